package com.PeopleCore.hr_backend.repository;

import com.PeopleCore.hr_backend.enums.UnpaidLeaveStatus;
import com.PeopleCore.hr_backend.model.UnpaidLeave;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.List;

@Repository
public interface UnpaidLeaveRepository extends JpaRepository<UnpaidLeave, Long> {

    @Query("SELECT u FROM UnpaidLeave u WHERE (:employeeId IS NULL OR u.employee.id = :employeeId) AND " +
            "(:status IS NULL OR u.status = :status) ORDER BY u.id DESC")
    List<UnpaidLeave> search(@Param("employeeId") Long employeeId,
                             @Param("status") UnpaidLeaveStatus status);

    List<UnpaidLeave> findByEmployeeIdOrderByIdAsc(Long employeeId);

    long countByStatus(UnpaidLeaveStatus status);

    @Query("SELECT SUM(u.deductionAmount) FROM UnpaidLeave u WHERE u.employee.id = :employeeId AND " +
            "u.status = :status AND u.processedAt >= :from AND u.processedAt < :to")
    BigDecimal sumProcessedDeductions(@Param("employeeId") Long employeeId,
                                      @Param("status") UnpaidLeaveStatus status,
                                      @Param("from") LocalDateTime from,
                                      @Param("to") LocalDateTime to);
}
