package com.PeopleCore.hr_backend.repository;

import com.PeopleCore.hr_backend.model.OvertimeAdjustment;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.List;

@Repository
public interface OvertimeAdjustmentRepository extends JpaRepository<OvertimeAdjustment, Long> {
    @Query("SELECT SUM(o.otHours * o.otRate) FROM OvertimeAdjustment o WHERE o.employee.id = :employeeId AND " +
            "o.createdAt >= :from AND o.createdAt < :to")
    BigDecimal sumAmountForPeriod(@Param("employeeId") Long employeeId,
                                  @Param("from") LocalDateTime from,
                                  @Param("to") LocalDateTime to);

    @Query("SELECT DISTINCT YEAR(o.createdAt), MONTH(o.createdAt) FROM OvertimeAdjustment o")
    List<Object[]> findActivityMonths();
}
