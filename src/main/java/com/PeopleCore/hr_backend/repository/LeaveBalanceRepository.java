package com.PeopleCore.hr_backend.repository;

import com.PeopleCore.hr_backend.model.LeaveBalance;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

@Repository
public interface LeaveBalanceRepository extends JpaRepository<LeaveBalance, Long> {

    /**
     * Reads the balance row under a write lock so concurrent approvals for the same
     * employee, type and year serialize on it.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT b FROM LeaveBalance b WHERE b.employee.id = :employeeId AND " +
            "b.leaveType.id = :leaveTypeId AND b.year = :year")
    Optional<LeaveBalance> findForUpdate(@Param("employeeId") Long employeeId,
                                         @Param("leaveTypeId") Long leaveTypeId,
                                         @Param("year") int year);

    @Query("SELECT b FROM LeaveBalance b WHERE b.employee.id = :employeeId AND " +
            "b.leaveType.id = :leaveTypeId AND b.year = :year")
    Optional<LeaveBalance> findBalance(@Param("employeeId") Long employeeId,
                                       @Param("leaveTypeId") Long leaveTypeId,
                                       @Param("year") int year);

    List<LeaveBalance> findByEmployeeIdAndYearOrderByLeaveTypeIdAsc(Long employeeId, int year);

    @Query("SELECT b FROM LeaveBalance b WHERE b.employee.id IN :employeeIds AND b.year = :year")
    List<LeaveBalance> findByEmployeesAndYear(@Param("employeeIds") Collection<Long> employeeIds,
                                              @Param("year") int year);
}
