package com.PeopleCore.hr_backend.repository;

import com.PeopleCore.hr_backend.model.LeaveBalanceEntry;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.math.BigDecimal;
import java.util.List;

@Repository
public interface LeaveBalanceEntryRepository extends JpaRepository<LeaveBalanceEntry, Long> {

    @Query("SELECT SUM(e.deltaDays) FROM LeaveBalanceEntry e WHERE e.employee.id = :employeeId AND " +
            "e.leaveType.id = :leaveTypeId AND e.year = :year")
    BigDecimal sumDeltaDays(@Param("employeeId") Long employeeId,
                            @Param("leaveTypeId") Long leaveTypeId,
                            @Param("year") int year);

    @Query("SELECT e FROM LeaveBalanceEntry e WHERE e.employee.id = :employeeId AND " +
            "e.leaveType.id = :leaveTypeId AND e.year = :year ORDER BY e.id ASC")
    List<LeaveBalanceEntry> findLedger(@Param("employeeId") Long employeeId,
                                       @Param("leaveTypeId") Long leaveTypeId,
                                       @Param("year") int year);
}
