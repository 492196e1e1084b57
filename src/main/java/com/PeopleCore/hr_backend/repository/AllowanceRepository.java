package com.PeopleCore.hr_backend.repository;

import com.PeopleCore.hr_backend.enums.ComponentStatus;
import com.PeopleCore.hr_backend.model.Allowance;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.LocalDate;
import java.util.List;

@Repository
public interface AllowanceRepository extends JpaRepository<Allowance, Long> {
    List<Allowance> findByEmployeeIdOrderByIdDesc(Long employeeId);

    @Query("""
        SELECT a FROM Allowance a
        WHERE a.employee.id = :employeeId AND a.status = :status
        AND (a.effectiveFrom IS NULL OR a.effectiveFrom <= :periodEnd)
        AND (a.effectiveTo IS NULL OR a.effectiveTo >= :periodStart)
        ORDER BY a.id ASC
    """)
    List<Allowance> findOverlapping(@Param("employeeId") Long employeeId,
                                    @Param("status") ComponentStatus status,
                                    @Param("periodStart") LocalDate periodStart,
                                    @Param("periodEnd") LocalDate periodEnd);

    @Query("SELECT DISTINCT YEAR(a.effectiveFrom), MONTH(a.effectiveFrom) FROM Allowance a " +
            "WHERE a.effectiveFrom IS NOT NULL")
    List<Object[]> findActivityMonths();
}
