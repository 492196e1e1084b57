package com.PeopleCore.hr_backend.repository;

import com.PeopleCore.hr_backend.enums.ComponentStatus;
import com.PeopleCore.hr_backend.model.Deduction;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.LocalDate;
import java.util.List;

@Repository
public interface DeductionRepository extends JpaRepository<Deduction, Long> {
    List<Deduction> findByEmployeeIdOrderByEffectiveDateDesc(Long employeeId);

    @Query("SELECT d FROM Deduction d WHERE d.employee.id = :employeeId AND d.status = :status AND " +
            "d.effectiveDate >= :periodStart AND d.effectiveDate <= :periodEnd ORDER BY d.id ASC")
    List<Deduction> findForPeriod(@Param("employeeId") Long employeeId,
                                  @Param("status") ComponentStatus status,
                                  @Param("periodStart") LocalDate periodStart,
                                  @Param("periodEnd") LocalDate periodEnd);

    @Query("SELECT DISTINCT YEAR(d.effectiveDate), MONTH(d.effectiveDate) FROM Deduction d")
    List<Object[]> findActivityMonths();
}
