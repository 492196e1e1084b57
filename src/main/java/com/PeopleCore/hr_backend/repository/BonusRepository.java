package com.PeopleCore.hr_backend.repository;

import com.PeopleCore.hr_backend.model.Bonus;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.stereotype.Repository;

import java.time.LocalDate;
import java.util.List;

@Repository
public interface BonusRepository extends JpaRepository<Bonus, Long> {
    List<Bonus> findByEmployeeIdOrderByEffectiveDateDesc(Long employeeId);

    List<Bonus> findByEmployeeIdAndEffectiveDateBetweenOrderByEffectiveDateAsc(Long employeeId,
                                                                              LocalDate periodStart,
                                                                              LocalDate periodEnd);

    @Query("SELECT DISTINCT YEAR(b.effectiveDate), MONTH(b.effectiveDate) FROM Bonus b")
    List<Object[]> findActivityMonths();
}
