package com.PeopleCore.hr_backend.repository;

import com.PeopleCore.hr_backend.model.PayrollCycle;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface PayrollCycleRepository extends JpaRepository<PayrollCycle, Long> {
    Optional<PayrollCycle> findFirstByPeriodYearAndPeriodMonthOrderByIdDesc(int periodYear, int periodMonth);

    List<PayrollCycle> findByPeriodYearAndPeriodMonthOrderByIdAsc(int periodYear, int periodMonth);
}
