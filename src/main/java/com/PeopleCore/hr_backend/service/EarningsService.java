package com.PeopleCore.hr_backend.service;

import com.PeopleCore.hr_backend.dto.response.GrossEarnings;
import com.PeopleCore.hr_backend.dto.response.PayLine;
import com.PeopleCore.hr_backend.enums.ComponentStatus;
import com.PeopleCore.hr_backend.model.Allowance;
import com.PeopleCore.hr_backend.model.Bonus;
import com.PeopleCore.hr_backend.model.Salary;
import com.PeopleCore.hr_backend.repository.AllowanceRepository;
import com.PeopleCore.hr_backend.repository.BonusRepository;
import com.PeopleCore.hr_backend.repository.OvertimeAdjustmentRepository;
import com.PeopleCore.hr_backend.repository.SalaryRepository;
import com.PeopleCore.hr_backend.util.PayPeriod;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

/**
 * Gross earnings aggregator. Every caller that reports a gross figure (payslip, transfer,
 * EPF/ETF transaction) goes through {@link #computeGross(Long, PayPeriod)}.
 * <p>
 * Runs inside the caller's transaction when there is one and never opens its own.
 */
@Service
@RequiredArgsConstructor
@Slf4j
@Transactional(propagation = Propagation.SUPPORTS, readOnly = true)
public class EarningsService {

    private final SalaryRepository salaryRepository;
    private final AllowanceRepository allowanceRepository;
    private final OvertimeAdjustmentRepository overtimeAdjustmentRepository;
    private final BonusRepository bonusRepository;

    public GrossEarnings computeGross(Long employeeId, int year, int month) {
        return computeGross(employeeId, PayPeriod.of(year, month));
    }

    public GrossEarnings computeGross(Long employeeId, PayPeriod period) {
        List<PayLine> breakdown = new ArrayList<>();

        BigDecimal basic = currentBasicSalary(employeeId);
        breakdown.add(new PayLine("Basic Salary", basic));

        BigDecimal allowances = BigDecimal.ZERO;
        for (Allowance allowance : allowanceRepository.findOverlapping(
                employeeId, ComponentStatus.ACTIVE, period.getStart(), period.getEnd())) {
            allowances = allowances.add(allowance.getAmount());
            breakdown.add(new PayLine(allowance.getName(), allowance.getAmount()));
        }

        BigDecimal overtime = nullToZero(overtimeAdjustmentRepository.sumAmountForPeriod(
                employeeId, period.startOfPeriod(), period.endExclusive()));
        if (overtime.signum() != 0) {
            breakdown.add(new PayLine("Overtime", overtime));
        }

        BigDecimal bonuses = BigDecimal.ZERO;
        for (Bonus bonus : bonusRepository.findByEmployeeIdAndEffectiveDateBetweenOrderByEffectiveDateAsc(
                employeeId, period.getStart(), period.getEnd())) {
            bonuses = bonuses.add(bonus.getAmount());
            breakdown.add(new PayLine(bonus.getDescription() != null ? bonus.getDescription() : "Bonus",
                    bonus.getAmount()));
        }

        BigDecimal gross = basic.add(allowances).add(overtime).add(bonuses);
        log.debug("Gross for employee {} in {}: {}", employeeId, period, gross);

        return GrossEarnings.builder()
                .employeeId(employeeId)
                .year(period.getYear())
                .month(period.getMonth())
                .basic(basic)
                .allowances(allowances)
                .overtime(overtime)
                .bonuses(bonuses)
                .gross(gross)
                .breakdown(breakdown)
                .build();
    }

    /**
     * Basic salary from the most recently inserted salary row, zero when there is none.
     */
    public BigDecimal currentBasicSalary(Long employeeId) {
        return salaryRepository.findFirstByEmployeeIdOrderByIdDesc(employeeId)
                .map(Salary::getBasicSalary)
                .orElse(BigDecimal.ZERO);
    }

    static BigDecimal nullToZero(BigDecimal value) {
        return value != null ? value : BigDecimal.ZERO;
    }
}
