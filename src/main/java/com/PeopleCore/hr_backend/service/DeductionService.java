package com.PeopleCore.hr_backend.service;

import com.PeopleCore.hr_backend.config.PayrollProperties;
import com.PeopleCore.hr_backend.dto.response.DeductionSummary;
import com.PeopleCore.hr_backend.dto.response.PayLine;
import com.PeopleCore.hr_backend.enums.ComponentStatus;
import com.PeopleCore.hr_backend.enums.DeductionBasis;
import com.PeopleCore.hr_backend.enums.UnpaidLeaveStatus;
import com.PeopleCore.hr_backend.model.Deduction;
import com.PeopleCore.hr_backend.model.EtfEpfConfig;
import com.PeopleCore.hr_backend.repository.DeductionRepository;
import com.PeopleCore.hr_backend.repository.EtfEpfConfigRepository;
import com.PeopleCore.hr_backend.repository.UnpaidLeaveRepository;
import com.PeopleCore.hr_backend.util.ContributionCalculator;
import com.PeopleCore.hr_backend.util.PayPeriod;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Deductions aggregator: regular deductions, processed unpaid leave and the employee EPF share.
 */
@Service
@RequiredArgsConstructor
@Slf4j
@Transactional(propagation = Propagation.SUPPORTS, readOnly = true)
public class DeductionService {

    private final DeductionRepository deductionRepository;
    private final UnpaidLeaveRepository unpaidLeaveRepository;
    private final EtfEpfConfigRepository etfEpfConfigRepository;
    private final EarningsService earningsService;
    private final ContributionCalculator contributionCalculator;
    private final PayrollProperties payrollProperties;

    public DeductionSummary computeDeductions(Long employeeId, int year, int month) {
        return computeDeductions(employeeId, PayPeriod.of(year, month));
    }

    public DeductionSummary computeDeductions(Long employeeId, PayPeriod period) {
        BigDecimal basic = earningsService.currentBasicSalary(employeeId);

        List<PayLine> regular = new ArrayList<>();
        BigDecimal regularTotal = BigDecimal.ZERO;
        for (Deduction deduction : deductionRepository.findForPeriod(
                employeeId, ComponentStatus.ACTIVE, period.getStart(), period.getEnd())) {
            if (isStatutory(deduction)) {
                continue;
            }
            BigDecimal amount = amountOf(deduction, basic);
            regular.add(new PayLine(deduction.getName(), amount));
            regularTotal = regularTotal.add(amount);
        }

        BigDecimal unpaidLeaveTotal = EarningsService.nullToZero(unpaidLeaveRepository.sumProcessedDeductions(
                employeeId, UnpaidLeaveStatus.PROCESSED, period.startOfPeriod(), period.endExclusive()));

        EtfEpfConfig config = etfEpfConfigRepository.findByEmployeeId(employeeId).orElse(null);
        BigDecimal epfRate = contributionCalculator.epfRate(config);
        BigDecimal epfEmployeeAmount = contributionCalculator.percentOf(basic, epfRate);

        return DeductionSummary.builder()
                .employeeId(employeeId)
                .year(period.getYear())
                .month(period.getMonth())
                .regular(regular)
                .regularTotal(regularTotal)
                .unpaidLeaveTotal(unpaidLeaveTotal)
                .epfRate(epfRate)
                .epfEmployeeAmount(epfEmployeeAmount)
                .total(regularTotal.add(unpaidLeaveTotal).add(epfEmployeeAmount))
                .build();
    }

    // EPF is priced from the rate config, so EPF-named deductions are not double counted
    private boolean isStatutory(Deduction deduction) {
        String marker = payrollProperties.getEpfDeductionMarker();
        return deduction.getName() != null && marker != null
                && deduction.getName().toUpperCase(Locale.ROOT).contains(marker.toUpperCase(Locale.ROOT));
    }

    private BigDecimal amountOf(Deduction deduction, BigDecimal basic) {
        if (deduction.getBasis() == DeductionBasis.PERCENT) {
            return contributionCalculator.percentOf(basic, EarningsService.nullToZero(deduction.getPercent()));
        }
        return EarningsService.nullToZero(deduction.getAmount());
    }
}
