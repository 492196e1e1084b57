package com.PeopleCore.hr_backend.util;

import com.PeopleCore.hr_backend.config.PayrollProperties;
import com.PeopleCore.hr_backend.dto.response.ContributionBreakdown;
import com.PeopleCore.hr_backend.model.EtfEpfConfig;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Statutory EPF/ETF arithmetic. Rates are percentages; a missing config or an unset rate
 * falls back to the configured defaults.
 */
@Component
@RequiredArgsConstructor
public class ContributionCalculator {

    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

    private final PayrollProperties payrollProperties;

    public BigDecimal epfRate(EtfEpfConfig config) {
        return config != null && config.getEpfContributionRate() != null
                ? config.getEpfContributionRate()
                : payrollProperties.getDefaultEpfRate();
    }

    public BigDecimal employerEpfRate(EtfEpfConfig config) {
        return config != null && config.getEmployerEpfRate() != null
                ? config.getEmployerEpfRate()
                : payrollProperties.getDefaultEmployerEpfRate();
    }

    public BigDecimal etfRate(EtfEpfConfig config) {
        return config != null && config.getEtfContributionRate() != null
                ? config.getEtfContributionRate()
                : payrollProperties.getDefaultEtfRate();
    }

    /**
     * Unrounded percentage of a base amount.
     */
    public BigDecimal percentOf(BigDecimal base, BigDecimal rate) {
        if (base == null || rate == null) {
            return BigDecimal.ZERO;
        }
        return base.multiply(rate).divide(HUNDRED, 10, RoundingMode.HALF_UP);
    }

    public BigDecimal employeeEpf(BigDecimal base, EtfEpfConfig config) {
        return percentOf(base, epfRate(config));
    }

    /**
     * Full breakdown on the given base, amounts rounded to 2 decimals.
     */
    public ContributionBreakdown calculate(BigDecimal base, EtfEpfConfig config) {
        BigDecimal safeBase = base != null ? base : BigDecimal.ZERO;
        BigDecimal employeeEpf = round(percentOf(safeBase, epfRate(config)));
        BigDecimal employerEpf = round(percentOf(safeBase, employerEpfRate(config)));
        BigDecimal employerEtf = round(percentOf(safeBase, etfRate(config)));

        return ContributionBreakdown.builder()
                .baseAmount(round(safeBase))
                .epfRate(epfRate(config))
                .employerEpfRate(employerEpfRate(config))
                .etfRate(etfRate(config))
                .employeeEpf(employeeEpf)
                .employerEpf(employerEpf)
                .employerEtf(employerEtf)
                .totalEpf(employeeEpf.add(employerEpf))
                .totalContribution(employeeEpf.add(employerEpf).add(employerEtf))
                .build();
    }

    public static BigDecimal round(BigDecimal value) {
        return (value != null ? value : BigDecimal.ZERO).setScale(2, RoundingMode.HALF_UP);
    }
}
