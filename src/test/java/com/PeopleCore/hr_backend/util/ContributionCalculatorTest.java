package com.PeopleCore.hr_backend.util;

import com.PeopleCore.hr_backend.config.PayrollProperties;
import com.PeopleCore.hr_backend.dto.response.ContributionBreakdown;
import com.PeopleCore.hr_backend.model.EtfEpfConfig;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("ContributionCalculator")
class ContributionCalculatorTest {

    private final ContributionCalculator calculator = new ContributionCalculator(new PayrollProperties());

    @Test
    @DisplayName("Unset rates default to 8/12/3")
    void defaultRates() {
        ContributionBreakdown breakdown = calculator.calculate(new BigDecimal("52000"), null);

        assertThat(breakdown.getEmployeeEpf()).isEqualByComparingTo("4160.00");
        assertThat(breakdown.getEmployerEpf()).isEqualByComparingTo("6240.00");
        assertThat(breakdown.getEmployerEtf()).isEqualByComparingTo("1560.00");
        assertThat(breakdown.getTotalEpf()).isEqualByComparingTo("10400.00");
        assertThat(breakdown.getTotalContribution()).isEqualByComparingTo("11960.00");
    }

    @Test
    @DisplayName("Configured rates override the defaults one by one")
    void configuredRates() {
        EtfEpfConfig config = EtfEpfConfig.builder()
                .epfNumber("EPF-1")
                .epfContributionRate(new BigDecimal("10.00"))
                .build();

        ContributionBreakdown breakdown = calculator.calculate(new BigDecimal("40000"), config);

        assertThat(breakdown.getEpfRate()).isEqualByComparingTo("10.00");
        assertThat(breakdown.getEmployeeEpf()).isEqualByComparingTo("4000.00");
        assertThat(breakdown.getEmployerEpf()).isEqualByComparingTo("4800.00");
        assertThat(breakdown.getEmployerEtf()).isEqualByComparingTo("1200.00");
    }

    @Test
    @DisplayName("Amounts round half up to two decimals")
    void roundsHalfUp() {
        ContributionBreakdown breakdown = calculator.calculate(new BigDecimal("333.33"), null);

        assertThat(breakdown.getEmployeeEpf()).isEqualByComparingTo("26.67");
        assertThat(breakdown.getEmployerEtf()).isEqualByComparingTo("10.00");
    }

    @Test
    @DisplayName("Missing base is treated as zero")
    void nullBase() {
        assertThat(calculator.calculate(null, null).getTotalContribution()).isEqualByComparingTo(BigDecimal.ZERO);
        assertThat(calculator.percentOf(null, new BigDecimal("8"))).isEqualByComparingTo(BigDecimal.ZERO);
    }
}
