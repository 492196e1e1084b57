package com.PeopleCore.hr_backend.util;

import com.PeopleCore.hr_backend.config.LeavePolicyProperties;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalTime;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("LeaveDurationCalculator")
class LeaveDurationCalculatorTest {

    private final LeaveDurationCalculator calculator = new LeaveDurationCalculator(new LeavePolicyProperties());

    private static final LocalDate DAY = LocalDate.of(2026, 3, 10);

    @Test
    @DisplayName("Half day from explicit times is 4.00 hours")
    void halfDayFromTimes() {
        BigDecimal hours = calculator.computeDurationHours(DAY, DAY,
                LocalTime.of(9, 0), LocalTime.of(13, 0), null);

        assertThat(hours).isEqualByComparingTo("4.00");
        assertThat(hours.scale()).isEqualTo(2);
    }

    @Test
    @DisplayName("Explicit duration wins over the computed span")
    void explicitDurationOverrides() {
        BigDecimal hours = calculator.computeDurationHours(DAY, DAY.plusDays(3),
                LocalTime.of(9, 0), LocalTime.of(18, 0), new BigDecimal("4.0"));

        assertThat(hours).isEqualByComparingTo("4.0");
    }

    @Test
    @DisplayName("Missing times fall back to office hours")
    void defaultOfficeHours() {
        assertThat(calculator.computeDurationHours(DAY, DAY, null, null, null))
                .isEqualByComparingTo("9.00");
    }

    @Test
    @DisplayName("Inverted span is floored at zero")
    void invertedSpanIsZero() {
        BigDecimal hours = calculator.computeDurationHours(DAY, DAY,
                LocalTime.of(15, 0), LocalTime.of(10, 0), null);

        assertThat(hours).isEqualByComparingTo(BigDecimal.ZERO);
    }

    @Test
    @DisplayName("Partial hours keep two decimals")
    void partialHours() {
        assertThat(calculator.computeDurationHours(DAY, DAY, LocalTime.of(9, 0), LocalTime.of(9, 20), null))
                .isEqualByComparingTo("0.33");
    }

    @Test
    @DisplayName("Full days are counted inclusively")
    void fullDaysInclusive() {
        assertThat(calculator.calculateFullDays(DAY, DAY)).isEqualTo(1);
        assertThat(calculator.calculateFullDays(DAY, DAY.plusDays(4))).isEqualTo(5);
        assertThat(calculator.calculateFullDays(DAY.plusDays(1), DAY)).isZero();
        assertThat(calculator.calculateFullDays(null, DAY)).isZero();
    }

    @Test
    @DisplayName("Hours convert to days at nine hours per day")
    void hoursToDays() {
        assertThat(calculator.hoursToDays(new BigDecimal("18"))).isEqualByComparingTo("2.00");
        assertThat(calculator.hoursToDays(new BigDecimal("117"))).isEqualByComparingTo("13.00");
        assertThat(calculator.hoursToDays(new BigDecimal("4"))).isEqualByComparingTo("0.44");
        assertThat(calculator.hoursToDays(null)).isEqualByComparingTo(BigDecimal.ZERO);
    }
}
