package com.PeopleCore.hr_backend.util;

import com.PeopleCore.hr_backend.exception.ValidationException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.time.LocalDateTime;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("PayPeriod")
class PayPeriodTest {

    @Test
    @DisplayName("Resolves the calendar range of a leap-year February")
    void resolvesLeapFebruary() {
        PayPeriod period = PayPeriod.of(2024, 2);

        assertThat(period.getStart()).isEqualTo(LocalDate.of(2024, 2, 1));
        assertThat(period.getEnd()).isEqualTo(LocalDate.of(2024, 2, 29));
        assertThat(period.getMonthName()).isEqualTo("February");
        assertThat(period.toString()).isEqualTo("2024-02");
    }

    @Test
    @DisplayName("Rejects months outside 1..12")
    void rejectsInvalidMonth() {
        assertThatThrownBy(() -> PayPeriod.of(2026, 13)).isInstanceOf(ValidationException.class);
        assertThatThrownBy(() -> PayPeriod.of(2026, 0)).isInstanceOf(ValidationException.class);
        assertThatThrownBy(() -> PayPeriod.require(null, 3)).isInstanceOf(ValidationException.class);
    }

    @Test
    @DisplayName("Previous of January is December of the prior year")
    void previousWrapsYear() {
        assertThat(PayPeriod.of(2026, 1).previous()).isEqualTo(PayPeriod.of(2025, 12));
        assertThat(PayPeriod.of(2026, 7).previous()).isEqualTo(PayPeriod.of(2026, 6));
    }

    @Test
    @DisplayName("Open-ended windows overlap the period")
    void overlapRules() {
        PayPeriod march = PayPeriod.of(2026, 3);

        assertThat(march.overlaps(null, null)).isTrue();
        assertThat(march.overlaps(LocalDate.of(2026, 3, 31), null)).isTrue();
        assertThat(march.overlaps(null, LocalDate.of(2026, 3, 1))).isTrue();
        assertThat(march.overlaps(LocalDate.of(2026, 4, 1), null)).isFalse();
        assertThat(march.overlaps(null, LocalDate.of(2026, 2, 28))).isFalse();
    }

    @Test
    @DisplayName("Timestamp bounds cover the whole last day")
    void timestampBounds() {
        PayPeriod march = PayPeriod.of(2026, 3);

        assertThat(march.startOfPeriod()).isEqualTo(LocalDateTime.of(2026, 3, 1, 0, 0));
        assertThat(march.endExclusive()).isEqualTo(LocalDateTime.of(2026, 4, 1, 0, 0));
        assertThat(PayPeriod.containing(LocalDate.of(2026, 3, 31))).isEqualTo(march);
    }
}
