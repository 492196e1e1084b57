package com.PeopleCore.hr_backend.util;

import com.PeopleCore.hr_backend.config.LeavePolicyProperties;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Duration;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.temporal.ChronoUnit;

/**
 * Converts leave request spans into hours and days. Calendar time only: weekends and
 * holidays are not excluded.
 */
@Component
@RequiredArgsConstructor
public class LeaveDurationCalculator {

    private static final BigDecimal MINUTES_PER_HOUR = BigDecimal.valueOf(60);

    private final LeavePolicyProperties leavePolicy;

    /**
     * Duration in hours, rounded to 2 decimals. An explicit value is returned unchanged;
     * otherwise the span between the start and end date-times, floored at zero. Missing
     * times fall back to the configured office hours.
     */
    public BigDecimal computeDurationHours(LocalDate startDate, LocalDate endDate,
                                           LocalTime startTime, LocalTime endTime,
                                           BigDecimal explicitHours) {
        if (explicitHours != null) {
            return explicitHours;
        }
        if (startDate == null || endDate == null) {
            return BigDecimal.ZERO.setScale(2);
        }

        LocalDateTime start = startDate.atTime(startTime != null ? startTime : leavePolicy.startTime());
        LocalDateTime end = endDate.atTime(endTime != null ? endTime : leavePolicy.endTime());

        long minutes = Math.max(0, Duration.between(start, end).toMinutes());
        return BigDecimal.valueOf(minutes).divide(MINUTES_PER_HOUR, 2, RoundingMode.HALF_UP);
    }

    /**
     * Inclusive calendar-day count, 0 when either date is missing or the range is inverted.
     */
    public int calculateFullDays(LocalDate startDate, LocalDate endDate) {
        if (startDate == null || endDate == null || startDate.isAfter(endDate)) {
            return 0;
        }
        return (int) ChronoUnit.DAYS.between(startDate, endDate) + 1;
    }

    public BigDecimal hoursToDays(BigDecimal hours) {
        if (hours == null) {
            return BigDecimal.ZERO;
        }
        return hours.divide(leavePolicy.getWorkHoursPerDay(), 2, RoundingMode.HALF_UP);
    }
}
