package com.PeopleCore.hr_backend.util;

import com.PeopleCore.hr_backend.exception.ValidationException;
import lombok.EqualsAndHashCode;
import lombok.Getter;

import java.time.LocalDate;
import java.time.LocalDateTime;

/**
 * A (year, month) pay cycle resolved to its inclusive calendar range.
 * <p>
 * Time-bound components overlap a period when
 * {@code (from == null || from <= end) && (to == null || to >= start)}.
 * Timestamps fall in a period when {@code startOfPeriod() <= t < endExclusive()}.
 */
@Getter
@EqualsAndHashCode(of = {"year", "month"})
public final class PayPeriod {

    private final int year;
    private final int month;
    private final LocalDate start;
    private final LocalDate end;

    private PayPeriod(int year, int month) {
        this.year = year;
        this.month = month;
        this.start = LocalDate.of(year, month, 1);
        this.end = start.withDayOfMonth(start.lengthOfMonth());
    }

    public static PayPeriod of(int year, int month) {
        if (year <= 0 || month < 1 || month > 12) {
            throw ValidationException.invalidPeriod(year, month);
        }
        return new PayPeriod(year, month);
    }

    /**
     * Same as {@link #of(int, int)} for request parameters that may be missing.
     */
    public static PayPeriod require(Integer year, Integer month) {
        if (year == null || month == null) {
            throw new ValidationException("Year and month are required");
        }
        return of(year, month);
    }

    public static PayPeriod containing(LocalDate date) {
        return new PayPeriod(date.getYear(), date.getMonthValue());
    }

    public String getMonthName() {
        return Constants.MONTH_NAMES[month - 1];
    }

    public PayPeriod previous() {
        return month == 1 ? new PayPeriod(year - 1, 12) : new PayPeriod(year, month - 1);
    }

    public boolean contains(LocalDate date) {
        return date != null && !date.isBefore(start) && !date.isAfter(end);
    }

    public boolean overlaps(LocalDate from, LocalDate to) {
        return (from == null || !from.isAfter(end)) && (to == null || !to.isBefore(start));
    }

    public LocalDateTime startOfPeriod() {
        return start.atStartOfDay();
    }

    public LocalDateTime endExclusive() {
        return end.plusDays(1).atStartOfDay();
    }

    @Override
    public String toString() {
        return String.format("%d-%02d", year, month);
    }
}
