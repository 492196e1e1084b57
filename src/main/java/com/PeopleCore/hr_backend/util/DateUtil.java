package com.PeopleCore.hr_backend.util;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;

/**
 * Date helpers shared by the leave and audit queries.
 */
public class DateUtil {

    private DateUtil() {
        // Utility class, no instantiation
    }

    public static final DateTimeFormatter DATE_FORMATTER = DateTimeFormatter.ofPattern("yyyy-MM-dd");

    public static String formatDate(LocalDate date) {
        return date != null ? date.format(DATE_FORMATTER) : null;
    }

    public static LocalDate getStartOfYear(int year) {
        return LocalDate.of(year, 1, 1);
    }

    public static LocalDate getEndOfYear(int year) {
        return LocalDate.of(year, 12, 31);
    }

    public static LocalDateTime getStartOfDay(LocalDate date) {
        return date != null ? date.atStartOfDay() : null;
    }

    // exclusive upper bound for "up to and including date"
    public static LocalDateTime getStartOfNextDay(LocalDate date) {
        return date != null ? date.plusDays(1).atStartOfDay() : null;
    }
}
