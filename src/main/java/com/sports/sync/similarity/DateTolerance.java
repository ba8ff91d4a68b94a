package com.sports.sync.similarity;

import java.time.LocalDate;
import java.time.temporal.ChronoUnit;

/**
 * Date comparisons that tolerate provider noise: small offsets caused by time zones
 * or scheduling, and day/month order confusion between locales.
 */
public final class DateTolerance {

    private DateTolerance() {
        // Utility class
    }

    /**
     * True if both dates are present and {@code |a - b| <= days}.
     */
    public static boolean within(LocalDate a, LocalDate b, int days) {
        if (a == null || b == null) {
            return false;
        }
        return Math.abs(ChronoUnit.DAYS.between(a, b)) <= days;
    }

    /**
     * True if swapping the day and month of {@code a} yields {@code b}.
     * Only defined when the day of {@code a} is at most 12.
     */
    public static boolean swappedEqual(LocalDate a, LocalDate b) {
        if (a == null || b == null || a.getDayOfMonth() > 12) {
            return false;
        }
        // the old month (1..12) is always a valid day of any month
        LocalDate swapped = LocalDate.of(a.getYear(), a.getDayOfMonth(), a.getMonthValue());
        return swapped.equals(b);
    }

    /**
     * Shifts a date by a number of days; null stays null.
     */
    public static LocalDate shift(LocalDate date, int days) {
        return date == null ? null : date.plusDays(days);
    }
}
