package com.micaixbrl.core.generator;

import java.time.LocalDate;

/**
 * Period of a context: an instant, or a duration from start to end date inclusive.
 *
 * @param instant instant date, null for durations
 * @param startDate start date, null for instants
 * @param endDate end date, null for instants
 */
public record XbrlPeriod(
    LocalDate instant,
    LocalDate startDate,
    LocalDate endDate
) {
    /**
     * Compact constructor with validation.
     */
    public XbrlPeriod {
        boolean isInstant = instant != null && startDate == null && endDate == null;
        boolean isDuration = instant == null && startDate != null && endDate != null;
        if (!isInstant && !isDuration) {
            throw new IllegalArgumentException("Period must be either an instant or a start/end duration");
        }
        if (isDuration && endDate.isBefore(startDate)) {
            throw new IllegalArgumentException("Duration end " + endDate + " is before start " + startDate);
        }
    }

    public static XbrlPeriod instant(LocalDate date) {
        return new XbrlPeriod(date, null, null);
    }

    public static XbrlPeriod duration(LocalDate start, LocalDate end) {
        return new XbrlPeriod(null, start, end);
    }

    /**
     * Calendar year containing the given date.
     *
     * @param date any date in the year
     * @return 1 January to 31 December of that year
     */
    public static XbrlPeriod calendarYearOf(LocalDate date) {
        return duration(date.withDayOfYear(1), LocalDate.of(date.getYear(), 12, 31));
    }

    public boolean isInstant() {
        return instant != null;
    }
}
