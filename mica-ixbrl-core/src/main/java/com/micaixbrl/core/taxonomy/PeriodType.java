package com.micaixbrl.core.taxonomy;

/**
 * Period type of a taxonomy element.
 */
public enum PeriodType {
    /**
     * Reported at a point in time (the document date).
     */
    INSTANT,

    /**
     * Reported over the calendar year of the document date.
     */
    DURATION
}
