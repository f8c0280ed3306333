package com.micaixbrl.core.validator;

import java.util.Map;

/**
 * Assertion totals applicable to a token type.
 *
 * @param existence existence assertion totals
 * @param value value assertion totals
 * @param total all assertions, identifier and duplicate checks included
 */
public record ValidationRequirements(AssertionSummary existence, AssertionSummary value, int total) {

    /**
     * Totals of one assertion catalog.
     *
     * @param total applicable assertions
     * @param required ERROR assertions
     * @param recommended WARNING assertions
     * @param byPart applicable assertions per record part, empty for value assertions
     */
    public record AssertionSummary(int total, int required, int recommended, Map<String, Integer> byPart) {

        /**
         * Compact constructor normalizing collections.
         */
        public AssertionSummary {
            byPart = byPart == null ? Map.of() : Map.copyOf(byPart);
        }
    }
}
