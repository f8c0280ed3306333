package com.micaixbrl.core.validator;

/**
 * Categories of validation run by {@link ValidationOrchestrator}, in execution order.
 */
public enum ValidationCategory {
    /**
     * Legal entity identifier format, checksum and optional registry status.
     */
    LEI,

    /**
     * Required and recommended fields.
     */
    EXISTENCE,

    /**
     * Format and cross-field rules.
     */
    VALUE,

    /**
     * Duplicate facts in the generated fact set.
     */
    DUPLICATE
}
