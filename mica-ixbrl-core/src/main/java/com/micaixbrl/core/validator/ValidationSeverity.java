package com.micaixbrl.core.validator;

/**
 * Severity of a validation finding.
 */
public enum ValidationSeverity {
    /**
     * Blocks acceptance of the record.
     */
    ERROR,

    /**
     * Reported but never blocks acceptance.
     */
    WARNING
}
