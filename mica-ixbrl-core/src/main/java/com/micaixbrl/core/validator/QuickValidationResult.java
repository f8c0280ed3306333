package com.micaixbrl.core.validator;

import java.util.List;

/**
 * Outcome of a quick validation (identifier and required fields only).
 *
 * @param valid true when there are no errors
 * @param errorCount number of errors
 * @param errors ERROR findings
 */
public record QuickValidationResult(boolean valid, int errorCount, List<ValidationError> errors) {

    /**
     * Compact constructor normalizing collections.
     */
    public QuickValidationResult {
        errors = errors == null ? List.of() : List.copyOf(errors);
    }
}
