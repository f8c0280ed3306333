package com.micaixbrl.core.validator;

import java.util.List;

/**
 * Findings of one validation category.
 *
 * @param errors ERROR findings
 * @param warnings WARNING findings
 */
public record CategoryFindings(List<ValidationError> errors, List<ValidationError> warnings) {

    /**
     * Compact constructor normalizing collections.
     */
    public CategoryFindings {
        errors = errors == null ? List.of() : List.copyOf(errors);
        warnings = warnings == null ? List.of() : List.copyOf(warnings);
    }

    /**
     * Splits findings by severity.
     *
     * @param findings findings of mixed severity
     * @return categorized findings
     */
    public static CategoryFindings of(List<ValidationError> findings) {
        return new CategoryFindings(
            findings.stream().filter(ValidationError::isError).toList(),
            findings.stream().filter(finding -> !finding.isError()).toList());
    }
}
