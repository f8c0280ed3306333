package com.micaixbrl.core.validator;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.util.Objects;

/**
 * One validation finding.
 *
 * @param ruleId rule identifier (e.g. {@code LEI-002}, {@code EXS-A-001})
 * @param severity severity
 * @param message human-readable message
 * @param element target element name, may be null
 * @param fieldPath record path the finding refers to, may be null
 */
public record ValidationError(
    String ruleId,
    ValidationSeverity severity,
    String message,
    String element,
    String fieldPath
) {
    /**
     * Compact constructor with validation.
     */
    public ValidationError {
        Objects.requireNonNull(ruleId, "ruleId must not be null");
        Objects.requireNonNull(severity, "severity must not be null");
        Objects.requireNonNull(message, "message must not be null");
    }

    public static ValidationError error(String ruleId, String message, String element, String fieldPath) {
        return new ValidationError(ruleId, ValidationSeverity.ERROR, message, element, fieldPath);
    }

    public static ValidationError warning(String ruleId, String message, String element, String fieldPath) {
        return new ValidationError(ruleId, ValidationSeverity.WARNING, message, element, fieldPath);
    }

    @JsonIgnore
    public boolean isError() {
        return severity == ValidationSeverity.ERROR;
    }

    /**
     * Copy reported against another field path.
     *
     * @param newFieldPath field path
     * @return copy with the field path replaced
     */
    public ValidationError withFieldPath(String newFieldPath) {
        return new ValidationError(ruleId, severity, message, element, newFieldPath);
    }
}
