package com.micaixbrl.core.validator;

import com.micaixbrl.core.model.TokenType;
import com.micaixbrl.core.model.WhitepaperData;

import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;

/**
 * Format or cross-field rule over a record.
 *
 * @param id rule id
 * @param description what the rule checks
 * @param fieldPath record path findings are reported against
 * @param tokenTypes token types the rule applies to
 * @param severity severity of a violation
 * @param check returns the violation message, or empty when the rule holds
 */
public record ValueAssertion(
    String id,
    String description,
    String fieldPath,
    Set<TokenType> tokenTypes,
    ValidationSeverity severity,
    Function<WhitepaperData, Optional<String>> check
) {
    /**
     * Compact constructor with validation.
     */
    public ValueAssertion {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(fieldPath, "fieldPath must not be null");
        Objects.requireNonNull(severity, "severity must not be null");
        Objects.requireNonNull(check, "check must not be null");
        tokenTypes = tokenTypes == null ? Set.of() : Set.copyOf(tokenTypes);
    }

    public boolean appliesTo(TokenType tokenType) {
        return tokenTypes.contains(tokenType);
    }

    Optional<ValidationError> evaluate(WhitepaperData data) {
        return check.apply(data)
            .map(message -> new ValidationError(id, severity, message, null, fieldPath));
    }
}
