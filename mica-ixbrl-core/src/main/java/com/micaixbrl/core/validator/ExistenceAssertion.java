package com.micaixbrl.core.validator;

import com.micaixbrl.core.model.TokenType;

import java.util.Objects;
import java.util.Set;

/**
 * Requirement that a field carries a value.
 *
 * <p>The requirement is met when the typed record path is present, or when the raw field
 * with {@code fieldNumber} carries content. Conditional assertions apply only when the
 * value at {@code conditionPath} equals {@code conditionValue}.</p>
 *
 * @param id rule id
 * @param message finding message
 * @param fieldPath typed record path
 * @param fieldNumber taxonomy field number satisfying the rule from raw fields, may be null
 * @param tokenTypes token types the rule applies to
 * @param severity ERROR for required, WARNING for recommended
 * @param conditionPath path of the precondition, may be null
 * @param conditionValue expected precondition value, may be null
 */
public record ExistenceAssertion(
    String id,
    String message,
    String fieldPath,
    String fieldNumber,
    Set<TokenType> tokenTypes,
    ValidationSeverity severity,
    String conditionPath,
    Boolean conditionValue
) {
    /**
     * Compact constructor with validation.
     */
    public ExistenceAssertion {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(message, "message must not be null");
        Objects.requireNonNull(fieldPath, "fieldPath must not be null");
        Objects.requireNonNull(severity, "severity must not be null");
        tokenTypes = tokenTypes == null ? Set.of() : Set.copyOf(tokenTypes);
    }

    public boolean appliesTo(TokenType tokenType) {
        return tokenTypes.contains(tokenType);
    }

    /**
     * Record part the rule belongs to ({@code partA} for {@code partA.legalName}).
     *
     * @return first path segment
     */
    public String part() {
        int dot = fieldPath.indexOf('.');
        return dot >= 0 ? fieldPath.substring(0, dot) : fieldPath;
    }
}
