package com.micaixbrl.core.validator;

import com.micaixbrl.core.model.TokenType;

import java.util.Set;

/**
 * Options of a validation run.
 *
 * @param checkRegistry whether to look the offeror's LEI up in the registry
 * @param skipRules rule ids whose findings are dropped
 * @param tokenType token type overriding the record's, may be null
 */
public record ValidationOptions(boolean checkRegistry, Set<String> skipRules, TokenType tokenType) {

    /**
     * Compact constructor normalizing collections.
     */
    public ValidationOptions {
        skipRules = skipRules == null ? Set.of() : Set.copyOf(skipRules);
    }

    public static ValidationOptions defaults() {
        return new ValidationOptions(false, Set.of(), null);
    }

    boolean isSkipped(ValidationError error) {
        return skipRules.contains(error.ruleId());
    }
}
