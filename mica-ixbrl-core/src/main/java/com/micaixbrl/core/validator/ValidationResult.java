package com.micaixbrl.core.validator;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Outcome of a full validation run.
 *
 * <p>The record is valid iff no ERROR finding exists in any category.</p>
 *
 * @param valid true when there are no ERROR findings
 * @param errors all ERROR findings, in category order
 * @param warnings all WARNING findings, in category order
 * @param summary totals
 * @param byCategory findings per category
 * @param assertionCounts pass/fail counts per category
 */
public record ValidationResult(
    boolean valid,
    List<ValidationError> errors,
    List<ValidationError> warnings,
    ValidationSummary summary,
    Map<ValidationCategory, CategoryFindings> byCategory,
    Map<ValidationCategory, AssertionCount> assertionCounts
) {
    /**
     * Compact constructor normalizing collections.
     */
    public ValidationResult {
        errors = errors == null ? List.of() : List.copyOf(errors);
        warnings = warnings == null ? List.of() : List.copyOf(warnings);
        byCategory = byCategory == null ? Map.of() : Collections.unmodifiableMap(new EnumMap<>(byCategory));
        assertionCounts = assertionCounts == null
            ? Map.of()
            : Collections.unmodifiableMap(new EnumMap<>(assertionCounts));
    }

    public CategoryFindings findings(ValidationCategory category) {
        return byCategory.getOrDefault(category, new CategoryFindings(List.of(), List.of()));
    }

    /**
     * Whether any finding carries the rule id.
     *
     * @param ruleId rule id
     * @return true if reported as error or warning
     */
    public boolean hasFinding(String ruleId) {
        return errors.stream().anyMatch(error -> error.ruleId().equals(ruleId))
            || warnings.stream().anyMatch(warning -> warning.ruleId().equals(ruleId));
    }
}
