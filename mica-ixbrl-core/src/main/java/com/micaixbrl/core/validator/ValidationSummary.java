package com.micaixbrl.core.validator;

/**
 * Totals across all validation categories.
 *
 * @param totalAssertions assertions evaluated
 * @param passed assertions passed
 * @param errors ERROR findings
 * @param warnings WARNING findings
 */
public record ValidationSummary(int totalAssertions, int passed, int errors, int warnings) {}
