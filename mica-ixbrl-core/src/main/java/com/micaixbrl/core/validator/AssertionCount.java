package com.micaixbrl.core.validator;

/**
 * Pass/fail count of one validation category.
 *
 * @param total assertions evaluated
 * @param passed assertions without an ERROR finding
 * @param failed assertions with an ERROR finding
 */
public record AssertionCount(int total, int passed, int failed) {

    /**
     * Count for a category with a fixed number of assertions.
     *
     * @param total assertions evaluated
     * @param failed ERROR findings
     * @return count, passed never below zero
     */
    public static AssertionCount of(int total, int failed) {
        return new AssertionCount(total, Math.max(0, total - failed), failed);
    }
}
