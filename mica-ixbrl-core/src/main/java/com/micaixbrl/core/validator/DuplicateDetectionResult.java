package com.micaixbrl.core.validator;

import java.util.List;

/**
 * Outcome of a duplicate scan.
 *
 * @param hasDuplicates true when at least one group exists
 * @param duplicates duplicate groups in first-occurrence order
 * @param totalFacts number of facts scanned
 */
public record DuplicateDetectionResult(boolean hasDuplicates, List<DuplicateGroup> duplicates, int totalFacts) {

    /**
     * Compact constructor normalizing collections.
     */
    public DuplicateDetectionResult {
        duplicates = duplicates == null ? List.of() : List.copyOf(duplicates);
    }
}
