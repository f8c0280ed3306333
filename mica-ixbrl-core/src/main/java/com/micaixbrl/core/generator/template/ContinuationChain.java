package com.micaixbrl.core.generator.template;

import java.util.List;
import java.util.Objects;

/**
 * Markup of a fact split across a primary tag and its continuations.
 *
 * @param primary primary fact tag carrying the first fragment
 * @param continuations continuation elements in chain order, empty for unsplit facts
 */
public record ContinuationChain(String primary, List<String> continuations) {

    /**
     * Compact constructor with validation.
     */
    public ContinuationChain {
        Objects.requireNonNull(primary, "primary must not be null");
        continuations = continuations == null ? List.of() : List.copyOf(continuations);
    }
}
