package com.micaixbrl.core.generator;

import java.util.Objects;

/**
 * Unit of measure of numeric facts.
 *
 * @param id unit id referenced by facts (e.g. {@code unit_EUR})
 * @param measure qualified measure (e.g. {@code iso4217:EUR})
 */
public record XbrlUnit(
    String id,
    String measure
) {
    /**
     * Compact constructor with validation.
     */
    public XbrlUnit {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(measure, "measure must not be null");
    }
}
