package com.micaixbrl.core.generator;

import java.util.Objects;

/**
 * Typed dimension member narrowing a context to one entity or sub-record.
 *
 * @param dimension qualified dimension name
 * @param value member value
 */
public record TypedMember(
    String dimension,
    String value
) {
    /**
     * Compact constructor with validation.
     */
    public TypedMember {
        Objects.requireNonNull(dimension, "dimension must not be null");
        Objects.requireNonNull(value, "value must not be null");
    }
}
