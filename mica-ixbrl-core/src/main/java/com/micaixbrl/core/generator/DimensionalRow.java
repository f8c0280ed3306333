package com.micaixbrl.core.generator;

import java.util.Objects;

/**
 * One repeated sub-record (management body member or project person) and its facts.
 *
 * @param contextRef per-index dimensional context
 * @param identity identity fact
 * @param businessAddress business address fact
 * @param functionOrType function or person type fact
 */
public record DimensionalRow(
    String contextRef,
    FactValue identity,
    FactValue businessAddress,
    FactValue functionOrType
) {
    /**
     * Compact constructor with validation.
     */
    public DimensionalRow {
        Objects.requireNonNull(contextRef, "contextRef must not be null");
        Objects.requireNonNull(identity, "identity must not be null");
        Objects.requireNonNull(businessAddress, "businessAddress must not be null");
        Objects.requireNonNull(functionOrType, "functionOrType must not be null");
    }
}
