package com.micaixbrl.core.generator;

import java.util.Objects;
import java.util.Optional;

/**
 * Entity, period and optional dimension a fact is reported against.
 *
 * @param id context id, unique within a document
 * @param identifier entity identifier (the primary entity's LEI)
 * @param scheme identifier scheme URI
 * @param period reporting period
 * @param dimension typed dimension member, or null for undimensioned contexts
 */
public record XbrlContext(
    String id,
    String identifier,
    String scheme,
    XbrlPeriod period,
    TypedMember dimension
) {
    /**
     * Compact constructor with validation.
     */
    public XbrlContext {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(identifier, "identifier must not be null");
        Objects.requireNonNull(scheme, "scheme must not be null");
        Objects.requireNonNull(period, "period must not be null");
    }

    public Optional<TypedMember> typedMember() {
        return Optional.ofNullable(dimension);
    }
}
