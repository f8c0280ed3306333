package com.micaixbrl.core.generator;

import java.util.Objects;

/**
 * One fact as it appears in a generated document, reduced to its identity and value.
 *
 * @param name qualified element name
 * @param contextRef context id
 * @param unitRef unit id, null for non-numeric facts
 * @param value reported value
 */
public record Fact(
    String name,
    String contextRef,
    String unitRef,
    String value
) {
    /**
     * Compact constructor with validation.
     */
    public Fact {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(contextRef, "contextRef must not be null");
    }

    /**
     * Identity key of the fact: element, context and unit.
     *
     * @return identity key
     */
    public Key key() {
        return new Key(name, contextRef, unitRef);
    }

    /**
     * Fact identity. Two facts with equal keys are duplicates.
     *
     * @param name element name
     * @param contextRef context id
     * @param unitRef unit id or null
     */
    public record Key(String name, String contextRef, String unitRef) {}
}
