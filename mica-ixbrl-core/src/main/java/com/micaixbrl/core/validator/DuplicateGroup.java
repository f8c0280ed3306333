package com.micaixbrl.core.validator;

import java.util.List;
import java.util.Objects;

/**
 * Facts sharing one identity key.
 *
 * @param name element name
 * @param contextRef context id
 * @param unitRef unit id, null for non-numeric facts
 * @param count number of facts in the group, at least 2
 * @param values reported values in emission order
 */
public record DuplicateGroup(String name, String contextRef, String unitRef, int count, List<String> values) {

    /**
     * Compact constructor with validation.
     */
    public DuplicateGroup {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(contextRef, "contextRef must not be null");
        if (count < 2) {
            throw new IllegalArgumentException("A duplicate group needs at least 2 facts, got " + count);
        }
        values = values == null ? List.of() : List.copyOf(values);
    }
}
