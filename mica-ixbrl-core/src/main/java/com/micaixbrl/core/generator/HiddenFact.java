package com.micaixbrl.core.generator;

import java.util.Objects;

/**
 * Enumeration fact reported in the hidden block and linked from its visible label.
 *
 * @param id fact id referenced by the visible label
 * @param name qualified element name
 * @param contextRef context id
 * @param taxonomyUri enumeration member URI, the reported value
 * @param humanReadable label shown in the visible document
 */
public record HiddenFact(
    String id,
    String name,
    String contextRef,
    String taxonomyUri,
    String humanReadable
) {
    /**
     * Compact constructor with validation.
     */
    public HiddenFact {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(contextRef, "contextRef must not be null");
        Objects.requireNonNull(taxonomyUri, "taxonomyUri must not be null");
        if (humanReadable == null) {
            humanReadable = "";
        }
    }
}
