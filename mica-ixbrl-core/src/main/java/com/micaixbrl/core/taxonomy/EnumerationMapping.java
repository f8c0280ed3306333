package com.micaixbrl.core.taxonomy;

import java.util.Objects;

/**
 * One member of a taxonomy enumeration.
 *
 * @param key value key used in records (e.g. {@code "MT"}, {@code "publicOffering"})
 * @param label human-readable label shown in the document
 * @param taxonomyUri member URI reported as the hidden fact value
 */
public record EnumerationMapping(
    String key,
    String label,
    String taxonomyUri
) {
    /**
     * Compact constructor with validation.
     */
    public EnumerationMapping {
        Objects.requireNonNull(key, "key must not be null");
        Objects.requireNonNull(label, "label must not be null");
        Objects.requireNonNull(taxonomyUri, "taxonomyUri must not be null");
    }
}
