package com.micaixbrl.core.generator;

import com.micaixbrl.core.taxonomy.EnumerationMapping;

import java.util.Objects;

/**
 * Value of one taxonomy element in the fact map, with everything needed to tag it.
 *
 * @param value display value
 * @param contextRef id of the context the fact is reported against
 * @param unitRef unit id for numeric facts, null otherwise
 * @param decimals decimal precision for numeric facts, null otherwise
 * @param taxonomyUri member URI for resolved enumerations, null otherwise
 * @param humanReadable label shown instead of the URI for resolved enumerations
 */
public record FactValue(
    String value,
    String contextRef,
    String unitRef,
    Integer decimals,
    String taxonomyUri,
    String humanReadable
) {
    /**
     * Compact constructor with validation.
     */
    public FactValue {
        Objects.requireNonNull(value, "value must not be null");
        Objects.requireNonNull(contextRef, "contextRef must not be null");
    }

    public static FactValue text(String value, String contextRef) {
        return new FactValue(value, contextRef, null, null, null, null);
    }

    public static FactValue numeric(String value, String contextRef, String unitRef, int decimals) {
        return new FactValue(value, contextRef, unitRef, decimals, null, null);
    }

    /**
     * Fact for a resolved enumeration member; the value is the member key.
     *
     * @param mapping resolved member
     * @param contextRef context id
     * @return enumeration fact value
     */
    public static FactValue enumeration(EnumerationMapping mapping, String contextRef) {
        return new FactValue(mapping.key(), contextRef, null, null, mapping.taxonomyUri(), mapping.label());
    }

    public boolean isEmpty() {
        return value.isBlank();
    }

    public boolean isEnumerationMember() {
        return taxonomyUri != null;
    }

    /**
     * Text shown in the visible document.
     *
     * @return human-readable override when present, the value otherwise
     */
    public String displayValue() {
        return humanReadable != null ? humanReadable : value;
    }

    /**
     * Value reported in the XBRL instance: the member URI for enumerations, the value otherwise.
     *
     * @return reported value
     */
    public String reportedValue() {
        return taxonomyUri != null ? taxonomyUri : value;
    }
}
