package com.micaixbrl.core.generator;

import com.micaixbrl.core.taxonomy.EnumerationMapping;
import com.micaixbrl.core.taxonomy.FieldCatalog;
import com.micaixbrl.core.taxonomy.FieldDefinition;
import com.micaixbrl.core.taxonomy.PeriodType;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Fact map under construction. Blank values are never stored.
 */
final class FactMapWriter {

    private final Map<String, FactValue> facts = new LinkedHashMap<>();

    /**
     * Context an element is reported against when it is not dimensional.
     *
     * @param element qualified element name
     * @return {@code ctx_instant} for instant elements, {@code ctx_duration} otherwise
     */
    static String contextFor(String element) {
        return FieldCatalog.byElement(element)
            .map(FieldDefinition::periodType)
            .filter(periodType -> periodType == PeriodType.INSTANT)
            .map(periodType -> ContextBuilder.INSTANT)
            .orElse(ContextBuilder.DURATION);
    }

    void put(String element, FactValue value) {
        if (value != null && !value.isEmpty()) {
            facts.put(element, value);
        }
    }

    void text(String element, String value) {
        if (value != null && !value.isBlank()) {
            put(element, FactValue.text(value, contextFor(element)));
        }
    }

    void numeric(String element, String value, String unitRef, int decimals) {
        if (value != null && !value.isBlank()) {
            put(element, FactValue.numeric(value, contextFor(element), unitRef, decimals));
        }
    }

    void enumeration(String element, EnumerationMapping mapping) {
        put(element, FactValue.enumeration(mapping, contextFor(element)));
    }

    boolean contains(String element) {
        return facts.containsKey(element);
    }

    int size() {
        return facts.size();
    }

    Map<String, FactValue> facts() {
        return Collections.unmodifiableMap(facts);
    }
}
