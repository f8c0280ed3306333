package com.micaixbrl.core.taxonomy;

import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Read-only lookups over the MiCA white paper field definitions.
 *
 * <p>The table is built once at class initialization and shared by the generator
 * and the validators.</p>
 *
 * <p><b>Usage:</b></p>
 * <pre>{@code
 * FieldDefinition fee = FieldCatalog.byNumber("E.10").orElseThrow();
 * List<FieldDefinition> partA = FieldCatalog.fieldsForSection(Section.A);
 * }</pre>
 */
public final class FieldCatalog {

    private FieldCatalog() {
        // Utility class
    }

    private static final Map<String, FieldDefinition> BY_NUMBER = MicaFieldTable.FIELDS.stream()
        .collect(Collectors.toMap(FieldDefinition::number, f -> f, (a, b) -> a, LinkedHashMap::new));

    private static final Map<String, FieldDefinition> BY_ELEMENT = MicaFieldTable.FIELDS.stream()
        .collect(Collectors.toMap(FieldDefinition::element, f -> f, (a, b) -> a, LinkedHashMap::new));

    private static final Map<Section, List<FieldDefinition>> BY_SECTION = groupBySection();

    private static Map<Section, List<FieldDefinition>> groupBySection() {
        Map<Section, List<FieldDefinition>> grouped = new EnumMap<>(Section.class);
        for (Section section : Section.values()) {
            grouped.put(section, MicaFieldTable.FIELDS.stream()
                .filter(field -> field.section() == section)
                .toList());
        }
        return Collections.unmodifiableMap(grouped);
    }

    /**
     * Returns all field definitions in template order.
     *
     * @return all fields
     */
    public static List<FieldDefinition> all() {
        return MicaFieldTable.FIELDS;
    }

    public static Optional<FieldDefinition> byNumber(String number) {
        return Optional.ofNullable(BY_NUMBER.get(number));
    }

    public static Optional<FieldDefinition> byElement(String element) {
        return Optional.ofNullable(BY_ELEMENT.get(element));
    }

    /**
     * Returns the fields of one section in template order, dimensional fields included.
     *
     * @param section section
     * @return fields of the section, possibly empty
     */
    public static List<FieldDefinition> fieldsForSection(Section section) {
        return BY_SECTION.getOrDefault(section, List.of());
    }

    /**
     * Whether a field number is owned by a field definition of its own.
     *
     * @param number field number
     * @return true if a definition exists for exactly this number
     */
    public static boolean isDefined(String number) {
        return BY_NUMBER.containsKey(number);
    }
}
