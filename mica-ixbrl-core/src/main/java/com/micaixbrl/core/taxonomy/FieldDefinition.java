package com.micaixbrl.core.taxonomy;

import java.util.Objects;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * One field of the MiCA white paper template and the taxonomy element it is tagged with.
 *
 * @param section section the field belongs to
 * @param number field number as printed in the template (e.g. {@code "E.10"})
 * @param label human-readable field label
 * @param element qualified taxonomy element name (e.g. {@code "mica:IssuePrice"})
 * @param dataType XBRL item type
 * @param periodType period type of the element
 * @param textBlock whether the element is a text block
 * @param hidden whether the fact goes to the hidden block (enumerations)
 * @param dimensional whether the field repeats per sub-record under a typed dimension
 */
public record FieldDefinition(
    Section section,
    String number,
    String label,
    String element,
    XbrlDataType dataType,
    PeriodType periodType,
    boolean textBlock,
    boolean hidden,
    boolean dimensional
) {
    private static final Pattern LETTERED_SUB_FIELD = Pattern.compile("^(.*\\d)[a-z]$");

    /**
     * Compact constructor with validation.
     */
    public FieldDefinition {
        Objects.requireNonNull(section, "section must not be null");
        Objects.requireNonNull(number, "number must not be null");
        Objects.requireNonNull(label, "label must not be null");
        Objects.requireNonNull(element, "element must not be null");
        Objects.requireNonNull(dataType, "dataType must not be null");
        Objects.requireNonNull(periodType, "periodType must not be null");
    }

    /**
     * Returns the parent field number of a lettered sub-field ({@code "E.31a"} → {@code "E.31"}).
     *
     * @return parent number, or empty when this is not a lettered sub-field
     */
    public Optional<String> parentNumber() {
        Matcher matcher = LETTERED_SUB_FIELD.matcher(number);
        return matcher.matches() ? Optional.of(matcher.group(1)) : Optional.empty();
    }

    /**
     * Element name without the {@code mica:} prefix.
     *
     * @return local element name
     */
    public String localName() {
        int colon = element.indexOf(':');
        return colon >= 0 ? element.substring(colon + 1) : element;
    }
}
