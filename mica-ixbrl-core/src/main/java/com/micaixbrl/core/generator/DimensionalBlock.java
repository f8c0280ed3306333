package com.micaixbrl.core.generator;

import com.micaixbrl.core.taxonomy.Section;

import java.util.List;
import java.util.Objects;

/**
 * Repeating table of sub-records rendered after a section's field table.
 *
 * @param section section the block belongs to
 * @param title block heading
 * @param identityElement element tagging the identity column
 * @param addressElement element tagging the business address column
 * @param functionElement element tagging the function or type column
 * @param rows one row per sub-record
 */
public record DimensionalBlock(
    Section section,
    String title,
    String identityElement,
    String addressElement,
    String functionElement,
    List<DimensionalRow> rows
) {
    /**
     * Compact constructor with validation.
     */
    public DimensionalBlock {
        Objects.requireNonNull(section, "section must not be null");
        Objects.requireNonNull(title, "title must not be null");
        Objects.requireNonNull(identityElement, "identityElement must not be null");
        Objects.requireNonNull(addressElement, "addressElement must not be null");
        Objects.requireNonNull(functionElement, "functionElement must not be null");
        rows = rows == null ? List.of() : List.copyOf(rows);
    }
}
