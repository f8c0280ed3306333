package com.micaixbrl.core.taxonomy;

/**
 * XBRL item types used by MiCA white paper fields.
 */
public enum XbrlDataType {
    STRING("stringItemType"),
    BOOLEAN("booleanItemType"),
    DATE("dateItemType"),
    MONETARY("monetaryItemType"),
    DECIMAL("decimalItemType"),
    INTEGER("integerItemType"),
    PERCENT("percentItemType"),
    TEXT_BLOCK("textBlockItemType"),
    ENUMERATION("enumerationItemType");

    private final String itemType;

    XbrlDataType(String itemType) {
        this.itemType = itemType;
    }

    /**
     * Returns the taxonomy item type name (e.g. {@code monetaryItemType}).
     *
     * @return item type name
     */
    public String itemType() {
        return itemType;
    }

    /**
     * Numeric types are tagged with {@code ix:nonFraction} when their value parses as a number.
     *
     * @return true for monetary, decimal, integer and percent
     */
    public boolean isNumeric() {
        return this == MONETARY || this == DECIMAL || this == INTEGER || this == PERCENT;
    }
}
