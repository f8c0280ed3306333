package com.micaixbrl.core.model;

/**
 * Role of a legal entity in the white paper.
 */
public enum EntityRole {
    /**
     * Offeror or person seeking admission to trading (part A), the primary entity.
     */
    OFFEROR("offeror", "Offeror", "partA"),

    /**
     * Issuer, when different from the offeror (part B).
     */
    ISSUER("issuer", "Issuer", "partB"),

    /**
     * Operator of the trading platform (part C).
     */
    OPERATOR("operator", "Operator", "partC");

    private final String key;
    private final String displayName;
    private final String part;

    EntityRole(String key, String displayName, String part) {
        this.key = key;
        this.displayName = displayName;
        this.part = part;
    }

    /**
     * Lowercase key used in context ids.
     *
     * @return key such as {@code issuer}
     */
    public String key() {
        return key;
    }

    public String displayName() {
        return displayName;
    }

    /**
     * Record part holding the entity.
     *
     * @return part name such as {@code partB}
     */
    public String part() {
        return part;
    }
}
