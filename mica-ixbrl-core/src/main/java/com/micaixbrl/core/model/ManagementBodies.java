package com.micaixbrl.core.model;

import java.util.List;

/**
 * Management body members grouped by the entity they belong to.
 *
 * @param offeror offeror's management body
 * @param issuer issuer's management body
 * @param operator trading platform operator's management body
 */
public record ManagementBodies(
    List<ManagementBodyMember> offeror,
    List<ManagementBodyMember> issuer,
    List<ManagementBodyMember> operator
) {
    /**
     * Compact constructor normalizing collections.
     */
    public ManagementBodies {
        offeror = offeror == null ? List.of() : List.copyOf(offeror);
        issuer = issuer == null ? List.of() : List.copyOf(issuer);
        operator = operator == null ? List.of() : List.copyOf(operator);
    }

    /**
     * Returns an instance without members.
     *
     * @return empty management bodies
     */
    public static ManagementBodies none() {
        return new ManagementBodies(List.of(), List.of(), List.of());
    }
}
