package com.micaixbrl.core.model;

/**
 * Member of an entity's management body.
 *
 * @param identity member name
 * @param businessAddress business address
 * @param function role within the management body
 */
public record ManagementBodyMember(
    String identity,
    String businessAddress,
    String function
) {}
