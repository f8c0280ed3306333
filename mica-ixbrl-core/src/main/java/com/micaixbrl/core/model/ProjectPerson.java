package com.micaixbrl.core.model;

/**
 * Person involved in implementing the crypto-asset project.
 *
 * @param identity person or company name
 * @param businessAddress business address
 * @param role type of involvement (advisor, developer, ...)
 */
public record ProjectPerson(
    String identity,
    String businessAddress,
    String role
) {}
