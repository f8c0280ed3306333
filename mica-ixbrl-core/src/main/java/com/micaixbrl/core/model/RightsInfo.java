package com.micaixbrl.core.model;

/**
 * Part G: rights and obligations attached to the crypto-asset.
 *
 * @param purchaseRights rights and obligations of purchasers
 * @param ownershipRights ownership rights (required for asset-referenced tokens)
 * @param transferRestrictions restrictions on transferability
 * @param lockUpPeriod lock-up arrangements
 * @param dynamicSupplyMechanism supply adjustment mechanism
 */
public record RightsInfo(
    String purchaseRights,
    String ownershipRights,
    String transferRestrictions,
    String lockUpPeriod,
    String dynamicSupplyMechanism
) {}
