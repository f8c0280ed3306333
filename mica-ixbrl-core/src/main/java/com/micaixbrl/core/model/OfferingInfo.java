package com.micaixbrl.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.math.BigDecimal;
import java.util.List;

/**
 * Part E: terms of the offer to the public or admission to trading.
 *
 * @param isPublicOffering true for an offer to the public, false for admission to trading
 * @param publicOfferingStartDate subscription period start (ISO date)
 * @param publicOfferingEndDate subscription period end (ISO date)
 * @param tokenPrice issue price per token
 * @param tokenPriceCurrency ISO 4217 currency of the issue price
 * @param maxSubscriptionGoal maximum subscription goal in the issue currency
 * @param distributionDate planned distribution date
 * @param withdrawalRights whether retail holders have a right of withdrawal
 * @param paymentMethods accepted payment methods
 */
public record OfferingInfo(
    @JsonProperty("isPublicOffering") Boolean isPublicOffering,
    String publicOfferingStartDate,
    String publicOfferingEndDate,
    BigDecimal tokenPrice,
    String tokenPriceCurrency,
    BigDecimal maxSubscriptionGoal,
    String distributionDate,
    Boolean withdrawalRights,
    List<String> paymentMethods
) {
    /**
     * Compact constructor normalizing collections.
     */
    public OfferingInfo {
        paymentMethods = paymentMethods == null ? List.of() : List.copyOf(paymentMethods);
    }
}
