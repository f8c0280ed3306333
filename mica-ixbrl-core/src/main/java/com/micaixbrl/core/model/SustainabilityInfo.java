package com.micaixbrl.core.model;

import java.math.BigDecimal;

/**
 * Part J: sustainability indicators of the consensus mechanism.
 *
 * @param energyConsumption annual energy consumption
 * @param energyUnit unit of {@code energyConsumption}, always kWh when present
 * @param consensusMechanismType consensus mechanism the indicators relate to
 * @param renewableEnergyPercentage share of renewable energy, 0 to 100
 * @param ghgEmissions greenhouse gas emissions in tonnes CO2 equivalent
 */
public record SustainabilityInfo(
    BigDecimal energyConsumption,
    String energyUnit,
    String consensusMechanismType,
    BigDecimal renewableEnergyPercentage,
    BigDecimal ghgEmissions
) {}
