package com.micaixbrl.core.model;

/**
 * Part F: characteristics of the crypto-asset.
 *
 * @param classification classification of the token
 * @param rightsDescription description of attached rights
 * @param technicalSpecifications technical specifications
 */
public record CharacteristicsInfo(
    String classification,
    String rightsDescription,
    String technicalSpecifications
) {}
