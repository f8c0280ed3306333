package com.micaixbrl.core.model;

import java.util.List;

/**
 * Part I: risk narratives, each category a list of paragraphs.
 *
 * @param offerRisks offer-related risks
 * @param issuerRisks issuer-related risks
 * @param marketRisks crypto-asset and market risks
 * @param technologyRisks technology-related risks
 * @param regulatoryRisks regulatory and project implementation risks
 */
public record RiskInfo(
    List<String> offerRisks,
    List<String> issuerRisks,
    List<String> marketRisks,
    List<String> technologyRisks,
    List<String> regulatoryRisks
) {
    /**
     * Compact constructor normalizing collections.
     */
    public RiskInfo {
        offerRisks = offerRisks == null ? List.of() : List.copyOf(offerRisks);
        issuerRisks = issuerRisks == null ? List.of() : List.copyOf(issuerRisks);
        marketRisks = marketRisks == null ? List.of() : List.copyOf(marketRisks);
        technologyRisks = technologyRisks == null ? List.of() : List.copyOf(technologyRisks);
        regulatoryRisks = regulatoryRisks == null ? List.of() : List.copyOf(regulatoryRisks);
    }
}
