package com.micaixbrl.core.model;

import java.util.List;

/**
 * Part H: underlying technology.
 *
 * @param blockchainDescription distributed ledger technology description
 * @param smartContractInfo protocols and technical standards
 * @param securityAudits audit outcomes, one entry per audit
 * @param technicalCapacity technical capacity narrative
 */
public record TechnologyInfo(
    String blockchainDescription,
    String smartContractInfo,
    List<String> securityAudits,
    String technicalCapacity
) {
    /**
     * Compact constructor normalizing collections.
     */
    public TechnologyInfo {
        securityAudits = securityAudits == null ? List.of() : List.copyOf(securityAudits);
    }
}
