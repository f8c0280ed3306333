package com.micaixbrl.core.model;

import java.math.BigDecimal;

/**
 * Part D: the crypto-asset project.
 *
 * @param cryptoAssetName name of the crypto-asset
 * @param cryptoAssetSymbol ticker symbol
 * @param totalSupply total number of units offered or traded
 * @param tokenStandard token standard (e.g. ERC-20)
 * @param blockchainNetwork network the token is issued on
 * @param consensusMechanism consensus mechanism of that network
 * @param projectDescription narrative description of the project
 */
public record ProjectInfo(
    String cryptoAssetName,
    String cryptoAssetSymbol,
    BigDecimal totalSupply,
    String tokenStandard,
    String blockchainNetwork,
    String consensusMechanism,
    String projectDescription
) {}
