package com.micaixbrl.core.model;

/**
 * Crypto-asset category a white paper is filed under.
 *
 * <p>The category selects which existence and value assertions apply.</p>
 */
public enum TokenType {
    /**
     * Crypto-assets other than asset-referenced or e-money tokens (MiCA Title II).
     */
    OTHR,

    /**
     * Asset-referenced token (MiCA Title III).
     */
    ART,

    /**
     * E-money token (MiCA Title IV).
     */
    EMT
}
