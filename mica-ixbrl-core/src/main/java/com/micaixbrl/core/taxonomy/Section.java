package com.micaixbrl.core.taxonomy;

import java.util.Arrays;
import java.util.Optional;

/**
 * Sections of the MiCA white paper, declared in canonical rendering order.
 */
public enum Section {
    SUMMARY("summary", "Summary"),
    A("A", "Part A: Information about the Offeror"),
    B("B", "Part B: Information about the Issuer"),
    C("C", "Part C: Information about the Operator of the Trading Platform"),
    D("D", "Part D: Information about the Crypto-Asset Project"),
    E("E", "Part E: Information about the Offer to the Public or Admission to Trading"),
    F("F", "Part F: Information about the Crypto-Asset"),
    G("G", "Part G: Rights and Obligations"),
    H("H", "Part H: Information on the Underlying Technology"),
    I("I", "Part I: Risk Disclosure and Compliance Statements"),
    J("J", "Part J: Information on Sustainability"),
    S("S", "Annex III: Sustainability Indicators");

    private final String key;
    private final String title;

    Section(String key, String title) {
        this.key = key;
        this.title = title;
    }

    public String key() {
        return key;
    }

    public String title() {
        return title;
    }

    /**
     * CSS class of the section's field table.
     *
     * @return table class
     */
    public String tableClass() {
        return this == S ? "sustainability" : "accounts";
    }

    /**
     * Looks up a section by key, case-insensitively.
     *
     * @param key section key ({@code summary}, {@code A} ... {@code S})
     * @return matching section, or empty
     */
    public static Optional<Section> fromKey(String key) {
        if (key == null) {
            return Optional.empty();
        }
        return Arrays.stream(values())
            .filter(section -> section.key.equalsIgnoreCase(key.trim()))
            .findFirst();
    }
}
