package com.micaixbrl.core.generator;

/**
 * Configuration for document generation.
 *
 * @param continuationThreshold length above which text blocks are split into continuations
 * @param defaultCurrency currency used for monetary facts when the record names none
 * @param defaultLanguage language used when the record names none
 */
public record GeneratorConfig(
    int continuationThreshold,
    String defaultCurrency,
    String defaultLanguage
) {
    public static final int DEFAULT_CONTINUATION_THRESHOLD = 5000;

    /**
     * Compact constructor with validation.
     */
    public GeneratorConfig {
        if (continuationThreshold <= 0) {
            continuationThreshold = DEFAULT_CONTINUATION_THRESHOLD;
        }
        if (defaultCurrency == null || defaultCurrency.isBlank()) {
            defaultCurrency = Units.DEFAULT_CURRENCY;
        }
        if (defaultLanguage == null || defaultLanguage.isBlank()) {
            defaultLanguage = "en";
        }
    }

    /**
     * Creates a default configuration.
     *
     * @return default generator config
     */
    public static GeneratorConfig defaults() {
        return new GeneratorConfig(DEFAULT_CONTINUATION_THRESHOLD, Units.DEFAULT_CURRENCY, "en");
    }
}
