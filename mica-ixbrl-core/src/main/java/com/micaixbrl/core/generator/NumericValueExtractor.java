package com.micaixbrl.core.generator;

import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Isolates the numeric token of a free-text value for numeric-typed fields.
 *
 * <p>A number next to a currency or unit symbol wins. Otherwise dates, times and currency
 * punctuation are removed and the first remaining number is taken, skipping four-digit
 * tokens between 1900 and 2100, which are almost always years. When nothing qualifies the
 * result is the empty string, never a guessed number.</p>
 */
public final class NumericValueExtractor {

    private NumericValueExtractor() {
        // Utility class
    }

    private static final String NUMBER = "\\d{1,3}(?:,\\d{3})+(?:\\.\\d+)?|\\d+(?:\\.\\d+)?";

    private static final Pattern SYMBOL_BEFORE = Pattern.compile(
        "(?:[€$£]|\\b(?:EUR|USD|GBP|CHF))\\s*(" + NUMBER + ")");

    private static final Pattern SYMBOL_AFTER = Pattern.compile(
        "(?<![\\d.,])(" + NUMBER + ")\\s*(?:[€$£%]|(?:EUR|USD|GBP|CHF|kWh|MWh|GWh|tCO2e)\\b)");

    private static final Pattern ISO_DATE = Pattern.compile("\\b\\d{4}-\\d{2}-\\d{2}\\b");
    private static final Pattern NUMERIC_DATE = Pattern.compile("\\b\\d{1,2}[./-]\\d{1,2}[./-]\\d{2,4}\\b");
    private static final Pattern TIME = Pattern.compile("\\b\\d{1,2}:\\d{2}(?::\\d{2})?\\b");
    private static final Pattern CURRENCY_PUNCTUATION = Pattern.compile("[€$£]");
    private static final Pattern STANDALONE_NUMBER = Pattern.compile("(?<![\\d.,])(" + NUMBER + ")(?![\\d])");
    private static final Pattern FOUR_DIGITS = Pattern.compile("\\d{4}");

    /**
     * Extracts the numeric token of a value.
     *
     * @param text free-text value, may be null
     * @return numeric token as written (thousands separators kept), or empty string
     */
    public static String extract(String text) {
        if (text == null || text.isBlank()) {
            return "";
        }
        Matcher before = SYMBOL_BEFORE.matcher(text);
        if (before.find()) {
            return before.group(1);
        }
        Matcher after = SYMBOL_AFTER.matcher(text);
        if (after.find()) {
            return after.group(1);
        }

        String cleaned = ISO_DATE.matcher(text).replaceAll(" ");
        cleaned = NUMERIC_DATE.matcher(cleaned).replaceAll(" ");
        cleaned = TIME.matcher(cleaned).replaceAll(" ");
        cleaned = CURRENCY_PUNCTUATION.matcher(cleaned).replaceAll(" ");

        Matcher number = STANDALONE_NUMBER.matcher(cleaned);
        while (number.find()) {
            String token = number.group(1);
            if (!isLikelyYear(token)) {
                return token;
            }
        }
        return "";
    }

    /**
     * Detects the currency a value is expressed in.
     *
     * @param text free-text value, may be null
     * @return ISO 4217 code, or empty when no currency is mentioned
     */
    public static Optional<String> detectCurrency(String text) {
        if (text == null) {
            return Optional.empty();
        }
        String upper = text.toUpperCase(Locale.ROOT);
        if (text.contains("€") || upper.contains("EUR")) {
            return Optional.of("EUR");
        }
        if (text.contains("$") || upper.contains("USD")) {
            return Optional.of("USD");
        }
        if (text.contains("£") || upper.contains("GBP")) {
            return Optional.of("GBP");
        }
        if (upper.contains("CHF")) {
            return Optional.of("CHF");
        }
        return Optional.empty();
    }

    private static boolean isLikelyYear(String token) {
        if (!FOUR_DIGITS.matcher(token).matches()) {
            return false;
        }
        int value = Integer.parseInt(token);
        return value >= 1900 && value <= 2100;
    }
}
