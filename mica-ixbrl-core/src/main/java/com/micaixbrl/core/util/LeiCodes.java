package com.micaixbrl.core.util;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * ISO 17442 legal entity identifier checks.
 *
 * <p>An LEI is 18 alphanumeric characters followed by two check digits. The check digits
 * follow ISO 7064 MOD 97-10, the same scheme as IBAN: letters map to 10..35, and the
 * resulting digit string taken modulo 97 must equal 1.</p>
 */
public final class LeiCodes {

    private LeiCodes() {
        // Utility class
    }

    /** Length of every LEI. */
    public static final int LENGTH = 20;

    private static final Pattern FORMAT = Pattern.compile("^[A-Z0-9]{18}[0-9]{2}$");

    /**
     * Trims and uppercases a candidate identifier.
     *
     * @param lei raw identifier, may be null
     * @return normalized identifier, or empty string for null
     */
    public static String normalize(String lei) {
        return lei == null ? "" : lei.trim().toUpperCase(Locale.ROOT);
    }

    /**
     * Whether the identifier has the LEI shape (after normalization).
     *
     * @param lei identifier
     * @return true when 18 alphanumerics are followed by 2 digits
     */
    public static boolean isWellFormed(String lei) {
        return FORMAT.matcher(normalize(lei)).matches();
    }

    /**
     * Verifies the MOD 97-10 check digits of a well-formed identifier.
     *
     * @param lei identifier
     * @return true when the running remainder ends at 1; false for malformed input
     */
    public static boolean hasValidChecksum(String lei) {
        String normalized = normalize(lei);
        if (!FORMAT.matcher(normalized).matches()) {
            return false;
        }
        int remainder = 0;
        for (int i = 0; i < normalized.length(); i++) {
            int value = Character.digit(normalized.charAt(i), 36);
            if (value >= 10) {
                remainder = (remainder * 100 + value) % 97;
            } else {
                remainder = (remainder * 10 + value) % 97;
            }
        }
        return remainder == 1;
    }

    /**
     * Whether a value is a "not applicable" placeholder rather than an identifier.
     *
     * @param value field value
     * @return true for values such as "Not applicable" or "N/A (not applicable)"
     */
    public static boolean isNotApplicable(String value) {
        if (value == null) {
            return false;
        }
        String compact = value.toLowerCase(Locale.ROOT).replaceAll("\\s+", "");
        return compact.contains("notapplicable");
    }
}
