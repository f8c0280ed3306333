package com.micaixbrl.core.generator;

import com.micaixbrl.core.taxonomy.EnumerationCatalog;
import com.micaixbrl.core.taxonomy.EnumerationMapping;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Best-effort recovery of an EU member state from free text such as a registered address.
 *
 * <p>Country names are tried before two-letter codes; the last occurrence wins since
 * addresses end with the country.</p>
 */
public final class CountryCodeExtractor {

    private CountryCodeExtractor() {
        // Utility class
    }

    private static final Pattern CODE = Pattern.compile("(?<![A-Za-z])([A-Z]{2})(?![A-Za-z])");

    private static final Map<Pattern, String> NAMES = namePatterns();

    private static Map<Pattern, String> namePatterns() {
        Map<Pattern, String> names = new LinkedHashMap<>();
        for (EnumerationMapping state : EnumerationCatalog.MEMBER_STATE.values()) {
            names.put(wordPattern(state.label()), state.key());
        }
        names.put(wordPattern("Czech Republic"), "CZ");
        return names;
    }

    private static Pattern wordPattern(String phrase) {
        return Pattern.compile("\\b" + Pattern.quote(phrase) + "\\b", Pattern.CASE_INSENSITIVE);
    }

    /**
     * Extracts a member state from text.
     *
     * @param text free text, may be null
     * @return member state, or empty when none is recognized
     */
    public static Optional<EnumerationMapping> extract(String text) {
        if (text == null || text.isBlank()) {
            return Optional.empty();
        }
        String byName = null;
        int bestStart = -1;
        for (Map.Entry<Pattern, String> entry : NAMES.entrySet()) {
            Matcher matcher = entry.getKey().matcher(text);
            while (matcher.find()) {
                if (matcher.start() > bestStart) {
                    bestStart = matcher.start();
                    byName = entry.getValue();
                }
            }
        }
        if (byName != null) {
            return Optional.of(EnumerationCatalog.MEMBER_STATE.get(byName));
        }

        String byCode = null;
        Matcher matcher = CODE.matcher(text);
        while (matcher.find()) {
            if (EnumerationCatalog.MEMBER_STATE.containsKey(matcher.group(1))) {
                byCode = matcher.group(1);
            }
        }
        return Optional.ofNullable(byCode).map(EnumerationCatalog.MEMBER_STATE::get);
    }
}
