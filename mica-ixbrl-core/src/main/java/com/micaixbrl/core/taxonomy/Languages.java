package com.micaixbrl.core.taxonomy;

import java.util.List;
import java.util.Map;

/**
 * Official EU languages a MiCA white paper may be drawn up in (Article 6(7)).
 */
public final class Languages {

    private Languages() {
        // Utility class
    }

    /** Supported ISO 639-1 codes. */
    public static final List<String> SUPPORTED = List.of(
        "bg", "cs", "da", "de", "el", "en", "es", "et", "fi", "fr",
        "ga", "hr", "hu", "it", "lt", "lv", "mt", "nl", "pl", "pt",
        "ro", "sk", "sl", "sv"
    );

    private static final Map<String, String> NAMES = Map.ofEntries(
        Map.entry("bg", "Bulgarian"), Map.entry("cs", "Czech"), Map.entry("da", "Danish"),
        Map.entry("de", "German"), Map.entry("el", "Greek"), Map.entry("en", "English"),
        Map.entry("es", "Spanish"), Map.entry("et", "Estonian"), Map.entry("fi", "Finnish"),
        Map.entry("fr", "French"), Map.entry("ga", "Irish"), Map.entry("hr", "Croatian"),
        Map.entry("hu", "Hungarian"), Map.entry("it", "Italian"), Map.entry("lt", "Lithuanian"),
        Map.entry("lv", "Latvian"), Map.entry("mt", "Maltese"), Map.entry("nl", "Dutch"),
        Map.entry("pl", "Polish"), Map.entry("pt", "Portuguese"), Map.entry("ro", "Romanian"),
        Map.entry("sk", "Slovak"), Map.entry("sl", "Slovenian"), Map.entry("sv", "Swedish")
    );

    public static boolean isSupported(String code) {
        return code != null && SUPPORTED.contains(code);
    }

    /**
     * Returns the English name of a language, or the code itself when unknown.
     *
     * @param code ISO 639-1 code
     * @return language name
     */
    public static String nameOf(String code) {
        return code == null ? "" : NAMES.getOrDefault(code, code);
    }
}
