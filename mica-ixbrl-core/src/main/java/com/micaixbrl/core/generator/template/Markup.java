package com.micaixbrl.core.generator.template;

/**
 * Escaping for text placed in XHTML content and attribute values.
 */
public final class Markup {

    private Markup() {
        // Utility class
    }

    /**
     * Escapes the five XML special characters.
     *
     * @param text raw text, may be null
     * @return escaped text, empty for null
     */
    public static String escape(String text) {
        if (text == null || text.isEmpty()) {
            return "";
        }
        StringBuilder escaped = new StringBuilder(text.length() + 16);
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            switch (c) {
                case '&' -> escaped.append("&amp;");
                case '<' -> escaped.append("&lt;");
                case '>' -> escaped.append("&gt;");
                case '"' -> escaped.append("&quot;");
                case '\'' -> escaped.append("&#39;");
                default -> escaped.append(c);
            }
        }
        return escaped.toString();
    }
}
