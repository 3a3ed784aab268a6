package io.lawtext.parser.text;

import java.util.regex.Pattern;

/**
 * Canonicalizes markup and raw text into single-spaced plain text.
 */
public final class TextNormalizer {

    private static final Pattern TAG = Pattern.compile("<[^>]+>");
    private static final Pattern WHITESPACE_RUN = Pattern.compile("\\s+", Pattern.UNICODE_CHARACTER_CLASS);
    private static final Pattern EDGE_WHITESPACE = Pattern.compile("^\\s+|\\s+$", Pattern.UNICODE_CHARACTER_CLASS);

    private TextNormalizer() {
    }

    /**
     * Removes tags, decodes the common HTML entities and collapses whitespace.
     */
    public static String stripMarkup(String html) {
        if (html == null || html.isEmpty()) {
            return "";
        }
        String text = TAG.matcher(html).replaceAll(" ")
                .replace("&nbsp;", " ")
                .replace("&amp;", "&")
                .replace("&lt;", "<")
                .replace("&gt;", ">")
                .replace("&quot;", "\"")
                .replace("&#39;", "'");
        return collapseWhitespace(text);
    }

    /**
     * Trims every Unicode space, including the no-break spaces that PDF and HTML extraction leave
     * at line edges, which {@link String#trim()} keeps.
     */
    public static String trimLine(String line) {
        if (line == null || line.isEmpty()) {
            return "";
        }
        return EDGE_WHITESPACE.matcher(line).replaceAll("");
    }

    public static String collapseWhitespace(String text) {
        if (text == null || text.isEmpty()) {
            return "";
        }
        return WHITESPACE_RUN.matcher(text).replaceAll(" ").trim();
    }

    public static String truncate(String text, int maxLength) {
        if (text == null) {
            return "";
        }
        return text.length() <= maxLength ? text : text.substring(0, maxLength);
    }
}
