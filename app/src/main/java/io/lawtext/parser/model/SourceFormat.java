package io.lawtext.parser.model;

import java.util.Locale;

/**
 * Declared format of the raw text handed to the parser.
 */
public enum SourceFormat {
    HTML,
    TEXT;

    public static SourceFormat from(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("Source format must be provided");
        }
        return switch (raw.trim().toLowerCase(Locale.ROOT)) {
            case "html", "htm" -> HTML;
            // PDF sources reach the parser as extracted plain text.
            case "text", "txt", "pdf" -> TEXT;
            default -> throw new IllegalArgumentException("Unsupported source format: " + raw);
        };
    }
}
