package io.lawtext.parser.config;

import java.util.Locale;

/**
 * What the CLI prints for a parsed act.
 */
public enum OutputMode {
    /** The full act in seed JSON form. */
    JSON,
    /** One report line with provision and definition counts. */
    SUMMARY;

    public static OutputMode from(String raw) {
        if (raw == null || raw.isBlank()) {
            return JSON;
        }
        for (OutputMode mode : values()) {
            if (mode.name().equalsIgnoreCase(raw.trim())) {
                return mode;
            }
        }
        throw new IllegalArgumentException("Unsupported output mode: " + raw.toLowerCase(Locale.ROOT));
    }
}
