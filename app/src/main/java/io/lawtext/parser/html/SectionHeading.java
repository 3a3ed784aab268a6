package io.lawtext.parser.html;

import java.util.Objects;

/**
 * A numbered section heading found at {@code offset} in the document body.
 */
public record SectionHeading(int offset, String label, String title) {

    public SectionHeading {
        if (offset < 0) {
            throw new IllegalArgumentException("offset must not be negative");
        }
        Objects.requireNonNull(label, "label");
        title = title == null ? "" : title;
    }
}
