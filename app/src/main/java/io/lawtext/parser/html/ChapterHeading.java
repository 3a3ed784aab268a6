package io.lawtext.parser.html;

import java.util.Objects;

/**
 * A chapter heading found at {@code offset} in the document body.
 */
public record ChapterHeading(int offset, String label) {

    public ChapterHeading {
        if (offset < 0) {
            throw new IllegalArgumentException("offset must not be negative");
        }
        Objects.requireNonNull(label, "label");
    }
}
