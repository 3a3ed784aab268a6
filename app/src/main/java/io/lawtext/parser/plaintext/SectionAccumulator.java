package io.lawtext.parser.plaintext;

import io.lawtext.parser.structure.SectionDraft;
import io.lawtext.parser.text.TextNormalizer;
import java.util.Objects;
import java.util.Optional;

/**
 * Mutable content buffer of the section currently being read.
 */
final class SectionAccumulator {

    private final String section;
    private final Optional<String> chapter;
    private final String title;
    private final StringBuilder content = new StringBuilder();

    SectionAccumulator(String section, Optional<String> chapter, String title, String initialContent) {
        this.section = Objects.requireNonNull(section, "section");
        this.chapter = chapter == null ? Optional.empty() : chapter;
        this.title = title == null ? "" : title;
        if (initialContent != null && !initialContent.isEmpty()) {
            content.append(initialContent);
        }
    }

    void append(String line) {
        content.append(' ').append(TextNormalizer.collapseWhitespace(line));
    }

    SectionDraft toDraft() {
        return new SectionDraft(section, chapter, title, TextNormalizer.collapseWhitespace(content.toString()));
    }
}
