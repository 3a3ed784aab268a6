package io.lawtext.parser.structure;

import java.util.Objects;
import java.util.Optional;

/**
 * A section recovered by a structure parser before the content threshold and truncation apply.
 * {@code content} is already normalized but not yet capped.
 */
public record SectionDraft(String section, Optional<String> chapter, String title, String content) {

    public SectionDraft {
        Objects.requireNonNull(section, "section");
        chapter = chapter == null ? Optional.empty() : chapter.filter(value -> !value.isBlank());
        title = title == null ? "" : title;
        content = content == null ? "" : content;
    }
}
