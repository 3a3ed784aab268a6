package io.lawtext.parser.model;

import java.util.Objects;
import java.util.Optional;

/**
 * A numbered section of an act with its optional chapter scope.
 */
public record Provision(String provisionRef, String section, Optional<String> chapter, String title, String content) {

    public Provision {
        Objects.requireNonNull(provisionRef, "provisionRef");
        Objects.requireNonNull(section, "section");
        chapter = chapter == null ? Optional.empty() : chapter.filter(value -> !value.isBlank());
        title = title == null ? "" : title;
        Objects.requireNonNull(content, "content");
    }

    public static String refFor(String section) {
        return "sec" + section;
    }
}
