package io.lawtext.parser.model;

import java.util.Objects;
import java.util.Optional;

/**
 * A defined term and its definition text.
 */
public record Definition(String term, String definition, Optional<String> sourceProvision) {

    public Definition {
        Objects.requireNonNull(term, "term");
        Objects.requireNonNull(definition, "definition");
        sourceProvision = sourceProvision == null ? Optional.empty() : sourceProvision;
    }
}
