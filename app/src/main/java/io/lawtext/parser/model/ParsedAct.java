package io.lawtext.parser.model;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Structured result of parsing one act: identity fields, provisions in source order and the
 * definitions extracted from its definitional provisions.
 */
public record ParsedAct(
        ActIdentity identity,
        Optional<String> description,
        List<Provision> provisions,
        List<Definition> definitions
) {

    public static final String TYPE = "statute";

    public ParsedAct {
        Objects.requireNonNull(identity, "identity");
        description = description == null ? Optional.empty() : description;
        provisions = provisions == null ? List.of() : List.copyOf(provisions);
        definitions = definitions == null ? List.of() : List.copyOf(definitions);
    }

    /**
     * Record carrying only registry metadata, used by consumers when structural parsing yielded nothing.
     */
    public static ParsedAct metadataOnly(ActIdentity identity, String description) {
        return new ParsedAct(identity, Optional.ofNullable(description).filter(value -> !value.isBlank()),
                List.of(), List.of());
    }

    public String type() {
        return TYPE;
    }

    public boolean isEmpty() {
        return provisions.isEmpty();
    }
}
