package io.lawtext.parser.output;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.lawtext.parser.model.ParsedAct;
import java.util.Objects;

/**
 * Serializes parsed acts into the seed JSON shape.
 */
public class ParsedActJsonWriter {

    private final ObjectMapper objectMapper;

    public ParsedActJsonWriter() {
        this(JsonMappers.seedMapper());
    }

    public ParsedActJsonWriter(ObjectMapper objectMapper) {
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper");
    }

    public String write(ParsedAct act, boolean pretty) {
        Objects.requireNonNull(act, "act");
        try {
            SeedDocument document = SeedDocument.from(act);
            return pretty
                    ? objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(document)
                    : objectMapper.writeValueAsString(document);
        } catch (JsonProcessingException ex) {
            throw new IllegalStateException("Failed to serialize parsed act " + act.identity().id(), ex);
        }
    }
}
