package io.lawtext.parser.output;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.lawtext.parser.ActSourceException;
import io.lawtext.parser.model.ActIdentity;
import io.lawtext.parser.model.ActStatus;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.Objects;
import java.util.Optional;

/**
 * Reads an act identity from a registry JSON entry such as
 * {@code {"id": "computer-law-1995", "titleEn": "Computers Law, 5755-1995", "abbreviation": "CL", ...}}.
 */
public class ActIdentityJsonReader {

    private final ObjectMapper objectMapper;

    public ActIdentityJsonReader() {
        this(JsonMappers.seedMapper());
    }

    public ActIdentityJsonReader(ObjectMapper objectMapper) {
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper");
    }

    public ActIdentity read(Path file) {
        Objects.requireNonNull(file, "file");
        if (!Files.isRegularFile(file)) {
            throw new ActSourceException("Identity file not found: " + file);
        }
        try {
            return read(Files.readString(file));
        } catch (IOException ex) {
            throw new ActSourceException("Failed to read identity file: " + file, ex);
        }
    }

    public ActIdentity read(String json) {
        RegistryEntry entry;
        try {
            entry = objectMapper.readValue(json, RegistryEntry.class);
        } catch (JsonProcessingException ex) {
            throw new ActSourceException("Malformed identity JSON: " + ex.getOriginalMessage(), ex);
        }
        try {
            return entry.toIdentity();
        } catch (IllegalArgumentException | DateTimeParseException ex) {
            throw new ActSourceException("Invalid identity record: " + ex.getMessage(), ex);
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record RegistryEntry(
            @JsonProperty("id") String id,
            @JsonProperty("title") String title,
            @JsonProperty("titleEn") @JsonAlias("title_en") String titleEn,
            @JsonProperty("abbreviation") @JsonAlias({"short_name", "shortName"}) String abbreviation,
            @JsonProperty("year") Integer year,
            @JsonProperty("status") String status,
            @JsonProperty("issuedDate") @JsonAlias("issued_date") String issuedDate,
            @JsonProperty("inForceDate") @JsonAlias("in_force_date") String inForceDate,
            @JsonProperty("url") String url
    ) {

        ActIdentity toIdentity() {
            ActStatus actStatus = status == null || status.isBlank() ? ActStatus.IN_FORCE : ActStatus.from(status);
            return new ActIdentity(id, title, titleEn, abbreviation, year == null ? 0 : year, actStatus,
                    parseDate(issuedDate), parseDate(inForceDate), url);
        }

        private static Optional<LocalDate> parseDate(String raw) {
            return raw == null || raw.isBlank() ? Optional.empty() : Optional.of(LocalDate.parse(raw.trim()));
        }
    }
}
