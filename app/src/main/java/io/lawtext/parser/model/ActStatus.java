package io.lawtext.parser.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

/**
 * Lifecycle status of an act as reported by the registry.
 */
public enum ActStatus {
    IN_FORCE("in_force"),
    AMENDED("amended"),
    REPEALED("repealed"),
    NOT_YET_IN_FORCE("not_yet_in_force");

    private final String wireValue;

    ActStatus(String wireValue) {
        this.wireValue = wireValue;
    }

    @JsonValue
    public String wireValue() {
        return wireValue;
    }

    @JsonCreator
    public static ActStatus from(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("Act status must be provided");
        }
        String normalized = raw.trim().toLowerCase(Locale.ROOT).replace('-', '_');
        for (ActStatus status : values()) {
            if (status.wireValue.equals(normalized) || status.name().equalsIgnoreCase(normalized)) {
                return status;
            }
        }
        throw new IllegalArgumentException("Unsupported act status: " + raw);
    }
}
