package io.lawtext.parser.model;

import java.time.LocalDate;
import java.util.Objects;
import java.util.Optional;

/**
 * Identity record of an act supplied by the external registry. The parser only reads it.
 */
public record ActIdentity(
        String id,
        String title,
        String titleEn,
        String shortName,
        int year,
        ActStatus status,
        Optional<LocalDate> issuedDate,
        Optional<LocalDate> inForceDate,
        String url
) {

    public ActIdentity {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("id must not be blank");
        }
        id = id.trim();
        title = title == null ? "" : title;
        titleEn = titleEn == null ? "" : titleEn;
        shortName = shortName == null ? "" : shortName;
        status = Objects.requireNonNull(status, "status");
        issuedDate = issuedDate == null ? Optional.empty() : issuedDate;
        inForceDate = inForceDate == null ? Optional.empty() : inForceDate;
        url = url == null ? "" : url;
    }

    /**
     * Minimal identity for ad-hoc parsing where only the id is known.
     */
    public static ActIdentity of(String id) {
        return new ActIdentity(id, "", "", "", 0, ActStatus.IN_FORCE, Optional.empty(), Optional.empty(), "");
    }
}
