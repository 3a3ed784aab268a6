package io.lawtext.parser.output;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import io.lawtext.parser.model.ActIdentity;
import io.lawtext.parser.model.ActStatus;
import io.lawtext.parser.model.Definition;
import io.lawtext.parser.model.ParsedAct;
import io.lawtext.parser.model.Provision;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

/**
 * Flat wire shape of a parsed act as read by the seed loader.
 */
@JsonPropertyOrder({"id", "type", "title", "title_en", "short_name", "status", "issued_date", "in_force_date", "url",
        "description", "provisions", "definitions"})
public record SeedDocument(
        String id,
        String type,
        String title,
        String titleEn,
        String shortName,
        ActStatus status,
        Optional<LocalDate> issuedDate,
        Optional<LocalDate> inForceDate,
        String url,
        Optional<String> description,
        List<Provision> provisions,
        List<Definition> definitions
) {

    public static SeedDocument from(ParsedAct act) {
        ActIdentity identity = act.identity();
        return new SeedDocument(identity.id(), act.type(), identity.title(), identity.titleEn(), identity.shortName(),
                identity.status(), identity.issuedDate(), identity.inForceDate(), identity.url(),
                act.description(), act.provisions(), act.definitions());
    }
}
