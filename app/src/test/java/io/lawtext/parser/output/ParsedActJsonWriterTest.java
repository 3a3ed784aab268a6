package io.lawtext.parser.output;

import static org.assertj.core.api.Assertions.assertThat;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.lawtext.parser.model.ActIdentity;
import io.lawtext.parser.model.ActStatus;
import io.lawtext.parser.model.Definition;
import io.lawtext.parser.model.ParsedAct;
import io.lawtext.parser.model.Provision;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.Test;

class ParsedActJsonWriterTest {

    private final ParsedActJsonWriter writer = new ParsedActJsonWriter();
    private final ObjectMapper reader = new ObjectMapper();

    @Test
    void writesSeedShapeWithSnakeCaseFields() throws Exception {
        ActIdentity identity = new ActIdentity("computer-law-1995", "חוק המחשבים", "Computers Law, 5755-1995", "CL",
                1995, ActStatus.AMENDED, Optional.of(LocalDate.of(1995, 7, 25)), Optional.empty(),
                "https://example.org/computers-law.pdf");
        ParsedAct act = new ParsedAct(identity, Optional.empty(),
                List.of(new Provision("sec1", "1", Optional.of("Chapter One: Interpretation"), "Definitions",
                        "In this Law definitions apply")),
                List.of(new Definition("computer", "a device that processes information", Optional.of("sec1"))));

        JsonNode json = reader.readTree(writer.write(act, false));

        assertThat(json.get("id").asText()).isEqualTo("computer-law-1995");
        assertThat(json.get("type").asText()).isEqualTo("statute");
        assertThat(json.get("title_en").asText()).isEqualTo("Computers Law, 5755-1995");
        assertThat(json.get("short_name").asText()).isEqualTo("CL");
        assertThat(json.get("status").asText()).isEqualTo("amended");
        assertThat(json.get("issued_date").asText()).isEqualTo("1995-07-25");
        assertThat(json.has("in_force_date")).isFalse();
        assertThat(json.has("description")).isFalse();

        JsonNode provision = json.get("provisions").get(0);
        assertThat(provision.get("provision_ref").asText()).isEqualTo("sec1");
        assertThat(provision.get("chapter").asText()).isEqualTo("Chapter One: Interpretation");
        assertThat(provision.get("section").asText()).isEqualTo("1");

        JsonNode definition = json.get("definitions").get(0);
        assertThat(definition.get("term").asText()).isEqualTo("computer");
        assertThat(definition.get("source_provision").asText()).isEqualTo("sec1");
    }

    @Test
    void omitsAbsentChapter() throws Exception {
        ParsedAct act = new ParsedAct(ActIdentity.of("a"), Optional.empty(),
                List.of(new Provision("sec2", "2", Optional.empty(), "", "content long enough")), List.of());

        JsonNode provision = reader.readTree(writer.write(act, false)).get("provisions").get(0);

        assertThat(provision.has("chapter")).isFalse();
    }

    @Test
    void prettyPrintingSpansLines() {
        String json = writer.write(ParsedAct.metadataOnly(ActIdentity.of("a"), "desc"), true);

        assertThat(json).contains(System.lineSeparator()).contains("\"description\" : \"desc\"");
    }
}
