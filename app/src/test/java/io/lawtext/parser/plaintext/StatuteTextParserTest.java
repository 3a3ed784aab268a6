package io.lawtext.parser.plaintext;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.tuple;

import io.lawtext.parser.structure.SectionDraft;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class StatuteTextParserTest {

    private final StatuteTextParser parser = new StatuteTextParser();

    @Test
    @DisplayName("marginal notes above a bare section number become its title")
    void usesMarginalNoteAsTitle() {
        String text = "Marginal Title\n\n1.\n\nBody text here that is long enough.\n\n2. Inline body text also long enough.";

        List<SectionDraft> drafts = parser.parse(text);

        assertThat(drafts)
                .extracting(SectionDraft::section, SectionDraft::title, SectionDraft::content)
                .containsExactly(
                        tuple("1", "Marginal Title", "Body text here that is long enough."),
                        tuple("2", "", "2. Inline body text also long enough."));
    }

    @Test
    void marginalNotesWrapAcrossLines() {
        String text = "Unlawful access\nto computer material\n\n4.\nA person who unlawfully accesses computer material";

        assertThat(parser.parse(text)).extracting(SectionDraft::title).containsExactly("Unlawful access to computer material");
    }

    @Test
    void skipsTableOfContentsAndTracksChapters() {
        String text = String.join("\n",
                "Contents",
                "Section 1 Go Definitions",
                "Section 2 Go Disruption",
                "Computers Law, 5755-1995",
                "Chapter One: Interpretation",
                "Definitions",
                "1.",
                "In this Law - \"computer material\" - software or information;",
                "\"information\" - data, signs, concepts or instructions;",
                "12",
                "Computers Law, 1995",
                "Chapter Two: Computer Offences",
                "2. A person who unlawfully disrupts the proper operation of a computer is liable to imprisonment.");

        List<SectionDraft> drafts = parser.parse(text);

        assertThat(drafts)
                .extracting(SectionDraft::section, SectionDraft::chapter, SectionDraft::title)
                .containsExactly(
                        tuple("1", Optional.of("Chapter One: Interpretation"), "Definitions"),
                        tuple("2", Optional.of("Chapter Two: Computer Offences"), ""));
        assertThat(drafts.get(0).content())
                .startsWith("In this Law")
                .endsWith("concepts or instructions;")
                .doesNotContain("12")
                .doesNotContain("Computers Law");
    }

    @Test
    void noiseLineBeforeFirstSectionResetsMarginalNotes() {
        String text = "Stray heading text\nGo\nPurpose\n1.\nThe purpose of this Law is to regulate";

        assertThat(parser.parse(text)).extracting(SectionDraft::title).containsExactly("Purpose");
    }

    @Test
    void filtersNoiseFromTitles() {
        String text = "Clause 3 of the bill\nContents\nPenalties\n5.\nA person who commits an offence is liable";

        assertThat(parser.parse(text)).extracting(SectionDraft::title).containsExactly("Penalties");
    }

    @Test
    void publicationFootnoteIsOrdinaryContent() {
        String text = "1.\nThis Law shall come into force on the day of publication.\n"
                + "2. Published in Sefer Ha-Chukkim No. 1534";

        List<SectionDraft> drafts = parser.parse(text);

        assertThat(drafts).extracting(SectionDraft::section).containsExactly("1");
        assertThat(drafts.get(0).content()).endsWith("2. Published in Sefer Ha-Chukkim No. 1534");
    }

    @Test
    void textWithoutSectionNumbersYieldsNothing() {
        assertThat(parser.parse("Just a paragraph\nof prose without numbering")).isEmpty();
        assertThat(parser.parse(null)).isEmpty();
    }

    @Test
    void sectionNumberFollowedByNoBreakSpaceStartsSection() {
        String text = "Purpose\n1.\u00A0\nThe purpose of this Law is stated here.\n2.\u00A0A second section with inline text.";

        assertThat(parser.parse(text))
                .extracting(SectionDraft::section, SectionDraft::title, SectionDraft::content)
                .containsExactly(
                        tuple("1", "Purpose", "The purpose of this Law is stated here."),
                        tuple("2", "", "2. A second section with inline text."));
    }

    @Test
    void numberedPublicationFootnoteStaysOutOfTitle() {
        String text = "3. Published in Sefer Ha-Chukkim No. 1534\nDefinitions\n1.\nIn this Law the following terms apply;";

        assertThat(parser.parse(text)).extracting(SectionDraft::title).containsExactly("Definitions");
    }
}
