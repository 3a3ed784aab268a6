package io.lawtext.parser.html;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.tuple;

import io.lawtext.parser.structure.SectionDraft;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class HtmlStructureParserTest {

    @Test
    @DisplayName("sections after a chapter heading inherit it")
    void attributesSectionsToChapter() {
        String html = "<B>CHAPTER A: Intro</B> ... <B>1. First</B> some content exceeding ten chars "
                + "<B>2. Second</B> more content exceeding ten chars";

        List<SectionDraft> drafts = HtmlStructureParser.generic().parse(html);

        assertThat(drafts)
                .extracting(SectionDraft::section, SectionDraft::chapter, SectionDraft::title)
                .containsExactly(
                        tuple("1", Optional.of("CHAPTER A: Intro"), "First"),
                        tuple("2", Optional.of("CHAPTER A: Intro"), "Second"));
        assertThat(drafts.get(0).content()).isEqualTo("1. First some content exceeding ten chars");
        assertThat(drafts.get(1).content()).isEqualTo("2. Second more content exceeding ten chars");
    }

    @Test
    void sectionBeforeAnyChapterHasNoChapter() {
        String html = "<B>1. Pre</B> content long enough here <B>CHAPTER B: Later</B>"
                + "<B>2. Post</B> content long enough there";

        List<SectionDraft> drafts = HtmlStructureParser.generic().parse(html);

        assertThat(drafts).extracting(SectionDraft::chapter)
                .containsExactly(Optional.empty(), Optional.of("CHAPTER B: Later"));
    }

    @Test
    void articleHeadingsActAsChapters() {
        String html = "<b>Article 1: General Provisions</b><b><a name=\"s1\"></a>1. Scope</b> This Law applies to all "
                + "<b>Article 2: Offences</b><b>2. Penalty</b> Whoever breaches section 1 is liable";

        List<SectionDraft> drafts = HtmlStructureParser.generic().parse(html);

        assertThat(drafts)
                .extracting(SectionDraft::section, SectionDraft::chapter)
                .containsExactly(
                        tuple("1", Optional.of("Article 1: General Provisions")),
                        tuple("2", Optional.of("Article 2: Offences")));
    }

    @Test
    void privacyLawBodyExcludesPageFurniture() {
        String html = "<HTML><BODY><TABLE><TR><TD><B>1. Navigation</B> links to other pages here\n"
                + "PROTECTION OF PRIVACY LAW, 5741-1981\n"
                + "<B>CHAPTER ONE: INFRINGEMENT OF PRIVACY</B>\n"
                + "<B>1. Prohibition of infringement of privacy</B> No person shall infringe the privacy of another"
                + " without his consent.\n"
                + "<B>2. Infringement of privacy</B> Infringement of privacy is any of the following:\n"
                + "</TD></TR></TABLE><BR>\n"
                + "<B>99. Footer</B> trailing page furniture text";

        List<SectionDraft> drafts = HtmlStructureParser.privacyLaw().parse(html);

        assertThat(drafts)
                .extracting(SectionDraft::section, SectionDraft::title)
                .containsExactly(
                        tuple("1", "Prohibition of infringement of privacy"),
                        tuple("2", "Infringement of privacy"));
        assertThat(drafts).allSatisfy(draft ->
                assertThat(draft.chapter()).contains("CHAPTER ONE: INFRINGEMENT OF PRIVACY"));
        assertThat(drafts.get(1).content()).endsWith("any of the following:");
    }

    @Test
    void privacyLawFallsBackToWholePageWithoutTitleMarker() {
        String html = "<B>4. Civil wrong</B> An infringement of privacy is a civil wrong.";

        assertThat(HtmlStructureParser.privacyLaw().parse(html)).extracting(SectionDraft::section).containsExactly("4");
    }

    @Test
    void keepsAlphanumericSectionLabels() {
        String html = "<B>17C. Definitions</B> In this Chapter the following apply";

        assertThat(HtmlStructureParser.generic().parse(html)).extracting(SectionDraft::section).containsExactly("17C");
    }

    @Test
    void returnsNothingForUnstructuredInput() {
        assertThat(HtmlStructureParser.generic().parse("<p>No headings at all</p>")).isEmpty();
        assertThat(HtmlStructureParser.generic().parse(null)).isEmpty();
    }

    @Test
    void headingWithNoBreakSpaceAfterNumberIsRecognized() {
        String html = "<B>CHAPTER\u00A0A:\u00A0Intro</B><B>1.\u00A0First</B> some content exceeding ten chars";

        assertThat(HtmlStructureParser.generic().parse(html))
                .extracting(SectionDraft::section, SectionDraft::chapter, SectionDraft::title, SectionDraft::content)
                .containsExactly(tuple("1", Optional.of("CHAPTER A: Intro"), "First",
                        "1. First some content exceeding ten chars"));
    }
}
