package io.lawtext.parser.html;

import io.lawtext.parser.structure.SectionDraft;
import io.lawtext.parser.structure.StructureParser;
import io.lawtext.parser.text.PatternMatches;
import io.lawtext.parser.text.TextNormalizer;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.regex.MatchResult;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Recovers chapters and numbered sections from pages where both kinds of heading are wrapped in
 * bold tags, e.g. {@code <B>CHAPTER ONE: Infringement of Privacy</B>} and {@code <B>12. Title</B>}.
 * <p>
 * A section spans from its own heading to the next section heading and belongs to the nearest
 * chapter heading before it. Nesting of the markup is ignored; only offsets count.
 */
public class HtmlStructureParser implements StructureParser {

    private static final Logger LOGGER = LoggerFactory.getLogger(HtmlStructureParser.class);

    private static final int FLAGS = Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CHARACTER_CLASS;

    static final Pattern SECTION_HEADING = Pattern.compile(
            "<B>(?:<a[^>]*></a>)?\\s*([0-9]+[A-Z]?)\\.\\s+([^<]+)</B>", FLAGS);
    static final Pattern CHAPTER_HEADING = Pattern.compile(
            "<B>\\s*(CHAPTER\\s+[^:]{1,200}:\\s*[^<]+)</B>", FLAGS);
    static final Pattern ARTICLE_HEADING = Pattern.compile(
            "<B>\\s*(Article\\s+[^:]{1,200}:\\s*[^<]+)</B>", FLAGS);

    private static final Pattern PRIVACY_LAW_BODY_END = Pattern.compile(
            "</TD>\\s*</TR>\\s*</TABLE>\\s*<BR>", FLAGS);

    private final HtmlBodyLocator bodyLocator;

    public HtmlStructureParser(HtmlBodyLocator bodyLocator) {
        this.bodyLocator = Objects.requireNonNull(bodyLocator, "bodyLocator");
    }

    /**
     * Fallback for HTML sources without a dedicated strategy: the whole page is the body.
     */
    public static HtmlStructureParser generic() {
        return new HtmlStructureParser(HtmlBodyLocator.WHOLE_DOCUMENT);
    }

    /**
     * Privacy Protection Law mirror: the act sits inside the main layout table after its title.
     */
    public static HtmlStructureParser privacyLaw() {
        return new HtmlStructureParser(HtmlBodyLocator.between("PROTECTION OF PRIVACY LAW", PRIVACY_LAW_BODY_END));
    }

    @Override
    public List<SectionDraft> parse(String rawText) {
        String html = rawText == null ? "" : rawText;
        String body = bodyLocator.locate(html);

        List<ChapterHeading> chapterHeadings = new ArrayList<>(findChapters(body, CHAPTER_HEADING));
        chapterHeadings.addAll(findChapters(body, ARTICLE_HEADING));
        ChapterIndex chapterIndex = new ChapterIndex(chapterHeadings);
        List<SectionHeading> sections = findSections(body);
        LOGGER.debug("Found {} chapter and {} section headings in {} characters of body",
                chapterIndex.chapters().size(), sections.size(), body.length());

        List<SectionDraft> drafts = new ArrayList<>(sections.size());
        ChapterIndex.Cursor chapters = chapterIndex.cursor();
        for (int i = 0; i < sections.size(); i++) {
            SectionHeading section = sections.get(i);
            int end = i + 1 < sections.size() ? sections.get(i + 1).offset() : body.length();
            Optional<String> chapter = chapters.chapterBefore(section.offset());
            String content = TextNormalizer.stripMarkup(body.substring(section.offset(), end));
            drafts.add(new SectionDraft(section.label(), chapter, section.title(), content));
        }
        return drafts;
    }

    private static List<ChapterHeading> findChapters(String body, Pattern pattern) {
        return PatternMatches.of(pattern, body).stream()
                .map(match -> new ChapterHeading(match.start(), TextNormalizer.stripMarkup(match.group(1))))
                .collect(Collectors.toList());
    }

    private static List<SectionHeading> findSections(String body) {
        List<SectionHeading> headings = new ArrayList<>();
        for (MatchResult match : PatternMatches.of(SECTION_HEADING, body)) {
            headings.add(new SectionHeading(match.start(), match.group(1),
                    TextNormalizer.stripMarkup(match.group(2))));
        }
        return headings;
    }
}
