package io.lawtext.parser.plaintext;

import io.lawtext.parser.structure.SectionDraft;
import io.lawtext.parser.structure.StructureParser;
import io.lawtext.parser.text.TextNormalizer;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Parser for Basic Law translations, where every numbered paragraph starts a section and its
 * title is the short label printed in the few lines just above the number:
 * <pre>
 * Purpose
 *
 * 1. The purpose of this Basic Law is ...
 * </pre>
 * Basic Laws carry no chapters.
 */
public class BasicLawTextParser implements StructureParser {

    private static final Logger LOGGER = LoggerFactory.getLogger(BasicLawTextParser.class);

    static final int TITLE_LOOK_BACK_LINES = 4;

    private static final Pattern SECTION_START = Pattern.compile("^([0-9]+[a-z]?)\\.\\s*(.*)", Pattern.UNICODE_CHARACTER_CLASS);
    private static final Pattern SECTION_WITH_TEXT = Pattern.compile("^[0-9]+[a-z]?\\.\\s", Pattern.UNICODE_CHARACTER_CLASS);
    private static final Pattern AMENDMENT_NOTE = Pattern.compile("^\\(Amendment");

    @Override
    public List<SectionDraft> parse(String rawText) {
        String[] lines = (rawText == null ? "" : rawText).split("\n", -1);
        List<SectionDraft> drafts = new ArrayList<>();
        SectionAccumulator current = null;

        for (int i = 0; i < lines.length; i++) {
            String line = TextNormalizer.trimLine(lines[i]);
            Matcher start = SECTION_START.matcher(line);
            if (start.find()) {
                if (current != null) {
                    drafts.add(current.toDraft());
                }
                String initialContent = start.group(2).isEmpty() ? "" : TextNormalizer.collapseWhitespace(line);
                current = new SectionAccumulator(start.group(1), Optional.empty(), titleAbove(lines, i), initialContent);
                continue;
            }
            if (current != null && !line.isEmpty() && !NoiseLines.isBasicLawRunningLine(line)) {
                current.append(line);
            }
        }
        if (current != null) {
            drafts.add(current.toDraft());
        }

        LOGGER.debug("Recovered {} section candidates from {} lines", drafts.size(), lines.length);
        return List.copyOf(drafts);
    }

    /**
     * Walks back over at most {@value #TITLE_LOOK_BACK_LINES} lines, stopping at the first blank
     * line once some title text has been collected.
     */
    static String titleAbove(String[] lines, int sectionLine) {
        String title = "";
        for (int j = sectionLine - 1; j >= Math.max(0, sectionLine - TITLE_LOOK_BACK_LINES); j--) {
            String previous = TextNormalizer.trimLine(lines[j]);
            if (!previous.isEmpty()
                    && previous.length() < NoiseLines.MAX_TITLE_LINE_LENGTH
                    && !SECTION_WITH_TEXT.matcher(previous).find()
                    && !AMENDMENT_NOTE.matcher(previous).find()) {
                title = title.isEmpty() ? previous : previous + " " + title;
            } else if (previous.isEmpty() && !title.isEmpty()) {
                break;
            }
        }
        return TextNormalizer.collapseWhitespace(title);
    }
}
