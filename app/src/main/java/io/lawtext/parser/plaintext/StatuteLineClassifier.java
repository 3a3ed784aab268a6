package io.lawtext.parser.plaintext;

import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Classifies trimmed lines of statute-convention text, in the priority order the state machine
 * applies them.
 */
public class StatuteLineClassifier {

    private static final int UNICODE_SPACES = Pattern.UNICODE_CHARACTER_CLASS;

    private static final Pattern CHAPTER_HEADING = Pattern.compile(
            "^Chapter\\s+(One|Two|Three|Four|Five|Six|Seven|Eight|Nine|Ten|\\w+):\\s*(.+)",
            Pattern.CASE_INSENSITIVE | UNICODE_SPACES);
    private static final Pattern SECTION_ALONE = Pattern.compile("^([0-9]+[A-Za-z]?)\\.\\s*$", UNICODE_SPACES);
    private static final Pattern SECTION_INLINE = Pattern.compile("^([0-9]+[A-Za-z]?)\\.\\s+(.+)", UNICODE_SPACES);

    public Line classify(String trimmedLine) {
        String line = trimmedLine == null ? "" : trimmedLine;
        if (line.isEmpty()) {
            return new Line(StatuteLineType.BLANK, line, null);
        }
        if (CHAPTER_HEADING.matcher(line).find()) {
            return new Line(StatuteLineType.CHAPTER_HEADING, line, null);
        }
        Matcher alone = SECTION_ALONE.matcher(line);
        if (alone.find()) {
            return new Line(StatuteLineType.SECTION_ALONE, line, alone.group(1));
        }
        Matcher inline = SECTION_INLINE.matcher(line);
        if (inline.find() && !NoiseLines.isPublicationFootnote(inline.group(2))) {
            return new Line(StatuteLineType.SECTION_INLINE, line, inline.group(1));
        }
        return new Line(StatuteLineType.CONTENT, line, null);
    }

    /**
     * A classified line; {@code sectionLabel} is set for section lines only.
     */
    public record Line(StatuteLineType type, String text, String sectionLabel) {

        public Line {
            Objects.requireNonNull(type, "type");
            Objects.requireNonNull(text, "text");
        }
    }
}
