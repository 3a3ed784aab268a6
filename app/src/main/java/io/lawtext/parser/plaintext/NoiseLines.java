package io.lawtext.parser.plaintext;

import java.util.List;
import java.util.regex.Pattern;

/**
 * Lines that PDF extraction leaves behind around the act text: table-of-contents links, page
 * numbers, mastheads, running headers and footnotes.
 */
final class NoiseLines {

    static final int MAX_TITLE_LINE_LENGTH = 100;

    private static final int U = Pattern.UNICODE_CHARACTER_CLASS;
    private static final int CI = Pattern.CASE_INSENSITIVE | U;

    static final String STATUTE_BODY_START = "Computers Law, 5755";

    private static final Pattern BARE_NUMBER = Pattern.compile("^[0-9]+$");
    private static final Pattern PAGE_NUMBER = Pattern.compile("^[0-9]{1,3}$");
    private static final Pattern TOC_LINK = Pattern.compile("^Go$", CI);
    private static final Pattern TOC_SECTION = Pattern.compile("^Section\\s+[0-9]+", U);
    private static final Pattern MASTHEAD = Pattern.compile("^Computers Law", CI);
    private static final Pattern RUNNING_HEADER = Pattern.compile("^Computers Law, 1995", CI);
    private static final Pattern PUBLICATION_FOOTNOTE = Pattern.compile("^Published in", CI);
    private static final Pattern NUMBERED_PUBLICATION_FOOTNOTE = Pattern.compile("^[0-9]+[A-Za-z]?\\.\\s+Published in", CI);
    private static final Pattern FOOTNOTE_MARK = Pattern.compile("^\\*$");

    private static final List<Pattern> TITLE_NOISE = List.of(
            Pattern.compile("^Chapter\\s+", CI),
            TOC_LINK,
            TOC_SECTION,
            Pattern.compile("^Clause\\s+", CI),
            Pattern.compile("^\\*"),
            Pattern.compile("^Contents$"),
            BARE_NUMBER,
            MASTHEAD,
            PUBLICATION_FOOTNOTE,
            NUMBERED_PUBLICATION_FOOTNOTE);

    private static final List<Pattern> MARGINAL_NOTE_NOISE = List.of(
            TOC_LINK,
            TOC_SECTION,
            MASTHEAD,
            BARE_NUMBER,
            FOOTNOTE_MARK,
            PUBLICATION_FOOTNOTE);

    private static final List<Pattern> BASIC_LAW_RUNNING_LINES = List.of(
            Pattern.compile("^BASIC-LAW:", CI),
            Pattern.compile("^This unofficial", CI),
            Pattern.compile("^For the full", CI),
            Pattern.compile("^Special thanks", CI));

    private NoiseLines() {
    }

    /** Candidate marginal-note line that cannot be part of a section title. */
    static boolean isTitleNoise(String line) {
        return line.isEmpty() || line.length() >= MAX_TITLE_LINE_LENGTH || matchesAny(TITLE_NOISE, line);
    }

    /** Line seen before any section that breaks the run of marginal notes. */
    static boolean isMarginalNoteNoise(String line) {
        return matchesAny(MARGINAL_NOTE_NOISE, line);
    }

    /** Page number or running header inside section content. */
    static boolean isStatuteContentNoise(String line) {
        return PAGE_NUMBER.matcher(line).matches() || RUNNING_HEADER.matcher(line).find();
    }

    static boolean isPublicationFootnote(String text) {
        return PUBLICATION_FOOTNOTE.matcher(text).find();
    }

    static boolean isBasicLawRunningLine(String line) {
        return matchesAny(BASIC_LAW_RUNNING_LINES, line);
    }

    private static boolean matchesAny(List<Pattern> patterns, String line) {
        for (Pattern pattern : patterns) {
            if (pattern.matcher(line).find()) {
                return true;
            }
        }
        return false;
    }
}
