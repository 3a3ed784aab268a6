package io.lawtext.parser.definition;

import java.util.List;
import java.util.regex.Pattern;

/**
 * Quoted-term definition patterns, grouped by the quoting habits of a source format.
 * Group 1 captures the term, group 2 the definition text.
 */
public enum DefinitionPatternSet {

    /** HTML mirrors: straight or curly quotes, one dash, definition ends at ';' or end of block. */
    HTML(List.of(
            Pattern.compile("[\"\u201c]([^\"\u201d]{1,200})[\"\u201d]\\s*[-\u2013\u2014]\\s*([^;]{1,20000}(?:;|$))", Pattern.UNICODE_CHARACTER_CLASS))),

    /** Extracted PDF text: dashes may be doubled and a definition must end with ';'. */
    PLAIN_TEXT(List.of(
            Pattern.compile("[\"\u201c]([^\"\u201d]{1,200})[\"\u201d]\\s*[-\u2013\u2014]+\\s*([^;]{1,20000};)", Pattern.UNICODE_CHARACTER_CLASS),
            Pattern.compile("\"([^\"]{1,200})\"\\s*[-\u2013\u2014]+\\s*([^;]{1,20000};)", Pattern.UNICODE_CHARACTER_CLASS)));

    private final List<Pattern> patterns;

    DefinitionPatternSet(List<Pattern> patterns) {
        this.patterns = patterns;
    }

    public List<Pattern> patterns() {
        return patterns;
    }
}
