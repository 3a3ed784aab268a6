package io.lawtext.parser.html;

import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Narrows an HTML page down to the part that holds the act itself.
 */
@FunctionalInterface
public interface HtmlBodyLocator {

    HtmlBodyLocator WHOLE_DOCUMENT = html -> html;

    String locate(String html);

    /**
     * Body starting at the first occurrence of {@code startMarker} (ignoring case) and ending just
     * before the first {@code endPattern} match after it. Falls back to the whole page when either
     * marker is missing.
     */
    static HtmlBodyLocator between(String startMarker, Pattern endPattern) {
        Objects.requireNonNull(startMarker, "startMarker");
        Objects.requireNonNull(endPattern, "endPattern");
        Pattern start = Pattern.compile(Pattern.quote(startMarker), Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE);
        return html -> {
            Matcher startMatch = start.matcher(html);
            if (!startMatch.find()) {
                return html;
            }
            Matcher endMatch = endPattern.matcher(html);
            if (!endMatch.find(startMatch.end())) {
                return html;
            }
            return html.substring(startMatch.start(), endMatch.start());
        };
    }
}
