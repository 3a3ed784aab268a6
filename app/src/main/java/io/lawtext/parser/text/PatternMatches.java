package io.lawtext.parser.text;

import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.regex.Matcher;
import java.util.regex.MatchResult;
import java.util.regex.Pattern;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * Lazy, restartable sequence of the matches of a pattern in an input, starting at an explicit offset.
 * <p>
 * Each iteration owns a fresh {@link Matcher}; the only scanning position is the offset tracked by
 * the iterator itself, so the same sequence can be walked any number of times.
 */
public final class PatternMatches implements Iterable<MatchResult> {

    private final Pattern pattern;
    private final CharSequence input;
    private final int startOffset;

    private PatternMatches(Pattern pattern, CharSequence input, int startOffset) {
        this.pattern = Objects.requireNonNull(pattern, "pattern");
        this.input = input == null ? "" : input;
        if (startOffset < 0 || startOffset > this.input.length()) {
            throw new IllegalArgumentException("startOffset out of range: " + startOffset);
        }
        this.startOffset = startOffset;
    }

    public static PatternMatches of(Pattern pattern, CharSequence input) {
        return new PatternMatches(pattern, input, 0);
    }

    PatternMatches from(int offset) {
        return new PatternMatches(pattern, input, offset);
    }

    int startOffset() {
        return startOffset;
    }

    @Override
    public Iterator<MatchResult> iterator() {
        return new MatchIterator();
    }

    public Stream<MatchResult> stream() {
        return StreamSupport.stream(
                Spliterators.spliteratorUnknownSize(iterator(), Spliterator.ORDERED | Spliterator.NONNULL), false);
    }

    private final class MatchIterator implements Iterator<MatchResult> {

        private final Matcher matcher = pattern.matcher(input);
        private int offset = startOffset;
        private MatchResult pending;
        private boolean exhausted;

        @Override
        public boolean hasNext() {
            if (pending != null) {
                return true;
            }
            if (exhausted || offset > input.length() || !matcher.find(offset)) {
                exhausted = true;
                return false;
            }
            pending = matcher.toMatchResult();
            // Empty matches must still advance the cursor.
            offset = matcher.end() == matcher.start() ? matcher.end() + 1 : matcher.end();
            return true;
        }

        @Override
        public MatchResult next() {
            if (!hasNext()) {
                throw new NoSuchElementException();
            }
            MatchResult result = pending;
            pending = null;
            return result;
        }
    }
}
