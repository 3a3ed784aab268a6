package io.lawtext.parser.html;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Offset-ordered chapter headings. Attribution walks the chapters once alongside the
 * offset-ordered sections instead of rescanning the whole list for every section.
 */
public final class ChapterIndex {

    private final List<ChapterHeading> chapters;

    public ChapterIndex(List<ChapterHeading> chapters) {
        List<ChapterHeading> sorted = new ArrayList<>(chapters == null ? List.of() : chapters);
        // Stable sort: headings sharing an offset keep their discovery order.
        sorted.sort(Comparator.comparingInt(ChapterHeading::offset));
        this.chapters = List.copyOf(sorted);
    }

    public List<ChapterHeading> chapters() {
        return chapters;
    }

    public Cursor cursor() {
        return new Cursor();
    }

    /**
     * Answers "which chapter strictly precedes this offset" for non-decreasing offsets.
     */
    public final class Cursor {

        private int next;
        private ChapterHeading current;
        private int lastOffset = -1;

        public Optional<String> chapterBefore(int offset) {
            if (offset < lastOffset) {
                throw new IllegalArgumentException("Offsets must be queried in non-decreasing order: "
                        + offset + " after " + lastOffset);
            }
            lastOffset = offset;
            while (next < chapters.size() && chapters.get(next).offset() < offset) {
                current = chapters.get(next);
                next++;
            }
            return current == null ? Optional.empty() : Optional.of(current.label());
        }
    }
}
