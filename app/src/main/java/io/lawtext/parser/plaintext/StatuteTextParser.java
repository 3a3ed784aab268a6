package io.lawtext.parser.plaintext;

import io.lawtext.parser.structure.SectionDraft;
import io.lawtext.parser.structure.StructureParser;
import io.lawtext.parser.text.TextNormalizer;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Line-by-line state machine for statutes extracted from PDF, where a section number stands at the
 * start of a line (alone or followed by text) and the lines preceding the first section number
 * form its marginal note.
 * <p>
 * Layout handled:
 * <pre>
 * Chapter One: Interpretation
 * Definitions
 * 1.
 * In this Law - ...
 * 2. (a) A person who ...
 * </pre>
 */
public class StatuteTextParser implements StructureParser {

    private static final Logger LOGGER = LoggerFactory.getLogger(StatuteTextParser.class);

    private final StatuteLineClassifier classifier;

    public StatuteTextParser() {
        this(new StatuteLineClassifier());
    }

    public StatuteTextParser(StatuteLineClassifier classifier) {
        this.classifier = Objects.requireNonNull(classifier, "classifier");
    }

    @Override
    public List<SectionDraft> parse(String rawText) {
        String text = skipTableOfContents(rawText == null ? "" : rawText);
        Run run = new Run();
        for (String line : text.split("\n", -1)) {
            run.accept(classifier.classify(TextNormalizer.trimLine(line)));
        }
        run.finish();
        LOGGER.debug("Recovered {} section candidates from {} characters of text", run.drafts.size(), text.length());
        return List.copyOf(run.drafts);
    }

    private static String skipTableOfContents(String text) {
        int start = text.indexOf(NoiseLines.STATUTE_BODY_START);
        return start >= 0 ? text.substring(start) : text;
    }

    /**
     * Per-call parsing state.
     */
    private static final class Run {

        private final List<SectionDraft> drafts = new ArrayList<>();
        private final List<String> marginalNotes = new ArrayList<>();
        private Optional<String> chapter = Optional.empty();
        private SectionAccumulator current;

        void accept(StatuteLineClassifier.Line line) {
            switch (line.type()) {
                case CHAPTER_HEADING -> {
                    chapter = Optional.of(TextNormalizer.collapseWhitespace(line.text()));
                    marginalNotes.clear();
                }
                case SECTION_ALONE -> startSection(line.sectionLabel(), "");
                case SECTION_INLINE -> startSection(line.sectionLabel(), TextNormalizer.collapseWhitespace(line.text()));
                case CONTENT -> acceptContent(line.text());
                case BLANK -> {
                    // Marginal notes may wrap across blank lines.
                }
            }
        }

        void finish() {
            if (current != null) {
                drafts.add(current.toDraft());
                current = null;
            }
        }

        private void startSection(String label, String initialContent) {
            finish();
            String title = TextNormalizer.collapseWhitespace(marginalNotes.stream()
                    .filter(note -> !NoiseLines.isTitleNoise(note))
                    .collect(Collectors.joining(" ")));
            current = new SectionAccumulator(label, chapter, title, initialContent);
            marginalNotes.clear();
        }

        private void acceptContent(String line) {
            if (current != null) {
                if (!NoiseLines.isStatuteContentNoise(line)) {
                    current.append(line);
                }
            } else if (NoiseLines.isMarginalNoteNoise(line)) {
                marginalNotes.clear();
            } else {
                marginalNotes.add(line);
            }
        }
    }
}
