package io.lawtext.parser.definition;

import io.lawtext.parser.model.Definition;
import io.lawtext.parser.text.PatternMatches;
import io.lawtext.parser.text.TextNormalizer;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.regex.MatchResult;
import java.util.regex.Pattern;

/**
 * Finds {@code "term" - definition;} constructs inside the content of a definitional provision.
 */
public class DefinitionExtractor {

    static final int MAX_TERM_LENGTH = 80;
    static final int MIN_DEFINITION_LENGTH = 6;

    /**
     * Collects every candidate of every pattern in the set, then adds the acceptable ones to
     * {@code target} in match order.
     *
     * @return number of definitions added
     */
    public int extractInto(String content,
                           String sourceProvision,
                           DefinitionPatternSet patternSet,
                           DefinitionSet target) {
        Objects.requireNonNull(patternSet, "patternSet");
        Objects.requireNonNull(target, "target");
        if (content == null || content.isEmpty()) {
            return 0;
        }

        List<Definition> candidates = new ArrayList<>();
        for (Pattern pattern : patternSet.patterns()) {
            for (MatchResult match : PatternMatches.of(pattern, content)) {
                toDefinition(match, sourceProvision).ifPresent(candidates::add);
            }
        }

        int added = 0;
        for (Definition candidate : candidates) {
            if (target.add(candidate)) {
                added++;
            }
        }
        return added;
    }

    private Optional<Definition> toDefinition(MatchResult match, String sourceProvision) {
        String term = TextNormalizer.collapseWhitespace(match.group(1));
        String definition = TextNormalizer.collapseWhitespace(match.group(2));
        if (definition.endsWith(";")) {
            definition = definition.substring(0, definition.length() - 1).trim();
        }
        if (term.isEmpty() || term.length() > MAX_TERM_LENGTH || definition.length() < MIN_DEFINITION_LENGTH) {
            return Optional.empty();
        }
        return Optional.of(new Definition(term, definition, Optional.ofNullable(sourceProvision)));
    }
}
