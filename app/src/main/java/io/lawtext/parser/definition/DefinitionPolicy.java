package io.lawtext.parser.definition;

import java.util.Objects;
import java.util.Set;

/**
 * Which section labels of a document hold definitions, and how their definitions are quoted.
 */
public record DefinitionPolicy(Set<String> definitionalSections, DefinitionPatternSet patternSet) {

    public static final DefinitionPolicy NONE = new DefinitionPolicy(Set.of(), DefinitionPatternSet.HTML);

    public DefinitionPolicy {
        definitionalSections = definitionalSections == null ? Set.of() : Set.copyOf(definitionalSections);
        Objects.requireNonNull(patternSet, "patternSet");
    }

    public static DefinitionPolicy of(DefinitionPatternSet patternSet, String... sections) {
        return new DefinitionPolicy(Set.of(sections), patternSet);
    }

    public boolean isDefinitional(String section) {
        return definitionalSections.contains(section);
    }
}
