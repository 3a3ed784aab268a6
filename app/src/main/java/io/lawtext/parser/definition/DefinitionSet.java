package io.lawtext.parser.definition;

import io.lawtext.parser.model.Definition;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Per-document accumulator of definitions keyed by term; the first definition of a term wins.
 */
public final class DefinitionSet {

    private final Map<String, Definition> byTerm = new LinkedHashMap<>();

    public boolean add(Definition definition) {
        Objects.requireNonNull(definition, "definition");
        return byTerm.putIfAbsent(definition.term(), definition) == null;
    }

    public boolean contains(String term) {
        return byTerm.containsKey(term);
    }

    public int size() {
        return byTerm.size();
    }

    public List<Definition> toList() {
        return List.copyOf(byTerm.values());
    }
}
