package io.lawtext.parser.structure;

import java.util.List;

/**
 * Recovers section boundaries, titles and chapter scope from one source convention.
 * Implementations never fail on malformed input; unrecognizable text yields an empty list.
 */
public interface StructureParser {

    List<SectionDraft> parse(String rawText);
}
