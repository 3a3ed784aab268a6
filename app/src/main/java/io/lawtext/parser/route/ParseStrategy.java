package io.lawtext.parser.route;

import io.lawtext.parser.definition.DefinitionPatternSet;
import io.lawtext.parser.definition.DefinitionPolicy;
import io.lawtext.parser.model.SourceFormat;

/**
 * Structural parsing strategy, resolved once per document by {@link StrategyRouter}.
 */
public enum ParseStrategy {

    /** UCI mirror of the Protection of Privacy Law; sections 3, 7 and 17C hold definitions. */
    PRIVACY_LAW_HTML(SourceFormat.HTML, DefinitionPolicy.of(DefinitionPatternSet.HTML, "3", "7", "17C")),

    /** Any other bold-heading HTML page. */
    GENERIC_HTML(SourceFormat.HTML, DefinitionPolicy.NONE),

    /** PDF-extracted statute text; section 1 holds definitions. */
    STATUTE_TEXT(SourceFormat.TEXT, DefinitionPolicy.of(DefinitionPatternSet.PLAIN_TEXT, "1")),

    /** PDF-extracted Basic Law text. */
    BASIC_LAW_TEXT(SourceFormat.TEXT, DefinitionPolicy.NONE);

    private final SourceFormat format;
    private final DefinitionPolicy definitionPolicy;

    ParseStrategy(SourceFormat format, DefinitionPolicy definitionPolicy) {
        this.format = format;
        this.definitionPolicy = definitionPolicy;
    }

    SourceFormat format() {
        return format;
    }

    public DefinitionPolicy definitionPolicy() {
        return definitionPolicy;
    }
}
