package io.lawtext.parser.route;

import io.lawtext.parser.html.HtmlStructureParser;
import io.lawtext.parser.plaintext.BasicLawTextParser;
import io.lawtext.parser.plaintext.StatuteTextParser;
import io.lawtext.parser.structure.StructureParser;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;

/**
 * Provides the structure parser implementing each strategy.
 */
public class ParserRegistry {

    private final Map<ParseStrategy, StructureParser> parsers;

    public ParserRegistry(StructureParser privacyLawHtml,
                          StructureParser genericHtml,
                          StructureParser statuteText,
                          StructureParser basicLawText) {
        Map<ParseStrategy, StructureParser> map = new EnumMap<>(ParseStrategy.class);
        map.put(ParseStrategy.PRIVACY_LAW_HTML, Objects.requireNonNull(privacyLawHtml, "privacyLawHtml"));
        map.put(ParseStrategy.GENERIC_HTML, Objects.requireNonNull(genericHtml, "genericHtml"));
        map.put(ParseStrategy.STATUTE_TEXT, Objects.requireNonNull(statuteText, "statuteText"));
        map.put(ParseStrategy.BASIC_LAW_TEXT, Objects.requireNonNull(basicLawText, "basicLawText"));
        this.parsers = map;
    }

    public static ParserRegistry defaults() {
        return new ParserRegistry(HtmlStructureParser.privacyLaw(), HtmlStructureParser.generic(),
                new StatuteTextParser(), new BasicLawTextParser());
    }

    public StructureParser select(ParseStrategy strategy) {
        return parsers.get(Objects.requireNonNull(strategy, "strategy"));
    }
}
