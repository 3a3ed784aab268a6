package io.lawtext.parser.route;

import io.lawtext.parser.model.ActIdentity;
import io.lawtext.parser.model.SourceFormat;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Picks the parsing strategy for a document from its declared format and identity.
 * Identities without a dedicated strategy get the format's default.
 */
public class StrategyRouter {

    private static final Logger LOGGER = LoggerFactory.getLogger(StrategyRouter.class);

    static final String BASIC_LAW_PREFIX = "basic-law-";

    private static final Map<String, ParseStrategy> DEDICATED_HTML = Map.of(
            "privacy-protection-law-1981", ParseStrategy.PRIVACY_LAW_HTML);
    private static final Map<String, ParseStrategy> DEDICATED_TEXT = Map.of(
            "computer-law-1995", ParseStrategy.STATUTE_TEXT);

    public ParseStrategy route(ActIdentity identity, SourceFormat format) {
        Objects.requireNonNull(identity, "identity");
        Objects.requireNonNull(format, "format");
        ParseStrategy strategy = switch (format) {
            case HTML -> DEDICATED_HTML.getOrDefault(identity.id(), ParseStrategy.GENERIC_HTML);
            case TEXT -> routeText(identity.id());
        };
        LOGGER.debug("Routing {} ({}) to {}", identity.id(), format, strategy);
        return strategy;
    }

    private ParseStrategy routeText(String id) {
        ParseStrategy dedicated = DEDICATED_TEXT.get(id);
        if (dedicated != null) {
            return dedicated;
        }
        if (id.startsWith(BASIC_LAW_PREFIX)) {
            return ParseStrategy.BASIC_LAW_TEXT;
        }
        // Unlisted statutes share the statute state machine.
        return ParseStrategy.STATUTE_TEXT;
    }
}
