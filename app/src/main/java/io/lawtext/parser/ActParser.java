package io.lawtext.parser;

import io.lawtext.parser.model.ActIdentity;
import io.lawtext.parser.model.ParsedAct;
import io.lawtext.parser.model.SourceFormat;
import io.lawtext.parser.route.ParseStrategy;
import io.lawtext.parser.route.ParserRegistry;
import io.lawtext.parser.route.StrategyRouter;
import io.lawtext.parser.structure.ProvisionAssembler;
import io.lawtext.parser.structure.SectionDraft;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * Converts the raw text of one act into its structured form.
 * <p>
 * Parsing is a pure function of its inputs: it performs no I/O and never fails on malformed text.
 * Text without recognizable structure yields an act with no provisions; deciding what to do with
 * such a result is left to the caller.
 */
public class ActParser {

    private static final Logger LOGGER = LoggerFactory.getLogger(ActParser.class);

    static final String MDC_ACT_ID = "actId";

    private final StrategyRouter router;
    private final ParserRegistry registry;
    private final ProvisionAssembler assembler;

    public ActParser() {
        this(new StrategyRouter(), ParserRegistry.defaults(), new ProvisionAssembler());
    }

    public ActParser(StrategyRouter router, ParserRegistry registry, ProvisionAssembler assembler) {
        this.router = Objects.requireNonNull(router, "router");
        this.registry = Objects.requireNonNull(registry, "registry");
        this.assembler = Objects.requireNonNull(assembler, "assembler");
    }

    public ParsedAct parse(String rawText, ActIdentity identity, SourceFormat format) {
        Objects.requireNonNull(identity, "identity");
        return parse(rawText, identity, router.route(identity, format));
    }

    public ParsedAct parse(String rawText, ActIdentity identity, ParseStrategy strategy) {
        Objects.requireNonNull(identity, "identity");
        Objects.requireNonNull(strategy, "strategy");
        MDC.put(MDC_ACT_ID, identity.id());
        try {
            List<SectionDraft> drafts = registry.select(strategy).parse(rawText == null ? "" : rawText);
            ProvisionAssembler.Assembly assembly = assembler.assemble(drafts, strategy.definitionPolicy());
            LOGGER.info("Parsed {} with {}: {} provisions, {} definitions",
                    identity.id(), strategy, assembly.provisions().size(), assembly.definitions().size());
            return new ParsedAct(identity, Optional.empty(), assembly.provisions(), assembly.definitions());
        } finally {
            MDC.remove(MDC_ACT_ID);
        }
    }

    public StrategyRouter router() {
        return router;
    }
}
