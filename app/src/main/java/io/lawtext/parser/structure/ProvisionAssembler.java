package io.lawtext.parser.structure;

import io.lawtext.parser.definition.DefinitionExtractor;
import io.lawtext.parser.definition.DefinitionPolicy;
import io.lawtext.parser.definition.DefinitionSet;
import io.lawtext.parser.model.Definition;
import io.lawtext.parser.model.Provision;
import io.lawtext.parser.text.TextNormalizer;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Turns section drafts into provisions: drops false positives, caps content and runs the
 * definition pass over the definitional sections.
 */
public class ProvisionAssembler {

    private static final Logger LOGGER = LoggerFactory.getLogger(ProvisionAssembler.class);

    public static final int MIN_CONTENT_LENGTH = 11;
    public static final int MAX_CONTENT_LENGTH = 8000;

    private final DefinitionExtractor definitionExtractor;

    public ProvisionAssembler() {
        this(new DefinitionExtractor());
    }

    public ProvisionAssembler(DefinitionExtractor definitionExtractor) {
        this.definitionExtractor = Objects.requireNonNull(definitionExtractor, "definitionExtractor");
    }

    public Assembly assemble(List<SectionDraft> drafts, DefinitionPolicy policy) {
        Objects.requireNonNull(drafts, "drafts");
        Objects.requireNonNull(policy, "policy");
        List<Provision> provisions = new ArrayList<>(drafts.size());
        DefinitionSet definitions = new DefinitionSet();
        int dropped = 0;

        for (SectionDraft draft : drafts) {
            // Drafts are normalized by their parsers; re-collapsing keeps the threshold honest.
            String content = TextNormalizer.collapseWhitespace(draft.content());
            if (content.length() < MIN_CONTENT_LENGTH) {
                dropped++;
                continue;
            }
            String ref = Provision.refFor(draft.section());
            provisions.add(new Provision(ref, draft.section(), draft.chapter(), draft.title(),
                    TextNormalizer.truncate(content, MAX_CONTENT_LENGTH)));
            if (policy.isDefinitional(draft.section())) {
                definitionExtractor.extractInto(content, ref, policy.patternSet(), definitions);
            }
        }

        if (dropped > 0) {
            LOGGER.debug("Dropped {} section candidates shorter than {} characters", dropped, MIN_CONTENT_LENGTH);
        }
        return new Assembly(List.copyOf(provisions), definitions.toList());
    }

    /**
     * Provisions in source order with the definitions found in them.
     */
    public record Assembly(List<Provision> provisions, List<Definition> definitions) {

        public Assembly {
            Objects.requireNonNull(provisions, "provisions");
            Objects.requireNonNull(definitions, "definitions");
        }
    }
}
