package com.vgen.generation.prompt;

import com.vgen.config.settings.ContextSettings;
import com.vgen.dialogue.content.ContentCorpus;
import com.vgen.dialogue.content.ContentKey;

import java.util.List;

/**
 * Existing phrasings from the target key's directory, used as style references in the prompt.
 */
public final class ExemplarCollector {

    private final ContentCorpus corpus;
    private final ContextSettings settings;

    public ExemplarCollector(ContentCorpus corpus, ContextSettings settings) {
        this.corpus = corpus;
        this.settings = settings;
    }

    /** Up to {@code context.max_exemplars} sibling lines; empty when sibling exemplars are disabled. */
    public List<String> collect(ContentKey key) {
        if (!settings.isIncludeSiblingExemplars()) {
            return List.of();
        }
        return List.copyOf(corpus.siblingLines(key, settings.getMaxExemplars()));
    }
}
