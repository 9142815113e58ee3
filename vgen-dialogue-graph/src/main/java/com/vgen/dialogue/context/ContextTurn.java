package com.vgen.dialogue.context;

import com.vgen.dialogue.model.NodeKind;

import java.util.List;

/**
 * A displayable turn preceding the target. {@code reference} is the literal text or
 * {@code contentKey:<key>}; {@code examples} are existing phrasings of that key.
 */
public record ContextTurn(String sequenceId, int messageId, String sender, NodeKind kind, String reference,
                          List<String> examples) {

    public static final String CONTENT_KEY_PREFIX = "contentKey:";

    public ContextTurn {
        examples = examples != null ? List.copyOf(examples) : List.of();
    }
}
