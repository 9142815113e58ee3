package com.vgen.dialogue.path;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.vgen.dialogue.model.NodeAddress;
import com.vgen.dialogue.model.NodeKind;

/**
 * One step of a resolved path. {@code selection} is set when this node was reached through an option of
 * the preceding CHOICE node.
 */
public record ResolvedPathNode(String sequenceId, int messageId, NodeKind kind, ChoiceSelection selection) {

    @JsonIgnore
    public NodeAddress address() {
        return new NodeAddress(sequenceId, messageId);
    }
}
