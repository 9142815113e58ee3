package com.vgen.dialogue.model;

import java.util.Objects;

/** Identity of a dialogue node: owning sequence id plus message id. */
public record NodeAddress(String sequenceId, int messageId) {

    public NodeAddress {
        Objects.requireNonNull(sequenceId, "sequenceId");
    }

    @Override
    public String toString() {
        return sequenceId + ":" + messageId;
    }
}
