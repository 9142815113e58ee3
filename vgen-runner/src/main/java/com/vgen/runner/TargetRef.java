package com.vgen.runner;

import com.vgen.dialogue.model.NodeAddress;

/** A node to generate variants for, written {@code sequenceId:messageId}. */
public record TargetRef(String sequenceId, int messageId) {

    public NodeAddress toAddress() {
        return new NodeAddress(sequenceId, messageId);
    }

    @Override
    public String toString() {
        return sequenceId + ":" + messageId;
    }
}
