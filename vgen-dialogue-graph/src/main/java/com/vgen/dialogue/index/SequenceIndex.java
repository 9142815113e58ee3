package com.vgen.dialogue.index;

import com.vgen.dialogue.model.DialogueNode;
import com.vgen.dialogue.model.NodeAddress;
import com.vgen.dialogue.model.SequenceDocument;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Node tables per sequence, loaded on first use and cached for the lifetime of the index. Nodes are
 * addressed by (sequence id, message id); successors are looked up here rather than linked directly.
 */
public final class SequenceIndex {

    private static final Logger log = LoggerFactory.getLogger(SequenceIndex.class);

    /** Message id of a sequence's entry node when present. */
    public static final int INITIAL_MESSAGE_ID = 1;

    private final SequenceSource source;
    private final Map<String, Optional<Map<Integer, DialogueNode>>> tables = new ConcurrentHashMap<>();

    public SequenceIndex(SequenceSource source) {
        this.source = source;
    }

    /** Whether a document exists for {@code sequenceId}. */
    public boolean hasSequence(String sequenceId) {
        return table(sequenceId).isPresent();
    }

    /**
     * Nodes of a sequence in declaration order.
     *
     * @throws SequenceLoadException when the sequence does not exist or is malformed
     */
    public Map<Integer, DialogueNode> nodes(String sequenceId) {
        return table(sequenceId).orElseThrow(() ->
                new SequenceLoadException("Sequence not found: " + sequenceId));
    }

    public Optional<DialogueNode> find(NodeAddress address) {
        return table(address.sequenceId()).map(t -> t.get(address.messageId()));
    }

    public Optional<DialogueNode> find(String sequenceId, int messageId) {
        return find(new NodeAddress(sequenceId, messageId));
    }

    /**
     * @throws SequenceLoadException when the sequence or the node does not exist
     */
    public DialogueNode require(NodeAddress address) {
        DialogueNode node = nodes(address.sequenceId()).get(address.messageId());
        if (node == null) {
            throw new SequenceLoadException("Message " + address.messageId()
                    + " not found in sequence " + address.sequenceId());
        }
        return node;
    }

    /**
     * Entry node of a sequence: message {@value #INITIAL_MESSAGE_ID} when declared, otherwise the first
     * declared message. Empty when the sequence is unknown or has no messages.
     */
    public Optional<NodeAddress> entryOf(String sequenceId) {
        Optional<Map<Integer, DialogueNode>> table = table(sequenceId);
        if (table.isEmpty() || table.get().isEmpty()) {
            return Optional.empty();
        }
        Map<Integer, DialogueNode> nodes = table.get();
        int id = nodes.containsKey(INITIAL_MESSAGE_ID) ? INITIAL_MESSAGE_ID : nodes.keySet().iterator().next();
        return Optional.of(new NodeAddress(sequenceId, id));
    }

    private Optional<Map<Integer, DialogueNode>> table(String sequenceId) {
        Optional<Map<Integer, DialogueNode>> cached = tables.get(sequenceId);
        if (cached != null) {
            return cached;
        }
        Optional<Map<Integer, DialogueNode>> loaded = source.load(sequenceId).map(doc -> index(sequenceId, doc));
        if (loaded.isEmpty()) {
            log.warn("Sequence {} not found", sequenceId);
        }
        tables.putIfAbsent(sequenceId, loaded);
        return tables.get(sequenceId);
    }

    private static Map<Integer, DialogueNode> index(String sequenceId, SequenceDocument doc) {
        if (doc.getSequenceId() != null && !doc.getSequenceId().equals(sequenceId)) {
            log.warn("Sequence document {} declares sequenceId '{}'; indexing under {}",
                    sequenceId, doc.getSequenceId(), sequenceId);
        }
        Map<Integer, DialogueNode> nodes = new LinkedHashMap<>();
        for (DialogueNode node : doc.getMessages()) {
            if (nodes.putIfAbsent(node.getId(), node.inSequence(sequenceId)) != null) {
                log.warn("Duplicate message id {} in sequence {}; keeping the first", node.getId(), sequenceId);
            }
        }
        return Collections.unmodifiableMap(nodes);
    }
}
