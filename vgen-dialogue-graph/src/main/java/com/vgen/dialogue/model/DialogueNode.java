package com.vgen.dialogue.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * A message entry of a sequence document. Immutable; the owning sequence is attached with
 * {@link #inSequence(String)} when the document is indexed.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public final class DialogueNode {

    private final int id;
    private final MessageType type;
    private final String sender;
    private final String text;
    private final String contentKey;
    private final Integer nextMessageId;
    private final String sequenceId;
    private final boolean choiceFlag;
    private final List<ChoiceOption> choices;
    private final List<BranchRoute> routes;
    private final String owningSequence;

    @JsonCreator
    public DialogueNode(
            @JsonProperty("id") int id,
            @JsonProperty("type") MessageType type,
            @JsonProperty("sender") String sender,
            @JsonProperty("text") String text,
            @JsonProperty("contentKey") String contentKey,
            @JsonProperty("nextMessageId") Integer nextMessageId,
            @JsonProperty("sequenceId") String sequenceId,
            @JsonProperty("isChoice") Boolean isChoice,
            @JsonProperty("choices") List<ChoiceOption> choices,
            @JsonProperty("routes") List<BranchRoute> routes) {
        this(id, type, sender, text, contentKey, nextMessageId, sequenceId,
                Boolean.TRUE.equals(isChoice), choices, routes, null);
    }

    private DialogueNode(int id, MessageType type, String sender, String text, String contentKey,
                         Integer nextMessageId, String sequenceId, boolean choiceFlag,
                         List<ChoiceOption> choices, List<BranchRoute> routes, String owningSequence) {
        this.id = id;
        this.type = type != null ? type : MessageType.UNKNOWN;
        this.sender = sender != null && !sender.isBlank() ? sender : null;
        this.text = text;
        this.contentKey = contentKey != null && !contentKey.isBlank() ? contentKey.trim() : null;
        this.nextMessageId = nextMessageId;
        this.sequenceId = sequenceId != null && !sequenceId.isBlank() ? sequenceId : null;
        this.choiceFlag = choiceFlag;
        this.choices = choices != null ? List.copyOf(choices) : List.of();
        this.routes = routes != null ? List.copyOf(routes) : List.of();
        this.owningSequence = owningSequence;
    }

    /** Copy of this node owned by {@code owner}. */
    public DialogueNode inSequence(String owner) {
        return new DialogueNode(id, type, sender, text, contentKey, nextMessageId, sequenceId, choiceFlag,
                choices, routes, owner);
    }

    public int getId() {
        return id;
    }

    public MessageType getType() {
        return type;
    }

    /** Declared sender, or {@code null} when the document leaves it out. */
    public String getSender() {
        return sender;
    }

    /** {@code user} for user messages, otherwise the declared sender, defaulting to {@code bot}. */
    public String effectiveSender() {
        if (type == MessageType.USER) return "user";
        return sender != null ? sender : "bot";
    }

    public String getText() {
        return text;
    }

    public String getContentKey() {
        return contentKey;
    }

    public Integer getNextMessageId() {
        return nextMessageId;
    }

    /** Sequence named by the node itself (a jump target when it differs from the owner). */
    public String getSequenceId() {
        return sequenceId;
    }

    public List<ChoiceOption> getChoices() {
        return choices;
    }

    public List<BranchRoute> getRoutes() {
        return routes;
    }

    public String getOwningSequence() {
        return owningSequence;
    }

    public NodeAddress address() {
        return new NodeAddress(owningSequence != null ? owningSequence : "", id);
    }

    public NodeKind getKind() {
        if (type == MessageType.AUTOROUTE) return NodeKind.CONDITIONAL_BRANCH;
        if (type == MessageType.CHOICE || choiceFlag || !choices.isEmpty()) return NodeKind.CHOICE;
        if (type == MessageType.DATA_ACTION) return NodeKind.ACTION;
        if (sequenceId != null && !sequenceId.equals(owningSequence)) return NodeKind.CROSS_JUMP;
        return NodeKind.MESSAGE;
    }

    /** Whether the node carries something shown to the user, regardless of where it leads next. */
    public boolean isDisplayable() {
        if (type == MessageType.AUTOROUTE || type == MessageType.DATA_ACTION) return false;
        return (text != null && !text.isBlank()) || contentKey != null;
    }

    @Override
    public String toString() {
        return "DialogueNode{" + address() + ", kind=" + getKind() + "}";
    }
}
