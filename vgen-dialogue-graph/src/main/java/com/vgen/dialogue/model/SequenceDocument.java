package com.vgen.dialogue.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/** Deserialized {@code sequences/<id>.json} document. */
@JsonIgnoreProperties(ignoreUnknown = true)
public final class SequenceDocument {

    private final String sequenceId;
    private final String name;
    private final String description;
    private final List<DialogueNode> messages;

    @JsonCreator
    public SequenceDocument(
            @JsonProperty("sequenceId") String sequenceId,
            @JsonProperty("name") String name,
            @JsonProperty("description") String description,
            @JsonProperty("messages") List<DialogueNode> messages) {
        this.sequenceId = sequenceId;
        this.name = name;
        this.description = description;
        this.messages = messages != null ? List.copyOf(messages) : List.of();
    }

    public String getSequenceId() {
        return sequenceId;
    }

    public String getName() {
        return name;
    }

    public String getDescription() {
        return description;
    }

    public List<DialogueNode> getMessages() {
        return messages;
    }
}
