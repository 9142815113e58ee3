package com.vgen.dialogue.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * One option of a CHOICE node. When neither {@code nextMessageId} nor {@code sequenceId} is set the
 * option continues at the choice node's linear successor.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public final class ChoiceOption {

    private final String text;
    private final Integer nextMessageId;
    private final String sequenceId;
    private final String contentKey;
    private final Object value;

    @JsonCreator
    public ChoiceOption(
            @JsonProperty("text") String text,
            @JsonProperty("nextMessageId") Integer nextMessageId,
            @JsonProperty("sequenceId") String sequenceId,
            @JsonProperty("contentKey") String contentKey,
            @JsonProperty("value") Object value) {
        this.text = text != null ? text : "";
        this.nextMessageId = nextMessageId;
        this.sequenceId = sequenceId != null && !sequenceId.isBlank() ? sequenceId : null;
        this.contentKey = contentKey != null && !contentKey.isBlank() ? contentKey : null;
        this.value = value;
    }

    public String getText() {
        return text;
    }

    public Integer getNextMessageId() {
        return nextMessageId;
    }

    public String getSequenceId() {
        return sequenceId;
    }

    public String getContentKey() {
        return contentKey;
    }

    public Object getValue() {
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ChoiceOption that = (ChoiceOption) o;
        return text.equals(that.text)
                && Objects.equals(nextMessageId, that.nextMessageId)
                && Objects.equals(sequenceId, that.sequenceId)
                && Objects.equals(contentKey, that.contentKey)
                && Objects.equals(value, that.value);
    }

    @Override
    public int hashCode() {
        return Objects.hash(text, nextMessageId, sequenceId, contentKey, value);
    }
}
