package com.vgen.dialogue.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Route of a CONDITIONAL_BRANCH node: a condition (or the default flag) and a destination, either the
 * entry node of {@code sequenceId} or {@code nextMessageId} in the same sequence.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public final class BranchRoute {

    private final String condition;
    private final String sequenceId;
    private final Integer nextMessageId;
    private final boolean isDefault;

    @JsonCreator
    public BranchRoute(
            @JsonProperty("condition") String condition,
            @JsonProperty("sequenceId") String sequenceId,
            @JsonProperty("nextMessageId") Integer nextMessageId,
            @JsonProperty("default") Boolean isDefault) {
        this.condition = condition;
        this.sequenceId = sequenceId != null && !sequenceId.isBlank() ? sequenceId : null;
        this.nextMessageId = nextMessageId;
        this.isDefault = Boolean.TRUE.equals(isDefault);
    }

    public String getCondition() {
        return condition;
    }

    public String getSequenceId() {
        return sequenceId;
    }

    public Integer getNextMessageId() {
        return nextMessageId;
    }

    public boolean isDefault() {
        return isDefault;
    }
}
