package com.vgen.dialogue.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Value of a message's {@code type} field in a sequence document. Absent or unrecognised values
 * deserialize as {@link #UNKNOWN}.
 */
public enum MessageType {
    BOT("bot"),
    USER("user"),
    CHOICE("choice"),
    TEXT_INPUT("textInput"),
    AUTOROUTE("autoroute"),
    DATA_ACTION("dataAction"),
    IMAGE("image"),
    UNKNOWN("unknown");

    private final String value;

    MessageType(String value) {
        this.value = value;
    }

    @JsonValue
    public String toValue() {
        return value;
    }

    @JsonCreator
    public static MessageType fromValue(String value) {
        if (value == null || value.isBlank()) return UNKNOWN;
        String normalized = value.trim();
        for (MessageType t : values()) {
            if (t != UNKNOWN && t.value.equalsIgnoreCase(normalized)) return t;
        }
        return UNKNOWN;
    }
}
