package com.vgen.dialogue.state;

/** How a choice directive identifies the option to take. */
public enum SelectionMethod {
    /** Zero-based option position. */
    BY_INDEX("index"),
    /** Exact display text. */
    BY_TEXT("text"),
    BY_CONTENT_KEY("content_key");

    private final String value;

    SelectionMethod(String value) {
        this.value = value;
    }

    public String toValue() {
        return value;
    }

    public static SelectionMethod fromValue(String value) {
        if (value != null) {
            String normalized = value.trim();
            for (SelectionMethod m : values()) {
                if (m.value.equalsIgnoreCase(normalized) || m.name().equalsIgnoreCase(normalized)) return m;
            }
        }
        throw new IllegalArgumentException("Unknown choice selection '" + value + "' (expected index, text or content_key)");
    }
}
