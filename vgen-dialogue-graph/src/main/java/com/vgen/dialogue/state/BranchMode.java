package com.vgen.dialogue.state;

/**
 * How CONDITIONAL_BRANCH nodes pick a route during path resolution.
 */
public enum BranchMode {
    /** Evaluate route conditions against the state variables; first match wins. */
    RESOLVE("resolve"),
    /** Ignore conditions and take the default route. */
    ALWAYS_DEFAULT("default");

    private final String value;

    BranchMode(String value) {
        this.value = value;
    }

    public String toValue() {
        return value;
    }

    /**
     * @throws IllegalArgumentException for values other than {@code resolve} and {@code default}
     */
    public static BranchMode fromValue(String value) {
        if (value == null || value.isBlank()) return RESOLVE;
        String normalized = value.trim();
        for (BranchMode m : values()) {
            if (m.value.equalsIgnoreCase(normalized) || m.name().equalsIgnoreCase(normalized)) return m;
        }
        throw new IllegalArgumentException("Unknown branch_mode '" + value + "' (expected resolve or default)");
    }
}
