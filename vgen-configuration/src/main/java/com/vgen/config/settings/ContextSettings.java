package com.vgen.config.settings;

import com.vgen.config.ConfigValue;

import java.util.LinkedHashMap;
import java.util.Map;

public final class ContextSettings {

    public static final ContextSettings DEFAULTS = new ContextSettings(4, true, 10, 2);

    private final int historyBubbles;
    private final boolean includeSiblingExemplars;
    private final int maxExemplars;
    private final int examplesPerTurn;

    public ContextSettings(int historyBubbles, boolean includeSiblingExemplars, int maxExemplars, int examplesPerTurn) {
        this.historyBubbles = Math.max(0, historyBubbles);
        this.includeSiblingExemplars = includeSiblingExemplars;
        this.maxExemplars = Math.max(0, maxExemplars);
        this.examplesPerTurn = Math.max(0, examplesPerTurn);
    }

    public static ContextSettings from(ConfigValue section) {
        return new ContextSettings(
                section.get("history_bubbles").asInt(DEFAULTS.historyBubbles),
                section.get("include_sibling_exemplars").asBoolean(DEFAULTS.includeSiblingExemplars),
                section.get("max_exemplars").asInt(DEFAULTS.maxExemplars),
                section.get("examples_per_turn").asInt(DEFAULTS.examplesPerTurn));
    }

    /** Maximum number of displayable turns kept before the target. */
    public int getHistoryBubbles() {
        return historyBubbles;
    }

    public boolean isIncludeSiblingExemplars() {
        return includeSiblingExemplars;
    }

    public int getMaxExemplars() {
        return maxExemplars;
    }

    /** Existing phrasings attached to each context turn that references a content key. */
    public int getExamplesPerTurn() {
        return examplesPerTurn;
    }

    public Map<String, Object> toSnapshot() {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("history_bubbles", historyBubbles);
        m.put("include_sibling_exemplars", includeSiblingExemplars);
        m.put("max_exemplars", maxExemplars);
        m.put("examples_per_turn", examplesPerTurn);
        return m;
    }
}
