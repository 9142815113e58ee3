package com.vgen.config.settings;

import com.vgen.config.ConfigValue;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public final class StyleSettings {

    public static final StyleSettings DEFAULTS =
            new StyleSettings(List.of("friendly", "concise", "supportive"), true, true, true);

    private final List<String> tone;
    private final boolean forbidEmojis;
    private final boolean allowPipes;
    private final boolean preservePlaceholders;

    public StyleSettings(List<String> tone, boolean forbidEmojis, boolean allowPipes, boolean preservePlaceholders) {
        this.tone = tone != null ? List.copyOf(tone) : List.of();
        this.forbidEmojis = forbidEmojis;
        this.allowPipes = allowPipes;
        this.preservePlaceholders = preservePlaceholders;
    }

    public static StyleSettings from(ConfigValue section) {
        return new StyleSettings(
                section.get("tone").asStringList(DEFAULTS.tone),
                section.get("forbid_emojis").asBoolean(DEFAULTS.forbidEmojis),
                section.get("allow_pipes").asBoolean(DEFAULTS.allowPipes),
                section.get("preserve_placeholders").asBoolean(DEFAULTS.preservePlaceholders));
    }

    public List<String> getTone() {
        return tone;
    }

    public boolean isForbidEmojis() {
        return forbidEmojis;
    }

    /** When false, lines containing the {@code |||} bubble separator are rejected. */
    public boolean isAllowPipes() {
        return allowPipes;
    }

    public boolean isPreservePlaceholders() {
        return preservePlaceholders;
    }

    public Map<String, Object> toSnapshot() {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("tone", tone);
        m.put("forbid_emojis", forbidEmojis);
        m.put("allow_pipes", allowPipes);
        m.put("preserve_placeholders", preservePlaceholders);
        return m;
    }
}
