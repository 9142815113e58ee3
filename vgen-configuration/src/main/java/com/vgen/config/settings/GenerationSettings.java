package com.vgen.config.settings;

import com.vgen.config.ConfigValue;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Sampling parameters and the structural limits applied to each generated line.
 */
public final class GenerationSettings {

    public static final GenerationSettings DEFAULTS = new GenerationSettings(8, 0.7, 0.9, 3, 90, 0.82);

    private final int numVariants;
    private final double temperature;
    private final double topP;
    private final int maxBubblesPerLine;
    private final int maxCharsPerBubble;
    private final double dedupeThreshold;

    public GenerationSettings(int numVariants, double temperature, double topP,
                              int maxBubblesPerLine, int maxCharsPerBubble, double dedupeThreshold) {
        this.numVariants = numVariants;
        this.temperature = temperature;
        this.topP = topP;
        this.maxBubblesPerLine = maxBubblesPerLine;
        this.maxCharsPerBubble = maxCharsPerBubble;
        this.dedupeThreshold = dedupeThreshold;
    }

    public static GenerationSettings from(ConfigValue section) {
        return new GenerationSettings(
                section.get("num_variants").asInt(DEFAULTS.numVariants),
                section.get("temperature").asDouble(DEFAULTS.temperature),
                section.get("top_p").asDouble(DEFAULTS.topP),
                section.get("max_bubbles_per_line").asInt(DEFAULTS.maxBubblesPerLine),
                section.get("max_chars_per_bubble").asInt(DEFAULTS.maxCharsPerBubble),
                section.get("dedupe_threshold").asDouble(DEFAULTS.dedupeThreshold));
    }

    public int getNumVariants() {
        return numVariants;
    }

    public double getTemperature() {
        return temperature;
    }

    public double getTopP() {
        return topP;
    }

    public int getMaxBubblesPerLine() {
        return maxBubblesPerLine;
    }

    public int getMaxCharsPerBubble() {
        return maxCharsPerBubble;
    }

    /** Token-set Jaccard similarity at or above which a candidate counts as a near duplicate. */
    public double getDedupeThreshold() {
        return dedupeThreshold;
    }

    public Map<String, Object> toSnapshot() {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("num_variants", numVariants);
        m.put("temperature", temperature);
        m.put("top_p", topP);
        m.put("max_bubbles_per_line", maxBubblesPerLine);
        m.put("max_chars_per_bubble", maxCharsPerBubble);
        m.put("dedupe_threshold", dedupeThreshold);
        return m;
    }
}
