package com.vgen.generation.prompt;

import com.vgen.config.PipelineConfig;
import com.vgen.dialogue.context.ContextTurn;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Assembles the {@link GenerationPrompt} from configuration, context turns and exemplars.
 */
public final class PromptBuilder {

    private final PipelineConfig config;

    public PromptBuilder(PipelineConfig config) {
        this.config = config;
    }

    public GenerationPrompt build(String contentKey, String targetPath, String defaultText,
                                  List<ContextTurn> context, List<String> siblingExemplars,
                                  List<String> existingVariants) {
        Map<String, Object> constraints = new LinkedHashMap<>();
        constraints.put("numVariants", config.getGen().getNumVariants());
        constraints.put("maxBubblesPerLine", config.getGen().getMaxBubblesPerLine());
        constraints.put("maxCharsPerBubble", config.getGen().getMaxCharsPerBubble());
        constraints.put("preservePlaceholders", config.getStyle().isPreservePlaceholders());

        int maxExemplars = config.getContext().getMaxExemplars();
        List<String> exemplars = siblingExemplars.size() > maxExemplars
                ? siblingExemplars.subList(0, maxExemplars) : siblingExemplars;

        return new GenerationPrompt(systemInstruction(), contentKey, targetPath, defaultText, constraints,
                context, existingVariants, exemplars);
    }

    String systemInstruction() {
        StringBuilder sb = new StringBuilder();
        sb.append("You are a UX writer for a friendly accountability chat bot. ");
        sb.append("Write multiple alternative lines for the specified contentKey. ");
        if (config.getStyle().isPreservePlaceholders()) {
            sb.append("Keep placeholders like {user.name} exactly unchanged. ");
        }
        if (config.getStyle().isAllowPipes()) {
            sb.append("Use ||| to split long messages into multiple bubbles (max ")
                    .append(config.getGen().getMaxBubblesPerLine()).append("). ");
        } else {
            sb.append("Write each line as a single bubble; do not use |||. ");
        }
        if (config.getStyle().isForbidEmojis()) {
            sb.append("Do not use emojis. ");
        }
        if (!config.getStyle().getTone().isEmpty()) {
            sb.append("Tone: ").append(String.join(", ", config.getStyle().getTone())).append(". ");
        }
        sb.append("Concise, natural, no marketing fluff. ");
        sb.append("Respond with JSON: {\"variants\": [\"...\"]}.");
        return sb.toString();
    }
}
