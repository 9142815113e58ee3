package com.vgen.generation.prompt;

import com.fasterxml.jackson.annotation.JsonValue;
import com.vgen.dialogue.context.ContextTurn;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Structured generation request for one content key. Serializes (and is sent) as
 * {@code {system, task, context, exemplars, output_format}}.
 */
public final class GenerationPrompt {

    private final String system;
    private final String contentKey;
    private final String targetPath;
    private final String defaultText;
    private final Map<String, Object> constraints;
    private final List<ContextTurn> context;
    private final List<String> existingVariants;
    private final List<String> siblingExemplars;

    public GenerationPrompt(String system, String contentKey, String targetPath, String defaultText,
                            Map<String, Object> constraints, List<ContextTurn> context,
                            List<String> existingVariants, List<String> siblingExemplars) {
        this.system = system;
        this.contentKey = contentKey;
        this.targetPath = targetPath;
        this.defaultText = defaultText;
        this.constraints = constraints != null ? new LinkedHashMap<>(constraints) : Map.of();
        this.context = context != null ? List.copyOf(context) : List.of();
        this.existingVariants = existingVariants != null ? List.copyOf(existingVariants) : List.of();
        this.siblingExemplars = siblingExemplars != null ? List.copyOf(siblingExemplars) : List.of();
    }

    public String getSystem() {
        return system;
    }

    public String getContentKey() {
        return contentKey;
    }

    public String getTargetPath() {
        return targetPath;
    }

    /** Literal text of the target node, when the sequence declares one. */
    public String getDefaultText() {
        return defaultText;
    }

    public List<ContextTurn> getContext() {
        return context;
    }

    public List<String> getExistingVariants() {
        return existingVariants;
    }

    public List<String> getSiblingExemplars() {
        return siblingExemplars;
    }

    @JsonValue
    public Map<String, Object> toMap() {
        Map<String, Object> task = new LinkedHashMap<>();
        task.put("contentKey", contentKey);
        task.put("targetPath", targetPath);
        if (defaultText != null && !defaultText.isBlank()) {
            task.put("defaultText", defaultText);
        }
        task.put("constraints", constraints);

        List<Map<String, Object>> turns = context.stream().map(t -> {
            Map<String, Object> m = new LinkedHashMap<>();
            m.put("sender", t.sender());
            m.put("kind", t.kind().name());
            m.put("text", t.reference());
            if (!t.examples().isEmpty()) {
                m.put("examples", t.examples());
            }
            return m;
        }).toList();

        Map<String, Object> exemplars = new LinkedHashMap<>();
        exemplars.put("existingVariants", existingVariants);
        exemplars.put("siblingExemplars", siblingExemplars);

        Map<String, Object> out = new LinkedHashMap<>();
        out.put("system", system);
        out.put("task", task);
        out.put("context", turns);
        out.put("exemplars", exemplars);
        out.put("output_format", Map.of("type", "json", "schema", Map.of("variants", List.of("string"))));
        return out;
    }
}
