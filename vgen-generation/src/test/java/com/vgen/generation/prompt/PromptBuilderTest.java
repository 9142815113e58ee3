package com.vgen.generation.prompt;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.vgen.config.PipelineConfig;
import com.vgen.config.settings.ContextSettings;
import com.vgen.config.settings.GenerationSettings;
import com.vgen.config.settings.IoSettings;
import com.vgen.config.settings.ProviderSettings;
import com.vgen.config.settings.RateLimitSettings;
import com.vgen.config.settings.SafetySettings;
import com.vgen.config.settings.StyleSettings;
import com.vgen.dialogue.context.ContextTurn;
import com.vgen.dialogue.model.NodeKind;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class PromptBuilderTest {

    private static PipelineConfig config(StyleSettings style, int maxExemplars) {
        return new PipelineConfig(ProviderSettings.DEFAULTS, GenerationSettings.DEFAULTS,
                new ContextSettings(4, true, maxExemplars, 2), style, IoSettings.DEFAULTS,
                RateLimitSettings.DEFAULTS, SafetySettings.DEFAULTS);
    }

    @Test
    void build_serializesTaskContextAndExemplars() {
        PromptBuilder builder = new PromptBuilder(config(StyleSettings.DEFAULTS, 2));
        List<ContextTurn> context = List.of(
                new ContextTurn("onboarding", 1, "bot", NodeKind.MESSAGE, "contentKey:bot.greet.hello", List.of("Hi!")),
                new ContextTurn("onboarding", 2, "user", NodeKind.CHOICE, "Sure", List.of()));

        GenerationPrompt prompt = builder.build("bot.greet.morning", "content/bot/greet/morning.txt", "Morning!",
                context, List.of("e1", "e2", "e3"), List.of("Good morning!"));
        JsonNode json = new ObjectMapper().valueToTree(prompt);

        assertEquals("bot.greet.morning", json.path("task").path("contentKey").asText());
        assertEquals("Morning!", json.path("task").path("defaultText").asText());
        assertEquals(8, json.path("task").path("constraints").path("numVariants").asInt());
        assertEquals(90, json.path("task").path("constraints").path("maxCharsPerBubble").asInt());
        assertEquals(2, json.path("context").size());
        assertEquals("CHOICE", json.path("context").get(1).path("kind").asText());
        assertTrue(json.path("context").get(1).path("examples").isMissingNode());
        assertEquals(2, json.path("exemplars").path("siblingExemplars").size());
        assertEquals("Good morning!", json.path("exemplars").path("existingVariants").get(0).asText());
        assertEquals("json", json.path("output_format").path("type").asText());
    }

    @Test
    void build_omitsBlankDefaultText() {
        GenerationPrompt prompt = new PromptBuilder(config(StyleSettings.DEFAULTS, 10))
                .build("bot.greet.morning", "content/bot/greet/morning.txt", "  ", List.of(), List.of(), List.of());
        JsonNode json = new ObjectMapper().valueToTree(prompt);

        assertTrue(json.path("task").path("defaultText").isMissingNode());
    }

    @Test
    void systemInstruction_followsStyleRules() {
        String relaxed = new PromptBuilder(config(new StyleSettings(List.of(), false, false, false), 10))
                .systemInstruction();
        assertTrue(relaxed.contains("do not use |||"));
        assertFalse(relaxed.contains("emojis"));
        assertFalse(relaxed.contains("placeholders"));

        String strict = new PromptBuilder(config(StyleSettings.DEFAULTS, 10)).systemInstruction();
        assertTrue(strict.contains("Do not use emojis"));
        assertTrue(strict.contains("{user.name}"));
        assertTrue(strict.contains("Tone: friendly, concise, supportive"));
    }
}
