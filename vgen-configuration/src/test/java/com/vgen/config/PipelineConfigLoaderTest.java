package com.vgen.config;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class PipelineConfigLoaderTest {

    @TempDir
    Path tempDir;

    @Test
    void load_missingFileWritesSampleAndReturnsDefaults() {
        Path path = tempDir.resolve("tool").resolve("variants_config.yaml");

        PipelineConfig config = PipelineConfigLoader.load(path);

        assertTrue(Files.exists(path));
        assertEquals(PipelineConfig.defaults().toSnapshot(), config.toSnapshot());
        assertTrue(config.isMockGeneration());
        assertEquals(List.of("friendly", "concise", "supportive"), config.getStyle().getTone());
    }

    @Test
    void load_yamlOverridesAndMissingSectionsDefault() throws Exception {
        Path path = tempDir.resolve("cfg.yaml");
        Files.writeString(path, """
                provider:
                  name: openai-chat
                  mock: false
                gen:
                  num_variants: 3
                  dedupe_threshold: 0.5
                io:
                  dry_run: false
                """);

        PipelineConfig config = PipelineConfigLoader.load(path);

        assertEquals("openai-chat", config.getProvider().getName());
        assertEquals("my-model", config.getProvider().getModel());
        assertEquals(3, config.getGen().getNumVariants());
        assertEquals(0.5, config.getGen().getDedupeThreshold(), 1e-9);
        assertEquals(90, config.getGen().getMaxCharsPerBubble());
        assertFalse(config.isMockGeneration());
        assertEquals(4, config.getContext().getHistoryBubbles());
        assertEquals(2000, config.getRateLimit().minIntervalMs());
    }

    @Test
    void load_jsonDocument() throws Exception {
        Path path = tempDir.resolve("cfg.json");
        Files.writeString(path, """
                {"safety": {"blocklist": ["darn"], "pii_regexes": ["\\\\d{3}-\\\\d{4}"]},
                 "rate_limit": {"rpm": 0, "retry_count": 5}}
                """);

        PipelineConfig config = PipelineConfigLoader.load(path);

        assertEquals(List.of("darn"), config.getSafety().getBlocklist());
        assertEquals(List.of("\\d{3}-\\d{4}"), config.getSafety().getPiiRegexes());
        assertEquals(5, config.getRateLimit().getRetryCount());
        assertEquals(0, config.getRateLimit().minIntervalMs());
    }

    @Test
    void load_snapshotUsesOriginalKeyNames() throws Exception {
        Path path = tempDir.resolve("cfg.yaml");
        Files.writeString(path, "context:\n  history_bubbles: 6\n");

        Map<String, Object> snapshot = PipelineConfigLoader.load(path).toSnapshot();

        assertEquals(List.of("provider", "gen", "context", "style", "io", "rate_limit", "safety"),
                List.copyOf(snapshot.keySet()));
        assertEquals(6, ((Map<?, ?>) snapshot.get("context")).get("history_bubbles"));
    }

    @Test
    void load_malformedFileFails() throws Exception {
        Path path = tempDir.resolve("bad.yaml");
        Files.writeString(path, "gen:\n  num_variants: 3\n   oops: 1\n");

        assertThrows(ConfigParseException.class, () -> PipelineConfigLoader.load(path));
    }

    @Test
    void load_invalidPiiRegexFails() throws Exception {
        Path path = tempDir.resolve("cfg.json");
        Files.writeString(path, "{\"safety\": {\"pii_regexes\": [\"(\"]}}");

        ConfigParseException e = assertThrows(ConfigParseException.class, () -> PipelineConfigLoader.load(path));
        assertTrue(e.getMessage().contains("safety.pii_regexes"));
    }
}
