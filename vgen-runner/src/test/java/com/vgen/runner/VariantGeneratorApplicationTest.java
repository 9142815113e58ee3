package com.vgen.runner;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class VariantGeneratorApplicationTest {

    @TempDir
    Path dir;

    private final ByteArrayOutputStream buffer = new ByteArrayOutputStream();
    private final PrintStream out = new PrintStream(buffer, true, StandardCharsets.UTF_8);

    private String output() {
        return buffer.toString(StandardCharsets.UTF_8);
    }

    @Test
    void run_helpPrintsUsage() {
        assertEquals(0, VariantGeneratorApplication.run(new String[]{"--help"}, Map.<String, String>of()::get, out));
        assertTrue(output().contains("Usage:"));
    }

    @Test
    void run_unknownArgumentIsUsageError() {
        assertEquals(2, VariantGeneratorApplication.run(new String[]{"--nope"}, Map.<String, String>of()::get, out));
        assertTrue(output().contains("Usage:"));
    }

    @Test
    void run_withoutTargetsIsUsageErrorAndWritesSampleConfig() {
        Path config = dir.resolve("cfg/variants_config.yaml");

        int code = VariantGeneratorApplication.run(new String[]{"--config", config.toString()},
                Map.<String, String>of()::get, out);

        assertEquals(2, code);
        assertTrue(Files.exists(config));
    }

    @Test
    void run_dryRunMockEndToEnd() throws Exception {
        Path assets = Files.createDirectories(dir.resolve("assets/sequences"));
        Files.writeString(assets.resolve("greet.json"), """
                {"sequenceId": "greet", "messages": [
                  {"id": 1, "type": "autoroute", "routes": [{"default": true, "nextMessageId": 2}]},
                  {"id": 2, "type": "bot", "contentKey": "bot.greet.morning"}
                ]}
                """);
        Path config = dir.resolve("config.yaml");
        Files.writeString(config, """
                provider:
                  mock: true
                io:
                  archive_dir: "%s"
                  dry_run: true
                """.formatted(dir.resolve("archive").toString().replace("\\", "/")));
        Map<String, String> env = Map.of("VGEN_CONFIG", config.toString(),
                "VGEN_ASSETS_DIR", dir.resolve("assets").toString());

        int code = VariantGeneratorApplication.run(new String[]{"--sequence", "greet", "--message", "2"}, env::get, out);

        assertEquals(0, code);
        assertTrue(output().contains("ok=1 fail=0"));
        assertTrue(Files.exists(dir.resolve("archive")));
    }

    @Test
    void run_failedTargetExitsOne() throws Exception {
        Path config = dir.resolve("config.yaml");
        Files.writeString(config, "io:\n  archive_dir: " + dir.resolve("archive").toString().replace("\\", "/") + "\n");
        Map<String, String> env = Map.of("VGEN_ASSETS_DIR", dir.resolve("assets").toString());

        int code = VariantGeneratorApplication.run(
                new String[]{"--config", config.toString(), "--sequence", "missing", "--message", "1"}, env::get, out);

        assertEquals(1, code);
        assertTrue(output().contains("ok=0 fail=1"));
        assertTrue(Files.exists(dir.resolve("archive")));
    }

    @Test
    void run_invalidPiiRegexFailsAtStartup() throws Exception {
        Path config = dir.resolve("config.json");
        Files.writeString(config, "{\"safety\": {\"pii_regexes\": [\"(\"]}}");
        Map<String, String> env = Map.of("VGEN_ASSETS_DIR", dir.resolve("assets").toString());

        int code = VariantGeneratorApplication.run(
                new String[]{"--config", config.toString(), "--sequence", "s", "--message", "1"}, env::get, out);

        assertEquals(1, code);
        assertFalse(output().contains("Done."));
    }
}
