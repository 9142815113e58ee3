package com.vgen.generation.prompt;

import com.vgen.config.settings.ContextSettings;
import com.vgen.dialogue.content.ContentCorpus;
import com.vgen.dialogue.content.ContentKey;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ExemplarCollectorTest {

    @TempDir
    Path assets;

    @Test
    void collect_readsSiblingFilesUpToMaxExemplars() throws Exception {
        Path dir = Files.createDirectories(assets.resolve("content/bot/greet"));
        Files.writeString(dir.resolve("evening.txt"), "Good evening\nNight owl?\n");
        Files.writeString(dir.resolve("morning.txt"), "Rise and shine\n");

        ExemplarCollector collector = new ExemplarCollector(new ContentCorpus(assets), new ContextSettings(4, true, 2, 2));

        assertEquals(List.of("Good evening", "Night owl?"), collector.collect(ContentKey.parse("bot.greet.morning")));
    }

    @Test
    void collect_returnsNothingWhenDisabled() throws Exception {
        Path dir = Files.createDirectories(assets.resolve("content/bot/greet"));
        Files.writeString(dir.resolve("evening.txt"), "Good evening\n");

        ExemplarCollector collector = new ExemplarCollector(new ContentCorpus(assets), new ContextSettings(4, false, 10, 2));

        assertTrue(collector.collect(ContentKey.parse("bot.greet.morning")).isEmpty());
    }
}
