package com.vgen.dialogue.content;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ContentCorpusTest {

    @TempDir
    Path assets;

    @Test
    void readLines_skipsBlankLinesAndMissingFileIsEmpty() throws Exception {
        ContentCorpus corpus = new ContentCorpus(assets);
        ContentKey key = ContentKey.parse("bot.greet.morning");
        assertTrue(corpus.readLines(key).isEmpty());

        Files.createDirectories(assets.resolve("content/bot/greet"));
        Files.writeString(assets.resolve("content/bot/greet/morning.txt"), "Good morning!\n\n  Rise and shine  \n");

        assertEquals(List.of("Good morning!", "Rise and shine"), corpus.readLines(key));
    }

    @Test
    void siblingLines_readsTxtFilesInNameOrderUpToMax() throws Exception {
        Path dir = Files.createDirectories(assets.resolve("content/bot/greet"));
        Files.writeString(dir.resolve("morning.txt"), "m1\nm2\n");
        Files.writeString(dir.resolve("evening.txt"), "e1\n");
        Files.writeString(dir.resolve("notes.md"), "ignored\n");
        ContentCorpus corpus = new ContentCorpus(assets);

        assertEquals(List.of("e1", "m1", "m2"), corpus.siblingLines(ContentKey.parse("bot.greet.night"), 10));
        assertEquals(List.of("e1", "m1"), corpus.siblingLines(ContentKey.parse("bot.greet.night"), 2));
        assertTrue(corpus.siblingLines(ContentKey.parse("bot.other.x"), 10).isEmpty());
    }

    @Test
    void append_createsFileAndKeepsLineBoundaries() throws Exception {
        ContentCorpus corpus = new ContentCorpus(assets);
        ContentKey key = ContentKey.parse("bot.greet.morning");
        Path file = assets.resolve("content/bot/greet/morning.txt");
        Files.createDirectories(file.getParent());
        Files.writeString(file, "existing");

        corpus.append(key, List.of("one", "two ||| three"));

        assertEquals("existing\none\ntwo ||| three\n", Files.readString(file));
    }
}
