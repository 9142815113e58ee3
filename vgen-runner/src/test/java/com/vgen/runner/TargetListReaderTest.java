package com.vgen.runner;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class TargetListReaderTest {

    @TempDir
    Path dir;

    @Test
    void read_skipsBlankLinesAndComments() throws Exception {
        Path file = dir.resolve("targets.txt");
        Files.writeString(file, """
                # onboarding
                onboarding_seq:1

                  onboarding_seq:12  
                daily:3
                """);

        assertEquals(List.of(new TargetRef("onboarding_seq", 1), new TargetRef("onboarding_seq", 12),
                new TargetRef("daily", 3)), TargetListReader.read(file));
    }

    @Test
    void read_rejectsMalformedLines() {
        assertThrows(InvalidTargetException.class, () -> TargetListReader.parse(List.of("onboarding_seq")));
        assertThrows(InvalidTargetException.class, () -> TargetListReader.parse(List.of("a:b:c")));
        assertThrows(InvalidTargetException.class, () -> TargetListReader.parse(List.of("seq:x")));
        assertThrows(InvalidTargetException.class, () -> TargetListReader.parse(List.of(":4")));
    }

    @Test
    void read_missingFileIsAnError() {
        assertThrows(InvalidTargetException.class, () -> TargetListReader.read(dir.resolve("nope.txt")));
    }
}
