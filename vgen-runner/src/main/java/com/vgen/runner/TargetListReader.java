package com.vgen.runner;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads a target list: one {@code sequenceId:messageId} per line; blank lines and lines starting with
 * {@code #} are skipped.
 */
public final class TargetListReader {

    private TargetListReader() {
    }

    public static List<TargetRef> read(Path file) {
        if (!Files.isRegularFile(file)) {
            throw new InvalidTargetException("Targets file not found: " + file);
        }
        try {
            return parse(Files.readAllLines(file, StandardCharsets.UTF_8));
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read " + file, e);
        }
    }

    static List<TargetRef> parse(List<String> lines) {
        List<TargetRef> targets = new ArrayList<>();
        for (String raw : lines) {
            String line = raw.trim();
            if (line.isEmpty() || line.startsWith("#")) {
                continue;
            }
            targets.add(parseTarget(line));
        }
        return targets;
    }

    static TargetRef parseTarget(String line) {
        String[] parts = line.split(":", -1);
        if (parts.length != 2 || parts[0].isBlank()) {
            throw new InvalidTargetException("Invalid target line (expected seq:msg): " + line);
        }
        try {
            return new TargetRef(parts[0].trim(), Integer.parseInt(parts[1].trim()));
        } catch (NumberFormatException e) {
            throw new InvalidTargetException("Invalid message id in line: " + line);
        }
    }
}
