package com.vgen.dialogue.content;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Phrasing files under the assets root, one phrasing per line. Reads ignore blank lines; writes only
 * append.
 */
public final class ContentCorpus {

    private static final Logger log = LoggerFactory.getLogger(ContentCorpus.class);

    private final Path assetsRoot;

    public ContentCorpus(Path assetsRoot) {
        this.assetsRoot = assetsRoot;
    }

    public Path getAssetsRoot() {
        return assetsRoot;
    }

    public Path resolve(ContentKey key) {
        return assetsRoot.resolve(key.toFilePath());
    }

    /** Trimmed non-empty lines of the key's file; empty when the file does not exist. */
    public List<String> readLines(ContentKey key) {
        return readLines(resolve(key));
    }

    /**
     * Lines from every {@code .txt} file in the key's directory (file name order), stopping at {@code max}.
     */
    public List<String> siblingLines(ContentKey key, int max) {
        Path dir = assetsRoot.resolve(key.siblingsDir());
        if (max <= 0 || !Files.isDirectory(dir)) {
            return List.of();
        }
        List<Path> files;
        try (Stream<Path> s = Files.list(dir)) {
            files = s.filter(p -> Files.isRegularFile(p) && p.getFileName().toString().endsWith(".txt"))
                    .sorted()
                    .collect(Collectors.toList());
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to list " + dir, e);
        }
        List<String> out = new ArrayList<>();
        for (Path file : files) {
            for (String line : readLines(file)) {
                out.add(line);
                if (out.size() >= max) {
                    return out;
                }
            }
        }
        return out;
    }

    /** Appends {@code lines} to the key's file, creating it (and its directories) when missing. */
    public Path append(ContentKey key, List<String> lines) {
        Path file = resolve(key);
        if (lines.isEmpty()) {
            return file;
        }
        StringBuilder sb = new StringBuilder();
        try {
            Files.createDirectories(file.getParent());
            if (Files.exists(file) && Files.size(file) > 0 && !endsWithNewline(file)) {
                sb.append('\n');
            }
            for (String line : lines) {
                sb.append(line).append('\n');
            }
            Files.writeString(file, sb.toString(), StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE, StandardOpenOption.APPEND);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to append to " + file, e);
        }
        log.info("Appended {} line(s) to {}", lines.size(), file);
        return file;
    }

    private static boolean endsWithNewline(Path file) throws IOException {
        byte[] bytes = Files.readAllBytes(file);
        return bytes.length > 0 && bytes[bytes.length - 1] == '\n';
    }

    private static List<String> readLines(Path file) {
        if (!Files.isRegularFile(file)) {
            return List.of();
        }
        try {
            List<String> out = new ArrayList<>();
            for (String line : Files.readAllLines(file, StandardCharsets.UTF_8)) {
                String s = line.trim();
                if (!s.isEmpty()) {
                    out.add(s);
                }
            }
            return out;
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read " + file, e);
        }
    }
}
