package com.vgen.config;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Reads configuration-like documents (pipeline config, state specs) that may be JSON or the
 * indentation-based subset handled by {@link ConfigParser}. JSON is tried first when the text looks
 * like a JSON object; on a JSON syntax error the text is parsed as the indentation format instead.
 */
public final class ConfigDocuments {

    private static final Logger log = LoggerFactory.getLogger(ConfigDocuments.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private ConfigDocuments() {
    }

    public static ConfigValue read(Path path) {
        String text;
        try {
            text = Files.readString(path, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read " + path, e);
        }
        return parse(text, path.toString());
    }

    /**
     * @param text   document contents
     * @param origin label used in log and error messages (e.g. the file path)
     */
    public static ConfigValue parse(String text, String origin) {
        String trimmed = text == null ? "" : text.strip();
        if (trimmed.startsWith("{")) {
            try {
                return ConfigValue.fromPlain(MAPPER.readValue(trimmed, Object.class));
            } catch (JsonProcessingException e) {
                log.debug("{} is not valid JSON ({}); parsing as indented config", origin, e.getOriginalMessage());
            }
        }
        return ConfigParser.parse(text);
    }
}
