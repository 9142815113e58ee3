package com.vgen.generation.client;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Extracts candidate lines from the recognized backend response shapes:
 * <ul>
 *   <li>{@code {"variants": [...]}}</li>
 *   <li>{@code {"choices": [{"message": {"content": "..."}}]}} where content is JSON with
 *       {@code variants} (or a bare array), optionally inside a markdown code fence; other content
 *       yields one variant per non-empty line</li>
 *   <li>{@code {"choices": [{"text": "..."}]}}</li>
 *   <li>{@code {"message": {"content": "..."}}} (Ollama chat)</li>
 * </ul>
 */
final class ResponseParser {

    private static final Logger log = LoggerFactory.getLogger(ResponseParser.class);

    private final ObjectMapper mapper;

    ResponseParser(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    List<String> variants(JsonNode root) {
        JsonNode direct = root.path("variants");
        if (direct.isArray()) {
            return textItems(direct);
        }
        JsonNode choices = root.path("choices");
        if (choices.isArray() && choices.size() > 0) {
            JsonNode content = choices.get(0).path("message").path("content");
            if (content.isTextual()) {
                return fromContent(content.asText());
            }
            List<String> texts = new ArrayList<>();
            for (JsonNode choice : choices) {
                JsonNode text = choice.path("text");
                if (text.isTextual() && !text.asText().isBlank()) {
                    texts.add(text.asText().trim());
                }
            }
            if (!texts.isEmpty()) {
                return texts;
            }
        }
        JsonNode ollamaContent = root.path("message").path("content");
        if (ollamaContent.isTextual()) {
            return fromContent(ollamaContent.asText());
        }
        throw new GenerationException("Unrecognized response shape: " + abbreviate(root.toString()));
    }

    private List<String> fromContent(String content) {
        String body = stripCodeFence(content.trim());
        if (body.startsWith("{") || body.startsWith("[")) {
            try {
                JsonNode parsed = mapper.readTree(body);
                if (parsed.isArray()) {
                    return textItems(parsed);
                }
                if (parsed.path("variants").isArray()) {
                    return textItems(parsed.path("variants"));
                }
            } catch (JsonProcessingException e) {
                log.debug("Message content is not JSON ({}); splitting into lines", e.getOriginalMessage());
            }
        }
        List<String> lines = new ArrayList<>();
        for (String line : body.split("\\r?\\n")) {
            if (!line.isBlank()) {
                lines.add(line.trim());
            }
        }
        return lines;
    }

    private static List<String> textItems(JsonNode array) {
        List<String> out = new ArrayList<>();
        for (JsonNode item : array) {
            if (item.isValueNode() && !item.isNull()) {
                out.add(item.asText());
            }
        }
        return out;
    }

    static String stripCodeFence(String text) {
        if (!text.startsWith("```")) {
            return text;
        }
        int firstNewline = text.indexOf('\n');
        int closing = text.lastIndexOf("```");
        if (firstNewline < 0 || closing <= firstNewline) {
            return text;
        }
        return text.substring(firstNewline + 1, closing).trim();
    }

    private static String abbreviate(String s) {
        return s.length() > 200 ? s.substring(0, 200) + "..." : s;
    }
}
