package com.spendlens.backend.services.chunking;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.spendlens.backend.exceptions.SchemaValidationException;

/**
 * Pulls a JSON array of records out of free-form model output.
 *
 * Accepted shapes, tried in order: a fenced block holding an array or object, the first
 * bracketed span in the text, the whole text. An object is unwrapped through its
 * {@code transactions} or {@code results} field, otherwise read as a one-element array.
 */
public final class JsonArrayExtractor {

    private JsonArrayExtractor() {}

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private static final Pattern FIRST_ARRAY = Pattern.compile("\\[[\\s\\S]*\\]");

    /**
     * @throws SchemaValidationException when no array or object can be read
     */
    public static List<JsonNode> extract(String text) {
        if (text == null || text.isBlank()) {
            throw new SchemaValidationException("Empty model output");
        }
        String s = text.trim();

        if (s.contains("```")) {
            String[] parts = s.split("```");
            for (int i = 1; i < parts.length; i++) {
                String p = parts[i].trim();
                if (p.regionMatches(true, 0, "json", 0, 4)) {
                    p = p.substring(4).trim();
                }
                if (p.startsWith("[") || p.startsWith("{")) {
                    List<JsonNode> found = tryRead(p);
                    if (found != null) return found;
                }
            }
        }

        Matcher m = FIRST_ARRAY.matcher(s);
        if (m.find()) {
            List<JsonNode> found = tryRead(m.group());
            if (found != null) return found;
        }

        List<JsonNode> whole = tryRead(s);
        if (whole != null) return whole;

        throw new SchemaValidationException("No JSON array in model output (" + s.length() + " chars)");
    }

    private static List<JsonNode> tryRead(String json) {
        JsonNode node;
        try {
            node = MAPPER.readTree(json);
        } catch (JsonProcessingException e) {
            return null;
        }
        if (node == null) return null;
        if (node.isArray()) return elements(node);
        if (node.isObject()) {
            if (node.path("transactions").isArray()) return elements(node.get("transactions"));
            if (node.path("results").isArray()) return elements(node.get("results"));
            return List.of(node);
        }
        return null;
    }

    private static List<JsonNode> elements(JsonNode array) {
        List<JsonNode> out = new ArrayList<>(array.size());
        array.forEach(out::add);
        return out;
    }
}
