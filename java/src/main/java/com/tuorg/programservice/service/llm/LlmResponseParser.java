package com.tuorg.programservice.service.llm;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.tuorg.programservice.exception.ExerciseSelectionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Turns a raw chat-completions body into an {@link ExerciseSelectionResponse}.
 * Models wrap JSON in fences, prepend prose or get cut off mid-object, so the
 * assistant text goes through several cleanup passes before mapping.
 */
public class LlmResponseParser {

    private final Logger log = LoggerFactory.getLogger(LlmResponseParser.class);

    private static final List<String> TEXT_PATHS = List.of(
            "/choices/0/message/content",
            "/choices/0/message/content/0",
            "/choices/0/text",
            "/outputs/0",
            "/output",
            "/response",
            "/choices/0/response",
            "/candidates/0/content/parts/0/text"
    );

    private static final Pattern FENCE = Pattern.compile("(?s)```(?:json)?\\s*(.*?)\\s*```");

    private final ObjectMapper mapper;

    public LlmResponseParser(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    public ExerciseSelectionResponse parse(String responseBody) {
        if (responseBody == null || responseBody.isBlank()) {
            throw new ExerciseSelectionException("LLM returned empty body");
        }
        String assistantText = extractAssistantText(responseBody);
        String cleaned = stripCodeFences(assistantText);
        if (cleaned == null || cleaned.isBlank()) {
            throw new ExerciseSelectionException("LLM returned empty content");
        }

        String json = extractFirstJsonBlock(cleaned);
        if (json == null) {
            if (looksLikeJson(cleaned)) {
                json = cleaned.trim();
            } else {
                String snippet = cleaned.length() > 200 ? cleaned.substring(0, 200) + "..." : cleaned;
                throw new ExerciseSelectionException("Could not extract JSON from LLM response: " + snippet);
            }
        }
        log.debug("LLM JSON candidate length={} chars", json.length());

        try {
            ExerciseSelectionResponse response = mapper.readValue(json, ExerciseSelectionResponse.class);
            if (response.getExercises() == null || response.getExercises().isEmpty()) {
                throw new ExerciseSelectionException("LLM response contains no exercises");
            }
            return response;
        } catch (JsonProcessingException e) {
            throw new ExerciseSelectionException("LLM response is not a valid selection: " + e.getOriginalMessage(), e);
        }
    }

    String extractAssistantText(String responseBody) {
        JsonNode root;
        try {
            root = mapper.readTree(responseBody);
        } catch (JsonProcessingException e) {
            // not an envelope; treat the body itself as the assistant text
            return responseBody;
        }
        for (String path : TEXT_PATHS) {
            JsonNode node = root.at(path);
            if (node.isMissingNode() || node.isNull()) continue;
            if (node.isTextual()) return node.asText();
            if (node.isArray()) {
                StringBuilder sb = new StringBuilder();
                for (JsonNode n : node) {
                    sb.append(n.isTextual() ? n.asText() : n.toString()).append("\n");
                }
                return sb.toString().trim();
            }
            return node.toString();
        }
        return responseBody;
    }

    static String stripCodeFences(String s) {
        if (s == null) return null;
        Matcher m = FENCE.matcher(s);
        if (m.find()) return m.group(1).trim();

        s = s.replaceAll("(?m)^```(?:json)?\\s*", "");
        s = s.replaceFirst("(?i)^\\s*json\\s*[:\\n]+", "");
        s = s.replaceAll("(?m)\\s*```\\s*$", "");
        return s.trim();
    }

    /**
     * First balanced object or array in {@code s}. A block truncated while
     * not inside a string is closed and kept if it then parses.
     */
    String extractFirstJsonBlock(String s) {
        if (s == null) return null;
        s = s.trim();

        int startObj = s.indexOf('{');
        int startArr = s.indexOf('[');
        if (startObj == -1 && startArr == -1) return null;

        int start = startObj == -1 ? startArr : (startArr == -1 ? startObj : Math.min(startObj, startArr));

        boolean inString = false;
        boolean escape = false;
        StringBuilder open = new StringBuilder();
        for (int i = start; i < s.length(); i++) {
            char c = s.charAt(i);
            if (escape) { escape = false; continue; }
            if (c == '\\') { escape = true; continue; }
            if (c == '"') { inString = !inString; continue; }
            if (inString) continue;
            if (c == '{' || c == '[') {
                open.append(c);
            } else if (c == '}' || c == ']') {
                if (open.length() == 0) return null;
                open.setLength(open.length() - 1);
                if (open.length() == 0) return s.substring(start, i + 1).trim();
            }
        }

        if (!inString && open.length() > 0) {
            StringBuilder repaired = new StringBuilder(s.substring(start).replaceAll("[,\\s]+$", ""));
            for (int k = open.length() - 1; k >= 0; k--) {
                repaired.append(open.charAt(k) == '{' ? '}' : ']');
            }
            String candidate = repaired.toString();
            try {
                mapper.readTree(candidate);
                return candidate;
            } catch (JsonProcessingException e) {
                log.debug("Truncated JSON could not be repaired: {}", e.getOriginalMessage());
                return null;
            }
        }
        return null;
    }

    static boolean looksLikeJson(String s) {
        String t = s == null ? "" : s.trim();
        return (t.startsWith("{") && t.endsWith("}")) || (t.startsWith("[") && t.endsWith("]"));
    }
}
