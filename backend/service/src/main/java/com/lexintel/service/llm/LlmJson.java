package com.lexintel.service.llm;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.lexintel.core.util.JsonUtils;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Lenient extraction of JSON from model text: code fences are stripped, trailing commas
 * removed, and as a last resort the outermost object or array span is tried.
 */
public final class LlmJson {
    private static final ObjectMapper MAPPER = JsonUtils.objectMapper();
    private static final Pattern TRAILING_COMMA = Pattern.compile(",(\\s*[}\\]])");
    private static final Pattern OBJECT_SPAN = Pattern.compile("\\{[\\s\\S]*\\}");
    private static final Pattern ARRAY_SPAN = Pattern.compile("\\[[\\s\\S]*\\]");

    private LlmJson() {
    }

    public static JsonNode parse(String text) throws AnalysisParseException {
        if (text == null || text.isBlank()) {
            throw new AnalysisParseException("Model returned no text");
        }
        String cleaned = TRAILING_COMMA.matcher(stripFences(text).trim()).replaceAll("$1");
        Optional<JsonNode> whole = tryParse(cleaned);
        if (whole.isPresent()) {
            return whole.get();
        }
        for (Pattern span : new Pattern[] {OBJECT_SPAN, ARRAY_SPAN}) {
            Matcher matcher = span.matcher(cleaned);
            if (matcher.find()) {
                Optional<JsonNode> partial = tryParse(matcher.group());
                if (partial.isPresent()) {
                    return partial.get();
                }
            }
        }
        String preview = cleaned.length() > 200 ? cleaned.substring(0, 200) + "..." : cleaned;
        throw new AnalysisParseException("Model output is not valid JSON: " + preview);
    }

    static String stripFences(String text) {
        int jsonFence = text.indexOf("```json");
        if (jsonFence >= 0) {
            return untilFence(text.substring(jsonFence + "```json".length()));
        }
        int fence = text.indexOf("```");
        if (fence >= 0) {
            return untilFence(text.substring(fence + 3));
        }
        return text;
    }

    private static String untilFence(String rest) {
        int end = rest.indexOf("```");
        return end >= 0 ? rest.substring(0, end) : rest;
    }

    private static Optional<JsonNode> tryParse(String candidate) {
        if (candidate.isBlank()) {
            return Optional.empty();
        }
        try {
            JsonNode node = MAPPER.readTree(candidate);
            return node == null || node.isMissingNode() || !node.isContainerNode() ? Optional.empty() : Optional.of(node);
        } catch (JsonProcessingException e) {
            return Optional.empty();
        }
    }
}
