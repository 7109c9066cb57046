package com.bko.conductor.orchestration.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import static com.bko.conductor.orchestration.OrchestrationConstants.DEFAULT_SYNTHESIS_HINT;

/**
 * Salvages JSON objects from model output: code fences, leading prose and truncated arrays.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class JsonProcessingService {

    public static final String TASKS_KEY = "tasks";
    public static final String QUESTIONS_KEY = "questions";

    private static final String FENCE = "```";

    private final ObjectMapper objectMapper;

    /**
     * Extracts a JSON object from raw model output. Tries the trimmed text as-is (minus a fence that wraps
     * the whole answer), then the span between the first {@code '{'} and the last {@code '}'}, then
     * truncation recovery on {@code arrayKey}. Fences inside string values are left alone.
     *
     * @return the parsed object, or {@code null} if nothing could be salvaged
     */
    @Nullable
    public JsonNode extractJson(@Nullable String raw, @Nullable String arrayKey) {
        if (!StringUtils.hasText(raw)) {
            return null;
        }
        String cleaned = stripOuterFence(raw.trim());

        JsonNode direct = readObject(cleaned);
        if (direct != null) {
            return direct;
        }

        int start = cleaned.indexOf('{');
        int end = cleaned.lastIndexOf('}');
        if (start >= 0 && end > start) {
            JsonNode sliced = readObject(cleaned.substring(start, end + 1));
            if (sliced != null) {
                return sliced;
            }
        }

        if (start >= 0 && arrayKey != null) {
            return recoverTruncated(cleaned.substring(start), arrayKey);
        }
        return null;
    }

    /**
     * Closes a JSON object whose {@code arrayKey} array was cut off mid-element. Keeps every element
     * object that was fully closed and drops the rest.
     *
     * @return the repaired object, or {@code null} if no element object closed before the cut
     */
    @Nullable
    public JsonNode recoverTruncated(String truncated, String arrayKey) {
        int keyIndex = truncated.indexOf("\"" + arrayKey + "\"");
        if (keyIndex < 0) {
            return null;
        }
        int arrayStart = truncated.indexOf('[', keyIndex);
        if (arrayStart < 0) {
            return null;
        }

        int lastCompleteEnd = -1;
        int depth = 0;
        boolean inString = false;
        boolean escape = false;
        for (int i = arrayStart + 1; i < truncated.length(); i++) {
            char ch = truncated.charAt(i);
            if (escape) {
                escape = false;
                continue;
            }
            if (ch == '\\') {
                escape = true;
                continue;
            }
            if (ch == '"') {
                inString = !inString;
                continue;
            }
            if (inString) {
                continue;
            }
            if (ch == '{') {
                depth++;
            } else if (ch == '}') {
                depth--;
                if (depth == 0) {
                    lastCompleteEnd = i;
                }
            }
        }
        if (lastCompleteEnd < 0) {
            return null;
        }

        String repaired = truncated.substring(0, lastCompleteEnd + 1) + closerFor(arrayKey);
        JsonNode recovered = readObject(repaired);
        if (recovered != null) {
            log.warn("Salvaged truncated JSON: recovered {} complete '{}' entries.",
                    recovered.path(arrayKey).size(), arrayKey);
        }
        return recovered;
    }

    /**
     * Removes a fence only when the answer opens with one. The closing fence is optional so truncated
     * answers still reach recovery.
     */
    static String stripOuterFence(String text) {
        if (!text.startsWith(FENCE)) {
            return text;
        }
        int lineEnd = text.indexOf('\n');
        String body = lineEnd < 0 ? text.substring(FENCE.length()) : text.substring(lineEnd + 1);
        body = body.trim();
        if (body.endsWith(FENCE)) {
            body = body.substring(0, body.length() - FENCE.length()).trim();
        }
        return body;
    }

    @Nullable
    private JsonNode readObject(String candidate) {
        try {
            JsonNode node = objectMapper.readTree(candidate);
            return node != null && node.isObject() ? node : null;
        } catch (JsonProcessingException ex) {
            return null;
        }
    }

    private static String closerFor(String arrayKey) {
        if (TASKS_KEY.equals(arrayKey)) {
            return "], \"synthesisHint\": \"" + DEFAULT_SYNTHESIS_HINT + "\" }";
        }
        return "] }";
    }
}
