package com.ai.tutoring.service;

import com.ai.tutoring.exception.ErrorCode;
import com.ai.tutoring.exception.GenerationFailedException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Pulls the JSON object out of a model reply. Models often wrap the object in
 * prose or a markdown code fence; everything from the first '{' to the last
 * '}' is parsed.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class JsonReplyReader {

    private final ObjectMapper objectMapper;

    /**
     * @param failureCode code of the exception thrown when no object can be read
     * @throws GenerationFailedException when the reply holds no parsable JSON object
     */
    public JsonNode readObject(String reply, ErrorCode failureCode) {
        int start = reply == null ? -1 : reply.indexOf('{');
        int end = reply == null ? -1 : reply.lastIndexOf('}');
        if (start < 0 || end <= start) {
            log.warn("AI response contained no JSON object ({} chars)", reply == null ? 0 : reply.length());
            throw new GenerationFailedException(failureCode,
                    "Could not parse JSON from AI response. The AI service may be unavailable.");
        }
        try {
            JsonNode node = objectMapper.readTree(reply.substring(start, end + 1));
            if (node == null || !node.isObject()) {
                throw new GenerationFailedException(failureCode, "AI response is not a JSON object");
            }
            return node;
        } catch (JsonProcessingException e) {
            log.warn("AI response JSON is malformed: {}", e.getOriginalMessage());
            throw new GenerationFailedException(failureCode, "AI response contained malformed JSON", e);
        }
    }

    /** Trimmed text of a string field, or null when absent, not a string, or blank. */
    public static String nonBlankText(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || !value.isTextual() || value.asText().isBlank())
            return null;
        return value.asText().trim();
    }
}
