package org.example.quizgen.service.quiz;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectReader;
import org.springframework.stereotype.Component;

/**
 * Recovers the JSON array a provider wrapped in prose: everything from the first '[' to the last ']'.
 * The whole slice must be one JSON value; anything after the first complete value is a parse failure.
 */
@Component
public class JsonArrayExtractor {

    private final ObjectReader reader;

    public JsonArrayExtractor(ObjectMapper objectMapper) {
        this.reader = objectMapper.reader().with(DeserializationFeature.FAIL_ON_TRAILING_TOKENS);
    }

    public JsonNode extract(String sanitizedText) {
        String text = sanitizedText == null ? "" : sanitizedText;
        int start = text.indexOf('[');
        int end = text.lastIndexOf(']');
        if (start == -1 || end == -1 || end <= start) {
            throw new QuizParseException("No valid JSON array found in output.");
        }

        JsonNode node;
        try {
            node = reader.readTree(text.substring(start, end + 1));
        } catch (JsonProcessingException e) {
            throw new QuizParseException("Failed to parse JSON array: " + e.getOriginalMessage(), e);
        }
        if (node == null || !node.isArray()) {
            throw new QuizParseException("No valid JSON array found in output.");
        }
        return node;
    }
}
