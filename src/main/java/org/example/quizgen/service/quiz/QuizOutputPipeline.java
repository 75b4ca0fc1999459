package org.example.quizgen.service.quiz;

import com.fasterxml.jackson.databind.JsonNode;
import org.example.quizgen.model.QuestionType;
import org.example.quizgen.model.QuizItem;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;

/**
 * Raw provider text to validated, type-bucketed items: sanitize, extract, parse, normalize, repair, validate.
 */
@Component
public class QuizOutputPipeline {

    private final OutputSanitizer sanitizer;
    private final JsonArrayExtractor extractor;
    private final QuizItemParser parser;
    private final QuizItemNormalizer normalizer;
    private final McqRepairer repairer;
    private final QuizItemValidator validator;

    public QuizOutputPipeline(
            OutputSanitizer sanitizer,
            JsonArrayExtractor extractor,
            QuizItemParser parser,
            QuizItemNormalizer normalizer,
            McqRepairer repairer,
            QuizItemValidator validator) {
        this.sanitizer = sanitizer;
        this.extractor = extractor;
        this.parser = parser;
        this.normalizer = normalizer;
        this.repairer = repairer;
        this.validator = validator;
    }

    /**
     * @throws QuizParseException if the text holds no well-formed JSON array
     */
    public Map<QuestionType, List<QuizItem>> process(String rawOutput) {
        JsonNode array = extractor.extract(sanitizer.sanitize(rawOutput));
        List<QuizItem> repaired = parser.parse(array).stream()
                .map(normalizer::normalize)
                .map(repairer::repair)
                .toList();
        return validator.partition(repaired);
    }
}
