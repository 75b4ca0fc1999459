package org.example.quizgen.service.quiz;

import com.fasterxml.jackson.databind.JsonNode;
import org.example.quizgen.model.McqItem;
import org.example.quizgen.model.QuestionType;
import org.example.quizgen.model.QuizItem;
import org.example.quizgen.model.TextAnswerItem;
import org.example.quizgen.model.TrueFalseItem;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Turns the raw JSON array into typed items, choosing the variant from each element's "type" tag.
 * Elements that are not objects or carry no known tag are dropped here.
 */
@Component
public class QuizItemParser {

    private static final Logger log = LoggerFactory.getLogger(QuizItemParser.class);

    public List<QuizItem> parse(JsonNode array) {
        List<QuizItem> items = new ArrayList<>();
        if (array == null || !array.isArray()) {
            return items;
        }

        for (JsonNode node : array) {
            if (!node.isObject()) {
                log.debug("Dropping non-object quiz element: {}", node);
                continue;
            }
            Optional<QuestionType> type = QuestionType.fromTag(text(node, "type"));
            if (type.isEmpty()) {
                log.debug("Dropping quiz element with unknown type: {}", node.path("type"));
                continue;
            }

            String question = firstText(node, "question", "text");
            switch (type.get()) {
                case MCQ -> items.add(new McqItem(question, choices(node), firstText(node, "answer", "correct_answer")));
                case TRUE_FALSE -> items.add(trueFalse(node, question));
                default -> items.add(new TextAnswerItem(type.get(), question, firstText(node, "answer", "correct_answer")));
            }
        }
        return items;
    }

    private TrueFalseItem trueFalse(JsonNode node, String question) {
        JsonNode answer = node.has("answer") ? node.get("answer") : node.path("correct_answer");
        if (answer.isBoolean()) {
            return new TrueFalseItem(question, answer.booleanValue(), null);
        }
        return new TrueFalseItem(question, null, answer.isValueNode() && !answer.isNull() ? answer.asText() : null);
    }

    private List<String> choices(JsonNode node) {
        JsonNode array = node.has("choices") ? node.get("choices") : node.path("options");
        List<String> choices = new ArrayList<>();
        if (!array.isArray()) {
            return choices;
        }
        for (JsonNode choice : array) {
            if (choice.isValueNode() && !choice.isNull()) {
                choices.add(choice.asText());
            } else if (choice.isObject() && choice.hasNonNull("text")) {
                choices.add(choice.get("text").asText());
            }
        }
        return choices;
    }

    private String firstText(JsonNode node, String primary, String fallback) {
        String value = text(node, primary);
        return value != null ? value : text(node, fallback);
    }

    private String text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull() || !value.isValueNode()) {
            return null;
        }
        return value.asText();
    }
}
