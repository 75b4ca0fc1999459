package org.example.quizgen.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.example.quizgen.entity.QuizQuestionEntity;
import org.example.quizgen.model.McqItem;
import org.example.quizgen.model.QuizItem;
import org.example.quizgen.model.QuizQuestionView;
import org.example.quizgen.model.StoredQuiz;
import org.example.quizgen.model.StoredReference;
import org.example.quizgen.model.TextAnswerItem;
import org.example.quizgen.model.TrueFalseItem;
import org.example.quizgen.repository.QuizQuestionRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Keeps generated quizzes so their questions can be fetched and graded later by id.
 */
@Service
public class QuizStorageService {

    private static final Logger log = LoggerFactory.getLogger(QuizStorageService.class);
    private static final TypeReference<List<String>> CHOICES_TYPE = new TypeReference<>() {};

    private final QuizQuestionRepository repository;
    private final ObjectMapper objectMapper;

    public QuizStorageService(QuizQuestionRepository repository, ObjectMapper objectMapper) {
        this.repository = repository;
        this.objectMapper = objectMapper;
    }

    @Transactional
    public StoredQuiz saveQuiz(List<QuizItem> items) {
        String quizId = UUID.randomUUID().toString();
        List<QuizQuestionEntity> entities = new ArrayList<>(items.size());
        for (int i = 0; i < items.size(); i++) {
            entities.add(toEntity(quizId, i, items.get(i)));
        }
        List<QuizQuestionEntity> saved = repository.saveAll(entities);
        log.info("Stored quiz {} with {} questions", quizId, saved.size());
        return new StoredQuiz(quizId, saved.stream().map(this::toView).toList());
    }

    @Transactional(readOnly = true)
    public Optional<StoredQuiz> findQuiz(String quizId) {
        List<QuizQuestionEntity> entities = repository.findByQuizIdOrderByPositionAsc(quizId);
        if (entities.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(new StoredQuiz(quizId, entities.stream().map(this::toView).toList()));
    }

    @Transactional(readOnly = true)
    public Optional<StoredReference> findReference(String questionId) {
        return repository.findById(questionId)
                .map(entity -> new StoredReference(
                        entity.getId(),
                        entity.getType(),
                        entity.getQuestion(),
                        entity.getAnswerText()
                ));
    }

    private QuizQuestionEntity toEntity(String quizId, int position, QuizItem item) {
        String choicesJson = null;
        String answer;
        if (item instanceof McqItem mcq) {
            choicesJson = writeChoices(mcq.choices());
            answer = mcq.answer();
        } else if (item instanceof TrueFalseItem tf) {
            answer = String.valueOf(tf.answer());
        } else {
            answer = ((TextAnswerItem) item).answer();
        }
        return new QuizQuestionEntity(quizId, position, item.type(), item.question(), choicesJson, answer);
    }

    private QuizQuestionView toView(QuizQuestionEntity entity) {
        QuizItem item = switch (entity.getType()) {
            case MCQ -> new McqItem(entity.getQuestion(), readChoices(entity.getChoicesJson()), entity.getAnswerText());
            case TRUE_FALSE -> new TrueFalseItem(
                    entity.getQuestion(), Boolean.parseBoolean(entity.getAnswerText()), entity.getAnswerText());
            default -> new TextAnswerItem(entity.getType(), entity.getQuestion(), entity.getAnswerText());
        };
        return QuizQuestionView.of(entity.getId(), item);
    }

    private String writeChoices(List<String> choices) {
        try {
            return objectMapper.writeValueAsString(choices);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize quiz choices", e);
        }
    }

    private List<String> readChoices(String choicesJson) {
        if (choicesJson == null || choicesJson.isBlank()) {
            return List.of();
        }
        try {
            return objectMapper.readValue(choicesJson, CHOICES_TYPE);
        } catch (JsonProcessingException e) {
            log.warn("Stored choices are not valid JSON: {}", e.getOriginalMessage());
            return List.of();
        }
    }
}
