package org.example.quizgen.service;

import org.example.quizgen.model.GradeResult;
import org.example.quizgen.model.GradingMethod;
import org.example.quizgen.model.QuestionType;
import org.example.quizgen.service.llm.DispatchResult;
import org.example.quizgen.service.llm.LlmProviderException;
import org.example.quizgen.service.llm.ModelDispatcher;
import org.example.quizgen.service.quiz.OutputSanitizer;
import org.example.quizgen.service.quiz.QuizItemNormalizer;
import org.example.quizgen.service.quiz.QuizPromptBuilder;
import org.example.quizgen.service.quiz.TextSimilarity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Decides whether a student's answer is correct.
 * <p>
 * Closed-form types (mcq, true/false, identification) are compared locally. Free-text types are
 * judged by the model with a TRUE/FALSE prompt; when that call fails or its answer is ambiguous a
 * token-overlap heuristic decides instead.
 */
@Service
public class AnswerGradingService {

    private static final Logger log = LoggerFactory.getLogger(AnswerGradingService.class);
    private static final Pattern NON_ALPHANUMERIC = Pattern.compile("[^\\p{L}\\p{N}]+");
    private static final Set<String> ARTICLES = Set.of("a", "an", "the");
    private static final int MIN_SHARED_TOKENS = 3;

    private final ModelDispatcher dispatcher;
    private final OutputSanitizer sanitizer;
    private final QuizPromptBuilder promptBuilder;
    private final QuizStorageService storageService;
    private final QuizMetricsService metricsService;
    private final int maxTokens;
    private final int coveragePercent;
    private final double similarityThreshold;

    public AnswerGradingService(
            ModelDispatcher dispatcher,
            OutputSanitizer sanitizer,
            QuizPromptBuilder promptBuilder,
            QuizStorageService storageService,
            QuizMetricsService metricsService,
            @Value("${quiz.grading.max-tokens:8}") int maxTokens,
            @Value("${quiz.grading.coverage-percent:40}") int coveragePercent,
            @Value("${quiz.grading.similarity-threshold:0.80}") double similarityThreshold) {
        this.dispatcher = dispatcher;
        this.sanitizer = sanitizer;
        this.promptBuilder = promptBuilder;
        this.storageService = storageService;
        this.metricsService = metricsService;
        this.maxTokens = maxTokens;
        this.coveragePercent = coveragePercent;
        this.similarityThreshold = similarityThreshold;
    }

    public GradeResult grade(QuestionType type, String question, String studentAnswer, String referenceAnswer) {
        GradeResult result = doGrade(type, question, studentAnswer, referenceAnswer);
        metricsService.recordGraded(result.method());
        return result;
    }

    /**
     * Grade against a stored question's reference answer.
     *
     * @return empty if no question with that id was stored
     */
    public Optional<GradeResult> gradeStored(String questionId, String studentAnswer) {
        return storageService.findReference(questionId)
                .map(reference -> grade(reference.type(), reference.question(), studentAnswer, reference.answer()));
    }

    private GradeResult doGrade(QuestionType type, String question, String studentAnswer, String referenceAnswer) {
        if (studentAnswer == null || studentAnswer.isBlank()) {
            return new GradeResult(false, GradingMethod.EXACT_MATCH);
        }
        return switch (type) {
            case IDENTIFICATION -> new GradeResult(
                    identificationKey(studentAnswer).equals(identificationKey(referenceAnswer)),
                    GradingMethod.EXACT_MATCH);
            case MCQ -> new GradeResult(
                    normalizedLower(studentAnswer).equals(normalizedLower(referenceAnswer)),
                    GradingMethod.EXACT_MATCH);
            case TRUE_FALSE -> {
                Boolean student = parseBoolean(studentAnswer);
                Boolean reference = parseBoolean(referenceAnswer);
                yield new GradeResult(student != null && student.equals(reference), GradingMethod.EXACT_MATCH);
            }
            case SHORT_ANSWER, ESSAY -> gradeWithModel(question, studentAnswer, referenceAnswer);
        };
    }

    private GradeResult gradeWithModel(String question, String studentAnswer, String referenceAnswer) {
        String prompt = promptBuilder.buildGradingPrompt(question, referenceAnswer, studentAnswer, coveragePercent);
        try {
            DispatchResult result = dispatcher.dispatch(prompt, maxTokens, 0.0);
            Boolean verdict = parseVerdict(result.content());
            if (verdict != null) {
                return new GradeResult(verdict, GradingMethod.MODEL);
            }
            log.warn("Ambiguous grading output from {}: '{}'; using lexical fallback", result.model(), result.content());
        } catch (LlmProviderException e) {
            log.warn("Grading call failed, using lexical fallback: {}", e.getMessage());
        }
        return new GradeResult(lexicalMatch(studentAnswer, referenceAnswer), GradingMethod.LEXICAL_FALLBACK);
    }

    Boolean parseVerdict(String output) {
        String cleaned = sanitizer.sanitize(output).toLowerCase(Locale.ROOT);
        boolean saysTrue = cleaned.contains("true");
        boolean saysFalse = cleaned.contains("false");
        if (saysTrue == saysFalse) {
            return null;
        }
        return saysTrue;
    }

    boolean lexicalMatch(String studentAnswer, String referenceAnswer) {
        Set<String> studentTokens = new LinkedHashSet<>(tokens(studentAnswer));
        Set<String> referenceTokens = new LinkedHashSet<>(tokens(referenceAnswer));
        Set<String> shared = new LinkedHashSet<>(studentTokens);
        shared.retainAll(referenceTokens);

        if (shared.size() >= MIN_SHARED_TOKENS) {
            return true;
        }
        if (!referenceTokens.isEmpty() && shared.size() * 2 >= referenceTokens.size()) {
            return true;
        }
        return TextSimilarity.ratio(normalizedLower(studentAnswer), normalizedLower(referenceAnswer)) >= similarityThreshold;
    }

    static String identificationKey(String answer) {
        List<String> tokens = tokens(answer);
        int start = 0;
        while (start < tokens.size() - 1 && ARTICLES.contains(tokens.get(start))) {
            start++;
        }
        return String.join("", tokens.subList(start, tokens.size()));
    }

    private static List<String> tokens(String value) {
        if (value == null) {
            return List.of();
        }
        List<String> tokens = new ArrayList<>();
        for (String token : NON_ALPHANUMERIC.split(value.toLowerCase(Locale.ROOT))) {
            if (!token.isEmpty()) {
                tokens.add(token);
            }
        }
        return tokens;
    }

    private static String normalizedLower(String value) {
        String normalized = QuizItemNormalizer.normalizeText(value);
        return normalized == null ? "" : normalized.toLowerCase(Locale.ROOT);
    }

    private static Boolean parseBoolean(String value) {
        if (value == null) {
            return null;
        }
        return switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "true", "t", "yes", "y" -> Boolean.TRUE;
            case "false", "f", "no", "n" -> Boolean.FALSE;
            default -> null;
        };
    }
}
