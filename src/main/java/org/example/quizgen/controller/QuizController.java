package org.example.quizgen.controller;

import com.fasterxml.jackson.annotation.JsonInclude;
import jakarta.servlet.http.HttpServletRequest;
import org.example.quizgen.config.RequestIdFilter;
import org.example.quizgen.model.Difficulty;
import org.example.quizgen.model.GradeResult;
import org.example.quizgen.model.GradingMethod;
import org.example.quizgen.model.QuestionType;
import org.example.quizgen.model.QuizGenerationResult;
import org.example.quizgen.model.QuizQuestionView;
import org.example.quizgen.model.QuizRequest;
import org.example.quizgen.model.TypeCounts;
import org.example.quizgen.service.AnswerGradingService;
import org.example.quizgen.service.QuizGenerationService;
import org.example.quizgen.service.QuizMetricsService;
import org.example.quizgen.service.QuizStorageService;
import org.example.quizgen.service.llm.BudgetExhaustedException;
import org.example.quizgen.service.llm.DispatchFailedException;
import org.example.quizgen.service.llm.ModelCooldownRegistry;
import org.example.quizgen.service.llm.ModelDispatcher;
import org.example.quizgen.service.llm.TokenBudgetTracker;
import org.example.quizgen.service.quiz.QuizParseException;
import org.example.quizgen.service.quiz.QuizShortfallException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpHeaders;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

@RestController
@RequestMapping("/api/quizzes")
public class QuizController {

    private static final Logger log = LoggerFactory.getLogger(QuizController.class);

    @Value("${quiz.enabled:true}")
    private boolean quizEnabled;

    private final QuizGenerationService quizGenerationService;
    private final AnswerGradingService answerGradingService;
    private final QuizStorageService quizStorageService;
    private final QuizMetricsService quizMetricsService;
    private final TokenBudgetTracker budgetTracker;
    private final ModelCooldownRegistry cooldownRegistry;
    private final ModelDispatcher modelDispatcher;

    public QuizController(
            QuizGenerationService quizGenerationService,
            AnswerGradingService answerGradingService,
            QuizStorageService quizStorageService,
            QuizMetricsService quizMetricsService,
            TokenBudgetTracker budgetTracker,
            ModelCooldownRegistry cooldownRegistry,
            ModelDispatcher modelDispatcher) {
        this.quizGenerationService = quizGenerationService;
        this.answerGradingService = answerGradingService;
        this.quizStorageService = quizStorageService;
        this.quizMetricsService = quizMetricsService;
        this.budgetTracker = budgetTracker;
        this.cooldownRegistry = cooldownRegistry;
        this.modelDispatcher = modelDispatcher;
    }

    @GetMapping("/status")
    public Map<String, Object> getStatus() {
        Map<String, Object> status = new LinkedHashMap<>();
        status.put("enabled", quizEnabled);
        status.put("provider", quizGenerationService.getProviderName());
        status.put("providerAvailable", quizGenerationService.isProviderAvailable());
        status.put("models", modelDispatcher.getModelPreference());
        status.put("budget", budgetTracker.snapshot());
        status.put("cooldowns", cooldownRegistry.activeCooldowns());
        status.put("metrics", quizMetricsService.snapshot());
        return status;
    }

    @PostMapping("/generate")
    public ResponseEntity<?> generate(@RequestBody GenerateQuizRequest body, HttpServletRequest httpRequest) {
        if (!quizEnabled) {
            return ResponseEntity.status(403).build();
        }
        if (body == null) {
            return ResponseEntity.badRequest().build();
        }

        QuizRequest request;
        try {
            request = new QuizRequest(
                    body.text(),
                    body.counts() == null ? TypeCounts.NONE : body.counts(),
                    Difficulty.fromLabel(body.difficulty())
            );
        } catch (IllegalArgumentException e) {
            return ResponseEntity.badRequest().body(ErrorResponse.of("invalid_request", e.getMessage()));
        }

        try {
            if (body.persist()) {
                QuizGenerationService.GeneratedQuiz generated = quizGenerationService.generateAndStore(request);
                QuizGenerationResult result = generated.result();
                httpRequest.setAttribute(RequestIdFilter.MODEL_ATTRIBUTE, result.model());
                httpRequest.setAttribute(RequestIdFilter.QUIZ_ID_ATTRIBUTE, generated.stored().quizId());
                return ResponseEntity.ok(new GenerateQuizResponse(
                        generated.stored().quizId(), result.model(), result.toppedUp(), generated.stored().questions()));
            }
            QuizGenerationResult result = quizGenerationService.generate(request);
            httpRequest.setAttribute(RequestIdFilter.MODEL_ATTRIBUTE, result.model());
            List<QuizQuestionView> items = result.items().stream()
                    .map(item -> QuizQuestionView.of(null, item))
                    .toList();
            return ResponseEntity.ok(new GenerateQuizResponse(null, result.model(), result.toppedUp(), items));
        } catch (BudgetExhaustedException e) {
            return ResponseEntity.status(503)
                    .header(HttpHeaders.RETRY_AFTER, String.valueOf(e.getRetryAfterSeconds()))
                    .body(ErrorResponse.of("budget_exhausted", e.getMessage()));
        } catch (DispatchFailedException e) {
            log.error("Quiz generation failed at the provider: {}", e.getMessage());
            return ResponseEntity.status(502).body(ErrorResponse.of("dispatch_failed", e.getMessage()));
        } catch (QuizParseException e) {
            log.error("Quiz generation output could not be parsed: {}", e.getMessage());
            return ResponseEntity.status(502).body(ErrorResponse.of("parse_failure", e.getMessage()));
        } catch (QuizShortfallException e) {
            return ResponseEntity.status(422).body(new ErrorResponse(
                    "schema_shortfall", e.getMessage(), e.getShortfall().asTagMap()));
        }
    }

    @GetMapping("/{quizId}")
    public ResponseEntity<StoredQuizResponse> getQuiz(@PathVariable String quizId) {
        if (!quizEnabled) {
            return ResponseEntity.status(403).build();
        }
        return quizStorageService.findQuiz(quizId)
                .map(quiz -> ResponseEntity.ok(new StoredQuizResponse(quiz.quizId(), quiz.questions())))
                .orElseGet(() -> ResponseEntity.notFound().build());
    }

    @PostMapping("/grade")
    public ResponseEntity<?> grade(@RequestBody GradeRequest request) {
        if (!quizEnabled) {
            return ResponseEntity.status(403).build();
        }
        if (request == null || request.question() == null || request.referenceAnswer() == null) {
            return ResponseEntity.badRequest().body(
                    ErrorResponse.of("invalid_request", "type, question and referenceAnswer are required"));
        }
        Optional<QuestionType> type = QuestionType.fromTag(request.type());
        if (type.isEmpty()) {
            return ResponseEntity.badRequest().body(
                    ErrorResponse.of("invalid_request", "Unknown question type: " + request.type()));
        }

        GradeResult result = answerGradingService.grade(
                type.get(), request.question(), request.studentAnswer(), request.referenceAnswer());
        return ResponseEntity.ok(new GradeResponse(null, result.correct(), result.method()));
    }

    @PostMapping("/questions/{questionId}/grade")
    public ResponseEntity<GradeResponse> gradeStored(
            @PathVariable String questionId,
            @RequestBody StoredGradeRequest request) {
        if (!quizEnabled) {
            return ResponseEntity.status(403).build();
        }
        if (request == null) {
            return ResponseEntity.badRequest().build();
        }
        return answerGradingService.gradeStored(questionId, request.studentAnswer())
                .map(result -> ResponseEntity.ok(new GradeResponse(questionId, result.correct(), result.method())))
                .orElseGet(() -> ResponseEntity.notFound().build());
    }

    public record GenerateQuizRequest(
            String text,
            TypeCounts counts,
            String difficulty,
            boolean persist
    ) {
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record GenerateQuizResponse(
            String quizId,
            String model,
            boolean toppedUp,
            List<QuizQuestionView> items
    ) {
    }

    public record StoredQuizResponse(String quizId, List<QuizQuestionView> items) {
    }

    public record GradeRequest(
            String type,
            String question,
            String studentAnswer,
            String referenceAnswer
    ) {
    }

    public record StoredGradeRequest(String studentAnswer) {
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record GradeResponse(String questionId, boolean correct, GradingMethod method) {
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record ErrorResponse(String error, String message, Map<String, Integer> shortfall) {
        static ErrorResponse of(String error, String message) {
            return new ErrorResponse(error, message, null);
        }
    }
}
