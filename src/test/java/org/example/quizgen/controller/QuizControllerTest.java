package org.example.quizgen.controller;

import org.example.quizgen.config.RequestIdFilter;
import org.example.quizgen.model.GradeResult;
import org.example.quizgen.model.GradingMethod;
import org.example.quizgen.model.McqItem;
import org.example.quizgen.model.QuestionType;
import org.example.quizgen.model.QuizGenerationResult;
import org.example.quizgen.model.QuizQuestionView;
import org.example.quizgen.model.QuizRequest;
import org.example.quizgen.model.StoredQuiz;
import org.example.quizgen.model.TrueFalseItem;
import org.example.quizgen.model.TypeCounts;
import org.example.quizgen.service.AnswerGradingService;
import org.example.quizgen.service.QuizGenerationService;
import org.example.quizgen.service.QuizMetricsService;
import org.example.quizgen.service.QuizStorageService;
import org.example.quizgen.service.llm.BudgetExhaustedException;
import org.example.quizgen.service.llm.BudgetSnapshot;
import org.example.quizgen.service.llm.DispatchFailedException;
import org.example.quizgen.service.llm.ModelCooldownRegistry;
import org.example.quizgen.service.llm.ModelDispatcher;
import org.example.quizgen.service.llm.TokenBudgetTracker;
import org.example.quizgen.service.quiz.QuizParseException;
import org.example.quizgen.service.quiz.QuizShortfallException;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.hamcrest.Matchers.is;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.request;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(QuizController.class)
class QuizControllerTest {

    private static final String GENERATE_BODY = """
            {"text": "Water boils at 100 C.", "counts": {"mcq": 1, "trueFalse": 1}, "difficulty": "Easy"}
            """;

    @Autowired
    private MockMvc mockMvc;

    @MockitoBean
    private QuizGenerationService quizGenerationService;

    @MockitoBean
    private AnswerGradingService answerGradingService;

    @MockitoBean
    private QuizStorageService quizStorageService;

    @MockitoBean
    private QuizMetricsService quizMetricsService;

    @MockitoBean
    private TokenBudgetTracker budgetTracker;

    @MockitoBean
    private ModelCooldownRegistry cooldownRegistry;

    @MockitoBean
    private ModelDispatcher modelDispatcher;

    @Test
    void getStatus_returnsBudgetCooldownsAndMetrics() throws Exception {
        when(quizGenerationService.getProviderName()).thenReturn("groq");
        when(quizGenerationService.isProviderAvailable()).thenReturn(true);
        when(modelDispatcher.getModelPreference()).thenReturn(List.of("llama-3.3-70b-versatile", "llama-3.1-8b-instant"));
        when(budgetTracker.snapshot()).thenReturn(new BudgetSnapshot(3, 40, 2100L, 52000L, 30, 1000, 12000, 100000));
        when(cooldownRegistry.activeCooldowns()).thenReturn(Map.of(
                "llama-3.3-70b-versatile", Instant.parse("2026-02-14T12:01:00Z")));
        when(quizMetricsService.snapshot()).thenReturn(Map.of("generationCompleted", 8L));

        mockMvc.perform(get("/api/quizzes/status"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.enabled", is(true)))
                .andExpect(jsonPath("$.provider", is("groq")))
                .andExpect(jsonPath("$.providerAvailable", is(true)))
                .andExpect(jsonPath("$.models[1]", is("llama-3.1-8b-instant")))
                .andExpect(jsonPath("$.budget.requestsToday", is(40)))
                .andExpect(jsonPath("$.budget.tokensPerMinute", is(12000)))
                .andExpect(jsonPath("$.cooldowns['llama-3.3-70b-versatile']").exists())
                .andExpect(jsonPath("$.metrics.generationCompleted", is(8)));
    }

    @Test
    void generate_returnsItemsInRequestedShape() throws Exception {
        when(quizGenerationService.generate(any(QuizRequest.class))).thenReturn(new QuizGenerationResult(
                List.of(
                        new McqItem("Boiling point?", List.of("100 C", "90 C", "80 C", "120 C"), "100 C"),
                        new TrueFalseItem("Ice floats.", true, null)
                ),
                "llama-3.3-70b-versatile",
                true
        ));

        mockMvc.perform(post("/api/quizzes/generate")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(GENERATE_BODY))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.model", is("llama-3.3-70b-versatile")))
                .andExpect(jsonPath("$.toppedUp", is(true)))
                .andExpect(jsonPath("$.quizId").doesNotExist())
                .andExpect(jsonPath("$.items[0].type", is("mcq")))
                .andExpect(jsonPath("$.items[0].choices[3]", is("120 C")))
                .andExpect(jsonPath("$.items[0].answer", is("100 C")))
                .andExpect(jsonPath("$.items[1].type", is("true_false")))
                .andExpect(jsonPath("$.items[1].answer", is(true)));

        ArgumentCaptor<QuizRequest> captured = ArgumentCaptor.forClass(QuizRequest.class);
        verify(quizGenerationService).generate(captured.capture());
        assertEquals(new TypeCounts(1, 0, 1, 0, 0), captured.getValue().counts());
    }

    @Test
    void generate_withPersist_returnsQuizId() throws Exception {
        QuizGenerationResult result = new QuizGenerationResult(
                List.of(new TrueFalseItem("Ice floats.", true, null)), "llama-3.1-8b-instant", false);
        StoredQuiz stored = new StoredQuiz("quiz-1", List.of(
                new QuizQuestionView("question-1", "true_false", "Ice floats.", null, true)));
        when(quizGenerationService.generateAndStore(any(QuizRequest.class)))
                .thenReturn(new QuizGenerationService.GeneratedQuiz(result, stored));

        mockMvc.perform(post("/api/quizzes/generate")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"text\": \"Ice floats.\", \"counts\": {\"trueFalse\": 1}, \"persist\": true}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.quizId", is("quiz-1")))
                .andExpect(jsonPath("$.items[0].id", is("question-1")))
                .andExpect(request().attribute(RequestIdFilter.MODEL_ATTRIBUTE, "llama-3.1-8b-instant"))
                .andExpect(request().attribute(RequestIdFilter.QUIZ_ID_ATTRIBUTE, "quiz-1"));
    }

    @Test
    void generate_blankText_returnsBadRequest() throws Exception {
        mockMvc.perform(post("/api/quizzes/generate")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"text\": \"  \", \"counts\": {\"mcq\": 2}}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error", is("invalid_request")));

        verifyNoInteractions(quizGenerationService);
    }

    @Test
    void generate_noQuestionsRequested_returnsBadRequest() throws Exception {
        mockMvc.perform(post("/api/quizzes/generate")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"text\": \"Some text\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error", is("invalid_request")));
    }

    @Test
    void generate_overflowingCounts_returnsBadRequest() throws Exception {
        mockMvc.perform(post("/api/quizzes/generate")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"text\": \"Some text\", \"counts\": {\"mcq\": 2147483647, \"essay\": 1}}"))
                .andExpect(status().isBadRequest());

        verifyNoInteractions(quizGenerationService);
    }

    @Test
    void generate_unknownDifficulty_returnsBadRequest() throws Exception {
        mockMvc.perform(post("/api/quizzes/generate")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"text\": \"Some text\", \"counts\": {\"mcq\": 1}, \"difficulty\": \"Nightmare\"}"))
                .andExpect(status().isBadRequest());
    }

    @Test
    void generate_budgetExhausted_returnsServiceUnavailableWithRetryAfter() throws Exception {
        when(quizGenerationService.generate(any(QuizRequest.class)))
                .thenThrow(new BudgetExhaustedException("budget ceiling rpm reached", 42));

        mockMvc.perform(post("/api/quizzes/generate")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(GENERATE_BODY))
                .andExpect(status().isServiceUnavailable())
                .andExpect(header().string("Retry-After", "42"))
                .andExpect(jsonPath("$.error", is("budget_exhausted")));
    }

    @Test
    void generate_dispatchFailed_returnsBadGateway() throws Exception {
        when(quizGenerationService.generate(any(QuizRequest.class)))
                .thenThrow(new DispatchFailedException(503, "unavailable"));

        mockMvc.perform(post("/api/quizzes/generate")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(GENERATE_BODY))
                .andExpect(status().isBadGateway())
                .andExpect(jsonPath("$.error", is("dispatch_failed")));
    }

    @Test
    void generate_parseFailure_returnsBadGatewayWithDistinctError() throws Exception {
        when(quizGenerationService.generate(any(QuizRequest.class)))
                .thenThrow(new QuizParseException("No valid JSON array found in output."));

        mockMvc.perform(post("/api/quizzes/generate")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(GENERATE_BODY))
                .andExpect(status().isBadGateway())
                .andExpect(jsonPath("$.error", is("parse_failure")))
                .andExpect(jsonPath("$.message", is("No valid JSON array found in output.")));
    }

    @Test
    void generate_shortfall_returnsUnprocessableWithPerTypeGap() throws Exception {
        when(quizGenerationService.generate(any(QuizRequest.class))).thenThrow(new QuizShortfallException(
                new TypeCounts(1, 0, 0, 0, 0), new TypeCounts(1, 0, 1, 0, 0)));

        mockMvc.perform(post("/api/quizzes/generate")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(GENERATE_BODY))
                .andExpect(status().isUnprocessableEntity())
                .andExpect(jsonPath("$.error", is("schema_shortfall")))
                .andExpect(jsonPath("$.shortfall.mcq", is(1)))
                .andExpect(jsonPath("$.shortfall.true_false", is(0)));
    }

    @Test
    void getQuiz_unknownId_returnsNotFound() throws Exception {
        when(quizStorageService.findQuiz("missing")).thenReturn(Optional.empty());

        mockMvc.perform(get("/api/quizzes/missing"))
                .andExpect(status().isNotFound());
    }

    @Test
    void getQuiz_storedQuiz_returnsItems() throws Exception {
        when(quizStorageService.findQuiz("quiz-1")).thenReturn(Optional.of(new StoredQuiz("quiz-1", List.of(
                new QuizQuestionView("question-1", "identification", "Red planet?", null, "Mars")))));

        mockMvc.perform(get("/api/quizzes/quiz-1"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.quizId", is("quiz-1")))
                .andExpect(jsonPath("$.items[0].answer", is("Mars")))
                .andExpect(jsonPath("$.items[0].choices").doesNotExist());
    }

    @Test
    void grade_returnsVerdictAndMethod() throws Exception {
        when(answerGradingService.grade(eq(QuestionType.IDENTIFICATION), eq("Powerhouse of the cell?"),
                eq("Mitochondria"), eq("the Mitochondria!")))
                .thenReturn(new GradeResult(true, GradingMethod.EXACT_MATCH));

        mockMvc.perform(post("/api/quizzes/grade")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"type": "identification", "question": "Powerhouse of the cell?",
                                 "studentAnswer": "Mitochondria", "referenceAnswer": "the Mitochondria!"}
                                """))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.correct", is(true)))
                .andExpect(jsonPath("$.method", is("EXACT_MATCH")));
    }

    @Test
    void grade_unknownType_returnsBadRequest() throws Exception {
        mockMvc.perform(post("/api/quizzes/grade")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"type\": \"matching\", \"question\": \"Q?\", \"referenceAnswer\": \"A\"}"))
                .andExpect(status().isBadRequest());

        verifyNoInteractions(answerGradingService);
    }

    @Test
    void gradeStored_returnsVerdictForKnownQuestion() throws Exception {
        when(answerGradingService.gradeStored("question-1", "Rayleigh scattering"))
                .thenReturn(Optional.of(new GradeResult(true, GradingMethod.MODEL)));

        mockMvc.perform(post("/api/quizzes/questions/question-1/grade")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"studentAnswer\": \"Rayleigh scattering\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.questionId", is("question-1")))
                .andExpect(jsonPath("$.correct", is(true)))
                .andExpect(jsonPath("$.method", is("MODEL")));
    }

    @Test
    void gradeStored_unknownQuestion_returnsNotFound() throws Exception {
        when(answerGradingService.gradeStored("missing", "x")).thenReturn(Optional.empty());

        mockMvc.perform(post("/api/quizzes/questions/missing/grade")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"studentAnswer\": \"x\"}"))
                .andExpect(status().isNotFound());
    }
}
