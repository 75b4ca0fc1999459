package org.example.quizgen.service;

import org.example.quizgen.model.QuestionType;
import org.example.quizgen.model.QuizGenerationResult;
import org.example.quizgen.model.QuizItem;
import org.example.quizgen.model.QuizRequest;
import org.example.quizgen.model.StoredQuiz;
import org.example.quizgen.service.llm.BudgetExhaustedException;
import org.example.quizgen.service.llm.DispatchFailedException;
import org.example.quizgen.service.llm.DispatchResult;
import org.example.quizgen.service.llm.LlmProvider;
import org.example.quizgen.service.llm.ModelDispatcher;
import org.example.quizgen.service.quiz.QuizOutputPipeline;
import org.example.quizgen.service.quiz.QuizParseException;
import org.example.quizgen.service.quiz.QuizPromptBuilder;
import org.example.quizgen.service.quiz.QuizReconciler;
import org.example.quizgen.service.quiz.QuizShortfallException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;

/**
 * Entry point for quiz generation: one primary call, then reconciliation to the exact requested counts.
 */
@Service
public class QuizGenerationService {

    private static final Logger log = LoggerFactory.getLogger(QuizGenerationService.class);

    private final QuizPromptBuilder promptBuilder;
    private final ModelDispatcher dispatcher;
    private final QuizOutputPipeline pipeline;
    private final QuizReconciler reconciler;
    private final QuizStorageService storageService;
    private final QuizMetricsService metricsService;
    private final LlmProvider provider;

    @Value("${quiz.llm.max-output-tokens:4096}")
    private int maxOutputTokens;

    public QuizGenerationService(
            QuizPromptBuilder promptBuilder,
            ModelDispatcher dispatcher,
            QuizOutputPipeline pipeline,
            QuizReconciler reconciler,
            QuizStorageService storageService,
            QuizMetricsService metricsService,
            @Qualifier("quizLlmProvider") LlmProvider provider) {
        this.promptBuilder = promptBuilder;
        this.dispatcher = dispatcher;
        this.pipeline = pipeline;
        this.reconciler = reconciler;
        this.storageService = storageService;
        this.metricsService = metricsService;
        this.provider = provider;
    }

    /**
     * @throws BudgetExhaustedException if no model could be called within budget
     * @throws DispatchFailedException if every candidate model failed
     * @throws QuizParseException if the primary output held no JSON array
     * @throws QuizShortfallException if the top-up did not fill every requested count
     */
    public QuizGenerationResult generate(QuizRequest request) {
        metricsService.recordGenerationRequested();
        long startedAt = System.currentTimeMillis();
        try {
            String prompt = promptBuilder.buildGenerationPrompt(
                    request.sourceText(), request.counts(), request.difficulty());
            DispatchResult primary = dispatcher.dispatch(prompt, maxOutputTokens);
            Map<QuestionType, List<QuizItem>> buckets = pipeline.process(primary.content());
            QuizReconciler.Reconciliation reconciliation = reconciler.reconcile(request, buckets, maxOutputTokens);

            long durationMs = System.currentTimeMillis() - startedAt;
            metricsService.recordGenerationCompleted(reconciliation.toppedUp(), durationMs);
            log.info("Generated {} questions with {} in {} ms (toppedUp={})",
                    reconciliation.items().size(), primary.model(), durationMs, reconciliation.toppedUp());
            return new QuizGenerationResult(reconciliation.items(), primary.model(), reconciliation.toppedUp());
        } catch (BudgetExhaustedException e) {
            metricsService.recordBudgetExhausted(System.currentTimeMillis() - startedAt);
            throw e;
        } catch (DispatchFailedException e) {
            metricsService.recordDispatchFailed(System.currentTimeMillis() - startedAt);
            throw e;
        } catch (QuizParseException e) {
            metricsService.recordParseFailed(System.currentTimeMillis() - startedAt);
            throw e;
        } catch (QuizShortfallException e) {
            metricsService.recordShortfall(System.currentTimeMillis() - startedAt);
            throw e;
        }
    }

    public GeneratedQuiz generateAndStore(QuizRequest request) {
        QuizGenerationResult result = generate(request);
        StoredQuiz stored = storageService.saveQuiz(result.items());
        return new GeneratedQuiz(result, stored);
    }

    public boolean isProviderAvailable() {
        return provider.isAvailable();
    }

    public String getProviderName() {
        return provider.getProviderName();
    }

    public record GeneratedQuiz(QuizGenerationResult result, StoredQuiz stored) {
    }
}
