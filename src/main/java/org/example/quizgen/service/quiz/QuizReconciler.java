package org.example.quizgen.service.quiz;

import org.example.quizgen.model.QuestionType;
import org.example.quizgen.model.QuizItem;
import org.example.quizgen.model.QuizRequest;
import org.example.quizgen.model.TypeCounts;
import org.example.quizgen.service.llm.DispatchResult;
import org.example.quizgen.service.llm.LlmProviderException;
import org.example.quizgen.service.llm.ModelDispatcher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Turns the validated buckets of the primary call into exactly the requested counts.
 * <p>
 * When a type is short, one supplementary call asks for the missing items only. There is never
 * a second top-up: whatever is still missing afterwards is reported as a {@link QuizShortfallException}.
 */
@Component
public class QuizReconciler {

    private static final Logger log = LoggerFactory.getLogger(QuizReconciler.class);

    private final ModelDispatcher dispatcher;
    private final QuizOutputPipeline pipeline;
    private final QuizPromptBuilder promptBuilder;
    private final int minTopUpOutputTokens;

    public QuizReconciler(
            ModelDispatcher dispatcher,
            QuizOutputPipeline pipeline,
            QuizPromptBuilder promptBuilder,
            @Value("${quiz.topup.min-output-tokens:256}") int minTopUpOutputTokens) {
        this.dispatcher = dispatcher;
        this.pipeline = pipeline;
        this.promptBuilder = promptBuilder;
        this.minTopUpOutputTokens = minTopUpOutputTokens;
    }

    /**
     * @param buckets validated items of the primary call, by type; merged into in place
     * @param baseOutputCap output token cap the primary call used
     * @throws QuizShortfallException if some type is still short after the top-up
     */
    public Reconciliation reconcile(QuizRequest request, Map<QuestionType, List<QuizItem>> buckets, int baseOutputCap) {
        TypeCounts requested = request.counts();
        TypeCounts shortfall = requested.shortfall(buckets);
        boolean toppedUp = false;

        if (!shortfall.isEmpty()) {
            toppedUp = true;
            log.warn("Primary call short by {}; requesting a top-up", shortfall.asTagMap());
            merge(buckets, topUp(request, buckets, shortfall, baseOutputCap));
            shortfall = requested.shortfall(buckets);
        }

        if (!shortfall.isEmpty()) {
            log.warn("Quiz still short by {} after top-up", shortfall.asTagMap());
            throw new QuizShortfallException(shortfall, requested);
        }

        List<QuizItem> items = new ArrayList<>(requested.total());
        for (QuestionType type : QuestionType.values()) {
            List<QuizItem> bucket = buckets.get(type);
            int wanted = requested.get(type);
            if (wanted > 0) {
                items.addAll(bucket.subList(0, wanted));
            }
        }
        return new Reconciliation(items, toppedUp);
    }

    /**
     * Output cap of the top-up call: proportional to the share of items still missing,
     * never below the configured floor nor above the primary cap.
     */
    int topUpOutputCap(int baseOutputCap, int shortfallTotal, int requestedTotal) {
        int proportional = (int) Math.ceil((double) baseOutputCap * shortfallTotal / Math.max(1, requestedTotal));
        return Math.min(baseOutputCap, Math.max(minTopUpOutputTokens, proportional));
    }

    private Map<QuestionType, List<QuizItem>> topUp(
            QuizRequest request,
            Map<QuestionType, List<QuizItem>> buckets,
            TypeCounts shortfall,
            int baseOutputCap) {
        String prompt = promptBuilder.buildTopUpPrompt(
                request.sourceText(), shortfall, request.difficulty(), existingQuestions(buckets));
        int cap = topUpOutputCap(baseOutputCap, shortfall.total(), request.counts().total());
        try {
            DispatchResult result = dispatcher.dispatch(prompt, cap);
            return pipeline.process(result.content());
        } catch (LlmProviderException | QuizParseException e) {
            log.warn("Top-up call failed, keeping primary items only: {}", e.getMessage());
            return QuizItemValidator.emptyBuckets();
        }
    }

    private void merge(Map<QuestionType, List<QuizItem>> buckets, Map<QuestionType, List<QuizItem>> extra) {
        Set<String> seen = new HashSet<>();
        for (List<QuizItem> bucket : buckets.values()) {
            for (QuizItem item : bucket) {
                seen.add(questionKey(item));
            }
        }
        int added = 0;
        for (QuestionType type : QuestionType.values()) {
            for (QuizItem item : extra.getOrDefault(type, List.of())) {
                if (seen.add(questionKey(item))) {
                    buckets.computeIfAbsent(type, ignored -> new ArrayList<>()).add(item);
                    added++;
                } else {
                    log.debug("Skipping repeated top-up question: {}", item.question());
                }
            }
        }
        log.info("Top-up added {} new items", added);
    }

    private List<String> existingQuestions(Map<QuestionType, List<QuizItem>> buckets) {
        List<String> questions = new ArrayList<>();
        for (QuestionType type : QuestionType.values()) {
            for (QuizItem item : buckets.getOrDefault(type, List.of())) {
                questions.add(item.question());
            }
        }
        return questions;
    }

    private static String questionKey(QuizItem item) {
        return item.question().toLowerCase(Locale.ROOT);
    }

    public record Reconciliation(List<QuizItem> items, boolean toppedUp) {
    }
}
