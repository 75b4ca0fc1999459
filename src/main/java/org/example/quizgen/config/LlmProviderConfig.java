package org.example.quizgen.config;

import org.example.quizgen.service.llm.GroqLlmProvider;
import org.example.quizgen.service.llm.LlmProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Configuration for the quiz LLM provider.
 */
@Configuration
public class LlmProviderConfig {

    private static final Logger log = LoggerFactory.getLogger(LlmProviderConfig.class);

    @Value("${quiz.llm.base-url:https://api.groq.com/openai/v1}")
    private String baseUrl;

    @Value("${quiz.llm.api-key:}")
    private String apiKey;

    @Value("${quiz.llm.timeout-seconds:75}")
    private int timeoutSeconds;

    @Bean
    @Qualifier("quizLlmProvider")
    public LlmProvider quizLlmProvider() {
        if (apiKey == null || apiKey.isBlank()) {
            log.warn("quiz.llm.api-key is not configured; generation and model grading will fail until it is set");
        }
        log.info("Configuring quiz LLM provider: baseUrl={}, timeout={}s", baseUrl, timeoutSeconds);
        return new GroqLlmProvider(baseUrl, apiKey == null ? "" : apiKey, timeoutSeconds);
    }
}
