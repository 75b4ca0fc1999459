package org.example.quizgen.service.llm;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Duration;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * LLM provider implementation for Groq.
 * Calls the OpenAI-compatible /chat/completions endpoint and reports every status back to the caller.
 */
public class GroqLlmProvider implements LlmProvider {

    private static final Logger log = LoggerFactory.getLogger(GroqLlmProvider.class);

    private final WebClient webClient;
    private final int timeoutSeconds;
    private final String apiKey;
    private final ObjectMapper objectMapper = new ObjectMapper();

    public GroqLlmProvider(String baseUrl, String apiKey, int timeoutSeconds) {
        this(WebClient.builder()
                .baseUrl(baseUrl)
                .defaultHeader("Authorization", "Bearer " + apiKey)
                .build(), apiKey, timeoutSeconds);
        log.info("Groq LLM provider initialized: baseUrl={}", baseUrl);
    }

    GroqLlmProvider(WebClient webClient, String apiKey, int timeoutSeconds) {
        this.webClient = webClient;
        this.apiKey = apiKey;
        this.timeoutSeconds = timeoutSeconds;
    }

    @Override
    public ProviderResponse complete(String model, String prompt, LlmOptions options) {
        Map<String, Object> requestBody = new HashMap<>();
        requestBody.put("model", model);
        requestBody.put("messages", List.of(
                Map.of("role", "user", "content", prompt)
        ));
        requestBody.put("temperature", options.temperature());
        requestBody.put("max_tokens", options.maxTokens());
        if (!options.stopSequences().isEmpty()) {
            requestBody.put("stop", options.stopSequences());
        }

        ResponseEntity<String> response;
        try {
            response = webClient.post()
                    .uri("/chat/completions")
                    .contentType(MediaType.APPLICATION_JSON)
                    .bodyValue(requestBody)
                    .exchangeToMono(clientResponse -> clientResponse.toEntity(String.class))
                    .timeout(Duration.ofSeconds(timeoutSeconds))
                    .block();
        } catch (Exception e) {
            log.error("Failed to reach Groq for model {}", model, e);
            throw new LlmProviderException("Failed to reach Groq for model " + model, e);
        }
        if (response == null) {
            throw new LlmProviderException("Empty response from Groq for model " + model);
        }

        int status = response.getStatusCode().value();
        String body = response.getBody() == null ? "" : response.getBody();
        if (status == 200) {
            return parseSuccess(body);
        }

        log.error("Groq API error for model {}: {} - {}", model, status, body);
        return parseFailure(status, body);
    }

    private ProviderResponse parseSuccess(String body) {
        JsonNode responseNode;
        try {
            responseNode = objectMapper.readTree(body);
        } catch (Exception e) {
            throw new LlmProviderException("Invalid response format from Groq API", e);
        }

        JsonNode choices = responseNode.get("choices");
        if (choices != null && choices.isArray() && choices.size() > 0) {
            JsonNode choice = choices.get(0);
            JsonNode message = choice.get("message");
            String content = null;
            if (message != null && message.hasNonNull("content")) {
                content = message.get("content").asText();
            } else if (choice.hasNonNull("text")) {
                content = choice.get("text").asText();
            }
            if (content != null) {
                return ProviderResponse.success(content, readTotalTokens(responseNode), body);
            }
        }

        throw new LlmProviderException("Invalid response format from Groq API");
    }

    private Integer readTotalTokens(JsonNode responseNode) {
        JsonNode usage = responseNode.get("usage");
        if (usage == null) {
            return null;
        }
        JsonNode total = usage.has("total_tokens") ? usage.get("total_tokens") : usage.get("totalTokens");
        return total != null && total.canConvertToInt() ? total.asInt() : null;
    }

    private ProviderResponse parseFailure(int status, String body) {
        try {
            JsonNode error = objectMapper.readTree(body).path("error");
            if (error.isObject()) {
                return ProviderResponse.failure(
                        status,
                        error.path("code").asText(""),
                        error.path("message").asText(""),
                        body
                );
            }
            if (error.isTextual()) {
                return ProviderResponse.failure(status, "", error.asText(), body);
            }
        } catch (Exception e) {
            log.debug("Groq error body is not JSON: {}", e.getMessage());
        }
        return ProviderResponse.failure(status, "", body, body);
    }

    @Override
    public boolean isAvailable() {
        if (apiKey == null || apiKey.isBlank()) {
            log.debug("Groq not available: API key not configured");
            return false;
        }
        // Availability is assumed once a key is set; real health is observed per call
        return true;
    }

    @Override
    public String getProviderName() {
        return "groq";
    }
}
