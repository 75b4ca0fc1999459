package org.example.quizgen.service.llm;

/**
 * Abstraction over a single textual completion endpoint.
 */
public interface LlmProvider {

    /**
     * Issue one blocking completion call against the given model.
     * Non-200 answers are returned, not thrown, so the caller can classify them.
     *
     * @param model model identifier to call
     * @param prompt the prompt to send
     * @param options generation options (temperature, output cap, stop sequences)
     * @return the status, content and usage reported by the endpoint
     * @throws LlmProviderException on transport failure or timeout
     */
    ProviderResponse complete(String model, String prompt, LlmOptions options);

    /**
     * Check if this provider is properly configured.
     *
     * @return true if the provider can accept requests
     */
    boolean isAvailable();

    /**
     * Get the name of this provider for logging/debugging.
     *
     * @return provider name (e.g., "groq")
     */
    String getProviderName();
}
