package org.example.quizgen.service.llm;

/**
 * Exception thrown when an LLM provider cannot complete a call at the transport level.
 */
public class LlmProviderException extends RuntimeException {

    public LlmProviderException(String message) {
        super(message);
    }

    public LlmProviderException(String message, Throwable cause) {
        super(message, cause);
    }
}
