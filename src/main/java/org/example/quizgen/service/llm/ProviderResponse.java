package org.example.quizgen.service.llm;

/**
 * Outcome of one provider call.
 *
 * @param status HTTP status, or 0 when the call never produced one
 * @param content generated text (200 only)
 * @param totalTokens usage reported by the provider, null when absent
 * @param errorCode provider error code (non-200 only), never null
 * @param errorMessage provider error message or raw body (non-200 only), never null
 * @param rawBody response body as received
 */
public record ProviderResponse(
        int status,
        String content,
        Integer totalTokens,
        String errorCode,
        String errorMessage,
        String rawBody
) {
    public ProviderResponse {
        errorCode = errorCode == null ? "" : errorCode;
        errorMessage = errorMessage == null ? "" : errorMessage;
        rawBody = rawBody == null ? "" : rawBody;
    }

    public static ProviderResponse success(String content, Integer totalTokens, String rawBody) {
        return new ProviderResponse(200, content, totalTokens, "", "", rawBody);
    }

    public static ProviderResponse failure(int status, String errorCode, String errorMessage, String rawBody) {
        return new ProviderResponse(status, null, null, errorCode, errorMessage, rawBody);
    }

    public boolean isSuccess() {
        return status == 200;
    }
}
