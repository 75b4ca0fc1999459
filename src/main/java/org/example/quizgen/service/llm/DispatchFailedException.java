package org.example.quizgen.service.llm;

/**
 * Every candidate model was skipped or failed.
 */
public class DispatchFailedException extends LlmProviderException {

    private final int lastStatus;
    private final String lastBody;

    public DispatchFailedException(int lastStatus, String lastBody) {
        super("All candidate models failed; last status " + lastStatus + ": " + lastBody);
        this.lastStatus = lastStatus;
        this.lastBody = lastBody;
    }

    public int getLastStatus() {
        return lastStatus;
    }

    public String getLastBody() {
        return lastBody;
    }
}
