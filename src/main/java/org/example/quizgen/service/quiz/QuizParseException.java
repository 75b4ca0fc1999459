package org.example.quizgen.service.quiz;

/**
 * Provider output did not contain a well-formed JSON array.
 */
public class QuizParseException extends RuntimeException {

    public QuizParseException(String message) {
        super(message);
    }

    public QuizParseException(String message, Throwable cause) {
        super(message, cause);
    }
}
