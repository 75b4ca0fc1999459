package org.example.quizgen.service.quiz;

import org.example.quizgen.model.Difficulty;
import org.example.quizgen.model.QuestionType;
import org.example.quizgen.model.TypeCounts;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.StringJoiner;

@Component
public class QuizPromptBuilder {

    private final int maxSourceChars;

    public QuizPromptBuilder(@Value("${quiz.generation.max-source-chars:20000}") int maxSourceChars) {
        this.maxSourceChars = maxSourceChars;
    }

    public String buildGenerationPrompt(String sourceText, TypeCounts counts, Difficulty difficulty) {
        return build(sourceText, counts, difficulty, List.of());
    }

    /**
     * Same layout as the generation prompt, scoped to the missing counts and listing questions
     * that must not be produced again.
     */
    public String buildTopUpPrompt(
            String sourceText,
            TypeCounts shortfall,
            Difficulty difficulty,
            List<String> existingQuestions) {
        return build(sourceText, shortfall, difficulty, existingQuestions == null ? List.of() : existingQuestions);
    }

    public String buildGradingPrompt(String question, String referenceAnswer, String studentAnswer, int coveragePercent) {
        return String.format("""
            You are grading a student's answer to a quiz question.

            QUESTION: %s
            REFERENCE ANSWER: %s
            STUDENT ANSWER: %s

            The student answer is correct if it covers at least %d%% of the key points of the reference answer,
            even when worded differently. Spelling mistakes do not matter.
            Reply with exactly one word: TRUE if the answer is correct, FALSE otherwise.
            """,
                oneLine(question),
                oneLine(referenceAnswer),
                oneLine(studentAnswer),
                coveragePercent
        ).strip();
    }

    String truncate(String sourceText) {
        if (sourceText == null) {
            return "";
        }
        return sourceText.length() > maxSourceChars ? sourceText.substring(0, maxSourceChars) : sourceText;
    }

    private String build(String sourceText, TypeCounts counts, Difficulty difficulty, List<String> avoid) {
        StringBuilder countLines = new StringBuilder();
        StringJoiner schema = new StringJoiner(",\n", "[\n", "\n]");
        for (QuestionType type : QuestionType.values()) {
            int count = counts.get(type);
            if (count <= 0) {
                continue;
            }
            countLines.append("- ").append(count).append(' ').append(describe(type)).append('\n');
            schema.add(example(type));
        }

        StringBuilder avoidSection = new StringBuilder();
        if (!avoid.isEmpty()) {
            avoidSection.append("Do NOT repeat or rephrase any of these existing questions:\n");
            for (String question : avoid) {
                avoidSection.append("- ").append(oneLine(question)).append('\n');
            }
            avoidSection.append('\n');
        }

        return String.format("""
            From the following learning material, generate a quiz with a total of %d questions.

            %s
            %s

            Keep every question and answer concise. MCQ choices must be short phrases (1 to 5 words).
            Do NOT include numbering or extra text (except a question mark at the end of every question).
            Only return the JSON array.

            %sRespond ONLY with a JSON array in this format, without adding any explanation or preamble:
            %s

            Learning Material:
            \"""
            %s
            \"""
            """,
                counts.total(),
                countLines.toString().stripTrailing(),
                difficultyInstruction(difficulty),
                avoidSection,
                schema,
                truncate(sourceText)
        ).strip();
    }

    private String describe(QuestionType type) {
        return switch (type) {
            case MCQ -> "Multiple Choice Questions (with exactly 4 distinct choices; the answer must be copied from the choices).";
            case SHORT_ANSWER -> "Short Answer Questions.";
            case TRUE_FALSE -> "True/False Questions (answer is true or false).";
            case IDENTIFICATION -> "Identification Questions (answer is a single term, name or figure).";
            case ESSAY -> "Essay Questions (answer lists the key points a good response covers).";
        };
    }

    private String example(QuestionType type) {
        return switch (type) {
            case MCQ -> """
                  {
                    "type": "mcq",
                    "question": "...",
                    "choices": ["A", "B", "C", "D"],
                    "answer": "B"
                  }""";
            case TRUE_FALSE -> """
                  {
                    "type": "true_false",
                    "question": "...",
                    "answer": true
                  }""";
            default -> String.format("""
                  {
                    "type": "%s",
                    "question": "...",
                    "answer": "..."
                  }""", type.tag());
        };
    }

    private String difficultyInstruction(Difficulty difficulty) {
        return switch (difficulty) {
            case EASY -> "Difficulty: Easy. Ask about facts stated directly in the material.";
            case INTERMEDIATE -> "Difficulty: Intermediate. Mix direct facts with questions that connect two details.";
            case DIFFICULT -> "Difficulty: Difficult. Ask questions that require combining several parts of the material, with plausible distractors.";
        };
    }

    private static String oneLine(String value) {
        return value == null ? "" : value.replaceAll("\\s+", " ").trim();
    }
}
