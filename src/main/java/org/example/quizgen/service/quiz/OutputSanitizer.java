package org.example.quizgen.service.quiz;

import org.springframework.stereotype.Component;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Strips reasoning blocks, code fences and stray wrapper characters from raw provider text.
 * Applying it twice gives the same result as applying it once.
 */
@Component
public class OutputSanitizer {

    private static final Pattern THINK_BLOCK = Pattern.compile(
            "<think>.*?</think>", Pattern.DOTALL | Pattern.CASE_INSENSITIVE);
    private static final Pattern FENCED_BLOCK = Pattern.compile(
            "```(?:json)?(.*?)```", Pattern.DOTALL | Pattern.CASE_INSENSITIVE);

    public String sanitize(String raw) {
        if (raw == null) {
            return "";
        }
        String text = raw.replace("\uFEFF", "");

        String previous;
        do {
            previous = text;
            text = THINK_BLOCK.matcher(text).replaceAll("");
        } while (!text.equals(previous));

        Matcher fence = FENCED_BLOCK.matcher(text);
        if (fence.find()) {
            text = fence.group(1);
        }
        return stripWrapperChars(text);
    }

    private String stripWrapperChars(String text) {
        int start = 0;
        int end = text.length();
        while (start < end && isWrapperChar(text.charAt(start))) {
            start++;
        }
        while (end > start && isWrapperChar(text.charAt(end - 1))) {
            end--;
        }
        return text.substring(start, end);
    }

    private boolean isWrapperChar(char c) {
        return c == '`' || Character.isWhitespace(c);
    }
}
