package org.example.quizgen.service.quiz;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;

class OutputSanitizerTest {

    private final OutputSanitizer sanitizer = new OutputSanitizer();

    @Test
    void sanitize_removesThinkBlocksAcrossLines() {
        String raw = "<THINK>plan the\nquestions first</think>\n[{\"type\":\"mcq\"}]";

        assertEquals("[{\"type\":\"mcq\"}]", sanitizer.sanitize(raw));
    }

    @Test
    void sanitize_keepsOnlyFencedContent() {
        String raw = "Here is your quiz:\n```json\n[1, 2, 3]\n```\nEnjoy!";

        assertEquals("[1, 2, 3]", sanitizer.sanitize(raw));
    }

    @Test
    void sanitize_stripsByteOrderMarkAndStrayBackticks() {
        assertEquals("[]", sanitizer.sanitize("\uFEFF`` []\n``"));
    }

    @Test
    void sanitize_null_returnsEmpty() {
        assertEquals("", sanitizer.sanitize(null));
    }

    @Test
    void sanitize_isIdempotent() {
        String[] samples = {
                "<think>a</think>```json\n[{\"q\":1}]\n```",
                "\uFEFF  [\"x\"]  ",
                "Sure! [1] and [2]",
                "<think>outer <think>inner</think> tail</think>[]",
                ""
        };
        for (String sample : samples) {
            String once = sanitizer.sanitize(sample);
            assertEquals(once, sanitizer.sanitize(once), "sample: " + sample);
        }
    }
}
