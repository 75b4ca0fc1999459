package org.example.quizgen.service.quiz;

/**
 * Normalized edit-distance similarity: {@code 1 - levenshtein(a, b) / max(|a|, |b|)}.
 * Two empty strings are identical (1.0).
 */
public final class TextSimilarity {

    private TextSimilarity() {
    }

    public static double ratio(String a, String b) {
        String left = a == null ? "" : a;
        String right = b == null ? "" : b;
        int longest = Math.max(left.length(), right.length());
        if (longest == 0) {
            return 1.0;
        }
        return 1.0 - (double) levenshtein(left, right) / longest;
    }

    static int levenshtein(String a, String b) {
        int[] previous = new int[b.length() + 1];
        int[] current = new int[b.length() + 1];
        for (int j = 0; j <= b.length(); j++) {
            previous[j] = j;
        }
        for (int i = 1; i <= a.length(); i++) {
            current[0] = i;
            for (int j = 1; j <= b.length(); j++) {
                int substitution = previous[j - 1] + (a.charAt(i - 1) == b.charAt(j - 1) ? 0 : 1);
                current[j] = Math.min(substitution, Math.min(previous[j] + 1, current[j - 1] + 1));
            }
            int[] swap = previous;
            previous = current;
            current = swap;
        }
        return previous[b.length()];
    }
}
