package com.document.verification.similarity;

import java.util.Locale;

/**
 * Case-insensitive Levenshtein similarity.
 * Both values are trimmed and lower-cased, then scored as
 * {@code (maxLength - distance) / maxLength * 100}.
 *
 * <p>Two empty values score 0, not 100. Callers detect the both-empty case from value
 * presence, so this score is never reported for it.</p>
 */
public class LevenshteinSimilarity implements SimilarityAlgorithm {

    @Override
    public double compute(String s1, String s2) {
        String a = normalize(s1);
        String b = normalize(s2);

        int maxLength = Math.max(a.length(), b.length());
        if (maxLength == 0) {
            return 0.0;
        }
        if (a.equals(b)) {
            return 100.0;
        }

        int distance = distance(a, b);
        return ((double) (maxLength - distance) / maxLength) * 100.0;
    }

    @Override
    public String getName() {
        return "Levenshtein";
    }

    /**
     * Computes the Levenshtein edit distance between two strings exactly as given.
     * Uses the Wagner-Fischer algorithm keeping two rows of the matrix.
     */
    public int distance(String s1, String s2) {
        // Keep s1 as the shorter string so the rows stay small
        if (s1.length() > s2.length()) {
            String temp = s1;
            s1 = s2;
            s2 = temp;
        }

        int m = s1.length();
        int n = s2.length();

        int[] previousRow = new int[m + 1];
        int[] currentRow = new int[m + 1];

        for (int i = 0; i <= m; i++) {
            previousRow[i] = i;
        }

        for (int j = 1; j <= n; j++) {
            currentRow[0] = j;

            for (int i = 1; i <= m; i++) {
                int cost = s1.charAt(i - 1) == s2.charAt(j - 1) ? 0 : 1;
                currentRow[i] = Math.min(
                        Math.min(currentRow[i - 1] + 1, previousRow[i] + 1),
                        previousRow[i - 1] + cost
                );
            }

            int[] temp = previousRow;
            previousRow = currentRow;
            currentRow = temp;
        }

        return previousRow[m];
    }

    private static String normalize(String value) {
        if (value == null) {
            return "";
        }
        return value.trim().toLowerCase(Locale.ROOT);
    }
}
