package com.vectorstore.dedup.similarity;

/**
 * Levenshtein distance-based similarity.
 * Scores as a percentage: round(100 * (maxLength - distance) / maxLength).
 */
public class LevenshteinSimilarity {

    /**
     * Computes the similarity percentage between two strings.
     *
     * @return a whole-number score between 0 and 100; 100 if both strings are empty
     */
    public double score(String s1, String s2) {
        if (s1 == null || s2 == null) {
            return 0.0;
        }
        if (s1.equals(s2)) {
            return 100.0;
        }
        int maxLength = Math.max(s1.length(), s2.length());
        int distance = distance(s1, s2);
        return Math.round(100.0 * (maxLength - distance) / maxLength);
    }

    /**
     * Computes the Levenshtein edit distance between two strings.
     * Uses Wagner-Fischer algorithm with O(min(m,n)) space optimization.
     */
    public int distance(String s1, String s2) {
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
}
