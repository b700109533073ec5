package com.purchasingpower.archiverag.resolver;

/**
 * Case-insensitive Indel similarity: {@code 2 * LCS(a, b) / (|a| + |b|)}.
 *
 * <p>Symmetric, in {@code [0.0, 1.0]}; two empty strings score 1.0.
 */
public final class NameSimilarity {

    private NameSimilarity() {
    }

    public static double ratio(String a, String b) {
        String left = a == null ? "" : a.toLowerCase();
        String right = b == null ? "" : b.toLowerCase();

        int total = left.length() + right.length();
        if (total == 0) {
            return 1.0;
        }
        return 2.0 * longestCommonSubsequence(left, right) / total;
    }

    static int longestCommonSubsequence(String a, String b) {
        int[] previous = new int[b.length() + 1];
        int[] current = new int[b.length() + 1];

        for (int i = 1; i <= a.length(); i++) {
            char ca = a.charAt(i - 1);
            for (int j = 1; j <= b.length(); j++) {
                if (ca == b.charAt(j - 1)) {
                    current[j] = previous[j - 1] + 1;
                } else {
                    current[j] = Math.max(previous[j], current[j - 1]);
                }
            }
            int[] swap = previous;
            previous = current;
            current = swap;
        }
        return previous[b.length()];
    }
}
