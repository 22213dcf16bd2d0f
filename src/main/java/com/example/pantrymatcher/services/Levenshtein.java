package com.example.pantrymatcher.services;

/** Edit distance with an optional bound that lets hopeless comparisons stop early. */
public final class Levenshtein {
    private Levenshtein() {}

    public static int distance(String a, String b) {
        return distance(a, b, Math.max(a.length(), b.length()));
    }

    /**
     * Returns the edit distance between {@code a} and {@code b} if it is at most
     * {@code max}, otherwise {@code max + 1}.
     */
    public static int distance(String a, String b, int max) {
        if (max < 0) return max + 1;
        if (Math.abs(a.length() - b.length()) > max) return max + 1;
        if (a.isEmpty()) return b.length();
        if (b.isEmpty()) return a.length();

        int[] prev = new int[b.length() + 1];
        int[] cur = new int[b.length() + 1];
        for (int j = 0; j <= b.length(); j++) prev[j] = j;

        for (int i = 1; i <= a.length(); i++) {
            cur[0] = i;
            int rowMin = cur[0];
            char ca = a.charAt(i - 1);
            for (int j = 1; j <= b.length(); j++) {
                int cost = ca == b.charAt(j - 1) ? 0 : 1;
                cur[j] = Math.min(Math.min(prev[j] + 1, cur[j - 1] + 1), prev[j - 1] + cost);
                if (cur[j] < rowMin) rowMin = cur[j];
            }
            // row minima never decrease, so the final distance is already out of reach
            if (rowMin > max) return max + 1;
            int[] tmp = prev; prev = cur; cur = tmp;
        }
        int d = prev[b.length()];
        return d <= max ? d : max + 1;
    }
}
