package org.retreat.placer;

/**
 * Gestalt (Ratcliff/Obershelp) similarity between two strings.
 *
 * ratio = 2 * M / (|a| + |b|), where M is the number of characters in the
 * matching blocks found by repeatedly taking the longest common substring and
 * recursing on the pieces to its left and right. Among equally long
 * substrings the one starting earliest in {@code a}, then in {@code b}, wins.
 */
public final class NameSimilarity {

    private NameSimilarity() {
    }

    public static double ratio(String a, String b) {
        int total = a.length() + b.length();
        if (total == 0) {
            return 1.0;
        }
        return 2.0 * matchingCharacters(a, b) / total;
    }

    static int matchingCharacters(String a, String b) {
        return countMatches(a, 0, a.length(), b, 0, b.length());
    }

    private static int countMatches(String a, int aLo, int aHi, String b, int bLo, int bHi) {
        if (aLo >= aHi || bLo >= bHi) {
            return 0;
        }
        int[] match = longestMatch(a, aLo, aHi, b, bLo, bHi);
        int i = match[0];
        int j = match[1];
        int size = match[2];
        if (size == 0) {
            return 0;
        }
        return size
                + countMatches(a, aLo, i, b, bLo, j)
                + countMatches(a, i + size, aHi, b, j + size, bHi);
    }

    /**
     * Returns {start in a, start in b, length} of the longest common substring.
     */
    private static int[] longestMatch(String a, int aLo, int aHi, String b, int bLo, int bHi) {
        int bestI = aLo;
        int bestJ = bLo;
        int bestSize = 0;
        // lengths[j + 1] = length of the match ending at a[i], b[j]
        int[] previous = new int[b.length() + 1];
        for (int i = aLo; i < aHi; i++) {
            int[] current = new int[b.length() + 1];
            char c = a.charAt(i);
            for (int j = bLo; j < bHi; j++) {
                if (b.charAt(j) == c) {
                    int k = previous[j] + 1;
                    current[j + 1] = k;
                    if (k > bestSize) {
                        bestI = i - k + 1;
                        bestJ = j - k + 1;
                        bestSize = k;
                    }
                }
            }
            previous = current;
        }
        return new int[]{bestI, bestJ, bestSize};
    }
}
