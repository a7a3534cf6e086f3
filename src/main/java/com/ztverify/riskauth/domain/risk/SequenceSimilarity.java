package com.ztverify.riskauth.domain.risk;

import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Ratcliff/Obershelp similarity: {@code 2 * M / T}, where M counts characters in the recursively
 * found longest common blocks and T is the combined length of both strings.
 */
public final class SequenceSimilarity {

    private SequenceSimilarity() {
    }

    public static double ratio(String a, String b) {
        String left = a == null ? "" : a;
        String right = b == null ? "" : b;
        int total = left.length() + right.length();
        if (total == 0) {
            return 1.0;
        }
        return 2.0 * matchingCharacters(left, right) / total;
    }

    static int matchingCharacters(String a, String b) {
        int matches = 0;
        Deque<int[]> pending = new ArrayDeque<>();
        pending.push(new int[] {0, a.length(), 0, b.length()});
        while (!pending.isEmpty()) {
            int[] range = pending.pop();
            int[] block = longestBlock(a, range[0], range[1], b, range[2], range[3]);
            int size = block[2];
            if (size == 0) {
                continue;
            }
            matches += size;
            if (range[0] < block[0] && range[2] < block[1]) {
                pending.push(new int[] {range[0], block[0], range[2], block[1]});
            }
            if (block[0] + size < range[1] && block[1] + size < range[3]) {
                pending.push(new int[] {block[0] + size, range[1], block[1] + size, range[3]});
            }
        }
        return matches;
    }

    // Earliest longest block wins on ties: lowest start in a, then lowest start in b.
    private static int[] longestBlock(String a, int aLo, int aHi, String b, int bLo, int bHi) {
        int bestI = aLo;
        int bestJ = bLo;
        int bestSize = 0;
        int width = bHi - bLo;
        int[] previous = new int[width + 1];
        for (int i = aLo; i < aHi; i++) {
            int[] current = new int[width + 1];
            char ch = a.charAt(i);
            for (int j = bLo; j < bHi; j++) {
                if (b.charAt(j) == ch) {
                    int run = previous[j - bLo] + 1;
                    current[j - bLo + 1] = run;
                    if (run > bestSize) {
                        bestSize = run;
                        bestI = i - run + 1;
                        bestJ = j - run + 1;
                    }
                }
            }
            previous = current;
        }
        return new int[] {bestI, bestJ, bestSize};
    }
}
