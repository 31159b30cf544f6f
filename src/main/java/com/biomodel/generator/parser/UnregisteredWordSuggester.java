package com.biomodel.generator.parser;

import java.util.List;
import java.util.Optional;

/**
 * Finds the registered phrase closest to some part of an unrecognized sentence.
 *
 * <p>Each phrase is compared with every substring of the sentence of the same
 * length; similarity is {@code 2 * M / (|phrase| + |window|)}, where M counts
 * the characters of the matching blocks found by repeatedly taking the longest
 * common block and recursing on both sides of it. The first phrase reaching the
 * highest score wins.
 */
public class UnregisteredWordSuggester {

    public static final double DEFAULT_THRESHOLD = 0.7;

    private final double threshold;

    public UnregisteredWordSuggester() {
        this(DEFAULT_THRESHOLD);
    }

    public UnregisteredWordSuggester(double threshold) {
        if (threshold < 0.0 || threshold > 1.0) {
            throw new IllegalArgumentException("Similarity threshold must be within [0, 1], got " + threshold);
        }
        this.threshold = threshold;
    }

    public double getThreshold() {
        return threshold;
    }

    public Optional<Suggestion> suggest(String sentence, List<String> phrases) {
        String bestPhrase = null;
        String bestWindow = null;
        double bestScore = -1.0;

        for (String phrase : phrases) {
            int width = phrase.length();
            for (int start = 0; start + width <= sentence.length(); start++) {
                String window = sentence.substring(start, start + width);
                double score = similarity(phrase, window);
                if (score > bestScore) {
                    bestScore = score;
                    bestPhrase = phrase;
                    bestWindow = window;
                }
            }
        }

        if (bestPhrase == null || bestScore < threshold) {
            return Optional.empty();
        }
        return Optional.of(new Suggestion(bestPhrase.trim(), bestWindow, bestScore));
    }

    static double similarity(String phrase, String window) {
        int total = phrase.length() + window.length();
        if (phrase.isEmpty() || total == 0) {
            return 0.0;
        }
        return 2.0 * matchingCharacters(phrase, 0, phrase.length(), window, 0, window.length()) / total;
    }

    private static int matchingCharacters(String a, int aLow, int aHigh, String b, int bLow, int bHigh) {
        if (aLow >= aHigh || bLow >= bHigh) {
            return 0;
        }
        // longest block, earliest in a, then earliest in b
        int bestI = aLow;
        int bestJ = bLow;
        int bestSize = 0;
        int[] previous = new int[bHigh - bLow + 1];
        for (int i = aLow; i < aHigh; i++) {
            int[] current = new int[bHigh - bLow + 1];
            for (int j = bLow; j < bHigh; j++) {
                if (a.charAt(i) == b.charAt(j)) {
                    int size = previous[j - bLow] + 1;
                    current[j - bLow + 1] = size;
                    int startI = i - size + 1;
                    int startJ = j - size + 1;
                    if (size > bestSize || (size == bestSize && (startI < bestI || (startI == bestI && startJ < bestJ)))) {
                        bestSize = size;
                        bestI = startI;
                        bestJ = startJ;
                    }
                }
            }
            previous = current;
        }
        if (bestSize == 0) {
            return 0;
        }
        return bestSize
                + matchingCharacters(a, aLow, bestI, b, bLow, bestJ)
                + matchingCharacters(a, bestI + bestSize, aHigh, b, bestJ + bestSize, bHigh);
    }
}
