package com.example.syncreconciler.assign;

/**
 * Similarity of two paths measured from their tails.
 *
 * <p>The score is the number of characters, separators excluded, in the trailing path
 * components both paths share exactly. A component that only partly matches contributes
 * nothing, so {@code a/ab/c} and {@code a/b/c} score 1. Used only to break ties between
 * fingerprint-equal candidates.
 */
public final class PathMatchScorer {
    private PathMatchScorer() {
    }

    public static int score(String first, String second) {
        return score(first, second, '/');
    }

    public static int score(String first, String second, char separator) {
        if (first.isEmpty() || second.isEmpty()) {
            return 0;
        }
        int firstEnd = first.length() - 1;
        int secondEnd = second.length() - 1;
        int index = 0;
        int separators = 0;
        int pending = 0;
        while (index <= firstEnd && index <= secondEnd) {
            char a = first.charAt(firstEnd - index);
            char b = second.charAt(secondEnd - index);
            if (a != b) {
                break;
            }
            index++;
            if (a == separator) {
                separators++;
                pending = 0;
            } else {
                pending++;
            }
        }
        boolean firstBoundary = index > firstEnd || first.charAt(firstEnd - index) == separator;
        boolean secondBoundary = index > secondEnd || second.charAt(secondEnd - index) == separator;
        if (firstBoundary && secondBoundary) {
            return index - separators;
        }
        return index - separators - pending;
    }
}
