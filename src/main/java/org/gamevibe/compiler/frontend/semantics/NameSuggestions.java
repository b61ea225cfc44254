package org.gamevibe.compiler.frontend.semantics;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;

/**
 * Finds "did you mean" candidates for misspelled names.
 */
public final class NameSuggestions {

    /** The largest edit distance at which a candidate is still offered. */
    public static final int MAX_DISTANCE = 2;

    private NameSuggestions() {}

    /**
     * Returns the candidates within {@link #MAX_DISTANCE} edits of {@code name}, compared
     * case-insensitively, nearest first. Candidates at the same distance keep their given order.
     *
     * @param name The name that could not be resolved.
     * @param candidates The names that are declared.
     * @return The suggestions, possibly empty.
     */
    public static List<String> closest(String name, Collection<String> candidates) {
        record Scored(String candidate, int distance) {}
        String needle = name.toLowerCase(Locale.ROOT);
        List<Scored> scored = new ArrayList<>();
        for (String candidate : candidates) {
            if (candidate.equals(name)) continue;
            int distance = distance(needle, candidate.toLowerCase(Locale.ROOT));
            if (distance <= MAX_DISTANCE) {
                scored.add(new Scored(candidate, distance));
            }
        }
        scored.sort(Comparator.comparingInt(Scored::distance));
        return scored.stream().map(Scored::candidate).toList();
    }

    /**
     * Computes the Levenshtein distance between two strings.
     */
    static int distance(String a, String b) {
        int[] previous = new int[b.length() + 1];
        int[] current = new int[b.length() + 1];
        for (int j = 0; j <= b.length(); j++) previous[j] = j;
        for (int i = 1; i <= a.length(); i++) {
            current[0] = i;
            for (int j = 1; j <= b.length(); j++) {
                int cost = a.charAt(i - 1) == b.charAt(j - 1) ? 0 : 1;
                current[j] = Math.min(Math.min(current[j - 1] + 1, previous[j] + 1), previous[j - 1] + cost);
            }
            int[] swap = previous;
            previous = current;
            current = swap;
        }
        return previous[b.length()];
    }
}
