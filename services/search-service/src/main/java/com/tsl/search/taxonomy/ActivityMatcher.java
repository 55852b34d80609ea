package com.tsl.search.taxonomy;

import java.util.Collections;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;

public class ActivityMatcher {
    public static final double DEFAULT_SIMILARITY_THRESHOLD = 0.8;

    private static final Set<String> FILLER_WORDS = Set.of(
        "a", "an", "the", "and", "or", "in", "at", "on", "near", "around", "to", "of", "for",
        "with", "some", "any", "activity", "thing", "option", "place", "spot", "trip", "travel",
        "do", "go", "want", "like", "i", "we", "my", "our", "good", "best", "nice", "great"
    );

    private final Taxonomy taxonomy;
    private final double similarityThreshold;
    private final List<String> fuzzyKeys;

    public ActivityMatcher(Taxonomy taxonomy, double similarityThreshold) {
        if (taxonomy == null) {
            throw new IllegalArgumentException("taxonomy required");
        }
        if (!(similarityThreshold > 0.0 && similarityThreshold <= 1.0)) {
            throw new IllegalArgumentException("similarity threshold must be in (0, 1]: " + similarityThreshold);
        }
        this.taxonomy = taxonomy;
        this.similarityThreshold = similarityThreshold;
        this.fuzzyKeys = List.copyOf(taxonomy.allKeys());
    }

    public Set<String> match(String text) {
        if (text == null || text.isBlank()) {
            return Set.of();
        }
        Set<String> matched = new TreeSet<>();
        for (String segment : text.split(",")) {
            matchSegment(TextNormalizer.tokens(segment), matched);
        }
        return Collections.unmodifiableSet(matched);
    }

    public Set<String> matchAll(Iterable<String> phrases) {
        Set<String> matched = new TreeSet<>();
        if (phrases == null) {
            return matched;
        }
        for (String phrase : phrases) {
            matched.addAll(match(phrase));
        }
        return Collections.unmodifiableSet(matched);
    }

    public Set<String> scan(String text) {
        if (text == null || text.isBlank()) {
            return Set.of();
        }
        String padded = " " + TextNormalizer.normalize(text) + " ";
        Set<String> found = new TreeSet<>();
        for (var entry : taxonomy.getSynonymMap().entrySet()) {
            if (padded.contains(" " + entry.getKey() + " ")) {
                found.add(entry.getValue());
            }
        }
        return Collections.unmodifiableSet(found);
    }

    public double getSimilarityThreshold() {
        return similarityThreshold;
    }

    private void matchSegment(List<String> tokens, Set<String> out) {
        if (tokens.isEmpty()) {
            return;
        }
        String whole = String.join(" ", tokens);
        if (resolveExact(whole, out)) {
            return;
        }
        if (tokens.size() > 1 && resolveFuzzy(whole, out)) {
            return;
        }

        int i = 0;
        while (i < tokens.size()) {
            int consumed = matchLongestAt(tokens, i, out);
            if (consumed > 0) {
                i += consumed;
                continue;
            }
            String token = tokens.get(i);
            if (!FILLER_WORDS.contains(token)) {
                resolveFuzzy(token, out);
            }
            i++;
        }
    }

    private int matchLongestAt(List<String> tokens, int start, Set<String> out) {
        if (FILLER_WORDS.contains(tokens.get(start))) {
            return 0;
        }
        int maxLen = Math.min(taxonomy.getMaxKeyTokens(), tokens.size() - start);
        for (int len = maxLen; len >= 1; len--) {
            String candidate = String.join(" ", tokens.subList(start, start + len));
            if (resolveExact(candidate, out)) {
                return len;
            }
        }
        return 0;
    }

    private boolean resolveExact(String key, Set<String> out) {
        Set<String> category = taxonomy.lookupCategory(key);
        if (category != null) {
            out.addAll(category);
            return true;
        }
        String activity = taxonomy.lookupActivity(key);
        if (activity != null) {
            out.add(activity);
            return true;
        }
        return false;
    }

    private boolean resolveFuzzy(String key, Set<String> out) {
        String best = null;
        double bestScore = 0.0;
        for (String candidate : fuzzyKeys) {
            if (Math.abs(candidate.length() - key.length()) > maxLengthGap(key, candidate)) {
                continue;
            }
            double score = similarity(key, candidate);
            if (score >= similarityThreshold && score > bestScore) {
                best = candidate;
                bestScore = score;
            }
        }
        return best != null && resolveExact(best, out);
    }

    private int maxLengthGap(String a, String b) {
        // ratio >= threshold is impossible once the length gap alone exceeds the allowed edits
        return (int) Math.floor((1.0 - similarityThreshold) * Math.max(a.length(), b.length()));
    }

    static double similarity(String a, String b) {
        int maxLen = Math.max(a.length(), b.length());
        if (maxLen == 0) {
            return 1.0;
        }
        return 1.0 - (double) levenshtein(a, b) / maxLen;
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
