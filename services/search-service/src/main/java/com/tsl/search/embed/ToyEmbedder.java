package com.tsl.search.embed;

import com.tsl.search.index.TextAnalyzer;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

public class ToyEmbedder {
    private static final double TERM_WEIGHT = 1.0;
    private static final double TRIGRAM_WEIGHT = 0.35;

    private final int dimension;

    public ToyEmbedder(int dimension) {
        if (dimension < 1) {
            throw new IllegalArgumentException("dimension must be positive: " + dimension);
        }
        this.dimension = dimension;
    }

    public List<Double> embed(String text) {
        if (text == null || text.isBlank()) {
            throw new EmbeddingUnavailableException("embed_empty_text", false);
        }
        List<String> terms = TextAnalyzer.analyze(text);
        if (terms.isEmpty()) {
            terms = List.of(text.trim().toLowerCase(Locale.ROOT));
        }
        double[] values = new double[dimension];
        for (String term : terms) {
            add(values, "t:" + term, TERM_WEIGHT);
            String padded = "#" + term + "#";
            for (int i = 0; i + 3 <= padded.length(); i++) {
                add(values, "g:" + padded.substring(i, i + 3), TRIGRAM_WEIGHT);
            }
        }
        double sumSquares = 0.0;
        for (double value : values) {
            sumSquares += value * value;
        }
        double norm = Math.sqrt(sumSquares);
        if (norm == 0.0) {
            norm = 1.0;
        }
        List<Double> vector = new ArrayList<>(dimension);
        for (double value : values) {
            vector.add(value / norm);
        }
        return vector;
    }

    public int getDimension() {
        return dimension;
    }

    private void add(double[] values, String feature, double weight) {
        int hash = mix(feature.hashCode());
        int bucket = Math.floorMod(hash, dimension);
        double sign = ((hash >>> 31) & 1) == 0 ? 1.0 : -1.0;
        values[bucket] += sign * weight;
    }

    private static int mix(int h) {
        h ^= h >>> 16;
        h *= 0x85ebca6b;
        h ^= h >>> 13;
        h *= 0xc2b2ae35;
        h ^= h >>> 16;
        return h;
    }
}
