package com.tsl.search.index;

import com.tsl.search.model.Document;
import com.tsl.search.model.RankedEntry;
import com.tsl.search.model.RetrievalSource;
import com.tsl.search.model.StructuredFields;
import com.tsl.search.model.StructuredFilter;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;

// exact cosine top-k; vectors are L2-normalized on write
public class VectorIndex {
    private final int dimension;
    private final ConcurrentHashMap<String, Entry> entries = new ConcurrentHashMap<>();

    public VectorIndex(int dimension) {
        if (dimension < 1) {
            throw new IllegalArgumentException("dimension must be positive: " + dimension);
        }
        this.dimension = dimension;
    }

    public void upsert(Document document) {
        if (document == null || document.getDocId() == null || document.getDocId().isBlank()) {
            throw new IndexWriteException("vector_invalid_document");
        }
        float[] vector = document.getEmbedding();
        if (vector.length != dimension) {
            throw new IndexWriteException(
                "vector_dimension_mismatch doc_id=" + document.getDocId()
                    + " expected=" + dimension + " actual=" + vector.length
            );
        }
        float[] normalized = normalize(vector);
        if (normalized == null) {
            throw new IndexWriteException("vector_zero_norm doc_id=" + document.getDocId());
        }
        entries.put(document.getDocId(), new Entry(normalized, document.getFields()));
    }

    public boolean delete(String docId) {
        return docId != null && entries.remove(docId) != null;
    }

    public List<RankedEntry> search(float[] query, StructuredFilter filter, int topK) {
        if (query == null || query.length != dimension) {
            throw new IllegalArgumentException(
                "query vector dimension mismatch expected=" + dimension
                    + " actual=" + (query == null ? 0 : query.length)
            );
        }
        if (topK <= 0 || entries.isEmpty()) {
            return List.of();
        }
        float[] normalizedQuery = normalize(query);
        if (normalizedQuery == null) {
            return List.of();
        }
        List<Scored> scored = new ArrayList<>();
        for (Map.Entry<String, Entry> candidate : entries.entrySet()) {
            Entry entry = candidate.getValue();
            if (!StructuredFilterPredicate.matches(entry.fields, filter)) {
                continue;
            }
            scored.add(new Scored(candidate.getKey(), dot(normalizedQuery, entry.vector)));
        }
        scored.sort(Comparator.comparingDouble((Scored s) -> s.score).reversed().thenComparing(s -> s.docId));
        int size = Math.min(topK, scored.size());
        List<RankedEntry> ranked = new ArrayList<>(size);
        for (int i = 0; i < size; i++) {
            Scored hit = scored.get(i);
            ranked.add(new RankedEntry(hit.docId, RetrievalSource.VECTOR, i + 1, hit.score));
        }
        return ranked;
    }

    public List<RankedEntry> search(List<Double> query, StructuredFilter filter, int topK) {
        return search(toFloats(query), filter, topK);
    }

    public boolean contains(String docId) {
        return docId != null && entries.containsKey(docId);
    }

    public Set<String> docIds() {
        return Collections.unmodifiableSet(new TreeSet<>(entries.keySet()));
    }

    public int size() {
        return entries.size();
    }

    public int getDimension() {
        return dimension;
    }

    public void clear() {
        entries.clear();
    }

    public static float[] toFloats(List<Double> values) {
        if (values == null) {
            return null;
        }
        float[] out = new float[values.size()];
        for (int i = 0; i < out.length; i++) {
            Double value = values.get(i);
            out[i] = value == null ? 0.0f : value.floatValue();
        }
        return out;
    }

    private static float[] normalize(float[] vector) {
        double sumSquares = 0.0;
        for (float value : vector) {
            if (Float.isNaN(value) || Float.isInfinite(value)) {
                return null;
            }
            sumSquares += (double) value * value;
        }
        if (sumSquares == 0.0) {
            return null;
        }
        double norm = Math.sqrt(sumSquares);
        float[] out = new float[vector.length];
        for (int i = 0; i < vector.length; i++) {
            out[i] = (float) (vector[i] / norm);
        }
        return out;
    }

    private static double dot(float[] a, float[] b) {
        double sum = 0.0;
        for (int i = 0; i < a.length; i++) {
            sum += (double) a[i] * b[i];
        }
        return sum;
    }

    private static final class Entry {
        private final float[] vector;
        private final StructuredFields fields;

        private Entry(float[] vector, StructuredFields fields) {
            this.vector = vector;
            this.fields = fields;
        }
    }

    private static final class Scored {
        private final String docId;
        private final double score;

        private Scored(String docId, double score) {
            this.docId = docId;
            this.score = score;
        }
    }
}
