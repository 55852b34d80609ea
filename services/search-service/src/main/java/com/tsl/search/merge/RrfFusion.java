package com.tsl.search.merge;

import com.tsl.search.model.FusedResult;
import com.tsl.search.model.RankedEntry;
import com.tsl.search.model.RetrievalSource;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

// score(d) = sum over lists of 1 / (k + rank_i(d)); raw scores are never compared
public final class RrfFusion {
    public static final int DEFAULT_K = 60;

    private RrfFusion() {
    }

    public static List<FusedResult> fuse(List<List<RankedEntry>> lists, int k, int limit) {
        if (k < 1) {
            throw new IllegalArgumentException("k must be >= 1: " + k);
        }
        if (lists == null || lists.isEmpty() || limit <= 0) {
            return List.of();
        }
        Map<String, MutableCandidate> candidates = new HashMap<>();
        for (int listIndex = 0; listIndex < lists.size(); listIndex++) {
            List<RankedEntry> list = lists.get(listIndex);
            if (list == null) {
                continue;
            }
            Map<String, RankedEntry> best = new HashMap<>();
            for (RankedEntry entry : list) {
                best.merge(entry.getDocId(), entry, (a, b) -> a.getRank() <= b.getRank() ? a : b);
            }
            for (RankedEntry entry : best.values()) {
                MutableCandidate candidate = candidates.computeIfAbsent(entry.getDocId(), MutableCandidate::new);
                candidate.score += 1.0 / (k + entry.getRank());
                candidate.contribute(listIndex, entry.getSource());
            }
        }

        List<MutableCandidate> mutable = new ArrayList<>(candidates.values());
        mutable.sort(
            Comparator.comparingDouble(MutableCandidate::getScore).reversed()
                .thenComparing(Comparator.comparingInt(MutableCandidate::getSourceCount).reversed())
                .thenComparing(MutableCandidate::getDocId)
        );

        int size = Math.min(limit, mutable.size());
        List<FusedResult> fused = new ArrayList<>(size);
        for (int i = 0; i < size; i++) {
            MutableCandidate candidate = mutable.get(i);
            fused.add(new FusedResult(candidate.docId, candidate.score, candidate.orderedSources()));
        }
        return fused;
    }

    private static final class MutableCandidate {
        private final String docId;
        private final Map<Integer, RetrievalSource> sourcesByList = new HashMap<>();
        private double score;

        private MutableCandidate(String docId) {
            this.docId = docId;
        }

        private void contribute(int listIndex, RetrievalSource source) {
            sourcesByList.put(listIndex, source);
        }

        private List<RetrievalSource> orderedSources() {
            List<Integer> indexes = new ArrayList<>(sourcesByList.keySet());
            indexes.sort(Integer::compare);
            List<RetrievalSource> ordered = new ArrayList<>(indexes.size());
            for (Integer index : indexes) {
                RetrievalSource source = sourcesByList.get(index);
                if (source != null && !ordered.contains(source)) {
                    ordered.add(source);
                }
            }
            return ordered;
        }

        private String getDocId() {
            return docId;
        }

        private double getScore() {
            return score;
        }

        private int getSourceCount() {
            return sourcesByList.size();
        }
    }
}
