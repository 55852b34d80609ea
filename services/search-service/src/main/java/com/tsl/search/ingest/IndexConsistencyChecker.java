package com.tsl.search.ingest;

import com.tsl.search.index.LexicalIndex;
import com.tsl.search.index.VectorIndex;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;

public final class IndexConsistencyChecker {
    private IndexConsistencyChecker() {
    }

    public static List<String> check(DocumentRegistry registry, LexicalIndex lexicalIndex, VectorIndex vectorIndex) {
        Set<String> registered = registry.indexedIds();
        Set<String> lexical = lexicalIndex.docIds();
        Set<String> vector = vectorIndex.docIds();
        List<String> problems = new ArrayList<>();
        addDifference(problems, "missing_lexical", registered, lexical);
        addDifference(problems, "missing_vector", registered, vector);
        addDifference(problems, "orphan_lexical", lexical, registered);
        addDifference(problems, "orphan_vector", vector, registered);
        return problems;
    }

    private static void addDifference(List<String> problems, String label, Set<String> expected, Set<String> actual) {
        Set<String> missing = new TreeSet<>(expected);
        missing.removeAll(actual);
        if (!missing.isEmpty()) {
            problems.add(label + "=" + missing);
        }
    }
}
