package com.tsl.search.index;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

import com.tsl.search.model.Document;
import com.tsl.search.model.RankedEntry;
import com.tsl.search.model.RetrievalSource;
import com.tsl.search.model.StructuredFields;
import com.tsl.search.model.StructuredFilter;
import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.Test;

class VectorIndexTest {
    private final VectorIndex index = new VectorIndex(3);

    @Test
    void ranksByCosineSimilarity() {
        index.upsert(doc("x", "Paris", new float[] {1f, 0f, 0f}));
        index.upsert(doc("xy", "Paris", new float[] {1f, 1f, 0f}));
        index.upsert(doc("z", "Lisbon", new float[] {0f, 0f, 5f}));

        List<RankedEntry> hits = index.search(new float[] {2f, 0f, 0f}, null, 10);

        assertThat(hits).extracting(RankedEntry::getDocId).containsExactly("x", "xy", "z");
        assertThat(hits.get(0).getRawScore()).isCloseTo(1.0, within(1e-6));
        assertThat(hits).extracting(RankedEntry::getRank).containsExactly(1, 2, 3);
        assertThat(hits).allMatch(hit -> hit.getSource() == RetrievalSource.VECTOR);
    }

    @Test
    void filterAppliesBeforeTopK() {
        index.upsert(doc("x", "Paris", new float[] {1f, 0f, 0f}));
        index.upsert(doc("z", "Lisbon", new float[] {0f, 0f, 1f}));

        List<RankedEntry> hits = index.search(List.of(1.0, 0.0, 0.0), new StructuredFilter("lisbon", null, Set.of()), 1);

        assertThat(hits).extracting(RankedEntry::getDocId).containsExactly("z");
    }

    @Test
    void tiesBreakByDocId() {
        index.upsert(doc("b", null, new float[] {0f, 1f, 0f}));
        index.upsert(doc("a", null, new float[] {0f, 2f, 0f}));

        assertThat(index.search(new float[] {0f, 1f, 0f}, null, 10)).extracting(RankedEntry::getDocId)
            .containsExactly("a", "b");
    }

    @Test
    void rejectsWrongDimensionAndZeroVectors() {
        assertThatThrownBy(() -> index.upsert(doc("bad", null, new float[] {1f, 0f})))
            .isInstanceOf(IndexWriteException.class)
            .hasMessageContaining("vector_dimension_mismatch");
        assertThatThrownBy(() -> index.upsert(doc("zero", null, new float[] {0f, 0f, 0f})))
            .isInstanceOf(IndexWriteException.class)
            .hasMessageContaining("vector_zero_norm");
        assertThatThrownBy(() -> index.search(new float[] {1f}, null, 5))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void zeroQueryReturnsNothing() {
        index.upsert(doc("x", null, new float[] {1f, 0f, 0f}));

        assertThat(index.search(new float[] {0f, 0f, 0f}, null, 5)).isEmpty();
    }

    @Test
    void deleteRemovesVector() {
        index.upsert(doc("x", null, new float[] {1f, 0f, 0f}));

        assertThat(index.delete("x")).isTrue();
        assertThat(index.contains("x")).isFalse();
        assertThat(index.search(new float[] {1f, 0f, 0f}, null, 5)).isEmpty();
    }

    private static Document doc(String id, String city, float[] vector) {
        return new Document(id, "title", "body", new StructuredFields(city, null, Set.of(), null, false), vector);
    }
}
