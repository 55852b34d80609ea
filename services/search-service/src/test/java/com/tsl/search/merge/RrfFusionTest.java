package com.tsl.search.merge;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

import com.tsl.search.model.FusedResult;
import com.tsl.search.model.RankedEntry;
import com.tsl.search.model.RetrievalSource;
import java.util.List;
import org.junit.jupiter.api.Test;

class RrfFusionTest {

    @Test
    void documentsInBothListsOutrankSingleListLeaders() {
        List<RankedEntry> lexical = List.of(lex("a", 1), lex("b", 2), lex("c", 3));
        List<RankedEntry> vector = List.of(vec("b", 1), vec("d", 2), vec("a", 3));

        List<FusedResult> fused = RrfFusion.fuse(List.of(lexical, vector), 60, 10);

        assertThat(fused).extracting(FusedResult::getDocId).containsExactly("b", "a", "d", "c");
        assertThat(fused.get(0).getFusedScore()).isCloseTo(1.0 / 62 + 1.0 / 61, within(1e-12));
        assertThat(fused.get(0).getSources()).containsExactly(RetrievalSource.LEXICAL, RetrievalSource.VECTOR);
        assertThat(fused.get(3).getSources()).containsExactly(RetrievalSource.LEXICAL);
    }

    @Test
    void equalScoresPreferMoreSourcesThenDocId() {
        // k=1: m scores 1/4 + 1/4 from two lists, y and z score 1/2 from one list each.
        List<RankedEntry> lexical = List.of(lex("z", 1), lex("x", 2), lex("m", 3));
        List<RankedEntry> vector = List.of(vec("y", 1), vec("x", 2), vec("m", 3));

        List<FusedResult> fused = RrfFusion.fuse(List.of(lexical, vector), 1, 10);

        assertThat(fused).extracting(FusedResult::getDocId).containsExactly("x", "m", "y", "z");
    }

    @Test
    void duplicateEntryInOneListCountsOnceAtBestRank() {
        List<RankedEntry> lexical = List.of(lex("a", 1), lex("a", 4));

        List<FusedResult> fused = RrfFusion.fuse(List.of(lexical), 60, 10);

        assertThat(fused).hasSize(1);
        assertThat(fused.get(0).getFusedScore()).isCloseTo(1.0 / 61, within(1e-12));
    }

    @Test
    void singleListKeepsItsOrder() {
        List<FusedResult> fused = RrfFusion.fuse(List.of(List.of(vec("q", 1), vec("p", 2))), 60, 10);

        assertThat(fused).extracting(FusedResult::getDocId).containsExactly("q", "p");
    }

    @Test
    void truncatesToLimitAndHandlesEmptyInput() {
        List<RankedEntry> lexical = List.of(lex("a", 1), lex("b", 2), lex("c", 3));

        assertThat(RrfFusion.fuse(List.of(lexical), 60, 2)).hasSize(2);
        assertThat(RrfFusion.fuse(List.of(), 60, 10)).isEmpty();
        assertThat(RrfFusion.fuse(List.of(List.of(), List.of()), 60, 10)).isEmpty();
    }

    @Test
    void rejectsNonPositiveK() {
        assertThatThrownBy(() -> RrfFusion.fuse(List.of(), 0, 10)).isInstanceOf(IllegalArgumentException.class);
    }

    private static RankedEntry lex(String id, int rank) {
        return new RankedEntry(id, RetrievalSource.LEXICAL, rank, 0.0);
    }

    private static RankedEntry vec(String id, int rank) {
        return new RankedEntry(id, RetrievalSource.VECTOR, rank, 0.0);
    }
}
