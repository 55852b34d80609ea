package com.tsl.search.ingest;

import static org.assertj.core.api.Assertions.assertThat;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.tsl.search.model.Document;
import com.tsl.search.model.PriceTier;
import com.tsl.search.model.RawDocument;
import com.tsl.search.model.StructuredFields;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class IndexSnapshotStoreTest {
    private final IndexSnapshotStore store = new IndexSnapshotStore(new ObjectMapper());

    @TempDir
    Path tempDir;

    @Test
    void savedSnapshotLoadsBackIntoEqualDocuments() {
        Document document = new Document(
            "kyoto-1",
            "Kyoto temples",
            "Tea ceremony at dawn.",
            new StructuredFields("Kyoto", "Japan", Set.of("tea_ceremony", "temple_visit"), PriceTier.MID_RANGE, false),
            new float[] {0.6f, 0.8f}
        );
        RawDocument raw = new RawDocument("kyoto-1", "Kyoto temples", "Tea ceremony at dawn.", List.of("tea ceremonies"));
        Path path = tempDir.resolve("nested/snapshot.jsonl");

        int saved = store.save(path, List.of(SnapshotRecord.of(document, raw)));
        IndexSnapshotStore.LoadResult result = store.load(path);

        assertThat(saved).isEqualTo(1);
        assertThat(result.isCorrupt()).isFalse();
        assertThat(result.getRecords()).hasSize(1);
        SnapshotRecord record = result.getRecords().get(0);
        assertThat(record.toDocument().sameContent(document)).isTrue();
        assertThat(record.toRaw().getActivities()).containsExactly("tea ceremonies");
        assertThat(Files.exists(tempDir.resolve("nested/snapshot.jsonl.tmp"))).isFalse();
    }

    @Test
    void writesSnakeCaseJsonLines() throws IOException {
        Document document = new Document("a", "T", "B", null, new float[] {1f});
        Path path = tempDir.resolve("snapshot.jsonl");

        store.save(path, List.of(SnapshotRecord.of(document, null)));

        String line = Files.readAllLines(path).get(0);
        assertThat(line).contains("\"doc_id\":\"a\"").contains("\"body_text\":\"B\"");
    }

    @Test
    void corruptLinesAreCollectedNotFatal() throws IOException {
        Path path = tempDir.resolve("snapshot.jsonl");
        Files.writeString(path, String.join("\n",
            "{\"doc_id\":\"ok\",\"title\":\"T\",\"body_text\":\"B\",\"embedding\":[1.0]}",
            "{\"doc_id\":",
            "",
            "{\"title\":\"no id\"}"
        ));

        IndexSnapshotStore.LoadResult result = store.load(path);

        assertThat(result.getRecords()).extracting(SnapshotRecord::getDocId).containsExactly("ok");
        assertThat(result.getCorruptions()).hasSize(2);
        assertThat(result.getCorruptions().get(0)).hasMessageContaining("line=2");
        assertThat(result.isCorrupt()).isTrue();
    }

    @Test
    void missingFileLoadsEmpty() {
        IndexSnapshotStore.LoadResult result = store.load(tempDir.resolve("absent.jsonl"));

        assertThat(result.getRecords()).isEmpty();
        assertThat(result.isCorrupt()).isFalse();
    }
}
