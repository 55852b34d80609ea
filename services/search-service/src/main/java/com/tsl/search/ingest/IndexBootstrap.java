package com.tsl.search.ingest;

import com.tsl.search.index.IndexCorruptionException;
import com.tsl.search.index.IndexHealth;
import com.tsl.search.index.IndexWriteException;
import com.tsl.search.index.LexicalIndex;
import com.tsl.search.index.VectorIndex;
import com.tsl.search.model.Document;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
public class IndexBootstrap {
    private static final Logger log = LoggerFactory.getLogger(IndexBootstrap.class);

    private final IndexSnapshotStore snapshotStore;
    private final IndexingPipeline indexingPipeline;
    private final DocumentRegistry registry;
    private final LexicalIndex lexicalIndex;
    private final VectorIndex vectorIndex;
    private final IndexHealth indexHealth;
    private final IndexingProperties properties;

    public IndexBootstrap(
        IndexSnapshotStore snapshotStore,
        IndexingPipeline indexingPipeline,
        DocumentRegistry registry,
        LexicalIndex lexicalIndex,
        VectorIndex vectorIndex,
        IndexHealth indexHealth,
        IndexingProperties properties
    ) {
        this.snapshotStore = snapshotStore;
        this.indexingPipeline = indexingPipeline;
        this.registry = registry;
        this.lexicalIndex = lexicalIndex;
        this.vectorIndex = vectorIndex;
        this.indexHealth = indexHealth;
        this.properties = properties;
    }

    @PostConstruct
    public void init() {
        if (properties.getSnapshot().isLoadOnStartup()) {
            loadSnapshot();
        }
    }

    @PreDestroy
    public void shutdown() {
        if (properties.getSnapshot().isSaveOnShutdown() && indexHealth.isConsistent()) {
            saveSnapshot();
        }
    }

    public int loadSnapshot() {
        Path path = snapshotPath();
        IndexSnapshotStore.LoadResult result;
        try {
            result = snapshotStore.load(path);
        } catch (IndexCorruptionException e) {
            indexHealth.markInconsistent("snapshot_unreadable");
            log.error("snapshot_load_failed path={} reason={}", path, e.getMessage());
            return 0;
        }
        int restored = 0;
        for (SnapshotRecord record : result.getRecords()) {
            Document document = record.toDocument();
            try {
                indexingPipeline.restore(document, record.toRaw());
                restored++;
            } catch (IndexWriteException e) {
                // Keep the raw text so a rebuild can recover it.
                registry.putIndexed(document, record.toRaw());
                registry.hide(document.getDocId());
                log.error("snapshot_record_rejected doc_id={} reason={}", record.getDocId(), e.getMessage());
            }
        }
        for (IndexCorruptionException corruption : result.getCorruptions()) {
            log.error("snapshot_corrupt_line path={} reason={}", path, corruption.getMessage());
        }
        List<String> problems = new ArrayList<>(IndexConsistencyChecker.check(registry, lexicalIndex, vectorIndex));
        if (result.isCorrupt()) {
            problems.add("corrupt_lines=" + result.getCorruptions().size());
        }
        if (problems.isEmpty()) {
            indexHealth.markHealthy();
            log.info("snapshot_loaded path={} documents={}", path, restored);
        } else {
            indexHealth.markInconsistent("index_inconsistent");
            log.error("snapshot_inconsistent path={} restored={} problems={}", path, restored, problems);
        }
        return restored;
    }

    public int saveSnapshot() {
        List<SnapshotRecord> records = new ArrayList<>();
        for (Document document : registry.documents()) {
            records.add(SnapshotRecord.of(document, registry.getRaw(document.getDocId()).orElse(null)));
        }
        return snapshotStore.save(snapshotPath(), records);
    }

    private Path snapshotPath() {
        return Path.of(properties.getSnapshot().getPath());
    }
}
