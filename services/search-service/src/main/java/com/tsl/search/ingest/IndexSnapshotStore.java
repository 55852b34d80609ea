package com.tsl.search.ingest;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.tsl.search.index.IndexCorruptionException;
import java.io.BufferedReader;
import java.io.BufferedWriter;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
public class IndexSnapshotStore {
    private static final Logger log = LoggerFactory.getLogger(IndexSnapshotStore.class);

    private final ObjectMapper objectMapper;

    public IndexSnapshotStore(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public int save(Path path, Collection<SnapshotRecord> records) {
        try {
            Path parent = path.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Path temp = path.resolveSibling(path.getFileName() + ".tmp");
            try (BufferedWriter writer = Files.newBufferedWriter(temp, StandardCharsets.UTF_8)) {
                for (SnapshotRecord record : records) {
                    writer.write(objectMapper.writeValueAsString(record));
                    writer.newLine();
                }
            }
            Files.move(temp, path, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            log.info("snapshot_saved path={} documents={}", path, records.size());
            return records.size();
        } catch (IOException e) {
            throw new UncheckedIOException("snapshot_write_failed path=" + path, e);
        }
    }

    // corrupt lines are collected, not fatal
    public LoadResult load(Path path) {
        if (!Files.isRegularFile(path)) {
            return new LoadResult(List.of(), List.of());
        }
        List<SnapshotRecord> records = new ArrayList<>();
        List<IndexCorruptionException> corrupt = new ArrayList<>();
        try (BufferedReader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            String line;
            int lineNumber = 0;
            while ((line = reader.readLine()) != null) {
                lineNumber++;
                if (line.isBlank()) {
                    continue;
                }
                try {
                    SnapshotRecord record = objectMapper.readValue(line, SnapshotRecord.class);
                    if (record.getDocId() == null || record.getDocId().isBlank()) {
                        throw new IndexCorruptionException("snapshot_missing_doc_id line=" + lineNumber);
                    }
                    records.add(record);
                } catch (JsonProcessingException e) {
                    corrupt.add(new IndexCorruptionException("snapshot_invalid_json line=" + lineNumber, e));
                } catch (IndexCorruptionException e) {
                    corrupt.add(e);
                }
            }
        } catch (IOException e) {
            throw new IndexCorruptionException("snapshot_unreadable path=" + path, e);
        }
        return new LoadResult(records, corrupt);
    }

    public static final class LoadResult {
        private final List<SnapshotRecord> records;
        private final List<IndexCorruptionException> corruptions;

        public LoadResult(List<SnapshotRecord> records, List<IndexCorruptionException> corruptions) {
            this.records = List.copyOf(records);
            this.corruptions = List.copyOf(corruptions);
        }

        public List<SnapshotRecord> getRecords() {
            return records;
        }

        public List<IndexCorruptionException> getCorruptions() {
            return corruptions;
        }

        public boolean isCorrupt() {
            return !corruptions.isEmpty();
        }
    }
}
