package com.tsl.search.ingest;

import com.tsl.search.model.Document;
import com.tsl.search.model.RawDocument;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;
import org.springframework.stereotype.Component;

@Component
public class DocumentRegistry {
    private final ConcurrentHashMap<String, Document> documents = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, RawDocument> raws = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, DocumentStatus> statuses = new ConcurrentHashMap<>();
    private final Set<String> visible = ConcurrentHashMap.newKeySet();
    private final ConcurrentHashMap<String, DocLock> locks = new ConcurrentHashMap<>();

    public <T> T withLock(String docId, Supplier<T> action) {
        DocLock docLock = locks.compute(docId, (key, existing) -> {
            DocLock held = existing == null ? new DocLock() : existing;
            held.users++;
            return held;
        });
        docLock.lock.lock();
        try {
            return action.get();
        } finally {
            docLock.lock.unlock();
            locks.computeIfPresent(docId, (key, held) -> --held.users == 0 ? null : held);
        }
    }

    int activeLocks() {
        return locks.size();
    }

    public Optional<Document> get(String docId) {
        return docId == null ? Optional.empty() : Optional.ofNullable(documents.get(docId));
    }

    public Optional<RawDocument> getRaw(String docId) {
        return docId == null ? Optional.empty() : Optional.ofNullable(raws.get(docId));
    }

    public Optional<DocumentStatus> status(String docId) {
        return docId == null ? Optional.empty() : Optional.ofNullable(statuses.get(docId));
    }

    public DocumentStatus updateState(String docId, DocumentState state, String reason) {
        DocumentStatus status = new DocumentStatus(docId, state, reason, System.currentTimeMillis());
        statuses.put(docId, status);
        return status;
    }

    public void putIndexed(Document document, RawDocument raw) {
        documents.put(document.getDocId(), document);
        if (raw != null) {
            raws.put(document.getDocId(), raw);
        }
        visible.add(document.getDocId());
    }

    public void hide(String docId) {
        visible.remove(docId);
    }

    public boolean isVisible(String docId) {
        return docId != null && visible.contains(docId);
    }

    public void remove(String docId) {
        visible.remove(docId);
        documents.remove(docId);
        raws.remove(docId);
        statuses.remove(docId);
    }

    // raws survive; a rebuild replays them
    public void clearIndexed() {
        visible.clear();
        documents.clear();
    }

    public Map<String, Document> visibleDocuments(Collection<String> docIds) {
        Map<String, Document> snapshot = new HashMap<>();
        for (String docId : docIds) {
            if (docId == null || !visible.contains(docId)) {
                continue;
            }
            Document document = documents.get(docId);
            if (document != null) {
                snapshot.put(docId, document);
            }
        }
        return snapshot;
    }

    public Set<String> visibleIds() {
        return Collections.unmodifiableSet(new TreeSet<>(visible));
    }

    public Set<String> indexedIds() {
        return Collections.unmodifiableSet(new TreeSet<>(documents.keySet()));
    }

    public List<RawDocument> raws() {
        List<RawDocument> all = new ArrayList<>(raws.values());
        all.sort((a, b) -> a.getDocId().compareTo(b.getDocId()));
        return all;
    }

    public List<Document> documents() {
        List<Document> all = new ArrayList<>(documents.values());
        all.sort((a, b) -> a.getDocId().compareTo(b.getDocId()));
        return all;
    }

    public int size() {
        return documents.size();
    }

    // users is only read and written inside ConcurrentHashMap.compute for the owning key
    private static final class DocLock {
        private final ReentrantLock lock = new ReentrantLock();
        private int users;
    }
}
