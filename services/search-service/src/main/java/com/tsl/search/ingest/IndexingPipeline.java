package com.tsl.search.ingest;

import com.tsl.search.embed.EmbeddingProvider;
import com.tsl.search.embed.EmbeddingUnavailableException;
import com.tsl.search.extract.ExtractionCancelledException;
import com.tsl.search.extract.ExtractionResult;
import com.tsl.search.extract.FieldExtractor;
import com.tsl.search.index.IndexHealth;
import com.tsl.search.index.IndexWriteException;
import com.tsl.search.index.LexicalIndex;
import com.tsl.search.index.VectorIndex;
import com.tsl.search.model.Document;
import com.tsl.search.model.RawDocument;
import com.tsl.search.model.StructuredFields;
import com.tsl.search.resilience.Backoff;
import com.tsl.search.taxonomy.ActivityMatcher;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.locks.ReentrantLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.stereotype.Service;

@Service
@EnableConfigurationProperties(IndexingProperties.class)
public class IndexingPipeline {
    private static final Logger log = LoggerFactory.getLogger(IndexingPipeline.class);

    private final DocumentRegistry registry;
    private final FieldExtractor fieldExtractor;
    private final EmbeddingProvider embeddingProvider;
    private final LexicalIndex lexicalIndex;
    private final VectorIndex vectorIndex;
    private final ActivityMatcher activityMatcher;
    private final IndexHealth indexHealth;
    private final IndexingProperties properties;
    private final ExecutorService indexingExecutor;
    private final MeterRegistry meterRegistry;
    private final ReentrantLock rebuildLock = new ReentrantLock();
    private final ReentrantReadWriteLock writeGate = new ReentrantReadWriteLock();

    public IndexingPipeline(
        DocumentRegistry registry,
        FieldExtractor fieldExtractor,
        EmbeddingProvider embeddingProvider,
        LexicalIndex lexicalIndex,
        VectorIndex vectorIndex,
        ActivityMatcher activityMatcher,
        IndexHealth indexHealth,
        IndexingProperties properties,
        @Qualifier("indexingExecutor") ExecutorService indexingExecutor,
        MeterRegistry meterRegistry
    ) {
        this.registry = registry;
        this.fieldExtractor = fieldExtractor;
        this.embeddingProvider = embeddingProvider;
        this.lexicalIndex = lexicalIndex;
        this.vectorIndex = vectorIndex;
        this.activityMatcher = activityMatcher;
        this.indexHealth = indexHealth;
        this.properties = properties;
        this.indexingExecutor = indexingExecutor;
        this.meterRegistry = meterRegistry;
    }

    public DocumentStatus upsert(RawDocument raw) {
        writeGate.readLock().lock();
        try {
            return upsertGated(raw);
        } finally {
            writeGate.readLock().unlock();
        }
    }

    private DocumentStatus upsertGated(RawDocument raw) {
        String invalid = validate(raw);
        if (invalid != null) {
            String docId = raw == null ? null : raw.getDocId();
            log.warn("document_skipped doc_id={} reason={}", docId, invalid);
            count(DocumentState.SKIPPED);
            if (docId == null || docId.isBlank() || hasIllegalChars(docId)) {
                return new DocumentStatus(docId, DocumentState.SKIPPED, invalid, System.currentTimeMillis());
            }
            return registry.withLock(docId, () -> {
                if (registry.get(docId).isPresent()) {
                    // A bad update must not clobber the state of the version still being served.
                    return new DocumentStatus(docId, DocumentState.SKIPPED, invalid, System.currentTimeMillis());
                }
                return registry.updateState(docId, DocumentState.SKIPPED, invalid);
            });
        }
        return registry.withLock(raw.getDocId(), () -> index(raw));
    }

    public IndexingReport upsertAll(List<RawDocument> batch) {
        long started = System.nanoTime();
        List<String> ids = new ArrayList<>(batch.size());
        List<Callable<DocumentStatus>> tasks = new ArrayList<>(batch.size());
        for (RawDocument raw : batch) {
            ids.add(raw == null ? null : raw.getDocId());
            tasks.add(() -> upsert(raw));
        }
        IndexingReport report = runAll(ids, tasks, started);
        log.info(
            "batch_indexed total={} indexed={} failed={} skipped={} took_ms={}",
            report.getTotal(),
            report.count(DocumentState.INDEXED),
            report.count(DocumentState.FAILED),
            report.count(DocumentState.SKIPPED),
            report.getTookMs()
        );
        return report;
    }

    // hidden from queries before either index is touched
    public boolean delete(String docId) {
        if (docId == null || docId.isBlank()) {
            return false;
        }
        writeGate.readLock().lock();
        try {
            return registry.withLock(docId, () -> {
                boolean known = registry.status(docId).isPresent() || registry.get(docId).isPresent();
                registry.hide(docId);
                boolean lexical = lexicalIndex.delete(docId);
                boolean vector = vectorIndex.delete(docId);
                registry.remove(docId);
                if (known || lexical || vector) {
                    log.info("document_deleted doc_id={}", docId);
                    return true;
                }
                return false;
            });
        } finally {
            writeGate.readLock().unlock();
        }
    }

    public IndexingReport rebuild() {
        rebuildLock.lock();
        try {
            long started = System.nanoTime();
            indexHealth.markInconsistent("index_rebuilding");
            List<String> ids = new ArrayList<>();
            writeGate.writeLock().lock();
            try {
                for (RawDocument raw : registry.raws()) {
                    ids.add(raw.getDocId());
                }
                lexicalIndex.clear();
                vectorIndex.clear();
                registry.clearIndexed();
            } finally {
                writeGate.writeLock().unlock();
            }
            log.info("index_rebuild_started documents={}", ids.size());
            List<Callable<DocumentStatus>> tasks = new ArrayList<>(ids.size());
            for (String docId : ids) {
                tasks.add(() -> replay(docId));
            }
            IndexingReport report = runAll(ids, tasks, started);
            List<String> problems = IndexConsistencyChecker.check(registry, lexicalIndex, vectorIndex);
            if (problems.isEmpty()) {
                indexHealth.markHealthy();
            } else {
                indexHealth.markInconsistent("index_inconsistent_after_rebuild");
                log.error("index_rebuild_inconsistent problems={}", problems);
            }
            log.info(
                "index_rebuild_finished indexed={} failed={} took_ms={}",
                report.count(DocumentState.INDEXED),
                report.count(DocumentState.FAILED),
                report.getTookMs()
            );
            return report;
        } finally {
            rebuildLock.unlock();
        }
    }

    public void restore(Document document, RawDocument raw) {
        writeGate.readLock().lock();
        try {
            registry.withLock(document.getDocId(), () -> {
                lexicalIndex.upsert(document);
                vectorIndex.upsert(document);
                registry.putIndexed(document, raw);
                registry.updateState(document.getDocId(), DocumentState.INDEXED, null);
                return null;
            });
        } finally {
            writeGate.readLock().unlock();
        }
    }

    private DocumentStatus replay(String docId) {
        writeGate.readLock().lock();
        try {
            return registry.withLock(docId, () -> {
                RawDocument current = registry.getRaw(docId).orElse(null);
                if (current == null) {
                    log.debug("rebuild_skipped doc_id={} reason=deleted", docId);
                    return null;
                }
                return index(current);
            });
        } finally {
            writeGate.readLock().unlock();
        }
    }

    // a null status marks a document deleted while the batch ran; it is left out of the report
    private IndexingReport runAll(List<String> ids, List<Callable<DocumentStatus>> tasks, long started) {
        List<Future<DocumentStatus>> futures = new ArrayList<>(tasks.size());
        for (Callable<DocumentStatus> task : tasks) {
            futures.add(indexingExecutor.submit(task));
        }
        List<DocumentStatus> statuses = new ArrayList<>(futures.size());
        for (int i = 0; i < futures.size(); i++) {
            String docId = ids.get(i);
            try {
                DocumentStatus status = futures.get(i).get();
                if (status != null) {
                    statuses.add(status);
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                futures.forEach(future -> future.cancel(true));
                throw new IndexWriteException("indexing_interrupted", e);
            } catch (ExecutionException e) {
                log.error("document_failed doc_id={} reason=unexpected_error", docId, e.getCause());
                statuses.add(new DocumentStatus(docId, DocumentState.FAILED, "unexpected_error", System.currentTimeMillis()));
            }
        }
        return new IndexingReport(statuses, (System.nanoTime() - started) / 1_000_000L);
    }

    private DocumentStatus index(RawDocument raw) {
        String docId = raw.getDocId();
        Document previous = registry.get(docId).orElse(null);
        registry.updateState(docId, DocumentState.PENDING, null);

        ExtractionResult extraction;
        try {
            extraction = fieldExtractor.extract(raw.getTitle(), raw.getBodyText());
        } catch (ExtractionCancelledException e) {
            return fail(docId, previous, "interrupted", false, e);
        }
        StructuredFields fields = extraction.getFields()
            .withAdditionalActivities(activityMatcher.matchAll(raw.getActivities()));
        registry.updateState(docId, DocumentState.EXTRACTED, extraction.getOutcome().isFallback()
            ? extraction.getOutcome().label()
            : null);

        Document document = new Document(docId, raw.getTitle(), raw.getBodyText(), fields, null);
        String embedText = embeddingText(document);
        int maxAttempts = Math.max(1, properties.getWriteMaxAttempts());
        Backoff backoff = Backoff.fixed(properties.getWriteBackoffMs());

        RuntimeException lastError = null;
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            try {
                lexicalIndex.upsert(document);
                lastError = null;
                break;
            } catch (IndexWriteException e) {
                lastError = e;
                log.debug("lexical_write_failed doc_id={} attempt={} reason={}", docId, attempt, e.getMessage());
            }
            if (!pause(backoff, attempt, maxAttempts)) {
                return fail(docId, previous, "interrupted", false, null);
            }
        }
        if (lastError != null) {
            return fail(docId, previous, "lexical_write_failed", false, lastError);
        }

        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            try {
                float[] embedding = VectorIndex.toFloats(embeddingProvider.embed(embedText, null));
                document = document.withEmbedding(embedding);
                vectorIndex.upsert(document);
                lastError = null;
                break;
            } catch (EmbeddingUnavailableException | IndexWriteException e) {
                lastError = e;
                log.debug("vector_write_failed doc_id={} attempt={} reason={}", docId, attempt, e.getMessage());
                if (Thread.currentThread().isInterrupted()) {
                    return fail(docId, previous, "interrupted", true, e);
                }
                if (e instanceof EmbeddingUnavailableException unavailable && !unavailable.isRetryable()) {
                    break;
                }
            }
            if (!pause(backoff, attempt, maxAttempts)) {
                return fail(docId, previous, "interrupted", true, null);
            }
        }
        if (lastError != null) {
            String reason = lastError instanceof EmbeddingUnavailableException
                ? "embedding_failed"
                : "vector_write_failed";
            return fail(docId, previous, reason, true, lastError);
        }

        registry.putIndexed(document, raw);
        count(DocumentState.INDEXED);
        log.debug("document_indexed doc_id={} activities={} partial={}",
            docId, fields.getActivities(), fields.isPartial());
        return registry.updateState(docId, DocumentState.INDEXED, null);
    }

    private boolean pause(Backoff backoff, int attempt, int maxAttempts) {
        if (attempt >= maxAttempts) {
            return true;
        }
        try {
            backoff.pause(attempt);
            return true;
        } catch (InterruptedException e) {
            return false;
        }
    }

    private DocumentStatus fail(
        String docId,
        Document previous,
        String reason,
        boolean lexicalWritten,
        Throwable cause
    ) {
        if (lexicalWritten) {
            rollbackLexical(docId, previous);
        }
        count(DocumentState.FAILED);
        if (cause == null) {
            log.error("document_failed doc_id={} reason={} kept_previous={}", docId, reason, previous != null);
        } else {
            log.error("document_failed doc_id={} reason={} kept_previous={} cause={}",
                docId, reason, previous != null, cause.getMessage());
        }
        return registry.updateState(docId, DocumentState.FAILED, reason);
    }

    private void rollbackLexical(String docId, Document previous) {
        if (previous == null) {
            lexicalIndex.delete(docId);
        } else {
            lexicalIndex.upsert(previous);
        }
    }

    private void count(DocumentState state) {
        meterRegistry.counter("ts_index_documents_total", "state", state.label()).increment();
    }

    static String embeddingText(Document document) {
        String title = document.getTitle().trim();
        String body = document.getBodyText().trim();
        if (title.isEmpty()) {
            return body;
        }
        if (body.isEmpty()) {
            return title;
        }
        return title + "\n" + body;
    }

    static String validate(RawDocument raw) {
        if (raw == null) {
            return "missing_document";
        }
        String docId = raw.getDocId();
        if (docId == null || docId.isBlank()) {
            return "missing_doc_id";
        }
        if (hasIllegalChars(docId)) {
            return "invalid_doc_id";
        }
        boolean noTitle = raw.getTitle() == null || raw.getTitle().isBlank();
        boolean noBody = raw.getBodyText() == null || raw.getBodyText().isBlank();
        if (noTitle && noBody) {
            return "empty_content";
        }
        return null;
    }

    private static boolean hasIllegalChars(String docId) {
        for (int i = 0; i < docId.length(); i++) {
            char ch = docId.charAt(i);
            if (Character.isWhitespace(ch) || Character.isISOControl(ch)) {
                return true;
            }
        }
        return false;
    }
}
