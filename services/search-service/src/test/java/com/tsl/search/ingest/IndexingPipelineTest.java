package com.tsl.search.ingest;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import com.tsl.search.embed.EmbeddingProvider;
import com.tsl.search.embed.EmbeddingUnavailableException;
import com.tsl.search.embed.ToyEmbedder;
import com.tsl.search.extract.ExtractionOutcome;
import com.tsl.search.extract.ExtractionResult;
import com.tsl.search.extract.FieldExtractor;
import com.tsl.search.index.IndexHealth;
import com.tsl.search.index.LexicalIndex;
import com.tsl.search.index.VectorIndex;
import com.tsl.search.model.Document;
import com.tsl.search.model.RankedEntry;
import com.tsl.search.model.RawDocument;
import com.tsl.search.model.StructuredFields;
import com.tsl.search.model.StructuredFilter;
import com.tsl.search.taxonomy.ActivityMatcher;
import com.tsl.search.taxonomy.TaxonomyLoader;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.util.Arrays;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import java.util.stream.Collectors;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class IndexingPipelineTest {
    private static final ActivityMatcher MATCHER = new ActivityMatcher(
        new TaxonomyLoader().load("classpath:taxonomy/travel-taxonomy.yml"),
        ActivityMatcher.DEFAULT_SIMILARITY_THRESHOLD
    );
    private static final int DIMENSION = 64;

    private final ToyEmbedder toyEmbedder = new ToyEmbedder(DIMENSION);
    private final AtomicBoolean embeddingDown = new AtomicBoolean(false);
    private final AtomicBoolean embeddingRejects = new AtomicBoolean(false);
    private final AtomicInteger embedCalls = new AtomicInteger();

    private DocumentRegistry registry;
    private FieldExtractor fieldExtractor;
    private LexicalIndex lexicalIndex;
    private VectorIndex vectorIndex;
    private IndexHealth indexHealth;
    private SimpleMeterRegistry meterRegistry;
    private ExecutorService executor;
    private IndexingPipeline pipeline;

    @BeforeEach
    void setUp() {
        registry = new DocumentRegistry();
        fieldExtractor = mock(FieldExtractor.class);
        when(fieldExtractor.extract(any(), any())).thenAnswer(invocation -> new ExtractionResult(
            new StructuredFields("Male", "Maldives", Set.of("beach"), null, false),
            ExtractionOutcome.EXTRACTED,
            1,
            null
        ));
        EmbeddingProvider embeddings = (text, budget) -> {
            embedCalls.incrementAndGet();
            if (embeddingDown.get()) {
                throw new EmbeddingUnavailableException("embed_timeout");
            }
            if (embeddingRejects.get()) {
                throw new EmbeddingUnavailableException("embed_dimension_mismatch", false);
            }
            return toyEmbedder.embed(text);
        };
        lexicalIndex = new LexicalIndex(1.2, 0.75);
        vectorIndex = new VectorIndex(DIMENSION);
        indexHealth = new IndexHealth();
        IndexingProperties properties = new IndexingProperties();
        properties.setWriteMaxAttempts(2);
        properties.setWriteBackoffMs(0L);
        meterRegistry = new SimpleMeterRegistry();
        executor = Executors.newFixedThreadPool(4);
        pipeline = pipeline(executor, embeddings, properties);
    }

    private IndexingPipeline pipeline(ExecutorService workers, EmbeddingProvider embeddings, IndexingProperties properties) {
        return new IndexingPipeline(
            registry,
            fieldExtractor,
            embeddings,
            lexicalIndex,
            vectorIndex,
            MATCHER,
            indexHealth,
            properties,
            workers,
            meterRegistry
        );
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Test
    void indexesIntoBothIndexesAndBecomesVisible() {
        DocumentStatus status = pipeline.upsert(raw("maldives-1", "Reef days", "Snorkelling and sunbathing.", List.of()));

        assertThat(status.getState()).isEqualTo(DocumentState.INDEXED);
        assertThat(lexicalIndex.contains("maldives-1")).isTrue();
        assertThat(vectorIndex.contains("maldives-1")).isTrue();
        assertThat(registry.isVisible("maldives-1")).isTrue();
        assertThat(registry.status("maldives-1")).get().extracting(DocumentStatus::getState)
            .isEqualTo(DocumentState.INDEXED);
        assertThat(meterRegistry.counter("ts_index_documents_total", "state", "indexed").count()).isEqualTo(1.0);
    }

    @Test
    void declaredActivitiesAreCanonicalizedAndMerged() {
        pipeline.upsert(raw("maldives-1", "Reef days", "Turquoise water.", List.of("snorkelling", "scuba")));

        Document document = registry.get("maldives-1").orElseThrow();
        assertThat(document.getFields().getActivities()).containsExactly("beach", "diving", "snorkeling");

        StructuredFilter snorkeling = new StructuredFilter(null, null, Set.of("snorkeling"));
        assertThat(lexicalIndex.search("snorkeling", snorkeling, 10)).extracting(RankedEntry::getDocId)
            .containsExactly("maldives-1");
    }

    @Test
    void invalidDocumentsAreSkipped() {
        assertThat(pipeline.upsert(raw("empty", " ", null, List.of())).getReason()).isEqualTo("empty_content");
        assertThat(pipeline.upsert(raw("bad id", "Title", "Body", List.of())).getReason()).isEqualTo("invalid_doc_id");
        assertThat(pipeline.upsert(raw(null, "Title", "Body", List.of())).getReason()).isEqualTo("missing_doc_id");
        assertThat(pipeline.upsert(null).getReason()).isEqualTo("missing_document");

        assertThat(registry.status("empty")).get().extracting(DocumentStatus::getState)
            .isEqualTo(DocumentState.SKIPPED);
        assertThat(lexicalIndex.size()).isZero();
        assertThat(vectorIndex.size()).isZero();
    }

    @Test
    void invalidUpdateLeavesServedVersionAlone() {
        pipeline.upsert(raw("doc-1", "Lisbon hikes", "Coastal trails.", List.of()));

        DocumentStatus status = pipeline.upsert(raw("doc-1", "", "", List.of()));

        assertThat(status.getState()).isEqualTo(DocumentState.SKIPPED);
        assertThat(registry.status("doc-1")).get().extracting(DocumentStatus::getState)
            .isEqualTo(DocumentState.INDEXED);
        assertThat(registry.get("doc-1")).get().extracting(Document::getTitle).isEqualTo("Lisbon hikes");
    }

    @Test
    void embeddingFailureRollsBackLexicalWriteOfNewDocument() {
        embeddingDown.set(true);

        DocumentStatus status = pipeline.upsert(raw("doc-1", "Lisbon hikes", "Coastal trails.", List.of()));

        assertThat(status.getState()).isEqualTo(DocumentState.FAILED);
        assertThat(status.getReason()).isEqualTo("embedding_failed");
        assertThat(embedCalls.get()).isEqualTo(2);
        assertThat(lexicalIndex.contains("doc-1")).isFalse();
        assertThat(vectorIndex.contains("doc-1")).isFalse();
        assertThat(registry.isVisible("doc-1")).isFalse();
    }

    @Test
    void nonRetryableEmbeddingFailureIsNotRetried() {
        embeddingRejects.set(true);

        DocumentStatus status = pipeline.upsert(raw("doc-1", "Lisbon hikes", "Coastal trails.", List.of()));

        assertThat(status.getState()).isEqualTo(DocumentState.FAILED);
        assertThat(status.getReason()).isEqualTo("embedding_failed");
        assertThat(embedCalls.get()).isEqualTo(1);
        assertThat(lexicalIndex.contains("doc-1")).isFalse();
    }

    @Test
    void embeddingFailureKeepsPreviousVersionServed() {
        pipeline.upsert(raw("doc-1", "Lisbon hikes", "Coastal trails.", List.of()));
        embeddingDown.set(true);

        DocumentStatus status = pipeline.upsert(raw("doc-1", "Porto wine", "Port cellars.", List.of()));

        assertThat(status.getState()).isEqualTo(DocumentState.FAILED);
        assertThat(registry.isVisible("doc-1")).isTrue();
        assertThat(registry.get("doc-1")).get().extracting(Document::getTitle).isEqualTo("Lisbon hikes");
        assertThat(lexicalIndex.search("cellars", null, 10)).isEmpty();
        assertThat(lexicalIndex.search("trails", null, 10)).extracting(RankedEntry::getDocId).containsExactly("doc-1");
        assertThat(IndexConsistencyChecker.check(registry, lexicalIndex, vectorIndex)).isEmpty();
    }

    @Test
    void reindexingSameInputIsIdempotent() {
        RawDocument input = raw("doc-1", "Kyoto temples", "Tea ceremony and temples.", List.of("tea ceremony"));
        pipeline.upsert(input);
        Document first = registry.get("doc-1").orElseThrow();

        pipeline.upsert(input);
        Document second = registry.get("doc-1").orElseThrow();

        assertThat(second.sameContent(first)).isTrue();
        assertThat(Arrays.equals(second.getEmbedding(), first.getEmbedding())).isTrue();
        assertThat(lexicalIndex.size()).isEqualTo(1);
        assertThat(vectorIndex.size()).isEqualTo(1);
    }

    @Test
    void indexedDocumentIsRetrievableFromBothIndexes() {
        pipeline.upsertAll(List.of(
            raw("reef", "Reef trip", "A day on the boat over coral.", List.of("snorkelling")),
            raw("museum", "Paris museums", "Louvre and Orsay.", List.of()),
            raw("food", "Rome food", "Pasta class.", List.of())
        ));

        List<RankedEntry> lexical = lexicalIndex.search("snorkeling", null, 10);
        assertThat(lexical).extracting(RankedEntry::getDocId).containsExactly("reef");
        assertThat(lexical.get(0).getRawScore()).isGreaterThan(0.0);

        Document reef = registry.get("reef").orElseThrow();
        List<RankedEntry> vector = vectorIndex.search(toyEmbedder.embed(IndexingPipeline.embeddingText(reef)), null, 3);
        assertThat(vector.get(0).getDocId()).isEqualTo("reef");
    }

    @Test
    void reindexingUnchangedDocumentKeepsRankingsAndScores() {
        pipeline.upsertAll(List.of(
            raw("a", "Lisbon hikes", "Coastal trails and cliffs.", List.of()),
            raw("b", "Porto hikes", "River trails and port cellars.", List.of()),
            raw("c", "Madeira levadas", "Trails along irrigation channels.", List.of())
        ));
        List<Double> query = toyEmbedder.embed("coastal trails");
        List<String> lexicalBefore = describe(lexicalIndex.search("coastal trails", null, 10));
        List<String> vectorBefore = describe(vectorIndex.search(query, null, 10));

        pipeline.upsert(raw("b", "Porto hikes", "River trails and port cellars.", List.of()));

        assertThat(describe(lexicalIndex.search("coastal trails", null, 10))).isEqualTo(lexicalBefore);
        assertThat(describe(vectorIndex.search(query, null, 10))).isEqualTo(vectorBefore);
    }

    @Test
    void documentLocksAreReleasedAfterWrites() {
        pipeline.upsert(raw("doc-1", "Lisbon hikes", "Coastal trails.", List.of()));
        pipeline.upsert(raw("doc-2", "Porto wine", "Port cellars.", List.of()));
        pipeline.delete("doc-1");
        pipeline.delete("missing");

        assertThat(registry.activeLocks()).isZero();
    }

    @Test
    void deleteDuringRebuildIsNotUndone() throws Exception {
        pipeline.upsertAll(List.of(
            raw("a", "Paris museums", "Louvre and Orsay.", List.of()),
            raw("b", "Rome food", "Pasta class.", List.of())
        ));
        AtomicBoolean holdNext = new AtomicBoolean(true);
        AtomicReference<String> heldTitle = new AtomicReference<>();
        CountDownLatch held = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        when(fieldExtractor.extract(any(), any())).thenAnswer(invocation -> {
            if (holdNext.compareAndSet(true, false)) {
                heldTitle.set(invocation.getArgument(0));
                held.countDown();
                release.await(5, TimeUnit.SECONDS);
            }
            return new ExtractionResult(
                new StructuredFields("Paris", "France", Set.of(), null, false),
                ExtractionOutcome.EXTRACTED,
                1,
                null
            );
        });
        ExecutorService single = Executors.newSingleThreadExecutor();
        ExecutorService caller = Executors.newSingleThreadExecutor();
        IndexingProperties properties = new IndexingProperties();
        properties.setWriteBackoffMs(0L);
        IndexingPipeline rebuilding = pipeline(single, (text, budget) -> toyEmbedder.embed(text), properties);
        try {
            Future<IndexingReport> rebuild = caller.submit(rebuilding::rebuild);
            assertThat(held.await(5, TimeUnit.SECONDS)).isTrue();
            String kept = "Paris museums".equals(heldTitle.get()) ? "a" : "b";
            String deleted = "a".equals(kept) ? "b" : "a";

            assertThat(rebuilding.delete(deleted)).isTrue();
            release.countDown();
            IndexingReport report = rebuild.get(5, TimeUnit.SECONDS);

            assertThat(report.getTotal()).isEqualTo(1);
            assertThat(report.count(DocumentState.INDEXED)).isEqualTo(1);
            assertThat(lexicalIndex.docIds()).containsExactly(kept);
            assertThat(vectorIndex.docIds()).containsExactly(kept);
            assertThat(registry.getRaw(deleted)).isEmpty();
            assertThat(registry.status(deleted)).isEmpty();
            assertThat(indexHealth.isConsistent()).isTrue();
        } finally {
            release.countDown();
            single.shutdownNow();
            caller.shutdownNow();
        }
    }

    @Test
    void deleteRemovesFromEverywhere() {
        pipeline.upsert(raw("doc-1", "Lisbon hikes", "Coastal trails.", List.of()));

        assertThat(pipeline.delete("doc-1")).isTrue();
        assertThat(pipeline.delete("doc-1")).isFalse();

        assertThat(lexicalIndex.contains("doc-1")).isFalse();
        assertThat(vectorIndex.contains("doc-1")).isFalse();
        assertThat(registry.isVisible("doc-1")).isFalse();
        assertThat(registry.status("doc-1")).isEmpty();
    }

    @Test
    void batchReportCountsEveryOutcome() {
        IndexingReport report = pipeline.upsertAll(List.of(
            raw("a", "Paris museums", "Louvre and Orsay.", List.of()),
            raw("b", "Rome food", "Pasta class.", List.of("cooking classes")),
            raw("c", "", "", List.of())
        ));

        assertThat(report.getTotal()).isEqualTo(3);
        assertThat(report.count(DocumentState.INDEXED)).isEqualTo(2);
        assertThat(report.count(DocumentState.SKIPPED)).isEqualTo(1);
        assertThat(report.getSkippedIds()).containsExactly("c");
        assertThat(report.getFailedIds()).isEmpty();
    }

    @Test
    void rebuildReindexesFromRawsAndRestoresHealth() {
        pipeline.upsertAll(List.of(
            raw("a", "Paris museums", "Louvre and Orsay.", List.of()),
            raw("b", "Rome food", "Pasta class.", List.of())
        ));
        lexicalIndex.delete("a");

        IndexingReport report = pipeline.rebuild();

        assertThat(report.count(DocumentState.INDEXED)).isEqualTo(2);
        assertThat(lexicalIndex.docIds()).containsExactly("a", "b");
        assertThat(vectorIndex.docIds()).containsExactly("a", "b");
        assertThat(indexHealth.isConsistent()).isTrue();
    }

    @Test
    void embeddingTextJoinsTitleAndBody() {
        Document document = new Document("d", " Title ", "Body", null, null);

        assertThat(IndexingPipeline.embeddingText(document)).isEqualTo("Title\nBody");
        assertThat(IndexingPipeline.embeddingText(new Document("d", "", "Body", null, null))).isEqualTo("Body");
    }

    private static List<String> describe(List<RankedEntry> ranked) {
        return ranked.stream()
            .map(entry -> entry.getDocId() + "#" + entry.getRank() + "@" + entry.getRawScore())
            .collect(Collectors.toList());
    }

    private static RawDocument raw(String id, String title, String body, List<String> activities) {
        return new RawDocument(id, title, body, activities);
    }
}
