package com.tsl.search.service;

import com.tsl.search.embed.EmbeddingProvider;
import com.tsl.search.index.IndexHealth;
import com.tsl.search.ingest.DocumentRegistry;
import com.tsl.search.merge.RrfFusion;
import com.tsl.search.model.Document;
import com.tsl.search.model.FusedResult;
import com.tsl.search.model.RankedEntry;
import com.tsl.search.model.StructuredFilter;
import com.tsl.search.query.QueryRewriter;
import com.tsl.search.query.RewriteResult;
import com.tsl.search.retrieval.LexicalRetriever;
import com.tsl.search.retrieval.RetrievalStageContext;
import com.tsl.search.retrieval.RetrievalStageResult;
import com.tsl.search.retrieval.Retriever;
import com.tsl.search.retrieval.VectorRetriever;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

@Service
public class HybridSearchService {
    private static final Logger log = LoggerFactory.getLogger(HybridSearchService.class);

    private final QueryRewriter queryRewriter;
    private final EmbeddingProvider embeddingProvider;
    private final LexicalRetriever lexicalRetriever;
    private final VectorRetriever vectorRetriever;
    private final DocumentRegistry registry;
    private final IndexHealth indexHealth;
    private final SearchProperties properties;
    private final ExecutorService searchExecutor;
    private final MeterRegistry meterRegistry;

    public HybridSearchService(
        QueryRewriter queryRewriter,
        EmbeddingProvider embeddingProvider,
        LexicalRetriever lexicalRetriever,
        VectorRetriever vectorRetriever,
        DocumentRegistry registry,
        IndexHealth indexHealth,
        SearchProperties properties,
        @Qualifier("searchExecutor") ExecutorService searchExecutor,
        MeterRegistry meterRegistry
    ) {
        this.queryRewriter = queryRewriter;
        this.embeddingProvider = embeddingProvider;
        this.lexicalRetriever = lexicalRetriever;
        this.vectorRetriever = vectorRetriever;
        this.registry = registry;
        this.indexHealth = indexHealth;
        this.properties = properties;
        this.searchExecutor = searchExecutor;
        this.meterRegistry = meterRegistry;
    }

    public SearchOutcome search(SearchCommand command) {
        if (command == null || command.getQuery() == null || command.getQuery().isBlank()) {
            throw new InvalidSearchRequestException("query_required");
        }
        indexHealth.ensureConsistent();

        long started = System.nanoTime();
        String query = command.getQuery().trim();
        SearchMode mode = command.getMode();
        int limit = resolveLimit(command.getLimit());
        int candidateTopK = Math.max(limit, properties.getCandidateTopK());
        int stageTimeoutMs = properties.getStageTimeoutMs();
        meterRegistry.counter("ts_search_total", "mode", mode.label()).increment();

        List<Future<?>> children = new ArrayList<>();
        try {
            Future<List<Double>> embeddingFuture = null;
            if (mode.usesVector()) {
                embeddingFuture = searchExecutor.submit(() -> embeddingProvider.embed(query, stageTimeoutMs));
                children.add(embeddingFuture);
            }
            RewriteResult rewrite = RewriteResult.skipped();
            if (mode.usesRewrite()) {
                Future<RewriteResult> rewriteFuture = searchExecutor.submit(() -> queryRewriter.rewrite(query));
                children.add(rewriteFuture);
                rewrite = awaitRewrite(rewriteFuture);
            }
            StructuredFilter filter = rewrite.getFilter();

            Future<RetrievalStageResult> lexicalFuture = null;
            Future<RetrievalStageResult> vectorFuture = null;
            long lexicalDeadline = 0L;
            long vectorDeadline = 0L;
            if (mode.usesLexical()) {
                RetrievalStageContext context = new RetrievalStageContext(query, filter, candidateTopK, stageTimeoutMs, null);
                lexicalFuture = searchExecutor.submit(() -> lexicalRetriever.retrieve(context));
                lexicalDeadline = System.nanoTime() + TimeUnit.MILLISECONDS.toNanos(stageTimeoutMs);
                children.add(lexicalFuture);
            }
            if (mode.usesVector()) {
                RetrievalStageContext context = new RetrievalStageContext(
                    query, filter, candidateTopK, stageTimeoutMs, embeddingFuture
                );
                vectorFuture = searchExecutor.submit(() -> vectorRetriever.retrieve(context));
                vectorDeadline = System.nanoTime() + TimeUnit.MILLISECONDS.toNanos(stageTimeoutMs);
                children.add(vectorFuture);
            }

            RetrievalStageResult lexicalResult = lexicalFuture == null
                ? RetrievalStageResult.skipped("mode_" + mode.label())
                : awaitStage(lexicalFuture, lexicalDeadline);
            RetrievalStageResult vectorResult = vectorFuture == null
                ? RetrievalStageResult.skipped("mode_" + mode.label())
                : awaitStage(vectorFuture, vectorDeadline);
            if (embeddingFuture != null && !embeddingFuture.isDone()) {
                embeddingFuture.cancel(true);
            }

            // One snapshot for both lists: a concurrent delete drops a document from both or neither.
            Map<String, Document> visible = registry.visibleDocuments(candidateIds(lexicalResult, vectorResult));
            lexicalResult = visibleOnly(lexicalResult, visible);
            vectorResult = visibleOnly(vectorResult, visible);

            return assemble(mode, limit, rewrite, lexicalResult, vectorResult, visible, started);
        } catch (InterruptedException e) {
            children.forEach(child -> child.cancel(true));
            Thread.currentThread().interrupt();
            log.info("search_cancelled mode={}", mode.label());
            throw new SearchCancelledException("search_cancelled", e);
        }
    }

    public RewriteResult rewrite(String query) {
        if (query == null || query.isBlank()) {
            throw new InvalidSearchRequestException("query_required");
        }
        return queryRewriter.rewrite(query.trim());
    }

    private SearchOutcome assemble(
        SearchMode mode,
        int limit,
        RewriteResult rewrite,
        RetrievalStageResult lexicalResult,
        RetrievalStageResult vectorResult,
        Map<String, Document> visible,
        long started
    ) {
        List<String> warnings = new ArrayList<>();
        if (rewrite.isDegraded()) {
            warnings.add("rewrite_degraded");
            meterRegistry.counter("ts_rewrite_degraded_total").increment();
        }
        Map<String, StageStatus> stages = new LinkedHashMap<>();
        List<List<RankedEntry>> lists = new ArrayList<>();
        int failed = 0;
        int enabled = 0;
        for (Stage stage : List.of(new Stage(lexicalRetriever, lexicalResult), new Stage(vectorRetriever, vectorResult))) {
            RetrievalStageResult result = stage.result;
            stages.put(stage.retriever.name(), StageStatus.of(result));
            if (result.isSkipped()) {
                continue;
            }
            enabled++;
            if (result.isError()) {
                failed++;
                warnings.add(stage.retriever.name() + (result.isTimedOut() ? "_timeout" : "_error"));
                log.warn("search_stage_failed stage={} reason={}", stage.retriever.name(), result.getErrorMessage());
            } else {
                lists.add(result.getEntries());
            }
        }
        if (enabled > 0 && failed == enabled) {
            log.warn("search_total_failure mode={} lexical={} vector={}",
                mode.label(), lexicalResult.getErrorMessage(), vectorResult.getErrorMessage());
            throw new TotalRetrievalFailureException("all_retrieval_stages_failed");
        }
        boolean partial = failed > 0;
        if (partial) {
            meterRegistry.counter("ts_search_partial_total").increment();
        }

        List<FusedResult> fused = RrfFusion.fuse(lists, properties.getRrfK(), limit);
        List<SearchHit> hits = new ArrayList<>(fused.size());
        for (FusedResult result : fused) {
            Document document = visible.get(result.getDocId());
            hits.add(new SearchHit(
                result.getDocId(),
                hits.size() + 1,
                result.getFusedScore(),
                result.getSources(),
                document.getTitle(),
                document.getFields()
            ));
        }
        long tookMs = (System.nanoTime() - started) / 1_000_000L;
        return new SearchOutcome(
            mode,
            hits,
            rewrite.getFilter(),
            rewrite.isDegraded(),
            lexicalResult.getEntries().size(),
            vectorResult.getEntries().size(),
            partial,
            stages,
            warnings,
            tookMs
        );
    }

    private RewriteResult awaitRewrite(Future<RewriteResult> future) throws InterruptedException {
        SearchProperties.Rewrite rewrite = properties.getRewrite();
        int attempts = Math.max(1, rewrite.getMaxAttempts());
        long budgetMs = (long) attempts * Math.max(1, rewrite.getTimeoutMs())
            + (long) (attempts - 1) * Math.max(0L, rewrite.getBackoffMs())
            + 1000L;
        try {
            return future.get(budgetMs, TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            log.warn("rewrite_degraded reason=rewrite_timeout budget_ms={}", budgetMs);
            return RewriteResult.degraded(attempts, "rewrite_timeout");
        } catch (ExecutionException e) {
            String reason = errorMessage(e);
            log.warn("rewrite_degraded reason={}", reason);
            return RewriteResult.degraded(attempts, reason);
        }
    }

    private RetrievalStageResult awaitStage(Future<RetrievalStageResult> future, long deadlineNanos)
        throws InterruptedException {
        try {
            long remaining = Math.max(0L, deadlineNanos - System.nanoTime());
            return future.get(remaining, TimeUnit.NANOSECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            return RetrievalStageResult.timedOut();
        } catch (ExecutionException e) {
            return RetrievalStageResult.error(errorMessage(e));
        }
    }

    private static Set<String> candidateIds(RetrievalStageResult... results) {
        Set<String> ids = new HashSet<>();
        for (RetrievalStageResult result : results) {
            if (result.isSuccess()) {
                for (RankedEntry entry : result.getEntries()) {
                    ids.add(entry.getDocId());
                }
            }
        }
        return ids;
    }

    private static RetrievalStageResult visibleOnly(RetrievalStageResult result, Map<String, Document> visible) {
        if (!result.isSuccess() || result.getEntries().isEmpty()) {
            return result;
        }
        List<RankedEntry> kept = new ArrayList<>(result.getEntries().size());
        for (RankedEntry entry : result.getEntries()) {
            if (visible.containsKey(entry.getDocId())) {
                kept.add(new RankedEntry(entry.getDocId(), entry.getSource(), kept.size() + 1, entry.getRawScore()));
            }
        }
        return result.withEntries(kept);
    }

    private int resolveLimit(Integer requested) {
        int maxLimit = Math.max(1, properties.getMaxLimit());
        int limit = requested == null ? properties.getDefaultLimit() : requested;
        return Math.max(1, Math.min(limit, maxLimit));
    }

    private String errorMessage(Exception e) {
        Throwable cause = e instanceof ExecutionException ? e.getCause() : e;
        if (cause == null) {
            return e.getMessage();
        }
        return cause.getMessage();
    }

    private static final class Stage {
        private final Retriever retriever;
        private final RetrievalStageResult result;

        private Stage(Retriever retriever, RetrievalStageResult result) {
            this.retriever = retriever;
            this.result = result;
        }
    }
}
