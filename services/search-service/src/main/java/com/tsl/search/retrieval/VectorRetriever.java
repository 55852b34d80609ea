package com.tsl.search.retrieval;

import com.tsl.search.embed.EmbeddingProvider;
import com.tsl.search.embed.EmbeddingUnavailableException;
import com.tsl.search.index.VectorIndex;
import com.tsl.search.model.RankedEntry;
import com.tsl.search.model.RetrievalSource;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import org.springframework.stereotype.Component;

@Component
public class VectorRetriever implements Retriever {
    private final VectorIndex vectorIndex;
    private final EmbeddingProvider embeddingProvider;

    public VectorRetriever(VectorIndex vectorIndex, EmbeddingProvider embeddingProvider) {
        this.vectorIndex = vectorIndex;
        this.embeddingProvider = embeddingProvider;
    }

    @Override
    public String name() {
        return "vector";
    }

    @Override
    public RetrievalSource source() {
        return RetrievalSource.VECTOR;
    }

    @Override
    public RetrievalStageResult retrieve(RetrievalStageContext context) {
        if (context == null || context.getQueryText() == null || context.getQueryText().isBlank()) {
            return RetrievalStageResult.empty();
        }
        if (context.getTopK() <= 0) {
            return RetrievalStageResult.empty();
        }
        long started = System.nanoTime();
        try {
            List<Double> vector = queryVector(context);
            List<RankedEntry> entries = vectorIndex.search(vector, context.getFilter(), context.getTopK());
            long tookMs = (System.nanoTime() - started) / 1_000_000L;
            return RetrievalStageResult.success(entries, tookMs);
        } catch (EmbeddingUnavailableException e) {
            return RetrievalStageResult.error(e.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return RetrievalStageResult.error("interrupted");
        } catch (RuntimeException e) {
            return RetrievalStageResult.error(e.getMessage());
        }
    }

    private List<Double> queryVector(RetrievalStageContext context) throws InterruptedException {
        Future<List<Double>> pending = context.getQueryEmbedding();
        if (pending == null) {
            return embeddingProvider.embed(context.getQueryText(), context.getTimeBudgetMs());
        }
        try {
            return pending.get();
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof EmbeddingUnavailableException unavailable) {
                throw unavailable;
            }
            throw new EmbeddingUnavailableException("embed_failed", cause);
        }
    }
}
