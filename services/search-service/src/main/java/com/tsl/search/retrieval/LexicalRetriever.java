package com.tsl.search.retrieval;

import com.tsl.search.index.LexicalIndex;
import com.tsl.search.model.RankedEntry;
import com.tsl.search.model.RetrievalSource;
import java.util.List;
import org.springframework.stereotype.Component;

@Component
public class LexicalRetriever implements Retriever {
    private final LexicalIndex lexicalIndex;

    public LexicalRetriever(LexicalIndex lexicalIndex) {
        this.lexicalIndex = lexicalIndex;
    }

    @Override
    public String name() {
        return "lexical";
    }

    @Override
    public RetrievalSource source() {
        return RetrievalSource.LEXICAL;
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
            List<RankedEntry> entries = lexicalIndex.search(context.getQueryText(), context.getFilter(), context.getTopK());
            long tookMs = (System.nanoTime() - started) / 1_000_000L;
            return RetrievalStageResult.success(entries, tookMs);
        } catch (RuntimeException e) {
            return RetrievalStageResult.error(e.getMessage());
        }
    }
}
