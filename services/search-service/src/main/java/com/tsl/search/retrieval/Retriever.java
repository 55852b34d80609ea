package com.tsl.search.retrieval;

import com.tsl.search.model.RetrievalSource;

public interface Retriever {
    String name();

    RetrievalSource source();

    RetrievalStageResult retrieve(RetrievalStageContext context);
}
