package com.tsl.search.api;

import com.tsl.search.api.dto.IndexingReportResponse;
import com.tsl.search.ingest.IndexBootstrap;
import com.tsl.search.ingest.IndexingPipeline;
import java.util.Map;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class IndexAdminController {
    private final IndexingPipeline indexingPipeline;
    private final IndexBootstrap indexBootstrap;

    public IndexAdminController(IndexingPipeline indexingPipeline, IndexBootstrap indexBootstrap) {
        this.indexingPipeline = indexingPipeline;
        this.indexBootstrap = indexBootstrap;
    }

    @PostMapping("/internal/index/rebuild")
    public IndexingReportResponse rebuild() {
        return IndexingReportResponse.from(indexingPipeline.rebuild());
    }

    @PostMapping("/internal/index/snapshot")
    public Map<String, Object> snapshot() {
        int saved = indexBootstrap.saveSnapshot();
        return Map.of("status", "ok", "documents", saved);
    }
}
