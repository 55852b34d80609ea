package com.tsl.search.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;
import java.util.Map;

public class SearchResponse {
    @JsonProperty("trace_id")
    private String traceId;

    @JsonProperty("request_id")
    private String requestId;

    private String mode;

    @JsonProperty("took_ms")
    private long tookMs;

    private List<SearchHitDto> hits;
    private FilterDto filter;

    @JsonProperty("lexical_count")
    private int lexicalCount;

    @JsonProperty("vector_count")
    private int vectorCount;

    private boolean partial;

    @JsonProperty("rewrite_degraded")
    private boolean rewriteDegraded;

    private List<String> warnings;
    private Map<String, StageDto> stages;

    public String getTraceId() {
        return traceId;
    }

    public void setTraceId(String traceId) {
        this.traceId = traceId;
    }

    public String getRequestId() {
        return requestId;
    }

    public void setRequestId(String requestId) {
        this.requestId = requestId;
    }

    public String getMode() {
        return mode;
    }

    public void setMode(String mode) {
        this.mode = mode;
    }

    public long getTookMs() {
        return tookMs;
    }

    public void setTookMs(long tookMs) {
        this.tookMs = tookMs;
    }

    public List<SearchHitDto> getHits() {
        return hits;
    }

    public void setHits(List<SearchHitDto> hits) {
        this.hits = hits;
    }

    public FilterDto getFilter() {
        return filter;
    }

    public void setFilter(FilterDto filter) {
        this.filter = filter;
    }

    public int getLexicalCount() {
        return lexicalCount;
    }

    public void setLexicalCount(int lexicalCount) {
        this.lexicalCount = lexicalCount;
    }

    public int getVectorCount() {
        return vectorCount;
    }

    public void setVectorCount(int vectorCount) {
        this.vectorCount = vectorCount;
    }

    public boolean isPartial() {
        return partial;
    }

    public void setPartial(boolean partial) {
        this.partial = partial;
    }

    public boolean isRewriteDegraded() {
        return rewriteDegraded;
    }

    public void setRewriteDegraded(boolean rewriteDegraded) {
        this.rewriteDegraded = rewriteDegraded;
    }

    public List<String> getWarnings() {
        return warnings;
    }

    public void setWarnings(List<String> warnings) {
        this.warnings = warnings;
    }

    public Map<String, StageDto> getStages() {
        return stages;
    }

    public void setStages(Map<String, StageDto> stages) {
        this.stages = stages;
    }

    public static class StageDto {
        private String status;

        @JsonProperty("took_ms")
        private long tookMs;

        private int count;
        private String error;

        public String getStatus() {
            return status;
        }

        public void setStatus(String status) {
            this.status = status;
        }

        public long getTookMs() {
            return tookMs;
        }

        public void setTookMs(long tookMs) {
            this.tookMs = tookMs;
        }

        public int getCount() {
            return count;
        }

        public void setCount(int count) {
            this.count = count;
        }

        public String getError() {
            return error;
        }

        public void setError(String error) {
            this.error = error;
        }
    }
}
