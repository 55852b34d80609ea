package com.tsl.search.api;

import com.tsl.search.api.dto.FieldsDto;
import com.tsl.search.api.dto.FilterDto;
import com.tsl.search.api.dto.RewriteRequest;
import com.tsl.search.api.dto.RewriteResponse;
import com.tsl.search.api.dto.SearchHitDto;
import com.tsl.search.api.dto.SearchRequest;
import com.tsl.search.api.dto.SearchResponse;
import com.tsl.search.index.IndexHealth;
import com.tsl.search.model.RetrievalSource;
import com.tsl.search.query.RewriteResult;
import com.tsl.search.service.HybridSearchService;
import com.tsl.search.service.InvalidSearchRequestException;
import com.tsl.search.service.SearchCommand;
import com.tsl.search.service.SearchHit;
import com.tsl.search.service.SearchMode;
import com.tsl.search.service.SearchOutcome;
import com.tsl.search.service.StageStatus;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class SearchController {
    private final HybridSearchService searchService;
    private final IndexHealth indexHealth;

    public SearchController(HybridSearchService searchService, IndexHealth indexHealth) {
        this.searchService = searchService;
        this.indexHealth = indexHealth;
    }

    @GetMapping("/health")
    public ResponseEntity<Map<String, String>> health() {
        if (!indexHealth.isConsistent()) {
            return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
                .body(Map.of("status", "degraded", "reason", indexHealth.getReason()));
        }
        return ResponseEntity.ok(Map.of("status", "ok"));
    }

    @PostMapping("/api/search")
    public SearchResponse search(
        @RequestBody(required = false) SearchRequest request,
        @RequestHeader(value = "x-trace-id", required = false) String traceIdHeader,
        @RequestHeader(value = "x-request-id", required = false) String requestIdHeader
    ) {
        if (request == null) {
            throw new InvalidSearchRequestException("request body is required");
        }
        if (request.getLimit() != null && request.getLimit() < 1) {
            throw new InvalidSearchRequestException("limit must be >= 1");
        }
        SearchMode mode = SearchMode.fromString(request.getMode());
        SearchOutcome outcome = searchService.search(new SearchCommand(request.getQuery(), mode, request.getLimit()));
        SearchResponse response = toResponse(outcome);
        response.setTraceId(RequestIdUtil.resolveOrGenerate(traceIdHeader));
        response.setRequestId(RequestIdUtil.resolveOrGenerate(requestIdHeader));
        return response;
    }

    @PostMapping("/api/rewrite-query")
    public RewriteResponse rewriteQuery(@RequestBody(required = false) RewriteRequest request) {
        if (request == null) {
            throw new InvalidSearchRequestException("request body is required");
        }
        RewriteResult result = searchService.rewrite(request.getQuery());
        RewriteResponse response = new RewriteResponse();
        response.setFilter(FilterDto.from(result.getFilter()));
        response.setDegraded(result.isDegraded());
        response.setAttempts(result.getAttempts());
        return response;
    }

    private SearchResponse toResponse(SearchOutcome outcome) {
        SearchResponse response = new SearchResponse();
        response.setMode(outcome.getMode().label());
        response.setTookMs(outcome.getTookMs());
        response.setFilter(FilterDto.from(outcome.getFilter()));
        response.setLexicalCount(outcome.getLexicalCount());
        response.setVectorCount(outcome.getVectorCount());
        response.setPartial(outcome.isPartial());
        response.setRewriteDegraded(outcome.isRewriteDegraded());
        response.setWarnings(outcome.getWarnings());

        List<SearchHitDto> hits = new ArrayList<>(outcome.getHits().size());
        for (SearchHit hit : outcome.getHits()) {
            SearchHitDto dto = new SearchHitDto();
            dto.setDocId(hit.getDocId());
            dto.setRank(hit.getRank());
            dto.setScore(hit.getScore());
            List<String> sources = new ArrayList<>(hit.getSources().size());
            for (RetrievalSource source : hit.getSources()) {
                sources.add(source.label());
            }
            dto.setSources(sources);
            dto.setTitle(hit.getTitle());
            dto.setFields(FieldsDto.from(hit.getFields()));
            hits.add(dto);
        }
        response.setHits(hits);

        Map<String, SearchResponse.StageDto> stages = new LinkedHashMap<>();
        for (Map.Entry<String, StageStatus> entry : outcome.getStages().entrySet()) {
            SearchResponse.StageDto stage = new SearchResponse.StageDto();
            stage.setStatus(entry.getValue().getStatus());
            stage.setTookMs(entry.getValue().getTookMs());
            stage.setCount(entry.getValue().getCount());
            stage.setError(entry.getValue().getError());
            stages.put(entry.getKey(), stage);
        }
        response.setStages(stages);
        return response;
    }
}
