package com.tsl.search.api;

import com.tsl.search.api.dto.BulkIndexRequest;
import com.tsl.search.api.dto.DocumentRequest;
import com.tsl.search.api.dto.DocumentStatusResponse;
import com.tsl.search.api.dto.ErrorResponse;
import com.tsl.search.api.dto.FieldsDto;
import com.tsl.search.api.dto.IndexingReportResponse;
import com.tsl.search.ingest.DocumentRegistry;
import com.tsl.search.ingest.DocumentStatus;
import com.tsl.search.ingest.IndexingPipeline;
import com.tsl.search.model.Document;
import com.tsl.search.model.RawDocument;
import com.tsl.search.service.InvalidSearchRequestException;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class DocumentController {
    private final IndexingPipeline indexingPipeline;
    private final DocumentRegistry registry;

    public DocumentController(IndexingPipeline indexingPipeline, DocumentRegistry registry) {
        this.indexingPipeline = indexingPipeline;
        this.registry = registry;
    }

    @PutMapping("/documents/{docId}")
    public DocumentStatusResponse upsert(
        @PathVariable("docId") String docId,
        @RequestBody(required = false) DocumentRequest request
    ) {
        if (request == null) {
            throw new InvalidSearchRequestException("request body is required");
        }
        DocumentStatus status = indexingPipeline.upsert(
            new RawDocument(docId, request.getTitle(), request.getBodyText(), request.getActivities())
        );
        return toResponse(status, registry.get(docId));
    }

    @PostMapping("/documents/_bulk")
    public IndexingReportResponse bulk(@RequestBody(required = false) BulkIndexRequest request) {
        if (request == null || request.getDocuments() == null) {
            throw new InvalidSearchRequestException("documents are required");
        }
        List<RawDocument> batch = new ArrayList<>(request.getDocuments().size());
        for (DocumentRequest document : request.getDocuments()) {
            if (document == null) {
                continue;
            }
            batch.add(new RawDocument(document.getDocId(), document.getTitle(), document.getBodyText(), document.getActivities()));
        }
        return IndexingReportResponse.from(indexingPipeline.upsertAll(batch));
    }

    @GetMapping("/documents/{docId}")
    public ResponseEntity<?> get(
        @PathVariable("docId") String docId,
        @RequestHeader(value = "x-trace-id", required = false) String traceIdHeader,
        @RequestHeader(value = "x-request-id", required = false) String requestIdHeader
    ) {
        Optional<DocumentStatus> status = registry.status(docId);
        if (status.isEmpty()) {
            return notFound(traceIdHeader, requestIdHeader);
        }
        return ResponseEntity.ok(toResponse(status.get(), registry.get(docId)));
    }

    @DeleteMapping("/documents/{docId}")
    public ResponseEntity<?> delete(
        @PathVariable("docId") String docId,
        @RequestHeader(value = "x-trace-id", required = false) String traceIdHeader,
        @RequestHeader(value = "x-request-id", required = false) String requestIdHeader
    ) {
        if (!indexingPipeline.delete(docId)) {
            return notFound(traceIdHeader, requestIdHeader);
        }
        return ResponseEntity.noContent().build();
    }

    private ResponseEntity<ErrorResponse> notFound(String traceIdHeader, String requestIdHeader) {
        return ResponseEntity.status(HttpStatus.NOT_FOUND).body(
            new ErrorResponse(
                "not_found",
                "Document not found",
                RequestIdUtil.resolveOrGenerate(traceIdHeader),
                RequestIdUtil.resolveOrGenerate(requestIdHeader)
            )
        );
    }

    private DocumentStatusResponse toResponse(DocumentStatus status, Optional<Document> document) {
        DocumentStatusResponse response = new DocumentStatusResponse();
        response.setDocId(status.getDocId());
        response.setState(status.getState().label());
        response.setReason(status.getReason());
        response.setUpdatedAtMs(status.getUpdatedAtMs());
        document.ifPresent(indexed -> {
            response.setTitle(indexed.getTitle());
            response.setFields(FieldsDto.from(indexed.getFields()));
        });
        return response;
    }
}
