package com.tsl.search.api;

import com.tsl.search.api.dto.ErrorResponse;
import com.tsl.search.index.IndexUnavailableException;
import com.tsl.search.service.InvalidSearchRequestException;
import com.tsl.search.service.SearchCancelledException;
import com.tsl.search.service.TotalRetrievalFailureException;
import jakarta.servlet.http.HttpServletRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.HttpMediaTypeNotSupportedException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

@RestControllerAdvice
public class ApiExceptionHandler {
    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler({HttpMessageNotReadableException.class, HttpMediaTypeNotSupportedException.class})
    public ResponseEntity<ErrorResponse> handleUnreadable(Exception ex, HttpServletRequest request) {
        return respond(HttpStatus.BAD_REQUEST, "bad_request", "Invalid request body", request);
    }

    @ExceptionHandler(InvalidSearchRequestException.class)
    public ResponseEntity<ErrorResponse> handleBadRequest(InvalidSearchRequestException ex, HttpServletRequest request) {
        return respond(HttpStatus.BAD_REQUEST, "bad_request", ex.getMessage(), request);
    }

    @ExceptionHandler(TotalRetrievalFailureException.class)
    public ResponseEntity<ErrorResponse> handleRetrievalFailure(
        TotalRetrievalFailureException ex,
        HttpServletRequest request
    ) {
        return respond(HttpStatus.SERVICE_UNAVAILABLE, "retrieval_unavailable", "All retrieval stages failed", request);
    }

    @ExceptionHandler(IndexUnavailableException.class)
    public ResponseEntity<ErrorResponse> handleIndexUnavailable(IndexUnavailableException ex, HttpServletRequest request) {
        return respond(HttpStatus.SERVICE_UNAVAILABLE, "index_unavailable", ex.getMessage(), request);
    }

    @ExceptionHandler(SearchCancelledException.class)
    public ResponseEntity<ErrorResponse> handleCancelled(SearchCancelledException ex, HttpServletRequest request) {
        return respond(HttpStatus.SERVICE_UNAVAILABLE, "search_cancelled", "Search was cancelled", request);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleUnexpected(Exception ex, HttpServletRequest request) {
        log.error("unexpected_error path={}", request.getRequestURI(), ex);
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, "internal_error", "Unexpected error", request);
    }

    private ResponseEntity<ErrorResponse> respond(
        HttpStatus status,
        String code,
        String message,
        HttpServletRequest request
    ) {
        String traceId = RequestIdUtil.resolveOrGenerate(request, "x-trace-id");
        String requestId = RequestIdUtil.resolveOrGenerate(request, "x-request-id");
        return ResponseEntity.status(status).body(new ErrorResponse(code, message, traceId, requestId));
    }
}
