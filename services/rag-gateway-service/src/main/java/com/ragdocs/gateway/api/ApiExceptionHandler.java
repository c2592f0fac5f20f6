package com.ragdocs.gateway.api;

import com.ragdocs.gateway.api.dto.ErrorResponse;
import com.ragdocs.gateway.retrieval.RetrievalBackendException;
import com.ragdocs.gateway.retrieval.RetrievalUnavailableException;
import jakarta.servlet.http.HttpServletRequest;
import java.util.UUID;
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
    private static final Logger logger = LoggerFactory.getLogger(ApiExceptionHandler.class);
    static final String TRACE_ID_HEADER = "x-trace-id";
    static final String REQUEST_ID_HEADER = "x-request-id";

    @ExceptionHandler(InvalidQueryException.class)
    public ResponseEntity<ErrorResponse> handleInvalidQuery(InvalidQueryException ex, HttpServletRequest request) {
        return ResponseEntity.badRequest().body(errorResponse("bad_request", ex.getMessage(), null, request));
    }

    @ExceptionHandler({HttpMessageNotReadableException.class, HttpMediaTypeNotSupportedException.class})
    public ResponseEntity<ErrorResponse> handleUnreadable(Exception ex, HttpServletRequest request) {
        return ResponseEntity.badRequest().body(errorResponse("bad_request", "Invalid request body", null, request));
    }

    @ExceptionHandler(RetrievalUnavailableException.class)
    public ResponseEntity<ErrorResponse> handleUnavailable(RetrievalUnavailableException ex, HttpServletRequest request) {
        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
            .body(errorResponse("retrieval_unavailable", ex.getMessage(), null, request));
    }

    @ExceptionHandler(RetrievalBackendException.class)
    public ResponseEntity<ErrorResponse> handleBackendError(RetrievalBackendException ex, HttpServletRequest request) {
        return ResponseEntity.status(HttpStatus.BAD_GATEWAY)
            .body(errorResponse("retrieval_backend_error", "Retrieval service error", ex.getMessage(), request));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleUnexpected(Exception ex, HttpServletRequest request) {
        ErrorResponse body = errorResponse("internal_error", "Unexpected error", null, request);
        logger.error(
            "unexpected_exception request_id={} trace_id={} method={} path={}",
            body.getRequestId(),
            body.getTraceId(),
            request == null ? null : request.getMethod(),
            request == null ? null : request.getRequestURI(),
            ex
        );
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(body);
    }

    private ErrorResponse errorResponse(String code, String message, String details, HttpServletRequest request) {
        return new ErrorResponse(
            code,
            message,
            details,
            headerOrRandomId(request, TRACE_ID_HEADER),
            headerOrRandomId(request, REQUEST_ID_HEADER)
        );
    }

    private static String headerOrRandomId(HttpServletRequest request, String headerName) {
        String value = request == null ? null : request.getHeader(headerName);
        if (value == null || value.isBlank()) {
            return UUID.randomUUID().toString();
        }
        return value;
    }
}
