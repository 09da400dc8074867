package org.listingwatch.tracker.api.exception;

import lombok.extern.slf4j.Slf4j;
import org.listingwatch.tracker.api.dto.ApiResponse;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.util.HashMap;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Maps ingestion failures to HTTP responses for all controllers.
 */
@RestControllerAdvice
@Slf4j
public class GlobalExceptionHandler {

    @ExceptionHandler(UnknownSourceException.class)
    public ResponseEntity<ApiResponse<Void>> handleUnknownSource(UnknownSourceException ex) {
        log.warn("Unknown snapshot source: {}", ex.getSource());
        return respond(ErrorCode.UNKNOWN_SOURCE, ex.getMessage(),
                details("source", ex.getSource()));
    }

    @ExceptionHandler(NormalizationException.class)
    public ResponseEntity<ApiResponse<Void>> handleNormalization(NormalizationException ex) {
        log.warn("Snapshot normalization failed: source={}, field={}: {}", ex.getSource(), ex.getField(), ex.getMessage());
        return respond(ErrorCode.NORMALIZATION_ERROR, ex.getMessage(),
                details("field", ex.getField()));
    }

    @ExceptionHandler(InvalidStateException.class)
    public ResponseEntity<ApiResponse<Void>> handleInvalidState(InvalidStateException ex) {
        log.warn("Snapshot rejected by listing {}: {}", ex.getListingId(), ex.getMessage());
        return respond(ErrorCode.INVALID_STATE, ex.getMessage(),
                details("listingId", ex.getListingId()));
    }

    @ExceptionHandler(ConflictException.class)
    public ResponseEntity<ApiResponse<Void>> handleConflict(ConflictException ex) {
        log.warn("Conflict on listing {}: {}", ex.getListingId(), ex.getMessage());
        return respond(ErrorCode.CONFLICT, ex.getMessage(),
                details("listingId", ex.getListingId()));
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ApiResponse<Void>> handleBeanValidation(MethodArgumentNotValidException ex) {
        String errors = ex.getBindingResult().getFieldErrors().stream()
                .map(e -> e.getField() + ": " + e.getDefaultMessage())
                .collect(Collectors.joining(", "));
        log.warn("Bean validation failed: {}", errors);
        return respond(ErrorCode.VALIDATION_ERROR, errors);
    }

    @ExceptionHandler({HttpMessageNotReadableException.class, MethodArgumentTypeMismatchException.class,
            IllegalArgumentException.class})
    public ResponseEntity<ApiResponse<Void>> handleBadRequest(Exception ex) {
        log.warn("Malformed request: {}", ex.getMessage());
        return respond(ErrorCode.VALIDATION_ERROR, "Malformed request: " + ex.getMessage());
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ApiResponse<Void>> handleGeneric(Exception ex) {
        log.error("Unexpected error: {}", ex.getMessage(), ex);
        return respond(ErrorCode.INTERNAL_ERROR, "An unexpected error occurred");
    }

    private static ResponseEntity<ApiResponse<Void>> respond(ErrorCode code, String message) {
        return respond(code, message, null);
    }

    private static ResponseEntity<ApiResponse<Void>> respond(ErrorCode code, String message, Object details) {
        return ResponseEntity.status(code.getHttpStatus()).body(ApiResponse.error(code, message, details));
    }

    // Map.of rejects null values
    private static Map<String, Object> details(String key, Object value) {
        Map<String, Object> details = new HashMap<>();
        details.put(key, value);
        return details;
    }
}
