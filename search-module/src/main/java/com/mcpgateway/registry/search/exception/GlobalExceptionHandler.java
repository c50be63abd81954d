package com.mcpgateway.registry.search.exception;

import com.mcpgateway.registry.common.exception.EmbeddingUnavailableException;
import com.mcpgateway.registry.common.exception.IndexBackendException;
import com.mcpgateway.registry.common.exception.SearchConfigurationException;
import com.mcpgateway.registry.common.exception.SearchValidationException;
import jakarta.servlet.http.HttpServletRequest;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.time.LocalDateTime;
import java.util.Map;
import java.util.stream.Collectors;

@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    @ExceptionHandler(SearchValidationException.class)
    public ResponseEntity<Map<String, Object>> handleValidationException(SearchValidationException e,
                                                                         HttpServletRequest request) {
        log.warn("Invalid request: {}", e.getMessage());
        return errorResponse(HttpStatus.BAD_REQUEST, "Bad Request", e.getMessage(), request);
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<Map<String, Object>> handleMethodArgumentNotValid(MethodArgumentNotValidException e,
                                                                            HttpServletRequest request) {
        String message = e.getBindingResult().getFieldErrors().stream()
                .map(FieldError::getField)
                .distinct()
                .map(field -> field + " is invalid")
                .collect(Collectors.joining(", "));
        log.warn("Request validation failed: {}", message);
        return errorResponse(HttpStatus.BAD_REQUEST, "Bad Request", message, request);
    }

    @ExceptionHandler({HttpMessageNotReadableException.class, MissingServletRequestParameterException.class})
    public ResponseEntity<Map<String, Object>> handleUnreadableRequest(Exception e, HttpServletRequest request) {
        log.warn("Malformed request: {}", e.getMessage());
        return errorResponse(HttpStatus.BAD_REQUEST, "Bad Request", "Malformed request", request);
    }

    @ExceptionHandler(EmbeddingUnavailableException.class)
    public ResponseEntity<Map<String, Object>> handleEmbeddingUnavailable(EmbeddingUnavailableException e,
                                                                          HttpServletRequest request) {
        log.error("Embedding provider unavailable: {}", e.getMessage());
        return errorResponse(HttpStatus.SERVICE_UNAVAILABLE, "Embedding Provider Unavailable", e.getMessage(), request);
    }

    @ExceptionHandler(IndexBackendException.class)
    public ResponseEntity<Map<String, Object>> handleIndexBackendException(IndexBackendException e,
                                                                           HttpServletRequest request) {
        log.error("Vector store error: {}", e.getMessage(), e);
        return errorResponse(HttpStatus.BAD_GATEWAY, "Vector Store Error", e.getMessage(), request);
    }

    @ExceptionHandler(SearchConfigurationException.class)
    public ResponseEntity<Map<String, Object>> handleConfigurationException(SearchConfigurationException e,
                                                                            HttpServletRequest request) {
        log.error("Search configuration error: {}", e.getMessage(), e);
        return errorResponse(HttpStatus.INTERNAL_SERVER_ERROR, "Configuration Error", e.getMessage(), request);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<Map<String, Object>> handleGenericException(Exception e, HttpServletRequest request) {
        log.error("Unexpected error: {}", e.getMessage(), e);
        return errorResponse(HttpStatus.INTERNAL_SERVER_ERROR, "Internal Server Error",
                "An unexpected error occurred", request);
    }

    private static ResponseEntity<Map<String, Object>> errorResponse(HttpStatus status, String error,
                                                                     String message, HttpServletRequest request) {
        Map<String, Object> errorResponse = Map.of(
            "timestamp", LocalDateTime.now(),
            "status", status.value(),
            "error", error,
            "message", message == null ? "" : message,
            "path", request.getRequestURI()
        );
        return ResponseEntity.status(status).body(errorResponse);
    }
}
