package com.wshg.catalog.controller;

import com.wshg.catalog.error.CatalogException;
import com.wshg.catalog.error.ErrorKind;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Maps catalog errors to HTTP responses: {error, kind, retryable, details}.
 */
@Slf4j
@RestControllerAdvice
public class CatalogExceptionHandler {

    @ExceptionHandler(CatalogException.class)
    public ResponseEntity<Map<String, Object>> handleCatalog(CatalogException ex) {
        HttpStatus status = statusOf(ex.getKind());
        if (status.is5xxServerError()) {
            log.warn("[API] {} {}: {}", status.value(), ex.getKind(), ex.getMessage());
        } else {
            log.debug("[API] {} {}: {}", status.value(), ex.getKind(), ex.getMessage());
        }
        return ResponseEntity.status(status).body(body(ex.getMessage(), ex.getKind(), ex.isRetryable(), ex.getDetails()));
    }

    @ExceptionHandler({HttpMessageNotReadableException.class, MethodArgumentTypeMismatchException.class})
    public ResponseEntity<Map<String, Object>> handleUnreadable(Exception ex) {
        return ResponseEntity.badRequest()
                .body(body("malformed request: " + ex.getMessage(), ErrorKind.VALIDATION_FAILED, false, Map.of()));
    }

    static HttpStatus statusOf(ErrorKind kind) {
        switch (kind) {
            case VALIDATION_FAILED:
                return HttpStatus.BAD_REQUEST;
            case EMBEDDING_FAILED:
                return HttpStatus.BAD_GATEWAY;
            case CHAIN_BROKEN:
                return HttpStatus.CONFLICT;
            case NOT_FOUND:
                return HttpStatus.NOT_FOUND;
            case TIMEOUT:
                return HttpStatus.GATEWAY_TIMEOUT;
            case PERSISTENCE_FAILED:
            default:
                return HttpStatus.INTERNAL_SERVER_ERROR;
        }
    }

    private static Map<String, Object> body(String message, ErrorKind kind, boolean retryable, Map<String, Object> details) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("error", message);
        body.put("kind", kind.name());
        body.put("retryable", retryable);
        body.put("details", details);
        return body;
    }
}
