package com.sysmon.controller;

import com.sysmon.dto.IngestResponse;
import com.sysmon.service.ServiceUnavailableException;
import com.sysmon.storage.StorageException;
import jakarta.servlet.http.HttpServletRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;
import org.springframework.web.servlet.resource.NoResourceFoundException;

import java.util.LinkedHashMap;
import java.util.Map;

@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    @ExceptionHandler(StorageException.class)
    public ResponseEntity<Object> handleStorage(StorageException e, HttpServletRequest request) {
        log.error("Storage failure on {}: {}", request.getRequestURI(), e.getMessage(), e);
        if (isIngest(request)) {
            return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
                    .body(IngestResponse.error("storage unavailable: " + e.getMessage()));
        }
        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
                .body(errorBody("STORAGE_UNAVAILABLE", e.getMessage()));
    }

    @ExceptionHandler(ServiceUnavailableException.class)
    public ResponseEntity<Object> handleUnavailable(ServiceUnavailableException e, HttpServletRequest request) {
        if (isIngest(request)) {
            return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).body(IngestResponse.error(e.getMessage()));
        }
        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
                .body(errorBody("SERVICE_UNAVAILABLE", e.getMessage()));
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<Object> handleUnreadable(HttpMessageNotReadableException e, HttpServletRequest request) {
        String reason = "malformed JSON: " + e.getMostSpecificCause().getMessage();
        if (isIngest(request)) {
            return ResponseEntity.badRequest().body(IngestResponse.rejected(reason));
        }
        return ResponseEntity.badRequest().body(errorBody("BAD_REQUEST", reason));
    }

    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    public ResponseEntity<Map<String, Object>> handleTypeMismatch(MethodArgumentTypeMismatchException e) {
        return ResponseEntity.badRequest()
                .body(errorBody("BAD_REQUEST", "Invalid value for '" + e.getName() + "'"));
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<Map<String, Object>> handleIllegalArgument(IllegalArgumentException e) {
        return ResponseEntity.badRequest()
                .body(errorBody("BAD_REQUEST", e.getMessage()));
    }

    @ExceptionHandler(NoResourceFoundException.class)
    public ResponseEntity<Map<String, Object>> handleNoResource(NoResourceFoundException e) {
        return ResponseEntity.status(HttpStatus.NOT_FOUND)
                .body(errorBody("NOT_FOUND", "Resource not found"));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<Map<String, Object>> handleGeneric(Exception e) {
        log.error("Unhandled exception", e);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(errorBody("INTERNAL_ERROR", "Internal server error"));
    }

    private static boolean isIngest(HttpServletRequest request) {
        return request.getRequestURI().startsWith("/ingest");
    }

    private Map<String, Object> errorBody(String code, String message) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("code", code);
        body.put("error", message != null ? message : "Unknown error");
        return body;
    }
}
