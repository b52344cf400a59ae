package com.vidnyan.heuristic.adapter.in.web;

import com.vidnyan.heuristic.application.port.in.AnalysisFailedException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.NestedExceptionUtils;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Maps request and analysis failures to error responses.
 */
@Slf4j
@RestControllerAdvice
public class ApiExceptionHandler {

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<Map<String, Object>> handleValidation(MethodArgumentNotValidException ex) {
        List<String> details = ex.getBindingResult().getFieldErrors().stream()
                .map(e -> e.getField() + ": " + e.getDefaultMessage())
                .sorted()
                .toList();
        log.warn("Rejected analysis request: {}", details);
        return error(HttpStatus.BAD_REQUEST, "validation_failed", "Invalid analysis request", details);
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<Map<String, Object>> handleUnreadable(HttpMessageNotReadableException ex) {
        Throwable cause = NestedExceptionUtils.getMostSpecificCause(ex);
        log.warn("Unreadable analysis request: {}", cause.getMessage());
        return error(HttpStatus.BAD_REQUEST, "validation_failed", "Malformed analysis request",
                List.of(String.valueOf(cause.getMessage())));
    }

    @ExceptionHandler(AnalysisFailedException.class)
    public ResponseEntity<Map<String, Object>> handleAnalysisFailed(AnalysisFailedException ex) {
        log.error("Analysis failed: {}", ex.getMessage());
        return error(HttpStatus.UNPROCESSABLE_ENTITY, "analysis_failed", ex.getMessage(), List.of());
    }

    @ExceptionHandler(RuntimeException.class)
    public ResponseEntity<Map<String, Object>> handleUnexpected(RuntimeException ex) {
        log.error("Unexpected error during analysis", ex);
        return error(HttpStatus.INTERNAL_SERVER_ERROR, "internal_error",
                "An error occurred during analysis: " + ex.getMessage(), List.of());
    }

    private ResponseEntity<Map<String, Object>> error(HttpStatus status, String error, String message,
                                                      List<String> details) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("status", "error");
        body.put("error", error);
        body.put("message", message);
        if (!details.isEmpty()) {
            body.put("details", details);
        }
        return new ResponseEntity<>(body, status);
    }
}
