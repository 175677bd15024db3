package com.csd.repograder.exception;

import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.LinkedHashMap;
import java.util.Map;

@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    @ExceptionHandler(InvalidInputException.class)
    public ResponseEntity<Map<String, String>> handleInvalidInput(InvalidInputException ex) {
        log.warn("Rejected analysis request: {}", ex.getMessage());
        return body(HttpStatus.BAD_REQUEST, ex);
    }

    @ExceptionHandler(RepositoryNotFoundException.class)
    public ResponseEntity<Map<String, String>> handleNotFound(RepositoryNotFoundException ex) {
        log.info("Repository not found: {}", ex.getMessage());
        return body(HttpStatus.NOT_FOUND, ex);
    }

    @ExceptionHandler(RateLimitedException.class)
    public ResponseEntity<Map<String, String>> handleRateLimited(RateLimitedException ex) {
        log.warn("GitHub rate limit hit: {}", ex.getMessage());
        return body(HttpStatus.TOO_MANY_REQUESTS, ex);
    }

    @ExceptionHandler(FetchFailedException.class)
    public ResponseEntity<Map<String, String>> handleFetchFailed(FetchFailedException ex) {
        log.error("Failed to fetch repository data", ex);
        return body(HttpStatus.BAD_GATEWAY, ex);
    }

    private ResponseEntity<Map<String, String>> body(HttpStatus status, RepositoryAnalysisException ex) {
        Map<String, String> error = new LinkedHashMap<>();
        error.put("error", ex.getErrorCode());
        error.put("message", ex.getMessage());
        return ResponseEntity.status(status).body(error);
    }
}
