package com.csd.repograder.exception;

public class RateLimitedException extends RepositoryAnalysisException {

    public RateLimitedException(String message) {
        super("RATE_LIMITED", message);
    }
}
