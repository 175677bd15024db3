package com.csd.repograder.exception;

public class FetchFailedException extends RepositoryAnalysisException {

    public FetchFailedException(String message) {
        super("FETCH_FAILED", message);
    }

    public FetchFailedException(String message, Throwable cause) {
        super("FETCH_FAILED", message, cause);
    }
}
