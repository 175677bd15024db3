package com.csd.repograder.exception;

/**
 * Base type for every failure reported back to the caller of an analysis.
 */
public abstract class RepositoryAnalysisException extends RuntimeException {

    private final String errorCode;

    protected RepositoryAnalysisException(String errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    protected RepositoryAnalysisException(String errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    public String getErrorCode() {
        return errorCode;
    }
}
