package com.csd.repograder.exception;

public class RepositoryNotFoundException extends RepositoryAnalysisException {

    public RepositoryNotFoundException(String message) {
        super("NOT_FOUND", message);
    }
}
