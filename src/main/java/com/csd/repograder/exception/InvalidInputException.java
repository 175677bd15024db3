package com.csd.repograder.exception;

public class InvalidInputException extends RepositoryAnalysisException {

    public InvalidInputException(String message) {
        super("INVALID_INPUT", message);
    }
}
