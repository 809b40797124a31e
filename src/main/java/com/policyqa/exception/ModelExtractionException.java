package com.policyqa.exception;

public class ModelExtractionException extends TransientDependencyException {

    public ModelExtractionException(String message, Throwable cause) {
        super(message, cause);
    }
}
