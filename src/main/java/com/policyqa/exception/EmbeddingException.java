package com.policyqa.exception;

public class EmbeddingException extends TransientDependencyException {

    public EmbeddingException(String message, Throwable cause) {
        super(message, cause);
    }
}
