package com.policyqa.exception;

/**
 * Failure of an outside dependency (embedding provider, language model) that may succeed on a later attempt.
 * The pipeline retries these with backoff.
 */
public class TransientDependencyException extends RuntimeException {

    public TransientDependencyException(String message) {
        super(message);
    }

    public TransientDependencyException(String message, Throwable cause) {
        super(message, cause);
    }
}
