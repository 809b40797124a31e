package com.policyqa.exception;

/**
 * Internal failure of the query pipeline. Never caused by user input.
 */
public class PipelineException extends RuntimeException {

    public PipelineException(String message) {
        super(message);
    }

    public PipelineException(String message, Throwable cause) {
        super(message, cause);
    }
}
