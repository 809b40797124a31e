package com.policyqa.exception;

import lombok.Getter;

@Getter
public class UnsupportedContentTypeException extends RuntimeException {
    private final String contentType;

    public UnsupportedContentTypeException(String contentType) {
        super("Unsupported content type: " + contentType);
        this.contentType = contentType;
    }
}
