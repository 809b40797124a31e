package com.policyqa.exception;

import lombok.Getter;

@Getter
public class DocumentTooLargeException extends RuntimeException {
    private final long sizeBytes;
    private final long limitBytes;

    public DocumentTooLargeException(long sizeBytes, long limitBytes) {
        super("Document size " + sizeBytes + " exceeds the limit of " + limitBytes + " bytes");
        this.sizeBytes = sizeBytes;
        this.limitBytes = limitBytes;
    }
}
