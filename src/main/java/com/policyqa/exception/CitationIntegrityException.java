package com.policyqa.exception;

import lombok.Getter;

@Getter
public class CitationIntegrityException extends PipelineException {
    private final Long chunkId;

    public CitationIntegrityException(Long chunkId) {
        super("Citation references chunk " + chunkId + " outside the retrieval set");
        this.chunkId = chunkId;
    }
}
