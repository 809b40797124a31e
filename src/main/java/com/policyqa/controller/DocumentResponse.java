package com.policyqa.controller;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.policyqa.model.Document;
import com.policyqa.model.DocumentStatus;

import java.time.OffsetDateTime;

public record DocumentResponse(
    Long id,

    String filename,

    @JsonProperty("content_type")
    String contentType,

    @JsonProperty("size_bytes")
    long sizeBytes,

    DocumentStatus status,

    @JsonProperty("failure_reason")
    @JsonInclude(JsonInclude.Include.NON_NULL)
    String failureReason,

    @JsonProperty("created_at")
    OffsetDateTime createdAt,

    @JsonProperty("updated_at")
    OffsetDateTime updatedAt
) {

    public static DocumentResponse from(Document doc) {
        return new DocumentResponse(
            doc.id(),
            doc.filename(),
            doc.contentType(),
            doc.sizeBytes(),
            doc.status(),
            doc.failureReason(),
            doc.createdAt(),
            doc.updatedAt()
        );
    }
}
