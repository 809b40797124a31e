package com.policyqa.model;

import java.time.OffsetDateTime;

public record Document(
    Long id,
    Long ownerId,
    String filename,
    String contentType,
    long sizeBytes,
    String storageRef,
    DocumentStatus status,
    String failureReason,
    OffsetDateTime createdAt,
    OffsetDateTime updatedAt
) {

    public static Document pending(Long ownerId, String filename, String contentType, long sizeBytes) {
        return new Document(null, ownerId, filename, contentType, sizeBytes, null,
            DocumentStatus.PENDING, null, null, null);
    }
}
