package com.policyqa.repository;

import com.policyqa.model.Document;
import com.policyqa.model.DocumentStatus;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

public interface DocumentRepository {

    Document save(Document document);

    void updateStorageRef(Long id, String storageRef);

    Optional<Document> findById(Long id);

    List<Document> findByOwner(Long ownerId);

    List<Document> findByIds(Collection<Long> ids);

    List<Long> findIdsByOwnerAndStatus(Long ownerId, DocumentStatus status);

    /**
     * Moves a pending document to processing. Returns false when the document is not pending.
     */
    boolean claimForIndexing(Long id);

    boolean markCompleted(Long id);

    /**
     * Fails a document that has not reached a terminal status yet.
     */
    boolean markFailed(Long id, String reason);

    List<Long> failStaleProcessing(int staleThresholdMinutes, String reason);

    void delete(Long id);
}
