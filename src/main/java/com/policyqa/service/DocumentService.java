package com.policyqa.service;

import com.policyqa.controller.DocumentResponse;

import java.util.Collection;
import java.util.List;

public interface DocumentService {

    DocumentResponse upload(Long ownerId, String filename, String contentType, byte[] content);

    DocumentResponse getById(Long ownerId, Long id);

    List<DocumentResponse> list(Long ownerId);

    void delete(Long ownerId, Long id);

    /**
     * Fails with a not-found error unless every id exists and belongs to the owner.
     */
    void requireOwned(Long ownerId, Collection<Long> documentIds);
}
