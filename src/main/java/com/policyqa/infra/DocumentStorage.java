package com.policyqa.infra;

/**
 * Keeps uploaded bytes until the indexer has consumed them.
 */
public interface DocumentStorage {

    String store(Long documentId, String filename, byte[] content);

    byte[] load(String storageRef);

    void delete(String storageRef);
}
