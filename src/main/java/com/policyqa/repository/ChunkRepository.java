package com.policyqa.repository;

import com.policyqa.model.ChunkDraft;
import com.policyqa.model.ChunkMatch;

import java.util.Collection;
import java.util.List;

public interface ChunkRepository {

    void saveChunks(Long documentId, List<ChunkDraft> chunks);

    /**
     * Nearest chunks by cosine distance to {@code vector}.
     */
    List<ChunkMatch> findNearest(float[] vector, Collection<Long> documentIds, int limit);

    /**
     * Chunks containing any of {@code terms} (case-insensitive), scored against {@code vector}.
     */
    List<ChunkMatch> findByKeywords(float[] vector, List<String> terms, Collection<Long> documentIds, int limit);

    int countByDocumentId(Long documentId);
}
