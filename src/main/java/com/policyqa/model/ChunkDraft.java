package com.policyqa.model;

/**
 * A chunk produced by the indexer, not yet persisted.
 */
public record ChunkDraft(
    int ordinal,
    Integer page,
    String section,
    ClauseCategory category,
    String content,
    float[] embedding
) {}
