package com.policyqa.model;

public record Chunk(
    Long id,
    Long documentId,
    int ordinal,
    Integer page,
    String section,
    ClauseCategory category,
    String content
) {}
