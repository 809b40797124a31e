package com.policyqa.model;

public record ChunkMatch(Chunk chunk, double vectorScore) {}
