package com.policyqa.model;

import java.util.Comparator;
import java.util.List;

public record RetrievedChunk(
    Chunk chunk,
    double score,
    double vectorScore,
    double keywordScore,
    List<String> matchedTerms
) {

    public static final Comparator<RetrievedChunk> RANKING = Comparator
        .comparingDouble(RetrievedChunk::score).reversed()
        .thenComparingInt(r -> r.chunk().ordinal())
        .thenComparing(r -> r.chunk().documentId())
        .thenComparing(r -> r.chunk().id());

    public RetrievedChunk {
        if (score < 0.0 || score > 1.0) {
            throw new IllegalArgumentException("Score must be in [0, 1]: " + score);
        }
        matchedTerms = matchedTerms == null ? List.of() : List.copyOf(matchedTerms);
    }

    public Long chunkId() {
        return chunk.id();
    }

    public Long documentId() {
        return chunk.documentId();
    }
}
