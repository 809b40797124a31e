package com.policyqa.model;

import java.util.List;
import java.util.Optional;
import java.util.Set;

public record RetrievalResult(List<Long> searchedDocumentIds, List<RetrievedChunk> chunks) {

    public RetrievalResult {
        searchedDocumentIds = searchedDocumentIds == null ? List.of() : List.copyOf(searchedDocumentIds);
        chunks = chunks == null ? List.of() : List.copyOf(chunks);
    }

    public static RetrievalResult empty() {
        return new RetrievalResult(List.of(), List.of());
    }

    public boolean isEmpty() {
        return chunks.isEmpty();
    }

    public Set<Long> chunkIds() {
        return Set.copyOf(chunks.stream().map(RetrievedChunk::chunkId).toList());
    }

    public Optional<RetrievedChunk> find(Long chunkId) {
        return chunks.stream().filter(c -> c.chunkId().equals(chunkId)).findFirst();
    }
}
