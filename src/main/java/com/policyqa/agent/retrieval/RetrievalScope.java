package com.policyqa.agent.retrieval;

import java.util.List;

/**
 * Whose documents to search, optionally narrowed to explicit ids.
 */
public record RetrievalScope(Long ownerId, List<Long> documentIds) {

    public RetrievalScope {
        documentIds = documentIds == null ? List.of() : List.copyOf(documentIds);
    }

    public boolean isExplicit() {
        return !documentIds.isEmpty();
    }
}
