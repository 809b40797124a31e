package com.policyqa.agent.orchestration;

import java.util.List;

public record QueryCommand(
    Long ownerId,
    String query,
    List<Long> documentIds,
    String sessionId,
    boolean includeAudit
) {

    public QueryCommand {
        documentIds = documentIds == null ? List.of() : List.copyOf(documentIds);
    }
}
