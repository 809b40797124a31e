package com.policyqa.model;

import java.util.List;
import java.util.Map;

public record QueryAuditRecord(
    String queryId,
    String sessionId,
    Long ownerId,
    String query,
    Decision decision,
    double confidence,
    long processingTimeMs,
    Map<QueryAttribute, AttributeValue> attributes,
    List<AgentStep> agentSteps
) {}
