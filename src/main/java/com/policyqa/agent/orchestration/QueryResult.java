package com.policyqa.agent.orchestration;

import com.policyqa.model.AgentStep;
import com.policyqa.model.StructuredResponse;

import java.util.List;

public record QueryResult(String queryId, StructuredResponse response, List<AgentStep> steps) {

    public QueryResult {
        steps = steps == null ? List.of() : List.copyOf(steps);
    }
}
