package com.policyqa.controller;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.policyqa.agent.orchestration.QueryResult;
import com.policyqa.model.AgentStep;
import com.policyqa.model.Decision;
import com.policyqa.model.SourceCitation;
import com.policyqa.model.StructuredResponse;

import java.math.BigDecimal;
import java.util.List;

public record QueryResponse(
    Decision decision,

    @JsonInclude(JsonInclude.Include.NON_NULL)
    BigDecimal amount,

    String justification,

    List<SourceCitation> sources,

    @JsonProperty("confidence_score")
    double confidenceScore,

    @JsonProperty("processing_time_ms")
    long processingTimeMs,

    @JsonProperty("query_id")
    String queryId,

    @JsonProperty("agent_steps")
    @JsonInclude(JsonInclude.Include.NON_NULL)
    List<AgentStep> agentSteps
) {

    public static QueryResponse from(QueryResult result, boolean includeAudit) {
        StructuredResponse response = result.response();
        return new QueryResponse(
            response.decision(),
            response.amount(),
            response.justification(),
            response.sources(),
            response.confidenceScore(),
            response.processingTimeMs(),
            result.queryId(),
            includeAudit ? result.steps() : null
        );
    }
}
