package com.policyqa.model;

import com.fasterxml.jackson.annotation.JsonProperty;

public record AgentStep(
    QueryStage stage,

    @JsonProperty("agent_name")
    String agentName,

    StepStatus status,

    int attempts,

    @JsonProperty("duration_ms")
    long durationMs,

    String input,

    String output
) {}
