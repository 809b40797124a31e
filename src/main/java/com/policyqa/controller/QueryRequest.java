package com.policyqa.controller;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;

import java.util.List;

public record QueryRequest(
    @NotBlank
    String query,

    @JsonProperty("document_ids")
    List<Long> documentIds,

    @JsonProperty("session_id")
    String sessionId,

    @JsonProperty("include_audit")
    boolean includeAudit
) {}
