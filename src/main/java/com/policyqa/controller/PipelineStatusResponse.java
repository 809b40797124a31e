package com.policyqa.controller;

import com.policyqa.model.QueryStage;

import java.util.List;

public record PipelineStatusResponse(
    List<String> agents,
    List<QueryStage> stages,
    List<String> rules
) {}
