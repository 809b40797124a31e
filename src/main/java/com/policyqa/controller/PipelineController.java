package com.policyqa.controller;

import com.policyqa.agent.evaluation.EvaluationAgent;
import com.policyqa.agent.orchestration.QueryOrchestrator;
import com.policyqa.model.QueryStage;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/pipeline")
@RequiredArgsConstructor
public class PipelineController {

    private final QueryOrchestrator orchestrator;
    private final EvaluationAgent evaluationAgent;

    @GetMapping("/status")
    public ResponseEntity<PipelineStatusResponse> status() {
        return ResponseEntity.ok(new PipelineStatusResponse(
            orchestrator.agents(),
            List.of(QueryStage.values()),
            evaluationAgent.ruleIds()
        ));
    }
}
