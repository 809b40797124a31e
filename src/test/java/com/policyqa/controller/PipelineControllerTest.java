package com.policyqa.controller;

import com.policyqa.agent.evaluation.EvaluationAgent;
import com.policyqa.agent.orchestration.QueryOrchestrator;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import java.util.List;

import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(PipelineController.class)
class PipelineControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockitoBean
    private QueryOrchestrator orchestrator;

    @MockitoBean
    private EvaluationAgent evaluationAgent;

    @Test
    @DisplayName("GET /pipeline/status should list agents, stages and rules")
    void shouldDescribePipeline() throws Exception {
        when(orchestrator.agents()).thenReturn(List.of("query-parser", "retrieval-agent"));
        when(evaluationAgent.ruleIds()).thenReturn(List.of("age-eligibility", "waiting-period"));

        mockMvc.perform(get("/pipeline/status"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.agents[0]").value("query-parser"))
            .andExpect(jsonPath("$.stages[0]").value("received"))
            .andExpect(jsonPath("$.stages.length()").value(7))
            .andExpect(jsonPath("$.rules[1]").value("waiting-period"));
    }
}
