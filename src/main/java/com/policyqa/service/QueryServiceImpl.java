package com.policyqa.service;

import com.policyqa.agent.orchestration.QueryCommand;
import com.policyqa.agent.orchestration.QueryExecution;
import com.policyqa.agent.orchestration.QueryOrchestrator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

@Service
@Slf4j
@RequiredArgsConstructor
public class QueryServiceImpl implements QueryService {

    private final DocumentService documentService;
    private final QueryOrchestrator orchestrator;

    @Override
    public QueryExecution submit(QueryCommand command) {
        if (!command.documentIds().isEmpty()) {
            documentService.requireOwned(command.ownerId(), command.documentIds());
        }
        QueryExecution execution = orchestrator.submit(command);
        log.debug("Submitted query {} for owner {}", execution.queryId(), command.ownerId());
        return execution;
    }
}
