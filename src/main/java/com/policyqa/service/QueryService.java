package com.policyqa.service;

import com.policyqa.agent.orchestration.QueryCommand;
import com.policyqa.agent.orchestration.QueryExecution;

public interface QueryService {

    /**
     * Checks ownership of any explicitly named documents and starts the pipeline.
     */
    QueryExecution submit(QueryCommand command);
}
