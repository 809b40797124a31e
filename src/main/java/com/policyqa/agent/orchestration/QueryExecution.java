package com.policyqa.agent.orchestration;

import java.util.concurrent.CompletableFuture;

/**
 * Handle on a submitted query.
 */
public record QueryExecution(QueryContext context, CompletableFuture<QueryResult> result) {

    public String queryId() {
        return context.getQueryId();
    }

    /**
     * Requests cooperative cancellation. The running stage is interrupted and nothing is persisted.
     */
    public void cancel() {
        context.cancel();
    }
}
