package com.policyqa.agent.orchestration;

import com.policyqa.exception.QueryCancelledException;
import com.policyqa.infra.TimeBudget;
import com.policyqa.model.AgentStep;
import com.policyqa.model.ParsedQuery;
import com.policyqa.model.QueryStage;
import com.policyqa.model.RetrievalResult;
import lombok.Getter;
import lombok.Setter;

import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Mutable state of one query as it moves through the pipeline. Stage transitions are validated;
 * partial results are kept so a short-circuited query can still cite what was retrieved.
 */
public class QueryContext {

    private static final Map<QueryStage, Set<QueryStage>> TRANSITIONS = new EnumMap<>(QueryStage.class);

    static {
        TRANSITIONS.put(QueryStage.RECEIVED, EnumSet.of(QueryStage.PARSING, QueryStage.FAILED));
        TRANSITIONS.put(QueryStage.PARSING, EnumSet.of(QueryStage.RETRIEVING, QueryStage.DONE, QueryStage.FAILED));
        TRANSITIONS.put(QueryStage.RETRIEVING, EnumSet.of(QueryStage.EVALUATING, QueryStage.DONE, QueryStage.FAILED));
        TRANSITIONS.put(QueryStage.EVALUATING, EnumSet.of(QueryStage.SYNTHESIZING, QueryStage.DONE, QueryStage.FAILED));
        TRANSITIONS.put(QueryStage.SYNTHESIZING, EnumSet.of(QueryStage.DONE, QueryStage.FAILED));
        TRANSITIONS.put(QueryStage.DONE, EnumSet.noneOf(QueryStage.class));
        TRANSITIONS.put(QueryStage.FAILED, EnumSet.noneOf(QueryStage.class));
    }

    @Getter
    private final String queryId;
    @Getter
    private final QueryCommand command;
    @Getter
    private final TimeBudget budget;

    private final AtomicBoolean cancelled = new AtomicBoolean();
    private final List<AgentStep> steps = new CopyOnWriteArrayList<>();

    @Getter
    private volatile QueryStage stage = QueryStage.RECEIVED;
    @Getter
    @Setter
    private volatile ParsedQuery parsedQuery;
    @Getter
    @Setter
    private volatile RetrievalResult retrieval = RetrievalResult.empty();

    private volatile Future<?> runningStage;

    public QueryContext(String queryId, QueryCommand command, TimeBudget budget) {
        this.queryId = queryId;
        this.command = command;
        this.budget = budget;
    }

    public synchronized void advance(QueryStage next) {
        if (!TRANSITIONS.get(stage).contains(next)) {
            throw new IllegalStateException("Illegal stage transition " + stage + " -> " + next);
        }
        stage = next;
    }

    public void record(AgentStep step) {
        steps.add(step);
    }

    public List<AgentStep> steps() {
        return List.copyOf(steps);
    }

    public void cancel() {
        cancelled.set(true);
        Future<?> current = runningStage;
        if (current != null) {
            current.cancel(true);
        }
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

    public void checkNotCancelled() {
        if (cancelled.get()) {
            throw new QueryCancelledException(queryId);
        }
    }

    void attach(Future<?> future) {
        runningStage = future;
        if (cancelled.get()) {
            future.cancel(true);
        }
    }

    void detach() {
        runningStage = null;
    }
}
