package com.policyqa.agent.orchestration;

import com.policyqa.agent.evaluation.EvaluationAgent;
import com.policyqa.agent.parser.QueryParserAgent;
import com.policyqa.agent.retrieval.RetrievalAgent;
import com.policyqa.agent.retrieval.RetrievalScope;
import com.policyqa.agent.synthesis.ResponseSynthesizer;
import com.policyqa.config.PipelineProperties;
import com.policyqa.exception.PipelineException;
import com.policyqa.exception.QueryCancelledException;
import com.policyqa.exception.StageTimeoutException;
import com.policyqa.exception.TransientDependencyException;
import com.policyqa.infra.TimeBudget;
import com.policyqa.model.AgentStep;
import com.policyqa.model.AttributeValue;
import com.policyqa.model.EvaluationDraft;
import com.policyqa.model.ParsedQuery;
import com.policyqa.model.QueryAttribute;
import com.policyqa.model.QueryAuditRecord;
import com.policyqa.model.QueryStage;
import com.policyqa.model.RetrievalResult;
import com.policyqa.model.StepStatus;
import com.policyqa.model.StructuredResponse;
import com.policyqa.repository.QueryAuditRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.TransientDataAccessException;
import org.springframework.retry.support.RetryTemplate;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Drives a query through parsing, retrieval, evaluation and synthesis under one wall-clock budget.
 * <p>
 * Each stage runs on the stage executor so an overrunning stage can be interrupted, and is retried on
 * transient dependency failures. When the budget runs out, or parsing or retrieval cannot reach their
 * dependencies, the query still completes with a {@code requires_more_info} answer built from whatever was
 * retrieved. Failures during evaluation or synthesis are internal errors.
 */
@Slf4j
@Service
public class QueryOrchestrator {

    public static final String PARSER = "query-parser";
    public static final String RETRIEVER = "retrieval-agent";
    public static final String EVALUATOR = "evaluation-agent";
    public static final String SYNTHESIZER = "response-synthesizer";

    private static final int MAX_SUMMARY = 200;

    private final QueryParserAgent parser;
    private final RetrievalAgent retrievalAgent;
    private final EvaluationAgent evaluationAgent;
    private final ResponseSynthesizer synthesizer;
    private final QueryAuditRepository auditRepository;
    private final PipelineProperties properties;
    private final AsyncTaskExecutor queryExecutor;
    private final AsyncTaskExecutor stageExecutor;
    private final RetryTemplate retryTemplate;

    public QueryOrchestrator(
        QueryParserAgent parser,
        RetrievalAgent retrievalAgent,
        EvaluationAgent evaluationAgent,
        ResponseSynthesizer synthesizer,
        QueryAuditRepository auditRepository,
        PipelineProperties properties,
        @Qualifier("queryTaskExecutor") AsyncTaskExecutor queryExecutor,
        @Qualifier("stageTaskExecutor") AsyncTaskExecutor stageExecutor
    ) {
        this.parser = parser;
        this.retrievalAgent = retrievalAgent;
        this.evaluationAgent = evaluationAgent;
        this.synthesizer = synthesizer;
        this.auditRepository = auditRepository;
        this.properties = properties;
        this.queryExecutor = queryExecutor;
        this.stageExecutor = stageExecutor;
        this.retryTemplate = RetryTemplate.builder()
            .maxAttempts(properties.maxAttempts())
            .exponentialBackoff(properties.initialBackoff().toMillis(), properties.backoffMultiplier(),
                properties.maxBackoff().toMillis())
            .retryOn(List.of(TransientDependencyException.class, TransientDataAccessException.class))
            .traversingCauses()
            .build();
    }

    public List<String> agents() {
        return List.of(PARSER, RETRIEVER, EVALUATOR, SYNTHESIZER);
    }

    /**
     * Validates the query text synchronously and runs the pipeline on the query executor.
     */
    public QueryExecution submit(QueryCommand command) {
        parser.validate(command.query());
        QueryContext context = newContext(command);
        CompletableFuture<QueryResult> result = CompletableFuture.supplyAsync(() -> run(context), queryExecutor);
        return new QueryExecution(context, result);
    }

    public QueryContext newContext(QueryCommand command) {
        return new QueryContext(UUID.randomUUID().toString(), command, TimeBudget.start(properties.timeout()));
    }

    public QueryResult run(QueryContext context) {
        QueryCommand command = context.getCommand();
        log.info("Query {} received (owner={}, session={}, documents={})", context.getQueryId(),
            command.ownerId(), command.sessionId(), command.documentIds().isEmpty() ? "all" : command.documentIds());

        try {
            context.advance(QueryStage.PARSING);
            ParsedQuery parsed = runStage(context, QueryStage.PARSING, PARSER, abbreviate(command.query()),
                () -> parser.parse(command.query(), sessionAttributes(command)),
                query -> "attributes=" + query.attributes().keySet() + ", confidence=" + format(query.confidence()));
            context.setParsedQuery(parsed);

            context.advance(QueryStage.RETRIEVING);
            RetrievalScope scope = new RetrievalScope(command.ownerId(), command.documentIds());
            RetrievalResult retrieval = runStage(context, QueryStage.RETRIEVING, RETRIEVER,
                "documents=" + (scope.isExplicit() ? scope.documentIds() : "all"),
                () -> retrievalAgent.retrieve(parsed, scope),
                result -> "chunks=" + result.chunks().size() + ", searched=" + result.searchedDocumentIds());
            context.setRetrieval(retrieval);

            context.advance(QueryStage.EVALUATING);
            EvaluationDraft draft = runStage(context, QueryStage.EVALUATING, EVALUATOR,
                "attributes=" + parsed.attributes().keySet() + ", chunks=" + retrieval.chunks().size(),
                () -> evaluationAgent.evaluate(parsed, retrieval),
                result -> "decision=" + result.decision().wireValue() + ", confidence=" + format(result.confidence()));

            context.advance(QueryStage.SYNTHESIZING);
            StructuredResponse response = runStage(context, QueryStage.SYNTHESIZING, SYNTHESIZER,
                "decision=" + draft.decision().wireValue() + ", rules=" + draft.trace().size(),
                () -> synthesizer.synthesize(draft, retrieval),
                result -> "sources=" + result.sources().size());

            return complete(context, response);
        } catch (QueryCancelledException e) {
            fail(context);
            log.info("Query {} cancelled during {}", context.getQueryId(), context.getStage().wireValue());
            throw e;
        } catch (StageTimeoutException e) {
            log.warn("Query {} ran out of time during {}", context.getQueryId(), e.getStage().wireValue());
            return fallback(context, "the query could not be completed within its time budget.");
        } catch (TransientDependencyException | TransientDataAccessException e) {
            QueryStage stage = context.getStage();
            if (stage == QueryStage.PARSING || stage == QueryStage.RETRIEVING) {
                log.warn("Query {} falling back after {} failed: {}", context.getQueryId(), stage.wireValue(),
                    e.getMessage());
                return fallback(context, "a required service was unavailable while "
                    + (stage == QueryStage.PARSING ? "reading the query." : "searching the policy documents."));
            }
            fail(context);
            log.error("Query {} failed during {} after retries", context.getQueryId(), stage.wireValue(), e);
            throw new PipelineException("Stage " + stage.wireValue() + " failed after retries", e);
        } catch (PipelineException e) {
            fail(context);
            log.error("Query {} failed during {}", context.getQueryId(), context.getStage().wireValue(), e);
            throw e;
        } catch (RuntimeException e) {
            fail(context);
            log.error("Query {} failed unexpectedly during {}", context.getQueryId(),
                context.getStage().wireValue(), e);
            throw new PipelineException("Query pipeline failed", e);
        }
    }

    private <T> T runStage(
        QueryContext context,
        QueryStage stage,
        String agent,
        String input,
        Supplier<T> work,
        Function<T, String> output
    ) {
        context.checkNotCancelled();
        long startNanos = System.nanoTime();
        AtomicInteger attempts = new AtomicInteger();

        try {
            T result = retryTemplate.execute(retryContext -> {
                attempts.incrementAndGet();
                context.checkNotCancelled();
                return callWithDeadline(context, stage, work);
            });
            context.record(step(stage, agent, StepStatus.COMPLETED, attempts.get(), startNanos, input,
                output.apply(result)));
            return result;
        } catch (StageTimeoutException e) {
            context.record(step(stage, agent, StepStatus.TIMED_OUT, attempts.get(), startNanos, input,
                e.getMessage()));
            throw e;
        } catch (QueryCancelledException e) {
            throw e;
        } catch (RuntimeException e) {
            context.record(step(stage, agent, StepStatus.FAILED, attempts.get(), startNanos, input,
                e.getClass().getSimpleName() + ": " + e.getMessage()));
            throw e;
        }
    }

    private <T> T callWithDeadline(QueryContext context, QueryStage stage, Supplier<T> work) {
        long remaining = context.getBudget().remainingMs();
        if (remaining <= 0) {
            throw new StageTimeoutException(stage);
        }

        Future<T> future;
        try {
            future = stageExecutor.submit(work::get);
        } catch (TaskRejectedException e) {
            throw new TransientDependencyException("No stage capacity for " + stage.wireValue(), e);
        }
        context.attach(future);
        try {
            return future.get(remaining, TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            throw new StageTimeoutException(stage);
        } catch (CancellationException e) {
            throw new QueryCancelledException(context.getQueryId());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            future.cancel(true);
            throw new QueryCancelledException(context.getQueryId());
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException runtime) {
                throw runtime;
            }
            if (cause instanceof Error error) {
                throw error;
            }
            throw new PipelineException("Stage " + stage.wireValue() + " failed", cause);
        } finally {
            context.detach();
        }
    }

    private QueryResult fallback(QueryContext context, String reason) {
        context.checkNotCancelled();
        StructuredResponse response = synthesizer.fallback(context.getRetrieval(), reason,
            properties.fallbackMaxSources());
        return complete(context, response);
    }

    private QueryResult complete(QueryContext context, StructuredResponse response) {
        context.checkNotCancelled();
        context.advance(QueryStage.DONE);
        StructuredResponse timed = response.withProcessingTime(context.getBudget().elapsedMs());

        audit(context, timed);
        log.info("Query {} done: decision={}, confidence={}, sources={}, {} ms", context.getQueryId(),
            timed.decision().wireValue(), format(timed.confidenceScore()), timed.sources().size(),
            timed.processingTimeMs());
        return new QueryResult(context.getQueryId(), timed, context.steps());
    }

    private void audit(QueryContext context, StructuredResponse response) {
        QueryCommand command = context.getCommand();
        ParsedQuery parsed = context.getParsedQuery();
        try {
            auditRepository.append(new QueryAuditRecord(
                context.getQueryId(),
                command.sessionId(),
                command.ownerId(),
                command.query(),
                response.decision(),
                response.confidenceScore(),
                response.processingTimeMs(),
                parsed == null ? Map.of() : parsed.attributes(),
                context.steps()
            ));
        } catch (DataAccessException e) {
            log.warn("Could not append audit record for query {}", context.getQueryId(), e);
        }
    }

    private Map<QueryAttribute, AttributeValue> sessionAttributes(QueryCommand command) {
        if (command.sessionId() == null || command.sessionId().isBlank()) {
            return Map.of();
        }
        try {
            return auditRepository.findLatestAttributes(command.ownerId(), command.sessionId());
        } catch (TransientDataAccessException e) {
            throw e;
        } catch (DataAccessException e) {
            log.warn("Could not load session {} context, parsing without it", command.sessionId(), e);
            return Map.of();
        }
    }

    private static void fail(QueryContext context) {
        if (!context.getStage().isTerminal()) {
            context.advance(QueryStage.FAILED);
        }
    }

    private static AgentStep step(QueryStage stage, String agent, StepStatus status, int attempts,
                                  long startNanos, String input, String output) {
        long durationMs = (System.nanoTime() - startNanos) / 1_000_000L;
        return new AgentStep(stage, agent, status, attempts, durationMs, input, abbreviate(output));
    }

    private static String abbreviate(String text) {
        if (text == null || text.length() <= MAX_SUMMARY) {
            return text;
        }
        return text.substring(0, MAX_SUMMARY) + "...";
    }

    private static String format(double value) {
        return String.format(Locale.ROOT, "%.2f", value);
    }
}
