package com.policyqa.controller;

import com.policyqa.agent.orchestration.QueryCommand;
import com.policyqa.agent.orchestration.QueryExecution;
import com.policyqa.service.QueryService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.context.request.async.DeferredResult;

import java.util.concurrent.CompletionException;

@Slf4j
@RestController
@RequestMapping("/query")
@RequiredArgsConstructor
public class QueryController {

    public static final String USER_HEADER = "X-User-Id";

    private final QueryService queryService;

    @PostMapping
    public DeferredResult<ResponseEntity<QueryResponse>> query(
        @RequestHeader(USER_HEADER) Long userId,
        @Valid @RequestBody QueryRequest request) {

        QueryExecution execution = queryService.submit(new QueryCommand(
            userId,
            request.query(),
            request.documentIds(),
            request.sessionId(),
            request.includeAudit()
        ));

        DeferredResult<ResponseEntity<QueryResponse>> deferred = new DeferredResult<>();
        deferred.onTimeout(() -> {
            log.warn("Request for query {} timed out, cancelling", execution.queryId());
            execution.cancel();
        });
        deferred.onError(error -> execution.cancel());

        execution.result().whenComplete((result, error) -> {
            if (error != null) {
                deferred.setErrorResult(error instanceof CompletionException && error.getCause() != null
                    ? error.getCause()
                    : error);
            } else {
                deferred.setResult(ResponseEntity.ok(QueryResponse.from(result, request.includeAudit())));
            }
        });
        return deferred;
    }
}
