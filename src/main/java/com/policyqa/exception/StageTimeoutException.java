package com.policyqa.exception;

import com.policyqa.model.QueryStage;
import lombok.Getter;

/**
 * A pipeline stage did not finish within the query's remaining time budget.
 */
@Getter
public class StageTimeoutException extends RuntimeException {
    private final QueryStage stage;

    public StageTimeoutException(QueryStage stage) {
        super("Time budget exhausted during " + stage.wireValue());
        this.stage = stage;
    }
}
