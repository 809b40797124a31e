package com.policyqa.exception;

import java.util.concurrent.CancellationException;

public class QueryCancelledException extends CancellationException {

    public QueryCancelledException(String queryId) {
        super("Query cancelled: " + queryId);
    }
}
