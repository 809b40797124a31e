package com.policyqa.model;

import java.math.BigDecimal;
import java.util.List;

public record EvaluationDraft(
    Decision decision,
    BigDecimal amount,
    List<RuleOutcome> trace,
    double confidence
) {

    public EvaluationDraft {
        trace = trace == null ? List.of() : List.copyOf(trace);
        if (amount != null && decision != Decision.APPROVED) {
            throw new IllegalArgumentException("Amount is only defined for approved decisions");
        }
    }
}
