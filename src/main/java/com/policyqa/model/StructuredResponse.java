package com.policyqa.model;

import java.math.BigDecimal;
import java.util.List;

public record StructuredResponse(
    Decision decision,
    BigDecimal amount,
    String justification,
    List<SourceCitation> sources,
    double confidenceScore,
    long processingTimeMs
) {

    public StructuredResponse {
        if (decision == null) {
            throw new IllegalArgumentException("Decision is required");
        }
        if (amount != null && decision != Decision.APPROVED) {
            throw new IllegalArgumentException("Amount is only present for approved decisions");
        }
        sources = sources == null ? List.of() : List.copyOf(sources);
        justification = justification == null ? "" : justification;
        confidenceScore = Math.max(0.0, Math.min(1.0, confidenceScore));
    }

    public StructuredResponse withProcessingTime(long millis) {
        return new StructuredResponse(decision, amount, justification, sources, confidenceScore, millis);
    }
}
