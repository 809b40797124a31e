package com.policyqa.model;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;

public record RuleOutcome(
    String ruleId,
    Map<String, String> inputs,
    RuleVerdict verdict,
    double confidence,
    List<ClauseEvidence> evidence,
    String explanation,
    BigDecimal amount
) {

    public RuleOutcome {
        inputs = inputs == null ? Map.of() : Map.copyOf(inputs);
        evidence = evidence == null ? List.of() : List.copyOf(evidence);
        confidence = Math.max(0.0, Math.min(1.0, confidence));
    }

    public static RuleOutcome pass(String ruleId, Map<String, String> inputs, double confidence,
                                   ClauseEvidence evidence, String explanation) {
        return new RuleOutcome(ruleId, inputs, RuleVerdict.PASS, confidence, List.of(evidence), explanation, null);
    }

    public static RuleOutcome fail(String ruleId, Map<String, String> inputs, double confidence,
                                   ClauseEvidence evidence, String explanation) {
        return new RuleOutcome(ruleId, inputs, RuleVerdict.FAIL, confidence, List.of(evidence), explanation, null);
    }

    public static RuleOutcome unknown(String ruleId, Map<String, String> inputs, double confidence, String explanation) {
        return new RuleOutcome(ruleId, inputs, RuleVerdict.UNKNOWN, confidence, List.of(), explanation, null);
    }

    public static RuleOutcome notApplicable(String ruleId, Map<String, String> inputs, String explanation) {
        return new RuleOutcome(ruleId, inputs, RuleVerdict.NOT_APPLICABLE, 0.0, List.of(), explanation, null);
    }

    public RuleOutcome withEvidence(ClauseEvidence clause) {
        return new RuleOutcome(ruleId, inputs, verdict, confidence, List.of(clause), explanation, amount);
    }

    public RuleOutcome withAmount(BigDecimal value) {
        return new RuleOutcome(ruleId, inputs, verdict, confidence, evidence, explanation, value);
    }

    public boolean isApplicable() {
        return verdict != RuleVerdict.NOT_APPLICABLE;
    }
}
