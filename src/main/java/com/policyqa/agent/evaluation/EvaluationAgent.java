package com.policyqa.agent.evaluation;

import com.policyqa.config.EvaluationProperties;
import com.policyqa.model.ClauseEvidence;
import com.policyqa.model.Decision;
import com.policyqa.model.EvaluationDraft;
import com.policyqa.model.ParsedQuery;
import com.policyqa.model.RetrievalResult;
import com.policyqa.model.RuleOutcome;
import com.policyqa.model.RuleVerdict;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.List;
import java.util.Objects;

/**
 * Applies the coverage rules in declaration order and derives the decision:
 * <ul>
 *   <li>any FAIL at or above the rejection confidence rejects;</li>
 *   <li>otherwise every applicable rule must PASS at or above the approval confidence and an amount must be
 *       known to approve;</li>
 *   <li>anything else requires more information.</li>
 * </ul>
 * The aggregate confidence is the weakest contributing rule confidence or cited chunk score.
 */
@Slf4j
@Component
public class EvaluationAgent {

    private final List<CoverageRule> rules;
    private final EvaluationProperties properties;

    public EvaluationAgent(List<CoverageRule> rules, EvaluationProperties properties) {
        this.rules = List.copyOf(rules);
        this.properties = properties;
    }

    public List<String> ruleIds() {
        return rules.stream().map(CoverageRule::id).toList();
    }

    public EvaluationDraft evaluate(ParsedQuery query, RetrievalResult evidence) {
        List<RuleOutcome> trace = rules.stream()
            .map(rule -> rule.evaluate(query, evidence))
            .toList();

        List<RuleOutcome> applicable = trace.stream().filter(RuleOutcome::isApplicable).toList();

        List<RuleOutcome> rejecting = applicable.stream()
            .filter(o -> o.verdict() == RuleVerdict.FAIL && o.confidence() >= properties.rejectionConfidence())
            .toList();
        if (!rejecting.isEmpty()) {
            return draft(Decision.REJECTED, null, trace, rejecting);
        }

        BigDecimal amount = applicable.stream()
            .filter(o -> o.verdict() == RuleVerdict.PASS)
            .map(RuleOutcome::amount)
            .filter(Objects::nonNull)
            .findFirst()
            .orElse(null);

        boolean settled = !applicable.isEmpty() && applicable.stream()
            .allMatch(o -> o.verdict() == RuleVerdict.PASS && o.confidence() >= properties.approvalConfidence());

        if (settled && amount != null) {
            return draft(Decision.APPROVED, amount, trace, applicable);
        }
        return draft(Decision.REQUIRES_MORE_INFO, null, trace, applicable);
    }

    private EvaluationDraft draft(Decision decision, BigDecimal amount, List<RuleOutcome> trace,
                                  List<RuleOutcome> contributing) {
        double confidence = weakestLink(contributing);
        log.debug("Evaluation decided {} with confidence {} from {} contributing rules",
            decision, confidence, contributing.size());
        return new EvaluationDraft(decision, amount, trace, confidence);
    }

    static double weakestLink(List<RuleOutcome> contributing) {
        if (contributing.isEmpty()) {
            return 0.0;
        }
        double ruleMin = contributing.stream().mapToDouble(RuleOutcome::confidence).min().orElse(0.0);
        double evidenceMin = contributing.stream()
            .flatMap(o -> o.evidence().stream())
            .map(ClauseEvidence::chunk)
            .mapToDouble(chunk -> chunk.score())
            .min()
            .orElse(1.0);
        return Math.max(0.0, Math.min(1.0, Math.min(ruleMin, evidenceMin)));
    }
}
