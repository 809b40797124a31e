package com.policyqa.agent.evaluation;

import com.policyqa.model.ParsedQuery;
import com.policyqa.model.RetrievalResult;
import com.policyqa.model.RuleOutcome;

/**
 * One coverage check. Rules are evaluated in {@link org.springframework.core.annotation.Order} order and
 * must not throw for missing attributes or evidence; they report UNKNOWN or NOT_APPLICABLE instead.
 */
public interface CoverageRule {

    String id();

    RuleOutcome evaluate(ParsedQuery query, RetrievalResult evidence);
}
