package com.policyqa.agent.evaluation;

import com.policyqa.agent.ProcedureCatalog;
import com.policyqa.model.QueryAttribute;
import com.policyqa.model.RetrievalResult;
import com.policyqa.model.RuleOutcome;
import com.policyqa.model.RuleVerdict;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static com.policyqa.PolicyFixtures.COVERAGE_CLAUSE;
import static com.policyqa.PolicyFixtures.UNRELATED_CLAUSE;
import static com.policyqa.PolicyFixtures.kneePolicy;
import static com.policyqa.PolicyFixtures.kneeQuery;
import static com.policyqa.PolicyFixtures.kneeQueryWithout;
import static com.policyqa.PolicyFixtures.retrieval;
import static com.policyqa.PolicyFixtures.retrieved;
import static org.assertj.core.api.Assertions.assertThat;

class ProcedureCoverageRuleTest {

    private final ProcedureCoverageRule rule = new ProcedureCoverageRule(new ProcedureCatalog());

    @Test
    @DisplayName("Coverage statement for the procedure passes")
    void shouldPassOnCoverageStatement() {
        RuleOutcome outcome = rule.evaluate(kneeQuery(), kneePolicy());

        assertThat(outcome.verdict()).isEqualTo(RuleVerdict.PASS);
        assertThat(outcome.confidence()).isEqualTo(0.9);
        assertThat(outcome.evidence().get(0).quote()).isEqualTo(COVERAGE_CLAUSE);
    }

    @Test
    @DisplayName("Mention without coverage wording is weakly unknown")
    void shouldBeUnknownOnBareMention() {
        RuleOutcome outcome = rule.evaluate(kneeQuery(),
            retrieval(retrieved(1L, "Knee surgery requires pre-authorisation.", 0.7)));

        assertThat(outcome.verdict()).isEqualTo(RuleVerdict.UNKNOWN);
        assertThat(outcome.confidence()).isEqualTo(0.3);
        assertThat(outcome.evidence()).hasSize(1);
    }

    @Test
    @DisplayName("Negative clauses never count as coverage")
    void shouldIgnoreNegativeClause() {
        RuleOutcome outcome = rule.evaluate(kneeQuery(),
            retrieval(retrieved(1L, "Knee surgery is not covered.", 0.7)));

        assertThat(outcome.verdict()).isEqualTo(RuleVerdict.UNKNOWN);
        assertThat(outcome.confidence()).isEqualTo(0.1);
        assertThat(outcome.evidence()).isEmpty();
    }

    @Test
    @DisplayName("Missing procedure or evidence yields zero confidence")
    void shouldBeUnknownWithoutInputs() {
        assertThat(rule.evaluate(kneeQueryWithout(QueryAttribute.PROCEDURE), kneePolicy()).confidence()).isZero();
        assertThat(rule.evaluate(kneeQuery(), RetrievalResult.empty()).confidence()).isZero();
        assertThat(rule.evaluate(kneeQuery(), retrieval(retrieved(1L, UNRELATED_CLAUSE, 0.5))).confidence())
            .isEqualTo(0.1);
    }
}
