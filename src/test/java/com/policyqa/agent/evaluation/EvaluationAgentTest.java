package com.policyqa.agent.evaluation;

import com.policyqa.agent.ProcedureCatalog;
import com.policyqa.config.EvaluationProperties;
import com.policyqa.model.ClauseEvidence;
import com.policyqa.model.Decision;
import com.policyqa.model.EvaluationDraft;
import com.policyqa.model.QueryAttribute;
import com.policyqa.model.RetrievalResult;
import com.policyqa.model.RuleOutcome;
import com.policyqa.model.RuleVerdict;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static com.policyqa.PolicyFixtures.COVERAGE_CLAUSE;
import static com.policyqa.PolicyFixtures.UNRELATED_CLAUSE;
import static com.policyqa.PolicyFixtures.kneePolicy;
import static com.policyqa.PolicyFixtures.kneeQuery;
import static com.policyqa.PolicyFixtures.kneeQueryWith;
import static com.policyqa.PolicyFixtures.kneeQueryWithout;
import static com.policyqa.PolicyFixtures.retrieval;
import static com.policyqa.PolicyFixtures.retrieved;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class EvaluationAgentTest {

    private final ProcedureCatalog catalog = new ProcedureCatalog();

    private final EvaluationAgent agent = new EvaluationAgent(List.of(
        new AgeEligibilityRule(),
        new GeographicCoverageRule(),
        new WaitingPeriodRule(catalog),
        new ProcedureCoverageRule(catalog),
        new ExclusionRule(catalog),
        new SumInsuredRule(catalog)
    ), new EvaluationProperties(0.7, 0.6));

    @Test
    @DisplayName("Rules run in declaration order and every rule appears in the trace")
    void shouldTraceEveryRuleInOrder() {
        EvaluationDraft draft = agent.evaluate(kneeQuery(), kneePolicy());

        assertThat(draft.trace()).extracting(RuleOutcome::ruleId).containsExactly(
            "age-eligibility", "geographic-coverage", "waiting-period", "procedure-coverage", "exclusion-match",
            "sum-insured");
        assertThat(agent.ruleIds()).containsExactlyElementsOf(
            draft.trace().stream().map(RuleOutcome::ruleId).toList());
    }

    @Nested
    @DisplayName("Decision policy")
    class DecisionPolicy {

        @Test
        @DisplayName("All applicable rules passing with an amount approves")
        void shouldApprove() {
            EvaluationDraft draft = agent.evaluate(kneeQuery(), kneePolicy());

            assertThat(draft.decision()).isEqualTo(Decision.APPROVED);
            assertThat(draft.amount()).isEqualByComparingTo("200000");
            assertThat(draft.confidence()).isCloseTo(0.86, within(1e-9));
        }

        @Test
        @DisplayName("Terse policy wording with a dotted rupee amount approves with that amount")
        void shouldApproveTersePolicyWording() {
            RetrievalResult evidence = retrieval(
                retrieved(1L, "Surgical procedures covered after 90-day waiting period. Sum insured Rs. 3,00,000.", 0.9),
                retrieved(2L, "Pune is a Zone-1 covered city.", 0.9),
                retrieved(3L, "Ages 18–65 eligible.", 0.9));

            EvaluationDraft draft = agent.evaluate(kneeQuery(), evidence);

            assertThat(draft.decision()).isEqualTo(Decision.APPROVED);
            assertThat(draft.amount()).isEqualByComparingTo("300000");
            assertThat(draft.confidence()).isGreaterThan(0.8);
            assertThat(draft.trace()).filteredOn(o -> o.ruleId().equals(SumInsuredRule.ID))
                .singleElement()
                .satisfies(outcome -> assertThat(outcome.evidence()).extracting(ClauseEvidence::quote)
                    .containsExactly("Sum insured Rs. 3,00,000."));
        }

        @Test
        @DisplayName("A confident failure rejects regardless of other rules")
        void shouldRejectOnWaitingPeriod() {
            EvaluationDraft draft = agent.evaluate(
                kneeQueryWith(Map.of(QueryAttribute.POLICY_TENURE, "P1M")), kneePolicy());

            assertThat(draft.decision()).isEqualTo(Decision.REJECTED);
            assertThat(draft.amount()).isNull();
            assertThat(draft.confidence()).isCloseTo(0.88, within(1e-9));
        }

        @Test
        @DisplayName("An explicit exclusion rejects")
        void shouldRejectOnExclusion() {
            RetrievalResult evidence = retrieval(
                retrieved(1L, COVERAGE_CLAUSE, 0.92),
                retrieved(2L, "Knee surgery arising from adventure sports is excluded.", 0.9));

            EvaluationDraft draft = agent.evaluate(kneeQuery(), evidence);

            assertThat(draft.decision()).isEqualTo(Decision.REJECTED);
            assertThat(draft.trace()).filteredOn(o -> o.verdict() == RuleVerdict.FAIL)
                .extracting(RuleOutcome::ruleId).containsExactly("exclusion-match");
        }

        @Test
        @DisplayName("Missing query details require more information")
        void shouldRequireMoreInfoWhenTenureMissing() {
            EvaluationDraft draft = agent.evaluate(kneeQueryWithout(QueryAttribute.POLICY_TENURE), kneePolicy());

            assertThat(draft.decision()).isEqualTo(Decision.REQUIRES_MORE_INFO);
            assertThat(draft.amount()).isNull();
        }

        @Test
        @DisplayName("Unrelated clauses require more information with low confidence")
        void shouldRequireMoreInfoWithoutMatchingClauses() {
            EvaluationDraft draft = agent.evaluate(kneeQuery(), retrieval(retrieved(1L, UNRELATED_CLAUSE, 0.4)));

            assertThat(draft.decision()).isEqualTo(Decision.REQUIRES_MORE_INFO);
            assertThat(draft.confidence()).isLessThan(0.3);
        }

        @Test
        @DisplayName("Empty evidence never throws")
        void shouldHandleEmptyEvidence() {
            EvaluationDraft draft = agent.evaluate(kneeQuery(), RetrievalResult.empty());

            assertThat(draft.decision()).isEqualTo(Decision.REQUIRES_MORE_INFO);
            assertThat(draft.confidence()).isZero();
            assertThat(draft.trace()).hasSize(6);
        }
    }

    @Test
    @DisplayName("Weakest link is bounded by cited chunk scores and zero when nothing contributes")
    void shouldComputeWeakestLink() {
        assertThat(EvaluationAgent.weakestLink(List.of())).isZero();

        var chunk = retrieved(9L, COVERAGE_CLAUSE, 0.4);
        RuleOutcome strongRule = RuleOutcome.pass("r", Map.of(), 0.95,
            new ClauseEvidence(chunk, COVERAGE_CLAUSE), "ok");

        assertThat(EvaluationAgent.weakestLink(List.of(strongRule))).isEqualTo(0.4);
    }
}
