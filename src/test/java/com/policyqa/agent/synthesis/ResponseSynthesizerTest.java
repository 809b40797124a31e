package com.policyqa.agent.synthesis;

import com.policyqa.exception.CitationIntegrityException;
import com.policyqa.model.ClauseEvidence;
import com.policyqa.model.Decision;
import com.policyqa.model.EvaluationDraft;
import com.policyqa.model.RetrievalResult;
import com.policyqa.model.RetrievedChunk;
import com.policyqa.model.RuleOutcome;
import com.policyqa.model.SourceCitation;
import com.policyqa.model.StructuredResponse;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;

import static com.policyqa.PolicyFixtures.AGE_CLAUSE;
import static com.policyqa.PolicyFixtures.COVERAGE_CLAUSE;
import static com.policyqa.PolicyFixtures.WAITING_CLAUSE;
import static com.policyqa.PolicyFixtures.kneePolicy;
import static com.policyqa.PolicyFixtures.retrieved;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ResponseSynthesizerTest {

    private final ResponseSynthesizer synthesizer = new ResponseSynthesizer();

    private final RetrievalResult policy = kneePolicy();
    private final RetrievedChunk coverage = policy.chunks().get(0);
    private final RetrievedChunk waiting = policy.chunks().get(2);
    private final RetrievedChunk age = policy.chunks().get(3);

    private static RuleOutcome pass(String id, RetrievedChunk chunk, String quote) {
        return RuleOutcome.pass(id, Map.of(), 0.9, new ClauseEvidence(chunk, quote), id + " holds.");
    }

    @Nested
    @DisplayName("Citations")
    class Citations {

        @Test
        @DisplayName("Cites each referenced chunk once, in first reference order")
        void shouldCiteDistinctChunksInTraceOrder() {
            EvaluationDraft draft = new EvaluationDraft(Decision.APPROVED, new BigDecimal("200000"), List.of(
                pass("age-eligibility", age, AGE_CLAUSE),
                pass("waiting-period", waiting, WAITING_CLAUSE),
                pass("procedure-coverage", coverage, COVERAGE_CLAUSE),
                pass("sum-insured", coverage, COVERAGE_CLAUSE).withAmount(new BigDecimal("200000"))
            ), 0.86);

            StructuredResponse response = synthesizer.synthesize(draft, policy);

            assertThat(response.sources()).extracting(SourceCitation::chunkId).containsExactly(4L, 3L, 1L);
            assertThat(response.sources().get(1).quotedText()).isEqualTo(WAITING_CLAUSE);
            assertThat(response.sources()).allSatisfy(source -> {
                assertThat(source.documentId()).isEqualTo(1L);
                assertThat(source.page()).isEqualTo(1);
            });
        }

        @Test
        @DisplayName("A citation outside the retrieval set is an integrity error")
        void shouldRejectForeignCitation() {
            RetrievedChunk stranger = retrieved(99L, "Some other clause is covered.", 0.9);
            EvaluationDraft draft = new EvaluationDraft(Decision.REQUIRES_MORE_INFO, null,
                List.of(pass("procedure-coverage", stranger, "Some other clause is covered.")), 0.5);

            assertThatThrownBy(() -> synthesizer.synthesize(draft, policy))
                .isInstanceOf(CitationIntegrityException.class)
                .hasMessageContaining("99");
        }
    }

    @Nested
    @DisplayName("Rendering")
    class Rendering {

        @Test
        @DisplayName("Approved responses carry the amount and a justification line per rule")
        void shouldRenderApproval() {
            EvaluationDraft draft = new EvaluationDraft(Decision.APPROVED, new BigDecimal("200000"), List.of(
                pass("waiting-period", waiting, WAITING_CLAUSE),
                RuleOutcome.notApplicable("geographic-coverage", Map.of(), "No location was given or restricted.")
            ), 0.88);

            StructuredResponse response = synthesizer.synthesize(draft, policy);

            assertThat(response.decision()).isEqualTo(Decision.APPROVED);
            assertThat(response.amount()).isEqualByComparingTo("200000");
            assertThat(response.confidenceScore()).isEqualTo(0.88);
            assertThat(response.justification())
                .startsWith("Approved")
                .contains("- waiting-period: pass (0.90). waiting-period holds.")
                .contains("- geographic-coverage: not applicable. No location was given or restricted.")
                .endsWith(ResponseSynthesizer.DISCLAIMER);
        }

        @Test
        @DisplayName("Non approved responses never carry an amount and always have a justification")
        void shouldRenderRequiresMoreInfo() {
            EvaluationDraft draft = new EvaluationDraft(Decision.REQUIRES_MORE_INFO, null, List.of(), 0.0);

            StructuredResponse response = synthesizer.synthesize(draft, policy);

            assertThat(response.amount()).isNull();
            assertThat(response.sources()).isEmpty();
            assertThat(response.justification()).isNotBlank();
        }
    }

    @Test
    @DisplayName("Fallback cites the top retrieved chunks with zero confidence")
    void shouldRenderFallback() {
        StructuredResponse response = synthesizer.fallback(policy, "the query timed out.", 2);

        assertThat(response.decision()).isEqualTo(Decision.REQUIRES_MORE_INFO);
        assertThat(response.confidenceScore()).isZero();
        assertThat(response.amount()).isNull();
        assertThat(response.sources()).extracting(SourceCitation::chunkId).containsExactly(1L, 2L);
        assertThat(response.justification()).contains("the query timed out.");
    }
}
