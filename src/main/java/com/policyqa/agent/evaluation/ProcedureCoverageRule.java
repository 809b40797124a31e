package com.policyqa.agent.evaluation;

import com.policyqa.agent.ProcedureCatalog;
import com.policyqa.model.ParsedQuery;
import com.policyqa.model.QueryAttribute;
import com.policyqa.model.RetrievalResult;
import com.policyqa.model.RuleOutcome;
import lombok.RequiredArgsConstructor;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.Optional;

@Order(40)
@Component
@RequiredArgsConstructor
public class ProcedureCoverageRule implements CoverageRule {

    public static final String ID = "procedure-coverage";

    private static final List<String> COVERAGE_MARKERS = List.of("covered", "cover", "payable", "eligible",
        "included", "reimburs", "benefit", "indemnif");

    private static final double COVERED_CERTAINTY = 0.9;
    private static final double MENTIONED_CONFIDENCE = 0.3;
    private static final double ABSENT_CONFIDENCE = 0.1;

    private final ProcedureCatalog procedureCatalog;

    @Override
    public String id() {
        return ID;
    }

    @Override
    public RuleOutcome evaluate(ParsedQuery query, RetrievalResult evidence) {
        if (query.procedure().isEmpty()) {
            return RuleOutcome.unknown(ID, Map.of(), 0.0, "The query does not name a procedure.");
        }

        String procedure = query.procedure().get();
        Map<String, String> inputs = Map.of("procedure", procedure);
        if (evidence.isEmpty()) {
            return RuleOutcome.unknown(ID, inputs, 0.0, "No policy clauses were retrieved.");
        }

        List<String> terms = procedureCatalog.termsFor(procedure);
        List<ClauseSentence> sentences = ClauseSentence.of(evidence);

        Optional<ClauseSentence> coverage = sentences.stream()
            .filter(s -> s.mentions(terms) && s.containsAny(COVERAGE_MARKERS) && !s.isNegative())
            .findFirst();
        if (coverage.isPresent()) {
            double confidence = Math.min(COVERED_CERTAINTY, query.confidenceOf(QueryAttribute.PROCEDURE));
            return RuleOutcome.pass(ID, inputs, confidence, coverage.get().toEvidence(),
                "The policy covers " + procedure + ".");
        }

        return sentences.stream()
            .filter(s -> s.mentions(terms) && !s.isNegative())
            .findFirst()
            .map(mention -> RuleOutcome.unknown(ID, inputs, MENTIONED_CONFIDENCE,
                    "The policy mentions " + procedure + " without stating that it is covered.")
                .withEvidence(mention.toEvidence()))
            .orElseGet(() -> RuleOutcome.unknown(ID, inputs, ABSENT_CONFIDENCE,
                "No retrieved clause states coverage for " + procedure + "."));
    }
}
