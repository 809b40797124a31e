package com.policyqa.agent.evaluation;

import com.policyqa.model.ParsedQuery;
import com.policyqa.model.QueryAttribute;
import com.policyqa.model.RetrievalResult;
import com.policyqa.model.RuleOutcome;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.Optional;

@Order(20)
@Component
public class GeographicCoverageRule implements CoverageRule {

    public static final String ID = "geographic-coverage";

    private static final List<String> GEOGRAPHIC_MARKERS = List.of("zone", "territor", "geograph", "city", "cities",
        "location", "region");
    private static final List<String> POSITIVE_MARKERS = List.of("covered", "zone", "eligible", "included",
        "network", "available");

    private static final double EXPLICIT_CERTAINTY = 0.9;
    private static final double MENTION_CERTAINTY = 0.55;
    private static final double UNLISTED_CONFIDENCE = 0.3;

    @Override
    public String id() {
        return ID;
    }

    @Override
    public RuleOutcome evaluate(ParsedQuery query, RetrievalResult evidence) {
        List<ClauseSentence> sentences = ClauseSentence.of(evidence);
        Optional<ClauseSentence> geographicClause = sentences.stream()
            .filter(s -> s.containsAny(GEOGRAPHIC_MARKERS))
            .findFirst();

        if (query.location().isEmpty()) {
            return geographicClause
                .map(clause -> RuleOutcome.unknown(ID, Map.of(), 0.0,
                    "The policy restricts coverage by location but the query does not state one.")
                    .withEvidence(clause.toEvidence()))
                .orElseGet(() -> RuleOutcome.notApplicable(ID, Map.of(), "No location was given or restricted."));
        }

        String location = query.location().get();
        Map<String, String> inputs = Map.of("location", location);
        double attributeConfidence = query.confidenceOf(QueryAttribute.LOCATION);
        List<String> locationTerm = List.of(location);

        Optional<ClauseSentence> mention = sentences.stream().filter(s -> s.mentions(locationTerm)).findFirst();
        if (mention.isPresent()) {
            ClauseSentence clause = mention.get();
            if (clause.isNegative()) {
                return RuleOutcome.fail(ID, inputs, Math.min(EXPLICIT_CERTAINTY, attributeConfidence), clause.toEvidence(),
                    location + " is excluded from the covered area.");
            }
            if (clause.containsAny(POSITIVE_MARKERS)) {
                return RuleOutcome.pass(ID, inputs, Math.min(EXPLICIT_CERTAINTY, attributeConfidence), clause.toEvidence(),
                    location + " is within the covered area.");
            }
            return RuleOutcome.pass(ID, inputs, Math.min(MENTION_CERTAINTY, attributeConfidence), clause.toEvidence(),
                location + " is mentioned by the policy without an explicit coverage statement.");
        }

        return geographicClause
            .map(clause -> RuleOutcome.unknown(ID, inputs, UNLISTED_CONFIDENCE,
                location + " is not listed among the locations the policy names.")
                .withEvidence(clause.toEvidence()))
            .orElseGet(() -> RuleOutcome.notApplicable(ID, inputs, "The retrieved clauses do not restrict location."));
    }
}
