package com.policyqa.agent.evaluation;

import com.policyqa.agent.ProcedureCatalog;
import com.policyqa.model.ParsedQuery;
import com.policyqa.model.QueryAttribute;
import com.policyqa.model.RetrievalResult;
import com.policyqa.model.RuleOutcome;
import com.policyqa.model.RuleVerdict;
import lombok.RequiredArgsConstructor;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Rejects on an explicit exclusion naming the procedure. Waiting-period wording ("not covered during the
 * first 30 days") is left to {@link WaitingPeriodRule}.
 */
@Order(50)
@Component
@RequiredArgsConstructor
public class ExclusionRule implements CoverageRule {

    public static final String ID = "exclusion-match";

    private static final Pattern TEMPORAL = Pattern.compile(
        "waiting\\s+period|(?:first|initial)\\s+\\d+\\s*(?:day|month|year)s?", Pattern.CASE_INSENSITIVE);

    private static final double EXCLUSION_CERTAINTY = 0.95;
    private static final double NO_EXCLUSION_CONFIDENCE = 0.9;

    private final ProcedureCatalog procedureCatalog;

    @Override
    public String id() {
        return ID;
    }

    @Override
    public RuleOutcome evaluate(ParsedQuery query, RetrievalResult evidence) {
        if (query.procedure().isEmpty()) {
            return RuleOutcome.notApplicable(ID, Map.of(), "No procedure to check against exclusions.");
        }

        String procedure = query.procedure().get();
        Map<String, String> inputs = Map.of("procedure", procedure);
        if (evidence.isEmpty()) {
            return RuleOutcome.unknown(ID, inputs, 0.0, "No policy clauses were retrieved to check exclusions.");
        }

        List<String> terms = procedureCatalog.specificTermsFor(procedure);

        return ClauseSentence.of(evidence).stream()
            .filter(ClauseSentence::isNegative)
            .filter(s -> !TEMPORAL.matcher(s.text()).find())
            .filter(s -> s.mentions(terms))
            .findFirst()
            .map(exclusion -> RuleOutcome.fail(ID, inputs,
                Math.min(EXCLUSION_CERTAINTY, query.confidenceOf(QueryAttribute.PROCEDURE)),
                exclusion.toEvidence(),
                "The policy explicitly excludes " + procedure + "."))
            .orElseGet(() -> new RuleOutcome(ID, inputs, RuleVerdict.PASS, NO_EXCLUSION_CONFIDENCE, List.of(),
                "No retrieved exclusion applies to " + procedure + ".", null));
    }
}
