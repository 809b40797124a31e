package com.policyqa.agent.evaluation;

import com.policyqa.agent.ProcedureCatalog;
import com.policyqa.model.ParsedQuery;
import com.policyqa.model.QueryAttribute;
import com.policyqa.model.RetrievalResult;
import com.policyqa.model.RuleOutcome;
import lombok.RequiredArgsConstructor;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Compares policy tenure with the waiting period. A clause naming the procedure wins over a general one.
 */
@Order(30)
@Component
@RequiredArgsConstructor
public class WaitingPeriodRule implements CoverageRule {

    public static final String ID = "waiting-period";

    private static final List<Pattern> WAITING_PATTERNS = List.of(
        Pattern.compile("\\b(\\d{1,4})\\s*[- ]?\\s*(day|month|year)s?\\s*[- ]?\\s*(?:initial\\s+)?waiting\\s+period",
            Pattern.CASE_INSENSITIVE),
        Pattern.compile("\\bwaiting\\s+period\\s+(?:of\\s+)?(\\d{1,4})\\s*[- ]?\\s*(day|month|year)s?",
            Pattern.CASE_INSENSITIVE),
        Pattern.compile("\\b(?:after|within)\\s+(?:the\\s+first\\s+)?(\\d{1,4})\\s*(day|month|year)s?\\s+(?:of|from)\\s+(?:the\\s+)?(?:policy|inception|commencement)",
            Pattern.CASE_INSENSITIVE)
    );

    private static final double SPECIFIC_CERTAINTY = 0.9;
    private static final double GENERAL_CERTAINTY = 0.8;

    private final ProcedureCatalog procedureCatalog;

    private record WaitingClause(ClauseSentence sentence, int days, boolean specific) {}

    @Override
    public String id() {
        return ID;
    }

    @Override
    public RuleOutcome evaluate(ParsedQuery query, RetrievalResult evidence) {
        List<String> procedureTerms = query.procedure().map(procedureCatalog::termsFor).orElse(List.of());
        List<WaitingClause> clauses = findClauses(ClauseSentence.of(evidence), procedureTerms);
        if (clauses.isEmpty()) {
            return RuleOutcome.notApplicable(ID, Map.of(), "No waiting period found in the retrieved clauses.");
        }

        WaitingClause clause = clauses.stream().filter(WaitingClause::specific).findFirst().orElse(clauses.get(0));

        if (query.tenureDays().isEmpty()) {
            return RuleOutcome.unknown(ID, Map.of(), 0.0,
                    "A waiting period of " + clause.days() + " days applies but the policy tenure is not stated.")
                .withEvidence(clause.sentence().toEvidence());
        }

        int tenureDays = query.tenureDays().get();
        Map<String, String> inputs = new LinkedHashMap<>();
        inputs.put("policy_tenure_days", String.valueOf(tenureDays));
        query.procedure().ifPresent(procedure -> inputs.put("procedure", procedure));

        double certainty = clause.specific() ? SPECIFIC_CERTAINTY : GENERAL_CERTAINTY;
        double confidence = Math.min(certainty, query.confidenceOf(QueryAttribute.POLICY_TENURE));

        if (tenureDays >= clause.days()) {
            return RuleOutcome.pass(ID, inputs, confidence, clause.sentence().toEvidence(),
                "Policy tenure of " + tenureDays + " days satisfies the " + clause.days() + "-day waiting period.");
        }
        return RuleOutcome.fail(ID, inputs, confidence, clause.sentence().toEvidence(),
            "Policy tenure of " + tenureDays + " days is shorter than the " + clause.days() + "-day waiting period.");
    }

    private List<WaitingClause> findClauses(List<ClauseSentence> sentences, List<String> procedureTerms) {
        List<WaitingClause> clauses = new ArrayList<>();
        for (ClauseSentence sentence : sentences) {
            for (Pattern pattern : WAITING_PATTERNS) {
                Matcher matcher = pattern.matcher(sentence.text());
                if (matcher.find()) {
                    int days = toDays(Integer.parseInt(matcher.group(1)), matcher.group(2));
                    boolean specific = !procedureTerms.isEmpty() && sentence.mentions(procedureTerms);
                    clauses.add(new WaitingClause(sentence, days, specific));
                    break;
                }
            }
        }
        return clauses;
    }

    private static int toDays(int amount, String unit) {
        return switch (unit.toLowerCase(Locale.ROOT)) {
            case "year" -> amount * 365;
            case "month" -> amount * 30;
            default -> amount;
        };
    }
}
