package com.policyqa.agent.evaluation;

import com.policyqa.model.ParsedQuery;
import com.policyqa.model.QueryAttribute;
import com.policyqa.model.RetrievalResult;
import com.policyqa.model.RuleOutcome;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

@Order(10)
@Component
public class AgeEligibilityRule implements CoverageRule {

    public static final String ID = "age-eligibility";

    private static final Pattern RANGE = Pattern.compile(
        "\\b(?:ages?|aged|age\\s+group|between)\\s*(?:of\\s*)?(\\d{1,3})\\s*(?:-|–|—|to|and)\\s*(\\d{1,3})\\b",
        Pattern.CASE_INSENSITIVE);
    private static final Pattern YEARS_RANGE = Pattern.compile(
        "\\b(\\d{1,3})\\s*(?:-|–|—|to)\\s*(\\d{1,3})\\s*years\\b", Pattern.CASE_INSENSITIVE);
    private static final Pattern MINIMUM = Pattern.compile(
        "\\b(?:minimum|min\\.?)\\s+(?:entry\\s+)?age\\s*(?:of|is|:)?\\s*(\\d{1,3})\\b", Pattern.CASE_INSENSITIVE);
    private static final Pattern MAXIMUM = Pattern.compile(
        "\\b(?:maximum|max\\.?)\\s+(?:entry\\s+)?age\\s*(?:of|is|:)?\\s*(\\d{1,3})\\b", Pattern.CASE_INSENSITIVE);
    private static final List<String> AGE_CONTEXT = List.of("age", "eligib", "entry");

    private static final double RANGE_CERTAINTY = 0.95;
    private static final double BOUND_CERTAINTY = 0.9;

    @Override
    public String id() {
        return ID;
    }

    @Override
    public RuleOutcome evaluate(ParsedQuery query, RetrievalResult evidence) {
        Bounds bounds = findBounds(ClauseSentence.of(evidence));
        if (bounds == null) {
            return RuleOutcome.notApplicable(ID, Map.of(), "No age limits found in the retrieved clauses.");
        }

        if (query.age().isEmpty()) {
            return RuleOutcome.unknown(ID, Map.of(), 0.0,
                "The policy limits eligibility by age (" + bounds.describe() + ") but the query does not state an age.")
                .withEvidence(bounds.clause().toEvidence());
        }

        int age = query.age().get();
        Map<String, String> inputs = Map.of("age", String.valueOf(age));
        double confidence = Math.min(bounds.certainty(), query.confidenceOf(QueryAttribute.AGE));

        if (bounds.admits(age)) {
            return RuleOutcome.pass(ID, inputs, confidence, bounds.clause().toEvidence(),
                "Age " + age + " is within the eligible range " + bounds.describe() + ".");
        }
        return RuleOutcome.fail(ID, inputs, confidence, bounds.clause().toEvidence(),
            "Age " + age + " is outside the eligible range " + bounds.describe() + ".");
    }

    private Bounds findBounds(List<ClauseSentence> sentences) {
        for (ClauseSentence sentence : sentences) {
            Matcher range = RANGE.matcher(sentence.text());
            if (range.find()) {
                return Bounds.of(range, sentence, RANGE_CERTAINTY);
            }
            Matcher years = YEARS_RANGE.matcher(sentence.text());
            if (years.find() && sentence.containsAny(AGE_CONTEXT)) {
                return Bounds.of(years, sentence, RANGE_CERTAINTY);
            }
        }

        Integer min = null;
        Integer max = null;
        ClauseSentence clause = null;
        for (ClauseSentence sentence : sentences) {
            Matcher minimum = MINIMUM.matcher(sentence.text());
            if (min == null && minimum.find()) {
                min = Integer.parseInt(minimum.group(1));
                clause = clause == null ? sentence : clause;
            }
            Matcher maximum = MAXIMUM.matcher(sentence.text());
            if (max == null && maximum.find()) {
                max = Integer.parseInt(maximum.group(1));
                clause = clause == null ? sentence : clause;
            }
        }
        return clause == null ? null : new Bounds(min, max, clause, BOUND_CERTAINTY);
    }

    private record Bounds(Integer min, Integer max, ClauseSentence clause, double certainty) {

        static Bounds of(Matcher matcher, ClauseSentence sentence, double certainty) {
            int a = Integer.parseInt(matcher.group(1));
            int b = Integer.parseInt(matcher.group(2));
            return new Bounds(Math.min(a, b), Math.max(a, b), sentence, certainty);
        }

        boolean admits(int age) {
            return (min == null || age >= min) && (max == null || age <= max);
        }

        String describe() {
            return (min == null ? "any" : min.toString()) + "-" + (max == null ? "any" : max.toString());
        }
    }
}
