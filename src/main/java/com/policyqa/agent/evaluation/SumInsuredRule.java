package com.policyqa.agent.evaluation;

import com.policyqa.agent.ProcedureCatalog;
import com.policyqa.model.ParsedQuery;
import com.policyqa.model.RetrievalResult;
import com.policyqa.model.RuleOutcome;
import lombok.RequiredArgsConstructor;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Finds the payable amount: a limit clause naming the procedure first, then the general sum insured.
 * Handles Indian digit grouping ("2,00,000") and lakh/crore multipliers.
 */
@Order(60)
@Component
@RequiredArgsConstructor
public class SumInsuredRule implements CoverageRule {

    public static final String ID = "sum-insured";

    private static final Pattern CURRENCY_AMOUNT = Pattern.compile(
        "(?:\\b(?:rs\\.?|inr|usd|eur|gbp)|₹|\\$|€|£)\\s*(\\d[\\d,]*(?:\\.\\d{1,2})?)\\s*(lakhs?|lacs?|crores?)?",
        Pattern.CASE_INSENSITIVE);
    private static final Pattern WORD_AMOUNT = Pattern.compile(
        "\\b(\\d[\\d,]*(?:\\.\\d{1,2})?)\\s*(lakhs?|lacs?|crores?|rupees|dollars)\\b", Pattern.CASE_INSENSITIVE);

    private static final List<String> LIMIT_MARKERS = List.of("sum insured", "sum assured", "limit", "maximum",
        "up to", "upto", "payable", "benefit", "cover of", "coverage of", "reimburse");
    private static final List<String> SUM_INSURED_MARKERS = List.of("sum insured", "sum assured");

    private static final double SPECIFIC_CERTAINTY = 0.9;
    private static final double SUM_INSURED_CERTAINTY = 0.85;
    private static final double GENERAL_CERTAINTY = 0.7;

    private final ProcedureCatalog procedureCatalog;

    private record AmountClause(ClauseSentence sentence, BigDecimal amount) {}

    @Override
    public String id() {
        return ID;
    }

    @Override
    public RuleOutcome evaluate(ParsedQuery query, RetrievalResult evidence) {
        Map<String, String> inputs = query.procedure().map(p -> Map.of("procedure", p)).orElse(Map.of());
        List<String> terms = query.procedure().map(procedureCatalog::termsFor).orElse(List.of());

        List<AmountClause> candidates = ClauseSentence.of(evidence).stream()
            .filter(s -> s.containsAny(LIMIT_MARKERS) && !s.isNegative())
            .flatMap(s -> amountIn(s.text()).map(amount -> new AmountClause(s, amount)).stream())
            .toList();

        if (candidates.isEmpty()) {
            return RuleOutcome.unknown(ID, inputs, 0.0, "No sum insured or benefit limit found in the retrieved clauses.");
        }

        Optional<AmountClause> specific = terms.isEmpty() ? Optional.empty() : candidates.stream()
            .filter(c -> c.sentence().mentions(terms))
            .findFirst();
        if (specific.isPresent()) {
            return found(inputs, specific.get(), SPECIFIC_CERTAINTY);
        }

        Optional<AmountClause> sumInsured = candidates.stream()
            .filter(c -> c.sentence().containsAny(SUM_INSURED_MARKERS))
            .findFirst();
        return sumInsured
            .map(clause -> found(inputs, clause, SUM_INSURED_CERTAINTY))
            .orElseGet(() -> found(inputs, candidates.get(0), GENERAL_CERTAINTY));
    }

    private RuleOutcome found(Map<String, String> inputs, AmountClause clause, double certainty) {
        return RuleOutcome.pass(ID, inputs, certainty, clause.sentence().toEvidence(),
                "The applicable limit is " + clause.amount().toPlainString() + ".")
            .withAmount(clause.amount());
    }

    static Optional<BigDecimal> amountIn(String text) {
        Matcher currency = CURRENCY_AMOUNT.matcher(text);
        if (currency.find()) {
            return parse(currency.group(1), currency.group(2));
        }
        Matcher word = WORD_AMOUNT.matcher(text);
        if (word.find()) {
            return parse(word.group(1), word.group(2));
        }
        return Optional.empty();
    }

    private static Optional<BigDecimal> parse(String digits, String unit) {
        String normalized = digits.replace(",", "");
        if (normalized.isEmpty()) {
            return Optional.empty();
        }
        BigDecimal amount = new BigDecimal(normalized);
        if (unit != null) {
            String lower = unit.toLowerCase(Locale.ROOT);
            if (lower.startsWith("lakh") || lower.startsWith("lac")) {
                amount = amount.multiply(BigDecimal.valueOf(100_000));
            } else if (lower.startsWith("crore")) {
                amount = amount.multiply(BigDecimal.valueOf(10_000_000));
            }
        }
        if (amount.signum() <= 0) {
            return Optional.empty();
        }
        BigDecimal normalizedAmount = amount.stripTrailingZeros();
        return Optional.of(normalizedAmount.scale() < 0 ? normalizedAmount.setScale(0) : normalizedAmount);
    }
}
