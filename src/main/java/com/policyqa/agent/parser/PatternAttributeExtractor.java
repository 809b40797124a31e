package com.policyqa.agent.parser;

import com.policyqa.agent.ProcedureCatalog;
import com.policyqa.config.ParserProperties;
import com.policyqa.model.AttributeValue;
import com.policyqa.model.QueryAttribute;
import org.springframework.stereotype.Component;

import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Deterministic extraction of age, gender, procedure, location and policy tenure from shorthand
 * such as "46M, knee surgery in Pune, 3-month-old policy".
 */
@Component
public class PatternAttributeExtractor implements AttributeExtractor {

    private static final int MAX_AGE = 120;

    private record Rule(Pattern pattern, double confidence) {}

    private static final List<Rule> AGE_RULES = List.of(
        new Rule(Pattern.compile("\\b(\\d{1,3})\\s*[- ]?\\s*(?:years?|yrs?|y)\\s*[- ]?\\s*old\\b", Pattern.CASE_INSENSITIVE), 0.95),
        new Rule(Pattern.compile("\\b(?:aged?|age\\s*:)\\s*(\\d{1,3})\\b", Pattern.CASE_INSENSITIVE), 0.9),
        new Rule(Pattern.compile("\\b(\\d{1,3})\\s*(?:yo|y/o)\\b", Pattern.CASE_INSENSITIVE), 0.85),
        new Rule(Pattern.compile("\\b(\\d{1,3})\\s*[- ]?\\s*(?:male|female)\\b", Pattern.CASE_INSENSITIVE), 0.85),
        new Rule(Pattern.compile("\\b(\\d{1,3})\\s*([MF])\\b"), 0.8)
    );

    private static final Pattern GENDER_WORD = Pattern.compile("\\b(male|female|man|woman|boy|girl)\\b", Pattern.CASE_INSENSITIVE);
    private static final Pattern GENDER_SHORT = Pattern.compile("\\b\\d{1,3}\\s*([MF])\\b");

    private static final List<Rule> TENURE_RULES = List.of(
        new Rule(Pattern.compile("\\b(\\d{1,3})\\s*[- ]?\\s*(day|week|month|year)s?\\s*[- ]?\\s*(?:old\\s+)?(?:insurance\\s+|health\\s+)?polic(?:y|ies)\\b",
            Pattern.CASE_INSENSITIVE), 0.95),
        new Rule(Pattern.compile("\\bpolicy\\s+(?:of|for|since|held\\s+for|taken\\s+)?\\s*(\\d{1,3})\\s*(day|week|month|year)s?\\b",
            Pattern.CASE_INSENSITIVE), 0.85),
        new Rule(Pattern.compile("\\b(?:insured|covered)\\s+for\\s+(\\d{1,3})\\s*(day|week|month|year)s?\\b",
            Pattern.CASE_INSENSITIVE), 0.75)
    );

    private static final Pattern LOCATION_FALLBACK = Pattern.compile("\\b(?:in|at|from)\\s+([A-Z][a-zA-Z]+(?:\\s+[A-Z][a-zA-Z]+)?)");
    private static final Set<String> NOT_LOCATIONS = Set.of("i", "my", "the", "a", "an", "it", "policy", "surgery", "hospital");

    private final ProcedureCatalog procedureCatalog;
    private final List<String> knownLocations;

    public PatternAttributeExtractor(ProcedureCatalog procedureCatalog, ParserProperties properties) {
        this.procedureCatalog = procedureCatalog;
        this.knownLocations = properties.knownLocations().stream()
            .sorted(Comparator.comparingInt(String::length).reversed())
            .toList();
    }

    @Override
    public Map<QueryAttribute, AttributeValue> extract(String text) {
        Map<QueryAttribute, AttributeValue> found = new EnumMap<>(QueryAttribute.class);
        if (text == null || text.isBlank()) {
            return found;
        }
        age(text).ifPresent(v -> found.put(QueryAttribute.AGE, v));
        gender(text).ifPresent(v -> found.put(QueryAttribute.GENDER, v));
        procedure(text).ifPresent(v -> found.put(QueryAttribute.PROCEDURE, v));
        location(text).ifPresent(v -> found.put(QueryAttribute.LOCATION, v));
        tenure(text).ifPresent(v -> found.put(QueryAttribute.POLICY_TENURE, v));
        return found;
    }

    private Optional<AttributeValue> age(String text) {
        for (Rule rule : AGE_RULES) {
            Matcher matcher = rule.pattern().matcher(text);
            while (matcher.find()) {
                int age = Integer.parseInt(matcher.group(1));
                if (age > 0 && age <= MAX_AGE) {
                    return Optional.of(AttributeValue.pattern(String.valueOf(age), rule.confidence()));
                }
            }
        }
        return Optional.empty();
    }

    private Optional<AttributeValue> gender(String text) {
        Matcher word = GENDER_WORD.matcher(text);
        if (word.find()) {
            String value = switch (word.group(1).toLowerCase(Locale.ROOT)) {
                case "male", "man", "boy" -> "male";
                default -> "female";
            };
            return Optional.of(AttributeValue.pattern(value, 0.9));
        }
        Matcher shorthand = GENDER_SHORT.matcher(text);
        if (shorthand.find()) {
            return Optional.of(AttributeValue.pattern("M".equals(shorthand.group(1)) ? "male" : "female", 0.75));
        }
        return Optional.empty();
    }

    private Optional<AttributeValue> procedure(String text) {
        return procedureCatalog.find(text)
            .map(match -> AttributeValue.pattern(match.name(), match.generic() ? 0.7 : 0.95));
    }

    private Optional<AttributeValue> location(String text) {
        String lower = text.toLowerCase(Locale.ROOT);
        for (String location : knownLocations) {
            if (Pattern.compile("\\b" + Pattern.quote(location.toLowerCase(Locale.ROOT)) + "\\b").matcher(lower).find()) {
                return Optional.of(AttributeValue.pattern(location, 0.9));
            }
        }
        Matcher matcher = LOCATION_FALLBACK.matcher(text);
        while (matcher.find()) {
            String candidate = matcher.group(1);
            if (!NOT_LOCATIONS.contains(candidate.toLowerCase(Locale.ROOT))
                && procedureCatalog.find(candidate).isEmpty()) {
                return Optional.of(AttributeValue.pattern(candidate, 0.6));
            }
        }
        return Optional.empty();
    }

    private Optional<AttributeValue> tenure(String text) {
        for (Rule rule : TENURE_RULES) {
            Matcher matcher = rule.pattern().matcher(text);
            if (matcher.find()) {
                int amount = Integer.parseInt(matcher.group(1));
                String unit = matcher.group(2).toLowerCase(Locale.ROOT);
                return Optional.of(AttributeValue.pattern(toIsoPeriod(amount, unit), rule.confidence()));
            }
        }
        return Optional.empty();
    }

    static String toIsoPeriod(int amount, String unit) {
        return switch (unit) {
            case "day" -> "P" + amount + "D";
            case "week" -> "P" + (amount * 7) + "D";
            case "month" -> "P" + amount + "M";
            case "year" -> "P" + amount + "Y";
            default -> throw new IllegalArgumentException("Unknown tenure unit: " + unit);
        };
    }
}
