package com.policyqa.model;

import java.time.Period;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;

/**
 * Structured view of a free-text query. Attributes that could not be recovered with enough
 * confidence are absent from the map.
 */
public record ParsedQuery(String rawText, Map<QueryAttribute, AttributeValue> attributes, double confidence) {

    private static final int DAYS_PER_MONTH = 30;
    private static final int DAYS_PER_YEAR = 365;

    public ParsedQuery {
        attributes = attributes == null || attributes.isEmpty()
            ? Collections.emptyMap()
            : Collections.unmodifiableMap(new EnumMap<>(attributes));
    }

    public Optional<AttributeValue> attribute(QueryAttribute name) {
        return Optional.ofNullable(attributes.get(name));
    }

    public boolean has(QueryAttribute name) {
        return attributes.containsKey(name);
    }

    public double confidenceOf(QueryAttribute name) {
        return attribute(name).map(AttributeValue::confidence).orElse(0.0);
    }

    public Optional<Integer> age() {
        return attribute(QueryAttribute.AGE).map(v -> Integer.parseInt(v.value()));
    }

    public Optional<String> procedure() {
        return attribute(QueryAttribute.PROCEDURE).map(AttributeValue::value);
    }

    public Optional<String> location() {
        return attribute(QueryAttribute.LOCATION).map(AttributeValue::value);
    }

    /**
     * Policy tenure in days, months counted as 30 days and years as 365.
     */
    public Optional<Integer> tenureDays() {
        return attribute(QueryAttribute.POLICY_TENURE)
            .map(v -> toDays(Period.parse(v.value())));
    }

    public static int toDays(Period period) {
        return period.getYears() * DAYS_PER_YEAR + period.getMonths() * DAYS_PER_MONTH + period.getDays();
    }
}
