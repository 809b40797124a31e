package com.policyqa.agent.parser;

import com.policyqa.config.ParserProperties;
import com.policyqa.exception.InvalidQueryException;
import com.policyqa.model.AttributeSource;
import com.policyqa.model.AttributeValue;
import com.policyqa.model.ParsedQuery;
import com.policyqa.model.QueryAttribute;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.Map;

/**
 * Turns free text into a {@link ParsedQuery}. Only empty or oversized input is rejected; anything else
 * parses, possibly with no attributes at all.
 * <p>
 * Sources are consulted in order: patterns, then the language model (when enabled) for the slots still
 * empty, then the previous query of the same session. Values under the confidence threshold are dropped.
 */
@Slf4j
@Component
public class QueryParserAgent {

    private final PatternAttributeExtractor patternExtractor;
    private final LlmAttributeExtractor llmExtractor;
    private final ParserProperties properties;

    public QueryParserAgent(
        PatternAttributeExtractor patternExtractor,
        LlmAttributeExtractor llmExtractor,
        ParserProperties properties
    ) {
        this.patternExtractor = patternExtractor;
        this.llmExtractor = llmExtractor;
        this.properties = properties;
    }

    public void validate(String rawText) {
        if (rawText == null || rawText.isBlank()) {
            throw new InvalidQueryException("Query cannot be empty");
        }
        if (rawText.length() > properties.maxQueryLength()) {
            throw new InvalidQueryException("Query exceeds " + properties.maxQueryLength() + " characters");
        }
    }

    public ParsedQuery parse(String rawText) {
        return parse(rawText, Map.of());
    }

    public ParsedQuery parse(String rawText, Map<QueryAttribute, AttributeValue> sessionAttributes) {
        validate(rawText);

        Map<QueryAttribute, AttributeValue> candidates = new EnumMap<>(QueryAttribute.class);
        candidates.putAll(patternExtractor.extract(rawText));

        if (properties.llm().enabled() && !candidates.keySet().containsAll(QueryAttribute.CORE)) {
            llmExtractor.extract(rawText).forEach(candidates::putIfAbsent);
        }

        if (sessionAttributes != null) {
            sessionAttributes.forEach((name, value) -> candidates.computeIfAbsent(name,
                k -> value.withConfidence(value.confidence() * properties.sessionDecay(), AttributeSource.SESSION)));
        }

        Map<QueryAttribute, AttributeValue> accepted = new EnumMap<>(QueryAttribute.class);
        candidates.forEach((name, value) -> {
            if (value.confidence() >= properties.attributeThreshold()) {
                accepted.put(name, value);
            } else {
                log.debug("Dropping {}='{}' below threshold ({})", name, value.value(), value.confidence());
            }
        });

        double overall = QueryAttribute.CORE.stream()
            .mapToDouble(name -> accepted.containsKey(name) ? accepted.get(name).confidence() : 0.0)
            .average()
            .orElse(0.0);

        log.debug("Parsed query: attributes={}, confidence={}", accepted.keySet(), overall);
        return new ParsedQuery(rawText, accepted, overall);
    }
}
