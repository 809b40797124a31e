package com.policyqa.agent.parser;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.policyqa.config.ParserProperties;
import com.policyqa.exception.ModelExtractionException;
import com.policyqa.infra.RateLimiter;
import com.policyqa.model.AttributeSource;
import com.policyqa.model.AttributeValue;
import com.policyqa.model.QueryAttribute;
import dev.langchain4j.model.chat.ChatModel;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Asks the chat model for the slots the patterns could not fill. Confidence is capped below the
 * pattern extractor's, since the model may paraphrase.
 */
@Slf4j
@Component
public class LlmAttributeExtractor implements AttributeExtractor {

    private static final Pattern JSON_OBJECT = Pattern.compile("\\{.*}", Pattern.DOTALL);
    private static final Pattern TENURE = Pattern.compile("(\\d{1,3})\\s*(day|week|month|year)s?", Pattern.CASE_INSENSITIVE);

    private static final String PROMPT_TEMPLATE = """
        Extract the insurance claim details from the query below.
        Answer with a single JSON object and nothing else, using exactly these keys:
        "age" (integer or null), "gender" ("male", "female" or null), "procedure" (short medical procedure name or null),
        "location" (city or region or null), "policy_tenure" (for example "3 months", or null),
        "confidence" (number between 0 and 1, how sure you are overall).
        Do not guess: use null for anything the query does not state.

        Query: %s
        """;

    private final ChatModel chatModel;
    private final RateLimiter chatLimiter;
    private final ObjectMapper objectMapper;
    private final double confidenceCap;

    public LlmAttributeExtractor(
        ChatModel chatModel,
        @Qualifier("chatLimiter") RateLimiter chatLimiter,
        ObjectMapper objectMapper,
        ParserProperties properties
    ) {
        this.chatModel = chatModel;
        this.chatLimiter = chatLimiter;
        this.objectMapper = objectMapper;
        this.confidenceCap = properties.llm().confidenceCap();
    }

    @Override
    public Map<QueryAttribute, AttributeValue> extract(String text) {
        String answer;
        try {
            answer = chatLimiter.execute(1, () -> chatModel.chat(PROMPT_TEMPLATE.formatted(text)));
        } catch (RuntimeException e) {
            throw new ModelExtractionException("Language model extraction failed", e);
        }
        return parseAnswer(answer);
    }

    Map<QueryAttribute, AttributeValue> parseAnswer(String answer) {
        Map<QueryAttribute, AttributeValue> found = new EnumMap<>(QueryAttribute.class);
        if (answer == null || answer.isBlank()) {
            return found;
        }
        Matcher json = JSON_OBJECT.matcher(answer);
        if (!json.find()) {
            log.warn("Model answer contained no JSON object");
            return found;
        }

        JsonNode root;
        try {
            root = objectMapper.readTree(json.group());
        } catch (JsonProcessingException e) {
            log.warn("Model answer was not valid JSON: {}", e.getOriginalMessage());
            return found;
        }

        double confidence = Math.min(confidenceCap, clamp(root.path("confidence").asDouble(confidenceCap)));

        JsonNode age = root.path("age");
        if (age.canConvertToInt() && age.asInt() > 0 && age.asInt() <= 120) {
            found.put(QueryAttribute.AGE, model(String.valueOf(age.asInt()), confidence));
        }
        text(root, "gender").map(g -> g.toLowerCase(Locale.ROOT))
            .filter(g -> g.equals("male") || g.equals("female"))
            .ifPresent(g -> found.put(QueryAttribute.GENDER, model(g, confidence)));
        text(root, "procedure")
            .ifPresent(p -> found.put(QueryAttribute.PROCEDURE, model(p.toLowerCase(Locale.ROOT), confidence)));
        text(root, "location")
            .ifPresent(l -> found.put(QueryAttribute.LOCATION, model(l, confidence)));
        text(root, "policy_tenure").map(TENURE::matcher).filter(Matcher::find)
            .ifPresent(m -> found.put(QueryAttribute.POLICY_TENURE, model(
                PatternAttributeExtractor.toIsoPeriod(Integer.parseInt(m.group(1)), m.group(2).toLowerCase(Locale.ROOT)),
                confidence)));
        return found;
    }

    private static Optional<String> text(JsonNode root, String field) {
        JsonNode node = root.path(field);
        if (!node.isTextual() || node.asText().isBlank()) {
            return Optional.empty();
        }
        return Optional.of(node.asText().trim());
    }

    private static AttributeValue model(String value, double confidence) {
        return new AttributeValue(value, confidence, AttributeSource.MODEL);
    }

    private static double clamp(double value) {
        return Math.max(0.0, Math.min(1.0, value));
    }
}
