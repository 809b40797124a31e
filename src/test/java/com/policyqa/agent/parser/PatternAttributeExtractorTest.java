package com.policyqa.agent.parser;

import com.policyqa.agent.ProcedureCatalog;
import com.policyqa.config.ParserProperties;
import com.policyqa.model.AttributeSource;
import com.policyqa.model.AttributeValue;
import com.policyqa.model.QueryAttribute;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PatternAttributeExtractorTest {

    private final ParserProperties properties = new ParserProperties(
        2000, 0.5, 0.8, List.of("Pune", "Mumbai", "Delhi", "New Delhi"), new ParserProperties.Llm(false, 0.7));

    private final PatternAttributeExtractor extractor = new PatternAttributeExtractor(new ProcedureCatalog(), properties);

    @Test
    @DisplayName("Should extract every slot from terse claim shorthand")
    void shouldExtractShorthand() {
        Map<QueryAttribute, AttributeValue> found = extractor.extract("46M, knee surgery in Pune, 3-month-old policy");

        assertThat(found.get(QueryAttribute.AGE).value()).isEqualTo("46");
        assertThat(found.get(QueryAttribute.AGE).confidence()).isEqualTo(0.8);
        assertThat(found.get(QueryAttribute.GENDER).value()).isEqualTo("male");
        assertThat(found.get(QueryAttribute.PROCEDURE).value()).isEqualTo("knee surgery");
        assertThat(found.get(QueryAttribute.PROCEDURE).confidence()).isEqualTo(0.95);
        assertThat(found.get(QueryAttribute.LOCATION).value()).isEqualTo("Pune");
        assertThat(found.get(QueryAttribute.POLICY_TENURE).value()).isEqualTo("P3M");
        assertThat(found.values()).extracting(AttributeValue::source).containsOnly(AttributeSource.PATTERN);
    }

    @Test
    @DisplayName("Should extract attributes written out in full sentences")
    void shouldExtractLongForm() {
        Map<QueryAttribute, AttributeValue> found = extractor.extract(
            "46-year-old female needs cataract surgery in Mumbai, policy held for 2 years");

        assertThat(found.get(QueryAttribute.AGE).value()).isEqualTo("46");
        assertThat(found.get(QueryAttribute.AGE).confidence()).isEqualTo(0.95);
        assertThat(found.get(QueryAttribute.GENDER).value()).isEqualTo("female");
        assertThat(found.get(QueryAttribute.PROCEDURE).value()).isEqualTo("cataract surgery");
        assertThat(found.get(QueryAttribute.LOCATION).value()).isEqualTo("Mumbai");
        assertThat(found.get(QueryAttribute.POLICY_TENURE).value()).isEqualTo("P2Y");
        assertThat(found.get(QueryAttribute.POLICY_TENURE).confidence()).isEqualTo(0.85);
    }

    @Test
    @DisplayName("Should return nothing for a question without claim details")
    void shouldReturnEmptyForGeneralQuestion() {
        assertThat(extractor.extract("what does my policy cover?")).isEmpty();
        assertThat(extractor.extract("   ")).isEmpty();
    }

    @Nested
    @DisplayName("Procedure and location")
    class ProcedureAndLocation {

        @Test
        @DisplayName("Generic procedures are extracted with lower confidence")
        void shouldLowerConfidenceForGenericProcedure() {
            AttributeValue procedure = extractor.extract("need surgery in Delhi").get(QueryAttribute.PROCEDURE);

            assertThat(procedure.value()).isEqualTo("surgery");
            assertThat(procedure.confidence()).isEqualTo(0.7);
        }

        @Test
        @DisplayName("Longest known location wins")
        void shouldPreferLongestLocation() {
            assertThat(extractor.extract("dialysis in New Delhi").get(QueryAttribute.LOCATION).value())
                .isEqualTo("New Delhi");
        }

        @Test
        @DisplayName("Unknown capitalised place after a preposition is a weak location")
        void shouldFallBackToPrepositionPhrase() {
            AttributeValue location = extractor.extract("knee surgery at Nagpur").get(QueryAttribute.LOCATION);

            assertThat(location.value()).isEqualTo("Nagpur");
            assertThat(location.confidence()).isEqualTo(0.6);
        }
    }

    @Nested
    @DisplayName("Age and tenure")
    class AgeAndTenure {

        @Test
        @DisplayName("Implausible ages are ignored")
        void shouldIgnoreImplausibleAge() {
            assertThat(extractor.extract("age 150, dialysis")).doesNotContainKey(QueryAttribute.AGE);
        }

        @Test
        @DisplayName("Weeks are converted to days")
        void shouldConvertWeeksToDays() {
            assertThat(extractor.extract("2 week old policy").get(QueryAttribute.POLICY_TENURE).value())
                .isEqualTo("P14D");
        }

        @Test
        @DisplayName("ISO period conversion rejects unknown units")
        void shouldRejectUnknownUnit() {
            assertThat(PatternAttributeExtractor.toIsoPeriod(3, "month")).isEqualTo("P3M");
            assertThatThrownBy(() -> PatternAttributeExtractor.toIsoPeriod(3, "decade"))
                .isInstanceOf(IllegalArgumentException.class);
        }
    }
}
