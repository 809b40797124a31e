package com.policyqa.model;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Locale;

import static org.assertj.core.api.Assertions.assertThat;

class WireValueTest {

    private Locale defaultLocale;

    @BeforeEach
    void switchToTurkish() {
        defaultLocale = Locale.getDefault();
        Locale.setDefault(Locale.forLanguageTag("tr-TR"));
    }

    @AfterEach
    void restoreLocale() {
        Locale.setDefault(defaultLocale);
    }

    @Test
    @DisplayName("Should render wire values independently of the default locale")
    void shouldRenderWireValuesWithoutLocaleSpecificCasing() {
        assertThat(Decision.REQUIRES_MORE_INFO.wireValue()).isEqualTo("requires_more_info");
        assertThat(DocumentStatus.PROCESSING.wireValue()).isEqualTo("processing");
        assertThat(StepStatus.TIMED_OUT.wireValue()).isEqualTo("timed_out");
        assertThat(QueryStage.RETRIEVING.wireValue()).isEqualTo("retrieving");
    }

    @Test
    @DisplayName("Should serialise decisions to the fixed lowercase schema values")
    void shouldSerialiseDecisionAsSchemaValue() throws Exception {
        ObjectMapper mapper = new ObjectMapper();

        assertThat(mapper.writeValueAsString(Decision.REQUIRES_MORE_INFO)).isEqualTo("\"requires_more_info\"");
    }
}
