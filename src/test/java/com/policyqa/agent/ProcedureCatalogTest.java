package com.policyqa.agent;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class ProcedureCatalogTest {

    private final ProcedureCatalog catalog = new ProcedureCatalog();

    @Nested
    @DisplayName("Finding procedures")
    class Find {

        @Test
        @DisplayName("Should prefer the longest named procedure")
        void shouldFindSpecificProcedure() {
            assertThat(catalog.find("46M, knee surgery in Pune"))
                .contains(new ProcedureCatalog.ProcedureMatch("knee surgery", false));
            assertThat(catalog.find("Knee Replacement after a fall"))
                .contains(new ProcedureCatalog.ProcedureMatch("knee replacement", false));
        }

        @Test
        @DisplayName("Should flag generic procedures")
        void shouldFlagGenericProcedure() {
            assertThat(catalog.find("needs surgery next week"))
                .contains(new ProcedureCatalog.ProcedureMatch("surgery", true));
        }

        @Test
        @DisplayName("Should find nothing in unrelated or empty text")
        void shouldFindNothing() {
            assertThat(catalog.find("persistent headache")).isEmpty();
            assertThat(catalog.find("  ")).isEmpty();
            assertThat(catalog.find(null)).isEmpty();
        }
    }

    @Nested
    @DisplayName("Policy vocabulary")
    class Vocabulary {

        @Test
        @DisplayName("Should expand a procedure into the terms policies use")
        void shouldExpandTerms() {
            assertThat(catalog.termsFor("Knee Surgery"))
                .startsWith("knee surgery", "knee", "surgery")
                .contains("orthopedic", "joint")
                .doesNotHaveDuplicates();
        }

        @Test
        @DisplayName("Should drop broad terms from the specific vocabulary")
        void shouldKeepOnlySpecificTerms() {
            assertThat(catalog.specificTermsFor("knee surgery"))
                .containsExactly("knee surgery", "knee", "orthopedic", "orthopaedic", "joint");
            assertThat(catalog.specificTermsFor("surgery")).containsExactly("surgery");
            assertThat(catalog.specificTermsFor("")).isEmpty();
        }

        @Test
        @DisplayName("Should match terms as word prefixes only")
        void shouldMatchWordPrefixes() {
            assertThat(ProcedureCatalog.mentionsAny("Ophthalmic procedures are covered", List.of("ophthalm"))).isTrue();
            assertThat(ProcedureCatalog.firstMention("Orthopaedic and joint care", List.of("joint", "orthopaedic")))
                .contains("joint");
            assertThat(ProcedureCatalog.mentionsAny("tenure of the policy", List.of("renal"))).isFalse();
            assertThat(ProcedureCatalog.mentionsAny(null, List.of("knee"))).isFalse();
        }
    }
}
