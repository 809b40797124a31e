package com.policyqa.agent;

import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Known medical procedures and the policy vocabulary that refers to them
 * ("knee surgery" is covered by clauses about "orthopedic" or "surgical" procedures).
 */
@Component
public class ProcedureCatalog {

    private static final Map<String, List<String>> RELATED_TERMS = new LinkedHashMap<>();
    private static final Set<String> GENERIC = Set.of("surgery", "treatment", "hospitalization", "operation");
    private static final Set<String> BROAD_TERMS = Set.of("surgery", "surgical", "operation", "treatment",
        "hospitalization", "hospitalisation", "in-patient", "inpatient");

    static {
        RELATED_TERMS.put("knee surgery", List.of("orthopedic", "orthopaedic", "surgical", "surgery", "knee", "joint"));
        RELATED_TERMS.put("knee replacement", List.of("orthopedic", "orthopaedic", "joint replacement", "knee", "surgical"));
        RELATED_TERMS.put("hip replacement", List.of("orthopedic", "orthopaedic", "joint replacement", "hip", "surgical"));
        RELATED_TERMS.put("heart surgery", List.of("cardiac", "cardiovascular", "heart", "surgical", "surgery"));
        RELATED_TERMS.put("bypass surgery", List.of("cardiac", "bypass", "heart", "surgical", "surgery"));
        RELATED_TERMS.put("cataract surgery", List.of("cataract", "eye", "ophthalm", "surgical", "surgery"));
        RELATED_TERMS.put("appendectomy", List.of("appendix", "appendectomy", "appendicitis", "surgical"));
        RELATED_TERMS.put("dental treatment", List.of("dental", "dentist", "tooth", "teeth"));
        RELATED_TERMS.put("cancer treatment", List.of("oncology", "cancer", "chemotherapy", "radiotherapy"));
        RELATED_TERMS.put("chemotherapy", List.of("oncology", "cancer", "chemotherapy"));
        RELATED_TERMS.put("dialysis", List.of("dialysis", "renal", "kidney"));
        RELATED_TERMS.put("maternity", List.of("maternity", "pregnancy", "childbirth", "delivery"));
        RELATED_TERMS.put("surgery", List.of("surgery", "surgical", "operation"));
        RELATED_TERMS.put("operation", List.of("surgery", "surgical", "operation"));
        RELATED_TERMS.put("hospitalization", List.of("hospitalization", "hospitalisation", "in-patient", "inpatient"));
        RELATED_TERMS.put("treatment", List.of("treatment"));
    }

    private static final List<String> BY_LENGTH = RELATED_TERMS.keySet().stream()
        .sorted(Comparator.comparingInt(String::length).reversed().thenComparing(Comparator.naturalOrder()))
        .toList();

    public record ProcedureMatch(String name, boolean generic) {}

    /**
     * Longest catalog procedure named in {@code text}.
     */
    public Optional<ProcedureMatch> find(String text) {
        if (text == null || text.isBlank()) {
            return Optional.empty();
        }
        String lower = text.toLowerCase(Locale.ROOT);
        for (String name : BY_LENGTH) {
            if (Pattern.compile("\\b" + Pattern.quote(name) + "\\b").matcher(lower).find()) {
                return Optional.of(new ProcedureMatch(name, GENERIC.contains(name)));
            }
        }
        return Optional.empty();
    }

    /**
     * The procedure name, its words and related policy vocabulary, lowercased and distinct.
     */
    public List<String> termsFor(String procedure) {
        if (procedure == null || procedure.isBlank()) {
            return List.of();
        }
        String name = procedure.toLowerCase(Locale.ROOT).trim();
        Set<String> terms = new LinkedHashSet<>();
        terms.add(name);
        Arrays.stream(name.split("\\s+"))
            .filter(word -> word.length() >= 3)
            .forEach(terms::add);
        terms.addAll(RELATED_TERMS.getOrDefault(name, List.of()));
        return new ArrayList<>(terms);
    }

    /**
     * Terms that identify this procedure rather than a whole class of procedures. "cosmetic surgery is
     * excluded" must not read as an exclusion of knee surgery.
     */
    public List<String> specificTermsFor(String procedure) {
        List<String> all = termsFor(procedure);
        if (all.isEmpty() || GENERIC.contains(all.get(0))) {
            return all.isEmpty() ? all : List.of(all.get(0));
        }
        return all.stream().filter(term -> !BROAD_TERMS.contains(term)).toList();
    }

    public List<String> procedures() {
        return List.copyOf(RELATED_TERMS.keySet());
    }

    /**
     * True when {@code text} contains any term as a word prefix ("ophthalm" matches "ophthalmic").
     */
    public static boolean mentionsAny(String text, List<String> terms) {
        return firstMention(text, terms).isPresent();
    }

    public static Optional<String> firstMention(String text, List<String> terms) {
        if (text == null) {
            return Optional.empty();
        }
        String lower = text.toLowerCase(Locale.ROOT);
        return terms.stream()
            .filter(term -> Pattern.compile("\\b" + Pattern.quote(term.toLowerCase(Locale.ROOT))).matcher(lower).find())
            .findFirst();
    }
}
