package com.policyqa.model;

import java.util.List;
import java.util.Locale;

/**
 * Coarse tag attached to each chunk at indexing time. Checked in declaration order, first hit wins.
 */
public enum ClauseCategory {
    EXCLUSION(List.of("excluded", "exclusion", "not covered", "not payable", "shall not")),
    WAITING_PERIOD(List.of("waiting period", "cooling period")),
    SUM_INSURED(List.of("sum insured", "sum assured", "maximum benefit", "coverage limit", "limit of indemnity")),
    AGE_ELIGIBILITY(List.of("entry age", "age limit", "aged ", "ages ", "years of age")),
    GEOGRAPHY(List.of("zone", "territor", "geograph", "city", "cities")),
    COVERAGE(List.of("covered", "coverage", "payable", "reimburs", "benefit", "eligible")),
    GENERAL(List.of());

    private final List<String> markers;

    ClauseCategory(List<String> markers) {
        this.markers = markers;
    }

    public static ClauseCategory classify(String text) {
        if (text == null || text.isBlank()) {
            return GENERAL;
        }
        String lower = text.toLowerCase(Locale.ROOT);
        for (ClauseCategory category : values()) {
            if (category.markers.stream().anyMatch(lower::contains)) {
                return category;
            }
        }
        return GENERAL;
    }
}
