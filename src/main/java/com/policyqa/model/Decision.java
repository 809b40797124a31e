package com.policyqa.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum Decision {
    APPROVED,
    REJECTED,
    REQUIRES_MORE_INFO;

    @JsonValue
    public String wireValue() {
        return name().toLowerCase(Locale.ROOT);
    }
}
