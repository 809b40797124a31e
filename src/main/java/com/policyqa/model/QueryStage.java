package com.policyqa.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum QueryStage {
    RECEIVED,
    PARSING,
    RETRIEVING,
    EVALUATING,
    SYNTHESIZING,
    DONE,
    FAILED;

    public boolean isTerminal() {
        return this == DONE || this == FAILED;
    }

    @JsonValue
    public String wireValue() {
        return name().toLowerCase(Locale.ROOT);
    }
}
