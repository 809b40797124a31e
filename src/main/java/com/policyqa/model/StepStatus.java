package com.policyqa.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum StepStatus {
    COMPLETED,
    FAILED,
    TIMED_OUT;

    @JsonValue
    public String wireValue() {
        return name().toLowerCase(Locale.ROOT);
    }
}
