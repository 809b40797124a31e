package com.policyqa.controller;

import com.fasterxml.jackson.annotation.JsonProperty;

public record ErrorResponse(
    String message,

    @JsonProperty("error_code")
    String errorCode,

    int status,

    long timestamp
) {}
