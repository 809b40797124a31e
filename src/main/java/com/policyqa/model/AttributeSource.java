package com.policyqa.model;

public enum AttributeSource {
    PATTERN,
    MODEL,
    SESSION
}
