package com.policyqa.model;

public record AttributeValue(String value, double confidence, AttributeSource source) {

    public AttributeValue {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Attribute value must not be blank");
        }
        if (confidence < 0.0 || confidence > 1.0) {
            throw new IllegalArgumentException("Confidence must be in [0, 1]: " + confidence);
        }
    }

    public static AttributeValue pattern(String value, double confidence) {
        return new AttributeValue(value, confidence, AttributeSource.PATTERN);
    }

    public AttributeValue withConfidence(double newConfidence, AttributeSource newSource) {
        return new AttributeValue(value, newConfidence, newSource);
    }
}
