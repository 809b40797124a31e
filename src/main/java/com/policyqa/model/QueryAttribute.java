package com.policyqa.model;

import java.util.EnumSet;
import java.util.Set;

public enum QueryAttribute {
    AGE,
    GENDER,
    PROCEDURE,
    LOCATION,
    POLICY_TENURE;

    /**
     * Slots that count towards the overall parse confidence. Gender is optional.
     */
    public static final Set<QueryAttribute> CORE = EnumSet.of(AGE, PROCEDURE, LOCATION, POLICY_TENURE);
}
