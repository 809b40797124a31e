package com.policyqa.model;

public enum RuleVerdict {
    PASS,
    FAIL,
    UNKNOWN,
    /** The retrieved clauses say nothing the rule could check. */
    NOT_APPLICABLE
}
