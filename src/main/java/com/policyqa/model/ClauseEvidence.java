package com.policyqa.model;

/**
 * A retrieved chunk a rule relied on, with the sentence it matched.
 */
public record ClauseEvidence(RetrievedChunk chunk, String quote) {}
