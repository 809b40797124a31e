package com.policyqa.agent.parser;

import com.policyqa.model.AttributeValue;
import com.policyqa.model.QueryAttribute;

import java.util.Map;

public interface AttributeExtractor {

    /**
     * Candidate attributes found in {@code text}. Absent keys mean nothing was found.
     */
    Map<QueryAttribute, AttributeValue> extract(String text);
}
