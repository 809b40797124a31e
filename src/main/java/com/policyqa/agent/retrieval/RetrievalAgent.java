package com.policyqa.agent.retrieval;

import com.policyqa.model.ParsedQuery;
import com.policyqa.model.RetrievalResult;

/**
 * Finds the clauses most relevant to a parsed query. Only documents whose indexing completed are searched.
 * An empty universe produces an empty result, never an error.
 */
public interface RetrievalAgent {

    RetrievalResult retrieve(ParsedQuery query, RetrievalScope scope);
}
