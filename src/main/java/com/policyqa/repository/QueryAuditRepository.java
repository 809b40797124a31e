package com.policyqa.repository;

import com.policyqa.model.AttributeValue;
import com.policyqa.model.QueryAttribute;
import com.policyqa.model.QueryAuditRecord;

import java.util.Map;

/**
 * Append-only log of answered queries, read back per session for conversational context.
 */
public interface QueryAuditRepository {

    void append(QueryAuditRecord record);

    Map<QueryAttribute, AttributeValue> findLatestAttributes(Long ownerId, String sessionId);
}
