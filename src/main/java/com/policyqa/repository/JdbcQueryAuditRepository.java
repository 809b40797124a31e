package com.policyqa.repository;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.policyqa.model.AttributeValue;
import com.policyqa.model.QueryAttribute;
import com.policyqa.model.QueryAuditRecord;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.simple.JdbcClient;
import org.springframework.stereotype.Repository;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.UUID;

@Slf4j
@Repository
@RequiredArgsConstructor
public class JdbcQueryAuditRepository implements QueryAuditRepository {

    private static final TypeReference<Map<QueryAttribute, AttributeValue>> ATTRIBUTES_TYPE = new TypeReference<>() {};

    private final JdbcClient jdbcClient;
    private final ObjectMapper objectMapper;

    @Override
    public void append(QueryAuditRecord record) {
        jdbcClient.sql("""
                INSERT INTO query_audit (query_id, session_id, owner_id, query, decision, confidence,
                                         processing_time_ms, attributes, agent_steps)
                VALUES (:queryId, :sessionId, :ownerId, :query, :decision, :confidence,
                        :processingTimeMs, CAST(:attributes AS jsonb), CAST(:agentSteps AS jsonb))
                """)
            .param("queryId", UUID.fromString(record.queryId()))
            .param("sessionId", record.sessionId())
            .param("ownerId", record.ownerId())
            .param("query", record.query())
            .param("decision", record.decision().name())
            .param("confidence", record.confidence())
            .param("processingTimeMs", record.processingTimeMs())
            .param("attributes", toJson(record.attributes()))
            .param("agentSteps", toJson(record.agentSteps()))
            .update();
    }

    @Override
    public Map<QueryAttribute, AttributeValue> findLatestAttributes(Long ownerId, String sessionId) {
        if (sessionId == null || sessionId.isBlank()) {
            return Collections.emptyMap();
        }

        return jdbcClient.sql("""
                SELECT attributes::text FROM query_audit
                WHERE owner_id = :ownerId AND session_id = :sessionId
                ORDER BY id DESC
                LIMIT 1
                """)
            .param("ownerId", ownerId)
            .param("sessionId", sessionId)
            .query(String.class)
            .optional()
            .map(this::readAttributes)
            .orElse(Collections.emptyMap());
    }

    private Map<QueryAttribute, AttributeValue> readAttributes(String json) {
        try {
            Map<QueryAttribute, AttributeValue> attributes = objectMapper.readValue(json, ATTRIBUTES_TYPE);
            return attributes == null || attributes.isEmpty() ? Collections.emptyMap() : new EnumMap<>(attributes);
        } catch (JsonProcessingException e) {
            log.warn("Ignoring unreadable session attributes: {}", e.getOriginalMessage());
            return Collections.emptyMap();
        }
    }

    private String toJson(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize audit payload", e);
        }
    }
}
