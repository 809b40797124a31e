package com.policyqa.repository;

import com.policyqa.model.AgentStep;
import com.policyqa.model.AttributeSource;
import com.policyqa.model.AttributeValue;
import com.policyqa.model.Decision;
import com.policyqa.model.QueryAttribute;
import com.policyqa.model.QueryAuditRecord;
import com.policyqa.model.QueryStage;
import com.policyqa.model.StepStatus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.jdbc.core.simple.JdbcClient;

import java.util.List;
import java.util.Map;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;

class JdbcQueryAuditRepositoryTest extends BaseIntegrationTest {

    private static final Long OWNER = 1L;

    @Autowired
    private QueryAuditRepository auditRepository;

    @Autowired
    private JdbcClient jdbcClient;

    @BeforeEach
    void setUp() {
        jdbcClient.sql("DELETE FROM query_audit").update();
    }

    private static QueryAuditRecord record(String sessionId, Map<QueryAttribute, AttributeValue> attributes) {
        AgentStep step = new AgentStep(QueryStage.PARSING, "query-parser", StepStatus.COMPLETED, 1, 4,
            "knee surgery", "attributes=" + attributes.keySet());
        return new QueryAuditRecord(UUID.randomUUID().toString(), sessionId, OWNER, "knee surgery in Pune",
            Decision.REQUIRES_MORE_INFO, 0.4, 25, attributes, List.of(step));
    }

    @Test
    @DisplayName("Should return the attributes of the latest query in the session")
    void shouldFindLatestAttributes() {
        auditRepository.append(record("s-1", Map.of(QueryAttribute.AGE, AttributeValue.pattern("46", 0.95))));
        auditRepository.append(record("s-1", Map.of(
            QueryAttribute.AGE, AttributeValue.pattern("47", 0.95),
            QueryAttribute.LOCATION, new AttributeValue("Pune", 0.72, AttributeSource.SESSION))));
        auditRepository.append(record("s-2", Map.of(QueryAttribute.AGE, AttributeValue.pattern("30", 0.95))));

        Map<QueryAttribute, AttributeValue> latest = auditRepository.findLatestAttributes(OWNER, "s-1");

        assertThat(latest).containsEntry(QueryAttribute.AGE, AttributeValue.pattern("47", 0.95));
        assertThat(latest.get(QueryAttribute.LOCATION).source()).isEqualTo(AttributeSource.SESSION);
    }

    @Test
    @DisplayName("Should keep sessions of different owners apart")
    void shouldIsolateOwners() {
        auditRepository.append(record("s-1", Map.of(QueryAttribute.AGE, AttributeValue.pattern("46", 0.95))));

        assertThat(auditRepository.findLatestAttributes(2L, "s-1")).isEmpty();
        assertThat(auditRepository.findLatestAttributes(OWNER, "unknown")).isEmpty();
        assertThat(auditRepository.findLatestAttributes(OWNER, null)).isEmpty();
    }

    @Test
    @DisplayName("Should store the agent steps of every query")
    void shouldStoreAgentSteps() {
        auditRepository.append(record(null, Map.of()));

        String steps = jdbcClient.sql("SELECT agent_steps::text FROM query_audit").query(String.class).single();

        assertThat(steps).contains("\"agent_name\"", "query-parser", "\"completed\"");
    }
}
