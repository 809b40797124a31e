package com.policyqa.repository;

import com.policyqa.exception.DocumentNotFoundException;
import com.policyqa.model.Document;
import com.policyqa.model.DocumentStatus;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.simple.JdbcClient;
import org.springframework.stereotype.Repository;

import java.time.OffsetDateTime;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

@Repository
@RequiredArgsConstructor
public class JdbcDocumentRepository implements DocumentRepository {

    private final JdbcClient jdbcClient;

    private final RowMapper<Document> documentRowMapper = (rs, rowNum) -> new Document(
        rs.getLong("id"),
        rs.getLong("owner_id"),
        rs.getString("filename"),
        rs.getString("content_type"),
        rs.getLong("size_bytes"),
        rs.getString("storage_ref"),
        DocumentStatus.valueOf(rs.getString("status")),
        rs.getString("failure_reason"),
        rs.getObject("created_at", OffsetDateTime.class),
        rs.getObject("updated_at", OffsetDateTime.class)
    );

    @Override
    public Document save(Document document) {
        return jdbcClient.sql("""
                INSERT INTO documents (owner_id, filename, content_type, size_bytes, storage_ref, status)
                VALUES (:ownerId, :filename, :contentType, :sizeBytes, :storageRef, :status)
                RETURNING *
                """)
            .param("ownerId", document.ownerId())
            .param("filename", document.filename())
            .param("contentType", document.contentType())
            .param("sizeBytes", document.sizeBytes())
            .param("storageRef", document.storageRef())
            .param("status", document.status() != null ? document.status().name() : DocumentStatus.PENDING.name())
            .query(documentRowMapper)
            .single();
    }

    @Override
    public void updateStorageRef(Long id, String storageRef) {
        int rowsAffected = jdbcClient.sql("""
                UPDATE documents
                SET storage_ref = :storageRef, updated_at = NOW()
                WHERE id = :id
                """)
            .param("storageRef", storageRef)
            .param("id", id)
            .update();

        if (rowsAffected == 0) {
            throw new DocumentNotFoundException(id);
        }
    }

    @Override
    public Optional<Document> findById(Long id) {
        return jdbcClient.sql("SELECT * FROM documents WHERE id = :id")
            .param("id", id)
            .query(documentRowMapper)
            .optional();
    }

    @Override
    public List<Document> findByOwner(Long ownerId) {
        return jdbcClient.sql("SELECT * FROM documents WHERE owner_id = :ownerId ORDER BY id")
            .param("ownerId", ownerId)
            .query(documentRowMapper)
            .list();
    }

    @Override
    public List<Document> findByIds(Collection<Long> ids) {
        if (ids == null || ids.isEmpty()) {
            return List.of();
        }
        return jdbcClient.sql("SELECT * FROM documents WHERE id IN (:ids) ORDER BY id")
            .param("ids", List.copyOf(ids))
            .query(documentRowMapper)
            .list();
    }

    @Override
    public List<Long> findIdsByOwnerAndStatus(Long ownerId, DocumentStatus status) {
        return jdbcClient.sql("""
                SELECT id FROM documents
                WHERE owner_id = :ownerId AND status = :status
                ORDER BY id
                """)
            .param("ownerId", ownerId)
            .param("status", status.name())
            .query(Long.class)
            .list();
    }

    @Override
    public boolean claimForIndexing(Long id) {
        return transition(id, DocumentStatus.PENDING, DocumentStatus.PROCESSING);
    }

    @Override
    public boolean markCompleted(Long id) {
        return transition(id, DocumentStatus.PROCESSING, DocumentStatus.COMPLETED);
    }

    @Override
    public boolean markFailed(Long id, String reason) {
        int rowsAffected = jdbcClient.sql("""
                UPDATE documents
                SET status = 'FAILED', failure_reason = :reason, updated_at = NOW()
                WHERE id = :id AND status IN ('PENDING', 'PROCESSING')
                """)
            .param("reason", reason)
            .param("id", id)
            .update();
        return rowsAffected > 0;
    }

    @Override
    public List<Long> failStaleProcessing(int staleThresholdMinutes, String reason) {
        return jdbcClient.sql("""
                UPDATE documents
                SET status = 'FAILED', failure_reason = :reason, updated_at = NOW()
                WHERE status = 'PROCESSING'
                  AND updated_at < NOW() - (INTERVAL '1 minute' * :staleMins)
                RETURNING id
                """)
            .param("reason", reason)
            .param("staleMins", staleThresholdMinutes)
            .query(Long.class)
            .list();
    }

    @Override
    public void delete(Long id) {
        int rowsAffected = jdbcClient.sql("DELETE FROM documents WHERE id = :id")
            .param("id", id)
            .update();

        if (rowsAffected == 0) {
            throw new DocumentNotFoundException(id);
        }
    }

    private boolean transition(Long id, DocumentStatus from, DocumentStatus to) {
        int rowsAffected = jdbcClient.sql("""
                UPDATE documents
                SET status = :to, updated_at = NOW()
                WHERE id = :id AND status = :from
                """)
            .param("to", to.name())
            .param("from", from.name())
            .param("id", id)
            .update();
        return rowsAffected > 0;
    }
}
