package com.policyqa.repository;

import com.policyqa.model.Chunk;
import com.policyqa.model.ChunkDraft;
import com.policyqa.model.ChunkMatch;
import com.policyqa.model.ClauseCategory;
import com.pgvector.PGvector;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.BatchPreparedStatementSetter;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.simple.JdbcClient;
import org.springframework.stereotype.Repository;

import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.sql.Types;
import java.util.Collection;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

@Repository
@RequiredArgsConstructor
public class JdbcChunkRepository implements ChunkRepository {

    private final JdbcClient jdbcClient;
    private final JdbcTemplate jdbcTemplate;

    private final RowMapper<ChunkMatch> chunkMatchMapper = (rs, rowNum) -> {
        String category = rs.getString("category");
        Chunk chunk = new Chunk(
            rs.getLong("id"),
            rs.getLong("document_id"),
            rs.getInt("ordinal"),
            (Integer) rs.getObject("page"),
            rs.getString("section"),
            category != null ? ClauseCategory.valueOf(category) : ClauseCategory.GENERAL,
            rs.getString("content")
        );
        // cosine distance lies in [0, 2]
        double similarity = Math.max(0.0, Math.min(1.0, rs.getDouble("vector_score")));
        return new ChunkMatch(chunk, similarity);
    };

    @Override
    public void saveChunks(Long documentId, List<ChunkDraft> chunks) {
        if (chunks == null || chunks.isEmpty()) {
            return;
        }

        String sql = """
            INSERT INTO chunks (document_id, ordinal, page, section, category, content, embedding)
            VALUES (?, ?, ?, ?, ?, ?, ?)
            """;

        jdbcTemplate.batchUpdate(sql, new BatchPreparedStatementSetter() {
            @Override
            public void setValues(PreparedStatement ps, int i) throws SQLException {
                ChunkDraft draft = chunks.get(i);
                ps.setLong(1, documentId);
                ps.setInt(2, draft.ordinal());
                if (draft.page() != null) {
                    ps.setInt(3, draft.page());
                } else {
                    ps.setNull(3, Types.INTEGER);
                }
                ps.setString(4, draft.section());
                ps.setString(5, draft.category() != null ? draft.category().name() : null);
                ps.setString(6, draft.content());
                ps.setObject(7, new PGvector(draft.embedding()));
            }

            @Override
            public int getBatchSize() {
                return chunks.size();
            }
        });
    }

    @Override
    public List<ChunkMatch> findNearest(float[] vector, Collection<Long> documentIds, int limit) {
        if (documentIds == null || documentIds.isEmpty()) {
            return List.of();
        }

        String sql = """
            SELECT c.id, c.document_id, c.ordinal, c.page, c.section, c.category, c.content,
                   1 - (c.embedding <=> :vector) AS vector_score
            FROM chunks c
            WHERE c.document_id IN (:documentIds)
            ORDER BY c.embedding <=> :vector ASC, c.ordinal ASC, c.document_id ASC, c.id ASC
            LIMIT :limit
            """;

        return jdbcClient.sql(sql)
            .param("vector", new PGvector(vector))
            .param("documentIds", List.copyOf(documentIds))
            .param("limit", limit)
            .query(chunkMatchMapper)
            .list();
    }

    @Override
    public List<ChunkMatch> findByKeywords(float[] vector, List<String> terms, Collection<Long> documentIds, int limit) {
        if (terms == null || terms.isEmpty() || documentIds == null || documentIds.isEmpty()) {
            return List.of();
        }

        String termFilter = IntStream.range(0, terms.size())
            .mapToObj(i -> "c.content ILIKE :term" + i)
            .collect(Collectors.joining(" OR ", "(", ")"));

        String sql = """
            SELECT c.id, c.document_id, c.ordinal, c.page, c.section, c.category, c.content,
                   1 - (c.embedding <=> :vector) AS vector_score
            FROM chunks c
            WHERE c.document_id IN (:documentIds)
              AND %s
            ORDER BY c.document_id ASC, c.ordinal ASC
            LIMIT :limit
            """.formatted(termFilter);

        var statement = jdbcClient.sql(sql)
            .param("vector", new PGvector(vector))
            .param("documentIds", List.copyOf(documentIds))
            .param("limit", limit);

        for (int i = 0; i < terms.size(); i++) {
            statement = statement.param("term" + i, "%" + escapeLike(terms.get(i)) + "%");
        }

        return statement.query(chunkMatchMapper).list();
    }

    @Override
    public int countByDocumentId(Long documentId) {
        return jdbcClient.sql("SELECT COUNT(*) FROM chunks WHERE document_id = :documentId")
            .param("documentId", documentId)
            .query(Integer.class)
            .single();
    }

    private static String escapeLike(String term) {
        return term.replace("\\", "\\\\").replace("%", "\\%").replace("_", "\\_");
    }
}
