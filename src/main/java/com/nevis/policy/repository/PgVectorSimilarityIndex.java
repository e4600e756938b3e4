package com.nevis.policy.repository;

import com.nevis.policy.model.ChunkMatch;
import com.nevis.policy.model.PolicyChunk;
import com.pgvector.PGvector;
import lombok.RequiredArgsConstructor;
import lombok.SneakyThrows;
import org.springframework.jdbc.core.BatchPreparedStatementSetter;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.simple.JdbcClient;
import org.springframework.stereotype.Repository;

import java.sql.Date;
import java.sql.PreparedStatement;
import java.sql.Types;
import java.time.LocalDate;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Repository
@RequiredArgsConstructor
public class PgVectorSimilarityIndex implements SimilarityIndex {

    private final JdbcClient jdbcClient;
    private final JdbcTemplate jdbcTemplate;

    private final RowMapper<ChunkMatch> sectionRowMapper = (rs, rowNum) -> new ChunkMatch(
        rs.getString("chunk_id"),
        rs.getString("content"),
        1.0,
        rs.getString("source"),
        rs.getString("revision_id"),
        rs.getString("version_label"),
        rs.getObject("effective_from", LocalDate.class),
        rs.getObject("effective_to", LocalDate.class),
        rs.getString("section_ref"),
        rs.getObject("page_number", Integer.class)
    );

    @Override
    public void upsert(List<PolicyChunk> chunks) {
        if (chunks == null || chunks.isEmpty()) {
            return;
        }

        String sql = """
            INSERT INTO policy_chunks (chunk_id, source, revision_id, version_label, effective_from, effective_to,
                                       section_ref, page_number, chunk_index, content, embedding)
            VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
            ON CONFLICT (chunk_id) DO UPDATE
            SET version_label = EXCLUDED.version_label,
                effective_from = EXCLUDED.effective_from,
                effective_to = EXCLUDED.effective_to,
                section_ref = EXCLUDED.section_ref,
                page_number = EXCLUDED.page_number,
                content = EXCLUDED.content,
                embedding = EXCLUDED.embedding
            """;

        jdbcTemplate.batchUpdate(sql, new BatchPreparedStatementSetter() {
            @Override
            @SneakyThrows
            public void setValues(PreparedStatement ps, int i) {
                PolicyChunk chunk = chunks.get(i);
                ps.setString(1, chunk.chunkId());
                ps.setString(2, chunk.source());
                ps.setString(3, chunk.revisionId());
                ps.setString(4, chunk.versionLabel());
                ps.setDate(5, Date.valueOf(chunk.effectiveFrom()));
                if (chunk.effectiveTo() != null) {
                    ps.setDate(6, Date.valueOf(chunk.effectiveTo()));
                } else {
                    ps.setNull(6, Types.DATE);
                }
                ps.setString(7, chunk.sectionRef() != null ? chunk.sectionRef() : "");
                if (chunk.pageNumber() != null) {
                    ps.setInt(8, chunk.pageNumber());
                } else {
                    ps.setNull(8, Types.INTEGER);
                }
                ps.setInt(9, chunk.chunkIndex());
                ps.setString(10, chunk.content());
                ps.setObject(11, new PGvector(chunk.embedding()));
            }

            @Override
            public int getBatchSize() {
                return chunks.size();
            }
        });
    }

    @Override
    public int deleteByRevision(String revisionId) {
        return jdbcClient.sql("DELETE FROM policy_chunks WHERE revision_id = :revisionId")
            .param("revisionId", revisionId)
            .update();
    }

    @Override
    public int retag(String revisionId, String versionLabel, LocalDate effectiveFrom, LocalDate effectiveTo) {
        String sql = """
            UPDATE policy_chunks
            SET version_label = :versionLabel,
                effective_from = :effectiveFrom,
                effective_to = :effectiveTo
            WHERE revision_id = :revisionId
            """;

        return jdbcClient.sql(sql)
            .param("versionLabel", versionLabel)
            .param("effectiveFrom", effectiveFrom)
            .param("effectiveTo", effectiveTo)
            .param("revisionId", revisionId)
            .update();
    }

    @Override
    public List<ChunkMatch> query(float[] vector, Collection<String> sources, Collection<String> revisionIds,
                                  int limit, double minScore) {
        if ((sources != null && sources.isEmpty()) || (revisionIds != null && revisionIds.isEmpty())) {
            return List.of();
        }

        // 1 - cosine distance gives a similarity score
        String sql = """
            SELECT chunk_id, content, source, revision_id, version_label, effective_from, effective_to,
                   section_ref, page_number,
                   1 - (embedding <=> :vector) AS score
            FROM policy_chunks
            WHERE 1 - (embedding <=> :vector) >= :minScore
            """
            + (sources != null ? " AND source IN (:sources)" : "")
            + (revisionIds != null ? " AND revision_id IN (:revisionIds)" : "")
            + """

            ORDER BY embedding <=> :vector ASC
            LIMIT :limit
            """;

        var statement = jdbcClient.sql(sql)
            .param("vector", new PGvector(vector))
            .param("minScore", minScore)
            .param("limit", limit);

        if (sources != null) {
            statement = statement.param("sources", List.copyOf(sources));
        }
        if (revisionIds != null) {
            statement = statement.param("revisionIds", List.copyOf(revisionIds));
        }

        return statement.query((rs, rowNum) -> new ChunkMatch(
            rs.getString("chunk_id"),
            rs.getString("content"),
            rs.getDouble("score"),
            rs.getString("source"),
            rs.getString("revision_id"),
            rs.getString("version_label"),
            rs.getObject("effective_from", LocalDate.class),
            rs.getObject("effective_to", LocalDate.class),
            rs.getString("section_ref"),
            rs.getObject("page_number", Integer.class)
        )).list();
    }

    @Override
    public List<ChunkMatch> findSection(String source, String revisionId, String sectionRef) {
        String sql = """
            SELECT chunk_id, content, source, revision_id, version_label, effective_from, effective_to,
                   section_ref, page_number
            FROM policy_chunks
            WHERE source = :source
              AND revision_id = :revisionId
              AND lower(section_ref) = lower(:sectionRef)
            ORDER BY chunk_index
            """;

        return jdbcClient.sql(sql)
            .param("source", source)
            .param("revisionId", revisionId)
            .param("sectionRef", sectionRef)
            .query(sectionRowMapper)
            .list();
    }

    @Override
    public Map<String, Integer> countsByRevision() {
        Map<String, Integer> counts = new LinkedHashMap<>();
        jdbcClient.sql("SELECT revision_id, COUNT(*) AS cnt FROM policy_chunks GROUP BY revision_id ORDER BY revision_id")
            .query(rs -> {
                counts.put(rs.getString("revision_id"), rs.getInt("cnt"));
            });
        return counts;
    }
}
