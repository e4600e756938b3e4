package com.nevis.policy.repository;

import com.nevis.policy.model.DocumentUpdate;
import com.nevis.policy.model.PolicyCategory;
import com.nevis.policy.model.PolicyDocument;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.simple.JdbcClient;
import org.springframework.stereotype.Repository;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.Optional;

@Repository
@RequiredArgsConstructor
public class JdbcPolicyDocumentRepository implements PolicyDocumentRepository {

    private final JdbcClient jdbcClient;

    private final RowMapper<PolicyDocument> documentRowMapper = (rs, rowNum) -> new PolicyDocument(
        rs.getString("source"),
        rs.getString("title"),
        rs.getString("description"),
        PolicyCategory.fromValue(rs.getString("category")),
        rs.getLong("timeline_version"),
        rs.getObject("created_at", OffsetDateTime.class),
        rs.getObject("updated_at", OffsetDateTime.class)
    );

    @Override
    public PolicyDocument save(PolicyDocument document) {
        return jdbcClient.sql("""
                INSERT INTO policy_documents (source, title, description, category)
                VALUES (:source, :title, :description, :category::policy_category)
                RETURNING *
                """)
            .param("source", document.source())
            .param("title", document.title())
            .param("description", document.description())
            .param("category", document.category().value())
            .query(documentRowMapper)
            .single();
    }

    @Override
    public Optional<PolicyDocument> findBySource(String source) {
        return jdbcClient.sql("SELECT * FROM policy_documents WHERE source = :source")
            .param("source", source)
            .query(documentRowMapper)
            .optional();
    }

    @Override
    public boolean existsBySource(String source) {
        return jdbcClient.sql("SELECT EXISTS (SELECT 1 FROM policy_documents WHERE source = :source)")
            .param("source", source)
            .query(Boolean.class)
            .single();
    }

    @Override
    public List<PolicyDocument> findAll(PolicyCategory category, String sourcePrefix) {
        String sql = """
            SELECT * FROM policy_documents
            WHERE (CAST(:category AS policy_category) IS NULL OR category = CAST(:category AS policy_category))
              AND (CAST(:prefix AS TEXT) IS NULL OR starts_with(source, CAST(:prefix AS TEXT)))
            ORDER BY source
            """;

        return jdbcClient.sql(sql)
            .param("category", category != null ? category.value() : null)
            .param("prefix", sourcePrefix != null && !sourcePrefix.isBlank() ? sourcePrefix : null)
            .query(documentRowMapper)
            .list();
    }

    @Override
    public Optional<PolicyDocument> update(String source, DocumentUpdate update) {
        String sql = """
            UPDATE policy_documents
            SET title = COALESCE(:title, title),
                description = COALESCE(:description, description),
                category = COALESCE(CAST(:category AS policy_category), category),
                updated_at = NOW()
            WHERE source = :source
            RETURNING *
            """;

        return jdbcClient.sql(sql)
            .param("title", update.title())
            .param("description", update.description())
            .param("category", update.category() != null ? update.category().value() : null)
            .param("source", source)
            .query(documentRowMapper)
            .optional();
    }

    @Override
    public Optional<Long> lockTimeline(String source) {
        String sql = """
            UPDATE policy_documents
            SET timeline_version = timeline_version + 1
            WHERE source = :source
            RETURNING timeline_version
            """;

        return jdbcClient.sql(sql)
            .param("source", source)
            .query(Long.class)
            .optional();
    }

    @Override
    public Optional<Long> findTimelineVersion(String source) {
        return jdbcClient.sql("SELECT timeline_version FROM policy_documents WHERE source = :source")
            .param("source", source)
            .query(Long.class)
            .optional();
    }
}
