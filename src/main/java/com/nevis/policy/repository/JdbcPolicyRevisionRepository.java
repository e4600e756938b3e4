package com.nevis.policy.repository;

import com.nevis.policy.exception.EntityNotFoundException;
import com.nevis.policy.model.PolicyRevision;
import com.nevis.policy.model.RevisionStatus;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.simple.JdbcClient;
import org.springframework.stereotype.Repository;

import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

@Repository
@RequiredArgsConstructor
public class JdbcPolicyRevisionRepository implements PolicyRevisionRepository {

    private final JdbcClient jdbcClient;

    private final RowMapper<PolicyRevision> revisionRowMapper = (rs, rowNum) -> new PolicyRevision(
        rs.getString("revision_id"),
        rs.getString("source"),
        rs.getString("version_label"),
        rs.getObject("effective_from", LocalDate.class),
        rs.getObject("effective_to", LocalDate.class),
        RevisionStatus.fromValue(rs.getString("status")),
        rs.getString("file_reference"),
        rs.getObject("file_size_bytes", Long.class),
        rs.getObject("page_count", Integer.class),
        rs.getInt("chunk_count"),
        rs.getString("notes"),
        rs.getString("error"),
        rs.getString("superseded_by"),
        rs.getObject("created_at", OffsetDateTime.class),
        rs.getObject("updated_at", OffsetDateTime.class),
        rs.getObject("ingested_at", OffsetDateTime.class)
    );

    @Override
    public PolicyRevision save(PolicyRevision revision) {
        return jdbcClient.sql("""
                INSERT INTO policy_revisions (revision_id, source, version_label, effective_from, effective_to,
                                              status, file_reference, file_size_bytes, notes)
                VALUES (:revisionId, :source, :versionLabel, :effectiveFrom, :effectiveTo,
                        :status::revision_status, :fileReference, :fileSizeBytes, :notes)
                RETURNING *
                """)
            .param("revisionId", revision.revisionId())
            .param("source", revision.source())
            .param("versionLabel", revision.versionLabel())
            .param("effectiveFrom", revision.effectiveFrom())
            .param("effectiveTo", revision.effectiveTo())
            .param("status", revision.status() != null ? revision.status().value() : RevisionStatus.PROCESSING.value())
            .param("fileReference", revision.fileReference())
            .param("fileSizeBytes", revision.fileSizeBytes())
            .param("notes", revision.notes())
            .query(revisionRowMapper)
            .single();
    }

    @Override
    public Optional<PolicyRevision> findById(String revisionId) {
        return jdbcClient.sql("SELECT * FROM policy_revisions WHERE revision_id = :revisionId")
            .param("revisionId", revisionId)
            .query(revisionRowMapper)
            .optional();
    }

    @Override
    public List<PolicyRevision> findBySource(String source) {
        return jdbcClient.sql("SELECT * FROM policy_revisions WHERE source = :source ORDER BY effective_from")
            .param("source", source)
            .query(revisionRowMapper)
            .list();
    }

    @Override
    public List<PolicyRevision> findByStatusIn(Collection<RevisionStatus> statuses) {
        if (statuses.isEmpty()) {
            return List.of();
        }
        return jdbcClient.sql("""
                SELECT * FROM policy_revisions
                WHERE status::text IN (:statuses)
                ORDER BY source, effective_from
                """)
            .param("statuses", statuses.stream().map(RevisionStatus::value).toList())
            .query(revisionRowMapper)
            .list();
    }

    @Override
    public List<PolicyRevision> findStaleProcessing(int staleThresholdMinutes) {
        return jdbcClient.sql("""
                SELECT * FROM policy_revisions
                WHERE status = 'processing'
                  AND updated_at < NOW() - make_interval(mins => :minutes)
                ORDER BY updated_at
                """)
            .param("minutes", staleThresholdMinutes)
            .query(revisionRowMapper)
            .list();
    }

    @Override
    public boolean existsById(String revisionId) {
        return jdbcClient.sql("SELECT EXISTS (SELECT 1 FROM policy_revisions WHERE revision_id = :revisionId)")
            .param("revisionId", revisionId)
            .query(Boolean.class)
            .single();
    }

    @Override
    public PolicyRevision updateDetails(String revisionId, String versionLabel, LocalDate effectiveFrom,
                                        LocalDate effectiveTo, String notes) {
        String sql = """
            UPDATE policy_revisions
            SET version_label = :versionLabel,
                effective_from = :effectiveFrom,
                effective_to = :effectiveTo,
                notes = :notes,
                updated_at = NOW()
            WHERE revision_id = :revisionId
            RETURNING *
            """;

        return jdbcClient.sql(sql)
            .param("versionLabel", versionLabel)
            .param("effectiveFrom", effectiveFrom)
            .param("effectiveTo", effectiveTo)
            .param("notes", notes)
            .param("revisionId", revisionId)
            .query(revisionRowMapper)
            .optional()
            .orElseThrow(() -> EntityNotFoundException.revision(revisionId));
    }

    @Override
    public void supersede(String revisionId, LocalDate effectiveTo, String supersededBy) {
        String sql = """
            UPDATE policy_revisions
            SET effective_to = :effectiveTo,
                superseded_by = :supersededBy,
                status = CASE WHEN status = 'active'::revision_status
                              THEN 'superseded'::revision_status
                              ELSE status END,
                updated_at = NOW()
            WHERE revision_id = :revisionId
            """;

        int rowsAffected = jdbcClient.sql(sql)
            .param("effectiveTo", effectiveTo)
            .param("supersededBy", supersededBy)
            .param("revisionId", revisionId)
            .update();

        if (rowsAffected == 0) {
            throw EntityNotFoundException.revision(revisionId);
        }
    }

    @Override
    public void clearSupersededBy(String supersededBy) {
        jdbcClient.sql("UPDATE policy_revisions SET superseded_by = NULL, updated_at = NOW() WHERE superseded_by = :id")
            .param("id", supersededBy)
            .update();
    }

    @Override
    public void delete(String revisionId) {
        int rowsAffected = jdbcClient.sql("DELETE FROM policy_revisions WHERE revision_id = :revisionId")
            .param("revisionId", revisionId)
            .update();

        if (rowsAffected == 0) {
            throw EntityNotFoundException.revision(revisionId);
        }
    }

    @Override
    public Optional<PolicyRevision> markIngested(String revisionId, String fileReference, int chunkCount,
                                                 Integer pageCount) {
        String sql = """
            UPDATE policy_revisions
            SET status = CASE WHEN superseded_by IS NULL
                              THEN 'active'::revision_status
                              ELSE 'superseded'::revision_status END,
                chunk_count = :chunkCount,
                page_count = :pageCount,
                error = NULL,
                ingested_at = NOW(),
                updated_at = NOW()
            WHERE revision_id = :revisionId
              AND status = 'processing'::revision_status
              AND file_reference IS NOT DISTINCT FROM CAST(:fileReference AS TEXT)
            RETURNING *
            """;

        return jdbcClient.sql(sql)
            .param("chunkCount", chunkCount)
            .param("pageCount", pageCount)
            .param("revisionId", revisionId)
            .param("fileReference", fileReference)
            .query(revisionRowMapper)
            .optional();
    }

    @Override
    public Optional<PolicyRevision> markFailed(String revisionId, String fileReference, String error) {
        String sql = """
            UPDATE policy_revisions
            SET status = 'failed'::revision_status,
                chunk_count = 0,
                error = :error,
                updated_at = NOW()
            WHERE revision_id = :revisionId
              AND status = 'processing'::revision_status
              AND file_reference IS NOT DISTINCT FROM CAST(:fileReference AS TEXT)
            RETURNING *
            """;

        return jdbcClient.sql(sql)
            .param("error", error)
            .param("revisionId", revisionId)
            .param("fileReference", fileReference)
            .query(revisionRowMapper)
            .optional();
    }

    @Override
    public Optional<PolicyRevision> claimForReindex(String revisionId) {
        String sql = """
            UPDATE policy_revisions
            SET status = 'processing'::revision_status,
                error = NULL,
                updated_at = NOW()
            WHERE revision_id = (
                SELECT revision_id FROM policy_revisions
                WHERE revision_id = :revisionId
                  AND status <> 'processing'::revision_status
                FOR UPDATE SKIP LOCKED
            )
            RETURNING *
            """;

        return jdbcClient.sql(sql)
            .param("revisionId", revisionId)
            .query(revisionRowMapper)
            .optional();
    }
}
