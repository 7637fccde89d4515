package com.company.scheduler.repository;

import com.company.scheduler.domain.ScheduledJob;
import com.company.scheduler.domain.enums.JobMode;
import com.company.scheduler.domain.enums.JobStatus;
import com.company.scheduler.domain.enums.MarkOutcomeResult;
import com.company.scheduler.exception.JobStoreException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * JDBC access to scheduled jobs. Every state transition after creation is a
 * conditional update on (sent = false, send_at = observed value), so of two
 * passes racing on the same occurrence exactly one applies.
 */
@Repository
@RequiredArgsConstructor
@Slf4j
public class ScheduledJobRepository {

    private static final int MAX_ERROR_LENGTH = 2000;
    private static final TypeReference<List<String>> RECIPIENTS_TYPE = new TypeReference<>() {
    };

    private final JdbcTemplate jdbcTemplate;
    private final ObjectMapper objectMapper;

    private static final String SELECT_BASE = """
        SELECT id, owner_id, recipients, subject, body, body_html, send_at, sent,
               mode, recurring, ai_model, from_name, status, failure_count,
               last_error, last_attempt_at, created_at, updated_at
        FROM scheduled_jobs
        """;

    /**
     * Unsent jobs whose send_at is at or before now, oldest first.
     */
    public List<ScheduledJob> findDue(Instant now) {
        try {
            return jdbcTemplate.query(SELECT_BASE + """
                WHERE sent = FALSE
                  AND send_at <= ?
                ORDER BY send_at, id
                """, rowMapper(), now.toEpochMilli());
        } catch (DataAccessException e) {
            throw new JobStoreException("Failed to load due jobs", e);
        }
    }

    public Optional<ScheduledJob> findById(String id) {
        try {
            List<ScheduledJob> results = jdbcTemplate.query(SELECT_BASE + " WHERE id = ?", rowMapper(), id);
            return results.isEmpty() ? Optional.empty() : Optional.of(results.get(0));
        } catch (DataAccessException e) {
            throw new JobStoreException("Failed to load job " + id, e);
        }
    }

    public List<ScheduledJob> findPendingByOwner(String ownerId) {
        try {
            return jdbcTemplate.query(SELECT_BASE + """
                WHERE owner_id = ?
                  AND sent = FALSE
                ORDER BY send_at, id
                """, rowMapper(), ownerId);
        } catch (DataAccessException e) {
            throw new JobStoreException("Failed to list pending jobs for owner " + ownerId, e);
        }
    }

    /**
     * Insert, or replace every column of an existing job with the same id.
     */
    public ScheduledJob upsert(ScheduledJob job) {
        Instant now = Instant.now();
        if (job.getCreatedAt() == null) {
            job.setCreatedAt(now);
        }
        job.setUpdatedAt(now);

        String recipients = writeRecipients(job.getRecipients());
        try {
            int updated = jdbcTemplate.update("""
                UPDATE scheduled_jobs
                SET owner_id = ?, recipients = ?, subject = ?, body = ?, body_html = ?,
                    send_at = ?, sent = ?, mode = ?, recurring = ?, ai_model = ?, from_name = ?,
                    status = ?, failure_count = ?, last_error = ?, last_attempt_at = ?, updated_at = ?
                WHERE id = ?
                """,
                    job.getOwnerId(),
                    recipients,
                    job.getSubject(),
                    job.getBody(),
                    job.getBodyHtml(),
                    job.getSendAt().toEpochMilli(),
                    job.isSent(),
                    job.getMode().getCode(),
                    job.isRecurring(),
                    job.getAiModel(),
                    job.getFromName(),
                    job.getStatus().name(),
                    job.getFailureCount(),
                    truncate(job.getLastError()),
                    toTimestamp(job.getLastAttemptAt()),
                    Timestamp.from(job.getUpdatedAt()),
                    job.getId());

            if (updated == 0) {
                jdbcTemplate.update("""
                    INSERT INTO scheduled_jobs (
                        id, owner_id, recipients, subject, body, body_html, send_at, sent,
                        mode, recurring, ai_model, from_name, status, failure_count,
                        last_error, last_attempt_at, created_at, updated_at
                    ) VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
                    """,
                        job.getId(),
                        job.getOwnerId(),
                        recipients,
                        job.getSubject(),
                        job.getBody(),
                        job.getBodyHtml(),
                        job.getSendAt().toEpochMilli(),
                        job.isSent(),
                        job.getMode().getCode(),
                        job.isRecurring(),
                        job.getAiModel(),
                        job.getFromName(),
                        job.getStatus().name(),
                        job.getFailureCount(),
                        truncate(job.getLastError()),
                        toTimestamp(job.getLastAttemptAt()),
                        Timestamp.from(job.getCreatedAt()),
                        Timestamp.from(job.getUpdatedAt()));
            }

            log.debug("Upserted job {} (sendAt={})", job.getId(), job.getSendAt());
            return job;

        } catch (DataAccessException e) {
            log.error("Failed to upsert job {}", job.getId(), e);
            throw new JobStoreException("Failed to save scheduled job " + job.getId(), e);
        }
    }

    /**
     * Claims the occurrence observed at expectedSendAt. Either terminal
     * (sent = true) or rescheduled to nextSendAt.
     */
    public MarkOutcomeResult markOutcome(String jobId, Instant expectedSendAt, boolean sent, Instant nextSendAt) {
        Instant newSendAt = sent || nextSendAt == null ? expectedSendAt : nextSendAt;
        try {
            int updated = jdbcTemplate.update("""
                UPDATE scheduled_jobs
                SET sent = ?,
                    send_at = ?,
                    status = ?,
                    failure_count = 0,
                    last_error = NULL,
                    updated_at = ?
                WHERE id = ?
                  AND sent = FALSE
                  AND send_at = ?
                """,
                    sent,
                    newSendAt.toEpochMilli(),
                    sent ? JobStatus.SENT.name() : JobStatus.PENDING.name(),
                    Timestamp.from(Instant.now()),
                    jobId,
                    expectedSendAt.toEpochMilli());
            return updated == 1 ? MarkOutcomeResult.APPLIED : MarkOutcomeResult.CONFLICT;
        } catch (DataAccessException e) {
            throw new JobStoreException("Failed to record outcome for job " + jobId, e);
        }
    }

    /**
     * Bookkeeping for a failed delivery; the job stays pending at the same send_at.
     */
    public MarkOutcomeResult recordDeliveryFailure(String jobId, Instant expectedSendAt,
                                                   String error, Instant attemptedAt) {
        try {
            int updated = jdbcTemplate.update("""
                UPDATE scheduled_jobs
                SET failure_count = failure_count + 1,
                    last_error = ?,
                    last_attempt_at = ?,
                    updated_at = ?
                WHERE id = ?
                  AND sent = FALSE
                  AND send_at = ?
                """,
                    truncate(error),
                    Timestamp.from(attemptedAt),
                    Timestamp.from(Instant.now()),
                    jobId,
                    expectedSendAt.toEpochMilli());
            return updated == 1 ? MarkOutcomeResult.APPLIED : MarkOutcomeResult.CONFLICT;
        } catch (DataAccessException e) {
            throw new JobStoreException("Failed to record delivery failure for job " + jobId, e);
        }
    }

    /**
     * Terminal failure once the attempt limit is reached.
     */
    public MarkOutcomeResult markFailed(String jobId, Instant expectedSendAt, String error, Instant attemptedAt) {
        try {
            int updated = jdbcTemplate.update("""
                UPDATE scheduled_jobs
                SET sent = TRUE,
                    status = ?,
                    failure_count = failure_count + 1,
                    last_error = ?,
                    last_attempt_at = ?,
                    updated_at = ?
                WHERE id = ?
                  AND sent = FALSE
                  AND send_at = ?
                """,
                    JobStatus.FAILED.name(),
                    truncate(error),
                    Timestamp.from(attemptedAt),
                    Timestamp.from(Instant.now()),
                    jobId,
                    expectedSendAt.toEpochMilli());
            return updated == 1 ? MarkOutcomeResult.APPLIED : MarkOutcomeResult.CONFLICT;
        } catch (DataAccessException e) {
            throw new JobStoreException("Failed to mark job " + jobId + " as failed", e);
        }
    }

    /**
     * @return rows removed; 0 when no job with this id belongs to the owner
     */
    public int deleteByIdAndOwner(String id, String ownerId) {
        try {
            return jdbcTemplate.update("DELETE FROM scheduled_jobs WHERE id = ? AND owner_id = ?", id, ownerId);
        } catch (DataAccessException e) {
            throw new JobStoreException("Failed to delete job " + id, e);
        }
    }

    public int countPending() {
        try {
            Integer count = jdbcTemplate.queryForObject(
                    "SELECT COUNT(*) FROM scheduled_jobs WHERE sent = FALSE", Integer.class);
            return count != null ? count : 0;
        } catch (DataAccessException e) {
            throw new JobStoreException("Failed to count pending jobs", e);
        }
    }

    private String writeRecipients(List<String> recipients) {
        try {
            return objectMapper.writeValueAsString(recipients);
        } catch (JsonProcessingException e) {
            throw new JobStoreException("Failed to serialize recipients", e);
        }
    }

    private RowMapper<ScheduledJob> rowMapper() {
        return new ScheduledJobRowMapper(objectMapper);
    }

    private static String truncate(String value) {
        if (value == null || value.length() <= MAX_ERROR_LENGTH) {
            return value;
        }
        return value.substring(0, MAX_ERROR_LENGTH);
    }

    private static Timestamp toTimestamp(Instant instant) {
        return instant != null ? Timestamp.from(instant) : null;
    }

    private static class ScheduledJobRowMapper implements RowMapper<ScheduledJob> {

        private final ObjectMapper objectMapper;

        ScheduledJobRowMapper(ObjectMapper objectMapper) {
            this.objectMapper = objectMapper;
        }

        @Override
        public ScheduledJob mapRow(ResultSet rs, int rowNum) throws SQLException {
            return ScheduledJob.builder()
                    .id(rs.getString("id"))
                    .ownerId(rs.getString("owner_id"))
                    .recipients(readRecipients(rs.getString("recipients")))
                    .subject(rs.getString("subject"))
                    .body(rs.getString("body"))
                    .bodyHtml(rs.getString("body_html"))
                    .sendAt(Instant.ofEpochMilli(rs.getLong("send_at")))
                    .sent(rs.getBoolean("sent"))
                    .mode(JobMode.fromCode(rs.getString("mode")))
                    .recurring(rs.getBoolean("recurring"))
                    .aiModel(rs.getString("ai_model"))
                    .fromName(rs.getString("from_name"))
                    .status(JobStatus.fromString(rs.getString("status")))
                    .failureCount(rs.getInt("failure_count"))
                    .lastError(rs.getString("last_error"))
                    .lastAttemptAt(getInstant(rs, "last_attempt_at"))
                    .createdAt(getInstant(rs, "created_at"))
                    .updatedAt(getInstant(rs, "updated_at"))
                    .build();
        }

        private List<String> readRecipients(String json) {
            if (json == null || json.isBlank()) {
                return List.of();
            }
            try {
                return objectMapper.readValue(json, RECIPIENTS_TYPE);
            } catch (JsonProcessingException e) {
                throw new JobStoreException("Stored recipients are not valid JSON", e);
            }
        }

        private static Instant getInstant(ResultSet rs, String columnName) throws SQLException {
            Timestamp timestamp = rs.getTimestamp(columnName);
            return timestamp != null ? timestamp.toInstant() : null;
        }
    }
}
