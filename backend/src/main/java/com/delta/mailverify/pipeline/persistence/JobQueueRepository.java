package com.delta.mailverify.pipeline.persistence;

import com.delta.mailverify.pipeline.model.JobStatus;
import com.delta.mailverify.pipeline.model.NewJob;
import com.delta.mailverify.pipeline.model.PipelineJob;
import com.delta.mailverify.pipeline.model.RunJobCounts;
import com.delta.mailverify.verify.persistence.DatabaseDialect;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.jdbc.support.GeneratedKeyHolder;
import org.springframework.jdbc.support.KeyHolder;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static com.delta.mailverify.verify.persistence.DatabaseDialect.toTimestamp;
import static com.delta.mailverify.verify.persistence.DatabaseDialect.truncate;

/**
 * Durable job queue on {@code pipeline_jobs}. A job is claimable once it is due, unlocked and
 * its dependency (if any) has succeeded. Expired locks make a running job claimable again.
 */
@Repository
public class JobQueueRepository {
    private static final Logger log = LoggerFactory.getLogger(JobQueueRepository.class);
    private static final TypeReference<Map<String, Object>> MAP_OBJECT = new TypeReference<>() {};
    private static final int H2_CLAIM_CANDIDATES = 5;
    public static final String DEPENDENCY_FAILED = "dependency_failed";

    private static final String CLAIMABLE = """
        queue = :queue
          AND next_run_at <= :now
          AND (status = 'queued' OR (status = 'running' AND locked_until < :now))
          AND (
              depends_on_job_id IS NULL
              OR EXISTS (
                  SELECT 1
                  FROM pipeline_jobs dep
                  WHERE dep.id = pipeline_jobs.depends_on_job_id
                    AND dep.status = 'succeeded'
              )
          )
        """;

    private final NamedParameterJdbcTemplate jdbc;
    private final ObjectMapper objectMapper;
    private final boolean postgres;

    public JobQueueRepository(NamedParameterJdbcTemplate jdbc, ObjectMapper objectMapper) {
        this.jdbc = jdbc;
        this.objectMapper = objectMapper;
        this.postgres = DatabaseDialect.detectPostgres(jdbc);
    }

    public long enqueue(NewJob job) {
        return enqueue(job, Instant.now());
    }

    public long enqueue(NewJob job, Instant runAt) {
        Instant now = Instant.now();
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("queue", job.queue())
            .addValue("jobType", job.jobType())
            .addValue("payload", writePayload(job.payload()))
            .addValue("dependsOn", job.dependsOnJobId())
            .addValue("status", JobStatus.QUEUED)
            .addValue("maxAttempts", Math.max(1, job.maxAttempts()))
            .addValue("nextRunAt", toTimestamp(runAt == null ? now : runAt))
            .addValue("tenantId", job.tenantId())
            .addValue("runId", job.runId())
            .addValue("companyId", job.companyId())
            .addValue("now", toTimestamp(now));
        KeyHolder keyHolder = new GeneratedKeyHolder();
        jdbc.update(
            """
                INSERT INTO pipeline_jobs (
                    queue, job_type, payload_json, depends_on_job_id, status, attempts, max_attempts,
                    next_run_at, tenant_id, run_id, company_id, created_at, updated_at
                )
                VALUES (
                    :queue, :jobType, :payload, :dependsOn, :status, 0, :maxAttempts,
                    :nextRunAt, :tenantId, :runId, :companyId, :now, :now
                )
                """,
            params,
            keyHolder,
            new String[]{"id"}
        );
        Number key = keyHolder.getKey();
        if (key == null) {
            throw new IllegalStateException("Failed to enqueue " + job.jobType() + " job");
        }
        return key.longValue();
    }

    public Optional<PipelineJob> claimNext(String queue, String lockOwner, long lockTtlSeconds) {
        Instant now = Instant.now();
        String safeOwner = (lockOwner == null || lockOwner.isBlank()) ? "unknown" : lockOwner.trim();
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("queue", queue)
            .addValue("now", toTimestamp(now))
            .addValue("lockedUntil", toTimestamp(now.plusSeconds(Math.max(1, lockTtlSeconds))))
            .addValue("lockOwner", safeOwner);

        if (postgres) {
            List<Long> claimed = jdbc.query(
                """
                    WITH candidate AS (
                        SELECT id
                        FROM pipeline_jobs
                        WHERE """ + CLAIMABLE + """
                        ORDER BY next_run_at ASC, id ASC
                        FOR UPDATE SKIP LOCKED
                        LIMIT 1
                    )
                    UPDATE pipeline_jobs pj
                    SET status = 'running',
                        attempts = pj.attempts + 1,
                        locked_until = :lockedUntil,
                        lock_owner = :lockOwner,
                        started_at = COALESCE(pj.started_at, :now),
                        updated_at = :now
                    FROM candidate
                    WHERE pj.id = candidate.id
                    RETURNING pj.id
                    """,
                params,
                (rs, rowNum) -> rs.getLong("id")
            );
            return claimed.isEmpty() ? Optional.empty() : findById(claimed.get(0));
        }

        params.addValue("limit", H2_CLAIM_CANDIDATES);
        List<Long> candidates = jdbc.queryForList(
            "SELECT id FROM pipeline_jobs WHERE " + CLAIMABLE + " ORDER BY next_run_at ASC, id ASC LIMIT :limit",
            params,
            Long.class
        );
        for (Long id : candidates) {
            params.addValue("id", id);
            int updated = jdbc.update(
                """
                    UPDATE pipeline_jobs
                    SET status = 'running',
                        attempts = attempts + 1,
                        locked_until = :lockedUntil,
                        lock_owner = :lockOwner,
                        started_at = COALESCE(started_at, :now),
                        updated_at = :now
                    WHERE id = :id
                      AND (status = 'queued' OR (status = 'running' AND locked_until < :now))
                    """,
                params
            );
            if (updated == 1) {
                return findById(id);
            }
        }
        return Optional.empty();
    }

    public Optional<PipelineJob> findById(long id) {
        return jdbc.query(
            """
                SELECT id, queue, job_type, payload_json, depends_on_job_id, status, attempts, max_attempts,
                       tenant_id, run_id, company_id
                FROM pipeline_jobs
                WHERE id = :id
                """,
            new MapSqlParameterSource().addValue("id", id),
            jobMapper()
        ).stream().findFirst();
    }

    public void markSucceeded(long jobId) {
        Instant now = Instant.now();
        jdbc.update(
            """
                UPDATE pipeline_jobs
                SET status = 'succeeded',
                    locked_until = NULL,
                    lock_owner = NULL,
                    last_error = NULL,
                    finished_at = :now,
                    updated_at = :now
                WHERE id = :id
                """,
            new MapSqlParameterSource()
                .addValue("id", jobId)
                .addValue("now", toTimestamp(now))
        );
    }

    public void markRetry(long jobId, Instant nextRunAt, String error) {
        Instant now = Instant.now();
        jdbc.update(
            """
                UPDATE pipeline_jobs
                SET status = 'queued',
                    next_run_at = :nextRunAt,
                    locked_until = NULL,
                    lock_owner = NULL,
                    last_error = :error,
                    updated_at = :now
                WHERE id = :id
                """,
            new MapSqlParameterSource()
                .addValue("id", jobId)
                .addValue("nextRunAt", toTimestamp(nextRunAt))
                .addValue("error", truncate(error, 1000))
                .addValue("now", toTimestamp(now))
        );
    }

    public void defer(long jobId, Instant nextRunAt, String reason) {
        Instant now = Instant.now();
        jdbc.update(
            """
                UPDATE pipeline_jobs
                SET status = 'queued',
                    attempts = CASE WHEN attempts > 0 THEN attempts - 1 ELSE 0 END,
                    next_run_at = :nextRunAt,
                    locked_until = NULL,
                    lock_owner = NULL,
                    last_error = :reason,
                    updated_at = :now
                WHERE id = :id
                """,
            new MapSqlParameterSource()
                .addValue("id", jobId)
                .addValue("nextRunAt", toTimestamp(nextRunAt))
                .addValue("reason", truncate(reason, 1000))
                .addValue("now", toTimestamp(now))
        );
    }

    public long countOpen(Long runId, Long companyId, String jobType) {
        Long count = jdbc.queryForObject(
            """
                SELECT COUNT(*)
                FROM pipeline_jobs
                WHERE run_id = :runId
                  AND company_id = :companyId
                  AND job_type = :jobType
                  AND status IN ('queued', 'running')
                """,
            new MapSqlParameterSource()
                .addValue("runId", runId)
                .addValue("companyId", companyId)
                .addValue("jobType", jobType),
            Long.class
        );
        return count == null ? 0 : count;
    }

    /**
     * Fails the job and every queued job that transitively depends on it.
     *
     * @return ids of the dependents that were failed
     */
    public List<Long> markFailed(long jobId, String error) {
        Instant now = Instant.now();
        jdbc.update(
            """
                UPDATE pipeline_jobs
                SET status = 'failed',
                    locked_until = NULL,
                    lock_owner = NULL,
                    last_error = :error,
                    finished_at = :now,
                    updated_at = :now
                WHERE id = :id
                """,
            new MapSqlParameterSource()
                .addValue("id", jobId)
                .addValue("error", truncate(error, 1000))
                .addValue("now", toTimestamp(now))
        );

        List<Long> cascaded = new ArrayList<>();
        Deque<Long> pending = new ArrayDeque<>();
        pending.add(jobId);
        while (!pending.isEmpty()) {
            long parent = pending.poll();
            MapSqlParameterSource params = new MapSqlParameterSource()
                .addValue("parent", parent)
                .addValue("error", DEPENDENCY_FAILED)
                .addValue("now", toTimestamp(now));
            List<Long> dependents = jdbc.queryForList(
                """
                    SELECT id
                    FROM pipeline_jobs
                    WHERE depends_on_job_id = :parent
                      AND status = 'queued'
                    """,
                params,
                Long.class
            );
            for (Long dependent : dependents) {
                int updated = jdbc.update(
                    """
                        UPDATE pipeline_jobs
                        SET status = 'failed',
                            last_error = :error,
                            finished_at = :now,
                            updated_at = :now
                        WHERE id = :id
                          AND status = 'queued'
                        """,
                    new MapSqlParameterSource()
                        .addValue("id", dependent)
                        .addValue("error", DEPENDENCY_FAILED)
                        .addValue("now", toTimestamp(now))
                );
                if (updated == 1) {
                    cascaded.add(dependent);
                    pending.add(dependent);
                }
            }
        }
        if (!cascaded.isEmpty()) {
            log.info("Job {} failed; {} dependent jobs marked {}", jobId, cascaded.size(), DEPENDENCY_FAILED);
        }
        return cascaded;
    }

    public RunJobCounts countForRun(long runId) {
        Map<String, Long> byStatus = new LinkedHashMap<>();
        jdbc.query(
            """
                SELECT status, COUNT(*) AS total
                FROM pipeline_jobs
                WHERE run_id = :runId
                GROUP BY status
                """,
            new MapSqlParameterSource().addValue("runId", runId),
            rs -> {
                byStatus.put(rs.getString("status"), rs.getLong("total"));
            }
        );
        return new RunJobCounts(
            byStatus.getOrDefault(JobStatus.QUEUED, 0L),
            byStatus.getOrDefault(JobStatus.RUNNING, 0L),
            byStatus.getOrDefault(JobStatus.SUCCEEDED, 0L),
            byStatus.getOrDefault(JobStatus.FAILED, 0L)
        );
    }

    public record CompanyJobCounts(long companyId, long succeeded, long failed) {}

    public List<CompanyJobCounts> countByCompany(long runId) {
        return jdbc.query(
            """
                SELECT company_id,
                       SUM(CASE WHEN status = 'succeeded' THEN 1 ELSE 0 END) AS succeeded,
                       SUM(CASE WHEN status = 'failed' THEN 1 ELSE 0 END) AS failed
                FROM pipeline_jobs
                WHERE run_id = :runId
                  AND company_id IS NOT NULL
                GROUP BY company_id
                ORDER BY company_id
                """,
            new MapSqlParameterSource().addValue("runId", runId),
            (rs, rowNum) -> new CompanyJobCounts(rs.getLong("company_id"), rs.getLong("succeeded"), rs.getLong("failed"))
        );
    }

    public record JobError(Long companyId, String jobType, String error) {}

    public List<JobError> findErrors(long runId, int limit) {
        return jdbc.query(
            """
                SELECT company_id, job_type, last_error
                FROM pipeline_jobs
                WHERE run_id = :runId
                  AND status = 'failed'
                  AND last_error IS NOT NULL
                ORDER BY id
                LIMIT :limit
                """,
            new MapSqlParameterSource()
                .addValue("runId", runId)
                .addValue("limit", Math.max(1, limit)),
            (rs, rowNum) -> new JobError(
                rs.getObject("company_id") == null ? null : rs.getLong("company_id"),
                rs.getString("job_type"),
                rs.getString("last_error")
            )
        );
    }

    public long countOpenForRun(long runId) {
        Long count = jdbc.queryForObject(
            """
                SELECT COUNT(*)
                FROM pipeline_jobs
                WHERE run_id = :runId
                  AND status IN ('queued', 'running')
                """,
            new MapSqlParameterSource().addValue("runId", runId),
            Long.class
        );
        return count == null ? 0 : count;
    }

    private RowMapper<PipelineJob> jobMapper() {
        return (rs, rowNum) -> new PipelineJob(
            rs.getLong("id"),
            rs.getString("queue"),
            rs.getString("job_type"),
            readPayload(rs.getString("payload_json")),
            rs.getObject("depends_on_job_id") == null ? null : rs.getLong("depends_on_job_id"),
            rs.getString("status"),
            rs.getInt("attempts"),
            rs.getInt("max_attempts"),
            rs.getString("tenant_id"),
            rs.getObject("run_id") == null ? null : rs.getLong("run_id"),
            rs.getObject("company_id") == null ? null : rs.getLong("company_id")
        );
    }

    private String writePayload(Map<String, Object> payload) {
        if (payload == null || payload.isEmpty()) {
            return null;
        }
        try {
            return objectMapper.writeValueAsString(payload);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Job payload is not serializable", e);
        }
    }

    private Map<String, Object> readPayload(String json) {
        if (json == null || json.isBlank()) {
            return Map.of();
        }
        try {
            return objectMapper.readValue(json, MAP_OBJECT);
        } catch (JsonProcessingException e) {
            log.warn("Unreadable job payload: {}", e.getOriginalMessage());
            return Map.of();
        }
    }
}
