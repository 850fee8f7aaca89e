package com.delta.mailverify.verify.persistence;

import com.delta.mailverify.verify.model.DeadLetterRecord;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static com.delta.mailverify.verify.persistence.DatabaseDialect.toInstant;
import static com.delta.mailverify.verify.persistence.DatabaseDialect.toTimestamp;
import static com.delta.mailverify.verify.persistence.DatabaseDialect.truncate;

@Repository
public class DeadLetterRepository {
    private static final Logger log = LoggerFactory.getLogger(DeadLetterRepository.class);
    private static final TypeReference<Map<String, Object>> MAP_OBJECT = new TypeReference<>() {};

    private final NamedParameterJdbcTemplate jdbc;
    private final ObjectMapper objectMapper;

    public DeadLetterRepository(NamedParameterJdbcTemplate jdbc, ObjectMapper objectMapper) {
        this.jdbc = jdbc;
        this.objectMapper = objectMapper;
    }

    public void insert(DeadLetterRecord record) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("jobId", record.jobId())
            .addValue("queue", record.queue())
            .addValue("attempts", record.attempts())
            .addValue("email", record.email())
            .addValue("mxHost", record.mxHost())
            .addValue("errorType", truncate(record.errorType(), 255))
            .addValue("errorMessage", truncate(record.errorMessage(), 4000))
            .addValue("stackTrace", truncate(record.stackTrace(), 100_000))
            .addValue("meta", writeMeta(record.meta()))
            .addValue("createdAt", toTimestamp(record.createdAt() == null ? Instant.now() : record.createdAt()));
        jdbc.update(
            """
                INSERT INTO dead_letters (
                    job_id, queue, attempts, email, mx_host, error_type, error_message, stack_trace, meta_json, created_at
                )
                VALUES (
                    :jobId, :queue, :attempts, :email, :mxHost, :errorType, :errorMessage, :stackTrace, :meta, :createdAt
                )
                """,
            params
        );
    }

    /**
     * Keeps only the newest {@code retention} records.
     */
    public int trim(int retention) {
        return jdbc.update(
            """
                DELETE FROM dead_letters
                WHERE id NOT IN (
                    SELECT id FROM (
                        SELECT id
                        FROM dead_letters
                        ORDER BY id DESC
                        LIMIT :retention
                    ) newest
                )
                """,
            new MapSqlParameterSource().addValue("retention", Math.max(1, retention))
        );
    }

    public List<DeadLetterRecord> findRecent(int limit) {
        int safeLimit = Math.max(1, Math.min(limit, 500));
        return jdbc.query(
            """
                SELECT id, job_id, queue, attempts, email, mx_host, error_type, error_message,
                       stack_trace, meta_json, created_at
                FROM dead_letters
                ORDER BY id DESC
                LIMIT :limit
                """,
            new MapSqlParameterSource().addValue("limit", safeLimit),
            (rs, rowNum) -> new DeadLetterRecord(
                rs.getLong("id"),
                rs.getObject("job_id") == null ? null : rs.getLong("job_id"),
                rs.getString("queue"),
                rs.getInt("attempts"),
                rs.getString("email"),
                rs.getString("mx_host"),
                rs.getString("error_type"),
                rs.getString("error_message"),
                rs.getString("stack_trace"),
                readMeta(rs.getString("meta_json")),
                toInstant(rs.getTimestamp("created_at"))
            )
        );
    }

    private String writeMeta(Map<String, Object> meta) {
        if (meta == null || meta.isEmpty()) {
            return null;
        }
        try {
            return objectMapper.writeValueAsString(meta);
        } catch (JsonProcessingException e) {
            log.warn("Failed to serialize dead-letter meta", e);
            return null;
        }
    }

    private Map<String, Object> readMeta(String raw) {
        if (raw == null || raw.isBlank()) {
            return Map.of();
        }
        try {
            return objectMapper.readValue(raw, MAP_OBJECT);
        } catch (JsonProcessingException e) {
            log.warn("Failed to parse dead-letter meta", e);
            return Map.of();
        }
    }
}
