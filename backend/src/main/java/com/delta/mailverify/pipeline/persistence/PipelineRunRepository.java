package com.delta.mailverify.pipeline.persistence;

import com.delta.mailverify.pipeline.model.CompanyRecord;
import com.delta.mailverify.pipeline.model.EmailRecord;
import com.delta.mailverify.pipeline.model.PersonRecord;
import com.delta.mailverify.pipeline.model.PipelineRun;
import com.delta.mailverify.pipeline.model.RunStatus;
import com.delta.mailverify.pipeline.model.VerificationCounts;
import com.delta.mailverify.verify.persistence.DatabaseDialect;
import com.delta.mailverify.verify.util.PatternCatalog.NameExample;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.jdbc.support.GeneratedKeyHolder;
import org.springframework.jdbc.support.KeyHolder;
import org.springframework.stereotype.Repository;

import java.sql.Types;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static com.delta.mailverify.verify.persistence.DatabaseDialect.toInstant;
import static com.delta.mailverify.verify.persistence.DatabaseDialect.toTimestamp;
import static com.delta.mailverify.verify.persistence.DatabaseDialect.truncate;

@Repository
public class PipelineRunRepository {
    private static final Logger log = LoggerFactory.getLogger(PipelineRunRepository.class);
    private static final TypeReference<Map<String, Object>> MAP_OBJECT = new TypeReference<>() {};
    private static final TypeReference<List<String>> LIST_STRING = new TypeReference<>() {};

    public static final String SOURCE_CRAWL = "crawl";
    public static final String SOURCE_GENERATED = "generated";

    private final NamedParameterJdbcTemplate jdbc;
    private final ObjectMapper objectMapper;
    private final boolean postgres;

    public PipelineRunRepository(NamedParameterJdbcTemplate jdbc, ObjectMapper objectMapper) {
        this.jdbc = jdbc;
        this.objectMapper = objectMapper;
        this.postgres = DatabaseDialect.detectPostgres(jdbc);
    }

    public boolean isDbReachable() {
        Integer value = jdbc.getJdbcTemplate().queryForObject("SELECT 1", Integer.class);
        return value != null && value == 1;
    }

    // runs

    public long createRun(String tenantId, List<String> domains, Map<String, Object> options) {
        Instant now = Instant.now();
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("tenantId", tenantId)
            .addValue("status", RunStatus.QUEUED)
            .addValue("domains", writeJson(domains))
            .addValue("options", writeJson(options))
            .addValue("now", toTimestamp(now));
        KeyHolder keyHolder = new GeneratedKeyHolder();
        jdbc.update(
            """
                INSERT INTO pipeline_runs (tenant_id, status, domains_json, options_json, created_at, updated_at)
                VALUES (:tenantId, :status, :domains, :options, :now, :now)
                """,
            params,
            keyHolder,
            new String[]{"id"}
        );
        Number key = keyHolder.getKey();
        if (key == null) {
            throw new IllegalStateException("Failed to create pipeline run");
        }
        return key.longValue();
    }

    public void markRunning(long runId) {
        Instant now = Instant.now();
        jdbc.update(
            """
                UPDATE pipeline_runs
                SET status = :status,
                    started_at = :now,
                    updated_at = :now
                WHERE id = :runId
                """,
            new MapSqlParameterSource()
                .addValue("runId", runId)
                .addValue("status", RunStatus.RUNNING)
                .addValue("now", toTimestamp(now))
        );
    }

    public void updateDomains(long runId, List<String> domains) {
        jdbc.update(
            "UPDATE pipeline_runs SET domains_json = :domains, updated_at = :now WHERE id = :runId",
            new MapSqlParameterSource()
                .addValue("runId", runId)
                .addValue("domains", writeJson(domains))
                .addValue("now", toTimestamp(Instant.now()))
        );
    }

    public void updateProgress(long runId, Map<String, Object> progress) {
        jdbc.update(
            "UPDATE pipeline_runs SET progress_json = :progress, updated_at = :now WHERE id = :runId",
            new MapSqlParameterSource()
                .addValue("runId", runId)
                .addValue("progress", writeJson(progress))
                .addValue("now", toTimestamp(Instant.now()))
        );
    }

    /**
     * Moves a run to a terminal status. Runs already terminal are left alone.
     */
    public boolean finishRun(long runId, String status, String error, Map<String, Object> progress) {
        Instant now = Instant.now();
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("runId", runId)
            .addValue("status", status)
            .addValue("error", truncate(error, 4000))
            .addValue("progress", progress == null ? null : writeJson(progress))
            .addValue("now", toTimestamp(now));
        return jdbc.update(
            """
                UPDATE pipeline_runs
                SET status = :status,
                    error = :error,
                    progress_json = COALESCE(:progress, progress_json),
                    finished_at = :now,
                    updated_at = :now
                WHERE id = :runId
                  AND status IN ('queued', 'running')
                """,
            params
        ) == 1;
    }

    public Optional<PipelineRun> findRun(long runId) {
        return jdbc.query(
            """
                SELECT id, tenant_id, status, domains_json, options_json, progress_json, error,
                       created_at, started_at, finished_at
                FROM pipeline_runs
                WHERE id = :runId
                """,
            new MapSqlParameterSource().addValue("runId", runId),
            (rs, rowNum) -> new PipelineRun(
                rs.getLong("id"),
                rs.getString("tenant_id"),
                rs.getString("status"),
                readList(rs.getString("domains_json")),
                readMap(rs.getString("options_json")),
                readMap(rs.getString("progress_json")),
                rs.getString("error"),
                toInstant(rs.getTimestamp("created_at")),
                toInstant(rs.getTimestamp("started_at")),
                toInstant(rs.getTimestamp("finished_at"))
            )
        ).stream().findFirst();
    }

    public List<Long> findRunningStartedBefore(Instant cutoff) {
        return jdbc.queryForList(
            """
                SELECT id
                FROM pipeline_runs
                WHERE status = 'running'
                  AND COALESCE(started_at, created_at) < :cutoff
                ORDER BY id
                """,
            new MapSqlParameterSource().addValue("cutoff", toTimestamp(cutoff)),
            Long.class
        );
    }

    /**
     * Domain counts of the tenant's runs created since {@code since}, excluding one run.
     */
    public List<List<String>> findRecentRunDomains(String tenantId, Instant since, Long excludeRunId) {
        return jdbc.query(
            """
                SELECT domains_json
                FROM pipeline_runs
                WHERE tenant_id = :tenantId
                  AND created_at >= :since
                  AND (:excludeRunId IS NULL OR id <> :excludeRunId)
                """,
            new MapSqlParameterSource()
                .addValue("tenantId", tenantId)
                .addValue("since", toTimestamp(since))
                .addValue("excludeRunId", excludeRunId, Types.BIGINT),
            (rs, rowNum) -> readList(rs.getString("domains_json"))
        );
    }

    // activity

    public void insertActivity(String tenantId, String action, Long runId, Map<String, Object> metadata) {
        jdbc.update(
            """
                INSERT INTO user_activity (tenant_id, action, run_id, metadata_json, created_at)
                VALUES (:tenantId, :action, :runId, :metadata, :now)
                """,
            new MapSqlParameterSource()
                .addValue("tenantId", tenantId)
                .addValue("action", action)
                .addValue("runId", runId)
                .addValue("metadata", writeJson(metadata))
                .addValue("now", toTimestamp(Instant.now()))
        );
    }

    public List<Map<String, Object>> findActivityMetadata(String tenantId, String action, Instant since, Long excludeRunId) {
        return jdbc.query(
            """
                SELECT metadata_json
                FROM user_activity
                WHERE tenant_id = :tenantId
                  AND action = :action
                  AND created_at >= :since
                  AND (:excludeRunId IS NULL OR run_id IS NULL OR run_id <> :excludeRunId)
                ORDER BY id
                """,
            new MapSqlParameterSource()
                .addValue("tenantId", tenantId)
                .addValue("action", action)
                .addValue("since", toTimestamp(since))
                .addValue("excludeRunId", excludeRunId, Types.BIGINT),
            (rs, rowNum) -> readMap(rs.getString("metadata_json"))
        );
    }

    // companies, people, emails

    public long ensureCompany(String tenantId, String domain, String name) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("tenantId", tenantId)
            .addValue("domain", domain)
            .addValue("name", name == null ? domain : name)
            .addValue("now", toTimestamp(Instant.now()));
        try {
            jdbc.update(
                """
                    INSERT INTO companies (tenant_id, name, domain, created_at, updated_at)
                    SELECT :tenantId, :name, :domain, :now, :now
                    WHERE NOT EXISTS (
                        SELECT 1 FROM companies WHERE tenant_id = :tenantId AND domain = :domain
                    )
                    """,
                params
            );
        } catch (DuplicateKeyException e) {
            log.debug("Company {} for tenant {} created concurrently", domain, tenantId);
        }
        Long id = jdbc.queryForObject(
            "SELECT id FROM companies WHERE tenant_id = :tenantId AND domain = :domain",
            params,
            Long.class
        );
        if (id == null) {
            throw new IllegalStateException("Company row missing for " + domain);
        }
        return id;
    }

    public Optional<CompanyRecord> findCompany(long companyId) {
        return jdbc.query(
            "SELECT id, tenant_id, name, domain FROM companies WHERE id = :id",
            new MapSqlParameterSource().addValue("id", companyId),
            (rs, rowNum) -> new CompanyRecord(
                rs.getLong("id"),
                rs.getString("tenant_id"),
                rs.getString("name"),
                rs.getString("domain")
            )
        ).stream().findFirst();
    }

    public long upsertPerson(long companyId, String fullName, String firstName, String lastName, String title, String sourceUrl) {
        Instant now = Instant.now();
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("companyId", companyId)
            .addValue("fullName", truncate(fullName, 512))
            .addValue("firstName", truncate(firstName, 255))
            .addValue("lastName", truncate(lastName, 255))
            .addValue("title", truncate(title, 512))
            .addValue("sourceUrl", truncate(sourceUrl, 2048))
            .addValue("now", toTimestamp(now));
        if (postgres) {
            Long id = jdbc.queryForObject(
                """
                    INSERT INTO people (company_id, full_name, first_name, last_name, title, source_url, created_at, updated_at)
                    VALUES (:companyId, :fullName, :firstName, :lastName, :title, :sourceUrl, :now, :now)
                    ON CONFLICT (company_id, full_name)
                    DO UPDATE SET
                        first_name = COALESCE(EXCLUDED.first_name, people.first_name),
                        last_name = COALESCE(EXCLUDED.last_name, people.last_name),
                        title = COALESCE(EXCLUDED.title, people.title),
                        source_url = COALESCE(EXCLUDED.source_url, people.source_url),
                        updated_at = EXCLUDED.updated_at
                    RETURNING id
                    """,
                params,
                Long.class
            );
            return id == null ? 0L : id;
        }
        jdbc.update(
            """
                MERGE INTO people p
                USING (
                    SELECT CAST(:companyId AS BIGINT) AS company_id,
                           CAST(:fullName AS VARCHAR(512)) AS full_name
                ) src
                ON p.company_id = src.company_id AND p.full_name = src.full_name
                WHEN MATCHED THEN UPDATE SET
                    first_name = COALESCE(:firstName, p.first_name),
                    last_name = COALESCE(:lastName, p.last_name),
                    title = COALESCE(:title, p.title),
                    source_url = COALESCE(:sourceUrl, p.source_url),
                    updated_at = :now
                WHEN NOT MATCHED THEN INSERT (company_id, full_name, first_name, last_name, title, source_url, created_at, updated_at)
                    VALUES (:companyId, :fullName, :firstName, :lastName, :title, :sourceUrl, :now, :now)
                """,
            params
        );
        Long id = jdbc.queryForObject(
            "SELECT id FROM people WHERE company_id = :companyId AND full_name = :fullName",
            params,
            Long.class
        );
        return id == null ? 0L : id;
    }

    public List<PersonRecord> findPeopleForCompany(long companyId) {
        return jdbc.query(
            """
                SELECT id, company_id, full_name, first_name, last_name
                FROM people
                WHERE company_id = :companyId
                ORDER BY id
                """,
            new MapSqlParameterSource().addValue("companyId", companyId),
            (rs, rowNum) -> new PersonRecord(
                rs.getLong("id"),
                rs.getLong("company_id"),
                rs.getString("full_name"),
                rs.getString("first_name"),
                rs.getString("last_name")
            )
        );
    }

    public Optional<PersonRecord> findPerson(long personId) {
        return jdbc.query(
            "SELECT id, company_id, full_name, first_name, last_name FROM people WHERE id = :id",
            new MapSqlParameterSource().addValue("id", personId),
            (rs, rowNum) -> new PersonRecord(
                rs.getLong("id"),
                rs.getLong("company_id"),
                rs.getString("full_name"),
                rs.getString("first_name"),
                rs.getString("last_name")
            )
        ).stream().findFirst();
    }

    public record EmailInsert(long id, boolean created) {}

    /**
     * Inserts the address unless it already exists. Existing rows keep their original owner.
     */
    public EmailInsert insertEmailIfAbsent(
        Long personId,
        Long companyId,
        Long runId,
        String email,
        String domain,
        String source,
        String sourceUrl,
        String pattern
    ) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("personId", personId)
            .addValue("companyId", companyId)
            .addValue("runId", runId)
            .addValue("email", email)
            .addValue("domain", domain)
            .addValue("source", source)
            .addValue("sourceUrl", truncate(sourceUrl, 2048))
            .addValue("pattern", pattern)
            .addValue("now", toTimestamp(Instant.now()));
        int inserted = 0;
        try {
            inserted = jdbc.update(
                """
                    INSERT INTO emails (person_id, company_id, run_id, email, domain, source, source_url, pattern, created_at, updated_at)
                    SELECT :personId, :companyId, :runId, :email, :domain, :source, :sourceUrl, :pattern, :now, :now
                    WHERE NOT EXISTS (SELECT 1 FROM emails WHERE email = :email)
                    """,
                params
            );
        } catch (DuplicateKeyException e) {
            log.debug("Email {} inserted concurrently", email);
        }
        Long id = jdbc.queryForObject("SELECT id FROM emails WHERE email = :email", params, Long.class);
        if (id == null) {
            throw new IllegalStateException("Email row missing for " + email);
        }
        return new EmailInsert(id, inserted == 1);
    }

    public List<NameExample> findNameExamples(String domain, int limit) {
        return jdbc.query(
            """
                SELECT p.first_name, p.last_name, p.full_name, e.email
                FROM emails e
                JOIN people p ON p.id = e.person_id
                WHERE e.domain = :domain
                  AND e.source = 'crawl'
                ORDER BY e.id
                LIMIT :limit
                """,
            new MapSqlParameterSource()
                .addValue("domain", domain)
                .addValue("limit", Math.max(1, limit)),
            (rs, rowNum) -> {
                String email = rs.getString("email");
                int at = email.lastIndexOf('@');
                String first = rs.getString("first_name");
                String last = rs.getString("last_name");
                if ((first == null || last == null) && rs.getString("full_name") != null) {
                    String[] tokens = rs.getString("full_name").trim().split("\\s+");
                    first = first == null ? tokens[0] : first;
                    last = last == null && tokens.length > 1 ? tokens[tokens.length - 1] : last;
                }
                return new NameExample(first, last, at < 0 ? email : email.substring(0, at));
            }
        );
    }

    /**
     * Addresses of a company that have no verification result yet.
     */
    public List<EmailRecord> findUnverifiedEmails(long companyId, boolean onlySourced) {
        return jdbc.query(
            """
                SELECT e.id, e.person_id, e.company_id, e.email, e.domain, e.source
                FROM emails e
                WHERE e.company_id = :companyId
                  AND (:onlySourced = FALSE OR e.source = 'crawl')
                  AND NOT EXISTS (
                      SELECT 1 FROM verification_results vr WHERE vr.email = e.email
                  )
                ORDER BY e.id
                """,
            new MapSqlParameterSource()
                .addValue("companyId", companyId)
                .addValue("onlySourced", onlySourced),
            (rs, rowNum) -> new EmailRecord(
                rs.getLong("id"),
                rs.getObject("person_id") == null ? null : rs.getLong("person_id"),
                rs.getObject("company_id") == null ? null : rs.getLong("company_id"),
                rs.getString("email"),
                rs.getString("domain"),
                rs.getString("source")
            )
        );
    }

    // stats

    public long countPeople(long companyId) {
        Long count = jdbc.queryForObject(
            "SELECT COUNT(*) FROM people WHERE company_id = :companyId",
            new MapSqlParameterSource().addValue("companyId", companyId),
            Long.class
        );
        return count == null ? 0 : count;
    }

    public long countEmails(long companyId) {
        Long count = jdbc.queryForObject(
            "SELECT COUNT(*) FROM emails WHERE company_id = :companyId",
            new MapSqlParameterSource().addValue("companyId", companyId),
            Long.class
        );
        return count == null ? 0 : count;
    }

    public VerificationCounts countVerificationsForCompany(long companyId) {
        List<VerificationCounts> rows = jdbc.query(
            """
                SELECT COUNT(*) AS total,
                       SUM(CASE WHEN vr.verify_status = 'valid' THEN 1 ELSE 0 END) AS valid_count,
                       SUM(CASE WHEN vr.verify_status = 'invalid' THEN 1 ELSE 0 END) AS invalid_count,
                       SUM(CASE WHEN vr.verify_status = 'risky_catch_all' THEN 1 ELSE 0 END) AS risky_count,
                       SUM(CASE WHEN vr.verify_status = 'unknown_timeout' THEN 1 ELSE 0 END) AS timeout_count
                FROM verification_results vr
                JOIN emails e ON e.email = vr.email
                WHERE e.company_id = :companyId
                """,
            new MapSqlParameterSource().addValue("companyId", companyId),
            (rs, rowNum) -> new VerificationCounts(
                rs.getLong("total"),
                rs.getLong("valid_count"),
                rs.getLong("invalid_count"),
                rs.getLong("risky_count"),
                rs.getLong("timeout_count")
            )
        );
        return rows.isEmpty() ? VerificationCounts.empty() : rows.get(0);
    }

    // cleanup

    /**
     * Deletes generated addresses of a run whose result is invalid, and optionally those never
     * verified. Rows with test-send history are kept as delivery evidence.
     */
    public int deleteGeneratedEmails(long runId, boolean includeUnverified) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("runId", runId)
            .addValue("includeUnverified", includeUnverified);
        List<String> emails = jdbc.queryForList(
            """
                SELECT e.email
                FROM emails e
                LEFT JOIN verification_results vr ON vr.email = e.email
                WHERE e.run_id = :runId
                  AND e.source = 'generated'
                  AND (
                      (vr.id IS NOT NULL AND vr.verify_status = 'invalid' AND vr.test_send_status = 'not_requested')
                      OR (:includeUnverified = TRUE AND vr.id IS NULL)
                  )
                """,
            params,
            String.class
        );
        if (emails.isEmpty()) {
            return 0;
        }
        MapSqlParameterSource deleteParams = new MapSqlParameterSource().addValue("emails", emails);
        jdbc.update("DELETE FROM verification_results WHERE email IN (:emails)", deleteParams);
        return jdbc.update("DELETE FROM emails WHERE email IN (:emails)", deleteParams);
    }

    private String writeJson(Object value) {
        if (value == null) {
            return null;
        }
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Value is not serializable", e);
        }
    }

    private Map<String, Object> readMap(String json) {
        if (json == null || json.isBlank()) {
            return Map.of();
        }
        try {
            return objectMapper.readValue(json, MAP_OBJECT);
        } catch (JsonProcessingException e) {
            log.warn("Unreadable JSON column: {}", e.getOriginalMessage());
            return Map.of();
        }
    }

    private List<String> readList(String json) {
        if (json == null || json.isBlank()) {
            return List.of();
        }
        try {
            return objectMapper.readValue(json, LIST_STRING);
        } catch (JsonProcessingException e) {
            log.warn("Unreadable JSON list column: {}", e.getOriginalMessage());
            return List.of();
        }
    }
}
