package com.delta.mailverify.verify.persistence;

import com.delta.mailverify.verify.model.EscalationCandidate;
import com.delta.mailverify.verify.model.PersonIdentity;
import com.delta.mailverify.verify.model.TestSendHistoryRow;
import com.delta.mailverify.verify.model.TestSendStatus;
import com.delta.mailverify.verify.model.VerificationResultRow;
import com.delta.mailverify.verify.model.VerificationUpsert;
import com.delta.mailverify.verify.model.VerifyStatus;
import com.delta.mailverify.verify.smtp.ProbeOutcome;
import com.delta.mailverify.verify.util.VerificationReasonCodes;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

import static com.delta.mailverify.verify.persistence.DatabaseDialect.toInstant;
import static com.delta.mailverify.verify.persistence.DatabaseDialect.toTimestamp;
import static com.delta.mailverify.verify.persistence.DatabaseDialect.truncate;

@Repository
public class VerificationResultRepository {
    private static final String RESULT_COLUMNS = """
        id, email_id, email, domain, mx_host, probe_category, probe_code, verify_status, verify_reason,
        catch_all_status, fallback_status, test_send_status, test_send_token, test_send_at,
        bounce_code, bounce_reason, verified_at, updated_at
        """;

    private static final RowMapper<VerificationResultRow> RESULT_MAPPER = (rs, rowNum) -> new VerificationResultRow(
        rs.getLong("id"),
        rs.getObject("email_id") == null ? null : rs.getLong("email_id"),
        rs.getString("email"),
        rs.getString("domain"),
        rs.getString("mx_host"),
        rs.getString("probe_category"),
        rs.getObject("probe_code") == null ? null : rs.getInt("probe_code"),
        rs.getString("verify_status"),
        rs.getString("verify_reason"),
        rs.getString("catch_all_status"),
        rs.getString("fallback_status"),
        rs.getString("test_send_status"),
        rs.getString("test_send_token"),
        toInstant(rs.getTimestamp("test_send_at")),
        rs.getString("bounce_code"),
        rs.getString("bounce_reason"),
        toInstant(rs.getTimestamp("verified_at")),
        toInstant(rs.getTimestamp("updated_at"))
    );

    private static final List<String> EVIDENCE_REASONS = List.of(
        VerificationReasonCodes.HARD_BOUNCE_USER_UNKNOWN,
        VerificationReasonCodes.NO_BOUNCE_AFTER_TEST_SEND
    );

    private final NamedParameterJdbcTemplate jdbc;
    private final boolean postgres;

    public VerificationResultRepository(NamedParameterJdbcTemplate jdbc) {
        this.jdbc = jdbc;
        this.postgres = DatabaseDialect.detectPostgres(jdbc);
    }

    /**
     * Writes probe-derived columns for one email. Repeated or concurrent calls converge on a single
     * row; test-send columns are left untouched on update, and so is a status that delivery
     * evidence already decided.
     */
    public long upsertResult(VerificationUpsert upsert) {
        Instant now = Instant.now();
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("emailId", upsert.emailId())
            .addValue("email", upsert.email())
            .addValue("domain", upsert.domain())
            .addValue("mxHost", upsert.mxHost())
            .addValue("probeCategory", upsert.probeCategory())
            .addValue("probeCode", upsert.probeCode())
            .addValue("probeError", truncate(upsert.probeError(), 64))
            .addValue("verifyStatus", upsert.verifyStatus())
            .addValue("verifyReason", upsert.verifyReason())
            .addValue("catchAllStatus", upsert.catchAllStatus())
            .addValue("fallbackStatus", upsert.fallbackStatus())
            .addValue("fallbackRaw", truncate(upsert.fallbackRaw(), 4000))
            .addValue("verifiedAt", toTimestamp(upsert.verifiedAt()))
            .addValue("evidenceReasons", EVIDENCE_REASONS)
            .addValue("now", toTimestamp(now));
        if (postgres) {
            jdbc.update(
                """
                    INSERT INTO verification_results (
                        email_id, email, domain, mx_host, probe_category, probe_code, probe_error,
                        verify_status, verify_reason, catch_all_status, fallback_status, fallback_raw,
                        test_send_status, verified_at, created_at, updated_at
                    )
                    VALUES (
                        :emailId, :email, :domain, :mxHost, :probeCategory, :probeCode, :probeError,
                        :verifyStatus, :verifyReason, :catchAllStatus, :fallbackStatus, :fallbackRaw,
                        'not_requested', :verifiedAt, :now, :now
                    )
                    ON CONFLICT (email)
                    DO UPDATE SET
                        email_id = COALESCE(EXCLUDED.email_id, verification_results.email_id),
                        domain = EXCLUDED.domain,
                        mx_host = EXCLUDED.mx_host,
                        probe_category = EXCLUDED.probe_category,
                        probe_code = EXCLUDED.probe_code,
                        probe_error = EXCLUDED.probe_error,
                        verify_status = CASE WHEN verification_results.verify_reason IN (:evidenceReasons)
                            THEN verification_results.verify_status ELSE EXCLUDED.verify_status END,
                        verify_reason = CASE WHEN verification_results.verify_reason IN (:evidenceReasons)
                            THEN verification_results.verify_reason ELSE EXCLUDED.verify_reason END,
                        catch_all_status = EXCLUDED.catch_all_status,
                        fallback_status = EXCLUDED.fallback_status,
                        fallback_raw = EXCLUDED.fallback_raw,
                        verified_at = EXCLUDED.verified_at,
                        updated_at = EXCLUDED.updated_at
                    """,
                params
            );
        } else {
            jdbc.update(
                """
                    MERGE INTO verification_results t
                    USING (SELECT CAST(:email AS VARCHAR(320)) AS email) s
                    ON t.email = s.email
                    WHEN MATCHED THEN UPDATE SET
                        email_id = COALESCE(CAST(:emailId AS BIGINT), t.email_id),
                        domain = :domain,
                        mx_host = :mxHost,
                        probe_category = :probeCategory,
                        probe_code = :probeCode,
                        probe_error = :probeError,
                        verify_status = CASE WHEN t.verify_reason IN (:evidenceReasons)
                            THEN t.verify_status ELSE :verifyStatus END,
                        verify_reason = CASE WHEN t.verify_reason IN (:evidenceReasons)
                            THEN t.verify_reason ELSE :verifyReason END,
                        catch_all_status = :catchAllStatus,
                        fallback_status = :fallbackStatus,
                        fallback_raw = :fallbackRaw,
                        verified_at = :verifiedAt,
                        updated_at = :now
                    WHEN NOT MATCHED THEN INSERT (
                        email_id, email, domain, mx_host, probe_category, probe_code, probe_error,
                        verify_status, verify_reason, catch_all_status, fallback_status, fallback_raw,
                        test_send_status, verified_at, created_at, updated_at
                    )
                    VALUES (
                        :emailId, :email, :domain, :mxHost, :probeCategory, :probeCode, :probeError,
                        :verifyStatus, :verifyReason, :catchAllStatus, :fallbackStatus, :fallbackRaw,
                        'not_requested', :verifiedAt, :now, :now
                    )
                    """,
                params
            );
        }
        Long id = jdbc.queryForObject(
            "SELECT id FROM verification_results WHERE email = :email",
            params,
            Long.class
        );
        if (id == null) {
            throw new IllegalStateException("Failed to upsert verification result for " + upsert.email());
        }
        return id;
    }

    public void insertAttempt(Long jobId, String email, String domain, int attempt, ProbeOutcome outcome) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("jobId", jobId)
            .addValue("email", email)
            .addValue("domain", domain)
            .addValue("mxHost", outcome.mxHost())
            .addValue("attempt", attempt)
            .addValue("category", outcome.category().value())
            .addValue("code", outcome.code())
            .addValue("error", truncate(outcome.error(), 64))
            .addValue("elapsedMs", outcome.elapsedMs())
            .addValue("now", toTimestamp(Instant.now()));
        jdbc.update(
            """
                INSERT INTO verification_attempts (
                    job_id, email, domain, mx_host, attempt, category, code, error, elapsed_ms, created_at
                )
                VALUES (
                    :jobId, :email, :domain, :mxHost, :attempt, :category, :code, :error, :elapsedMs, :now
                )
                """,
            params
        );
    }

    public Optional<VerificationResultRow> findById(long id) {
        return jdbc.query(
            "SELECT " + RESULT_COLUMNS + " FROM verification_results WHERE id = :id",
            new MapSqlParameterSource().addValue("id", id),
            RESULT_MAPPER
        ).stream().findFirst();
    }

    public Optional<VerificationResultRow> findByEmail(String email) {
        return jdbc.query(
            "SELECT " + RESULT_COLUMNS + " FROM verification_results WHERE email = :email",
            new MapSqlParameterSource().addValue("email", email),
            RESULT_MAPPER
        ).stream().findFirst();
    }

    public Optional<VerificationResultRow> findByToken(String token) {
        if (token == null || token.isBlank()) {
            return Optional.empty();
        }
        return jdbc.query(
            "SELECT " + RESULT_COLUMNS + " FROM verification_results WHERE test_send_token = :token",
            new MapSqlParameterSource().addValue("token", token.trim()),
            RESULT_MAPPER
        ).stream().findFirst();
    }

    /**
     * Most recent outstanding test-send for a recipient address. Used only when a bounce carries no
     * recoverable token.
     */
    public Optional<VerificationResultRow> findLatestOutstandingByRecipient(String email) {
        return jdbc.query(
            "SELECT " + RESULT_COLUMNS + """
                FROM verification_results
                WHERE LOWER(email) = LOWER(:email)
                  AND test_send_status IN ('pending', 'sent')
                ORDER BY test_send_at DESC NULLS LAST, id DESC
                LIMIT 1
                """,
            new MapSqlParameterSource().addValue("email", email),
            RESULT_MAPPER
        ).stream().findFirst();
    }

    public List<VerificationResultRow> findByDomain(String domain) {
        return jdbc.query(
            "SELECT " + RESULT_COLUMNS + " FROM verification_results WHERE domain = :domain ORDER BY id",
            new MapSqlParameterSource().addValue("domain", domain),
            RESULT_MAPPER
        );
    }

    public List<TestSendHistoryRow> findTestSendHistory(String domain) {
        return jdbc.query(
            """
                SELECT email, test_send_status, bounce_code, bounce_reason
                FROM verification_results
                WHERE domain = :domain
                  AND test_send_status IS NOT NULL
                  AND test_send_status <> 'not_requested'
                ORDER BY id
                """,
            new MapSqlParameterSource().addValue("domain", domain),
            (rs, rowNum) -> new TestSendHistoryRow(
                rs.getString("email"),
                rs.getString("test_send_status"),
                rs.getString("bounce_code"),
                rs.getString("bounce_reason")
            )
        );
    }

    public List<String> findDomainsWithTestSendActivity() {
        return jdbc.queryForList(
            """
                SELECT DISTINCT domain
                FROM verification_results
                WHERE test_send_status IS NOT NULL
                  AND test_send_status <> 'not_requested'
                ORDER BY domain
                """,
            new MapSqlParameterSource(),
            String.class
        );
    }

    /**
     * Moves the row to {@code pending} unless another address of the same person at the same
     * domain already has a test-send outstanding. The person row is locked first so concurrent
     * requests for one person run one after the other.
     *
     * @return 1 when the row is now pending, 0 otherwise
     */
    @Transactional
    public int markTestSendRequested(long id, String token) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("id", id)
            .addValue("token", token)
            .addValue("now", toTimestamp(Instant.now()));
        findPersonForResult(id).ifPresent(person -> jdbc.queryForList(
            """
                SELECT id
                FROM people
                WHERE id = :personId
                FOR UPDATE
                """,
            new MapSqlParameterSource().addValue("personId", person.personId()),
            Long.class
        ));
        return jdbc.update(
            """
                UPDATE verification_results
                SET test_send_status = 'pending',
                    test_send_token = :token,
                    test_send_at = NULL,
                    updated_at = :now
                WHERE id = :id
                  AND (test_send_status IS NULL OR test_send_status IN ('not_requested', 'pending'))
                  AND NOT EXISTS (
                      SELECT 1
                      FROM emails mine
                      JOIN emails sibling
                        ON sibling.person_id = mine.person_id
                       AND sibling.domain = mine.domain
                      JOIN verification_results other ON other.email = sibling.email
                      WHERE mine.email = verification_results.email
                        AND other.id <> verification_results.id
                        AND other.test_send_status IN ('pending', 'sent')
                  )
                """,
            params
        );
    }

    public int markTestSendSent(long id, Instant sentAt) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("id", id)
            .addValue("sentAt", toTimestamp(sentAt))
            .addValue("now", toTimestamp(Instant.now()));
        return jdbc.update(
            """
                UPDATE verification_results
                SET test_send_status = 'sent',
                    test_send_at = :sentAt,
                    updated_at = :now
                WHERE id = :id
                  AND test_send_status = 'pending'
                """,
            params
        );
    }

    public int applyBounce(long id, boolean hard, String code, String reason, Instant bouncedAt) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("id", id)
            .addValue("status", hard ? TestSendStatus.BOUNCE_HARD : TestSendStatus.BOUNCE_SOFT)
            .addValue("code", truncate(code, 64))
            .addValue("reason", truncate(reason, 1000))
            .addValue("bouncedAt", toTimestamp(bouncedAt))
            .addValue("hard", hard)
            .addValue("invalid", VerifyStatus.INVALID)
            .addValue("invalidReason", VerificationReasonCodes.HARD_BOUNCE_USER_UNKNOWN)
            .addValue("now", toTimestamp(Instant.now()));
        return jdbc.update(
            """
                UPDATE verification_results
                SET test_send_status = :status,
                    bounce_code = :code,
                    bounce_reason = :reason,
                    bounced_at = :bouncedAt,
                    verify_status = CASE WHEN :hard THEN :invalid ELSE verify_status END,
                    verify_reason = CASE WHEN :hard THEN :invalidReason ELSE verify_reason END,
                    updated_at = :now
                WHERE id = :id
                  AND test_send_status IN ('pending', 'sent')
                """,
            params
        );
    }

    public List<String> findDomainsWithStaleSends(Instant cutoff) {
        return jdbc.queryForList(
            """
                SELECT DISTINCT domain
                FROM verification_results
                WHERE test_send_status = 'sent'
                  AND test_send_at <= :cutoff
                """,
            new MapSqlParameterSource().addValue("cutoff", toTimestamp(cutoff)),
            String.class
        );
    }

    /**
     * Ages out {@code sent} rows older than the cutoff. Rows whose verify status was still
     * ambiguous (or unset) are upgraded to valid in the same pass.
     *
     * @return number of rows moved to delivered_assumed
     */
    public int assumeDeliveredBefore(Instant cutoff) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("cutoff", toTimestamp(cutoff))
            .addValue("valid", VerifyStatus.VALID)
            .addValue("reason", VerificationReasonCodes.NO_BOUNCE_AFTER_TEST_SEND)
            .addValue("now", toTimestamp(Instant.now()));
        int upgraded = jdbc.update(
            """
                UPDATE verification_results
                SET test_send_status = 'delivered_assumed',
                    verify_status = :valid,
                    verify_reason = :reason,
                    updated_at = :now
                WHERE test_send_status = 'sent'
                  AND test_send_at <= :cutoff
                  AND (verify_status IS NULL OR verify_status IN ('unknown_timeout', 'risky_catch_all'))
                """,
            params
        );
        int aged = jdbc.update(
            """
                UPDATE verification_results
                SET test_send_status = 'delivered_assumed',
                    updated_at = :now
                WHERE test_send_status = 'sent'
                  AND test_send_at <= :cutoff
                """,
            params
        );
        return upgraded + aged;
    }

    public int upgradeRiskyToValid(long id) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("id", id)
            .addValue("valid", VerifyStatus.VALID)
            .addValue("reason", VerificationReasonCodes.NO_BOUNCE_AFTER_TEST_SEND)
            .addValue("now", toTimestamp(Instant.now()));
        return jdbc.update(
            """
                UPDATE verification_results
                SET verify_status = :valid,
                    verify_reason = :reason,
                    updated_at = :now
                WHERE id = :id
                  AND verify_status = 'risky_catch_all'
                  AND test_send_status IN ('sent', 'delivered_assumed')
                """,
            params
        );
    }

    public Optional<PersonIdentity> findPersonForResult(long resultId) {
        return jdbc.query(
            """
                SELECT p.id AS person_id, p.first_name, p.last_name, p.full_name, e.domain
                FROM verification_results vr
                JOIN emails e ON e.email = vr.email
                JOIN people p ON p.id = e.person_id
                WHERE vr.id = :resultId
                """,
            new MapSqlParameterSource().addValue("resultId", resultId),
            (rs, rowNum) -> new PersonIdentity(
                rs.getLong("person_id"),
                rs.getString("first_name"),
                rs.getString("last_name"),
                rs.getString("full_name"),
                rs.getString("domain")
            )
        ).stream().findFirst();
    }

    public List<EscalationCandidate> findCandidatesForPerson(long personId, String domain) {
        return jdbc.query(
            """
                SELECT vr.id AS result_id, e.id AS email_id, e.email, vr.verify_status, vr.test_send_status
                FROM emails e
                JOIN verification_results vr ON vr.email = e.email
                WHERE e.person_id = :personId
                  AND e.domain = :domain
                ORDER BY e.id
                """,
            new MapSqlParameterSource()
                .addValue("personId", personId)
                .addValue("domain", domain),
            (rs, rowNum) -> new EscalationCandidate(
                rs.getLong("result_id"),
                rs.getLong("email_id"),
                rs.getString("email"),
                rs.getString("verify_status"),
                rs.getString("test_send_status")
            )
        );
    }

    public boolean hasOutstandingTestSend(long personId, String domain) {
        Long count = jdbc.queryForObject(
            """
                SELECT COUNT(*)
                FROM emails e
                JOIN verification_results vr ON vr.email = e.email
                WHERE e.person_id = :personId
                  AND e.domain = :domain
                  AND vr.test_send_status IN ('pending', 'sent')
                """,
            new MapSqlParameterSource()
                .addValue("personId", personId)
                .addValue("domain", domain),
            Long.class
        );
        return count != null && count > 0;
    }
}
