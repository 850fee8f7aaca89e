package com.delta.mailverify.verify.persistence;

import com.delta.mailverify.verify.model.DeliveryEvidence;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.Optional;

import static com.delta.mailverify.verify.persistence.DatabaseDialect.toInstant;
import static com.delta.mailverify.verify.persistence.DatabaseDialect.toTimestamp;

@Repository
public class DomainEvidenceRepository {
    private final NamedParameterJdbcTemplate jdbc;
    private final boolean postgres;

    public DomainEvidenceRepository(NamedParameterJdbcTemplate jdbc) {
        this.jdbc = jdbc;
        this.postgres = DatabaseDialect.detectPostgres(jdbc);
    }

    public record CatchAllProbeRecord(String domain, String status, String mxHost, Integer rcptCode, Instant checkedAt) {}

    public Optional<CatchAllProbeRecord> findCatchAllProbe(String domain) {
        return jdbc.query(
            """
                SELECT domain, status, mx_host, rcpt_code, checked_at
                FROM domain_catch_all
                WHERE domain = :domain
                """,
            new MapSqlParameterSource().addValue("domain", domain),
            (rs, rowNum) -> new CatchAllProbeRecord(
                rs.getString("domain"),
                rs.getString("status"),
                rs.getString("mx_host"),
                rs.getObject("rcpt_code") == null ? null : rs.getInt("rcpt_code"),
                toInstant(rs.getTimestamp("checked_at"))
            )
        ).stream().findFirst();
    }

    public void upsertCatchAllProbe(
        String domain,
        String status,
        String mxHost,
        Integer rcptCode,
        String localPart,
        Instant checkedAt
    ) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("domain", domain)
            .addValue("status", status)
            .addValue("mxHost", mxHost)
            .addValue("rcptCode", rcptCode)
            .addValue("localPart", localPart)
            .addValue("checkedAt", toTimestamp(checkedAt));
        if (postgres) {
            jdbc.update(
                """
                    INSERT INTO domain_catch_all (domain, status, mx_host, rcpt_code, local_part, checked_at)
                    VALUES (:domain, :status, :mxHost, :rcptCode, :localPart, :checkedAt)
                    ON CONFLICT (domain)
                    DO UPDATE SET
                        status = EXCLUDED.status,
                        mx_host = EXCLUDED.mx_host,
                        rcpt_code = EXCLUDED.rcpt_code,
                        local_part = EXCLUDED.local_part,
                        checked_at = EXCLUDED.checked_at
                    """,
                params
            );
            return;
        }
        jdbc.update(
            """
                MERGE INTO domain_catch_all (domain, status, mx_host, rcpt_code, local_part, checked_at)
                KEY(domain)
                VALUES (:domain, :status, :mxHost, :rcptCode, :localPart, :checkedAt)
                """,
            params
        );
    }

    public Optional<String> findDeliveryCatchAllStatus(String domain) {
        return jdbc.queryForList(
            """
                SELECT delivery_catchall_status
                FROM domain_delivery_evidence
                WHERE domain = :domain
                """,
            new MapSqlParameterSource().addValue("domain", domain),
            String.class
        ).stream().findFirst();
    }

    public void saveDeliveryEvidence(DeliveryEvidence evidence, String status, Instant computedAt) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("domain", evidence.domain())
            .addValue("good", evidence.hasGoodReal())
            .addValue("bad", evidence.hasBadInvalid())
            .addValue("status", status)
            .addValue("computedAt", toTimestamp(computedAt));
        if (postgres) {
            jdbc.update(
                """
                    INSERT INTO domain_delivery_evidence (
                        domain, has_good_real, has_bad_invalid, delivery_catchall_status, computed_at
                    )
                    VALUES (:domain, :good, :bad, :status, :computedAt)
                    ON CONFLICT (domain)
                    DO UPDATE SET
                        has_good_real = EXCLUDED.has_good_real,
                        has_bad_invalid = EXCLUDED.has_bad_invalid,
                        delivery_catchall_status = EXCLUDED.delivery_catchall_status,
                        computed_at = EXCLUDED.computed_at
                    """,
                params
            );
            return;
        }
        jdbc.update(
            """
                MERGE INTO domain_delivery_evidence (
                    domain, has_good_real, has_bad_invalid, delivery_catchall_status, computed_at
                )
                KEY(domain)
                VALUES (:domain, :good, :bad, :status, :computedAt)
                """,
            params
        );
    }
}
