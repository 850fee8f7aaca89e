package com.delta.mailverify.verify.gate;

import com.delta.mailverify.verify.persistence.DatabaseDialect;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Gate counters kept in the shared relational store so every worker process sees the same
 * holders. Increments are single conditional UPDATE statements; the row lock makes the
 * compare-and-increment atomic.
 */
public class JdbcConcurrencyGate implements ConcurrencyGate {
    private static final Logger log = LoggerFactory.getLogger(JdbcConcurrencyGate.class);
    private static final Duration RPS_WINDOW_TTL = Duration.ofSeconds(2);

    private final NamedParameterJdbcTemplate jdbc;
    private final Duration leaseTtl;
    private final Clock clock;
    private final boolean postgres;

    public JdbcConcurrencyGate(NamedParameterJdbcTemplate jdbc, Duration leaseTtl) {
        this(jdbc, leaseTtl, Clock.systemUTC());
    }

    public JdbcConcurrencyGate(NamedParameterJdbcTemplate jdbc, Duration leaseTtl, Clock clock) {
        this.jdbc = jdbc;
        this.leaseTtl = leaseTtl;
        this.clock = clock;
        this.postgres = DatabaseDialect.detectPostgres(jdbc);
    }

    @Override
    public boolean acquire(String key, int limit) {
        if (key == null || limit <= 0) {
            return false;
        }
        Instant now = clock.instant();
        ensureRow("gate_leases", "gate_key", "holders", key, now);
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("key", key)
            .addValue("limit", limit)
            .addValue("now", DatabaseDialect.toTimestamp(now))
            .addValue("expiresAt", DatabaseDialect.toTimestamp(now.plus(leaseTtl)));
        int updated = jdbc.update(
            """
                UPDATE gate_leases
                SET holders = CASE WHEN expires_at < :now THEN 1 ELSE holders + 1 END,
                    expires_at = :expiresAt
                WHERE gate_key = :key
                  AND (expires_at < :now OR holders < :limit)
                """,
            params
        );
        return updated == 1;
    }

    @Override
    public void release(String key) {
        if (key == null) {
            return;
        }
        jdbc.update(
            """
                UPDATE gate_leases
                SET holders = CASE WHEN holders > 0 THEN holders - 1 ELSE 0 END
                WHERE gate_key = :key
                """,
            new MapSqlParameterSource().addValue("key", key)
        );
    }

    @Override
    public boolean consumeRps(String key, int limit) {
        if (key == null || limit <= 0) {
            return false;
        }
        Instant now = clock.instant();
        String windowKey = key + ":" + now.getEpochSecond();
        boolean created = ensureRow("rate_windows", "window_key", "hits", windowKey, now.plus(RPS_WINDOW_TTL));
        if (created) {
            purgeExpiredWindows(now);
        }
        MapSqlParameterSource params = new MapSqlParameterSource().addValue("key", windowKey);
        List<Integer> hits;
        if (postgres) {
            hits = jdbc.query(
                """
                    UPDATE rate_windows
                    SET hits = hits + 1
                    WHERE window_key = :key
                    RETURNING hits
                    """,
                params,
                (rs, rowNum) -> rs.getInt("hits")
            );
        } else {
            hits = jdbc.query(
                """
                    SELECT hits
                    FROM FINAL TABLE (
                        UPDATE rate_windows
                        SET hits = hits + 1
                        WHERE window_key = :key
                    )
                    """,
                params,
                (rs, rowNum) -> rs.getInt("hits")
            );
        }
        return !hits.isEmpty() && hits.get(0) <= limit;
    }

    @Override
    public void refundRps(String key) {
        if (key == null) {
            return;
        }
        jdbc.update(
            """
                UPDATE rate_windows
                SET hits = hits - 1
                WHERE window_key = :key
                  AND hits > 0
                """,
            new MapSqlParameterSource().addValue("key", key + ":" + clock.instant().getEpochSecond())
        );
    }

    public int holders(String key) {
        List<Integer> rows = jdbc.query(
            """
                SELECT holders
                FROM gate_leases
                WHERE gate_key = :key
                  AND expires_at >= :now
                """,
            new MapSqlParameterSource()
                .addValue("key", key)
                .addValue("now", DatabaseDialect.toTimestamp(clock.instant())),
            (rs, rowNum) -> rs.getInt("holders")
        );
        return rows.isEmpty() ? 0 : rows.get(0);
    }

    private boolean ensureRow(String table, String keyColumn, String counterColumn, String key, Instant expiresAt) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("key", key)
            .addValue("expiresAt", DatabaseDialect.toTimestamp(expiresAt));
        if (postgres) {
            return jdbc.update(
                "INSERT INTO " + table + " (" + keyColumn + ", " + counterColumn + ", expires_at) "
                    + "VALUES (:key, 0, :expiresAt) ON CONFLICT (" + keyColumn + ") DO NOTHING",
                params
            ) > 0;
        }
        try {
            return jdbc.update(
                "INSERT INTO " + table + " (" + keyColumn + ", " + counterColumn + ", expires_at) "
                    + "SELECT :key, 0, :expiresAt "
                    + "WHERE NOT EXISTS (SELECT 1 FROM " + table + " WHERE " + keyColumn + " = :key)",
                params
            ) > 0;
        } catch (DuplicateKeyException e) {
            log.debug("Gate row {} in {} created concurrently", key, table);
            return false;
        }
    }

    private void purgeExpiredWindows(Instant now) {
        jdbc.update(
            """
                DELETE FROM rate_windows
                WHERE expires_at < :now
                """,
            new MapSqlParameterSource().addValue("now", DatabaseDialect.toTimestamp(now))
        );
    }
}
