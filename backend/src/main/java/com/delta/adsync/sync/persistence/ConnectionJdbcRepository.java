package com.delta.adsync.sync.persistence;

import com.delta.adsync.sync.model.AdAccount;
import com.delta.adsync.sync.model.ConnectionStatus;
import com.delta.adsync.sync.model.PlatformConnection;
import com.delta.adsync.sync.model.StoredToken;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.jdbc.support.GeneratedKeyHolder;
import org.springframework.jdbc.support.KeyHolder;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import static com.delta.adsync.sync.persistence.JdbcSupport.nullableLong;
import static com.delta.adsync.sync.persistence.JdbcSupport.toInstant;
import static com.delta.adsync.sync.persistence.JdbcSupport.toTimestamp;
import static com.delta.adsync.sync.persistence.JdbcSupport.truncate;

@Repository
public class ConnectionJdbcRepository {
    private static final Logger log = LoggerFactory.getLogger(ConnectionJdbcRepository.class);
    private static final String CONNECTION_COLUMNS = """
        id,
        tenant_id,
        platform,
        access_token_ciphertext,
        token_encrypted,
        token_expires_at,
        long_lived_token,
        granted_scopes,
        status,
        consecutive_auth_failures,
        last_error,
        last_validated_at,
        is_default,
        created_at
        """;
    private static final String ACCOUNT_COLUMNS = """
        id,
        tenant_id,
        external_account_id,
        name,
        currency,
        timezone_name,
        account_status,
        primary_connection_id
        """;

    private final NamedParameterJdbcTemplate jdbc;
    private final boolean postgres;

    public ConnectionJdbcRepository(NamedParameterJdbcTemplate jdbc) {
        this.jdbc = jdbc;
        this.postgres = JdbcSupport.detectPostgres(jdbc);
    }

    public long insertConnection(
        String tenantId,
        String platform,
        StoredToken token,
        Instant tokenExpiresAt,
        boolean longLivedToken,
        List<String> grantedScopes,
        ConnectionStatus status,
        boolean isDefault,
        Instant now
    ) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("tenantId", tenantId)
            .addValue("platform", platform)
            .addValue("ciphertext", token.value())
            .addValue("encrypted", token.encrypted())
            .addValue("expiresAt", toTimestamp(tokenExpiresAt))
            .addValue("longLived", longLivedToken)
            .addValue("scopes", grantedScopes == null || grantedScopes.isEmpty() ? null : String.join(",", grantedScopes))
            .addValue("status", status.dbValue())
            .addValue("isDefault", isDefault)
            .addValue("now", toTimestamp(now));
        KeyHolder keyHolder = new GeneratedKeyHolder();
        jdbc.update(
            """
                INSERT INTO platform_connections (
                    tenant_id,
                    platform,
                    access_token_ciphertext,
                    token_encrypted,
                    token_expires_at,
                    long_lived_token,
                    granted_scopes,
                    status,
                    consecutive_auth_failures,
                    last_validated_at,
                    is_default,
                    created_at,
                    updated_at
                )
                VALUES (
                    :tenantId,
                    :platform,
                    :ciphertext,
                    :encrypted,
                    :expiresAt,
                    :longLived,
                    :scopes,
                    :status,
                    0,
                    :now,
                    :isDefault,
                    :now,
                    :now
                )
                """,
            params,
            keyHolder,
            new String[]{"id"}
        );
        Number key = keyHolder.getKey();
        if (key == null) {
            throw new IllegalStateException("Failed to insert platform connection");
        }
        return key.longValue();
    }

    public PlatformConnection findConnection(long connectionId) {
        List<PlatformConnection> rows = jdbc.query(
            "SELECT " + CONNECTION_COLUMNS + " FROM platform_connections WHERE id = :id",
            new MapSqlParameterSource("id", connectionId),
            connectionMapper()
        );
        return rows.isEmpty() ? null : rows.get(0);
    }

    public List<PlatformConnection> findConnections(String tenantId, String platform) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("tenantId", tenantId)
            .addValue("platform", platform);
        return jdbc.query(
            "SELECT " + CONNECTION_COLUMNS + """
                FROM platform_connections
                WHERE tenant_id = :tenantId
                  AND platform = :platform
                ORDER BY id
                """,
            params,
            connectionMapper()
        );
    }

    public int clearDefaultConnections(String tenantId, String platform, long exceptConnectionId, Instant now) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("tenantId", tenantId)
            .addValue("platform", platform)
            .addValue("exceptId", exceptConnectionId)
            .addValue("now", toTimestamp(now));
        return jdbc.update(
            """
                UPDATE platform_connections
                SET is_default = FALSE,
                    updated_at = :now
                WHERE tenant_id = :tenantId
                  AND platform = :platform
                  AND id <> :exceptId
                  AND is_default = TRUE
                """,
            params
        );
    }

    public void markDefault(long connectionId, Instant now) {
        jdbc.update(
            "UPDATE platform_connections SET is_default = TRUE, updated_at = :now WHERE id = :id",
            new MapSqlParameterSource()
                .addValue("id", connectionId)
                .addValue("now", toTimestamp(now))
        );
    }

    public void updateConnectionToken(long connectionId, StoredToken token, Instant expiresAt, boolean longLived, Instant now) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("id", connectionId)
            .addValue("ciphertext", token.value())
            .addValue("encrypted", token.encrypted())
            .addValue("expiresAt", toTimestamp(expiresAt))
            .addValue("longLived", longLived)
            .addValue("now", toTimestamp(now));
        jdbc.update(
            """
                UPDATE platform_connections
                SET access_token_ciphertext = :ciphertext,
                    token_encrypted = :encrypted,
                    token_expires_at = :expiresAt,
                    long_lived_token = :longLived,
                    updated_at = :now
                WHERE id = :id
                """,
            params
        );
    }

    public void updateConnectionStatus(
        long connectionId,
        ConnectionStatus status,
        int consecutiveAuthFailures,
        String lastError,
        Instant lastValidatedAt,
        Instant now
    ) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("id", connectionId)
            .addValue("status", status.dbValue())
            .addValue("failures", Math.max(0, consecutiveAuthFailures))
            .addValue("lastError", truncate(lastError, 2000))
            .addValue("lastValidatedAt", toTimestamp(lastValidatedAt))
            .addValue("now", toTimestamp(now));
        jdbc.update(
            """
                UPDATE platform_connections
                SET status = :status,
                    consecutive_auth_failures = :failures,
                    last_error = :lastError,
                    last_validated_at = COALESCE(:lastValidatedAt, last_validated_at),
                    updated_at = :now
                WHERE id = :id
                """,
            params
        );
    }

    public int deleteConnection(long connectionId) {
        return jdbc.update(
            "DELETE FROM platform_connections WHERE id = :id",
            new MapSqlParameterSource("id", connectionId)
        );
    }

    public int countPrimaryReferences(long connectionId) {
        Integer count = jdbc.queryForObject(
            "SELECT COUNT(*) FROM ad_accounts WHERE primary_connection_id = :id",
            new MapSqlParameterSource("id", connectionId),
            Integer.class
        );
        return count == null ? 0 : count;
    }

    public long upsertAccount(
        String tenantId,
        String externalAccountId,
        String name,
        String currency,
        String timezoneName,
        String accountStatus,
        Instant now
    ) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("tenantId", tenantId)
            .addValue("externalAccountId", externalAccountId)
            .addValue("name", truncate(name, 512))
            .addValue("currency", currency)
            .addValue("timezoneName", timezoneName)
            .addValue("accountStatus", accountStatus)
            .addValue("now", toTimestamp(now));
        if (postgres) {
            jdbc.update(
                """
                    INSERT INTO ad_accounts (
                        tenant_id,
                        external_account_id,
                        name,
                        currency,
                        timezone_name,
                        account_status,
                        created_at,
                        updated_at
                    )
                    VALUES (
                        :tenantId,
                        :externalAccountId,
                        :name,
                        :currency,
                        :timezoneName,
                        :accountStatus,
                        :now,
                        :now
                    )
                    ON CONFLICT (tenant_id, external_account_id)
                    DO UPDATE SET
                        name = COALESCE(EXCLUDED.name, ad_accounts.name),
                        currency = COALESCE(EXCLUDED.currency, ad_accounts.currency),
                        timezone_name = COALESCE(EXCLUDED.timezone_name, ad_accounts.timezone_name),
                        account_status = COALESCE(EXCLUDED.account_status, ad_accounts.account_status),
                        updated_at = EXCLUDED.updated_at
                    """,
                params
            );
        } else {
            upsertAccountLegacy(params);
        }
        Long id = jdbc.queryForObject(
            """
                SELECT id
                FROM ad_accounts
                WHERE tenant_id = :tenantId
                  AND external_account_id = :externalAccountId
                """,
            params,
            Long.class
        );
        if (id == null) {
            throw new IllegalStateException("Failed to upsert ad account " + externalAccountId);
        }
        return id;
    }

    private void upsertAccountLegacy(MapSqlParameterSource params) {
        String update = """
            UPDATE ad_accounts
            SET name = COALESCE(:name, name),
                currency = COALESCE(:currency, currency),
                timezone_name = COALESCE(:timezoneName, timezone_name),
                account_status = COALESCE(:accountStatus, account_status),
                updated_at = :now
            WHERE tenant_id = :tenantId
              AND external_account_id = :externalAccountId
            """;
        if (jdbc.update(update, params) > 0) {
            return;
        }
        try {
            jdbc.update(
                """
                    INSERT INTO ad_accounts (
                        tenant_id,
                        external_account_id,
                        name,
                        currency,
                        timezone_name,
                        account_status,
                        created_at,
                        updated_at
                    )
                    VALUES (
                        :tenantId,
                        :externalAccountId,
                        :name,
                        :currency,
                        :timezoneName,
                        :accountStatus,
                        :now,
                        :now
                    )
                    """,
                params
            );
        } catch (DataIntegrityViolationException e) {
            jdbc.update(update, params);
        }
    }

    public AdAccount findAccount(String tenantId, String externalAccountId) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("tenantId", tenantId)
            .addValue("externalAccountId", externalAccountId);
        List<AdAccount> rows = jdbc.query(
            "SELECT " + ACCOUNT_COLUMNS + """
                FROM ad_accounts
                WHERE tenant_id = :tenantId
                  AND external_account_id = :externalAccountId
                """,
            params,
            accountMapper()
        );
        return rows.isEmpty() ? null : rows.get(0);
    }

    public List<AdAccount> findAccounts(String tenantId) {
        return jdbc.query(
            "SELECT " + ACCOUNT_COLUMNS + " FROM ad_accounts WHERE tenant_id = :tenantId ORDER BY external_account_id",
            new MapSqlParameterSource("tenantId", tenantId),
            accountMapper()
        );
    }

    /**
     * Points the account at a primary connection. With {@code onlyIfAbsent} an existing primary
     * is kept, which is what re-syncs use.
     */
    public boolean setPrimaryConnection(long accountId, long connectionId, boolean onlyIfAbsent, Instant now) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("accountId", accountId)
            .addValue("connectionId", connectionId)
            .addValue("now", toTimestamp(now));
        String sql = """
            UPDATE ad_accounts
            SET primary_connection_id = :connectionId,
                updated_at = :now
            WHERE id = :accountId
            """ + (onlyIfAbsent ? " AND primary_connection_id IS NULL" : "");
        return jdbc.update(sql, params) > 0;
    }

    public void grantAccess(long connectionId, long accountId, Instant now) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("connectionId", connectionId)
            .addValue("accountId", accountId)
            .addValue("now", toTimestamp(now));
        if (postgres) {
            jdbc.update(
                """
                    INSERT INTO ad_account_access (connection_id, account_id, granted_at)
                    VALUES (:connectionId, :accountId, :now)
                    ON CONFLICT (connection_id, account_id) DO NOTHING
                    """,
                params
            );
            return;
        }
        Integer existing = jdbc.queryForObject(
            "SELECT COUNT(*) FROM ad_account_access WHERE connection_id = :connectionId AND account_id = :accountId",
            params,
            Integer.class
        );
        if (existing != null && existing > 0) {
            return;
        }
        try {
            jdbc.update(
                "INSERT INTO ad_account_access (connection_id, account_id, granted_at) VALUES (:connectionId, :accountId, :now)",
                params
            );
        } catch (DataIntegrityViolationException e) {
            log.debug("Access for connection {} on account {} was granted concurrently", connectionId, accountId);
        }
    }

    public int revokeAccess(long connectionId, long accountId) {
        return jdbc.update(
            "DELETE FROM ad_account_access WHERE connection_id = :connectionId AND account_id = :accountId",
            new MapSqlParameterSource()
                .addValue("connectionId", connectionId)
                .addValue("accountId", accountId)
        );
    }

    public int clearPrimaryConnection(long accountId, long connectionId, Instant now) {
        return jdbc.update(
            """
                UPDATE ad_accounts
                SET primary_connection_id = NULL,
                    updated_at = :now
                WHERE id = :accountId
                  AND primary_connection_id = :connectionId
                """,
            new MapSqlParameterSource()
                .addValue("accountId", accountId)
                .addValue("connectionId", connectionId)
                .addValue("now", toTimestamp(now))
        );
    }

    public List<Long> findConnectionIdsWithAccess(long accountId) {
        return jdbc.queryForList(
            "SELECT connection_id FROM ad_account_access WHERE account_id = :accountId ORDER BY connection_id",
            new MapSqlParameterSource("accountId", accountId),
            Long.class
        );
    }

    private RowMapper<PlatformConnection> connectionMapper() {
        return (rs, rowNum) -> {
            String scopes = rs.getString("granted_scopes");
            List<String> scopeList = scopes == null || scopes.isBlank()
                ? List.of()
                : new ArrayList<>(Arrays.asList(scopes.split(",")));
            return new PlatformConnection(
                rs.getLong("id"),
                rs.getString("tenant_id"),
                rs.getString("platform"),
                rs.getString("access_token_ciphertext"),
                rs.getBoolean("token_encrypted"),
                toInstant(rs.getTimestamp("token_expires_at")),
                rs.getBoolean("long_lived_token"),
                scopeList,
                ConnectionStatus.fromDb(rs.getString("status")),
                rs.getInt("consecutive_auth_failures"),
                rs.getString("last_error"),
                toInstant(rs.getTimestamp("last_validated_at")),
                rs.getBoolean("is_default"),
                toInstant(rs.getTimestamp("created_at"))
            );
        };
    }

    private RowMapper<AdAccount> accountMapper() {
        return (rs, rowNum) -> new AdAccount(
            rs.getLong("id"),
            rs.getString("tenant_id"),
            rs.getString("external_account_id"),
            rs.getString("name"),
            rs.getString("currency"),
            rs.getString("timezone_name"),
            rs.getString("account_status"),
            nullableLong(rs, "primary_connection_id")
        );
    }
}
