package com.delta.adsync.sync.service;

import com.delta.adsync.config.AdSyncProperties;
import com.delta.adsync.sync.http.GraphApiClient;
import com.delta.adsync.sync.http.GraphApiException;
import com.delta.adsync.sync.http.GraphAuthException;
import com.delta.adsync.sync.http.GraphErrorClassifier;
import com.delta.adsync.sync.http.PagedRows;
import com.delta.adsync.sync.model.AdAccount;
import com.delta.adsync.sync.model.ConnectionStatus;
import com.delta.adsync.sync.model.PlatformConnection;
import com.delta.adsync.sync.model.StoredToken;
import com.delta.adsync.sync.model.TokenExchangeResult;
import com.delta.adsync.sync.persistence.ConnectionJdbcRepository;
import com.delta.adsync.sync.token.TokenEncryptionException;
import com.delta.adsync.sync.token.TokenVault;
import com.delta.adsync.sync.util.GraphIds;
import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Service
public class ConnectionService {
    public static final String PLATFORM = "meta";

    private static final Logger log = LoggerFactory.getLogger(ConnectionService.class);
    private static final String ACCOUNT_FIELDS = "id,name,account_status,currency,timezone_name";

    private final ConnectionJdbcRepository repository;
    private final TokenVault tokenVault;
    private final GraphApiClient graphApiClient;
    private final AdSyncProperties properties;
    private final Clock clock;

    public ConnectionService(
        ConnectionJdbcRepository repository,
        TokenVault tokenVault,
        GraphApiClient graphApiClient,
        AdSyncProperties properties,
        Clock clock
    ) {
        this.repository = repository;
        this.tokenVault = tokenVault;
        this.graphApiClient = graphApiClient;
        this.properties = properties;
        this.clock = clock;
    }

    /**
     * Checks the token against {@code /me}, reads its granted scopes from {@code /me/permissions}
     * and stores it as a new {@code connected} connection. The first connection of a tenant always
     * becomes its default.
     *
     * @throws ConnectionValidationException when the platform rejects the token or a required
     *                                       scope is missing
     */
    @Transactional
    public PlatformConnection registerConnection(
        String tenantId,
        String rawToken,
        Instant tokenExpiresAt,
        boolean longLivedToken,
        boolean makeDefault
    ) {
        requireTenant(tenantId);
        if (rawToken == null || rawToken.isBlank()) {
            throw new IllegalArgumentException("Access token is required");
        }
        List<String> grantedScopes = validateToken(rawToken);
        Instant now = Instant.now(clock);
        StoredToken stored = tokenVault.storeAllowingPlaintext(tenantId, rawToken);
        boolean firstConnection = repository.findConnections(tenantId, PLATFORM).isEmpty();
        boolean isDefault = makeDefault || firstConnection;
        long connectionId = repository.insertConnection(
            tenantId,
            PLATFORM,
            stored,
            tokenExpiresAt,
            longLivedToken,
            grantedScopes,
            ConnectionStatus.CONNECTED,
            false,
            now
        );
        if (isDefault) {
            // clear before marking: Postgres enforces a single default per tenant with a unique index
            int cleared = repository.clearDefaultConnections(tenantId, PLATFORM, connectionId, now);
            repository.markDefault(connectionId, now);
            if (cleared > 0) {
                log.info("Connection {} is now the default for tenant {} ({} previous default cleared)", connectionId, tenantId, cleared);
            }
        }
        return repository.findConnection(connectionId);
    }

    /** OAuth callback path: code, then short-lived token, then long-lived token when possible. */
    @Transactional
    public PlatformConnection connectWithCode(
        String tenantId,
        String code,
        String redirectUri,
        boolean makeDefault
    ) {
        TokenExchangeResult shortLived = tokenVault.exchangeCodeForToken(code, redirectUri);
        long shortTtl = Math.max(1L, Duration.between(Instant.now(clock), shortLived.expiresAt()).getSeconds());
        TokenExchangeResult exchanged = tokenVault.exchangeShortLivedForLongLived(shortLived.accessToken(), shortTtl);
        if (exchanged.degraded()) {
            log.warn("Tenant {} connected with a short-lived token only: {}", tenantId, exchanged.error());
        }
        return registerConnection(
            tenantId,
            exchanged.accessToken(),
            exchanged.expiresAt(),
            exchanged.longLived(),
            makeDefault
        );
    }

    /** Returns the scopes the platform reports as granted for the token. */
    List<String> validateToken(String rawToken) {
        List<String> granted = new ArrayList<>();
        try {
            graphApiClient.getJson(graphApiClient.graphUrl("me", Map.of("fields", "id,name", "access_token", rawToken)));
            PagedRows permissions = graphApiClient.fetchAllPages(
                graphApiClient.graphUrl("me/permissions", Map.of("access_token", rawToken))
            );
            for (JsonNode row : permissions.rows()) {
                String permission = row.path("permission").asText("");
                if (!permission.isEmpty() && "granted".equals(row.path("status").asText())) {
                    granted.add(permission);
                }
            }
        } catch (GraphAuthException e) {
            throw new ConnectionValidationException("Platform rejected the access token: " + e.getMessage(), e);
        }
        List<String> missing = new ArrayList<>();
        for (String required : properties.getToken().getRequiredScopes()) {
            if (!granted.contains(required)) {
                missing.add(required);
            }
        }
        if (!missing.isEmpty()) {
            throw new ConnectionValidationException("Access token is missing required scope(s): " + String.join(", ", missing));
        }
        return granted;
    }

    @Transactional
    public void makeDefault(long connectionId) {
        PlatformConnection connection = requireConnection(connectionId);
        Instant now = Instant.now(clock);
        repository.clearDefaultConnections(connection.tenantId(), connection.platform(), connectionId, now);
        repository.markDefault(connectionId, now);
    }

    /**
     * Upserts the account and grants the connection read access. The primary pointer is only set
     * when the account has none, unless {@code rebind} asks to move it.
     */
    @Transactional
    public AdAccount bindAccount(
        String tenantId,
        long connectionId,
        String externalAccountId,
        String name,
        String currency,
        String timezoneName,
        String accountStatus,
        boolean rebind
    ) {
        requireTenant(tenantId);
        PlatformConnection connection = requireConnection(connectionId);
        if (!connection.tenantId().equals(tenantId)) {
            throw new IllegalArgumentException("Connection " + connectionId + " does not belong to tenant " + tenantId);
        }
        String accountId = GraphIds.normalizeAccountId(externalAccountId);
        if (accountId == null) {
            throw new IllegalArgumentException("Account id is required");
        }
        Instant now = Instant.now(clock);
        long id = repository.upsertAccount(tenantId, accountId, name, currency, timezoneName, accountStatus, now);
        repository.grantAccess(connectionId, id, now);
        boolean moved = repository.setPrimaryConnection(id, connectionId, !rebind, now);
        if (moved && rebind) {
            log.info("Account {} of tenant {} rebound to connection {}", accountId, tenantId, connectionId);
        }
        return repository.findAccount(tenantId, accountId);
    }

    /**
     * Lists every ad account the connection's token can see and binds each of them to the
     * connection. Existing primary pointers are kept.
     */
    @Transactional(noRollbackFor = GraphAuthException.class)
    public List<AdAccount> discoverAccounts(long connectionId) {
        PlatformConnection connection = requireConnection(connectionId);
        String token = resolveConnectionToken(connection);
        PagedRows page;
        try {
            Map<String, String> params = new LinkedHashMap<>();
            params.put("fields", ACCOUNT_FIELDS);
            params.put("limit", "100");
            params.put("access_token", token);
            page = graphApiClient.fetchAllPages(graphApiClient.graphUrl("me/adaccounts", params));
        } catch (GraphAuthException e) {
            recordAuthFailure(connectionId, e.getMessage());
            throw e;
        }
        if (page.truncated()) {
            log.warn("Account discovery for connection {} stopped after {} page(s)", connectionId, page.pagesFetched());
        }
        Instant now = Instant.now(clock);
        List<AdAccount> accounts = new ArrayList<>();
        for (JsonNode row : page.rows()) {
            String accountId = GraphIds.normalizeAccountId(row.path("id").asText(null));
            if (accountId == null) {
                continue;
            }
            long id = repository.upsertAccount(
                connection.tenantId(),
                accountId,
                textOrNull(row, "name"),
                textOrNull(row, "currency"),
                textOrNull(row, "timezone_name"),
                textOrNull(row, "account_status"),
                now
            );
            repository.grantAccess(connectionId, id, now);
            repository.setPrimaryConnection(id, connectionId, true, now);
            accounts.add(repository.findAccount(connection.tenantId(), accountId));
        }
        recordValidationSuccess(connectionId);
        log.info("Connection {} discovered {} ad account(s) for tenant {}", connectionId, accounts.size(), connection.tenantId());
        return accounts;
    }

    /** Revokes the connection's access to the account and drops it as primary if it was. */
    @Transactional
    public AdAccount unbindAccount(String tenantId, long connectionId, String externalAccountId) {
        requireTenant(tenantId);
        PlatformConnection connection = requireConnection(connectionId);
        if (!connection.tenantId().equals(tenantId)) {
            throw new IllegalArgumentException("Connection " + connectionId + " does not belong to tenant " + tenantId);
        }
        String accountId = GraphIds.normalizeAccountId(externalAccountId);
        AdAccount account = accountId == null ? null : repository.findAccount(tenantId, accountId);
        if (account == null) {
            throw new IllegalArgumentException("Unknown account " + externalAccountId);
        }
        Instant now = Instant.now(clock);
        repository.revokeAccess(connectionId, account.id());
        if (repository.clearPrimaryConnection(account.id(), connectionId, now) > 0) {
            log.info("Account {} of tenant {} no longer has a primary connection", accountId, tenantId);
        }
        return repository.findAccount(tenantId, accountId);
    }

    public AdAccount findAccount(String tenantId, String externalAccountId) {
        return repository.findAccount(tenantId, GraphIds.normalizeAccountId(externalAccountId));
    }

    public List<AdAccount> findAccounts(String tenantId) {
        return repository.findAccounts(tenantId);
    }

    public List<PlatformConnection> findConnections(String tenantId) {
        requireTenant(tenantId);
        return repository.findConnections(tenantId, PLATFORM);
    }

    public PlatformConnection findConnection(long connectionId) {
        return repository.findConnection(connectionId);
    }

    /**
     * Plain access token of the account's primary connection.
     *
     * @throws ConnectionUnavailableException when there is no usable connection
     */
    public String resolveAccessToken(AdAccount account) {
        if (account.primaryConnectionId() == null) {
            throw new ConnectionUnavailableException("Account " + account.externalAccountId() + " has no primary connection");
        }
        PlatformConnection connection = repository.findConnection(account.primaryConnectionId());
        if (connection == null) {
            throw new ConnectionUnavailableException("Primary connection of account " + account.externalAccountId() + " no longer exists");
        }
        return resolveConnectionToken(connection);
    }

    private String resolveConnectionToken(PlatformConnection connection) {
        if (connection.status() != ConnectionStatus.CONNECTED) {
            throw new ConnectionUnavailableException(
                "Connection " + connection.id() + " is " + connection.status().dbValue()
            );
        }
        try {
            return tokenVault.reveal(connection.tenantId(), connection.storedToken());
        } catch (TokenEncryptionException e) {
            throw new ConnectionUnavailableException("Stored token of connection " + connection.id() + " cannot be read", e);
        }
    }

    /** Counts an auth failure; the connection flips to {@code error} once the threshold is hit. */
    public ConnectionStatus recordAuthFailure(long connectionId, String message) {
        PlatformConnection connection = repository.findConnection(connectionId);
        if (connection == null) {
            return null;
        }
        int failures = connection.consecutiveAuthFailures() + 1;
        ConnectionStatus status = connection.status();
        if (status == ConnectionStatus.CONNECTED && failures >= properties.getToken().getAuthFailureThreshold()) {
            status = ConnectionStatus.ERROR;
            log.warn("Connection {} marked error after {} auth failure(s): {}", connectionId, failures, message);
        }
        repository.updateConnectionStatus(connectionId, status, failures, message, null, Instant.now(clock));
        return status;
    }

    public void recordValidationSuccess(long connectionId) {
        Instant now = Instant.now(clock);
        repository.updateConnectionStatus(connectionId, ConnectionStatus.CONNECTED, 0, null, now, now);
    }

    /** Deleting the default hands the default over to the oldest remaining connection. */
    @Transactional
    public void deleteConnection(long connectionId) {
        PlatformConnection connection = repository.findConnection(connectionId);
        int references = repository.countPrimaryReferences(connectionId);
        if (references > 0) {
            throw new ConnectionInUseException(
                "Connection " + connectionId + " is the primary connection of " + references + " account(s)"
            );
        }
        repository.deleteConnection(connectionId);
        if (connection == null || !connection.defaultConnection()) {
            return;
        }
        repository.findConnections(connection.tenantId(), connection.platform()).stream()
            .min(Comparator.comparing(PlatformConnection::createdAt).thenComparingLong(PlatformConnection::id))
            .ifPresent(next -> {
                repository.markDefault(next.id(), Instant.now(clock));
                log.info("Connection {} is now the default for tenant {}", next.id(), connection.tenantId());
            });
    }

    /**
     * Extends the connection's token. Code 190 with a revocation subcode marks the connection
     * {@code revoked}; other auth failures go through {@link #recordAuthFailure}.
     */
    public PlatformConnection refreshConnectionToken(long connectionId) {
        PlatformConnection connection = requireConnection(connectionId);
        String current;
        try {
            current = tokenVault.reveal(connection.tenantId(), connection.storedToken());
        } catch (TokenEncryptionException e) {
            recordAuthFailure(connectionId, e.getMessage());
            return repository.findConnection(connectionId);
        }
        try {
            TokenExchangeResult refreshed = tokenVault.requestLongLivedToken(current);
            if (refreshed == null) {
                log.warn("Token refresh for connection {} returned no token, keeping the current one", connectionId);
                return connection;
            }
            Instant now = Instant.now(clock);
            StoredToken stored = tokenVault.storeAllowingPlaintext(connection.tenantId(), refreshed.accessToken());
            repository.updateConnectionToken(connectionId, stored, refreshed.expiresAt(), true, now);
            recordValidationSuccess(connectionId);
        } catch (GraphAuthException e) {
            if (GraphErrorClassifier.isPermanentlyInvalidToken(e.getErrorCode(), e.getErrorSubcode())) {
                log.warn("Connection {} token was revoked upstream: {}", connectionId, e.getMessage());
                repository.updateConnectionStatus(
                    connectionId,
                    ConnectionStatus.REVOKED,
                    connection.consecutiveAuthFailures() + 1,
                    e.getMessage(),
                    null,
                    Instant.now(clock)
                );
            } else {
                recordAuthFailure(connectionId, e.getMessage());
            }
        } catch (GraphApiException e) {
            log.warn("Token refresh for connection {} failed: {}", connectionId, e.getMessage());
        }
        return repository.findConnection(connectionId);
    }

    private PlatformConnection requireConnection(long connectionId) {
        PlatformConnection connection = repository.findConnection(connectionId);
        if (connection == null) {
            throw new IllegalArgumentException("Unknown connection " + connectionId);
        }
        return connection;
    }

    private static String textOrNull(JsonNode row, String field) {
        JsonNode value = row.get(field);
        return value == null || value.isNull() ? null : value.asText();
    }

    private void requireTenant(String tenantId) {
        if (tenantId == null || tenantId.isBlank()) {
            throw new IllegalArgumentException("Tenant id is required");
        }
    }
}
