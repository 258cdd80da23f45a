package com.delta.adsync.sync.model;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.time.Instant;
import java.util.List;

public record PlatformConnection(
    long id,
    String tenantId,
    String platform,
    @JsonIgnore String accessTokenCiphertext,
    boolean tokenEncrypted,
    Instant tokenExpiresAt,
    boolean longLivedToken,
    List<String> grantedScopes,
    ConnectionStatus status,
    int consecutiveAuthFailures,
    String lastError,
    Instant lastValidatedAt,
    boolean defaultConnection,
    Instant createdAt
) {
    public StoredToken storedToken() {
        return new StoredToken(accessTokenCiphertext, tokenEncrypted);
    }
}
