package com.delta.adsync.sync.model;

import java.time.Instant;

public record TokenExchangeResult(
    String accessToken,
    Instant expiresAt,
    boolean longLived,
    String error
) {
    public boolean degraded() {
        return !longLived;
    }
}
