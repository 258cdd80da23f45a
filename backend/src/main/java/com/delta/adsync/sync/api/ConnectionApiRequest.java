package com.delta.adsync.sync.api;

import java.time.Instant;

/**
 * Either {@code accessToken} or an OAuth {@code code} with its {@code redirectUri}. Granted scopes
 * are always read back from the platform.
 */
public record ConnectionApiRequest(
    String tenantId,
    String accessToken,
    Instant tokenExpiresAt,
    Boolean longLivedToken,
    String code,
    String redirectUri,
    Boolean makeDefault
) {
}
