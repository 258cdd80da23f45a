package com.delta.adsync.sync.model;

import java.time.Duration;
import java.time.Instant;

public record HttpFetchResult(
    String requestedUrl,
    int statusCode,
    String body,
    byte[] bodyBytes,
    String contentType,
    Instant fetchedAt,
    Duration duration,
    String errorCode,
    String errorMessage
) {
    public boolean isSuccessful() {
        return statusCode >= 200 && statusCode < 300 && errorCode == null;
    }
}
