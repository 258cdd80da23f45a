package com.delta.adsync.sync.model;

import java.time.Instant;

public record CachedMedia(
    String storedUrl,
    String storagePath,
    long sizeBytes,
    String contentType,
    Instant expiresAt) {}
