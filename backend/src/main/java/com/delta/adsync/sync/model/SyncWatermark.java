package com.delta.adsync.sync.model;

import java.time.Instant;
import java.time.LocalDate;

public record SyncWatermark(
    String tenantId,
    String externalAccountId,
    LocalDate lastDailyDateSynced,
    Instant lastIntradaySyncedAt,
    Instant lastSuccessAt,
    String lastError,
    boolean syncEnabled,
    Instant updatedAt
) {
}
