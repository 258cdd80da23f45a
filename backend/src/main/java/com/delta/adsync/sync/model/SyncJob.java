package com.delta.adsync.sync.model;

import java.time.Instant;
import java.time.LocalDate;
import java.util.Map;

public record SyncJob(
    long id,
    String tenantId,
    String externalAccountId,
    SyncMode jobKind,
    LocalDate dateFrom,
    LocalDate dateTo,
    SyncJobStatus status,
    int rowsSynced,
    Map<String, Integer> rowsByLevel,
    int entitiesSynced,
    int creativesSynced,
    String errorSummary,
    Instant startedAt,
    Instant endedAt,
    Long durationMs
) {
}
