package com.delta.adsync.sync.model;

import java.time.Instant;
import java.util.List;

public record SyncRunSummary(
    String tenantId,
    SyncMode mode,
    Instant startedAt,
    Instant finishedAt,
    int accountsRequested,
    int accountsSynced,
    int accountsFailed,
    int rowsSynced,
    int creativesResolved,
    List<AccountSyncSummary> accounts,
    List<String> errors) {}
