package com.delta.adsync.sync.model;

import java.util.List;
import java.util.Map;

public record AccountSyncSummary(
    String externalAccountId,
    Long jobId,
    SyncJobStatus status,
    DateRange dateRange,
    Map<String, Integer> rowsByLevel,
    int rowsSynced,
    int entitiesSynced,
    int creativesResolved,
    Map<String, String> creativeErrors,
    List<String> errors
) {
    public boolean succeeded() {
        return status == SyncJobStatus.COMPLETED;
    }
}
