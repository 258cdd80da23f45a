package com.delta.adsync.sync.model;

import java.util.List;

public record SyncStatusView(
    String tenantId,
    List<SyncWatermark> watermarks,
    List<SyncJob> recentJobs,
    List<String> runningAccounts) {}
