package com.delta.adsync.sync.model;

import java.util.List;
import java.util.Map;

public record EntitySyncSummary(
    String externalAccountId,
    boolean skipped,
    Map<String, Integer> countsByType,
    int total,
    List<String> errors) {}
