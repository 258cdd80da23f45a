package com.delta.adsync.sync.api;

import java.time.LocalDate;
import java.util.List;

public record SyncApiRunRequest(
    String tenantId,
    List<String> accountIds,
    String mode,
    Integer daysBack,
    LocalDate dateFrom,
    LocalDate dateTo,
    List<String> levels,
    Boolean syncCreatives,
    Boolean syncEntities
) {
}
