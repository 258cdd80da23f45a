package com.delta.adsync.sync.model;

import com.delta.adsync.sync.util.GraphIds;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

public record SyncRunRequest(
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
    public List<String> normalizedAccountIds() {
        if (accountIds == null) {
            return List.of();
        }
        Set<String> out = new LinkedHashSet<>();
        for (String accountId : accountIds) {
            String normalized = GraphIds.normalizeAccountId(accountId);
            if (normalized != null) {
                out.add(normalized);
            }
        }
        return new ArrayList<>(out);
    }

    public List<EntityLevel> normalizedLevels(List<String> defaults) {
        List<String> source = levels == null || levels.isEmpty() ? defaults : levels;
        Set<EntityLevel> out = new LinkedHashSet<>();
        if (source != null) {
            for (String level : source) {
                if (level != null && !level.isBlank()) {
                    out.add(EntityLevel.fromString(level));
                }
            }
        }
        return new ArrayList<>(out);
    }

    public SyncMode syncMode() {
        return SyncMode.fromString(mode);
    }

    public boolean creativesRequested() {
        return Boolean.TRUE.equals(syncCreatives);
    }

    public boolean entitiesRequested() {
        return Boolean.TRUE.equals(syncEntities);
    }
}
