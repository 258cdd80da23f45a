package com.delta.adsync.sync.model;

import java.util.List;
import java.util.Map;

/**
 * Outcome of resolving a list of ads. Every requested ad id ends up in exactly one of
 * {@code records} or {@code errors}.
 */
public record BatchResolutionResult(
    Map<String, CreativeRecord> records,
    Map<String, String> errors,
    List<String> unpersistedAdIds,
    int reusedStored
) {
    public int resolvedCount() {
        return records.size();
    }
}
