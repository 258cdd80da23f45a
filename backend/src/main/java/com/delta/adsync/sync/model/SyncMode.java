package com.delta.adsync.sync.model;

import java.util.Locale;

public enum SyncMode {
    DAILY,
    INTRADAY,
    BACKFILL;

    public String dbValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static SyncMode fromString(String raw) {
        if (raw == null || raw.isBlank()) {
            return DAILY;
        }
        String normalized = raw.trim().toUpperCase(Locale.ROOT);
        for (SyncMode mode : values()) {
            if (mode.name().equals(normalized)) {
                return mode;
            }
        }
        throw new IllegalArgumentException("Unknown sync mode: " + raw);
    }
}
