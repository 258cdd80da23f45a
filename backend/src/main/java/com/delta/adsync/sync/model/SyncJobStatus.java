package com.delta.adsync.sync.model;

import java.util.Locale;

public enum SyncJobStatus {
    RUNNING,
    COMPLETED,
    FAILED;

    public boolean isTerminal() {
        return this != RUNNING;
    }

    public String dbValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static SyncJobStatus fromDb(String raw) {
        return raw == null ? null : valueOf(raw.trim().toUpperCase(Locale.ROOT));
    }
}
