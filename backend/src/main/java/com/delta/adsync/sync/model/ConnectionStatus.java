package com.delta.adsync.sync.model;

import java.util.Locale;

public enum ConnectionStatus {
    PENDING,
    CONNECTED,
    ERROR,
    REVOKED;

    public String dbValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static ConnectionStatus fromDb(String raw) {
        return raw == null ? PENDING : valueOf(raw.trim().toUpperCase(Locale.ROOT));
    }
}
