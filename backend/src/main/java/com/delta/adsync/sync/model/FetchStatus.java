package com.delta.adsync.sync.model;

import java.util.Locale;

public enum FetchStatus {
    SUCCESS,
    PARTIAL,
    FAILED;

    public static FetchStatus of(boolean hasMedia, boolean hasText) {
        if (hasMedia && hasText) {
            return SUCCESS;
        }
        if (hasMedia || hasText) {
            return PARTIAL;
        }
        return FAILED;
    }

    public String dbValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static FetchStatus fromDb(String raw) {
        return raw == null ? FAILED : valueOf(raw.trim().toUpperCase(Locale.ROOT));
    }
}
