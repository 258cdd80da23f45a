package com.delta.adsync.sync.model;

import java.util.Locale;

public enum CreativeType {
    IMAGE,
    VIDEO,
    CAROUSEL,
    DYNAMIC,
    UNKNOWN;

    public String dbValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static CreativeType fromDb(String raw) {
        if (raw == null || raw.isBlank()) {
            return UNKNOWN;
        }
        try {
            return valueOf(raw.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            return UNKNOWN;
        }
    }
}
