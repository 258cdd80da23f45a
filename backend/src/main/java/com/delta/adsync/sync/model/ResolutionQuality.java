package com.delta.adsync.sync.model;

import java.util.Locale;

public enum ResolutionQuality {
    HD,
    SD,
    LOW,
    UNKNOWN;

    /**
     * Classifies pixel dimensions in either orientation. Missing or non-positive dimensions are
     * {@link #UNKNOWN}.
     */
    public static ResolutionQuality classify(Integer width, Integer height) {
        if (width == null || height == null || width <= 0 || height <= 0) {
            return UNKNOWN;
        }
        if ((width >= 1280 && height >= 720) || (width >= 720 && height >= 1280)) {
            return HD;
        }
        if ((width >= 640 && height >= 480) || (width >= 480 && height >= 640)) {
            return SD;
        }
        return LOW;
    }

    public String dbValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static ResolutionQuality fromDb(String raw) {
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
