package com.delta.adsync.sync.model;

import java.util.Locale;

public enum EntityLevel {
    CAMPAIGN("campaign", "campaign_id", "campaign_name", "campaigns"),
    ADSET("adset", "adset_id", "adset_name", "adsets"),
    AD("ad", "ad_id", "ad_name", "ads");

    private final String apiValue;
    private final String idField;
    private final String nameField;
    private final String edge;

    EntityLevel(String apiValue, String idField, String nameField, String edge) {
        this.apiValue = apiValue;
        this.idField = idField;
        this.nameField = nameField;
        this.edge = edge;
    }

    public String apiValue() {
        return apiValue;
    }

    public String idField() {
        return idField;
    }

    public String nameField() {
        return nameField;
    }

    public String edge() {
        return edge;
    }

    public static EntityLevel fromString(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("Entity level is required");
        }
        String normalized = raw.trim().toLowerCase(Locale.ROOT).replace("_", "");
        if (normalized.equals("adgroup")) {
            return ADSET;
        }
        for (EntityLevel level : values()) {
            if (level.apiValue.equals(normalized)) {
                return level;
            }
        }
        throw new IllegalArgumentException("Unknown entity level: " + raw);
    }
}
