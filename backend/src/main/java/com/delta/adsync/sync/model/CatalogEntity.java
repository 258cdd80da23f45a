package com.delta.adsync.sync.model;

import java.math.BigDecimal;

public record CatalogEntity(
    String tenantId,
    String externalAccountId,
    EntityLevel entityType,
    String entityId,
    String name,
    String status,
    String effectiveStatus,
    String objective,
    String campaignId,
    String adsetId,
    BigDecimal dailyBudget,
    BigDecimal lifetimeBudget,
    String rawJson
) {
}
