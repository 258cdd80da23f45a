package com.delta.adsync.sync.model;

import java.math.BigDecimal;
import java.time.LocalDate;

public record MetricRow(
    String tenantId,
    String externalAccountId,
    EntityLevel level,
    String entityId,
    String entityName,
    LocalDate metricDate,
    String campaignId,
    String adsetId,
    BigDecimal spend,
    long impressions,
    long reach,
    long clicks,
    long uniqueClicks,
    BigDecimal ctr,
    BigDecimal cpc,
    BigDecimal cpm,
    BigDecimal frequency,
    long leads,
    BigDecimal conversions,
    BigDecimal conversionValue,
    BigDecimal purchaseValue,
    String actionsJson,
    String actionValuesJson
) {
}
