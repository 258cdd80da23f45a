package com.delta.adsync.sync.service;

import com.delta.adsync.sync.model.EntityLevel;
import com.delta.adsync.sync.model.MetricRow;
import com.fasterxml.jackson.databind.JsonNode;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.Set;

/**
 * Maps one insights row into a {@link MetricRow}. Numeric fields arrive as strings; anything
 * unparseable counts as zero.
 */
public final class InsightRowNormalizer {
  static final Set<String> LEAD_ACTIONS = Set.of("lead", "onsite_conversion.lead_grouped");
  static final Set<String> CONVERSION_ACTIONS = Set.of(
      "lead",
      "purchase",
      "complete_registration",
      "offsite_conversion.fb_pixel_purchase",
      "onsite_conversion.purchase",
      "offsite_conversion.fb_pixel_lead");
  static final Set<String> CONVERSION_VALUE_ACTIONS = Set.of(
      "purchase", "offsite_conversion.fb_pixel_purchase", "onsite_conversion.purchase");
  static final Set<String> PURCHASE_VALUE_ACTIONS = Set.of(
      "purchase", "offsite_conversion.fb_pixel_purchase");

  private InsightRowNormalizer() {}

  /**
   * @return the normalized row, or null when the row carries no entity id or no date
   */
  public static MetricRow normalize(String tenantId, String accountId, EntityLevel level, JsonNode row) {
    String entityId = text(row, level.idField());
    LocalDate date = parseDate(text(row, "date_start"));
    if (entityId == null || date == null) {
      return null;
    }
    JsonNode actions = row.path("actions");
    JsonNode actionValues = row.path("action_values");
    return new MetricRow(
        tenantId,
        accountId,
        level,
        entityId,
        text(row, level.nameField()),
        date,
        text(row, "campaign_id"),
        text(row, "adset_id"),
        decimal(row.path("spend")),
        whole(row.path("impressions")),
        whole(row.path("reach")),
        whole(row.path("clicks")),
        whole(row.path("unique_clicks")),
        decimal(row.path("ctr")),
        decimal(row.path("cpc")),
        decimal(row.path("cpm")),
        decimal(row.path("frequency")),
        sumActions(actions, LEAD_ACTIONS).longValue(),
        sumActions(actions, CONVERSION_ACTIONS),
        sumActions(actionValues, CONVERSION_VALUE_ACTIONS),
        sumActions(actionValues, PURCHASE_VALUE_ACTIONS),
        actions.isArray() ? actions.toString() : null,
        actionValues.isArray() ? actionValues.toString() : null);
  }

  static BigDecimal sumActions(JsonNode actions, Set<String> types) {
    BigDecimal total = BigDecimal.ZERO;
    if (!actions.isArray()) {
      return total;
    }
    for (JsonNode action : actions) {
      String type = text(action, "action_type");
      if (type != null && types.contains(type)) {
        total = total.add(decimal(action.path("value")));
      }
    }
    return total;
  }

  static BigDecimal decimal(JsonNode node) {
    if (node == null || node.isMissingNode() || node.isNull()) {
      return BigDecimal.ZERO;
    }
    if (node.isNumber()) {
      return node.decimalValue();
    }
    String raw = node.asText().trim();
    if (raw.isEmpty()) {
      return BigDecimal.ZERO;
    }
    try {
      return new BigDecimal(raw);
    } catch (NumberFormatException e) {
      return BigDecimal.ZERO;
    }
  }

  static long whole(JsonNode node) {
    BigDecimal value = decimal(node);
    return value.setScale(0, RoundingMode.HALF_UP).longValue();
  }

  private static LocalDate parseDate(String raw) {
    if (raw == null) {
      return null;
    }
    try {
      return LocalDate.parse(raw);
    } catch (DateTimeParseException e) {
      return null;
    }
  }

  private static String text(JsonNode node, String field) {
    JsonNode value = node.path(field);
    if (value.isMissingNode() || value.isNull()) {
      return null;
    }
    String text = value.asText();
    return text.isBlank() ? null : text.trim();
  }
}
