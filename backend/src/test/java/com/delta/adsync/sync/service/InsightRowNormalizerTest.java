package com.delta.adsync.sync.service;

import com.delta.adsync.sync.TestFixtures;
import com.delta.adsync.sync.model.EntityLevel;
import com.delta.adsync.sync.model.MetricRow;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.LocalDate;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;

class InsightRowNormalizerTest {

    @Test
    void normalizesAdLevelRowWithActions() {
        MetricRow row = InsightRowNormalizer.normalize("tenant-a", "42", EntityLevel.AD, TestFixtures.parse("""
            {"ad_id":"9001","ad_name":"Spring sale","campaign_id":"c1","adset_id":"s1",
             "date_start":"2024-04-30","date_stop":"2024-04-30",
             "spend":"12.34","impressions":"1500","reach":"1200","clicks":"45","unique_clicks":"40",
             "ctr":"3.0","cpc":"0.274222","cpm":"8.226667","frequency":"1.25",
             "actions":[{"action_type":"lead","value":"3"},{"action_type":"purchase","value":"2"},
                        {"action_type":"link_click","value":"40"}],
             "action_values":[{"action_type":"purchase","value":"99.90"},
                              {"action_type":"onsite_conversion.purchase","value":"10.10"}]}
            """));

        assertEquals("9001", row.entityId());
        assertEquals("Spring sale", row.entityName());
        assertEquals(LocalDate.of(2024, 4, 30), row.metricDate());
        assertEquals("c1", row.campaignId());
        assertEquals("s1", row.adsetId());
        assertThat(row.spend()).isEqualByComparingTo("12.34");
        assertEquals(1500L, row.impressions());
        assertEquals(1200L, row.reach());
        assertEquals(45L, row.clicks());
        assertEquals(40L, row.uniqueClicks());
        assertThat(row.frequency()).isEqualByComparingTo("1.25");
        assertEquals(3L, row.leads());
        assertThat(row.conversions()).isEqualByComparingTo("5");
        assertThat(row.conversionValue()).isEqualByComparingTo("110.00");
        assertThat(row.purchaseValue()).isEqualByComparingTo("99.90");
        assertThat(row.actionsJson()).contains("link_click");
        assertThat(row.actionValuesJson()).contains("99.90");
    }

    @Test
    void missingOrGarbledNumbersCountAsZero() {
        MetricRow row = InsightRowNormalizer.normalize("tenant-a", "42", EntityLevel.CAMPAIGN, TestFixtures.parse("""
            {"campaign_id":"c1","date_start":"2024-04-30","spend":"n/a","impressions":"","clicks":"12.6"}
            """));

        assertThat(row.spend()).isEqualByComparingTo(BigDecimal.ZERO);
        assertEquals(0L, row.impressions());
        assertEquals(13L, row.clicks());
        assertEquals(0L, row.leads());
        assertThat(row.conversions()).isEqualByComparingTo(BigDecimal.ZERO);
        assertNull(row.actionsJson());
        assertNull(row.entityName());
    }

    @Test
    void rowsWithoutEntityIdOrDateAreDropped() {
        assertNull(InsightRowNormalizer.normalize("t", "42", EntityLevel.ADSET,
            TestFixtures.parse("{\"date_start\":\"2024-04-30\",\"spend\":\"1\"}")));
        assertNull(InsightRowNormalizer.normalize("t", "42", EntityLevel.ADSET,
            TestFixtures.parse("{\"adset_id\":\"s1\",\"date_start\":\"30/04/2024\"}")));
    }
}
