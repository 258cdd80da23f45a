package com.delta.adsync.sync.persistence;

import com.delta.adsync.sync.model.CreativeRecord;
import com.delta.adsync.sync.model.CreativeType;
import com.delta.adsync.sync.model.DateRange;
import com.delta.adsync.sync.model.EntityLevel;
import com.delta.adsync.sync.model.FetchStatus;
import com.delta.adsync.sync.model.MetricRow;
import com.delta.adsync.sync.model.ResolutionQuality;
import com.delta.adsync.sync.model.SyncJob;
import com.delta.adsync.sync.model.SyncJobStatus;
import com.delta.adsync.sync.model.SyncMode;
import com.delta.adsync.sync.model.SyncWatermark;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.sql.Date;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

@SpringBootTest
@ActiveProfiles("test")
@Transactional
class SyncJdbcRepositoryUpsertTest {
    @Autowired
    private SyncJdbcRepository syncRepository;

    @Autowired
    private CreativeJdbcRepository creativeRepository;

    @Autowired
    private NamedParameterJdbcTemplate jdbc;

    @Test
    void metricUpsertReplacesValuesForSameGrain() {
        LocalDate day = LocalDate.of(2024, 4, 1);
        syncRepository.upsertMetricRow(metric("c1", day, "10.50", 1000), Instant.parse("2024-04-02T00:00:00Z"));
        syncRepository.upsertMetricRow(metric("c1", day, "12.75", 1200), Instant.parse("2024-04-03T00:00:00Z"));
        syncRepository.upsertMetricRow(metric("c1", day.plusDays(1), "3.00", 10), Instant.parse("2024-04-03T00:00:00Z"));

        assertEquals(2, syncRepository.countMetricRows("tenant-metrics", "100", EntityLevel.CAMPAIGN));
        Map<String, Object> stored = jdbc.queryForMap(
            """
                SELECT spend, impressions
                FROM insights_daily
                WHERE tenant_id = :tenantId
                  AND entity_id = :entityId
                  AND metric_date = :metricDate
                """,
            new MapSqlParameterSource()
                .addValue("tenantId", "tenant-metrics")
                .addValue("entityId", "c1")
                .addValue("metricDate", Date.valueOf(day))
        );
        assertThat(new BigDecimal(stored.get("spend").toString())).isEqualByComparingTo("12.75");
        assertEquals(1200L, ((Number) stored.get("impressions")).longValue());
    }

    @Test
    void jobLeavesRunningExactlyOnce() {
        long jobId = syncRepository.insertSyncJob(
            "tenant-jobs",
            "200",
            SyncMode.DAILY,
            new DateRange(LocalDate.of(2024, 4, 1), LocalDate.of(2024, 4, 3)),
            Instant.parse("2024-04-04T00:00:00Z")
        );
        assertThat(syncRepository.findRunningJobs("tenant-jobs", "200")).extracting(SyncJob::id).containsExactly(jobId);

        boolean first = syncRepository.completeSyncJob(
            jobId, SyncJobStatus.COMPLETED, 6, Map.of("campaign", 6), 2, 0, null,
            Instant.parse("2024-04-04T00:00:05Z"), 5000L
        );
        boolean second = syncRepository.completeSyncJob(
            jobId, SyncJobStatus.FAILED, 0, Map.of(), 0, 0, "late failure",
            Instant.parse("2024-04-04T00:01:00Z"), 60000L
        );

        assertTrue(first);
        assertFalse(second);
        SyncJob job = syncRepository.findSyncJob(jobId);
        assertEquals(SyncJobStatus.COMPLETED, job.status());
        assertEquals(6, job.rowsSynced());
        assertEquals(Map.of("campaign", 6), job.rowsByLevel());
        assertNull(job.errorSummary());
        assertTrue(syncRepository.findRunningJobs("tenant-jobs", "200").isEmpty());
    }

    @Test
    void watermarkUpsertOverwritesExistingRow() {
        syncRepository.upsertWatermark(new SyncWatermark(
            "tenant-wm", "300", LocalDate.of(2024, 4, 1), null, null, null, true, Instant.parse("2024-04-02T00:00:00Z")
        ));
        syncRepository.upsertWatermark(new SyncWatermark(
            "tenant-wm", "300", LocalDate.of(2024, 4, 5), null, Instant.parse("2024-04-06T00:00:00Z"), null, false,
            Instant.parse("2024-04-06T00:00:00Z")
        ));

        SyncWatermark stored = syncRepository.findWatermark("tenant-wm", "300");
        assertNotNull(stored);
        assertEquals(LocalDate.of(2024, 4, 5), stored.lastDailyDateSynced());
        assertFalse(stored.syncEnabled());
        assertEquals(1, syncRepository.findWatermarks("tenant-wm").size());
        assertThat(syncRepository.findEnabledWatermarks()).noneMatch(w -> w.tenantId().equals("tenant-wm"));
    }

    @Test
    void creativeUpsertOverwritesPreviousRecord() {
        creativeRepository.upsertCreative(creative("ad-1", FetchStatus.PARTIAL, null, null));
        creativeRepository.upsertCreative(creative("ad-1", FetchStatus.SUCCESS, "https://cdn.example.com/hd.jpg", "Buy now"));
        creativeRepository.upsertCreative(creative("ad-2", FetchStatus.FAILED, null, null));

        Map<String, CreativeRecord> stored = creativeRepository.findCreatives("tenant-creatives", List.of("ad-1", "ad-2", "ad-missing"));

        assertThat(stored).containsOnlyKeys("ad-1", "ad-2");
        CreativeRecord first = stored.get("ad-1");
        assertEquals(FetchStatus.SUCCESS, first.fetchStatus());
        assertEquals("https://cdn.example.com/hd.jpg", first.imageUrlHd());
        assertEquals("Buy now", first.title());
        assertEquals(ResolutionQuality.HD, first.resolutionQuality());
        assertNull(creativeRepository.findCreative("tenant-other", "ad-1"));
    }

    private MetricRow metric(String entityId, LocalDate day, String spend, long impressions) {
        return new MetricRow(
            "tenant-metrics", "100", EntityLevel.CAMPAIGN, entityId, "Campaign " + entityId, day,
            entityId, null,
            new BigDecimal(spend), impressions, 800, 25, 20,
            new BigDecimal("2.5"), new BigDecimal("0.42"), new BigDecimal("10.5"), new BigDecimal("1.25"),
            2, BigDecimal.ZERO, BigDecimal.ZERO, BigDecimal.ZERO,
            "[]", "[]"
        );
    }

    private CreativeRecord creative(String adId, FetchStatus status, String hdUrl, String title) {
        return new CreativeRecord(
            "tenant-creatives", adId, "100", "Ad " + adId, "cr-" + adId, CreativeType.IMAGE,
            hdUrl, hdUrl, null, hdUrl == null ? null : 1200, hdUrl == null ? null : 1200,
            hdUrl == null ? ResolutionQuality.UNKNOWN : ResolutionQuality.HD, hdUrl == null ? null : "direct_url",
            null, null, null, title, null, null, null, null,
            status, false, 0, null, null, null, null, 1, Instant.parse("2024-04-04T00:00:00Z")
        );
    }
}
