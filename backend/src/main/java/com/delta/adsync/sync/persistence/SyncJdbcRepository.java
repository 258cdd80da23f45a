package com.delta.adsync.sync.persistence;

import com.delta.adsync.sync.model.CatalogEntity;
import com.delta.adsync.sync.model.DateRange;
import com.delta.adsync.sync.model.EntityLevel;
import com.delta.adsync.sync.model.MetricRow;
import com.delta.adsync.sync.model.SyncJob;
import com.delta.adsync.sync.model.SyncJobStatus;
import com.delta.adsync.sync.model.SyncMode;
import com.delta.adsync.sync.model.SyncWatermark;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.jdbc.support.GeneratedKeyHolder;
import org.springframework.jdbc.support.KeyHolder;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.time.LocalDate;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static com.delta.adsync.sync.persistence.JdbcSupport.nullableLong;
import static com.delta.adsync.sync.persistence.JdbcSupport.toInstant;
import static com.delta.adsync.sync.persistence.JdbcSupport.toLocalDate;
import static com.delta.adsync.sync.persistence.JdbcSupport.toSqlDate;
import static com.delta.adsync.sync.persistence.JdbcSupport.toTimestamp;
import static com.delta.adsync.sync.persistence.JdbcSupport.truncate;

@Repository
public class SyncJdbcRepository {
    private static final Logger log = LoggerFactory.getLogger(SyncJdbcRepository.class);
    private static final TypeReference<Map<String, Integer>> MAP_INT = new TypeReference<>() {};
    private static final String JOB_COLUMNS = """
        id,
        tenant_id,
        external_account_id,
        job_kind,
        date_from,
        date_to,
        status,
        rows_synced,
        rows_by_level,
        entities_synced,
        creatives_synced,
        error_summary,
        started_at,
        ended_at,
        duration_ms
        """;
    private static final String WATERMARK_COLUMNS = """
        tenant_id,
        external_account_id,
        last_daily_date_synced,
        last_intraday_synced_at,
        last_success_at,
        last_error,
        sync_enabled,
        updated_at
        """;

    private final NamedParameterJdbcTemplate jdbc;
    private final ObjectMapper objectMapper;
    private final boolean postgres;

    public SyncJdbcRepository(NamedParameterJdbcTemplate jdbc, ObjectMapper objectMapper) {
        this.jdbc = jdbc;
        this.objectMapper = objectMapper;
        this.postgres = JdbcSupport.detectPostgres(jdbc);
    }

    public long insertSyncJob(String tenantId, String externalAccountId, SyncMode jobKind, DateRange range, Instant startedAt) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("tenantId", tenantId)
            .addValue("accountId", externalAccountId)
            .addValue("jobKind", jobKind.dbValue())
            .addValue("dateFrom", range == null ? null : toSqlDate(range.since()))
            .addValue("dateTo", range == null ? null : toSqlDate(range.until()))
            .addValue("status", SyncJobStatus.RUNNING.dbValue())
            .addValue("startedAt", toTimestamp(startedAt));
        KeyHolder keyHolder = new GeneratedKeyHolder();
        jdbc.update(
            """
                INSERT INTO sync_jobs (
                    tenant_id,
                    external_account_id,
                    job_kind,
                    date_from,
                    date_to,
                    status,
                    rows_synced,
                    entities_synced,
                    creatives_synced,
                    started_at
                )
                VALUES (
                    :tenantId,
                    :accountId,
                    :jobKind,
                    :dateFrom,
                    :dateTo,
                    :status,
                    0,
                    0,
                    0,
                    :startedAt
                )
                """,
            params,
            keyHolder,
            new String[]{"id"}
        );
        Number key = keyHolder.getKey();
        if (key == null) {
            throw new IllegalStateException("Failed to insert sync job for account " + externalAccountId);
        }
        return key.longValue();
    }

    /**
     * Moves a running job to a terminal state. Terminal rows are never touched again; the return
     * value says whether this call performed the transition.
     */
    public boolean completeSyncJob(
        long jobId,
        SyncJobStatus status,
        int rowsSynced,
        Map<String, Integer> rowsByLevel,
        int entitiesSynced,
        int creativesSynced,
        String errorSummary,
        Instant endedAt,
        long durationMs
    ) {
        if (!status.isTerminal()) {
            throw new IllegalArgumentException("Jobs can only be completed into a terminal status");
        }
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("jobId", jobId)
            .addValue("status", status.dbValue())
            .addValue("running", SyncJobStatus.RUNNING.dbValue())
            .addValue("rowsSynced", Math.max(0, rowsSynced))
            .addValue("rowsByLevel", writeJson(rowsByLevel))
            .addValue("entitiesSynced", Math.max(0, entitiesSynced))
            .addValue("creativesSynced", Math.max(0, creativesSynced))
            .addValue("errorSummary", truncate(errorSummary, 8000))
            .addValue("endedAt", toTimestamp(endedAt))
            .addValue("durationMs", Math.max(0L, durationMs));
        int updated = jdbc.update(
            """
                UPDATE sync_jobs
                SET status = :status,
                    rows_synced = :rowsSynced,
                    rows_by_level = :rowsByLevel,
                    entities_synced = :entitiesSynced,
                    creatives_synced = :creativesSynced,
                    error_summary = :errorSummary,
                    ended_at = :endedAt,
                    duration_ms = :durationMs
                WHERE id = :jobId
                  AND status = :running
                """,
            params
        );
        if (updated == 0) {
            log.warn("Sync job {} was already terminal, ignoring transition to {}", jobId, status);
        }
        return updated > 0;
    }

    public SyncJob findSyncJob(long jobId) {
        List<SyncJob> rows = jdbc.query(
            "SELECT " + JOB_COLUMNS + " FROM sync_jobs WHERE id = :id",
            new MapSqlParameterSource("id", jobId),
            jobMapper()
        );
        return rows.isEmpty() ? null : rows.get(0);
    }

    public List<SyncJob> findRecentJobs(String tenantId, int limit) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("tenantId", tenantId)
            .addValue("limit", Math.max(1, Math.min(limit, 500)));
        return jdbc.query(
            "SELECT " + JOB_COLUMNS + """
                FROM sync_jobs
                WHERE tenant_id = :tenantId
                ORDER BY started_at DESC, id DESC
                LIMIT :limit
                """,
            params,
            jobMapper()
        );
    }

    public List<SyncJob> findRunningJobs(String tenantId) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("tenantId", tenantId)
            .addValue("running", SyncJobStatus.RUNNING.dbValue());
        return jdbc.query(
            "SELECT " + JOB_COLUMNS + """
                FROM sync_jobs
                WHERE tenant_id = :tenantId
                  AND status = :running
                ORDER BY started_at
                """,
            params,
            jobMapper()
        );
    }

    public List<SyncJob> findRunningJobs(String tenantId, String externalAccountId) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("tenantId", tenantId)
            .addValue("accountId", externalAccountId)
            .addValue("running", SyncJobStatus.RUNNING.dbValue());
        return jdbc.query(
            "SELECT " + JOB_COLUMNS + """
                FROM sync_jobs
                WHERE tenant_id = :tenantId
                  AND external_account_id = :accountId
                  AND status = :running
                ORDER BY started_at
                """,
            params,
            jobMapper()
        );
    }

    public SyncWatermark findWatermark(String tenantId, String externalAccountId) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("tenantId", tenantId)
            .addValue("accountId", externalAccountId);
        List<SyncWatermark> rows = jdbc.query(
            "SELECT " + WATERMARK_COLUMNS + """
                FROM sync_watermarks
                WHERE tenant_id = :tenantId
                  AND external_account_id = :accountId
                """,
            params,
            watermarkMapper()
        );
        return rows.isEmpty() ? null : rows.get(0);
    }

    public List<SyncWatermark> findWatermarks(String tenantId) {
        return jdbc.query(
            "SELECT " + WATERMARK_COLUMNS + " FROM sync_watermarks WHERE tenant_id = :tenantId ORDER BY external_account_id",
            new MapSqlParameterSource("tenantId", tenantId),
            watermarkMapper()
        );
    }

    public List<SyncWatermark> findEnabledWatermarks() {
        return jdbc.query(
            "SELECT " + WATERMARK_COLUMNS + " FROM sync_watermarks WHERE sync_enabled = TRUE ORDER BY tenant_id, external_account_id",
            new MapSqlParameterSource(),
            watermarkMapper()
        );
    }

    public void upsertWatermark(SyncWatermark watermark) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("tenantId", watermark.tenantId())
            .addValue("accountId", watermark.externalAccountId())
            .addValue("lastDaily", toSqlDate(watermark.lastDailyDateSynced()))
            .addValue("lastIntraday", toTimestamp(watermark.lastIntradaySyncedAt()))
            .addValue("lastSuccess", toTimestamp(watermark.lastSuccessAt()))
            .addValue("lastError", truncate(watermark.lastError(), 4000))
            .addValue("enabled", watermark.syncEnabled())
            .addValue("updatedAt", toTimestamp(watermark.updatedAt() == null ? Instant.now() : watermark.updatedAt()));
        if (postgres) {
            jdbc.update(
                """
                    INSERT INTO sync_watermarks (
                        tenant_id,
                        external_account_id,
                        last_daily_date_synced,
                        last_intraday_synced_at,
                        last_success_at,
                        last_error,
                        sync_enabled,
                        updated_at
                    )
                    VALUES (
                        :tenantId,
                        :accountId,
                        :lastDaily,
                        :lastIntraday,
                        :lastSuccess,
                        :lastError,
                        :enabled,
                        :updatedAt
                    )
                    ON CONFLICT (tenant_id, external_account_id)
                    DO UPDATE SET
                        last_daily_date_synced = EXCLUDED.last_daily_date_synced,
                        last_intraday_synced_at = EXCLUDED.last_intraday_synced_at,
                        last_success_at = EXCLUDED.last_success_at,
                        last_error = EXCLUDED.last_error,
                        sync_enabled = EXCLUDED.sync_enabled,
                        updated_at = EXCLUDED.updated_at
                    """,
                params
            );
            return;
        }
        String update = """
            UPDATE sync_watermarks
            SET last_daily_date_synced = :lastDaily,
                last_intraday_synced_at = :lastIntraday,
                last_success_at = :lastSuccess,
                last_error = :lastError,
                sync_enabled = :enabled,
                updated_at = :updatedAt
            WHERE tenant_id = :tenantId
              AND external_account_id = :accountId
            """;
        if (jdbc.update(update, params) > 0) {
            return;
        }
        try {
            jdbc.update(
                """
                    INSERT INTO sync_watermarks (
                        tenant_id,
                        external_account_id,
                        last_daily_date_synced,
                        last_intraday_synced_at,
                        last_success_at,
                        last_error,
                        sync_enabled,
                        updated_at
                    )
                    VALUES (
                        :tenantId,
                        :accountId,
                        :lastDaily,
                        :lastIntraday,
                        :lastSuccess,
                        :lastError,
                        :enabled,
                        :updatedAt
                    )
                    """,
                params
            );
        } catch (DataIntegrityViolationException e) {
            jdbc.update(update, params);
        }
    }

    public void insertRawInsight(
        String tenantId,
        String externalAccountId,
        Long syncJobId,
        EntityLevel level,
        String entityId,
        LocalDate dateStart,
        LocalDate dateStop,
        String payload,
        Instant fetchedAt
    ) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("tenantId", tenantId)
            .addValue("accountId", externalAccountId)
            .addValue("jobId", syncJobId)
            .addValue("level", level.apiValue())
            .addValue("entityId", entityId)
            .addValue("dateStart", toSqlDate(dateStart))
            .addValue("dateStop", toSqlDate(dateStop))
            .addValue("payload", payload)
            .addValue("fetchedAt", toTimestamp(fetchedAt));
        jdbc.update(
            """
                INSERT INTO insights_raw (
                    tenant_id,
                    external_account_id,
                    sync_job_id,
                    entity_level,
                    entity_id,
                    date_start,
                    date_stop,
                    payload,
                    fetched_at
                )
                VALUES (
                    :tenantId,
                    :accountId,
                    :jobId,
                    :level,
                    :entityId,
                    :dateStart,
                    :dateStop,
                    :payload,
                    :fetchedAt
                )
                """,
            params
        );
    }

    public void upsertMetricRow(MetricRow row, Instant syncedAt) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("tenantId", row.tenantId())
            .addValue("accountId", row.externalAccountId())
            .addValue("level", row.level().apiValue())
            .addValue("entityId", row.entityId())
            .addValue("metricDate", toSqlDate(row.metricDate()))
            .addValue("entityName", truncate(row.entityName(), 512))
            .addValue("campaignId", row.campaignId())
            .addValue("adsetId", row.adsetId())
            .addValue("spend", row.spend())
            .addValue("impressions", row.impressions())
            .addValue("reach", row.reach())
            .addValue("clicks", row.clicks())
            .addValue("uniqueClicks", row.uniqueClicks())
            .addValue("ctr", row.ctr())
            .addValue("cpc", row.cpc())
            .addValue("cpm", row.cpm())
            .addValue("frequency", row.frequency())
            .addValue("leads", row.leads())
            .addValue("conversions", row.conversions())
            .addValue("conversionValue", row.conversionValue())
            .addValue("purchaseValue", row.purchaseValue())
            .addValue("actionsJson", row.actionsJson())
            .addValue("actionValuesJson", row.actionValuesJson())
            .addValue("syncedAt", toTimestamp(syncedAt));
        String insert = """
            INSERT INTO insights_daily (
                tenant_id,
                external_account_id,
                entity_level,
                entity_id,
                metric_date,
                entity_name,
                campaign_id,
                adset_id,
                spend,
                impressions,
                reach,
                clicks,
                unique_clicks,
                ctr,
                cpc,
                cpm,
                frequency,
                leads,
                conversions,
                conversion_value,
                purchase_value,
                actions_json,
                action_values_json,
                synced_at
            )
            VALUES (
                :tenantId,
                :accountId,
                :level,
                :entityId,
                :metricDate,
                :entityName,
                :campaignId,
                :adsetId,
                :spend,
                :impressions,
                :reach,
                :clicks,
                :uniqueClicks,
                :ctr,
                :cpc,
                :cpm,
                :frequency,
                :leads,
                :conversions,
                :conversionValue,
                :purchaseValue,
                :actionsJson,
                :actionValuesJson,
                :syncedAt
            )
            """;
        if (postgres) {
            jdbc.update(
                insert + """
                    ON CONFLICT (tenant_id, external_account_id, entity_level, entity_id, metric_date)
                    DO UPDATE SET
                        entity_name = EXCLUDED.entity_name,
                        campaign_id = EXCLUDED.campaign_id,
                        adset_id = EXCLUDED.adset_id,
                        spend = EXCLUDED.spend,
                        impressions = EXCLUDED.impressions,
                        reach = EXCLUDED.reach,
                        clicks = EXCLUDED.clicks,
                        unique_clicks = EXCLUDED.unique_clicks,
                        ctr = EXCLUDED.ctr,
                        cpc = EXCLUDED.cpc,
                        cpm = EXCLUDED.cpm,
                        frequency = EXCLUDED.frequency,
                        leads = EXCLUDED.leads,
                        conversions = EXCLUDED.conversions,
                        conversion_value = EXCLUDED.conversion_value,
                        purchase_value = EXCLUDED.purchase_value,
                        actions_json = EXCLUDED.actions_json,
                        action_values_json = EXCLUDED.action_values_json,
                        synced_at = EXCLUDED.synced_at
                    """,
                params
            );
            return;
        }
        String update = """
            UPDATE insights_daily
            SET entity_name = :entityName,
                campaign_id = :campaignId,
                adset_id = :adsetId,
                spend = :spend,
                impressions = :impressions,
                reach = :reach,
                clicks = :clicks,
                unique_clicks = :uniqueClicks,
                ctr = :ctr,
                cpc = :cpc,
                cpm = :cpm,
                frequency = :frequency,
                leads = :leads,
                conversions = :conversions,
                conversion_value = :conversionValue,
                purchase_value = :purchaseValue,
                actions_json = :actionsJson,
                action_values_json = :actionValuesJson,
                synced_at = :syncedAt
            WHERE tenant_id = :tenantId
              AND external_account_id = :accountId
              AND entity_level = :level
              AND entity_id = :entityId
              AND metric_date = :metricDate
            """;
        if (jdbc.update(update, params) > 0) {
            return;
        }
        try {
            jdbc.update(insert, params);
        } catch (DataIntegrityViolationException e) {
            jdbc.update(update, params);
        }
    }

    public int countMetricRows(String tenantId, String externalAccountId, EntityLevel level) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("tenantId", tenantId)
            .addValue("accountId", externalAccountId)
            .addValue("level", level.apiValue());
        Integer count = jdbc.queryForObject(
            """
                SELECT COUNT(*)
                FROM insights_daily
                WHERE tenant_id = :tenantId
                  AND external_account_id = :accountId
                  AND entity_level = :level
                """,
            params,
            Integer.class
        );
        return count == null ? 0 : count;
    }

    public void upsertCatalogEntity(CatalogEntity entity, Instant syncedAt) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("tenantId", entity.tenantId())
            .addValue("accountId", entity.externalAccountId())
            .addValue("entityType", entity.entityType().apiValue())
            .addValue("entityId", entity.entityId())
            .addValue("name", truncate(entity.name(), 512))
            .addValue("status", entity.status())
            .addValue("effectiveStatus", entity.effectiveStatus())
            .addValue("objective", entity.objective())
            .addValue("campaignId", entity.campaignId())
            .addValue("adsetId", entity.adsetId())
            .addValue("dailyBudget", entity.dailyBudget())
            .addValue("lifetimeBudget", entity.lifetimeBudget())
            .addValue("rawJson", entity.rawJson())
            .addValue("syncedAt", toTimestamp(syncedAt));
        String insert = """
            INSERT INTO entity_catalog (
                tenant_id,
                external_account_id,
                entity_type,
                entity_id,
                name,
                status,
                effective_status,
                objective,
                campaign_id,
                adset_id,
                daily_budget,
                lifetime_budget,
                raw_json,
                last_synced_at
            )
            VALUES (
                :tenantId,
                :accountId,
                :entityType,
                :entityId,
                :name,
                :status,
                :effectiveStatus,
                :objective,
                :campaignId,
                :adsetId,
                :dailyBudget,
                :lifetimeBudget,
                :rawJson,
                :syncedAt
            )
            """;
        if (postgres) {
            jdbc.update(
                insert + """
                    ON CONFLICT (tenant_id, external_account_id, entity_type, entity_id)
                    DO UPDATE SET
                        name = EXCLUDED.name,
                        status = EXCLUDED.status,
                        effective_status = EXCLUDED.effective_status,
                        objective = EXCLUDED.objective,
                        campaign_id = EXCLUDED.campaign_id,
                        adset_id = EXCLUDED.adset_id,
                        daily_budget = EXCLUDED.daily_budget,
                        lifetime_budget = EXCLUDED.lifetime_budget,
                        raw_json = EXCLUDED.raw_json,
                        last_synced_at = EXCLUDED.last_synced_at
                    """,
                params
            );
            return;
        }
        String update = """
            UPDATE entity_catalog
            SET name = :name,
                status = :status,
                effective_status = :effectiveStatus,
                objective = :objective,
                campaign_id = :campaignId,
                adset_id = :adsetId,
                daily_budget = :dailyBudget,
                lifetime_budget = :lifetimeBudget,
                raw_json = :rawJson,
                last_synced_at = :syncedAt
            WHERE tenant_id = :tenantId
              AND external_account_id = :accountId
              AND entity_type = :entityType
              AND entity_id = :entityId
            """;
        if (jdbc.update(update, params) > 0) {
            return;
        }
        try {
            jdbc.update(insert, params);
        } catch (DataIntegrityViolationException e) {
            jdbc.update(update, params);
        }
    }

    public Instant findLatestCatalogSync(String tenantId, String externalAccountId) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("tenantId", tenantId)
            .addValue("accountId", externalAccountId);
        List<Instant> rows = jdbc.query(
            """
                SELECT MAX(last_synced_at) AS latest
                FROM entity_catalog
                WHERE tenant_id = :tenantId
                  AND external_account_id = :accountId
                """,
            params,
            (rs, rowNum) -> toInstant(rs.getTimestamp("latest"))
        );
        return rows.isEmpty() ? null : rows.get(0);
    }

    private RowMapper<SyncJob> jobMapper() {
        return (rs, rowNum) -> new SyncJob(
            rs.getLong("id"),
            rs.getString("tenant_id"),
            rs.getString("external_account_id"),
            SyncMode.fromString(rs.getString("job_kind")),
            toLocalDate(rs.getDate("date_from")),
            toLocalDate(rs.getDate("date_to")),
            SyncJobStatus.fromDb(rs.getString("status")),
            rs.getInt("rows_synced"),
            readJson(rs.getString("rows_by_level")),
            rs.getInt("entities_synced"),
            rs.getInt("creatives_synced"),
            rs.getString("error_summary"),
            toInstant(rs.getTimestamp("started_at")),
            toInstant(rs.getTimestamp("ended_at")),
            nullableLong(rs, "duration_ms")
        );
    }

    private RowMapper<SyncWatermark> watermarkMapper() {
        return (rs, rowNum) -> new SyncWatermark(
            rs.getString("tenant_id"),
            rs.getString("external_account_id"),
            toLocalDate(rs.getDate("last_daily_date_synced")),
            toInstant(rs.getTimestamp("last_intraday_synced_at")),
            toInstant(rs.getTimestamp("last_success_at")),
            rs.getString("last_error"),
            rs.getBoolean("sync_enabled"),
            toInstant(rs.getTimestamp("updated_at"))
        );
    }

    private String writeJson(Map<String, Integer> counts) {
        if (counts == null || counts.isEmpty()) {
            return null;
        }
        try {
            return objectMapper.writeValueAsString(counts);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Unable to serialize row counts", e);
        }
    }

    private Map<String, Integer> readJson(String raw) {
        if (raw == null || raw.isBlank()) {
            return Map.of();
        }
        try {
            return new LinkedHashMap<>(objectMapper.readValue(raw, MAP_INT));
        } catch (JsonProcessingException e) {
            log.warn("Unreadable rows_by_level value: {}", raw);
            return Map.of();
        }
    }
}
