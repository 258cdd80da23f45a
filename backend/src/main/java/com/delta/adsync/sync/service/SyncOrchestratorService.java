package com.delta.adsync.sync.service;

import com.delta.adsync.config.AdSyncProperties;
import com.delta.adsync.sync.creative.CreativeResolver;
import com.delta.adsync.sync.http.GraphApiClient;
import com.delta.adsync.sync.http.GraphApiException;
import com.delta.adsync.sync.http.GraphAuthException;
import com.delta.adsync.sync.http.PagedRows;
import com.delta.adsync.sync.model.AccountSyncSummary;
import com.delta.adsync.sync.model.AdAccount;
import com.delta.adsync.sync.model.BatchResolutionResult;
import com.delta.adsync.sync.model.DateRange;
import com.delta.adsync.sync.model.EntityLevel;
import com.delta.adsync.sync.model.EntitySyncSummary;
import com.delta.adsync.sync.model.MetricRow;
import com.delta.adsync.sync.model.SyncJob;
import com.delta.adsync.sync.model.SyncJobStatus;
import com.delta.adsync.sync.model.SyncMode;
import com.delta.adsync.sync.model.SyncRunRequest;
import com.delta.adsync.sync.model.SyncRunSummary;
import com.delta.adsync.sync.model.SyncWatermark;
import com.delta.adsync.sync.persistence.SyncJdbcRepository;
import com.delta.adsync.sync.util.GraphIds;
import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ExecutorService;

/**
 * Runs metric syncs. Accounts in one invocation are processed one after another and each gets its
 * own job row; a failing account is reported in the summary and never stops its siblings.
 */
@Service
public class SyncOrchestratorService {
    private static final Logger log = LoggerFactory.getLogger(SyncOrchestratorService.class);
    static final String INSIGHT_FIELDS = "campaign_id,campaign_name,adset_id,adset_name,ad_id,ad_name,"
        + "date_start,date_stop,spend,impressions,reach,clicks,ctr,cpc,cpm,frequency,unique_clicks,actions,action_values";
    private static final int MAX_ERROR_SUMMARY = 4000;

    private final SyncJdbcRepository repository;
    private final GraphApiClient graphApiClient;
    private final ConnectionService connectionService;
    private final CreativeResolver creativeResolver;
    private final EntityCatalogService entityCatalogService;
    private final SyncDateRanges dateRanges;
    private final ExecutorService syncRunExecutor;
    private final AdSyncProperties properties;
    private final Clock clock;

    public SyncOrchestratorService(
        SyncJdbcRepository repository,
        GraphApiClient graphApiClient,
        ConnectionService connectionService,
        CreativeResolver creativeResolver,
        EntityCatalogService entityCatalogService,
        SyncDateRanges dateRanges,
        @Qualifier("syncRunExecutor") ExecutorService syncRunExecutor,
        AdSyncProperties properties,
        Clock clock
    ) {
        this.repository = repository;
        this.graphApiClient = graphApiClient;
        this.connectionService = connectionService;
        this.creativeResolver = creativeResolver;
        this.entityCatalogService = entityCatalogService;
        this.dateRanges = dateRanges;
        this.syncRunExecutor = syncRunExecutor;
        this.properties = properties;
        this.clock = clock;
    }

    public SyncRunSummary runSync(SyncRunRequest request) {
        validate(request);
        SyncMode mode = request.syncMode();
        List<EntityLevel> levels = request.normalizedLevels(properties.getSync().getDefaultLevels());
        List<String> accounts = resolveScope(request);
        Instant startedAt = clock.instant();
        log.info(
            "Starting {} sync for tenant {} over {} account(s), levels={}",
            mode.dbValue(),
            request.tenantId(),
            accounts.size(),
            levels
        );

        List<AccountSyncSummary> summaries = new ArrayList<>();
        List<String> errors = new ArrayList<>();
        for (String accountId : accounts) {
            AccountSyncSummary summary;
            try {
                summary = syncAccount(request, accountId, mode, levels);
            } catch (ActiveSyncJobException e) {
                log.warn("Skipping account {}: {}", accountId, e.getMessage());
                summary = rejected(accountId, e.getMessage());
            } catch (RuntimeException e) {
                log.warn("Sync failed for account {}", accountId, e);
                summary = rejected(accountId, describe(e));
            }
            summaries.add(summary);
            for (String error : summary.errors()) {
                errors.add(accountId + ": " + error);
            }
        }

        int synced = 0;
        int rows = 0;
        int creatives = 0;
        for (AccountSyncSummary summary : summaries) {
            if (summary.succeeded()) {
                synced++;
            }
            rows += summary.rowsSynced();
            creatives += summary.creativesResolved();
        }
        Instant finishedAt = clock.instant();
        log.info(
            "Finished {} sync for tenant {}: synced={} failed={} rows={} creatives={}",
            mode.dbValue(),
            request.tenantId(),
            synced,
            summaries.size() - synced,
            rows,
            creatives
        );
        return new SyncRunSummary(
            request.tenantId(),
            mode,
            startedAt,
            finishedAt,
            accounts.size(),
            synced,
            summaries.size() - synced,
            rows,
            creatives,
            summaries,
            errors
        );
    }

    /**
     * Validates the request and hands it to the background executor.
     *
     * @return the accounts the run will cover
     */
    public List<String> startAsync(SyncRunRequest request) {
        validate(request);
        List<String> accounts = resolveScope(request);
        SyncRunRequest scoped = new SyncRunRequest(
            request.tenantId(),
            accounts,
            request.mode(),
            request.daysBack(),
            request.dateFrom(),
            request.dateTo(),
            request.levels(),
            request.syncCreatives(),
            request.syncEntities()
        );
        syncRunExecutor.submit(() -> {
            try {
                runSync(scoped);
            } catch (RuntimeException e) {
                log.warn("Background sync for tenant {} failed", request.tenantId(), e);
            }
        });
        return accounts;
    }

    /**
     * Explicit account ids are synced even when their watermark is disabled; an empty scope means
     * every bound account of the tenant that is still enabled.
     */
    List<String> resolveScope(SyncRunRequest request) {
        List<String> explicit = request.normalizedAccountIds();
        if (!explicit.isEmpty()) {
            return explicit;
        }
        Set<String> disabled = new LinkedHashSet<>();
        for (SyncWatermark watermark : repository.findWatermarks(request.tenantId())) {
            if (!watermark.syncEnabled()) {
                disabled.add(watermark.externalAccountId());
            }
        }
        List<String> out = new ArrayList<>();
        for (AdAccount account : connectionService.findAccounts(request.tenantId())) {
            if (!disabled.contains(account.externalAccountId())) {
                out.add(account.externalAccountId());
            }
        }
        return out;
    }

    private AccountSyncSummary syncAccount(SyncRunRequest request, String accountId, SyncMode mode, List<EntityLevel> levels) {
        String tenantId = request.tenantId();
        AdAccount account = connectionService.findAccount(tenantId, accountId);
        if (account == null) {
            return rejected(accountId, "Unknown ad account " + accountId);
        }
        ensureNoActiveJob(tenantId, accountId);
        DateRange range = dateRanges.rangeFor(request, account.timezoneName());
        Instant startedAt = clock.instant();
        long jobId = repository.insertSyncJob(tenantId, accountId, mode, range, startedAt);
        log.info("Sync job {} started for account {} ({} {}..{})", jobId, accountId, mode.dbValue(), range.since(), range.until());

        List<String> errors = new ArrayList<>();
        Map<String, Integer> rowsByLevel = new LinkedHashMap<>();
        Set<String> adIds = new LinkedHashSet<>();
        Map<String, String> creativeErrors = new LinkedHashMap<>();
        int rowsSynced = 0;
        int entitiesSynced = 0;
        int creativesResolved = 0;
        try {
            String accessToken = connectionService.resolveAccessToken(account);
            boolean authRejected = false;
            for (EntityLevel level : levels) {
                try {
                    int written = syncLevel(tenantId, accountId, jobId, level, range, accessToken, adIds, errors);
                    rowsByLevel.put(level.apiValue(), written);
                    rowsSynced += written;
                } catch (GraphAuthException e) {
                    errors.add(level.apiValue() + ": " + e.getMessage());
                    handleAuthFailure(account, e);
                    authRejected = true;
                    break;
                } catch (GraphApiException | DataAccessException e) {
                    log.warn("Level {} failed for account {}", level.apiValue(), accountId, e);
                    errors.add(level.apiValue() + ": " + e.getMessage());
                }
            }

            if (!authRejected && request.entitiesRequested()) {
                try {
                    EntitySyncSummary entities = entityCatalogService.syncEntities(tenantId, accountId, accessToken, false);
                    entitiesSynced = entities.total();
                    for (String error : entities.errors()) {
                        errors.add("entities " + error);
                    }
                } catch (GraphAuthException e) {
                    errors.add("entities: " + e.getMessage());
                    handleAuthFailure(account, e);
                    authRejected = true;
                }
            }

            if (!authRejected && request.creativesRequested() && !adIds.isEmpty()) {
                try {
                    BatchResolutionResult creatives = creativeResolver.resolveCreativesBatch(
                        tenantId,
                        new ArrayList<>(adIds),
                        accountId,
                        accessToken,
                        true
                    );
                    creativesResolved = creatives.resolvedCount();
                    creativeErrors.putAll(creatives.errors());
                } catch (GraphAuthException e) {
                    errors.add("creatives: " + e.getMessage());
                    handleAuthFailure(account, e);
                }
            }
        } catch (ConnectionUnavailableException e) {
            log.warn("No usable connection for account {}: {}", accountId, e.getMessage());
            errors.add(e.getMessage());
        } catch (RuntimeException e) {
            log.warn("Sync job {} failed for account {}", jobId, accountId, e);
            errors.add(describe(e));
        }

        SyncJobStatus status = errors.isEmpty() ? SyncJobStatus.COMPLETED : SyncJobStatus.FAILED;
        String errorSummary = errors.isEmpty() ? null : truncate(String.join("; ", errors));
        Instant endedAt = clock.instant();
        repository.completeSyncJob(
            jobId,
            status,
            rowsSynced,
            rowsByLevel,
            entitiesSynced,
            creativesResolved,
            errorSummary,
            endedAt,
            Duration.between(startedAt, endedAt).toMillis()
        );
        updateWatermark(tenantId, accountId, mode, range, status, errorSummary, endedAt);
        log.info(
            "Sync job {} for account {} finished {}: rows={} entities={} creatives={} errors={}",
            jobId,
            accountId,
            status.dbValue(),
            rowsSynced,
            entitiesSynced,
            creativesResolved,
            errors.size()
        );
        return new AccountSyncSummary(
            accountId,
            jobId,
            status,
            range,
            rowsByLevel,
            rowsSynced,
            entitiesSynced,
            creativesResolved,
            creativeErrors,
            errors
        );
    }

    /**
     * Pulls every page of one level, writing the raw row before its normalized upsert. Ad ids seen
     * at ad level are collected for creative resolution.
     */
    private int syncLevel(
        String tenantId,
        String accountId,
        long jobId,
        EntityLevel level,
        DateRange range,
        String accessToken,
        Set<String> adIds,
        List<String> errors
    ) {
        PagedRows page = graphApiClient.fetchAllPages(insightsUrl(accountId, level, range, accessToken));
        if (page.truncated()) {
            errors.add(level.apiValue() + ": pagination stopped after " + page.pagesFetched() + " pages");
        }
        Instant fetchedAt = clock.instant();
        int written = 0;
        for (JsonNode row : page.rows()) {
            MetricRow metric = InsightRowNormalizer.normalize(tenantId, accountId, level, row);
            if (metric == null) {
                log.debug("Skipping {} insight row without id or date for account {}", level.apiValue(), accountId);
                continue;
            }
            repository.insertRawInsight(
                tenantId,
                accountId,
                jobId,
                level,
                metric.entityId(),
                metric.metricDate(),
                parseDate(row.path("date_stop").asText(null)),
                row.toString(),
                fetchedAt
            );
            repository.upsertMetricRow(metric, fetchedAt);
            if (level == EntityLevel.AD) {
                adIds.add(metric.entityId());
            }
            written++;
        }
        return written;
    }

    String insightsUrl(String accountId, EntityLevel level, DateRange range, String accessToken) {
        Map<String, String> params = new LinkedHashMap<>();
        params.put("level", level.apiValue());
        params.put("fields", INSIGHT_FIELDS);
        params.put("time_range", "{\"since\":\"" + range.since() + "\",\"until\":\"" + range.until() + "\"}");
        params.put("time_increment", "1");
        params.put("limit", String.valueOf(properties.getGraph().getPageSize()));
        params.put("access_token", accessToken);
        return graphApiClient.graphUrl(GraphIds.accountNode(accountId) + "/insights", params);
    }

    /**
     * Refuses to start while a recent job for the account is still running. Running jobs older than
     * the timeout are treated as abandoned and closed as failed.
     */
    private void ensureNoActiveJob(String tenantId, String accountId) {
        Instant now = clock.instant();
        Instant cutoff = now.minus(Duration.ofMinutes(properties.getSync().getActiveJobTimeoutMinutes()));
        for (SyncJob job : repository.findRunningJobs(tenantId, accountId)) {
            if (job.startedAt() != null && job.startedAt().isAfter(cutoff)) {
                throw new ActiveSyncJobException(
                    "Active sync job in progress for account " + accountId + " (id=" + job.id() + ", startedAt=" + job.startedAt() + ")"
                );
            }
            log.info("Closing abandoned sync job {} for account {} started at {}", job.id(), accountId, job.startedAt());
            repository.completeSyncJob(
                job.id(),
                SyncJobStatus.FAILED,
                job.rowsSynced(),
                job.rowsByLevel(),
                job.entitiesSynced(),
                job.creativesSynced(),
                "Abandoned: no completion within " + properties.getSync().getActiveJobTimeoutMinutes() + " minutes",
                now,
                job.startedAt() == null ? 0L : Duration.between(job.startedAt(), now).toMillis()
            );
        }
    }

    /**
     * The daily cursor only moves forward and only for a completed daily job; the intraday stamp
     * moves only on success.
     */
    private void updateWatermark(
        String tenantId,
        String accountId,
        SyncMode mode,
        DateRange range,
        SyncJobStatus status,
        String errorSummary,
        Instant now
    ) {
        try {
            SyncWatermark existing = repository.findWatermark(tenantId, accountId);
            boolean success = status == SyncJobStatus.COMPLETED;
            LocalDate lastDaily = existing == null ? null : existing.lastDailyDateSynced();
            if (success && mode == SyncMode.DAILY && (lastDaily == null || range.until().isAfter(lastDaily))) {
                lastDaily = range.until();
            }
            Instant lastIntraday = existing == null ? null : existing.lastIntradaySyncedAt();
            if (success && mode == SyncMode.INTRADAY) {
                lastIntraday = now;
            }
            Instant lastSuccess = success ? now : existing == null ? null : existing.lastSuccessAt();
            repository.upsertWatermark(new SyncWatermark(
                tenantId,
                accountId,
                lastDaily,
                lastIntraday,
                lastSuccess,
                success ? null : errorSummary,
                existing == null || existing.syncEnabled(),
                now
            ));
        } catch (DataAccessException e) {
            log.warn("Failed to update watermark for account {}", accountId, e);
        }
    }

    private void handleAuthFailure(AdAccount account, GraphAuthException e) {
        log.warn("Credential rejected while syncing account {}: {}", account.externalAccountId(), e.getMessage());
        if (account.primaryConnectionId() == null) {
            return;
        }
        try {
            connectionService.recordAuthFailure(account.primaryConnectionId(), e.getMessage());
        } catch (DataAccessException ex) {
            log.warn("Failed to record auth failure for connection {}", account.primaryConnectionId(), ex);
        }
    }

    private void validate(SyncRunRequest request) {
        if (request == null || request.tenantId() == null || request.tenantId().isBlank()) {
            throw new IllegalArgumentException("tenantId is required");
        }
        // throws on an unknown mode
        request.syncMode();
        if (request.normalizedLevels(properties.getSync().getDefaultLevels()).isEmpty()) {
            throw new IllegalArgumentException("At least one entity level is required");
        }
        if (request.dateFrom() != null && request.dateTo() != null && request.dateTo().isBefore(request.dateFrom())) {
            throw new IllegalArgumentException("dateTo is before dateFrom");
        }
    }

    private static AccountSyncSummary rejected(String accountId, String error) {
        return new AccountSyncSummary(
            accountId,
            null,
            SyncJobStatus.FAILED,
            null,
            Map.of(),
            0,
            0,
            0,
            Map.of(),
            List.of(error)
        );
    }

    private static LocalDate parseDate(String raw) {
        if (raw == null || raw.isBlank()) {
            return null;
        }
        try {
            return LocalDate.parse(raw);
        } catch (DateTimeParseException e) {
            return null;
        }
    }

    private static String describe(RuntimeException e) {
        return e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage();
    }

    private static String truncate(String value) {
        return value.length() <= MAX_ERROR_SUMMARY ? value : value.substring(0, MAX_ERROR_SUMMARY);
    }
}
