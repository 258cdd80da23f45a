package com.delta.adsync.sync.service;

import com.delta.adsync.config.AdSyncProperties;
import com.delta.adsync.sync.http.GraphApiClient;
import com.delta.adsync.sync.http.GraphApiException;
import com.delta.adsync.sync.http.GraphAuthException;
import com.delta.adsync.sync.http.PagedRows;
import com.delta.adsync.sync.model.AdAccount;
import com.delta.adsync.sync.model.CatalogEntity;
import com.delta.adsync.sync.model.EntityLevel;
import com.delta.adsync.sync.model.EntitySyncSummary;
import com.delta.adsync.sync.persistence.SyncJdbcRepository;
import com.delta.adsync.sync.util.GraphIds;
import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Mirrors the account's campaigns, ad sets and ads into {@code entity_catalog}. The catalog
 * changes slowly, so a fresh one is not fetched again until it ages past the configured ttl.
 */
@Service
public class EntityCatalogService {
    private static final Logger log = LoggerFactory.getLogger(EntityCatalogService.class);
    private static final int CATALOG_PAGE_SIZE = 500;
    private static final BigDecimal MINOR_UNITS = BigDecimal.valueOf(100);
    private static final Map<EntityLevel, String> FIELDS = Map.of(
        EntityLevel.CAMPAIGN, "id,name,status,effective_status,objective,daily_budget,lifetime_budget",
        EntityLevel.ADSET, "id,name,status,effective_status,campaign_id,daily_budget,lifetime_budget",
        EntityLevel.AD, "id,name,status,effective_status,campaign_id,adset_id"
    );

    private final GraphApiClient graphApiClient;
    private final SyncJdbcRepository repository;
    private final ConnectionService connectionService;
    private final AdSyncProperties properties;
    private final Clock clock;

    public EntityCatalogService(
        GraphApiClient graphApiClient,
        SyncJdbcRepository repository,
        ConnectionService connectionService,
        AdSyncProperties properties,
        Clock clock
    ) {
        this.graphApiClient = graphApiClient;
        this.repository = repository;
        this.connectionService = connectionService;
        this.properties = properties;
        this.clock = clock;
    }

    /** Looks up the account's credential and syncs its catalog. */
    public EntitySyncSummary syncEntities(String tenantId, String accountId, boolean force) {
        String normalized = GraphIds.normalizeAccountId(accountId);
        AdAccount account = connectionService.findAccount(tenantId, normalized);
        if (account == null) {
            throw new IllegalArgumentException("Unknown ad account " + normalized + " for tenant " + tenantId);
        }
        return syncEntities(tenantId, normalized, connectionService.resolveAccessToken(account), force);
    }

    /**
     * Fetches every entity type. A failing type is reported in the summary and does not stop the
     * others.
     *
     * @throws GraphAuthException when the credential is rejected
     */
    public EntitySyncSummary syncEntities(String tenantId, String accountId, String accessToken, boolean force) {
        Instant now = clock.instant();
        if (!force && isFresh(tenantId, accountId, now)) {
            log.info("Entity catalog for account {} is fresh, skipping", accountId);
            return new EntitySyncSummary(accountId, true, Map.of(), 0, List.of());
        }
        Map<String, Integer> counts = new LinkedHashMap<>();
        List<String> errors = new ArrayList<>();
        int total = 0;
        for (EntityLevel type : EntityLevel.values()) {
            try {
                int written = syncType(tenantId, accountId, accessToken, type, now, errors);
                counts.put(type.edge(), written);
                total += written;
            } catch (GraphAuthException e) {
                throw e;
            } catch (GraphApiException | DataAccessException e) {
                log.warn("Entity sync of {} failed for account {}", type.edge(), accountId, e);
                errors.add(type.edge() + ": " + e.getMessage());
            }
        }
        log.info("Synced {} catalog entities for account {} ({})", total, accountId, counts);
        return new EntitySyncSummary(accountId, false, counts, total, errors);
    }

    private int syncType(
        String tenantId,
        String accountId,
        String accessToken,
        EntityLevel type,
        Instant syncedAt,
        List<String> errors
    ) {
        Map<String, String> params = new LinkedHashMap<>();
        params.put("fields", FIELDS.get(type));
        params.put("limit", String.valueOf(CATALOG_PAGE_SIZE));
        params.put("access_token", accessToken);
        PagedRows page = graphApiClient.fetchAllPages(
            graphApiClient.graphUrl(GraphIds.accountNode(accountId) + "/" + type.edge(), params)
        );
        int written = 0;
        for (JsonNode row : page.rows()) {
            CatalogEntity entity = toEntity(tenantId, accountId, type, row);
            if (entity != null) {
                repository.upsertCatalogEntity(entity, syncedAt);
                written++;
            }
        }
        if (page.truncated()) {
            log.warn(
                "Entity sync of {} for account {} stopped at the page cap after {} page(s)",
                type.edge(),
                accountId,
                page.pagesFetched()
            );
            errors.add(type.edge() + ": truncated after " + page.pagesFetched() + " page(s)");
        }
        return written;
    }

    static CatalogEntity toEntity(String tenantId, String accountId, EntityLevel type, JsonNode row) {
        String id = text(row, "id");
        if (id == null) {
            return null;
        }
        return new CatalogEntity(
            tenantId,
            accountId,
            type,
            id,
            text(row, "name"),
            text(row, "status"),
            text(row, "effective_status"),
            text(row, "objective"),
            type == EntityLevel.CAMPAIGN ? id : text(row, "campaign_id"),
            type == EntityLevel.ADSET ? id : text(row, "adset_id"),
            budget(row, "daily_budget"),
            budget(row, "lifetime_budget"),
            row.toString()
        );
    }

    /** Budgets come in the account currency's minor units. */
    private static BigDecimal budget(JsonNode row, String field) {
        String raw = text(row, field);
        if (raw == null) {
            return null;
        }
        try {
            return new BigDecimal(raw).divide(MINOR_UNITS, 2, RoundingMode.HALF_UP);
        } catch (NumberFormatException e) {
            return null;
        }
    }

    private boolean isFresh(String tenantId, String accountId, Instant now) {
        Instant latest = repository.findLatestCatalogSync(tenantId, accountId);
        if (latest == null) {
            return false;
        }
        return latest.isAfter(now.minus(Duration.ofHours(properties.getSync().getEntityCacheTtlHours())));
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
