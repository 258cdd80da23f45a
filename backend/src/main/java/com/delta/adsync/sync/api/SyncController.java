package com.delta.adsync.sync.api;

import com.delta.adsync.sync.creative.CreativeResolver;
import com.delta.adsync.sync.media.MediaCacheService;
import com.delta.adsync.sync.model.AdAccount;
import com.delta.adsync.sync.model.BatchResolutionResult;
import com.delta.adsync.sync.model.CachedMedia;
import com.delta.adsync.sync.model.CreativeRecord;
import com.delta.adsync.sync.model.EntitySyncSummary;
import com.delta.adsync.sync.model.SyncJob;
import com.delta.adsync.sync.model.SyncRunRequest;
import com.delta.adsync.sync.model.SyncRunSummary;
import com.delta.adsync.sync.model.SyncStatusView;
import com.delta.adsync.sync.service.ConnectionService;
import com.delta.adsync.sync.service.EntityCatalogService;
import com.delta.adsync.sync.service.SyncOrchestratorService;
import com.delta.adsync.sync.service.SyncStatusService;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.springframework.http.HttpStatus.BAD_REQUEST;
import static org.springframework.http.HttpStatus.NOT_FOUND;

@RestController
@RequestMapping("/api")
public class SyncController {
    private final SyncOrchestratorService orchestratorService;
    private final SyncStatusService statusService;
    private final EntityCatalogService entityCatalogService;
    private final CreativeResolver creativeResolver;
    private final MediaCacheService mediaCacheService;
    private final ConnectionService connectionService;

    public SyncController(
        SyncOrchestratorService orchestratorService,
        SyncStatusService statusService,
        EntityCatalogService entityCatalogService,
        CreativeResolver creativeResolver,
        MediaCacheService mediaCacheService,
        ConnectionService connectionService
    ) {
        this.orchestratorService = orchestratorService;
        this.statusService = statusService;
        this.entityCatalogService = entityCatalogService;
        this.creativeResolver = creativeResolver;
        this.mediaCacheService = mediaCacheService;
        this.connectionService = connectionService;
    }

    @PostMapping("/sync/run")
    public SyncRunSummary runSync(@RequestBody SyncApiRunRequest request) {
        return orchestratorService.runSync(toRunRequest(request));
    }

    @PostMapping("/sync/run-async")
    public ResponseEntity<Map<String, Object>> runSyncAsync(@RequestBody SyncApiRunRequest request) {
        List<String> accounts = orchestratorService.startAsync(toRunRequest(request));
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("tenantId", request.tenantId());
        body.put("accounts", accounts);
        body.put("status", "accepted");
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(body);
    }

    @GetMapping("/sync/jobs/{jobId}")
    public SyncJob getJob(@PathVariable("jobId") long jobId) {
        return statusService.getJob(jobId);
    }

    @GetMapping("/sync/status")
    public SyncStatusView getStatus(@RequestParam(name = "tenantId") String tenantId) {
        return statusService.getStatus(tenantId);
    }

    @PostMapping("/sync/entities")
    public EntitySyncSummary syncEntities(
        @RequestParam(name = "tenantId") String tenantId,
        @RequestParam(name = "accountId") String accountId,
        @RequestParam(name = "force", required = false, defaultValue = "false") boolean force
    ) {
        return entityCatalogService.syncEntities(tenantId, accountId, force);
    }

    @PostMapping("/creatives/{adId}/resolve")
    public CreativeRecord resolveCreative(
        @PathVariable("adId") String adId,
        @RequestParam(name = "tenantId") String tenantId,
        @RequestParam(name = "accountId") String accountId
    ) {
        AdAccount account = requireAccount(tenantId, accountId);
        return creativeResolver.resolveCreative(
            tenantId,
            adId,
            account.externalAccountId(),
            connectionService.resolveAccessToken(account)
        );
    }

    @PostMapping("/creatives/resolve-batch")
    public BatchResolutionResult resolveCreativesBatch(@RequestBody CreativeBatchApiRequest request) {
        if (request.adIds() == null || request.adIds().isEmpty()) {
            throw new ResponseStatusException(BAD_REQUEST, "adIds must not be empty");
        }
        AdAccount account = requireAccount(request.tenantId(), request.accountId());
        return creativeResolver.resolveCreativesBatch(
            request.tenantId(),
            request.adIds(),
            account.externalAccountId(),
            connectionService.resolveAccessToken(account),
            Boolean.TRUE.equals(request.reuseStored())
        );
    }

    @PostMapping("/media/cache")
    public CachedMedia cacheMedia(@RequestBody MediaCacheApiRequest request) {
        if (request.tenantId() == null || request.adId() == null || request.sourceUrl() == null) {
            throw new ResponseStatusException(BAD_REQUEST, "tenantId, adId and sourceUrl are required");
        }
        return mediaCacheService.cache(request.tenantId(), request.adId(), request.mediaType(), request.sourceUrl());
    }

    private AdAccount requireAccount(String tenantId, String accountId) {
        if (tenantId == null || tenantId.isBlank() || accountId == null || accountId.isBlank()) {
            throw new ResponseStatusException(BAD_REQUEST, "tenantId and accountId are required");
        }
        AdAccount account = connectionService.findAccount(tenantId, accountId);
        if (account == null) {
            throw new ResponseStatusException(NOT_FOUND, "Unknown ad account " + accountId);
        }
        return account;
    }

    private static SyncRunRequest toRunRequest(SyncApiRunRequest request) {
        if (request == null) {
            throw new ResponseStatusException(BAD_REQUEST, "Request body is required");
        }
        return new SyncRunRequest(
            request.tenantId(),
            request.accountIds(),
            request.mode(),
            request.daysBack(),
            request.dateFrom(),
            request.dateTo(),
            request.levels(),
            request.syncCreatives(),
            request.syncEntities()
        );
    }
}
