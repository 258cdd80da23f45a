package com.delta.adsync.sync.service;

import com.delta.adsync.config.AdSyncProperties;
import com.delta.adsync.sync.model.SyncRunRequest;
import com.delta.adsync.sync.model.SyncRunSummary;
import com.delta.adsync.sync.model.SyncWatermark;
import com.delta.adsync.sync.persistence.SyncJdbcRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/** Runs a daily sync for every enabled watermark on a fixed interval. */
@Service
public class ScheduledSyncService {
    private static final Logger log = LoggerFactory.getLogger(ScheduledSyncService.class);

    private final SyncJdbcRepository repository;
    private final SyncOrchestratorService orchestratorService;
    private final ScheduledExecutorService schedulerExecutor;
    private final AdSyncProperties properties;
    private final AtomicBoolean running = new AtomicBoolean(false);
    private final Object lifecycleLock = new Object();

    private ScheduledFuture<?> scheduled;

    public ScheduledSyncService(
        SyncJdbcRepository repository,
        SyncOrchestratorService orchestratorService,
        @Qualifier("schedulerExecutor") ScheduledExecutorService schedulerExecutor,
        AdSyncProperties properties
    ) {
        this.repository = repository;
        this.orchestratorService = orchestratorService;
        this.schedulerExecutor = schedulerExecutor;
        this.properties = properties;
    }

    @PostConstruct
    public void startIfEnabled() {
        if (properties.getScheduler().isEnabled()) {
            start();
        }
    }

    @PreDestroy
    public void stopOnShutdown() {
        stop();
    }

    public boolean isRunning() {
        return running.get();
    }

    public void start() {
        synchronized (lifecycleLock) {
            if (running.get()) {
                return;
            }
            AdSyncProperties.Scheduler scheduler = properties.getScheduler();
            scheduled = schedulerExecutor.scheduleWithFixedDelay(
                this::runScheduledCycle,
                scheduler.getInitialDelayMinutes(),
                scheduler.getIntervalMinutes(),
                TimeUnit.MINUTES
            );
            running.set(true);
            log.info(
                "Scheduled daily sync every {} minute(s), first run in {} minute(s)",
                scheduler.getIntervalMinutes(),
                scheduler.getInitialDelayMinutes()
            );
        }
    }

    public void stop() {
        synchronized (lifecycleLock) {
            if (!running.get()) {
                return;
            }
            running.set(false);
            if (scheduled != null) {
                scheduled.cancel(false);
                scheduled = null;
            }
        }
    }

    /** One pass over every enabled account, grouped by tenant. Returns the per-tenant summaries. */
    public List<SyncRunSummary> runOnce() {
        Map<String, List<String>> accountsByTenant = new LinkedHashMap<>();
        for (SyncWatermark watermark : repository.findEnabledWatermarks()) {
            accountsByTenant.computeIfAbsent(watermark.tenantId(), key -> new ArrayList<>()).add(watermark.externalAccountId());
        }
        List<SyncRunSummary> summaries = new ArrayList<>();
        for (Map.Entry<String, List<String>> entry : accountsByTenant.entrySet()) {
            SyncRunRequest request = new SyncRunRequest(
                entry.getKey(),
                entry.getValue(),
                "daily",
                null,
                null,
                null,
                null,
                Boolean.TRUE,
                Boolean.FALSE
            );
            try {
                summaries.add(orchestratorService.runSync(request));
            } catch (RuntimeException e) {
                log.warn("Scheduled sync failed for tenant {}", entry.getKey(), e);
            }
        }
        return summaries;
    }

    private void runScheduledCycle() {
        try {
            List<SyncRunSummary> summaries = runOnce();
            log.info("Scheduled sync cycle finished for {} tenant(s)", summaries.size());
        } catch (RuntimeException e) {
            log.warn("Scheduled sync cycle failed", e);
        }
    }
}
