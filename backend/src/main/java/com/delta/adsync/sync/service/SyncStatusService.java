package com.delta.adsync.sync.service;

import com.delta.adsync.config.AdSyncProperties;
import com.delta.adsync.sync.model.SyncJob;
import com.delta.adsync.sync.model.SyncStatusView;
import com.delta.adsync.sync.persistence.SyncJdbcRepository;
import org.springframework.stereotype.Service;
import org.springframework.web.server.ResponseStatusException;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import static org.springframework.http.HttpStatus.BAD_REQUEST;
import static org.springframework.http.HttpStatus.NOT_FOUND;

@Service
public class SyncStatusService {
    private final SyncJdbcRepository repository;
    private final AdSyncProperties properties;

    public SyncStatusService(SyncJdbcRepository repository, AdSyncProperties properties) {
        this.repository = repository;
        this.properties = properties;
    }

    public SyncStatusView getStatus(String tenantId) {
        if (tenantId == null || tenantId.isBlank()) {
            throw new ResponseStatusException(BAD_REQUEST, "tenantId is required");
        }
        Set<String> running = new LinkedHashSet<>();
        for (SyncJob job : repository.findRunningJobs(tenantId)) {
            running.add(job.externalAccountId());
        }
        return new SyncStatusView(
            tenantId,
            repository.findWatermarks(tenantId),
            repository.findRecentJobs(tenantId, properties.getSync().getStatusJobLimit()),
            new ArrayList<>(running)
        );
    }

    public SyncJob getJob(long jobId) {
        SyncJob job = repository.findSyncJob(jobId);
        if (job == null) {
            throw new ResponseStatusException(NOT_FOUND, "Sync job not found: " + jobId);
        }
        return job;
    }
}
