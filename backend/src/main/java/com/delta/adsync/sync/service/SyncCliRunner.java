package com.delta.adsync.sync.service;

import com.delta.adsync.config.AdSyncProperties;
import com.delta.adsync.sync.model.AccountSyncSummary;
import com.delta.adsync.sync.model.SyncRunRequest;
import com.delta.adsync.sync.model.SyncRunSummary;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.context.ConfigurableApplicationContext;
import org.springframework.stereotype.Component;

@Component
public class SyncCliRunner implements ApplicationRunner {
    private static final Logger log = LoggerFactory.getLogger(SyncCliRunner.class);

    private final AdSyncProperties properties;
    private final SyncOrchestratorService orchestratorService;
    private final ConfigurableApplicationContext applicationContext;

    public SyncCliRunner(
        AdSyncProperties properties,
        SyncOrchestratorService orchestratorService,
        ConfigurableApplicationContext applicationContext
    ) {
        this.properties = properties;
        this.orchestratorService = orchestratorService;
        this.applicationContext = applicationContext;
    }

    @Override
    public void run(ApplicationArguments args) {
        AdSyncProperties.Cli cli = properties.getCli();
        if (!cli.isRun()) {
            return;
        }

        SyncRunRequest request = new SyncRunRequest(
            cli.getTenantId(),
            cli.getAccounts(),
            cli.getMode(),
            cli.getDaysBack(),
            null,
            null,
            null,
            cli.isSyncCreatives(),
            null
        );
        SyncRunSummary summary = orchestratorService.runSync(request);
        log.info(
            "Sync for tenant {} finished: accounts={} synced={} failed={} rows={}",
            summary.tenantId(),
            summary.accountsRequested(),
            summary.accountsSynced(),
            summary.accountsFailed(),
            summary.rowsSynced()
        );
        for (AccountSyncSummary account : summary.accounts()) {
            log.info(
                "Summary {}: job={}, status={}, rows={}, creatives={}, errors={}",
                account.externalAccountId(),
                account.jobId(),
                account.status(),
                account.rowsByLevel(),
                account.creativesResolved(),
                account.errors()
            );
        }

        if (cli.isExitAfterRun()) {
            int exitCode = SpringApplication.exit(applicationContext, () -> summary.accountsFailed() == 0 ? 0 : 1);
            System.exit(exitCode);
        }
    }
}
