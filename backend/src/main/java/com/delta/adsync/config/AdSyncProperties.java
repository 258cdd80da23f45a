package com.delta.adsync.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.List;

@ConfigurationProperties(prefix = "adsync")
public class AdSyncProperties {
    public static final int MAX_BATCH_SIZE = 50;

    private Graph graph = new Graph();
    private Token token = new Token();
    private Media media = new Media();
    private Sync sync = new Sync();
    private Scheduler scheduler = new Scheduler();
    private Cli cli = new Cli();

    public Graph getGraph() {
        return graph;
    }

    public void setGraph(Graph graph) {
        this.graph = graph;
    }

    public Token getToken() {
        return token;
    }

    public void setToken(Token token) {
        this.token = token;
    }

    public Media getMedia() {
        return media;
    }

    public void setMedia(Media media) {
        this.media = media;
    }

    public Sync getSync() {
        return sync;
    }

    public void setSync(Sync sync) {
        this.sync = sync;
    }

    public Scheduler getScheduler() {
        return scheduler;
    }

    public void setScheduler(Scheduler scheduler) {
        this.scheduler = scheduler;
    }

    public Cli getCli() {
        return cli;
    }

    public void setCli(Cli cli) {
        this.cli = cli;
    }

    public static class Graph {
        private String baseUrl = "https://graph.facebook.com";
        private String apiVersion = "v21.0";
        private String appId;
        private String appSecret;
        private int requestTimeoutSeconds = 30;
        private int maxRetries = 3;
        private int retryBaseDelayMs = 1000;
        private int retryMaxDelayMs = 30000;
        private int maxPages = 200;
        private int pageSize = 500;
        private int batchSize = MAX_BATCH_SIZE;
        private int interBatchDelayMs = 200;
        private int globalConcurrency = 4;

        public String getBaseUrl() {
            if (baseUrl == null || baseUrl.isBlank()) {
                return "https://graph.facebook.com";
            }
            String trimmed = baseUrl.trim();
            return trimmed.endsWith("/") ? trimmed.substring(0, trimmed.length() - 1) : trimmed;
        }

        public void setBaseUrl(String baseUrl) {
            this.baseUrl = baseUrl;
        }

        public String getApiVersion() {
            return apiVersion == null || apiVersion.isBlank() ? "v21.0" : apiVersion.trim();
        }

        public void setApiVersion(String apiVersion) {
            this.apiVersion = apiVersion;
        }

        public String getAppId() {
            return appId;
        }

        public void setAppId(String appId) {
            this.appId = appId;
        }

        public String getAppSecret() {
            return appSecret;
        }

        public void setAppSecret(String appSecret) {
            this.appSecret = appSecret;
        }

        public int getRequestTimeoutSeconds() {
            return Math.max(1, requestTimeoutSeconds);
        }

        public void setRequestTimeoutSeconds(int requestTimeoutSeconds) {
            this.requestTimeoutSeconds = Math.max(1, requestTimeoutSeconds);
        }

        public int getMaxRetries() {
            return Math.max(0, maxRetries);
        }

        public void setMaxRetries(int maxRetries) {
            this.maxRetries = Math.max(0, maxRetries);
        }

        public int getRetryBaseDelayMs() {
            return Math.max(1, retryBaseDelayMs);
        }

        public void setRetryBaseDelayMs(int retryBaseDelayMs) {
            this.retryBaseDelayMs = Math.max(1, retryBaseDelayMs);
        }

        public int getRetryMaxDelayMs() {
            return Math.max(getRetryBaseDelayMs(), retryMaxDelayMs);
        }

        public void setRetryMaxDelayMs(int retryMaxDelayMs) {
            this.retryMaxDelayMs = Math.max(1, retryMaxDelayMs);
        }

        public int getMaxPages() {
            return Math.max(1, maxPages);
        }

        public void setMaxPages(int maxPages) {
            this.maxPages = Math.max(1, maxPages);
        }

        public int getPageSize() {
            return Math.max(1, pageSize);
        }

        public void setPageSize(int pageSize) {
            this.pageSize = Math.max(1, pageSize);
        }

        public int getBatchSize() {
            return Math.min(MAX_BATCH_SIZE, Math.max(1, batchSize));
        }

        public void setBatchSize(int batchSize) {
            this.batchSize = Math.min(MAX_BATCH_SIZE, Math.max(1, batchSize));
        }

        public int getInterBatchDelayMs() {
            return Math.max(0, interBatchDelayMs);
        }

        public void setInterBatchDelayMs(int interBatchDelayMs) {
            this.interBatchDelayMs = Math.max(0, interBatchDelayMs);
        }

        public int getGlobalConcurrency() {
            return Math.max(1, globalConcurrency);
        }

        public void setGlobalConcurrency(int globalConcurrency) {
            this.globalConcurrency = Math.max(1, globalConcurrency);
        }
    }

    public static class Token {
        private String encryptionKey;
        private long longLivedDefaultTtlSeconds = 5183944L;
        private long shortLivedDefaultTtlSeconds = 3600L;
        private int authFailureThreshold = 1;
        private List<String> requiredScopes = new ArrayList<>(List.of("ads_read", "business_management"));

        public String getEncryptionKey() {
            return encryptionKey;
        }

        public void setEncryptionKey(String encryptionKey) {
            this.encryptionKey = encryptionKey;
        }

        public long getLongLivedDefaultTtlSeconds() {
            return Math.max(60L, longLivedDefaultTtlSeconds);
        }

        public void setLongLivedDefaultTtlSeconds(long longLivedDefaultTtlSeconds) {
            this.longLivedDefaultTtlSeconds = longLivedDefaultTtlSeconds;
        }

        public long getShortLivedDefaultTtlSeconds() {
            return Math.max(60L, shortLivedDefaultTtlSeconds);
        }

        public void setShortLivedDefaultTtlSeconds(long shortLivedDefaultTtlSeconds) {
            this.shortLivedDefaultTtlSeconds = shortLivedDefaultTtlSeconds;
        }

        public int getAuthFailureThreshold() {
            return Math.max(1, authFailureThreshold);
        }

        public void setAuthFailureThreshold(int authFailureThreshold) {
            this.authFailureThreshold = Math.max(1, authFailureThreshold);
        }

        public List<String> getRequiredScopes() {
            return requiredScopes;
        }

        public void setRequiredScopes(List<String> requiredScopes) {
            this.requiredScopes = requiredScopes == null ? new ArrayList<>() : requiredScopes;
        }
    }

    public static class Media {
        private boolean cacheOnResolve = false;
        private String storageRoot = "./media-cache";
        private String publicBaseUrl = "http://localhost:8080/media";
        private long maxBytes = 10L * 1024L * 1024L;
        private int expiryDays = 30;

        public boolean isCacheOnResolve() {
            return cacheOnResolve;
        }

        public void setCacheOnResolve(boolean cacheOnResolve) {
            this.cacheOnResolve = cacheOnResolve;
        }

        public String getStorageRoot() {
            return storageRoot == null || storageRoot.isBlank() ? "./media-cache" : storageRoot.trim();
        }

        public void setStorageRoot(String storageRoot) {
            this.storageRoot = storageRoot;
        }

        public String getPublicBaseUrl() {
            String value = publicBaseUrl == null || publicBaseUrl.isBlank() ? "http://localhost:8080/media" : publicBaseUrl.trim();
            return value.endsWith("/") ? value.substring(0, value.length() - 1) : value;
        }

        public void setPublicBaseUrl(String publicBaseUrl) {
            this.publicBaseUrl = publicBaseUrl;
        }

        public long getMaxBytes() {
            return Math.max(1024L, maxBytes);
        }

        public void setMaxBytes(long maxBytes) {
            this.maxBytes = Math.max(1024L, maxBytes);
        }

        public int getExpiryDays() {
            return Math.max(1, expiryDays);
        }

        public void setExpiryDays(int expiryDays) {
            this.expiryDays = Math.max(1, expiryDays);
        }
    }

    public static class Sync {
        private List<String> defaultLevels = new ArrayList<>(List.of("campaign", "adset", "ad"));
        private int defaultDaysBack = 7;
        private int maxDaysBack = 90;
        private int entityCacheTtlHours = 6;
        private int creativeMaxAttempts = 3;
        private int activeJobTimeoutMinutes = 120;
        private int statusJobLimit = 20;

        public List<String> getDefaultLevels() {
            return defaultLevels;
        }

        public void setDefaultLevels(List<String> defaultLevels) {
            this.defaultLevels = defaultLevels == null ? new ArrayList<>() : new ArrayList<>(defaultLevels);
        }

        public int getDefaultDaysBack() {
            return Math.max(1, defaultDaysBack);
        }

        public void setDefaultDaysBack(int defaultDaysBack) {
            this.defaultDaysBack = Math.max(1, defaultDaysBack);
        }

        public int getMaxDaysBack() {
            return Math.max(1, maxDaysBack);
        }

        public void setMaxDaysBack(int maxDaysBack) {
            this.maxDaysBack = Math.max(1, maxDaysBack);
        }

        public int getEntityCacheTtlHours() {
            return Math.max(0, entityCacheTtlHours);
        }

        public void setEntityCacheTtlHours(int entityCacheTtlHours) {
            this.entityCacheTtlHours = Math.max(0, entityCacheTtlHours);
        }

        public int getCreativeMaxAttempts() {
            return Math.max(1, creativeMaxAttempts);
        }

        public void setCreativeMaxAttempts(int creativeMaxAttempts) {
            this.creativeMaxAttempts = Math.max(1, creativeMaxAttempts);
        }

        public int getActiveJobTimeoutMinutes() {
            return Math.max(1, activeJobTimeoutMinutes);
        }

        public void setActiveJobTimeoutMinutes(int activeJobTimeoutMinutes) {
            this.activeJobTimeoutMinutes = Math.max(1, activeJobTimeoutMinutes);
        }

        public int getStatusJobLimit() {
            return Math.max(1, statusJobLimit);
        }

        public void setStatusJobLimit(int statusJobLimit) {
            this.statusJobLimit = Math.max(1, statusJobLimit);
        }
    }

    public static class Scheduler {
        private boolean enabled = false;
        private int intervalMinutes = 1440;
        private int initialDelayMinutes = 5;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public int getIntervalMinutes() {
            return Math.max(1, intervalMinutes);
        }

        public void setIntervalMinutes(int intervalMinutes) {
            this.intervalMinutes = Math.max(1, intervalMinutes);
        }

        public int getInitialDelayMinutes() {
            return Math.max(0, initialDelayMinutes);
        }

        public void setInitialDelayMinutes(int initialDelayMinutes) {
            this.initialDelayMinutes = Math.max(0, initialDelayMinutes);
        }
    }

    public static class Cli {
        private boolean run = false;
        private boolean exitAfterRun = true;
        private String tenantId;
        private List<String> accounts = new ArrayList<>();
        private String mode = "daily";
        private Integer daysBack;
        private boolean syncCreatives = true;

        public boolean isRun() {
            return run;
        }

        public void setRun(boolean run) {
            this.run = run;
        }

        public boolean isExitAfterRun() {
            return exitAfterRun;
        }

        public void setExitAfterRun(boolean exitAfterRun) {
            this.exitAfterRun = exitAfterRun;
        }

        public String getTenantId() {
            return tenantId;
        }

        public void setTenantId(String tenantId) {
            this.tenantId = tenantId;
        }

        public List<String> getAccounts() {
            return accounts;
        }

        public void setAccounts(List<String> accounts) {
            this.accounts = accounts == null ? new ArrayList<>() : new ArrayList<>(accounts);
        }

        public String getMode() {
            return mode;
        }

        public void setMode(String mode) {
            this.mode = mode;
        }

        public Integer getDaysBack() {
            return daysBack;
        }

        public void setDaysBack(Integer daysBack) {
            this.daysBack = daysBack;
        }

        public boolean isSyncCreatives() {
            return syncCreatives;
        }

        public void setSyncCreatives(boolean syncCreatives) {
            this.syncCreatives = syncCreatives;
        }
    }
}
