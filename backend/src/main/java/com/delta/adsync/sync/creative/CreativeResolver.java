package com.delta.adsync.sync.creative;

import com.delta.adsync.config.AdSyncProperties;
import com.delta.adsync.sync.http.BatchRequest;
import com.delta.adsync.sync.http.BatchResponse;
import com.delta.adsync.sync.http.GraphApiClient;
import com.delta.adsync.sync.http.GraphApiException;
import com.delta.adsync.sync.http.GraphAuthException;
import com.delta.adsync.sync.media.MediaCacheException;
import com.delta.adsync.sync.media.MediaCacheService;
import com.delta.adsync.sync.model.BatchResolutionResult;
import com.delta.adsync.sync.model.CachedMedia;
import com.delta.adsync.sync.model.CreativeRecord;
import com.delta.adsync.sync.model.CreativeType;
import com.delta.adsync.sync.model.FetchStatus;
import com.delta.adsync.sync.model.ResolutionQuality;
import com.delta.adsync.sync.persistence.CreativeJdbcRepository;
import com.delta.adsync.sync.util.GraphIds;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Turns ad ids into normalized {@link CreativeRecord}s. Every record produced here is upserted,
 * even when nothing could be resolved, so "no creative" stays distinguishable from "never tried".
 */
@Service
public class CreativeResolver {
    private static final Logger log = LoggerFactory.getLogger(CreativeResolver.class);
    private static final String CREATIVE_FIELDS =
        "id,name,title,body,image_url,thumbnail_url,video_id,image_hash,call_to_action_type,"
            + "object_story_spec,effective_object_story_id,effective_instagram_media_id,object_id,asset_feed_spec";
    static final String AD_FIELDS =
        "id,name,status,preview_shareable_link,creative{" + CREATIVE_FIELDS + "},adcreatives{" + CREATIVE_FIELDS + "}";
    private static final String VIDEO_PAGE_URL = "https://www.facebook.com/ads/videos/";

    private final GraphApiClient graphApiClient;
    private final MediaResolutionChain mediaChain;
    private final TextResolver textResolver;
    private final CreativeJdbcRepository repository;
    private final MediaCacheService mediaCacheService;
    private final AdSyncProperties properties;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public CreativeResolver(
        GraphApiClient graphApiClient,
        MediaResolutionChain mediaChain,
        TextResolver textResolver,
        CreativeJdbcRepository repository,
        MediaCacheService mediaCacheService,
        AdSyncProperties properties,
        ObjectMapper objectMapper,
        Clock clock
    ) {
        this.graphApiClient = graphApiClient;
        this.mediaChain = mediaChain;
        this.textResolver = textResolver;
        this.repository = repository;
        this.mediaCacheService = mediaCacheService;
        this.properties = properties;
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    /**
     * Resolves one ad. Upstream failures other than auth produce a persisted {@code failed} record
     * carrying the error message.
     *
     * @throws GraphAuthException when the credential is rejected
     */
    public CreativeRecord resolveCreative(String tenantId, String adId, String accountId, String accessToken) {
        String normalizedAccount = GraphIds.normalizeAccountId(accountId);
        ResolutionContext context = new ResolutionContext(tenantId, normalizedAccount, accessToken);
        CreativeRecord previous = findStored(tenantId, adId);

        Map<String, String> params = new LinkedHashMap<>();
        params.put("fields", AD_FIELDS);
        params.put("access_token", accessToken);
        CreativeRecord record;
        try {
            JsonNode ad = graphApiClient.getJson(graphApiClient.graphUrl(adId, params));
            record = resolveFromAd(context, adId, ad, previous);
        } catch (GraphAuthException e) {
            throw e;
        } catch (GraphApiException e) {
            log.warn("Creative fetch failed for ad {} ({}): {}", adId, e.getCategory(), e.getMessage());
            record = failedRecord(tenantId, adId, normalizedAccount, e.getMessage(), previous);
        }
        persist(record, new ArrayList<>());
        return record;
    }

    public BatchResolutionResult resolveCreativesBatch(String tenantId, List<String> adIds, String accountId, String accessToken) {
        return resolveCreativesBatch(tenantId, adIds, accountId, accessToken, false);
    }

    /**
     * Resolves many ads through composite requests. A failing sub-request only affects its own ad
     * id, which is reported in the error map; siblings are resolved normally.
     *
     * @param reuseStored when true, ads whose stored record is final are returned as stored
     *                    without any upstream call
     * @throws GraphAuthException when the credential is rejected, since no further call can succeed
     */
    public BatchResolutionResult resolveCreativesBatch(
        String tenantId,
        List<String> adIds,
        String accountId,
        String accessToken,
        boolean reuseStored
    ) {
        Map<String, CreativeRecord> records = new LinkedHashMap<>();
        Map<String, String> errors = new LinkedHashMap<>();
        List<String> unpersisted = new ArrayList<>();
        if (adIds == null || adIds.isEmpty()) {
            return new BatchResolutionResult(records, errors, unpersisted, 0);
        }
        Set<String> unique = new LinkedHashSet<>();
        for (String adId : adIds) {
            if (adId != null && !adId.isBlank()) {
                unique.add(adId.trim());
            }
        }
        String normalizedAccount = GraphIds.normalizeAccountId(accountId);
        ResolutionContext context = new ResolutionContext(tenantId, normalizedAccount, accessToken);
        Map<String, CreativeRecord> stored = loadStored(tenantId, unique);

        int reused = 0;
        List<String> pending = new ArrayList<>();
        for (String adId : unique) {
            CreativeRecord previous = stored.get(adId);
            if (reuseStored && isFinal(previous)) {
                records.put(adId, previous);
                reused++;
            } else {
                pending.add(adId);
            }
        }

        int batchSize = properties.getGraph().getBatchSize();
        for (int start = 0; start < pending.size(); start += batchSize) {
            List<String> chunk = pending.subList(start, Math.min(pending.size(), start + batchSize));
            if (start > 0 && !pauseBetweenBatches()) {
                for (String adId : pending.subList(start, pending.size())) {
                    errors.put(adId, "Interrupted before resolution");
                }
                break;
            }
            resolveChunk(context, chunk, stored, records, errors, unpersisted);
        }

        log.info(
            "Resolved {} of {} creatives for account {} (reused={}, errors={}, lookups={})",
            records.size(),
            unique.size(),
            normalizedAccount,
            reused,
            errors.size(),
            context.remoteLookups()
        );
        return new BatchResolutionResult(records, errors, unpersisted, reused);
    }

    private void resolveChunk(
        ResolutionContext context,
        List<String> chunk,
        Map<String, CreativeRecord> stored,
        Map<String, CreativeRecord> records,
        Map<String, String> errors,
        List<String> unpersisted
    ) {
        List<BatchRequest> requests = new ArrayList<>(chunk.size());
        for (String adId : chunk) {
            requests.add(BatchRequest.get(adId + "?fields=" + URLEncoder.encode(AD_FIELDS, StandardCharsets.UTF_8)));
        }
        List<BatchResponse> responses;
        try {
            responses = graphApiClient.fetchBatch(context.accessToken(), requests);
        } catch (GraphAuthException e) {
            throw e;
        } catch (GraphApiException e) {
            log.warn("Creative batch of {} ads failed: {}", chunk.size(), e.getMessage());
            for (String adId : chunk) {
                errors.put(adId, "Batch request failed: " + e.getMessage());
            }
            return;
        }

        for (int i = 0; i < chunk.size(); i++) {
            String adId = chunk.get(i);
            BatchResponse response = responses.get(i);
            String failure = slotError(response);
            if (failure != null) {
                errors.put(adId, failure);
                continue;
            }
            JsonNode ad;
            try {
                ad = objectMapper.readTree(response.body());
            } catch (JsonProcessingException e) {
                errors.put(adId, "Failed to parse response");
                continue;
            }
            if (ad.hasNonNull("error")) {
                String message = CreativePayload.text(ad.path("error"), "message");
                errors.put(adId, message != null ? message : "Upstream error for ad " + adId);
                continue;
            }
            try {
                CreativeRecord record = resolveFromAd(context, adId, ad, stored.get(adId));
                persist(record, unpersisted);
                records.put(adId, record);
            } catch (GraphAuthException e) {
                throw e;
            } catch (RuntimeException e) {
                log.warn("Creative resolution failed for ad {}", adId, e);
                errors.put(adId, e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage());
            }
        }
    }

    /** Builds the normalized record from one ad node. Does not persist. */
    CreativeRecord resolveFromAd(ResolutionContext context, String requestedAdId, JsonNode ad, CreativeRecord previous) {
        CreativePayload payload = new CreativePayload(ad);
        String adId = payload.adId() != null ? payload.adId() : requestedAdId;
        CreativeType type = CreativeTypeDetector.detect(payload);
        Optional<MediaCandidate> media = mediaChain.resolve(payload, type, context);
        TextResolver.ResolvedTexts texts = textResolver.resolve(payload, context);

        boolean hasText = texts.title() != null
            || texts.body() != null
            || texts.description() != null
            || texts.callToAction() != null
            || texts.linkUrl() != null;
        FetchStatus status = FetchStatus.of(media.isPresent(), hasText);
        ResolutionQuality quality = media.map(MediaCandidate::quality).orElse(ResolutionQuality.UNKNOWN);
        String videoId = payload.videoId();
        int carouselCount = payload.carouselChildren().size();

        CreativeRecord record = new CreativeRecord(
            context.tenantId(),
            adId,
            context.accountId(),
            payload.adName(),
            payload.creativeId(),
            type,
            media.map(MediaCandidate::url).orElse(null),
            quality == ResolutionQuality.HD ? media.get().url() : null,
            CreativePayload.text(payload.creative(), "thumbnail_url"),
            media.map(MediaCandidate::width).orElse(null),
            media.map(MediaCandidate::height).orElse(null),
            quality,
            media.map(MediaCandidate::source).orElse(null),
            videoId,
            videoId == null ? null : VIDEO_PAGE_URL + videoId,
            CreativePayload.text(payload.ad(), "preview_shareable_link"),
            texts.title(),
            texts.body(),
            texts.description(),
            texts.callToAction(),
            texts.linkUrl(),
            status,
            carouselCount > 1,
            carouselCount,
            null,
            null,
            payload.ad().toString(),
            payload.hasCreative() ? null : "Ad has no creative",
            previous == null ? 1 : previous.fetchAttempts() + 1,
            clock.instant()
        );
        return media.isPresent() ? maybeCache(record) : record;
    }

    private CreativeRecord maybeCache(CreativeRecord record) {
        if (!properties.getMedia().isCacheOnResolve() || record.imageUrl() == null) {
            return record;
        }
        try {
            CachedMedia cached = mediaCacheService.cache(record.tenantId(), record.adId(), "image", record.imageUrl());
            return record.withCachedImage(cached.storedUrl(), cached.sizeBytes());
        } catch (MediaCacheException e) {
            log.warn("Unable to cache image for ad {}: {}", record.adId(), e.getMessage());
            return record;
        }
    }

    /** A final record is not worth another upstream round trip. */
    boolean isFinal(CreativeRecord record) {
        if (record == null) {
            return false;
        }
        if (record.fetchAttempts() >= properties.getSync().getCreativeMaxAttempts()) {
            return true;
        }
        if (record.fetchStatus() != FetchStatus.SUCCESS) {
            return false;
        }
        return !(record.resolutionQuality() == ResolutionQuality.LOW && record.cachedImageUrl() == null);
    }

    private String slotError(BatchResponse response) {
        if (response == null || response.code() == 0) {
            return "No response for sub-request";
        }
        if (response.isSuccessful() && response.body() != null) {
            return null;
        }
        String message = null;
        if (response.body() != null) {
            try {
                JsonNode body = objectMapper.readTree(response.body());
                message = CreativePayload.text(body.path("error"), "message");
            } catch (JsonProcessingException e) {
                log.debug("Unparseable error body for sub-request with status {}", response.code());
            }
        }
        return message != null ? message : "HTTP " + response.code();
    }

    private CreativeRecord failedRecord(String tenantId, String adId, String accountId, String message, CreativeRecord previous) {
        int attempts = previous == null ? 1 : previous.fetchAttempts() + 1;
        return CreativeRecord.failed(tenantId, adId, accountId, message, attempts, clock.instant());
    }

    private void persist(CreativeRecord record, List<String> unpersisted) {
        try {
            repository.upsertCreative(record);
        } catch (DataAccessException e) {
            log.warn("Failed to persist creative for ad {}", record.adId(), e);
            unpersisted.add(record.adId());
        }
    }

    private CreativeRecord findStored(String tenantId, String adId) {
        try {
            return repository.findCreative(tenantId, adId);
        } catch (DataAccessException e) {
            log.warn("Unable to load stored creative for ad {}", adId, e);
            return null;
        }
    }

    private Map<String, CreativeRecord> loadStored(String tenantId, Set<String> adIds) {
        try {
            return repository.findCreatives(tenantId, adIds);
        } catch (DataAccessException e) {
            log.warn("Unable to load stored creatives for tenant {}", tenantId, e);
            return Map.of();
        }
    }

    private boolean pauseBetweenBatches() {
        long delay = properties.getGraph().getInterBatchDelayMs();
        if (delay <= 0) {
            return true;
        }
        try {
            Thread.sleep(delay);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }
}
