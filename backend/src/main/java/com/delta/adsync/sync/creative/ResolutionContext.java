package com.delta.adsync.sync.creative;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * State owned by one resolution run: the credential plus the lookup caches. Negative answers are
 * cached too, so every hash, post and video is requested at most once per run.
 */
public final class ResolutionContext {
    private final String tenantId;
    private final String accountId;
    private final String accessToken;
    private final Map<String, Optional<MediaCandidate>> imageHashes = new HashMap<>();
    private final Map<String, Optional<JsonNode>> posts = new HashMap<>();
    private final Map<String, Optional<JsonNode>> videos = new HashMap<>();
    private int remoteLookups;

    public ResolutionContext(String tenantId, String accountId, String accessToken) {
        this.tenantId = tenantId;
        this.accountId = accountId;
        this.accessToken = accessToken;
    }

    public String tenantId() {
        return tenantId;
    }

    public String accountId() {
        return accountId;
    }

    public String accessToken() {
        return accessToken;
    }

    Map<String, Optional<MediaCandidate>> imageHashes() {
        return imageHashes;
    }

    Map<String, Optional<JsonNode>> posts() {
        return posts;
    }

    Map<String, Optional<JsonNode>> videos() {
        return videos;
    }

    void countLookup() {
        remoteLookups++;
    }

    public int remoteLookups() {
        return remoteLookups;
    }
}
