package com.delta.adsync.sync.http;

public record BatchRequest(String method, String relativeUrl) {
    public static BatchRequest get(String relativeUrl) {
        return new BatchRequest("GET", relativeUrl);
    }
}
