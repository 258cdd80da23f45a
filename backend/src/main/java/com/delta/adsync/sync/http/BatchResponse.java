package com.delta.adsync.sync.http;

/**
 * One slot of a batch reply. {@code code == 0} means the upstream returned no result for the
 * sub-request (it timed out server side).
 */
public record BatchResponse(int code, String body) {
    public boolean isSuccessful() {
        return code >= 200 && code < 300 && body != null;
    }
}
