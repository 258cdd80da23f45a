package com.delta.adsync.sync.http;

public enum GraphErrorCategory {
    AUTH,
    PERMISSION,
    NOT_FOUND,
    RATE_LIMIT,
    TRANSIENT,
    INVALID_REQUEST;

    public boolean isRetryable() {
        return this == RATE_LIMIT || this == TRANSIENT;
    }
}
