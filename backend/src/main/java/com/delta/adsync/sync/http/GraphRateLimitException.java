package com.delta.adsync.sync.http;

public class GraphRateLimitException extends GraphApiException {
    public GraphRateLimitException(int httpStatus, Integer errorCode, Integer errorSubcode, String message) {
        super(GraphErrorCategory.RATE_LIMIT, httpStatus, errorCode, errorSubcode, message);
    }
}
