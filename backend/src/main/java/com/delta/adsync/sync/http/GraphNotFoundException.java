package com.delta.adsync.sync.http;

public class GraphNotFoundException extends GraphApiException {
    public GraphNotFoundException(int httpStatus, Integer errorCode, Integer errorSubcode, String message) {
        super(GraphErrorCategory.NOT_FOUND, httpStatus, errorCode, errorSubcode, message);
    }
}
