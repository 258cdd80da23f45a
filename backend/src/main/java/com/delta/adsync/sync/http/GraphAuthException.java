package com.delta.adsync.sync.http;

public class GraphAuthException extends GraphApiException {
    public GraphAuthException(int httpStatus, Integer errorCode, Integer errorSubcode, String message) {
        super(GraphErrorCategory.AUTH, httpStatus, errorCode, errorSubcode, message);
    }
}
