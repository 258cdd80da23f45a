package com.delta.adsync.sync.http;

public class GraphPermissionException extends GraphApiException {
    public GraphPermissionException(int httpStatus, Integer errorCode, Integer errorSubcode, String message) {
        super(GraphErrorCategory.PERMISSION, httpStatus, errorCode, errorSubcode, message);
    }
}
