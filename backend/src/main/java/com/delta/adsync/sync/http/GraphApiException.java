package com.delta.adsync.sync.http;

/**
 * Failure talking to the Graph API. Subclasses mark the categories callers react to differently.
 */
public class GraphApiException extends RuntimeException {
    private final GraphErrorCategory category;
    private final int httpStatus;
    private final Integer errorCode;
    private final Integer errorSubcode;

    public GraphApiException(GraphErrorCategory category, int httpStatus, Integer errorCode, Integer errorSubcode, String message) {
        super(message);
        this.category = category;
        this.httpStatus = httpStatus;
        this.errorCode = errorCode;
        this.errorSubcode = errorSubcode;
    }

    public static GraphApiException of(GraphErrorCategory category, int httpStatus, Integer errorCode, Integer errorSubcode, String message) {
        if (category == GraphErrorCategory.AUTH) {
            return new GraphAuthException(httpStatus, errorCode, errorSubcode, message);
        }
        if (category == GraphErrorCategory.PERMISSION) {
            return new GraphPermissionException(httpStatus, errorCode, errorSubcode, message);
        }
        if (category == GraphErrorCategory.NOT_FOUND) {
            return new GraphNotFoundException(httpStatus, errorCode, errorSubcode, message);
        }
        if (category == GraphErrorCategory.RATE_LIMIT) {
            return new GraphRateLimitException(httpStatus, errorCode, errorSubcode, message);
        }
        return new GraphApiException(category, httpStatus, errorCode, errorSubcode, message);
    }

    public GraphErrorCategory getCategory() {
        return category;
    }

    public int getHttpStatus() {
        return httpStatus;
    }

    public Integer getErrorCode() {
        return errorCode;
    }

    public Integer getErrorSubcode() {
        return errorSubcode;
    }
}
