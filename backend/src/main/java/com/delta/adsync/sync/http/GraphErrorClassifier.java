package com.delta.adsync.sync.http;

import java.util.Set;

public final class GraphErrorClassifier {
  private static final Set<Integer> RATE_LIMIT_CODES = Set.of(4, 17, 32, 341, 613);
  private static final Set<Integer> AUTH_CODES = Set.of(102, 190);
  private static final Set<Integer> TRANSIENT_CODES = Set.of(1, 2);
  private static final Set<Integer> REVOKED_SUBCODES = Set.of(460, 463, 467);
  private static final int NOT_FOUND_SUBCODE = 33;

  private GraphErrorClassifier() {}

  /**
   * Classifies an upstream failure. The Graph error code wins over the HTTP status because the
   * platform reports throttling as 400/403 with code 17/4.
   */
  public static GraphErrorCategory classify(int httpStatus, Integer errorCode, Integer errorSubcode) {
    if (errorCode != null) {
      if (RATE_LIMIT_CODES.contains(errorCode) || (errorCode >= 80000 && errorCode <= 80014)) {
        return GraphErrorCategory.RATE_LIMIT;
      }
      if (AUTH_CODES.contains(errorCode)) {
        return GraphErrorCategory.AUTH;
      }
      if (errorCode == 10 || (errorCode >= 200 && errorCode <= 299)) {
        return GraphErrorCategory.PERMISSION;
      }
      if (errorCode == 100 && errorSubcode != null && errorSubcode == NOT_FOUND_SUBCODE) {
        return GraphErrorCategory.NOT_FOUND;
      }
      if (TRANSIENT_CODES.contains(errorCode)) {
        return GraphErrorCategory.TRANSIENT;
      }
    }
    return fromHttpStatus(httpStatus);
  }

  public static GraphErrorCategory fromHttpStatus(int httpStatus) {
    if (httpStatus == 401) {
      return GraphErrorCategory.AUTH;
    }
    if (httpStatus == 403) {
      return GraphErrorCategory.PERMISSION;
    }
    if (httpStatus == 404) {
      return GraphErrorCategory.NOT_FOUND;
    }
    if (httpStatus == 429) {
      return GraphErrorCategory.RATE_LIMIT;
    }
    if (httpStatus == 408 || httpStatus <= 0 || httpStatus >= 500) {
      return GraphErrorCategory.TRANSIENT;
    }
    return GraphErrorCategory.INVALID_REQUEST;
  }

  /** Code 190 with one of these subcodes means the user revoked access or the session is gone. */
  public static boolean isPermanentlyInvalidToken(Integer errorCode, Integer errorSubcode) {
    return errorCode != null && errorCode == 190 && errorSubcode != null && REVOKED_SUBCODES.contains(errorSubcode);
  }
}
