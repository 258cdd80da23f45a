package com.delta.adsync.sync.util;

public final class GraphIds {
  private static final String ACCOUNT_PREFIX = "act_";

  private GraphIds() {}

  /** Strips the {@code act_} prefix; stored account ids are bare numeric ids. */
  public static String normalizeAccountId(String raw) {
    if (raw == null) {
      return null;
    }
    String trimmed = raw.trim();
    if (trimmed.startsWith(ACCOUNT_PREFIX)) {
      trimmed = trimmed.substring(ACCOUNT_PREFIX.length());
    }
    return trimmed.isEmpty() ? null : trimmed;
  }

  public static String accountNode(String accountId) {
    String normalized = normalizeAccountId(accountId);
    if (normalized == null) {
      throw new IllegalArgumentException("Account id is required");
    }
    return ACCOUNT_PREFIX + normalized;
  }
}
