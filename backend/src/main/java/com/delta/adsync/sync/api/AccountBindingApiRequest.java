package com.delta.adsync.sync.api;

public record AccountBindingApiRequest(
    String tenantId,
    String accountId,
    String name,
    String currency,
    String timezoneName,
    String accountStatus,
    Boolean rebind
) {
}
