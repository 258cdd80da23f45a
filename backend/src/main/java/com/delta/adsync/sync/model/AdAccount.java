package com.delta.adsync.sync.model;

public record AdAccount(
    long id,
    String tenantId,
    String externalAccountId,
    String name,
    String currency,
    String timezoneName,
    String accountStatus,
    Long primaryConnectionId
) {
}
