package com.delta.adsync.sync.api;

import java.util.List;

public record CreativeBatchApiRequest(String tenantId, String accountId, List<String> adIds, Boolean reuseStored) {
}
