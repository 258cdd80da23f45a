package com.delta.adsync.sync.http;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;

public record GraphPage(List<JsonNode> rows, String nextPageUrl) {
    public boolean hasNext() {
        return nextPageUrl != null && !nextPageUrl.isBlank();
    }
}
