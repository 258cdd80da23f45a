package com.delta.adsync.sync.http;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;

/**
 * All rows of a paginated edge. {@code truncated} is set when the page cap stopped the walk while
 * the upstream still advertised a next page.
 */
public record PagedRows(List<JsonNode> rows, int pagesFetched, boolean truncated) {
}
