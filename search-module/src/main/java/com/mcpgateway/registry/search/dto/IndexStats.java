package com.mcpgateway.registry.search.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;

import java.util.Map;

/**
 * Состояние поискового индекса
 */
@Builder
public record IndexStats(
    @JsonProperty("backend")
    String backend,

    @JsonProperty("mode")
    String mode,

    @JsonProperty("records")
    long records,

    @JsonProperty("dimension")
    int dimension,

    @JsonProperty("pending_retries")
    int pendingRetries,

    @JsonProperty("embedding")
    Map<String, Object> embedding
) {
}
