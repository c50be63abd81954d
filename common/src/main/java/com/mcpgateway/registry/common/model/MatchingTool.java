package com.mcpgateway.registry.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;

/** Инструмент сервера, совпавший с запросом */
@Builder
public record MatchingTool(
    @JsonProperty("name")
    String name,

    @JsonProperty("description")
    String description,

    @JsonProperty("relevance_score")
    double relevanceScore,

    @JsonProperty("match_context")
    String matchContext
) {
}
