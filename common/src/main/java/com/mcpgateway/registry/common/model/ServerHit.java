package com.mcpgateway.registry.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;

import java.util.List;

/** Сервер в результатах поиска */
@Builder
public record ServerHit(
    @JsonProperty("path")
    String path,

    @JsonProperty("name")
    String name,

    @JsonProperty("description")
    String description,

    @JsonProperty("tags")
    List<String> tags,

    @JsonProperty("num_tools")
    int numTools,

    @JsonProperty("is_enabled")
    boolean enabled,

    @JsonProperty("relevance_score")
    double relevanceScore,

    @JsonProperty("match_context")
    String matchContext,

    @JsonProperty("matching_tools")
    List<MatchingTool> matchingTools
) {
    @JsonProperty("entity_type")
    public EntityType entityType() {
        return EntityType.MCP_SERVER;
    }
}
