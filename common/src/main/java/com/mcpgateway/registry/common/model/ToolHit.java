package com.mcpgateway.registry.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;

import java.util.Map;

/** Инструмент в результатах поиска вместе с владеющим сервером */
@Builder
public record ToolHit(
    @JsonProperty("name")
    String name,

    @JsonProperty("description")
    String description,

    @JsonProperty("server_path")
    String serverPath,

    @JsonProperty("server_name")
    String serverName,

    @JsonProperty("input_schema")
    Map<String, Object> inputSchema,

    @JsonProperty("relevance_score")
    double relevanceScore,

    @JsonProperty("match_context")
    String matchContext
) {
    @JsonProperty("entity_type")
    public EntityType entityType() {
        return EntityType.TOOL;
    }
}
