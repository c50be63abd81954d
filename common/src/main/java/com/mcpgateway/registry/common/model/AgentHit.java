package com.mcpgateway.registry.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;

import java.util.List;

/** Агент в результатах поиска */
@Builder
public record AgentHit(
    @JsonProperty("path")
    String path,

    @JsonProperty("name")
    String name,

    @JsonProperty("description")
    String description,

    @JsonProperty("tags")
    List<String> tags,

    @JsonProperty("skills")
    List<String> skills,

    @JsonProperty("visibility")
    String visibility,

    @JsonProperty("trust_level")
    String trustLevel,

    @JsonProperty("is_enabled")
    boolean enabled,

    @JsonProperty("relevance_score")
    double relevanceScore,

    @JsonProperty("match_context")
    String matchContext
) {
    @JsonProperty("entity_type")
    public EntityType entityType() {
        return EntityType.A2A_AGENT;
    }
}
