package com.mcpgateway.registry.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;

/** Навык A2A агента */
@Builder
public record AgentSkill(
    @JsonProperty("name")
    String name,

    @JsonProperty("description")
    String description
) {
}
