package com.mcpgateway.registry.common.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import lombok.Builder;

import java.util.Objects;
import java.util.List;

/**
 * A2A агент, зарегистрированный в реестре
 */
@Builder
public record AgentEntity(
    @NotBlank
    @JsonProperty("path")
    String path,

    @NotBlank
    @JsonProperty("name")
    String name,

    @JsonProperty("description")
    String description,

    @JsonProperty("tags")
    List<String> tags,

    @JsonProperty("enabled")
    @JsonAlias("is_enabled")
    Boolean enabled,

    @JsonProperty("capabilities")
    List<String> capabilities,

    @JsonProperty("skills")
    List<AgentSkill> skills,

    @JsonProperty("visibility")
    String visibility,

    @JsonProperty("trust_level")
    String trustLevel
) {
    public AgentEntity {
        tags = tags == null ? List.of() : tags.stream().filter(Objects::nonNull).distinct().toList();
        capabilities = capabilities == null ? List.of() : List.copyOf(capabilities);
        skills = skills == null ? List.of() : List.copyOf(skills);
        enabled = enabled == null ? Boolean.TRUE : enabled;
        visibility = visibility == null ? "public" : visibility;
        trustLevel = trustLevel == null ? "unverified" : trustLevel;
    }
}
