package com.mcpgateway.registry.common.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import lombok.Builder;

import java.util.Objects;
import java.util.List;

/**
 * MCP сервер вместе с его инструментами.
 * Теги имеют семантику множества: дубликаты удаляются с сохранением порядка.
 */
@Builder
public record ServerEntity(
    @NotBlank
    @JsonProperty("path")
    String path,

    @NotBlank
    @JsonProperty("name")
    @JsonAlias("server_name")
    String name,

    @JsonProperty("description")
    String description,

    @JsonProperty("tags")
    List<String> tags,

    @JsonProperty("enabled")
    @JsonAlias("is_enabled")
    Boolean enabled,

    @Valid
    @JsonProperty("tools")
    @JsonAlias("tool_list")
    List<ToolDefinition> tools
) {
    public ServerEntity {
        tags = tags == null ? List.of() : tags.stream().filter(Objects::nonNull).distinct().toList();
        tools = tools == null ? List.of() : List.copyOf(tools);
        enabled = enabled == null ? Boolean.TRUE : enabled;
    }
}
