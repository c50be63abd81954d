package com.mcpgateway.registry.common.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import lombok.Builder;

import java.util.Map;

/**
 * Инструмент, опубликованный MCP сервером
 */
@Builder
public record ToolDefinition(
    @NotBlank
    @JsonProperty("name")
    String name,

    @JsonProperty("description")
    String description,

    @JsonProperty("input_schema")
    @JsonAlias({"inputSchema", "schema"})
    Map<String, Object> inputSchema
) {
}
