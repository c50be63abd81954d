package com.mcpgateway.registry.common.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import com.mcpgateway.registry.common.exception.SearchValidationException;

import java.util.Locale;

/**
 * Тип индексируемой сущности реестра
 */
public enum EntityType {
    MCP_SERVER("mcp_server"),
    TOOL("tool"),
    A2A_AGENT("a2a_agent");

    private final String wireName;

    EntityType(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    /** Разобрать имя типа, принимая сокращения server и agent */
    @JsonCreator
    public static EntityType fromWireName(String value) {
        if (value == null) {
            throw new SearchValidationException("Entity type must not be null");
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        return switch (normalized) {
            case "mcp_server", "server" -> MCP_SERVER;
            case "tool" -> TOOL;
            case "a2a_agent", "agent" -> A2A_AGENT;
            default -> throw new SearchValidationException("Unknown entity type: " + value);
        };
    }
}
