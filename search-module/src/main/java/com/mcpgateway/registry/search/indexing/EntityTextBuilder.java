package com.mcpgateway.registry.search.indexing;

import com.mcpgateway.registry.common.model.AgentEntity;
import com.mcpgateway.registry.common.model.AgentSkill;
import com.mcpgateway.registry.common.model.ServerEntity;
import com.mcpgateway.registry.common.model.ToolDefinition;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Строит текст, по которому вычисляется эмбеддинг сущности
 */
@Component
public class EntityTextBuilder {

    public String serverText(ServerEntity server) {
        List<String> parts = new ArrayList<>();
        add(parts, server.name());
        add(parts, server.description());
        if (!server.tags().isEmpty()) {
            parts.add("Tags: " + String.join(", ", server.tags()));
        }
        if (!server.tools().isEmpty()) {
            parts.add("Tools: " + String.join(", ", server.tools().stream().map(ToolDefinition::name).toList()));
        }
        return String.join(" ", parts);
    }

    public String toolText(ToolDefinition tool) {
        List<String> parts = new ArrayList<>();
        add(parts, tool.name());
        add(parts, tool.description());
        return String.join(" ", parts);
    }

    public String agentText(AgentEntity agent) {
        List<String> parts = new ArrayList<>();
        add(parts, agent.name());
        add(parts, agent.description());
        if (!agent.tags().isEmpty()) {
            parts.add("Tags: " + String.join(", ", agent.tags()));
        }
        if (!agent.capabilities().isEmpty()) {
            parts.add("Capabilities: " + String.join(", ", agent.capabilities()));
        }
        for (AgentSkill skill : agent.skills()) {
            add(parts, skill.name());
            add(parts, skill.description());
        }
        return String.join(" ", parts);
    }

    private static void add(List<String> parts, String value) {
        if (value != null && !value.isBlank()) {
            parts.add(value.trim());
        }
    }
}
