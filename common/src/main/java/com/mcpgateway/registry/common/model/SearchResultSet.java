package com.mcpgateway.registry.common.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;

import java.util.List;

/**
 * Ответ гибридного поиска, сгруппированный по типам сущностей
 */
@Builder
public record SearchResultSet(
    @JsonProperty("query")
    String query,

    @JsonProperty("servers")
    List<ServerHit> servers,

    @JsonProperty("tools")
    List<ToolHit> tools,

    @JsonProperty("agents")
    List<AgentHit> agents,

    @JsonProperty("total_servers")
    int totalServers,

    @JsonProperty("total_tools")
    int totalTools,

    @JsonProperty("total_agents")
    int totalAgents,

    @JsonProperty("degraded")
    boolean degraded,

    @JsonProperty("search_mode")
    String searchMode
) {
    public SearchResultSet {
        servers = servers == null ? List.of() : List.copyOf(servers);
        tools = tools == null ? List.of() : List.copyOf(tools);
        agents = agents == null ? List.of() : List.copyOf(agents);
    }

    /** Пустой ответ для запросов, не прошедших проверку длины */
    public static SearchResultSet empty(String query, String searchMode) {
        return new SearchResultSet(query, List.of(), List.of(), List.of(), 0, 0, 0, false, searchMode);
    }

    @JsonIgnore
    public boolean isEmpty() {
        return servers.isEmpty() && tools.isEmpty() && agents.isEmpty();
    }
}
