package com.mcpgateway.registry.search.engine;

import com.mcpgateway.registry.common.model.AgentHit;
import com.mcpgateway.registry.common.model.EmbeddingRecord;
import com.mcpgateway.registry.common.model.EntityType;
import com.mcpgateway.registry.common.model.MatchingTool;
import com.mcpgateway.registry.common.model.SearchResultSet;
import com.mcpgateway.registry.common.model.ServerHit;
import com.mcpgateway.registry.common.model.ToolHit;
import com.mcpgateway.registry.search.config.SearchSettings;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Превращает ранжированный пул кандидатов в ответ: нормализует оценки,
 * группирует инструменты под серверами и обрезает списки по типам.
 * <p>
 * relevance = combined / (1 + w), ограниченная [0, 1]. Нормализация идёт по
 * теоретическому диапазону оценки, поэтому 1.0 получает только полное
 * семантическое и ключевое совпадение, а оценки сравнимы между запросами.
 */
@Component
@RequiredArgsConstructor
public class SearchResultFormatter {

    static final int MAX_MATCHING_TOOLS = 3;

    private final SearchSettings settings;

    public SearchResultSet format(String query, List<ScoredCandidate> ranked, int maxResults,
                                  boolean degraded, String searchMode) {
        List<ServerHit> servers = new ArrayList<>();
        List<ToolHit> tools = new ArrayList<>();
        List<AgentHit> agents = new ArrayList<>();
        Map<String, List<MatchingTool>> toolsByServer = new LinkedHashMap<>();

        // matching tools come from the whole pool, before per-type truncation
        for (ScoredCandidate candidate : ranked) {
            EmbeddingRecord record = candidate.record();
            if (record.entityType() == EntityType.TOOL) {
                List<MatchingTool> matching = toolsByServer.computeIfAbsent(record.ownerId(), owner -> new ArrayList<>());
                if (matching.size() < MAX_MATCHING_TOOLS) {
                    matching.add(new MatchingTool(record.name(), record.description(), relevance(candidate),
                            toolContext(record)));
                }
            }
        }

        for (ScoredCandidate candidate : ranked) {
            EmbeddingRecord record = candidate.record();
            switch (record.entityType()) {
                case MCP_SERVER -> {
                    if (servers.size() < maxResults) {
                        servers.add(toServerHit(candidate, toolsByServer.getOrDefault(record.id(), List.of())));
                    }
                }
                case TOOL -> {
                    if (tools.size() < maxResults) {
                        tools.add(toToolHit(candidate));
                    }
                }
                case A2A_AGENT -> {
                    if (agents.size() < maxResults) {
                        agents.add(toAgentHit(candidate));
                    }
                }
            }
        }

        return SearchResultSet.builder()
                .query(query)
                .servers(servers)
                .tools(tools)
                .agents(agents)
                .totalServers(servers.size())
                .totalTools(tools.size())
                .totalAgents(agents.size())
                .degraded(degraded)
                .searchMode(searchMode)
                .build();
    }

    double relevance(ScoredCandidate candidate) {
        double normalized = candidate.combinedScore() / settings.maxCombinedScore();
        double clamped = Math.max(0.0, Math.min(1.0, normalized));
        return Math.round(clamped * 10_000.0) / 10_000.0;
    }

    private ServerHit toServerHit(ScoredCandidate candidate, List<MatchingTool> matchingTools) {
        EmbeddingRecord record = candidate.record();
        Object numTools = record.metadata().get("num_tools");
        return ServerHit.builder()
                .path(record.path())
                .name(record.name())
                .description(record.description())
                .tags(record.tags())
                .numTools(numTools instanceof Number number ? number.intValue() : 0)
                // disabled entities never reach the formatter
                .enabled(true)
                .relevanceScore(relevance(candidate))
                .matchingTools(List.copyOf(matchingTools))
                .matchContext(record.description())
                .build();
    }

    @SuppressWarnings("unchecked")
    private ToolHit toToolHit(ScoredCandidate candidate) {
        EmbeddingRecord record = candidate.record();
        Object schema = record.metadata().get("input_schema");
        return ToolHit.builder()
                .name(record.name())
                .description(record.description())
                .serverPath(record.ownerId())
                .serverName(record.metadataValue("server_name"))
                .inputSchema(schema instanceof Map<?, ?> map ? (Map<String, Object>) map : Map.of())
                .relevanceScore(relevance(candidate))
                .matchContext(toolContext(record))
                .build();
    }

    @SuppressWarnings("unchecked")
    private AgentHit toAgentHit(ScoredCandidate candidate) {
        EmbeddingRecord record = candidate.record();
        Object skills = record.metadata().get("skills");
        return AgentHit.builder()
                .path(record.path())
                .name(record.name())
                .description(record.description())
                .tags(record.tags())
                .skills(skills instanceof List<?> list ? (List<String>) list : List.of())
                .visibility(record.metadataValue("visibility"))
                .trustLevel(record.metadataValue("trust_level"))
                .enabled(true)
                .relevanceScore(relevance(candidate))
                .matchContext(record.description())
                .build();
    }

    /** Описание инструмента, а если его нет, то имя */
    private static String toolContext(EmbeddingRecord record) {
        String description = record.description();
        return description == null || description.isBlank() ? "Tool: " + record.name() : description;
    }
}
