package com.mcpgateway.registry.search.indexing;

import com.mcpgateway.registry.common.model.AgentEntity;
import com.mcpgateway.registry.common.model.ServerEntity;

import java.time.Instant;

/**
 * Версия сущности, отправленная на индексацию. Номер версии растёт с каждой отправкой,
 * записать в индекс можно только последнюю версию пути.
 */
public record PendingIndexTask(String path, long version, ServerEntity server, AgentEntity agent,
                               int attempts, Instant enqueuedAt) {

    public static PendingIndexTask forServer(ServerEntity server, long version) {
        return new PendingIndexTask(server.path(), version, server, null, 0, Instant.now());
    }

    public static PendingIndexTask forAgent(AgentEntity agent, long version) {
        return new PendingIndexTask(agent.path(), version, null, agent, 0, Instant.now());
    }

    public PendingIndexTask nextAttempt() {
        return new PendingIndexTask(path, version, server, agent, attempts + 1, enqueuedAt);
    }
}
