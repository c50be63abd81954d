package com.mcpgateway.registry.search.indexing;

import com.mcpgateway.registry.common.exception.EmbeddingUnavailableException;
import com.mcpgateway.registry.common.exception.SearchValidationException;
import com.mcpgateway.registry.common.model.AgentEntity;
import com.mcpgateway.registry.common.model.AgentSkill;
import com.mcpgateway.registry.common.model.EmbeddingRecord;
import com.mcpgateway.registry.common.model.EntityType;
import com.mcpgateway.registry.common.model.ServerEntity;
import com.mcpgateway.registry.common.model.ToolDefinition;
import com.mcpgateway.registry.search.config.SearchSettings;
import com.mcpgateway.registry.search.embedding.EmbeddingProvider;
import com.mcpgateway.registry.storage.index.VectorIndexStore;
import com.google.common.util.concurrent.Striped;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.concurrent.locks.Lock;

/**
 * Индексация сущностей реестра. Все тексты группы (сервер и его инструменты)
 * превращаются в эмбеддинги до первой записи, поэтому ошибка провайдера
 * оставляет предыдущую версию в индексе нетронутой.
 */
@Slf4j
@Service
public class EntityIndexer {

    private final VectorIndexStore store;
    private final EmbeddingProvider embeddingProvider;
    private final EntityTextBuilder textBuilder;
    private final EntityStatusRegistry statusRegistry;
    private final IndexRetryQueue retryQueue;
    private final SearchSettings settings;
    private final Executor indexingExecutor;
    private final Striped<Lock> writeLocks = Striped.lock(64);

    public EntityIndexer(VectorIndexStore store,
                         EmbeddingProvider embeddingProvider,
                         EntityTextBuilder textBuilder,
                         EntityStatusRegistry statusRegistry,
                         IndexRetryQueue retryQueue,
                         SearchSettings settings,
                         @Qualifier("indexingExecutor") Executor indexingExecutor) {
        this.store = store;
        this.embeddingProvider = embeddingProvider;
        this.textBuilder = textBuilder;
        this.statusRegistry = statusRegistry;
        this.retryQueue = retryQueue;
        this.settings = settings;
        this.indexingExecutor = indexingExecutor;
    }

    /**
     * Проиндексировать сервер и его инструменты. Инструменты, исчезнувшие из сервера,
     * удаляются вместе с заменой группы.
     *
     * @return число записанных записей, 0, если за время расчёта эмбеддингов пришла более новая версия
     */
    public int indexServer(ServerEntity server) {
        requirePath(server.path(), server.name());
        return writeServer(PendingIndexTask.forServer(server, retryQueue.nextVersion(server.path())), true);
    }

    private int writeServer(PendingIndexTask task, boolean queueOnFailure) {
        ServerEntity server = task.server();
        Map<String, ToolDefinition> tools = new LinkedHashMap<>();
        for (ToolDefinition tool : server.tools()) {
            if (tool.name() == null || tool.name().isBlank()) {
                throw new SearchValidationException("Tool name must not be blank on server " + server.path());
            }
            if (tools.putIfAbsent(tool.name(), tool) != null) {
                log.warn("Duplicate tool {} on server {}, keeping the first definition", tool.name(), server.path());
            }
        }

        List<String> texts = new ArrayList<>();
        texts.add(textBuilder.serverText(server));
        tools.values().forEach(tool -> texts.add(textBuilder.toolText(tool)));

        List<float[]> vectors = embedOrQueue(texts, task, queueOnFailure);

        Instant now = Instant.now();
        Map<String, Object> embeddingMetadata = embeddingProvider.describe();
        List<EmbeddingRecord> records = new ArrayList<>();

        Map<String, Object> serverMetadata = new HashMap<>();
        serverMetadata.put("num_tools", tools.size());
        records.add(EmbeddingRecord.builder()
                .id(server.path())
                .entityType(EntityType.MCP_SERVER)
                .ownerId(server.path())
                .path(server.path())
                .name(server.name())
                .description(nullToEmpty(server.description()))
                .tags(server.tags())
                .text(texts.get(0))
                .embedding(vectors.get(0))
                .enabled(server.enabled())
                .metadata(serverMetadata)
                .embeddingMetadata(embeddingMetadata)
                .indexedAt(now)
                .build());

        int position = 1;
        for (ToolDefinition tool : tools.values()) {
            Map<String, Object> toolMetadata = new HashMap<>();
            toolMetadata.put("server_name", server.name());
            toolMetadata.put("server_path", server.path());
            if (tool.inputSchema() != null) {
                toolMetadata.put("input_schema", tool.inputSchema());
            }
            records.add(EmbeddingRecord.builder()
                    .id(EmbeddingRecord.toolId(server.path(), tool.name()))
                    .entityType(EntityType.TOOL)
                    .ownerId(server.path())
                    .path(server.path())
                    .name(tool.name())
                    .description(nullToEmpty(tool.description()))
                    .tags(server.tags())
                    .text(texts.get(position))
                    .embedding(vectors.get(position))
                    .enabled(server.enabled())
                    .metadata(toolMetadata)
                    .embeddingMetadata(embeddingMetadata)
                    .indexedAt(now)
                    .build());
            position++;
        }

        if (!writeIfLatest(task, records, server.enabled())) {
            return 0;
        }
        log.info("Indexed server {} with {} tools", server.path(), tools.size());
        return records.size();
    }

    /** Проиндексировать агента */
    public int indexAgent(AgentEntity agent) {
        requirePath(agent.path(), agent.name());
        return writeAgent(PendingIndexTask.forAgent(agent, retryQueue.nextVersion(agent.path())), true);
    }

    private int writeAgent(PendingIndexTask task, boolean queueOnFailure) {
        AgentEntity agent = task.agent();
        String text = textBuilder.agentText(agent);
        List<float[]> vectors = embedOrQueue(List.of(text), task, queueOnFailure);

        Map<String, Object> metadata = new HashMap<>();
        metadata.put("skills", agent.skills().stream().map(AgentSkill::name).filter(name -> name != null).toList());
        metadata.put("capabilities", agent.capabilities());
        metadata.put("visibility", agent.visibility());
        metadata.put("trust_level", agent.trustLevel());

        EmbeddingRecord record = EmbeddingRecord.builder()
                .id(agent.path())
                .entityType(EntityType.A2A_AGENT)
                .ownerId(agent.path())
                .path(agent.path())
                .name(agent.name())
                .description(nullToEmpty(agent.description()))
                .tags(agent.tags())
                .text(text)
                .embedding(vectors.get(0))
                .enabled(agent.enabled())
                .metadata(metadata)
                .embeddingMetadata(embeddingProvider.describe())
                .indexedAt(Instant.now())
                .build();

        if (!writeIfLatest(task, List.of(record), agent.enabled())) {
            return 0;
        }
        log.info("Indexed agent {}", agent.path());
        return 1;
    }

    /** Индексация в фоне; ошибка, кроме недоступности провайдера, попадает в лог и в future */
    public CompletableFuture<Integer> indexServerAsync(ServerEntity server) {
        return CompletableFuture.supplyAsync(() -> indexServer(server), indexingExecutor)
                .whenComplete((count, error) -> logAsyncFailure(server.path(), error));
    }

    public CompletableFuture<Integer> indexAgentAsync(AgentEntity agent) {
        return CompletableFuture.supplyAsync(() -> indexAgent(agent), indexingExecutor)
                .whenComplete((count, error) -> logAsyncFailure(agent.path(), error));
    }

    /**
     * Удалить сущность вместе с принадлежащими ей записями.
     * ID инструмента удаляет только запись инструмента.
     *
     * @return число удалённых записей
     */
    public int removeEntity(String id) {
        int removed;
        Lock lock = writeLocks.get(id);
        lock.lock();
        try {
            retryQueue.forget(id);
            removed = store.removeGroup(id);
            if (removed == 0 && store.remove(id)) {
                removed = 1;
            }
            statusRegistry.forget(id);
        } finally {
            lock.unlock();
        }
        log.info("Removed {} records for {}", removed, id);
        return removed;
    }

    /**
     * Переключить доступность без пересчёта эмбеддингов. Запросы видят новое
     * состояние сразу через реестр состояний, флаги в индексе обновляются следом.
     *
     * @return false, если сущность не проиндексирована
     */
    public boolean setEnabled(String path, boolean enabled) {
        statusRegistry.setEnabled(path, enabled);
        int updated = store.setGroupEnabled(path, enabled);
        if (updated == 0) {
            log.debug("Enabled state of {} recorded, entity is not indexed", path);
            return false;
        }
        log.info("Entity {} {} ({} records)", path, enabled ? "enabled" : "disabled", updated);
        return true;
    }

    /**
     * Переиндексировать полный набор сущностей и удалить группы, которых в нём нет.
     *
     * @return число сущностей, которые не удалось проиндексировать
     */
    public int rebuild(List<ServerEntity> servers, List<AgentEntity> agents) {
        Set<String> keep = new HashSet<>();
        int failures = 0;

        for (ServerEntity server : servers) {
            keep.add(server.path());
            try {
                indexServer(server);
            } catch (RuntimeException e) {
                failures++;
                log.error("Failed to index server {} during rebuild: {}", server.path(), e.getMessage());
            }
        }
        for (AgentEntity agent : agents) {
            keep.add(agent.path());
            try {
                indexAgent(agent);
            } catch (RuntimeException e) {
                failures++;
                log.error("Failed to index agent {} during rebuild: {}", agent.path(), e.getMessage());
            }
        }

        int staleGroups = 0;
        for (String ownerId : store.ownerIds()) {
            if (!keep.contains(ownerId)) {
                removeEntity(ownerId);
                staleGroups++;
            }
        }

        log.info("Rebuilt search index: {} servers, {} agents, {} failures, {} stale groups removed",
                servers.size(), agents.size(), failures, staleGroups);
        return failures;
    }

    /**
     * Повторить индексацию сущностей, отложенных из-за недоступности провайдера
     */
    @Scheduled(fixedDelayString = "#{@searchSettings.retryInterval().toMillis()}",
               initialDelayString = "#{@searchSettings.retryInterval().toMillis()}")
    public void retryPending() {
        List<PendingIndexTask> tasks = retryQueue.drain();
        if (tasks.isEmpty()) {
            return;
        }
        log.debug("Retrying indexing of {} entities", tasks.size());

        for (PendingIndexTask task : tasks) {
            PendingIndexTask attempt = task.nextAttempt();
            if (!retryQueue.isLatest(attempt.path(), attempt.version())) {
                log.debug("Dropped retry of {}: version {} is superseded", attempt.path(), attempt.version());
                continue;
            }
            try {
                if (attempt.server() != null) {
                    writeServer(attempt, false);
                } else {
                    writeAgent(attempt, false);
                }
            } catch (EmbeddingUnavailableException e) {
                if (attempt.attempts() >= settings.maxRetryAttempts()) {
                    log.error("Giving up indexing {} after {} attempts: {}", attempt.path(), attempt.attempts(), e.getMessage());
                } else {
                    retryQueue.requeue(attempt);
                }
            } catch (RuntimeException e) {
                log.error("Retry indexing of {} failed: {}", attempt.path(), e.getMessage(), e);
            }
        }
    }

    public int pendingRetries() {
        return retryQueue.size();
    }

    private List<float[]> embedOrQueue(List<String> texts, PendingIndexTask task, boolean queueOnFailure) {
        try {
            return embeddingProvider.embed(texts);
        } catch (EmbeddingUnavailableException e) {
            if (queueOnFailure) {
                log.warn("Embedding provider unavailable while indexing {}, queued for retry: {}", task.path(), e.getMessage());
                if (settings.maxRetryAttempts() > 0) {
                    retryQueue.enqueue(task);
                }
            }
            throw e;
        }
    }

    /**
     * Записать группу, если версия задачи всё ещё последняя для пути.
     * Более старая версия, пришедшая позже, в индекс не попадает.
     */
    private boolean writeIfLatest(PendingIndexTask task, List<EmbeddingRecord> records, boolean enabled) {
        Lock lock = writeLocks.get(task.path());
        lock.lock();
        try {
            if (!retryQueue.isLatest(task.path(), task.version())) {
                log.debug("Skipped writing {}: version {} is superseded", task.path(), task.version());
                return false;
            }
            store.replaceGroup(task.path(), records);
            statusRegistry.setEnabled(task.path(), enabled);
            retryQueue.complete(task.path(), task.version());
            return true;
        } finally {
            lock.unlock();
        }
    }

    private static void logAsyncFailure(String path, Throwable error) {
        if (error == null) {
            return;
        }
        Throwable cause = error instanceof CompletionException && error.getCause() != null ? error.getCause() : error;
        if (cause instanceof EmbeddingUnavailableException) {
            return;
        }
        log.error("Background indexing of {} failed: {}", path, cause.getMessage(), cause);
    }

    private static void requirePath(String path, String name) {
        if (path == null || path.isBlank()) {
            throw new SearchValidationException("Entity path must not be blank");
        }
        if (name == null || name.isBlank()) {
            throw new SearchValidationException("Entity name must not be blank: " + path);
        }
    }

    private static String nullToEmpty(String value) {
        return value == null ? "" : value;
    }
}
