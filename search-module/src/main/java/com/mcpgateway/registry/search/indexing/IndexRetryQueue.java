package com.mcpgateway.registry.search.indexing;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Очередь повторной индексации. Помнит последнюю отправленную версию каждого пути
 * и хранит не более одной задачи на путь, всегда самую новую.
 */
@Slf4j
@Component
public class IndexRetryQueue {

    private final AtomicLong versions = new AtomicLong();
    private final Map<String, Long> latest = new ConcurrentHashMap<>();
    private final Map<String, PendingIndexTask> pending = new ConcurrentHashMap<>();

    /** Выдать номер новой отправки пути, он становится последним */
    public long nextVersion(String path) {
        long version = versions.incrementAndGet();
        latest.merge(path, version, Math::max);
        return version;
    }

    /** Версия ещё не вытеснена более новой отправкой или удалением */
    public boolean isLatest(String path, long version) {
        Long current = latest.get(path);
        return current != null && current == version;
    }

    /** Поставить в очередь; более новая ожидающая версия того же пути не заменяется */
    public void enqueue(PendingIndexTask task) {
        if (!isLatest(task.path(), task.version())) {
            log.debug("Not queueing superseded version {} of {}", task.version(), task.path());
            return;
        }
        PendingIndexTask kept = pending.merge(task.path(), task, IndexRetryQueue::newer);
        if (kept == task) {
            log.info("Queued {} (version {}) for retry indexing", task.path(), task.version());
        }
    }

    /** Вернуть задачу после неудачной попытки, если за это время не пришла новая версия */
    public void requeue(PendingIndexTask task) {
        if (isLatest(task.path(), task.version())) {
            pending.merge(task.path(), task, IndexRetryQueue::newer);
        }
    }

    /** Снять ожидающую задачу, если она не новее записанной версии */
    public void complete(String path, long version) {
        PendingIndexTask left = pending.computeIfPresent(path, (key, task) -> task.version() <= version ? null : task);
        if (left != null) {
            log.debug("Kept newer pending version {} of {}", left.version(), path);
        }
    }

    /** Забыть путь: ожидающая задача снимается, версии в полёте больше не запишутся */
    public void forget(String path) {
        latest.remove(path);
        if (pending.remove(path) != null) {
            log.debug("Cancelled pending retry for {}", path);
        }
    }

    /** Забрать все ожидающие задачи */
    public List<PendingIndexTask> drain() {
        List<PendingIndexTask> tasks = new ArrayList<>();
        for (String path : List.copyOf(pending.keySet())) {
            PendingIndexTask task = pending.remove(path);
            if (task != null) {
                tasks.add(task);
            }
        }
        return tasks;
    }

    public int size() {
        return pending.size();
    }

    private static PendingIndexTask newer(PendingIndexTask queued, PendingIndexTask offered) {
        return offered.version() >= queued.version() ? offered : queued;
    }
}
