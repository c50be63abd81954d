package com.mcpgateway.registry.storage.index;

import com.github.jelmerk.hnswlib.core.DistanceFunctions;
import com.github.jelmerk.hnswlib.core.SearchResult;
import com.github.jelmerk.hnswlib.core.hnsw.HnswIndex;
import com.mcpgateway.registry.common.exception.IndexBackendException;
import com.mcpgateway.registry.common.model.EmbeddingRecord;
import com.mcpgateway.registry.common.model.IndexFilter;
import com.mcpgateway.registry.common.model.VectorMatch;
import com.mcpgateway.registry.storage.kv.EmbeddingRecordStorage;
import com.mcpgateway.registry.storage.similarity.VectorSimilarity;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Файловый бэкенд: записи хранятся в RocksDB, поиск идёт по HNSW индексу в памяти.
 * Индекс перестраивается из RocksDB при ensureIndex и при исчерпании ёмкости.
 * Записи с нулевым вектором в HNSW не попадают, их находит только точный перебор.
 */
@Slf4j
public class HnswVectorIndexStore extends AbstractVectorIndexStore {

    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();
    private final EmbeddingRecordStorage storage;

    /** Маппинг ID → запись */
    private final Map<String, EmbeddingRecord> records = new HashMap<>();

    /** Маппинг владелец → ID его записей */
    private final Map<String, Set<String>> idsByOwner = new HashMap<>();

    /** HNSW индекс, null в режиме FALLBACK */
    private HnswIndex<String, float[], EmbeddingRecord, Float> hnswIndex;

    /** Ёмкость текущего индекса */
    private int capacity;

    /** Занятые слоты, включая помеченные удалёнными */
    private int usedSlots;

    public HnswVectorIndexStore(VectorIndexSettings settings, VectorSimilarity similarity, EmbeddingRecordStorage storage) {
        super(settings, similarity);
        this.storage = storage;
        log.info("Initialized HNSW vector store with dimension={}, m={}, efConstruction={}, efSearch={}, dataPath={}",
                settings.dimension(), settings.m(), settings.efConstruction(), settings.efSearch(), settings.dataPath());
    }

    @Override
    public String backendName() {
        return "file";
    }

    @Override
    protected void openStorage() {
        storage.initialize();

        lock.writeLock().lock();
        try {
            List<EmbeddingRecord> stored = storage.getAll();
            records.clear();
            idsByOwner.clear();
            int skipped = 0;
            for (EmbeddingRecord record : stored) {
                if (record.dimensions() != settings.dimension()) {
                    skipped++;
                    continue;
                }
                putInMemory(record);
            }
            if (skipped > 0) {
                log.warn("Skipped {} stored records with dimension different from {}", skipped, settings.dimension());
            }
            log.info("Loaded {} embedding records from RocksDB", records.size());
        } catch (IndexBackendException e) {
            throw e;
        } catch (Exception e) {
            throw new IndexBackendException("Failed to load embedding records from RocksDB", e);
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    protected boolean prepareNativeIndex() {
        lock.writeLock().lock();
        try {
            rebuildIndex(Math.max(settings.initialCapacity(), records.size() * 2));
            return true;
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    protected void onModeChanged(SearchMode newMode) {
        lock.writeLock().lock();
        try {
            if (newMode == SearchMode.NATIVE && hnswIndex == null) {
                rebuildIndex(Math.max(settings.initialCapacity(), records.size() * 2));
            }
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    protected void doUpsert(EmbeddingRecord record) {
        lock.writeLock().lock();
        try {
            storage.put(record);
            removeFromMemory(record.id());
            putInMemory(record);
            addToIndex(record);
            log.debug("Upserted record {} into HNSW store", record.id());
        } catch (Exception e) {
            throw new IndexBackendException("Failed to upsert record " + record.id(), e);
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    protected void doReplaceGroup(String ownerId, List<EmbeddingRecord> newRecords) {
        lock.writeLock().lock();
        try {
            Set<String> newIds = new HashSet<>();
            newRecords.forEach(record -> newIds.add(record.id()));

            List<String> staleIds = new ArrayList<>();
            for (String id : idsByOwner.getOrDefault(ownerId, Set.of())) {
                if (!newIds.contains(id)) {
                    staleIds.add(id);
                }
            }

            // RocksDB batch first, memory only after a successful write
            storage.writeGroup(newRecords, staleIds);

            for (String staleId : staleIds) {
                removeFromMemory(staleId);
                removeFromIndex(staleId);
            }
            for (EmbeddingRecord record : newRecords) {
                removeFromMemory(record.id());
                putInMemory(record);
                addToIndex(record);
            }
            log.debug("Replaced group {}: {} records written, {} stale removed", ownerId, newRecords.size(), staleIds.size());
        } catch (IndexBackendException e) {
            throw e;
        } catch (Exception e) {
            throw new IndexBackendException("Failed to replace record group " + ownerId, e);
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    protected int doSetGroupEnabled(String ownerId, boolean enabled) {
        lock.writeLock().lock();
        try {
            List<EmbeddingRecord> updated = new ArrayList<>();
            for (String id : idsByOwner.getOrDefault(ownerId, Set.of())) {
                updated.add(records.get(id).withEnabled(enabled));
            }
            if (updated.isEmpty()) {
                return 0;
            }
            storage.writeGroup(updated, List.of());
            // HNSW nodes resolve to the live record, the graph stays as is
            updated.forEach(record -> records.put(record.id(), record));
            log.debug("Set enabled={} on {} records of group {}", enabled, updated.size(), ownerId);
            return updated.size();
        } catch (Exception e) {
            throw new IndexBackendException("Failed to update enabled state of group " + ownerId, e);
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    protected boolean doRemove(String id) {
        lock.writeLock().lock();
        try {
            if (!records.containsKey(id)) {
                return false;
            }
            storage.delete(id);
            removeFromMemory(id);
            removeFromIndex(id);
            return true;
        } catch (Exception e) {
            throw new IndexBackendException("Failed to remove record " + id, e);
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    protected int doRemoveGroup(String ownerId) {
        lock.writeLock().lock();
        try {
            List<String> ids = new ArrayList<>(idsByOwner.getOrDefault(ownerId, Set.of()));
            if (ids.isEmpty()) {
                return 0;
            }
            storage.writeGroup(List.of(), ids);
            for (String id : ids) {
                removeFromMemory(id);
                removeFromIndex(id);
            }
            log.debug("Removed group {} with {} records", ownerId, ids.size());
            return ids.size();
        } catch (Exception e) {
            throw new IndexBackendException("Failed to remove record group " + ownerId, e);
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    protected List<VectorMatch> nativeQuery(float[] vector, int k, IndexFilter filter) {
        lock.readLock().lock();
        try {
            if (hnswIndex == null) {
                throw new IndexBackendException("HNSW index is not built");
            }
            int indexed = hnswIndex.size();
            if (indexed == 0) {
                return List.of();
            }

            // over-fetch when a type filter drops part of the neighbours
            int fetch = Math.min(indexed, filter.acceptsAll() ? k : k * 4);
            List<VectorMatch> matches = new ArrayList<>();
            Set<String> seen = new HashSet<>();
            while (true) {
                matches.clear();
                seen.clear();
                List<SearchResult<EmbeddingRecord, Float>> nearest = hnswIndex.findNearest(vector, fetch);
                for (SearchResult<EmbeddingRecord, Float> result : nearest) {
                    // the live record wins over a stale node left by remove()
                    EmbeddingRecord record = records.get(result.item().id());
                    if (record == null || !filter.accepts(record) || !seen.add(record.id())) {
                        continue;
                    }
                    matches.add(new VectorMatch(record, similarity.cosineSimilarity(vector, record.embedding())));
                }
                if (matches.size() >= k || fetch >= indexed) {
                    break;
                }
                fetch = Math.min(indexed, fetch * 2);
            }
            return matches;
        } catch (IndexBackendException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new IndexBackendException("HNSW query failed: " + e.getMessage(), e);
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    protected List<EmbeddingRecord> scanRecords(IndexFilter filter) {
        lock.readLock().lock();
        try {
            List<EmbeddingRecord> snapshot = new ArrayList<>();
            for (EmbeddingRecord record : records.values()) {
                if (filter.accepts(record)) {
                    snapshot.add(record);
                }
            }
            return snapshot;
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public List<EmbeddingRecord> findByOwner(String ownerId) {
        ensureReady();
        lock.readLock().lock();
        try {
            List<EmbeddingRecord> owned = new ArrayList<>();
            for (String id : idsByOwner.getOrDefault(ownerId, Set.of())) {
                owned.add(records.get(id));
            }
            return owned;
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public List<String> ownerIds() {
        ensureReady();
        lock.readLock().lock();
        try {
            return idsByOwner.keySet().stream().sorted().toList();
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public Optional<EmbeddingRecord> get(String id) {
        ensureReady();
        lock.readLock().lock();
        try {
            return Optional.ofNullable(records.get(id));
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public long size() {
        ensureReady();
        lock.readLock().lock();
        try {
            return records.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    /** Размер HNSW индекса, 0 если индекс не построен */
    public int indexedCount() {
        lock.readLock().lock();
        try {
            return hnswIndex == null ? 0 : hnswIndex.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public void close() {
        storage.cleanup();
    }

    private void putInMemory(EmbeddingRecord record) {
        records.put(record.id(), record);
        idsByOwner.computeIfAbsent(record.ownerId(), owner -> new LinkedHashSet<>()).add(record.id());
    }

    private void removeFromMemory(String id) {
        EmbeddingRecord removed = records.remove(id);
        if (removed != null) {
            Set<String> owned = idsByOwner.get(removed.ownerId());
            if (owned != null) {
                owned.remove(id);
                if (owned.isEmpty()) {
                    idsByOwner.remove(removed.ownerId());
                }
            }
        }
    }

    private void addToIndex(EmbeddingRecord record) {
        if (hnswIndex == null) {
            return;
        }
        removeFromIndex(record.id());
        if (record.isZeroVector()) {
            return;
        }
        if (usedSlots >= capacity) {
            // records already holds the new record, the rebuild picks it up
            rebuildIndex(Math.max(capacity * 2, records.size() * 2));
            return;
        }
        hnswIndex.add(record);
        usedSlots++;
    }

    private void removeFromIndex(String id) {
        if (hnswIndex != null) {
            hnswIndex.remove(id, 0);
        }
    }

    private void rebuildIndex(int newCapacity) {
        HnswIndex<String, float[], EmbeddingRecord, Float> rebuilt = HnswIndex
                .newBuilder(settings.dimension(), DistanceFunctions.FLOAT_COSINE_DISTANCE, newCapacity)
                .withM(settings.m())
                .withEfConstruction(settings.efConstruction())
                .withEf(settings.efSearch())
                .withRemoveEnabled()
                .build();

        List<EmbeddingRecord> items = records.values().stream()
                .filter(record -> !record.isZeroVector())
                .toList();
        try {
            rebuilt.addAll(items);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IndexBackendException("Interrupted while building HNSW index", e);
        }

        hnswIndex = rebuilt;
        capacity = newCapacity;
        usedSlots = items.size();
        log.info("Built HNSW index with {} vectors, capacity={}", items.size(), newCapacity);
    }
}
