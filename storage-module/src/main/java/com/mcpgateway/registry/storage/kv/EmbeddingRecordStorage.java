package com.mcpgateway.registry.storage.kv;

import com.mcpgateway.registry.common.model.EmbeddingRecord;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Интерфейс для постоянного хранения векторных записей
 */
public interface EmbeddingRecordStorage {

    /** Открыть хранилище */
    void initialize();

    /** Сохранить запись */
    void put(EmbeddingRecord record) throws Exception;

    /** Атомарно записать группу и удалить устаревшие ID */
    void writeGroup(List<EmbeddingRecord> records, Collection<String> staleIds) throws Exception;

    /** Получить запись по ID */
    Optional<EmbeddingRecord> get(String id) throws Exception;

    /** Удалить запись */
    boolean delete(String id) throws Exception;

    /** Получить все записи */
    List<EmbeddingRecord> getAll() throws Exception;

    /** Закрыть хранилище */
    void cleanup();
}
