package com.mcpgateway.registry.storage.index;

import com.mcpgateway.registry.common.model.EmbeddingRecord;
import com.mcpgateway.registry.common.model.IndexFilter;
import com.mcpgateway.registry.common.model.VectorMatch;

import java.util.List;
import java.util.Optional;

/**
 * Хранилище векторных записей с поиском ближайших соседей по косинусному сходству
 */
public interface VectorIndexStore extends AutoCloseable {

    /**
     * Подготовить индекс. Идемпотентно. Несовпадение размерности или метрики
     * приводит к SearchConfigurationException, отсутствие нативного поиска к режиму FALLBACK.
     */
    void ensureIndex(int dimension, String metric);

    /** Вставить или заменить запись (последняя запись побеждает) */
    void upsert(EmbeddingRecord record);

    /** Атомарно заменить все записи владельца, удалив отсутствующие в новом наборе */
    void replaceGroup(String ownerId, List<EmbeddingRecord> records);

    /**
     * Атомарно выставить флаг доступности всем записям владельца без замены векторов.
     *
     * @return число записей владельца
     */
    int setGroupEnabled(String ownerId, boolean enabled);

    /** Удалить запись. Для неизвестного ID ничего не делает и возвращает false */
    boolean remove(String id);

    /** Каскадно удалить запись владельца и все принадлежащие ему записи */
    int removeGroup(String ownerId);

    /** До k ближайших записей по убыванию сходства, при равенстве по возрастанию ID */
    List<VectorMatch> query(float[] vector, int k, IndexFilter filter);

    /** Записи, у которых путь, имя, описание или теги содержат хотя бы один из токенов */
    List<EmbeddingRecord> findByKeywords(List<String> tokens, IndexFilter filter, int limit);

    /** Все записи владельца */
    List<EmbeddingRecord> findByOwner(String ownerId);

    /** ID всех владельцев, у которых есть записи */
    List<String> ownerIds();

    /** Получить запись по ID */
    Optional<EmbeddingRecord> get(String id);

    /** Количество записей */
    long size();

    /** Текущий режим поиска */
    SearchMode mode();

    /** Принудительно установить режим (используется в тестах и конфигурации) */
    void forceMode(SearchMode mode);

    /** Название бэкенда для диагностики */
    String backendName();

    @Override
    default void close() {
    }
}
