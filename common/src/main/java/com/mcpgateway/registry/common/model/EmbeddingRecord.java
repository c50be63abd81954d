package com.mcpgateway.registry.common.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.github.jelmerk.hnswlib.core.Item;
import lombok.Builder;

import java.io.Serializable;
import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Векторное представление одной сущности реестра (сервера, инструмента или агента).
 * Для инструментов ownerId совпадает с путём сервера, для остальных сущностей с их собственным путём.
 */
@Builder(toBuilder = true)
public record EmbeddingRecord(
    @JsonProperty("id")
    String id,

    @JsonProperty("entity_type")
    EntityType entityType,

    @JsonProperty("owner_id")
    String ownerId,

    @JsonProperty("path")
    String path,

    @JsonProperty("name")
    String name,

    @JsonProperty("description")
    String description,

    @JsonProperty("tags")
    List<String> tags,

    @JsonProperty("text")
    String text,

    @JsonProperty("embedding")
    float[] embedding,

    @JsonProperty("enabled")
    boolean enabled,

    @JsonProperty("metadata")
    Map<String, Object> metadata,

    @JsonProperty("embedding_metadata")
    Map<String, Object> embeddingMetadata,

    @JsonProperty("indexed_at")
    Instant indexedAt
) implements Serializable, Item<String, float[]> {

    private static final String TOOL_ID_SEPARATOR = "#tool:";

    public EmbeddingRecord {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("Record id cannot be null or blank");
        }
        if (embedding == null || embedding.length == 0) {
            throw new IllegalArgumentException("Embedding cannot be null or empty");
        }
        tags = tags == null ? List.of() : List.copyOf(tags);
        metadata = metadata == null ? Map.of() : Map.copyOf(metadata);
        embeddingMetadata = embeddingMetadata == null ? Map.of() : Map.copyOf(embeddingMetadata);
        ownerId = ownerId == null ? id : ownerId;
    }

    /** Идентификатор записи инструмента внутри сервера */
    public static String toolId(String serverPath, String toolName) {
        return serverPath + TOOL_ID_SEPARATOR + toolName;
    }

    /** Копия записи с другим флагом доступности, без пересчёта эмбеддинга */
    public EmbeddingRecord withEnabled(boolean newEnabled) {
        return toBuilder().enabled(newEnabled).build();
    }

    /** Строковое значение из метаданных отображения */
    public String metadataValue(String key) {
        Object value = metadata.get(key);
        return value == null ? null : value.toString();
    }

    /** Нулевой вектор получается из пустого текста и не участвует в приближённом поиске */
    @JsonIgnore
    public boolean isZeroVector() {
        for (float v : embedding) {
            if (v != 0.0f) {
                return false;
            }
        }
        return true;
    }

    @JsonIgnore
    @Override
    public float[] vector() {
        return embedding;
    }

    @JsonIgnore
    @Override
    public int dimensions() {
        return embedding.length;
    }
}
