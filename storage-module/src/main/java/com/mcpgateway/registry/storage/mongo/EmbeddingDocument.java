package com.mcpgateway.registry.storage.mongo;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Document;
import org.springframework.data.mongodb.core.mapping.Field;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Документ MongoDB с эмбеддингом сущности реестра.
 * Коллекция задаётся явно при каждом обращении: её имя включает размерность.
 * Метаданные отображения хранятся JSON строкой, так как JSON Schema инструментов
 * содержит ключи с символом $.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Document
public class EmbeddingDocument {

    @Id
    private String id;

    @Field("entity_type")
    private String entityType;

    @Field("owner_id")
    private String ownerId;

    private String path;

    private String name;

    private String description;

    private List<String> tags;

    private String text;

    private List<Double> embedding;

    private boolean enabled;

    @Field("metadata_json")
    private String metadataJson;

    @Field("embedding_metadata")
    private Map<String, Object> embeddingMetadata;

    @Field("indexed_at")
    private Instant indexedAt;
}
