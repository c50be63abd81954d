package com.mcpgateway.registry.storage.kv;

import com.mcpgateway.registry.common.model.EmbeddingRecord;
import com.mcpgateway.registry.common.model.EntityType;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class RocksDbEmbeddingStorageTest {

    @TempDir
    Path tempDir;

    private RocksDbEmbeddingStorage storage;

    @BeforeEach
    void setUp() {
        storage = new RocksDbEmbeddingStorage(tempDir.resolve("rocks").toString());
        storage.initialize();
    }

    @AfterEach
    void tearDown() {
        storage.cleanup();
    }

    @Test
    @DisplayName("Запись сохраняется и читается со всеми полями")
    void putAndGetPreservesRecord() throws Exception {
        EmbeddingRecord record = newRecord("/weather-api#tool:get_forecast", "/weather-api", new float[]{0.1f, 0.2f, 0.3f});

        storage.put(record);

        EmbeddingRecord loaded = storage.get(record.id()).orElseThrow();
        assertThat(loaded.ownerId()).isEqualTo("/weather-api");
        assertThat(loaded.entityType()).isEqualTo(EntityType.TOOL);
        assertThat(loaded.embedding()).containsExactly(0.1f, 0.2f, 0.3f);
        assertThat(loaded.metadata()).containsEntry("server_name", "weather");
        assertThat(loaded.indexedAt()).isEqualTo(record.indexedAt());
    }

    @Test
    @DisplayName("Групповая запись удаляет устаревшие ключи в одном батче")
    void writeGroupDeletesStaleIds() throws Exception {
        storage.put(newRecord("/srv#tool:old", "/srv", new float[]{1f, 0f, 0f}));
        storage.put(newRecord("/srv#tool:kept", "/srv", new float[]{0f, 1f, 0f}));

        storage.writeGroup(List.of(newRecord("/srv#tool:kept", "/srv", new float[]{0f, 0f, 1f})), List.of("/srv#tool:old"));

        List<EmbeddingRecord> all = storage.getAll();
        assertThat(all).extracting(EmbeddingRecord::id).containsExactly("/srv#tool:kept");
        assertThat(all.get(0).embedding()).containsExactly(0f, 0f, 1f);
    }

    @Test
    @DisplayName("Удаление неизвестного ключа возвращает false")
    void deleteUnknownReturnsFalse() throws Exception {
        storage.put(newRecord("/a", "/a", new float[]{1f, 0f, 0f}));

        assertThat(storage.delete("/missing")).isFalse();
        assertThat(storage.delete("/a")).isTrue();
        assertThat(storage.get("/a")).isEmpty();
    }

    @Test
    @DisplayName("Данные переживают закрытие и повторное открытие хранилища")
    void recordsSurviveReopen() throws Exception {
        storage.put(newRecord("/b", "/b", new float[]{0f, 1f, 0f}));
        storage.put(newRecord("/a", "/a", new float[]{1f, 0f, 0f}));
        storage.cleanup();

        storage.initialize();

        assertThat(storage.getAll().stream().sorted(Comparator.comparing(EmbeddingRecord::id)).toList())
                .extracting(EmbeddingRecord::id)
                .containsExactly("/a", "/b");
    }

    private static EmbeddingRecord newRecord(String id, String ownerId, float[] embedding) {
        return EmbeddingRecord.builder()
                .id(id)
                .entityType(id.contains("#tool:") ? EntityType.TOOL : EntityType.MCP_SERVER)
                .ownerId(ownerId)
                .path(ownerId)
                .name(id)
                .description("test record")
                .tags(List.of("test"))
                .text(id)
                .embedding(embedding)
                .enabled(true)
                .metadata(Map.of("server_name", "weather"))
                .indexedAt(Instant.parse("2024-05-01T10:15:30Z"))
                .build();
    }
}
