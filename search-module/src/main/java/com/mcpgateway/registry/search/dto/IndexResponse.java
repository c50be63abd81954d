package com.mcpgateway.registry.search.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Результат операции индексации
 */
public record IndexResponse(
    @JsonProperty("path")
    String path,

    @JsonProperty("status")
    String status,

    @JsonProperty("records")
    int records
) {
    public static IndexResponse indexed(String path, int records) {
        return new IndexResponse(path, "indexed", records);
    }

    public static IndexResponse queued(String path) {
        return new IndexResponse(path, "queued", 0);
    }

    public static IndexResponse removed(String path, int records) {
        return new IndexResponse(path, "removed", records);
    }
}
