package com.mcpgateway.registry.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotNull;
import lombok.Builder;

import java.util.List;

/**
 * Поисковый запрос. Длина текста и число результатов проверяются движком:
 * слишком короткий или длинный текст даёт пустой ответ, max_results ограничивается сверху.
 */
@Builder
public record SearchRequest(
    @NotNull
    @JsonProperty("query")
    String query,

    @JsonProperty("entity_types")
    List<EntityType> entityTypes,

    @JsonProperty("max_results")
    Integer maxResults
) {
    public SearchRequest {
        entityTypes = entityTypes == null ? List.of() : List.copyOf(entityTypes);
    }

    public static SearchRequest of(String query) {
        return new SearchRequest(query, null, null);
    }
}
