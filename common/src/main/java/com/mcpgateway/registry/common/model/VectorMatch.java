package com.mcpgateway.registry.common.model;

/**
 * Результат векторного поиска: запись и косинусное сходство с запросом в диапазоне [-1, 1]
 */
public record VectorMatch(EmbeddingRecord record, double similarity) {
}
