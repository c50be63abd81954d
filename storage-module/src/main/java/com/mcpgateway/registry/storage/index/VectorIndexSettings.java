package com.mcpgateway.registry.storage.index;

import lombok.Builder;

import java.time.Duration;

/**
 * Неизменяемые настройки векторного индекса, вычисленные один раз при старте
 */
@Builder
public record VectorIndexSettings(
    int dimension,
    String similarityMetric,
    ModePreference modePreference,
    String dataPath,
    int m,
    int efConstruction,
    int efSearch,
    int initialCapacity,
    String collectionName,
    String indexName,
    int numCandidatesMultiplier,
    Duration queryTimeout,
    int maxConsecutiveTimeouts
) {
    /** Запрошенный в конфигурации режим */
    public enum ModePreference {
        AUTO,
        NATIVE,
        FALLBACK
    }

    public VectorIndexSettings {
        if (dimension <= 0) {
            throw new IllegalArgumentException("Index dimension must be positive: " + dimension);
        }
        similarityMetric = similarityMetric == null ? "cosine" : similarityMetric;
        modePreference = modePreference == null ? ModePreference.AUTO : modePreference;
        initialCapacity = Math.max(16, initialCapacity);
        numCandidatesMultiplier = Math.max(1, numCandidatesMultiplier);
        queryTimeout = queryTimeout == null ? Duration.ofSeconds(5) : queryTimeout;
        maxConsecutiveTimeouts = Math.max(1, maxConsecutiveTimeouts);
    }
}
