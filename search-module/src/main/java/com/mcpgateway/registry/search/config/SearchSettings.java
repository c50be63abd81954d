package com.mcpgateway.registry.search.config;

import com.mcpgateway.registry.storage.index.VectorIndexSettings;
import lombok.Builder;

import java.time.Duration;

/**
 * Immutable search engine settings, built once from {@link SearchProperties}
 * and injected into every component.
 */
@Builder
public record SearchSettings(
    Backend backend,
    int minQueryLength,
    int maxQueryLength,
    int defaultMaxResults,
    int maxResultsLimit,
    int candidateMultiplier,
    double keywordBoostWeight,
    EmbeddingSettings embedding,
    VectorIndexSettings index,
    Duration retryInterval,
    int maxRetryAttempts,
    int executorThreads,
    int queueCapacity
) {
    public enum Backend {
        FILE,
        MONGODB
    }

    /** Максимальное значение комбинированной оценки */
    public double maxCombinedScore() {
        return 1.0 + keywordBoostWeight;
    }
}
