package com.mcpgateway.registry.search.config;

import lombok.Builder;

import java.time.Duration;

/**
 * Resolved embedding provider settings.
 */
@Builder(toBuilder = true)
public record EmbeddingSettings(
    Provider provider,
    String modelName,
    String modelDir,
    int dimension,
    String baseUrl,
    String apiKey,
    int batchSize,
    Duration timeout,
    Duration connectTimeout,
    boolean verifyOnStartup,
    boolean requestDimensions
) {
    public enum Provider {
        LOCAL,
        REMOTE
    }

    @Override
    public String toString() {
        // api key stays out of logs
        return "EmbeddingSettings[provider=" + provider + ", modelName=" + modelName + ", dimension=" + dimension
                + ", baseUrl=" + baseUrl + ", batchSize=" + batchSize + ", timeout=" + timeout + "]";
    }
}
