package com.mcpgateway.registry.search.config;

import com.mcpgateway.registry.common.exception.SearchConfigurationException;
import com.mcpgateway.registry.storage.index.VectorIndexSettings;
import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.Locale;

/**
 * Configuration properties of the registry search engine.
 * Resolved once into {@link SearchSettings} at startup.
 */
@Data
@Validated
@ConfigurationProperties(prefix = "registry.search")
public class SearchProperties {

    /**
     * Storage backend: file or mongodb.
     */
    @NotBlank
    private String backend = "file";

    /**
     * Vector search mode: auto, native or fallback.
     */
    @NotBlank
    private String mode = "auto";

    @Min(1)
    private int minQueryLength = 2;

    @Min(1)
    private int maxQueryLength = 512;

    @Min(1)
    private int defaultMaxResults = 10;

    @Min(1)
    private int maxResultsLimit = 50;

    /**
     * Candidate pool size is max results multiplied by this value.
     */
    @Min(1)
    private int candidateMultiplier = 5;

    @DecimalMin("0.0")
    private double keywordBoostWeight = 0.5;

    @Valid
    @NotNull
    private Embedding embedding = new Embedding();

    @Valid
    @NotNull
    private Index index = new Index();

    @Valid
    @NotNull
    private Indexing indexing = new Indexing();

    /** Имя коллекции с учётом размерности */
    public String resolveCollectionName() {
        return index.getCollection() + "_" + embedding.getDimension();
    }

    /** Собрать неизменяемые настройки, проверив согласованность значений */
    public SearchSettings toSettings() {
        SearchSettings.Backend resolvedBackend = parse(SearchSettings.Backend.class, backend, "backend");
        VectorIndexSettings.ModePreference resolvedMode = parse(VectorIndexSettings.ModePreference.class, mode, "mode");
        EmbeddingSettings.Provider provider = parse(EmbeddingSettings.Provider.class, embedding.getProvider(), "embedding.provider");

        if (!"cosine".equalsIgnoreCase(index.getSimilarityMetric())) {
            throw new SearchConfigurationException("Unsupported similarity metric: " + index.getSimilarityMetric());
        }
        if (minQueryLength > maxQueryLength) {
            throw new SearchConfigurationException("min-query-length must not exceed max-query-length");
        }
        if (defaultMaxResults > maxResultsLimit) {
            throw new SearchConfigurationException("default-max-results must not exceed max-results-limit");
        }
        if (provider == EmbeddingSettings.Provider.REMOTE) {
            requireText(embedding.getBaseUrl(), "embedding.base-url");
            requireText(embedding.getModelName(), "embedding.model-name");
            requireText(embedding.getApiKey(), "embedding.api-key");
        }

        EmbeddingSettings embeddingSettings = EmbeddingSettings.builder()
                .provider(provider)
                .modelName(embedding.getModelName())
                .modelDir(blankToNull(embedding.getModelDir()))
                .dimension(embedding.getDimension())
                .baseUrl(blankToNull(embedding.getBaseUrl()))
                .apiKey(blankToNull(embedding.getApiKey()))
                .batchSize(embedding.getBatchSize())
                .timeout(embedding.getTimeout())
                .connectTimeout(embedding.getConnectTimeout())
                .verifyOnStartup(embedding.isVerifyOnStartup())
                .requestDimensions(embedding.isRequestDimensions())
                .build();

        VectorIndexSettings indexSettings = VectorIndexSettings.builder()
                .dimension(embedding.getDimension())
                .similarityMetric(index.getSimilarityMetric().toLowerCase(Locale.ROOT))
                .modePreference(resolvedMode)
                .dataPath(index.getDataPath())
                .m(index.getM())
                .efConstruction(index.getEfConstruction())
                .efSearch(index.getEfSearch())
                .initialCapacity(index.getInitialCapacity())
                .collectionName(resolveCollectionName())
                .indexName(index.getIndexName())
                .numCandidatesMultiplier(index.getNumCandidatesMultiplier())
                .queryTimeout(index.getQueryTimeout())
                .maxConsecutiveTimeouts(index.getMaxConsecutiveTimeouts())
                .build();

        return SearchSettings.builder()
                .backend(resolvedBackend)
                .minQueryLength(minQueryLength)
                .maxQueryLength(maxQueryLength)
                .defaultMaxResults(defaultMaxResults)
                .maxResultsLimit(maxResultsLimit)
                .candidateMultiplier(candidateMultiplier)
                .keywordBoostWeight(keywordBoostWeight)
                .embedding(embeddingSettings)
                .index(indexSettings)
                .retryInterval(indexing.getRetryInterval())
                .maxRetryAttempts(indexing.getMaxRetryAttempts())
                .executorThreads(indexing.getExecutorThreads())
                .queueCapacity(indexing.getQueueCapacity())
                .build();
    }

    private static <E extends Enum<E>> E parse(Class<E> type, String value, String key) {
        try {
            return Enum.valueOf(type, value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException | NullPointerException e) {
            throw new SearchConfigurationException("Invalid value for registry.search." + key + ": " + value, e);
        }
    }

    private static void requireText(String value, String key) {
        if (value == null || value.isBlank()) {
            throw new SearchConfigurationException("registry.search." + key + " is required for the remote embedding provider");
        }
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value;
    }

    @Data
    public static class Embedding {
        /**
         * local (in-process ONNX model) or remote (OpenAI-compatible API).
         */
        @NotBlank
        private String provider = "local";

        private String modelName = "all-MiniLM-L6-v2";

        /**
         * Directory with model.onnx and tokenizer.json. The bundled model is used when empty.
         */
        private String modelDir;

        @Min(1)
        private int dimension = 384;

        private String baseUrl;

        private String apiKey;

        @Min(1)
        private int batchSize = 64;

        @NotNull
        private Duration timeout = Duration.ofSeconds(10);

        @NotNull
        private Duration connectTimeout = Duration.ofSeconds(5);

        private boolean verifyOnStartup = true;

        /**
         * Send the dimensions field to the remote API. Only models with adjustable output size accept it.
         */
        private boolean requestDimensions = false;
    }

    @Data
    public static class Index {
        @NotBlank
        private String similarityMetric = "cosine";

        @NotBlank
        private String dataPath = "./data/search-index";

        @Min(2)
        private int m = 16;

        @Min(1)
        private int efConstruction = 200;

        @Min(1)
        private int efSearch = 100;

        @Min(16)
        private int initialCapacity = 1024;

        @NotBlank
        private String collection = "mcp_embeddings";

        @NotBlank
        private String indexName = "embedding_vector_idx";

        @Min(1)
        private int numCandidatesMultiplier = 10;

        @NotNull
        private Duration queryTimeout = Duration.ofSeconds(5);

        @Min(1)
        private int maxConsecutiveTimeouts = 3;
    }

    @Data
    public static class Indexing {
        @NotNull
        private Duration retryInterval = Duration.ofSeconds(30);

        @Min(0)
        private int maxRetryAttempts = 5;

        @Min(1)
        private int executorThreads = 2;

        @Min(1)
        private int queueCapacity = 100;
    }
}
