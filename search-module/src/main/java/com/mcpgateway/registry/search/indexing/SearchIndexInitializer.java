package com.mcpgateway.registry.search.indexing;

import com.mcpgateway.registry.common.exception.EmbeddingUnavailableException;
import com.mcpgateway.registry.common.exception.IndexBackendException;
import com.mcpgateway.registry.common.exception.SearchConfigurationException;
import com.mcpgateway.registry.search.config.SearchSettings;
import com.mcpgateway.registry.search.embedding.EmbeddingProvider;
import com.mcpgateway.registry.storage.index.VectorIndexStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

/**
 * Проверка размерности провайдера и подготовка индекса при старте.
 * Несовпадение размерности прерывает запуск, недоступность провайдера или
 * хранилища только логируется: индекс будет подготовлен при первом обращении.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class SearchIndexInitializer implements ApplicationRunner {

    private final EmbeddingProvider embeddingProvider;
    private final VectorIndexStore store;
    private final SearchSettings settings;

    @Override
    public void run(ApplicationArguments args) {
        int dimension = settings.index().dimension();

        if (settings.embedding().verifyOnStartup()) {
            verifyDimension(dimension);
        }

        try {
            store.ensureIndex(dimension, settings.index().similarityMetric());
            log.info("Search index ready: backend={}, mode={}, records={}",
                    store.backendName(), store.mode(), store.size());
        } catch (IndexBackendException e) {
            log.warn("Vector store {} is not reachable at startup, index will be prepared on first use: {}",
                    store.backendName(), e.getMessage());
        }
    }

    private void verifyDimension(int dimension) {
        try {
            int actual = embeddingProvider.detectDimension();
            if (actual != dimension) {
                throw new SearchConfigurationException(String.format(
                    "Embedding model produces %d dimensions but registry.search.embedding.dimension is %d",
                    actual, dimension));
            }
            log.info("Embedding provider verified: {}", embeddingProvider.describe());
        } catch (EmbeddingUnavailableException e) {
            log.warn("Embedding provider is not reachable at startup, dimension not verified: {}", e.getMessage());
        }
    }
}
