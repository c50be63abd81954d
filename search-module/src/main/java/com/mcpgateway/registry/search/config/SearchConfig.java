package com.mcpgateway.registry.search.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import com.mcpgateway.registry.common.exception.SearchConfigurationException;
import com.mcpgateway.registry.search.embedding.EmbeddingProvider;
import com.mcpgateway.registry.search.embedding.LocalEmbeddingProvider;
import com.mcpgateway.registry.search.embedding.RemoteEmbeddingProvider;
import com.mcpgateway.registry.storage.index.HnswVectorIndexStore;
import com.mcpgateway.registry.storage.index.VectorIndexStore;
import com.mcpgateway.registry.storage.kv.RocksDbEmbeddingStorage;
import com.mcpgateway.registry.storage.mongo.MongoVectorIndexStore;
import com.mcpgateway.registry.storage.similarity.VectorSimilarity;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.web.reactive.function.client.WebClient;

import java.util.concurrent.Executor;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;

/**
 * Сборка компонентов поиска по разрешённым настройкам: бэкенд хранилища
 * и провайдер эмбеддингов выбираются один раз при старте.
 */
@Slf4j
@Configuration
@EnableConfigurationProperties(SearchProperties.class)
public class SearchConfig {

    @Bean
    public SearchSettings searchSettings(SearchProperties properties) {
        SearchSettings settings = properties.toSettings();
        log.info("Search settings resolved: backend={}, mode={}, embedding={}, dimension={}",
                settings.backend(), settings.index().modePreference(), settings.embedding(), settings.index().dimension());
        return settings;
    }

    @Bean
    public EmbeddingProvider embeddingProvider(SearchSettings settings,
                                               @Qualifier("embeddingWebClientBuilder") WebClient.Builder embeddingWebClientBuilder) {
        return switch (settings.embedding().provider()) {
            case LOCAL -> new LocalEmbeddingProvider(settings.embedding());
            case REMOTE -> new RemoteEmbeddingProvider(settings.embedding(), embeddingWebClientBuilder);
        };
    }

    @Bean(destroyMethod = "close")
    public VectorIndexStore vectorIndexStore(SearchSettings settings,
                                             VectorSimilarity similarity,
                                             ObjectProvider<MongoTemplate> mongoTemplate,
                                             ObjectMapper objectMapper) {
        return switch (settings.backend()) {
            case FILE -> new HnswVectorIndexStore(settings.index(), similarity,
                    new RocksDbEmbeddingStorage(settings.index().dataPath()));
            case MONGODB -> {
                MongoTemplate template = mongoTemplate.getIfAvailable();
                if (template == null) {
                    throw new SearchConfigurationException("MongoDB backend selected but no MongoTemplate is configured");
                }
                yield new MongoVectorIndexStore(settings.index(), similarity, template, objectMapper);
            }
        };
    }

    /**
     * Executor для фоновой индексации
     */
    @Bean(name = "indexingExecutor")
    public Executor indexingExecutor(SearchSettings settings) {
        ThreadPoolExecutor executor = new ThreadPoolExecutor(
            settings.executorThreads(),
            settings.executorThreads(),
            60L, TimeUnit.SECONDS,
            new LinkedBlockingQueue<>(settings.queueCapacity()),
            new ThreadFactoryBuilder().setNameFormat("search-indexing-%d").build(),
            new ThreadPoolExecutor.CallerRunsPolicy()
        );

        executor.allowCoreThreadTimeOut(true);

        return executor;
    }
}
