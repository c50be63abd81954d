package com.mcpgateway.registry.search.embedding;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.mcpgateway.registry.common.exception.EmbeddingTimeoutException;
import com.mcpgateway.registry.common.exception.EmbeddingUnavailableException;
import com.mcpgateway.registry.common.exception.RegistrySearchException;
import com.mcpgateway.registry.search.config.EmbeddingSettings;
import io.netty.handler.timeout.ReadTimeoutException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;

import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeoutException;

/**
 * Клиент OpenAI-совместимого API эмбеддингов (LiteLLM, OpenAI, Bedrock через прокси).
 * POST {base-url}/embeddings с телом {model, input, dimensions?}.
 */
@Slf4j
public class RemoteEmbeddingProvider extends AbstractEmbeddingProvider {

    private final EmbeddingSettings settings;
    private final WebClient webClient;

    public RemoteEmbeddingProvider(EmbeddingSettings settings, WebClient.Builder webClientBuilder) {
        super(settings.dimension(), settings.batchSize());
        this.settings = settings;
        this.webClient = webClientBuilder.clone()
                .baseUrl(settings.baseUrl())
                .defaultHeaders(headers -> headers.setBearerAuth(settings.apiKey()))
                .build();
        log.info("Initialized remote embedding provider: model={}, baseUrl={}", settings.modelName(), settings.baseUrl());
    }

    @Override
    protected List<float[]> embedBatch(List<String> texts) {
        Map<String, Object> request = new LinkedHashMap<>();
        request.put("model", settings.modelName());
        request.put("input", texts);
        if (settings.requestDimensions()) {
            request.put("dimensions", dimension);
        }

        EmbeddingsResponse response = webClient.post()
                .uri("/embeddings")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(request)
                .retrieve()
                .bodyToMono(EmbeddingsResponse.class)
                .timeout(settings.timeout())
                .onErrorMap(this::translate)
                .block();

        if (response == null || response.data() == null || response.data().size() != texts.size()) {
            log.error("Malformed embeddings response for {} texts from {}", texts.size(), settings.baseUrl());
            throw new EmbeddingUnavailableException("Malformed response from embeddings API at " + settings.baseUrl());
        }

        return response.data().stream()
                .sorted(Comparator.comparingInt(EmbeddingData::index))
                .map(EmbeddingData::embedding)
                .toList();
    }

    @Override
    public Map<String, Object> describe() {
        return Map.of(
            "provider", "remote",
            "model", settings.modelName(),
            "dimension", dimension);
    }

    private Throwable translate(Throwable error) {
        if (error instanceof RegistrySearchException) {
            return error;
        }
        if (error instanceof TimeoutException
                || (error instanceof WebClientRequestException && error.getCause() instanceof ReadTimeoutException)) {
            log.warn("Embeddings API at {} timed out after {}", settings.baseUrl(), settings.timeout());
            return new EmbeddingTimeoutException("Embeddings API timed out after " + settings.timeout(), error);
        }
        if (error instanceof WebClientRequestException) {
            log.error("Failed to connect to embeddings API at {}: {}", settings.baseUrl(), error.getMessage());
            return new EmbeddingUnavailableException("Embeddings API is not reachable at " + settings.baseUrl(), error);
        }
        if (error instanceof WebClientResponseException responseException) {
            log.error("Embeddings API returned error: status={}, body={}",
                    responseException.getStatusCode(), responseException.getResponseBodyAsString());
            return new EmbeddingUnavailableException(
                    "Embeddings API returned " + responseException.getStatusCode().value(), error);
        }
        log.error("Failed to generate embeddings: {}", error.getMessage());
        return new EmbeddingUnavailableException("Failed to generate embeddings: " + error.getMessage(), error);
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record EmbeddingsResponse(List<EmbeddingData> data) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record EmbeddingData(int index, float[] embedding) {
    }
}
