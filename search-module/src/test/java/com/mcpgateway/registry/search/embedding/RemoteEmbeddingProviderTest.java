package com.mcpgateway.registry.search.embedding;

import com.mcpgateway.registry.common.exception.EmbeddingTimeoutException;
import com.mcpgateway.registry.common.exception.EmbeddingUnavailableException;
import com.mcpgateway.registry.common.exception.SearchConfigurationException;
import com.mcpgateway.registry.search.config.EmbeddingSettings;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.codec.HttpMessageWriter;
import org.springframework.http.server.reactive.ServerHttpRequest;
import org.springframework.mock.http.client.reactive.MockClientHttpRequest;
import org.springframework.web.reactive.function.BodyInserter;
import org.springframework.web.reactive.function.client.ClientRequest;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.ExchangeFunction;
import org.springframework.web.reactive.function.client.ExchangeStrategies;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RemoteEmbeddingProviderTest {

    private static final EmbeddingSettings SETTINGS = EmbeddingSettings.builder()
            .provider(EmbeddingSettings.Provider.REMOTE)
            .modelName("text-embedding-3-small")
            .dimension(3)
            .baseUrl("http://embeddings.test/v1")
            .apiKey("test-key")
            .batchSize(16)
            .timeout(Duration.ofMillis(200))
            .build();

    private final List<ClientRequest> requests = new ArrayList<>();

    @Test
    @DisplayName("Векторы возвращаются в порядке индексов ответа")
    void ordersVectorsByResponseIndex() {
        RemoteEmbeddingProvider provider = provider(respond(HttpStatus.OK, """
                {"object": "list", "data": [
                  {"object": "embedding", "index": 1, "embedding": [0.0, 1.0, 0.0]},
                  {"object": "embedding", "index": 0, "embedding": [1.0, 0.0, 0.0]}
                ], "model": "text-embedding-3-small"}
                """));

        List<float[]> vectors = provider.embed(List.of("weather", "files"));

        assertThat(vectors.get(0)).containsExactly(1f, 0f, 0f);
        assertThat(vectors.get(1)).containsExactly(0f, 1f, 0f);
        ClientRequest request = requests.get(0);
        assertThat(request.url().toString()).isEqualTo("http://embeddings.test/v1/embeddings");
        assertThat(request.headers().getFirst(HttpHeaders.AUTHORIZATION)).isEqualTo("Bearer test-key");
    }

    @Test
    @DisplayName("Пустые тексты не отправляются в API")
    void blankTextsAreNotSent() {
        RemoteEmbeddingProvider provider = provider(respond(HttpStatus.OK, """
                {"data": [{"index": 0, "embedding": [0.0, 0.0, 1.0]}]}
                """));

        List<float[]> vectors = provider.embed(List.of("  ", "weather"));

        assertThat(vectors.get(0)).containsExactly(0f, 0f, 0f);
        assertThat(vectors.get(1)).containsExactly(0f, 0f, 1f);
        assertThat(requests).hasSize(1);
        assertThat(provider.embed(List.of(""))).hasSize(1);
        assertThat(requests).hasSize(1);
    }

    @Test
    @DisplayName("Ошибка API превращается в недоступность провайдера")
    void serverErrorMeansUnavailable() {
        RemoteEmbeddingProvider provider = provider(respond(HttpStatus.INTERNAL_SERVER_ERROR, "{\"error\": \"boom\"}"));

        assertThatThrownBy(() -> provider.embed("weather"))
                .isInstanceOf(EmbeddingUnavailableException.class)
                .hasMessageContaining("500");
    }

    @Test
    @DisplayName("Зависший запрос завершается таймаутом")
    void slowResponseTimesOut() {
        RemoteEmbeddingProvider provider = provider(request -> Mono.never());

        assertThatThrownBy(() -> provider.embed("weather"))
                .isInstanceOf(EmbeddingTimeoutException.class);
    }

    @Test
    @DisplayName("Неполный ответ отклоняется")
    void incompleteResponseIsRejected() {
        RemoteEmbeddingProvider provider = provider(respond(HttpStatus.OK, """
                {"data": [{"index": 0, "embedding": [1.0, 0.0, 0.0]}]}
                """));

        assertThatThrownBy(() -> provider.embed(List.of("weather", "files")))
                .isInstanceOf(EmbeddingUnavailableException.class);
    }

    @Test
    @DisplayName("Размерность модели, отличная от настроенной, считается ошибкой конфигурации")
    void dimensionMismatchIsConfigurationError() {
        RemoteEmbeddingProvider provider = provider(respond(HttpStatus.OK, """
                {"data": [{"index": 0, "embedding": [1.0, 0.0]}]}
                """));

        assertThatThrownBy(() -> provider.embed("weather"))
                .isInstanceOf(SearchConfigurationException.class);
        assertThat(provider.detectDimension()).isEqualTo(2);
    }

    @Test
    @DisplayName("Поле dimensions отправляется только при включённой настройке")
    void sendsDimensionsOnlyWhenRequested() {
        String single = """
                {"data": [{"index": 0, "embedding": [1.0, 0.0, 0.0]}]}
                """;
        provider(respond(HttpStatus.OK, single)).embed("weather");
        EmbeddingSettings withDimensions = SETTINGS.toBuilder().requestDimensions(true).build();
        provider(withDimensions, respond(HttpStatus.OK, single)).embed("weather");

        assertThat(bodyOf(requests.get(0)))
                .contains("\"model\":\"text-embedding-3-small\"")
                .contains("\"input\":[\"weather\"]")
                .doesNotContain("dimensions");
        assertThat(bodyOf(requests.get(1))).contains("\"dimensions\":3");
    }

    private RemoteEmbeddingProvider provider(ExchangeFunction exchange) {
        return provider(SETTINGS, exchange);
    }

    private RemoteEmbeddingProvider provider(EmbeddingSettings settings, ExchangeFunction exchange) {
        ExchangeFunction recording = request -> {
            requests.add(request);
            return exchange.exchange(request);
        };
        return new RemoteEmbeddingProvider(settings, WebClient.builder().exchangeFunction(recording));
    }

    private static String bodyOf(ClientRequest request) {
        MockClientHttpRequest httpRequest = new MockClientHttpRequest(HttpMethod.POST, request.url());
        request.body().insert(httpRequest, new BodyInserter.Context() {
            @Override
            public List<HttpMessageWriter<?>> messageWriters() {
                return ExchangeStrategies.withDefaults().messageWriters();
            }

            @Override
            public Optional<ServerHttpRequest> serverRequest() {
                return Optional.empty();
            }

            @Override
            public Map<String, Object> hints() {
                return Map.of();
            }
        }).block();
        return httpRequest.getBodyAsString().block();
    }

    private static ExchangeFunction respond(HttpStatus status, String body) {
        return request -> Mono.just(ClientResponse.create(status)
                .header(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                .body(body)
                .build());
    }
}
