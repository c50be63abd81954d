package com.mcpgateway.registry.search.embedding;

import com.mcpgateway.registry.common.exception.EmbeddingUnavailableException;
import com.mcpgateway.registry.common.exception.SearchConfigurationException;
import com.mcpgateway.registry.search.config.EmbeddingSettings;
import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.data.segment.TextSegment;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.model.output.Response;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class LocalEmbeddingProviderTest {

    @Mock
    private EmbeddingModel model;

    @TempDir
    Path tempDir;

    @Test
    @DisplayName("Пустые тексты дают нулевой вектор без обращения к модели")
    void blankTextsProduceZeroVectors() {
        LocalEmbeddingProvider provider = new LocalEmbeddingProvider(settings(3, 16, null), model);

        List<float[]> vectors = provider.embed(List.of("", "   "));

        assertThat(vectors).hasSize(2);
        assertThat(vectors.get(0)).containsExactly(0f, 0f, 0f);
        verifyNoInteractions(model);
    }

    @Test
    @DisplayName("Тексты отправляются в модель пачками заданного размера")
    void embedsInBatches() {
        when(model.embedAll(anyList())).thenAnswer(invocation -> {
            List<TextSegment> segments = invocation.getArgument(0);
            return Response.from(segments.stream()
                    .map(segment -> Embedding.from(new float[]{segment.text().length(), 0f, 1f}))
                    .toList());
        });
        LocalEmbeddingProvider provider = new LocalEmbeddingProvider(settings(3, 2, null), model);

        List<float[]> vectors = provider.embed(List.of("a", "", "bbb", "cc"));

        @SuppressWarnings("unchecked")
        ArgumentCaptor<List<TextSegment>> captor = ArgumentCaptor.forClass(List.class);
        verify(model, times(2)).embedAll(captor.capture());
        assertThat(captor.getAllValues()).extracting(List::size).containsExactly(2, 1);
        assertThat(vectors).extracting(vector -> vector[0]).containsExactly(1f, 0f, 3f, 2f);
    }

    @Test
    @DisplayName("Модель с другой размерностью отклоняется")
    void dimensionMismatchIsRejected() {
        when(model.embedAll(anyList())).thenReturn(Response.from(List.of(Embedding.from(new float[]{1f, 0f}))));
        LocalEmbeddingProvider provider = new LocalEmbeddingProvider(settings(3, 16, null), model);

        assertThatThrownBy(() -> provider.embed("weather"))
                .isInstanceOf(SearchConfigurationException.class)
                .hasMessageContaining("2 dimensions");
    }

    @Test
    @DisplayName("Сбой модели превращается в недоступность провайдера")
    void modelFailureMeansUnavailable() {
        when(model.embedAll(anyList())).thenThrow(new IllegalStateException("onnx session closed"));
        LocalEmbeddingProvider provider = new LocalEmbeddingProvider(settings(3, 16, null), model);

        assertThatThrownBy(() -> provider.embed("weather"))
                .isInstanceOf(EmbeddingUnavailableException.class)
                .hasMessageContaining("onnx session closed");
    }

    @Test
    @DisplayName("Каталог без файлов модели даёт понятную ошибку")
    void missingModelFilesAreReported() {
        LocalEmbeddingProvider provider = new LocalEmbeddingProvider(settings(384, 16, tempDir.toString()));

        assertThatThrownBy(() -> provider.embed("weather"))
                .isInstanceOf(EmbeddingUnavailableException.class)
                .hasMessageContaining("model.onnx");
    }

    @Test
    void describesModel() {
        LocalEmbeddingProvider provider = new LocalEmbeddingProvider(settings(384, 16, null), model);

        assertThat(provider.describe())
                .containsEntry("provider", "local")
                .containsEntry("model", "all-MiniLM-L6-v2")
                .containsEntry("dimension", 384);
        assertThat(provider.dimension()).isEqualTo(384);
    }

    private static EmbeddingSettings settings(int dimension, int batchSize, String modelDir) {
        return EmbeddingSettings.builder()
                .provider(EmbeddingSettings.Provider.LOCAL)
                .modelName("all-MiniLM-L6-v2")
                .modelDir(modelDir)
                .dimension(dimension)
                .batchSize(batchSize)
                .build();
    }
}
