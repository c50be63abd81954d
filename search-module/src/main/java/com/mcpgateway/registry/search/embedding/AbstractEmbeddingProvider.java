package com.mcpgateway.registry.search.embedding;

import com.mcpgateway.registry.common.exception.EmbeddingUnavailableException;
import com.mcpgateway.registry.common.exception.SearchConfigurationException;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;

/**
 * Общая часть провайдеров: нулевые векторы для пустых текстов, разбиение на пачки
 * и проверка размерности ответа модели.
 */
@Slf4j
public abstract class AbstractEmbeddingProvider implements EmbeddingProvider {

    private static final String SAMPLE_TEXT = "dimension check";

    protected final int dimension;
    private final int batchSize;

    protected AbstractEmbeddingProvider(int dimension, int batchSize) {
        this.dimension = dimension;
        this.batchSize = Math.max(1, batchSize);
    }

    /** Векторы для непустых текстов, по одному на текст */
    protected abstract List<float[]> embedBatch(List<String> texts);

    @Override
    public List<float[]> embed(List<String> texts) {
        if (texts.isEmpty()) {
            return List.of();
        }

        List<float[]> vectors = new ArrayList<>(texts.size());
        List<Integer> positions = new ArrayList<>();
        List<String> pending = new ArrayList<>();
        for (int i = 0; i < texts.size(); i++) {
            String text = texts.get(i);
            vectors.add(null);
            if (text == null || text.isBlank()) {
                vectors.set(i, new float[dimension]);
            } else {
                positions.add(i);
                pending.add(text);
            }
        }

        for (int from = 0; from < pending.size(); from += batchSize) {
            int to = Math.min(pending.size(), from + batchSize);
            List<float[]> batch = embedBatch(pending.subList(from, to));
            if (batch == null || batch.size() != to - from) {
                throw new EmbeddingUnavailableException(String.format(
                    "Embedding model returned %d vectors for %d texts", batch == null ? 0 : batch.size(), to - from));
            }
            for (int i = 0; i < batch.size(); i++) {
                float[] vector = batch.get(i);
                if (vector == null) {
                    throw new EmbeddingUnavailableException("Embedding model returned an empty vector");
                }
                if (vector.length != dimension) {
                    throw new SearchConfigurationException(String.format(
                        "Embedding model returned %d dimensions, configured dimension is %d", vector.length, dimension));
                }
                vectors.set(positions.get(from + i), vector);
            }
        }

        log.debug("Embedded {} texts ({} blank)", texts.size(), texts.size() - pending.size());
        return vectors;
    }

    @Override
    public int dimension() {
        return dimension;
    }

    @Override
    public int detectDimension() {
        List<float[]> sample = embedBatch(List.of(SAMPLE_TEXT));
        if (sample == null || sample.isEmpty() || sample.get(0) == null) {
            throw new EmbeddingUnavailableException("Embedding model returned no vector for the dimension check");
        }
        return sample.get(0).length;
    }
}
