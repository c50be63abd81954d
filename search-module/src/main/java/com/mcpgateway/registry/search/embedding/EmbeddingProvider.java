package com.mcpgateway.registry.search.embedding;

import java.util.List;
import java.util.Map;

/**
 * Преобразует тексты в векторы фиксированной размерности.
 * Пустой текст или текст из пробелов даёт нулевой вектор.
 */
public interface EmbeddingProvider {

    /** Векторы в том же порядке, что и тексты */
    List<float[]> embed(List<String> texts);

    /** Вектор одного текста */
    default float[] embed(String text) {
        return embed(List.of(text)).get(0);
    }

    /** Настроенная размерность */
    int dimension();

    /** Фактическая размерность модели, без проверки на совпадение с настройкой */
    int detectDimension();

    /** Провайдер, модель и размерность для метаданных записей */
    Map<String, Object> describe();
}
