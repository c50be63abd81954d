package com.mcpgateway.registry.search.engine;

import com.mcpgateway.registry.common.model.EmbeddingRecord;

/**
 * Кандидат после гибридного ранжирования.
 *
 * @param vectorScore     нормализованное сходство (cos + 1) / 2, 0.5 без эмбеддинга запроса
 * @param keywordFraction доля совпавших токенов запроса
 * @param combinedScore   vectorScore * (1 + w * keywordFraction)
 */
public record ScoredCandidate(
    EmbeddingRecord record,
    double vectorScore,
    double keywordFraction,
    double combinedScore
) {
}
