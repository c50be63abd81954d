package com.mcpgateway.registry.search.engine;

import com.mcpgateway.registry.common.exception.EmbeddingUnavailableException;
import com.mcpgateway.registry.common.exception.IndexBackendException;
import com.mcpgateway.registry.common.model.EmbeddingRecord;
import com.mcpgateway.registry.common.model.IndexFilter;
import com.mcpgateway.registry.common.model.SearchRequest;
import com.mcpgateway.registry.common.model.SearchResultSet;
import com.mcpgateway.registry.common.model.VectorMatch;
import com.mcpgateway.registry.search.config.SearchSettings;
import com.mcpgateway.registry.search.embedding.EmbeddingProvider;
import com.mcpgateway.registry.search.indexing.EntityStatusProvider;
import com.mcpgateway.registry.storage.index.VectorIndexStore;
import com.mcpgateway.registry.storage.similarity.VectorSimilarity;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Гибридный поиск: векторное сходство, усиленное долей совпавших ключевых слов.
 * <p>
 * combined = s * (1 + w * f), где s = (cos + 1) / 2, f = доля токенов запроса,
 * найденных в записи, w = keyword-boost-weight. Без эмбеддинга запроса s = 0.5
 * и остаются только записи с f > 0.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class HybridSearchEngine {

    static final String KEYWORD_ONLY_MODE = "keyword_only";
    static final double NEUTRAL_VECTOR_SCORE = 0.5;

    private static final Comparator<ScoredCandidate> RANKING = Comparator
            .comparingDouble(ScoredCandidate::combinedScore).reversed()
            .thenComparing(candidate -> candidate.record().id());

    private final VectorIndexStore store;
    private final EmbeddingProvider embeddingProvider;
    private final QueryTokenizer tokenizer;
    private final KeywordScorer keywordScorer;
    private final EntityStatusProvider statusProvider;
    private final SearchResultFormatter formatter;
    private final VectorSimilarity similarity;
    private final SearchSettings settings;

    public SearchResultSet search(SearchRequest request) {
        String query = tokenizer.normalize(request.query());
        int significantLength = tokenizer.stripPunctuation(query).length();
        if (significantLength < settings.minQueryLength() || query.length() > settings.maxQueryLength()) {
            log.debug("Query of length {} ({} without punctuation) is outside [{}, {}], returning empty result",
                    query.length(), significantLength, settings.minQueryLength(), settings.maxQueryLength());
            return SearchResultSet.empty(query, store.mode().wireName());
        }

        int maxResults = clampMaxResults(request.maxResults());
        IndexFilter filter = IndexFilter.of(request.entityTypes());
        List<String> tokens = tokenizer.tokenize(query);
        // truncation is per type, so every requested type gets its own share of the pool
        int poolSize = maxResults * settings.candidateMultiplier() * filter.types().size();

        float[] queryVector = null;
        boolean degraded = false;
        try {
            queryVector = embeddingProvider.embed(query);
        } catch (EmbeddingUnavailableException e) {
            degraded = true;
            log.warn("Embedding provider unavailable, falling back to keyword-only search: {}", e.getMessage());
        }

        Map<String, EmbeddingRecord> pool = new LinkedHashMap<>();
        Map<String, Double> cosineById = new HashMap<>();

        if (queryVector != null) {
            try {
                for (VectorMatch match : store.query(queryVector, poolSize, filter)) {
                    pool.put(match.record().id(), match.record());
                    cosineById.put(match.record().id(), match.similarity());
                }
            } catch (IndexBackendException e) {
                degraded = true;
                queryVector = null;
                cosineById.clear();
                pool.clear();
                log.warn("Vector query failed, falling back to keyword-only search: {}", e.getMessage());
            }
        }

        try {
            for (EmbeddingRecord record : store.findByKeywords(tokens, filter, poolSize)) {
                if (pool.putIfAbsent(record.id(), record) == null && queryVector != null) {
                    cosineById.put(record.id(), cosineOf(queryVector, record));
                }
            }
        } catch (IndexBackendException e) {
            log.warn("Keyword lookup failed, ranking vector candidates only: {}", e.getMessage());
        }

        double weight = settings.keywordBoostWeight();
        List<ScoredCandidate> ranked = new ArrayList<>(pool.size());
        for (EmbeddingRecord record : pool.values()) {
            if (!isEnabled(record)) {
                continue;
            }
            double fraction = keywordScorer.fraction(record, tokens);
            double vectorScore;
            if (queryVector == null) {
                if (fraction == 0.0) {
                    continue;
                }
                vectorScore = NEUTRAL_VECTOR_SCORE;
            } else {
                vectorScore = (cosineById.getOrDefault(record.id(), 0.0) + 1.0) / 2.0;
            }
            double combined = clamp(vectorScore * (1.0 + weight * fraction), 0.0, settings.maxCombinedScore());
            ranked.add(new ScoredCandidate(record, vectorScore, fraction, combined));
        }
        ranked.sort(RANKING);

        String searchMode = queryVector == null ? KEYWORD_ONLY_MODE : store.mode().wireName();
        log.debug("Query '{}' ranked {} candidates (tokens={}, mode={}, degraded={})",
                query, ranked.size(), tokens, searchMode, degraded);
        return formatter.format(query, ranked, maxResults, degraded, searchMode);
    }

    private int clampMaxResults(Integer requested) {
        int value = requested == null ? settings.defaultMaxResults() : requested;
        return Math.max(1, Math.min(settings.maxResultsLimit(), value));
    }

    /** Актуальное состояние из реестра, иначе флаг записи. Инструменты следуют за своим сервером */
    private boolean isEnabled(EmbeddingRecord record) {
        return statusProvider.enabledState(record.ownerId()).orElse(record.enabled());
    }

    private double cosineOf(float[] queryVector, EmbeddingRecord record) {
        if (record.dimensions() != queryVector.length) {
            return 0.0;
        }
        return similarity.cosineSimilarity(queryVector, record.embedding());
    }

    private static double clamp(double value, double min, double max) {
        return Math.max(min, Math.min(max, value));
    }
}
