package com.mcpgateway.registry.storage.index;

import com.mcpgateway.registry.common.exception.IndexBackendException;
import com.mcpgateway.registry.common.exception.IndexBackendTimeoutException;
import com.mcpgateway.registry.common.exception.SearchConfigurationException;
import com.mcpgateway.registry.common.model.EmbeddingRecord;
import com.mcpgateway.registry.common.model.IndexFilter;
import com.mcpgateway.registry.common.model.VectorMatch;
import com.mcpgateway.registry.storage.similarity.VectorSimilarity;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Общая логика хранилищ: проверка размерности и метрики, переключение режимов
 * NATIVE/FALLBACK и точный поиск перебором по снимку записей.
 * <p>
 * Ошибка нативного поиска переводит хранилище в FALLBACK до следующего ensureIndex.
 * Таймаут обслуживается перебором только для текущего запроса, а после
 * maxConsecutiveTimeouts таймаутов подряд хранилище переключается окончательно.
 */
@Slf4j
public abstract class AbstractVectorIndexStore implements VectorIndexStore {

    protected static final Comparator<VectorMatch> RANKING = Comparator
            .comparingDouble(VectorMatch::similarity).reversed()
            .thenComparing(match -> match.record().id());

    protected final VectorIndexSettings settings;
    protected final VectorSimilarity similarity;

    private final AtomicInteger consecutiveTimeouts = new AtomicInteger();
    private volatile SearchMode mode = SearchMode.FALLBACK;
    private volatile boolean ready;

    protected AbstractVectorIndexStore(VectorIndexSettings settings, VectorSimilarity similarity) {
        this.settings = settings;
        this.similarity = similarity;
    }

    /** Открыть хранилище записей */
    protected abstract void openStorage();

    /** Подготовить нативный индекс. false, если бэкенд не поддерживает векторный поиск */
    protected abstract boolean prepareNativeIndex();

    /** Нативный запрос k ближайших */
    protected abstract List<VectorMatch> nativeQuery(float[] vector, int k, IndexFilter filter);

    /** Снимок записей, прошедших фильтр */
    protected abstract List<EmbeddingRecord> scanRecords(IndexFilter filter);

    protected abstract void doUpsert(EmbeddingRecord record);

    protected abstract void doReplaceGroup(String ownerId, List<EmbeddingRecord> records);

    protected abstract int doSetGroupEnabled(String ownerId, boolean enabled);

    protected abstract boolean doRemove(String id);

    protected abstract int doRemoveGroup(String ownerId);

    /** Вызывается после смены режима */
    protected void onModeChanged(SearchMode newMode) {
    }

    @Override
    public final synchronized void ensureIndex(int dimension, String metric) {
        if (metric == null || !"cosine".equals(metric.toLowerCase(Locale.ROOT))) {
            throw new SearchConfigurationException("Unsupported similarity metric: " + metric + ", only cosine is supported");
        }
        if (dimension != settings.dimension()) {
            throw new SearchConfigurationException(String.format(
                "Embedding dimension %d does not match index dimension %d", dimension, settings.dimension()));
        }

        openStorage();
        consecutiveTimeouts.set(0);

        if (settings.modePreference() == VectorIndexSettings.ModePreference.FALLBACK) {
            changeMode(SearchMode.FALLBACK);
            ready = true;
            log.info("Vector index for {} ensured in forced fallback mode, dimension={}", backendName(), dimension);
            return;
        }

        boolean nativeAvailable;
        try {
            nativeAvailable = prepareNativeIndex();
        } catch (IndexBackendException e) {
            log.warn("Native vector index for {} could not be prepared: {}", backendName(), e.getMessage());
            nativeAvailable = false;
        }

        changeMode(nativeAvailable ? SearchMode.NATIVE : SearchMode.FALLBACK);
        ready = true;

        if (nativeAvailable) {
            log.info("Vector index for {} ensured in native mode, dimension={}", backendName(), dimension);
        } else if (settings.modePreference() == VectorIndexSettings.ModePreference.NATIVE) {
            log.error("Native vector search was requested but {} does not provide it, using client-side cosine fallback",
                    backendName());
        } else {
            log.warn("Native vector search is not available on {}, using client-side cosine fallback", backendName());
        }
    }

    @Override
    public void upsert(EmbeddingRecord record) {
        ensureReady();
        checkDimension(record);
        doUpsert(record);
    }

    @Override
    public void replaceGroup(String ownerId, List<EmbeddingRecord> records) {
        ensureReady();
        for (EmbeddingRecord record : records) {
            if (!ownerId.equals(record.ownerId())) {
                throw new IllegalArgumentException(String.format(
                    "Record %s belongs to %s, not to group %s", record.id(), record.ownerId(), ownerId));
            }
            checkDimension(record);
        }
        doReplaceGroup(ownerId, records);
    }

    @Override
    public int setGroupEnabled(String ownerId, boolean enabled) {
        ensureReady();
        return doSetGroupEnabled(ownerId, enabled);
    }

    @Override
    public boolean remove(String id) {
        ensureReady();
        return doRemove(id);
    }

    @Override
    public int removeGroup(String ownerId) {
        ensureReady();
        return doRemoveGroup(ownerId);
    }

    @Override
    public List<VectorMatch> query(float[] vector, int k, IndexFilter filter) {
        ensureReady();
        if (vector.length != settings.dimension()) {
            throw new IllegalArgumentException(String.format(
                "Query vector dimension mismatch. Expected: %d, got: %d", settings.dimension(), vector.length));
        }
        if (k <= 0) {
            return List.of();
        }
        IndexFilter effectiveFilter = filter == null ? IndexFilter.all() : filter;

        // zero query vector has cosine 0 with everything, the approximate index cannot rank it
        if (mode == SearchMode.NATIVE && !similarity.isZero(vector)) {
            try {
                List<VectorMatch> matches = new ArrayList<>(nativeQuery(vector, k, effectiveFilter));
                consecutiveTimeouts.set(0);
                matches.sort(RANKING);
                return matches.size() > k ? List.copyOf(matches.subList(0, k)) : matches;
            } catch (IndexBackendTimeoutException e) {
                int timeouts = consecutiveTimeouts.incrementAndGet();
                if (timeouts >= settings.maxConsecutiveTimeouts()) {
                    switchToFallback(timeouts + " consecutive native query timeouts");
                } else {
                    log.warn("Native vector query on {} timed out ({} of {}), answering with exact scan",
                            backendName(), timeouts, settings.maxConsecutiveTimeouts());
                }
            } catch (IndexBackendException e) {
                switchToFallback(e.getMessage());
            }
        }

        return exactQuery(vector, k, effectiveFilter);
    }

    @Override
    public List<EmbeddingRecord> findByKeywords(List<String> tokens, IndexFilter filter, int limit) {
        ensureReady();
        if (tokens == null || tokens.isEmpty() || limit <= 0) {
            return List.of();
        }
        return rankByKeywords(scanRecords(filter == null ? IndexFilter.all() : filter), tokens, limit);
    }

    /** Отобрать записи с совпадениями, по убыванию числа совпавших токенов, затем по ID */
    protected List<EmbeddingRecord> rankByKeywords(List<EmbeddingRecord> candidates, List<String> tokens, int limit) {
        List<String> lowered = tokens.stream().map(token -> token.toLowerCase(Locale.ROOT)).toList();

        return candidates.stream()
                .map(record -> new KeywordHit(record, matchedTokens(record, lowered)))
                .filter(hit -> hit.matched() > 0)
                .sorted(Comparator.comparingInt(KeywordHit::matched).reversed()
                        .thenComparing(hit -> hit.record().id()))
                .limit(limit)
                .map(KeywordHit::record)
                .toList();
    }

    @Override
    public SearchMode mode() {
        return mode;
    }

    @Override
    public void forceMode(SearchMode newMode) {
        consecutiveTimeouts.set(0);
        changeMode(newMode);
        log.info("Vector store {} forced into {} mode", backendName(), newMode);
    }

    /** Точный поиск перебором по снимку записей */
    protected List<VectorMatch> exactQuery(float[] vector, int k, IndexFilter filter) {
        List<EmbeddingRecord> snapshot = scanRecords(filter);
        return snapshot.stream()
                .filter(record -> record.dimensions() == vector.length)
                .map(record -> new VectorMatch(record, similarity.cosineSimilarity(vector, record.embedding())))
                .sorted(RANKING)
                .limit(k)
                .toList();
    }

    /** Перейти в FALLBACK, сообщив об этом в лог один раз */
    protected synchronized void switchToFallback(String reason) {
        if (mode != SearchMode.FALLBACK) {
            changeMode(SearchMode.FALLBACK);
            log.warn("Vector store {} switched to fallback mode: {}", backendName(), reason);
        }
    }

    protected void ensureReady() {
        if (!ready) {
            ensureIndex(settings.dimension(), settings.similarityMetric());
        }
    }

    private void changeMode(SearchMode newMode) {
        mode = newMode;
        onModeChanged(newMode);
    }

    private void checkDimension(EmbeddingRecord record) {
        if (record.dimensions() != settings.dimension()) {
            throw new SearchConfigurationException(String.format(
                "Record %s has dimension %d, index dimension is %d",
                record.id(), record.dimensions(), settings.dimension()));
        }
    }

    protected static int matchedTokens(EmbeddingRecord record, List<String> loweredTokens) {
        String haystack = String.join(" ",
                nullToEmpty(record.path()),
                nullToEmpty(record.name()),
                nullToEmpty(record.description()),
                String.join(" ", record.tags())).toLowerCase(Locale.ROOT);
        int matched = 0;
        for (String token : loweredTokens) {
            if (haystack.contains(token)) {
                matched++;
            }
        }
        return matched;
    }

    private static String nullToEmpty(String value) {
        return value == null ? "" : value;
    }

    private record KeywordHit(EmbeddingRecord record, int matched) {
    }
}
