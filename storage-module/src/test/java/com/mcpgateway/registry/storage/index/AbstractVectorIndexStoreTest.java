package com.mcpgateway.registry.storage.index;

import com.mcpgateway.registry.common.exception.IndexBackendException;
import com.mcpgateway.registry.common.exception.IndexBackendTimeoutException;
import com.mcpgateway.registry.common.model.EmbeddingRecord;
import com.mcpgateway.registry.common.model.EntityType;
import com.mcpgateway.registry.common.model.IndexFilter;
import com.mcpgateway.registry.common.model.VectorMatch;
import com.mcpgateway.registry.storage.similarity.VectorSimilarity;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Переключение режимов NATIVE/FALLBACK на заглушке бэкенда
 */
class AbstractVectorIndexStoreTest {

    private StubStore store;

    @BeforeEach
    void setUp() {
        store = new StubStore(settings(VectorIndexSettings.ModePreference.AUTO));
        store.ensureIndex(2, "cosine");
        store.upsert(record("/a", 1f, 0f));
        store.upsert(record("/b", 0f, 1f));
    }

    @Test
    @DisplayName("Ошибка нативного поиска переключает хранилище в FALLBACK навсегда")
    void backendErrorSwitchesToFallback() {
        store.nativeFailure = new IndexBackendException("vector search unsupported");

        List<VectorMatch> matches = store.query(new float[]{1f, 0f}, 1, IndexFilter.all());

        assertThat(matches).extracting(match -> match.record().id()).containsExactly("/a");
        assertThat(store.mode()).isEqualTo(SearchMode.FALLBACK);

        store.nativeFailure = null;
        store.query(new float[]{1f, 0f}, 1, IndexFilter.all());
        assertThat(store.nativeCalls).isEqualTo(1);
    }

    @Test
    @DisplayName("Единичный таймаут обслуживается перебором без смены режима")
    void singleTimeoutKeepsNativeMode() {
        store.nativeFailure = new IndexBackendTimeoutException("timed out", null);

        List<VectorMatch> matches = store.query(new float[]{0f, 1f}, 1, IndexFilter.all());

        assertThat(matches).extracting(match -> match.record().id()).containsExactly("/b");
        assertThat(store.mode()).isEqualTo(SearchMode.NATIVE);
    }

    @Test
    @DisplayName("Серия таймаутов подряд переключает режим, успешный запрос сбрасывает счётчик")
    void consecutiveTimeoutsSwitchToFallback() {
        store.nativeFailure = new IndexBackendTimeoutException("timed out", null);
        store.query(new float[]{1f, 0f}, 1, IndexFilter.all());
        store.query(new float[]{1f, 0f}, 1, IndexFilter.all());

        store.nativeFailure = null;
        store.query(new float[]{1f, 0f}, 1, IndexFilter.all());
        assertThat(store.mode()).isEqualTo(SearchMode.NATIVE);

        store.nativeFailure = new IndexBackendTimeoutException("timed out", null);
        store.query(new float[]{1f, 0f}, 1, IndexFilter.all());
        store.query(new float[]{1f, 0f}, 1, IndexFilter.all());
        store.query(new float[]{1f, 0f}, 1, IndexFilter.all());

        assertThat(store.mode()).isEqualTo(SearchMode.FALLBACK);
    }

    @Test
    @DisplayName("Повторный ensureIndex возвращает нативный режим")
    void ensureIndexRestoresNativeMode() {
        store.nativeFailure = new IndexBackendException("connection reset");
        store.query(new float[]{1f, 0f}, 1, IndexFilter.all());
        assertThat(store.mode()).isEqualTo(SearchMode.FALLBACK);

        store.nativeFailure = null;
        store.ensureIndex(2, "cosine");

        assertThat(store.mode()).isEqualTo(SearchMode.NATIVE);
    }

    @Test
    @DisplayName("Нулевой вектор запроса всегда ищется перебором")
    void zeroQueryVectorUsesExactScan() {
        List<VectorMatch> matches = store.query(new float[]{0f, 0f}, 5, IndexFilter.all());

        assertThat(store.nativeCalls).isZero();
        assertThat(matches).extracting(match -> match.record().id()).containsExactly("/a", "/b");
        assertThat(matches).extracting(VectorMatch::similarity).containsOnly(0.0);
    }

    @Test
    @DisplayName("Без нативной поддержки хранилище сразу работает в FALLBACK")
    void missingNativeSupportStartsInFallback() {
        StubStore plain = new StubStore(settings(VectorIndexSettings.ModePreference.AUTO));
        plain.nativeSupported = false;

        plain.ensureIndex(2, "COSINE");

        assertThat(plain.mode()).isEqualTo(SearchMode.FALLBACK);
    }

    @Test
    @DisplayName("Хранилище инициализируется лениво при первом обращении")
    void firstAccessEnsuresIndex() {
        StubStore lazy = new StubStore(settings(VectorIndexSettings.ModePreference.NATIVE));

        lazy.upsert(record("/a", 1f, 0f));

        assertThat(lazy.opened).isTrue();
        assertThat(lazy.mode()).isEqualTo(SearchMode.NATIVE);
    }

    @Test
    @DisplayName("Запись чужого владельца в группе отклоняется")
    void replaceGroupRejectsForeignRecords() {
        assertThatThrownBy(() -> store.replaceGroup("/a", List.of(record("/b", 0f, 1f))))
                .isInstanceOf(IllegalArgumentException.class);
        assertThat(store.get("/b")).isPresent();
    }

    @Test
    @DisplayName("Равные сходства упорядочиваются по ID")
    void tiesAreOrderedById() {
        store.upsert(record("/c", 1f, 0f));
        store.forceMode(SearchMode.FALLBACK);

        List<VectorMatch> matches = store.query(new float[]{1f, 0f}, 2, IndexFilter.all());

        assertThat(matches).extracting(match -> match.record().id()).containsExactly("/a", "/c");
    }

    private static VectorIndexSettings settings(VectorIndexSettings.ModePreference preference) {
        return VectorIndexSettings.builder()
                .dimension(2)
                .modePreference(preference)
                .maxConsecutiveTimeouts(3)
                .build();
    }

    private static EmbeddingRecord record(String id, float... embedding) {
        return EmbeddingRecord.builder()
                .id(id)
                .entityType(EntityType.MCP_SERVER)
                .name(id)
                .embedding(embedding)
                .enabled(true)
                .build();
    }

    /** Бэкенд в памяти с управляемым нативным поиском */
    private static class StubStore extends AbstractVectorIndexStore {

        private final Map<String, EmbeddingRecord> records = new LinkedHashMap<>();
        private boolean nativeSupported = true;
        private RuntimeException nativeFailure;
        private int nativeCalls;
        private boolean opened;

        StubStore(VectorIndexSettings settings) {
            super(settings, new VectorSimilarity());
        }

        @Override
        protected void openStorage() {
            opened = true;
        }

        @Override
        protected boolean prepareNativeIndex() {
            return nativeSupported;
        }

        @Override
        protected List<VectorMatch> nativeQuery(float[] vector, int k, IndexFilter filter) {
            nativeCalls++;
            if (nativeFailure != null) {
                throw nativeFailure;
            }
            return exactQuery(vector, k, filter);
        }

        @Override
        protected List<EmbeddingRecord> scanRecords(IndexFilter filter) {
            return new ArrayList<>(records.values().stream().filter(filter::accepts).toList());
        }

        @Override
        protected void doUpsert(EmbeddingRecord record) {
            records.put(record.id(), record);
        }

        @Override
        protected void doReplaceGroup(String ownerId, List<EmbeddingRecord> group) {
            records.values().removeIf(record -> record.ownerId().equals(ownerId));
            group.forEach(record -> records.put(record.id(), record));
        }

        @Override
        protected int doSetGroupEnabled(String ownerId, boolean enabled) {
            List<EmbeddingRecord> owned = findByOwner(ownerId);
            owned.forEach(record -> records.put(record.id(), record.withEnabled(enabled)));
            return owned.size();
        }

        @Override
        protected boolean doRemove(String id) {
            return records.remove(id) != null;
        }

        @Override
        protected int doRemoveGroup(String ownerId) {
            int before = records.size();
            records.values().removeIf(record -> record.ownerId().equals(ownerId));
            return before - records.size();
        }

        @Override
        public List<EmbeddingRecord> findByOwner(String ownerId) {
            return records.values().stream().filter(record -> record.ownerId().equals(ownerId)).toList();
        }

        @Override
        public List<String> ownerIds() {
            return records.values().stream().map(EmbeddingRecord::ownerId).distinct().sorted().toList();
        }

        @Override
        public Optional<EmbeddingRecord> get(String id) {
            return Optional.ofNullable(records.get(id));
        }

        @Override
        public long size() {
            return records.size();
        }

        @Override
        public String backendName() {
            return "stub";
        }
    }
}
