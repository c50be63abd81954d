package com.mcpgateway.registry.storage.kv;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.mcpgateway.registry.common.exception.IndexBackendException;
import com.mcpgateway.registry.common.model.EmbeddingRecord;
import lombok.extern.slf4j.Slf4j;
import org.rocksdb.ColumnFamilyDescriptor;
import org.rocksdb.ColumnFamilyHandle;
import org.rocksdb.DBOptions;
import org.rocksdb.RocksDB;
import org.rocksdb.RocksDBException;
import org.rocksdb.RocksIterator;
import org.rocksdb.WriteBatch;
import org.rocksdb.WriteOptions;

import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Хранилище векторных записей в RocksDB. Значения сериализуются в JSON,
 * ключ записи совпадает с её ID.
 */
@Slf4j
public class RocksDbEmbeddingStorage implements EmbeddingRecordStorage {
    private static final String EMBEDDINGS_CF = "embeddings";

    private final String dataPath;
    private final ObjectMapper objectMapper = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);

    private DBOptions dbOptions;
    private RocksDB rocksDB;
    private ColumnFamilyHandle defaultHandle;
    private ColumnFamilyHandle embeddingsHandle;

    public RocksDbEmbeddingStorage(String dataPath) {
        this.dataPath = dataPath;
    }

    @Override
    public synchronized void initialize() {
        if (rocksDB != null) {
            return;
        }
        RocksDB.loadLibrary();

        try {
            Path dbPath = Paths.get(dataPath);
            dbPath.toFile().mkdirs();

            List<ColumnFamilyDescriptor> columnFamilyDescriptors = List.of(
                new ColumnFamilyDescriptor(RocksDB.DEFAULT_COLUMN_FAMILY),
                new ColumnFamilyDescriptor(EMBEDDINGS_CF.getBytes(StandardCharsets.UTF_8))
            );

            List<ColumnFamilyHandle> handles = new ArrayList<>();

            dbOptions = new DBOptions()
                .setCreateIfMissing(true)
                .setCreateMissingColumnFamilies(true);

            rocksDB = RocksDB.open(dbOptions, dbPath.toString(), columnFamilyDescriptors, handles);
            defaultHandle = handles.get(0);
            embeddingsHandle = handles.get(1);

            log.info("RocksDB embedding storage initialized at path: {}", dbPath);

        } catch (RocksDBException e) {
            log.error("Failed to initialize RocksDB at {}", dataPath, e);
            throw new IndexBackendException("Failed to initialize embedding storage at " + dataPath, e);
        }
    }

    @Override
    public void put(EmbeddingRecord record) throws Exception {
        rocksDB.put(embeddingsHandle, key(record.id()), objectMapper.writeValueAsBytes(record));
    }

    @Override
    public void writeGroup(List<EmbeddingRecord> records, Collection<String> staleIds) throws Exception {
        try (WriteBatch batch = new WriteBatch();
             WriteOptions writeOptions = new WriteOptions()) {
            for (String staleId : staleIds) {
                batch.delete(embeddingsHandle, key(staleId));
            }
            for (EmbeddingRecord record : records) {
                batch.put(embeddingsHandle, key(record.id()), objectMapper.writeValueAsBytes(record));
            }
            rocksDB.write(writeOptions, batch);
        }
    }

    @Override
    public Optional<EmbeddingRecord> get(String id) throws Exception {
        byte[] value = rocksDB.get(embeddingsHandle, key(id));

        if (value == null) {
            return Optional.empty();
        }

        return Optional.of(objectMapper.readValue(value, EmbeddingRecord.class));
    }

    @Override
    public boolean delete(String id) throws Exception {
        byte[] existing = rocksDB.get(embeddingsHandle, key(id));

        if (existing == null) {
            return false;
        }

        rocksDB.delete(embeddingsHandle, key(id));
        return true;
    }

    @Override
    public List<EmbeddingRecord> getAll() throws Exception {
        List<EmbeddingRecord> records = new ArrayList<>();

        try (RocksIterator iterator = rocksDB.newIterator(embeddingsHandle)) {
            iterator.seekToFirst();

            while (iterator.isValid()) {
                records.add(objectMapper.readValue(iterator.value(), EmbeddingRecord.class));
                iterator.next();
            }
        }

        return records;
    }

    @Override
    public synchronized void cleanup() {
        if (rocksDB != null) {
            embeddingsHandle.close();
            defaultHandle.close();
            rocksDB.close();
            dbOptions.close();
            rocksDB = null;
            log.info("RocksDB embedding storage closed");
        }
    }

    private static byte[] key(String id) {
        return id.getBytes(StandardCharsets.UTF_8);
    }
}
