package com.mcpgateway.registry.storage.mongo;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.mcpgateway.registry.common.exception.IndexBackendException;
import com.mcpgateway.registry.common.exception.IndexBackendTimeoutException;
import com.mcpgateway.registry.common.model.EmbeddingRecord;
import com.mcpgateway.registry.common.model.EntityType;
import com.mcpgateway.registry.common.model.IndexFilter;
import com.mcpgateway.registry.common.model.VectorMatch;
import com.mcpgateway.registry.storage.index.AbstractVectorIndexStore;
import com.mcpgateway.registry.storage.index.VectorIndexSettings;
import com.mcpgateway.registry.storage.similarity.VectorSimilarity;
import com.mongodb.MongoCommandException;
import com.mongodb.MongoException;
import com.mongodb.MongoExecutionTimeoutException;
import com.mongodb.MongoSocketReadTimeoutException;
import lombok.extern.slf4j.Slf4j;
import org.bson.Document;
import org.springframework.dao.DataAccessException;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.BulkOperations;
import org.springframework.data.mongodb.core.FindAndReplaceOptions;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.index.Index;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import java.util.regex.Pattern;

/**
 * Бэкенд MongoDB: один документ на запись в коллекции {@code <collection>_<dimension>}.
 * Нативный режим использует $vectorSearch (Atlas / DocumentDB с поиском),
 * иначе косинус считается на стороне клиента по отфильтрованным документам.
 */
@Slf4j
public class MongoVectorIndexStore extends AbstractVectorIndexStore {

    private static final String EMBEDDING_FIELD = "embedding";
    private static final String SCORE_FIELD = "vector_score";
    private static final List<String> KEYWORD_FIELDS = List.of("path", "name", "description", "tags");

    private final MongoTemplate mongoTemplate;
    private final ObjectMapper objectMapper;
    private final String collection;

    public MongoVectorIndexStore(VectorIndexSettings settings, VectorSimilarity similarity,
                                 MongoTemplate mongoTemplate, ObjectMapper objectMapper) {
        super(settings, similarity);
        this.mongoTemplate = mongoTemplate;
        this.objectMapper = objectMapper;
        this.collection = settings.collectionName();
        log.info("Initialized MongoDB vector store with collection={}, index={}, dimension={}",
                collection, settings.indexName(), settings.dimension());
    }

    @Override
    public String backendName() {
        return "mongodb";
    }

    @Override
    protected void openStorage() {
        try {
            if (!mongoTemplate.collectionExists(collection)) {
                mongoTemplate.createCollection(collection);
                log.info("Created collection {}", collection);
            }
            mongoTemplate.indexOps(collection).ensureIndex(
                    new Index().on("owner_id", Sort.Direction.ASC).named("owner_id_idx"));
            mongoTemplate.indexOps(collection).ensureIndex(
                    new Index().on("entity_type", Sort.Direction.ASC).named("entity_type_idx"));
        } catch (DataAccessException | MongoException e) {
            throw new IndexBackendException("Failed to prepare collection " + collection, e);
        }
    }

    @Override
    protected boolean prepareNativeIndex() {
        try {
            List<Document> existing = mongoTemplate.getCollection(collection)
                    .aggregate(List.of(new Document("$listSearchIndexes", new Document("name", settings.indexName()))))
                    .into(new ArrayList<>());
            if (!existing.isEmpty()) {
                log.info("Vector search index {} already exists on {}", settings.indexName(), collection);
                return true;
            }

            mongoTemplate.executeCommand(new Document("createSearchIndexes", collection)
                    .append("indexes", List.of(vectorIndexDefinition())));
            log.info("Created vector search index {} on {} with {} dimensions",
                    settings.indexName(), collection, settings.dimension());
            return true;
        } catch (MongoCommandException e) {
            log.warn("Vector search is not supported by this MongoDB deployment (code {}): {}",
                    e.getErrorCode(), e.getErrorMessage());
            return false;
        } catch (DataAccessException | MongoException e) {
            log.warn("Failed to prepare vector search index {}: {}", settings.indexName(), e.getMessage());
            return false;
        }
    }

    @Override
    protected List<VectorMatch> nativeQuery(float[] vector, int k, IndexFilter filter) {
        Document vectorSearch = new Document("index", settings.indexName())
                .append("path", EMBEDDING_FIELD)
                .append("queryVector", toDoubles(vector))
                .append("numCandidates", k * settings.numCandidatesMultiplier())
                .append("limit", k);
        if (!filter.acceptsAll()) {
            vectorSearch.append("filter", new Document("entity_type", new Document("$in", wireNames(filter))));
        }

        List<Document> pipeline = List.of(
                new Document("$vectorSearch", vectorSearch),
                new Document("$addFields", new Document(SCORE_FIELD, new Document("$meta", "vectorSearchScore"))));

        try {
            List<Document> documents = mongoTemplate.getCollection(collection)
                    .aggregate(pipeline)
                    .maxTime(settings.queryTimeout().toMillis(), TimeUnit.MILLISECONDS)
                    .into(new ArrayList<>());

            List<VectorMatch> matches = new ArrayList<>(documents.size());
            for (Document document : documents) {
                Object score = document.get(SCORE_FIELD);
                EmbeddingRecord record = toRecord(mongoTemplate.getConverter().read(EmbeddingDocument.class, document));
                // vectorSearchScore for cosine is (1 + cos) / 2
                double cosine = score instanceof Number number
                        ? 2.0 * number.doubleValue() - 1.0
                        : similarity.cosineSimilarity(vector, record.embedding());
                matches.add(new VectorMatch(record, Math.max(-1.0, Math.min(1.0, cosine))));
            }
            return matches;
        } catch (MongoExecutionTimeoutException | MongoSocketReadTimeoutException e) {
            throw new IndexBackendTimeoutException("Vector search timed out on " + collection, e);
        } catch (MongoException e) {
            throw new IndexBackendException("Vector search failed on " + collection + ": " + e.getMessage(), e);
        }
    }

    @Override
    protected List<EmbeddingRecord> scanRecords(IndexFilter filter) {
        Query query = new Query();
        if (!filter.acceptsAll()) {
            query.addCriteria(Criteria.where("entityType").in(wireNames(filter)));
        }
        return find(query);
    }

    @Override
    public List<EmbeddingRecord> findByKeywords(List<String> tokens, IndexFilter filter, int limit) {
        ensureReady();
        if (tokens == null || tokens.isEmpty() || limit <= 0) {
            return List.of();
        }
        IndexFilter effectiveFilter = filter == null ? IndexFilter.all() : filter;

        List<Criteria> alternatives = new ArrayList<>();
        for (String token : tokens) {
            String pattern = Pattern.quote(token);
            for (String field : KEYWORD_FIELDS) {
                alternatives.add(Criteria.where(field).regex(pattern, "i"));
            }
        }
        Criteria criteria = new Criteria().orOperator(alternatives.toArray(new Criteria[0]));
        if (!effectiveFilter.acceptsAll()) {
            criteria = new Criteria().andOperator(criteria, Criteria.where("entityType").in(wireNames(effectiveFilter)));
        }

        // documents matching one token come first in natural order, rank them locally
        Query query = Query.query(criteria).limit(limit * 4);
        return rankByKeywords(find(query), tokens, limit);
    }

    @Override
    protected void doUpsert(EmbeddingRecord record) {
        try {
            mongoTemplate.save(toDocument(record), collection);
        } catch (DataAccessException | MongoException e) {
            throw new IndexBackendException("Failed to upsert record " + record.id(), e);
        }
    }

    @Override
    protected void doReplaceGroup(String ownerId, List<EmbeddingRecord> records) {
        List<String> newIds = records.stream().map(EmbeddingRecord::id).toList();
        try {
            BulkOperations bulk = mongoTemplate.bulkOps(BulkOperations.BulkMode.ORDERED, EmbeddingDocument.class, collection);
            bulk.remove(Query.query(Criteria.where("ownerId").is(ownerId).and("id").nin(newIds)));
            for (EmbeddingRecord record : records) {
                bulk.replaceOne(Query.query(Criteria.where("id").is(record.id())), toDocument(record),
                        FindAndReplaceOptions.options().upsert());
            }
            bulk.execute();
            log.debug("Replaced group {} with {} records in {}", ownerId, records.size(), collection);
        } catch (DataAccessException | MongoException e) {
            throw new IndexBackendException("Failed to replace record group " + ownerId, e);
        }
    }

    @Override
    protected int doSetGroupEnabled(String ownerId, boolean enabled) {
        try {
            return (int) mongoTemplate.updateMulti(Query.query(Criteria.where("ownerId").is(ownerId)),
                    Update.update("enabled", enabled), EmbeddingDocument.class, collection).getMatchedCount();
        } catch (DataAccessException | MongoException e) {
            throw new IndexBackendException("Failed to update enabled state of group " + ownerId, e);
        }
    }

    @Override
    protected boolean doRemove(String id) {
        try {
            return mongoTemplate.remove(Query.query(Criteria.where("id").is(id)), EmbeddingDocument.class, collection)
                    .getDeletedCount() > 0;
        } catch (DataAccessException | MongoException e) {
            throw new IndexBackendException("Failed to remove record " + id, e);
        }
    }

    @Override
    protected int doRemoveGroup(String ownerId) {
        try {
            return (int) mongoTemplate.remove(Query.query(Criteria.where("ownerId").is(ownerId)),
                    EmbeddingDocument.class, collection).getDeletedCount();
        } catch (DataAccessException | MongoException e) {
            throw new IndexBackendException("Failed to remove record group " + ownerId, e);
        }
    }

    @Override
    public List<EmbeddingRecord> findByOwner(String ownerId) {
        ensureReady();
        return find(Query.query(Criteria.where("ownerId").is(ownerId)));
    }

    @Override
    public List<String> ownerIds() {
        ensureReady();
        try {
            return mongoTemplate.findDistinct(new Query(), "ownerId", collection, EmbeddingDocument.class, String.class)
                    .stream().sorted().toList();
        } catch (DataAccessException | MongoException e) {
            throw new IndexBackendException("Failed to list record owners in " + collection, e);
        }
    }

    @Override
    public Optional<EmbeddingRecord> get(String id) {
        ensureReady();
        try {
            return Optional.ofNullable(mongoTemplate.findById(id, EmbeddingDocument.class, collection))
                    .map(this::toRecord);
        } catch (DataAccessException | MongoException e) {
            throw new IndexBackendException("Failed to read record " + id, e);
        }
    }

    @Override
    public long size() {
        ensureReady();
        try {
            return mongoTemplate.count(new Query(), EmbeddingDocument.class, collection);
        } catch (DataAccessException | MongoException e) {
            throw new IndexBackendException("Failed to count records in " + collection, e);
        }
    }

    private List<EmbeddingRecord> find(Query query) {
        try {
            return mongoTemplate.find(query, EmbeddingDocument.class, collection).stream()
                    .map(this::toRecord)
                    .toList();
        } catch (DataAccessException | MongoException e) {
            throw new IndexBackendException("Failed to read records from " + collection, e);
        }
    }

    private Document vectorIndexDefinition() {
        List<Document> fields = List.of(
                new Document("type", "vector")
                        .append("path", EMBEDDING_FIELD)
                        .append("numDimensions", settings.dimension())
                        .append("similarity", "cosine"),
                new Document("type", "filter").append("path", "entity_type"));
        return new Document("name", settings.indexName())
                .append("type", "vectorSearch")
                .append("definition", new Document("fields", fields));
    }

    EmbeddingDocument toDocument(EmbeddingRecord record) {
        List<Double> embedding = toDoubles(record.embedding());
        try {
            return EmbeddingDocument.builder()
                    .id(record.id())
                    .entityType(record.entityType().wireName())
                    .ownerId(record.ownerId())
                    .path(record.path())
                    .name(record.name())
                    .description(record.description())
                    .tags(record.tags())
                    .text(record.text())
                    .embedding(embedding)
                    .enabled(record.enabled())
                    .metadataJson(objectMapper.writeValueAsString(record.metadata()))
                    .embeddingMetadata(record.embeddingMetadata())
                    .indexedAt(record.indexedAt())
                    .build();
        } catch (JsonProcessingException e) {
            throw new IndexBackendException("Failed to serialize metadata of record " + record.id(), e);
        }
    }

    EmbeddingRecord toRecord(EmbeddingDocument document) {
        float[] embedding = new float[document.getEmbedding().size()];
        for (int i = 0; i < embedding.length; i++) {
            embedding[i] = document.getEmbedding().get(i).floatValue();
        }
        Map<String, Object> metadata = Map.of();
        if (document.getMetadataJson() != null) {
            try {
                metadata = objectMapper.readValue(document.getMetadataJson(), new TypeReference<Map<String, Object>>() {
                });
            } catch (JsonProcessingException e) {
                log.warn("Ignoring unreadable metadata of record {}: {}", document.getId(), e.getOriginalMessage());
            }
        }
        return EmbeddingRecord.builder()
                .id(document.getId())
                .entityType(EntityType.fromWireName(document.getEntityType()))
                .ownerId(document.getOwnerId())
                .path(document.getPath())
                .name(document.getName())
                .description(document.getDescription())
                .tags(document.getTags())
                .text(document.getText())
                .embedding(embedding)
                .enabled(document.isEnabled())
                .metadata(metadata)
                .embeddingMetadata(document.getEmbeddingMetadata())
                .indexedAt(document.getIndexedAt())
                .build();
    }

    private static List<Double> toDoubles(float[] vector) {
        List<Double> values = new ArrayList<>(vector.length);
        for (float v : vector) {
            values.add((double) v);
        }
        return values;
    }

    private static List<String> wireNames(IndexFilter filter) {
        return filter.types().stream().map(EntityType::wireName).sorted().toList();
    }
}
