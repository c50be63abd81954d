package com.mcpgateway.registry.search.embedding;

import com.mcpgateway.registry.common.exception.EmbeddingUnavailableException;
import com.mcpgateway.registry.search.config.EmbeddingSettings;
import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.data.segment.TextSegment;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.model.embedding.onnx.OnnxEmbeddingModel;
import dev.langchain4j.model.embedding.onnx.PoolingMode;
import dev.langchain4j.model.embedding.onnx.allminilml6v2.AllMiniLmL6V2EmbeddingModel;
import dev.langchain4j.model.output.Response;
import lombok.extern.slf4j.Slf4j;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

/**
 * Локальная модель эмбеддингов через ONNX Runtime, без сетевых вызовов.
 * Без model-dir используется встроенная all-MiniLM-L6-v2 (384 измерения),
 * иначе model.onnx и tokenizer.json из указанного каталога.
 */
@Slf4j
public class LocalEmbeddingProvider extends AbstractEmbeddingProvider {

    static final String MODEL_FILE = "model.onnx";
    static final String TOKENIZER_FILE = "tokenizer.json";

    private final EmbeddingSettings settings;
    private volatile EmbeddingModel model;

    public LocalEmbeddingProvider(EmbeddingSettings settings) {
        super(settings.dimension(), settings.batchSize());
        this.settings = settings;
    }

    LocalEmbeddingProvider(EmbeddingSettings settings, EmbeddingModel model) {
        this(settings);
        this.model = model;
    }

    @Override
    protected List<float[]> embedBatch(List<String> texts) {
        EmbeddingModel embeddingModel = model();
        try {
            Response<List<Embedding>> response = embeddingModel.embedAll(texts.stream().map(TextSegment::from).toList());
            return response.content().stream().map(Embedding::vector).toList();
        } catch (RuntimeException e) {
            throw new EmbeddingUnavailableException("Local embedding model failed: " + e.getMessage(), e);
        }
    }

    @Override
    public Map<String, Object> describe() {
        return Map.of(
            "provider", "local",
            "model", settings.modelName(),
            "dimension", dimension);
    }

    private EmbeddingModel model() {
        EmbeddingModel current = model;
        if (current == null) {
            synchronized (this) {
                current = model;
                if (current == null) {
                    current = loadModel();
                    model = current;
                }
            }
        }
        return current;
    }

    private EmbeddingModel loadModel() {
        try {
            if (settings.modelDir() == null) {
                log.info("Loading bundled all-MiniLM-L6-v2 embedding model (configured name: {})", settings.modelName());
                return new AllMiniLmL6V2EmbeddingModel();
            }

            Path modelPath = Path.of(settings.modelDir(), MODEL_FILE);
            Path tokenizerPath = Path.of(settings.modelDir(), TOKENIZER_FILE);
            if (!Files.isRegularFile(modelPath) || !Files.isRegularFile(tokenizerPath)) {
                throw new EmbeddingUnavailableException(String.format(
                    "Local embedding model %s not found: expected %s and %s in %s",
                    settings.modelName(), MODEL_FILE, TOKENIZER_FILE, settings.modelDir()));
            }
            log.info("Loading local embedding model {} from {}", settings.modelName(), settings.modelDir());
            return new OnnxEmbeddingModel(modelPath.toString(), tokenizerPath.toString(), PoolingMode.MEAN);
        } catch (EmbeddingUnavailableException e) {
            throw e;
        } catch (RuntimeException | LinkageError e) {
            throw new EmbeddingUnavailableException("Failed to load local embedding model " + settings.modelName(), e);
        }
    }
}
