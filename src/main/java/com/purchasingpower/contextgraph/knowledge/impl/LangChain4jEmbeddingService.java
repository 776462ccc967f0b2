package com.purchasingpower.contextgraph.knowledge.impl;

import com.purchasingpower.contextgraph.configuration.ContextGraphProperties;
import com.purchasingpower.contextgraph.configuration.EmbeddingProperties;
import com.purchasingpower.contextgraph.knowledge.EmbeddingService;
import com.purchasingpower.contextgraph.model.CallContext;
import com.purchasingpower.contextgraph.model.ServiceType;
import com.purchasingpower.contextgraph.util.ExternalCallLogger;
import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.data.segment.TextSegment;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.model.ollama.OllamaEmbeddingModel;
import dev.langchain4j.model.output.Response;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * LangChain4j-based embedding service backed by Ollama.
 *
 * <p>The model is built with an explicit timeout and retry count, so a stalled embedding
 * server fails the current sync stage instead of hanging the whole sync.
 *
 * @since 1.0.0
 */
@Slf4j
@Service
public class LangChain4jEmbeddingService implements EmbeddingService {

    private final EmbeddingModel embeddingModel;
    private final int batchSize;

    @Autowired
    public LangChain4jEmbeddingService(ContextGraphProperties properties) {
        EmbeddingProperties embedding = properties.getEmbedding();

        log.info("🔷 Initializing LangChain4j Embedding Service");
        log.info("   - Ollama URL: {}", embedding.getBaseUrl());
        log.info("   - Model: {}", embedding.getModel());
        log.info("   - Timeout: {}s", embedding.getTimeoutSeconds());
        log.info("   - Max Retries: {}", embedding.getMaxRetries());

        this.embeddingModel = OllamaEmbeddingModel.builder()
                .baseUrl(embedding.getBaseUrl())
                .modelName(embedding.getModel())
                .timeout(Duration.ofSeconds(embedding.getTimeoutSeconds()))
                .maxRetries(embedding.getMaxRetries())
                .logRequests(false)
                .logResponses(false)
                .build();
        this.batchSize = embedding.getBatchSize();
    }

    LangChain4jEmbeddingService(EmbeddingModel embeddingModel, int batchSize) {
        this.embeddingModel = embeddingModel;
        this.batchSize = batchSize;
    }

    @Override
    public List<List<Double>> embedAll(List<String> texts) {
        if (texts == null || texts.isEmpty()) {
            return List.of();
        }
        if (texts.stream().anyMatch(t -> t == null || t.isBlank())) {
            throw new IllegalArgumentException("Texts to embed cannot be blank");
        }

        List<List<Double>> embeddings = new ArrayList<>(texts.size());
        for (int start = 0; start < texts.size(); start += batchSize) {
            List<String> batch = texts.subList(start, Math.min(start + batchSize, texts.size()));
            embeddings.addAll(embedBatch(batch));
        }
        return embeddings;
    }

    private List<List<Double>> embedBatch(List<String> batch) {
        CallContext ctx = ExternalCallLogger.startCall(ServiceType.OLLAMA, "EmbedAll", log);
        ctx.logRequest("Embedding batch", "Texts", batch.size());

        List<TextSegment> segments = batch.stream()
                .map(TextSegment::from)
                .collect(Collectors.toList());

        try {
            Response<List<Embedding>> response = embeddingModel.embedAll(segments);
            List<Embedding> content = response.content();
            if (content == null || content.size() != batch.size()) {
                throw new IllegalStateException("Embedding service returned "
                        + (content == null ? 0 : content.size()) + " vectors for " + batch.size() + " texts");
            }

            List<List<Double>> embeddings = content.stream()
                    .map(this::convertToDoubleList)
                    .collect(Collectors.toList());

            ctx.logResponse("Embeddings generated", "Count", embeddings.size());
            return embeddings;
        } catch (Exception e) {
            ctx.logError("Batch embedding generation failed", e);
            throw new RuntimeException("Batch embedding generation failed", e);
        }
    }

    /**
     * Convert LangChain4j Embedding (float[]) to List<Double>, the representation stored on graph nodes.
     */
    private List<Double> convertToDoubleList(Embedding embedding) {
        float[] vector = embedding.vector();
        List<Double> result = new ArrayList<>(vector.length);
        for (float value : vector) {
            result.add((double) value);
        }
        return result;
    }
}
