package com.purchasingpower.contextgraph.source.impl;

import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.purchasingpower.contextgraph.exception.SourceUnavailableException;
import com.purchasingpower.contextgraph.model.CallContext;
import com.purchasingpower.contextgraph.model.ServiceType;
import com.purchasingpower.contextgraph.util.ExternalCallLogger;
import org.slf4j.Logger;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Shared file handling for the file-backed sources: missing file means empty source,
 * unreadable or malformed file raises {@link SourceUnavailableException}.
 */
abstract class AbstractFileSource {

    protected final ObjectMapper objectMapper;

    protected AbstractFileSource(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    protected abstract Logger logger();

    protected Optional<String> readText(Path file, String sourceName) {
        if (!Files.exists(file)) {
            logger().debug("{} not found at {}, treating as empty", sourceName, file);
            return Optional.empty();
        }
        CallContext ctx = ExternalCallLogger.startCall(ServiceType.SOURCE, "Read " + sourceName, logger());
        ctx.logRequest("Reading file", "Path", file);
        try {
            String content = Files.readString(file);
            ctx.logResponse("File read", "Characters", content.length());
            return Optional.of(content);
        } catch (IOException e) {
            ctx.logError("Failed to read " + file, e);
            throw new SourceUnavailableException(sourceName, "cannot read " + file, e);
        }
    }

    protected Optional<JsonNode> readTree(Path file, String sourceName) {
        return readText(file, sourceName).map(content -> {
            try {
                return objectMapper.readTree(content);
            } catch (IOException e) {
                throw new SourceUnavailableException(sourceName, "malformed JSON in " + file, e);
            }
        });
    }

    /**
     * Convert a JSON array node to a typed list. A null or missing node yields an empty list.
     */
    protected <T> List<T> toList(JsonNode arrayNode, Class<T> elementType, String sourceName) {
        if (arrayNode == null || arrayNode.isNull() || arrayNode.isMissingNode()) {
            return List.of();
        }
        if (!arrayNode.isArray()) {
            throw new SourceUnavailableException(sourceName, "expected a JSON array", null);
        }
        JavaType listType = objectMapper.getTypeFactory().constructCollectionType(List.class, elementType);
        try {
            return objectMapper.convertValue(arrayNode, listType);
        } catch (IllegalArgumentException e) {
            throw new SourceUnavailableException(sourceName, "unexpected record shape", e);
        }
    }

    protected Optional<Instant> lastModified(Path file) {
        if (!Files.exists(file)) {
            return Optional.empty();
        }
        try {
            return Optional.of(Files.getLastModifiedTime(file).toInstant());
        } catch (IOException e) {
            logger().warn("Cannot read modification time of {}: {}", file, e.getMessage());
            return Optional.empty();
        }
    }
}
