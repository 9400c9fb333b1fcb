package fr.lapetina.scheduler.domain.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Opaque result returned by the downstream RAG pipeline.
 */
public record PipelineResult(String requestId, Map<String, Object> body) {
    public PipelineResult {
        Objects.requireNonNull(requestId, "Request ID is required");
        body = body != null ? Collections.unmodifiableMap(new LinkedHashMap<>(body)) : Map.of();
    }
}
