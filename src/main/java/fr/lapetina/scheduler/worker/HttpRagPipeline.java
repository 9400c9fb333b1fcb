package fr.lapetina.scheduler.worker;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import fr.lapetina.scheduler.domain.model.PipelineResult;
import fr.lapetina.scheduler.exception.PipelineException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * RAG pipeline reached over HTTP with a JSON body.
 *
 * Uses java.net.http.HttpClient for non-blocking I/O. Posts
 * {@code {"requestId", "tenantId", "payload"}} and expects a JSON object back.
 */
public final class HttpRagPipeline implements RagPipeline {

    private static final Logger log = LoggerFactory.getLogger(HttpRagPipeline.class);

    private static final TypeReference<Map<String, Object>> BODY_TYPE = new TypeReference<>() {
    };

    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final URI endpoint;
    private final Duration requestTimeout;

    public HttpRagPipeline(URI endpoint, Duration connectTimeout, Duration requestTimeout) {
        this.endpoint = endpoint;
        this.requestTimeout = requestTimeout;
        this.httpClient = HttpClient.newBuilder()
                .connectTimeout(connectTimeout)
                .version(HttpClient.Version.HTTP_1_1)
                .build();
        this.objectMapper = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .setSerializationInclusion(JsonInclude.Include.NON_NULL)
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    @Override
    public CompletableFuture<PipelineResult> execute(String requestId, String tenantId, Map<String, Object> payload) {
        HttpRequest httpRequest;
        try {
            httpRequest = buildHttpRequest(requestId, tenantId, payload);
        } catch (IOException e) {
            log.error("Failed to build pipeline request: requestId={}", requestId, e);
            return CompletableFuture.failedFuture(
                    new PipelineException("Failed to build request: " + e.getMessage(), -1, e));
        }

        Instant startTime = Instant.now();
        log.debug("Calling pipeline: requestId={}, tenantId={}, endpoint={}", requestId, tenantId, endpoint);

        return httpClient.sendAsync(httpRequest, HttpResponse.BodyHandlers.ofString())
                .thenApply(response -> handleResponse(requestId, response, startTime));
    }

    private HttpRequest buildHttpRequest(String requestId, String tenantId, Map<String, Object> payload)
            throws IOException {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("requestId", requestId);
        body.put("tenantId", tenantId);
        body.put("payload", payload);

        return HttpRequest.newBuilder()
                .uri(endpoint)
                .timeout(requestTimeout)
                .header("Content-Type", "application/json")
                .header("X-Request-ID", requestId)
                .header("X-Tenant-ID", tenantId)
                .POST(HttpRequest.BodyPublishers.ofString(objectMapper.writeValueAsString(body)))
                .build();
    }

    private PipelineResult handleResponse(String requestId, HttpResponse<String> response, Instant startTime) {
        long latencyMs = Duration.between(startTime, Instant.now()).toMillis();
        int statusCode = response.statusCode();

        if (statusCode < 200 || statusCode >= 300) {
            log.warn("Pipeline returned HTTP error: requestId={}, status={}, latencyMs={}",
                    requestId, statusCode, latencyMs);
            throw new PipelineException(extractError(response.body(), statusCode), statusCode);
        }

        try {
            Map<String, Object> body = response.body() == null || response.body().isBlank()
                    ? Map.of()
                    : objectMapper.readValue(response.body(), BODY_TYPE);
            log.debug("Pipeline call succeeded: requestId={}, status={}, latencyMs={}",
                    requestId, statusCode, latencyMs);
            return new PipelineResult(requestId, body);
        } catch (IOException e) {
            throw new PipelineException("Failed to parse pipeline response: " + e.getMessage(), statusCode, e);
        }
    }

    private String extractError(String body, int statusCode) {
        String message = "HTTP " + statusCode;
        if (body == null || body.isBlank()) {
            return message;
        }
        try {
            Map<String, Object> errorBody = objectMapper.readValue(body, BODY_TYPE);
            Object error = errorBody.get("error");
            return error != null ? error.toString() : message;
        } catch (IOException e) {
            log.debug("Pipeline error body is not JSON: status={}", statusCode);
            return message;
        }
    }
}
