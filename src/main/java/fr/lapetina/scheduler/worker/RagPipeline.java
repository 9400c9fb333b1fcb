package fr.lapetina.scheduler.worker;

import fr.lapetina.scheduler.domain.model.PipelineResult;

import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Outbound port to the retrieval-augmented generation pipeline.
 *
 * The call is opaque to the scheduler: it is made exactly once per dispatched request and
 * never retried here. Implementations must not block the calling thread.
 */
@FunctionalInterface
public interface RagPipeline {

    /**
     * @return a future completing with the result, or exceptionally with the pipeline error
     */
    CompletableFuture<PipelineResult> execute(String requestId, String tenantId, Map<String, Object> payload);
}
