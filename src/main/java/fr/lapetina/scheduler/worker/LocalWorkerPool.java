package fr.lapetina.scheduler.worker;

import fr.lapetina.scheduler.domain.model.PipelineResult;
import fr.lapetina.scheduler.domain.model.RequestStatus;
import fr.lapetina.scheduler.domain.model.ScheduledRequest;
import fr.lapetina.scheduler.domain.model.SchedulingOutcome;
import fr.lapetina.scheduler.domain.model.WorkerSlot;
import fr.lapetina.scheduler.infrastructure.metrics.MetricsRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Fixed-size set of execution slots of one replica.
 *
 * A request must own a slot for the whole pipeline call, so at most N calls are in flight
 * per replica. The call itself is asynchronous: dispatch returns as soon as the pipeline
 * accepted the request, and the slot is released from the completion callback.
 */
public final class LocalWorkerPool {

    private static final Logger log = LoggerFactory.getLogger(LocalWorkerPool.class);

    private final WorkerSlot[] slots;
    private final RagPipeline pipeline;
    private final MetricsRegistry metrics;
    private final Clock clock;
    private final List<SlotReleaseListener> listeners = new CopyOnWriteArrayList<>();
    private final Object idleMonitor = new Object();

    public LocalWorkerPool(int size, RagPipeline pipeline, MetricsRegistry metrics, Clock clock) {
        if (size < 1) {
            throw new IllegalArgumentException("Pool size must be >= 1");
        }
        this.slots = new WorkerSlot[size];
        for (int i = 0; i < size; i++) {
            slots[i] = new WorkerSlot(i);
        }
        this.pipeline = pipeline;
        this.metrics = metrics;
        this.clock = clock;
        log.info("LocalWorkerPool initialized: size={}", size);
    }

    public void addListener(SlotReleaseListener listener) {
        listeners.add(listener);
    }

    /**
     * Takes a free slot and starts the pipeline call for a queued request.
     *
     * @return false if no slot is free or the request is no longer queued
     */
    public boolean dispatch(ScheduledRequest request) {
        Instant now = clock.instant();
        WorkerSlot slot = acquireSlot(request.requestId(), now);
        if (slot == null) {
            return false;
        }
        if (!request.markDispatched(now)) {
            slot.release(request.requestId());
            log.debug("Dispatch aborted, request no longer queued: requestId={}, status={}",
                    request.requestId(), request.status());
            return false;
        }

        MDC.put("requestId", request.requestId());
        MDC.put("tenantId", request.tenantId());
        MDC.put("tier", request.tier().name());
        try {
            log.debug("Request dispatched: requestId={}, tenantId={}, tier={}, slotId={}, queueWaitMs={}",
                    request.requestId(), request.tenantId(), request.tier(), slot.slotId(),
                    request.waitedUntil(now).toMillis());

            CompletableFuture<PipelineResult> call = invoke(request);
            call.whenComplete((result, error) -> complete(slot, request, result, error, now));
        } finally {
            MDC.remove("requestId");
            MDC.remove("tenantId");
            MDC.remove("tier");
        }
        return true;
    }

    private CompletableFuture<PipelineResult> invoke(ScheduledRequest request) {
        try {
            CompletableFuture<PipelineResult> call =
                    pipeline.execute(request.requestId(), request.tenantId(), request.payload());
            return call != null ? call : CompletableFuture.failedFuture(
                    new IllegalStateException("Pipeline returned no future"));
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(e);
        }
    }

    private void complete(
            WorkerSlot slot,
            ScheduledRequest request,
            PipelineResult result,
            Throwable error,
            Instant startedAt
    ) {
        Instant now = clock.instant();
        Duration latency = Duration.between(startedAt, now);
        slot.release(request.requestId());

        if (error == null) {
            request.transition(RequestStatus.DISPATCHED, RequestStatus.COMPLETED);
            request.resolve(SchedulingOutcome.completed(
                    request, result != null ? result : new PipelineResult(request.requestId(), null), now));
            metrics.recordDispatchLatency(request.tier(), RequestStatus.COMPLETED, latency);
            metrics.incrementOutcome(request.tier(), RequestStatus.COMPLETED);
            log.debug("Request completed: requestId={}, tenantId={}, latencyMs={}",
                    request.requestId(), request.tenantId(), latency.toMillis());
        } else {
            Throwable cause = error instanceof CompletionException && error.getCause() != null
                    ? error.getCause()
                    : error;
            request.transition(RequestStatus.DISPATCHED, RequestStatus.FAILED);
            request.resolve(SchedulingOutcome.failed(request, describe(cause), now));
            metrics.recordDispatchLatency(request.tier(), RequestStatus.FAILED, latency);
            metrics.incrementOutcome(request.tier(), RequestStatus.FAILED);
            log.warn("Pipeline call failed: requestId={}, tenantId={}, tier={}, error={}, latencyMs={}",
                    request.requestId(), request.tenantId(), request.tier(), describe(cause), latency.toMillis());
        }

        synchronized (idleMonitor) {
            idleMonitor.notifyAll();
        }
        for (SlotReleaseListener listener : listeners) {
            try {
                listener.onSlotReleased(request.requestId());
            } catch (Exception e) {
                log.error("Slot release listener failed: requestId={}", request.requestId(), e);
            }
        }
    }

    private static String describe(Throwable cause) {
        return cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
    }

    private WorkerSlot acquireSlot(String requestId, Instant now) {
        for (WorkerSlot slot : slots) {
            if (slot.isFree() && slot.tryAcquire(requestId, now)) {
                return slot;
            }
        }
        return null;
    }

    public int size() {
        return slots.length;
    }

    public int busySlots() {
        int busy = 0;
        for (WorkerSlot slot : slots) {
            if (!slot.isFree()) {
                busy++;
            }
        }
        return busy;
    }

    public int freeSlots() {
        return slots.length - busySlots();
    }

    /**
     * True when every slot is occupied.
     */
    public boolean isOverloaded() {
        return busySlots() >= slots.length;
    }

    public List<WorkerSlot> slots() {
        return List.of(slots);
    }

    /**
     * Requests currently owning a slot.
     */
    public List<String> inFlightRequestIds() {
        List<String> ids = new ArrayList<>();
        for (WorkerSlot slot : slots) {
            String id = slot.occupyingRequestId();
            if (id != null) {
                ids.add(id);
            }
        }
        return ids;
    }

    /**
     * Waits until no slot is occupied or the timeout elapses.
     *
     * @return true if the pool became idle
     */
    public boolean awaitIdle(Duration timeout) throws InterruptedException {
        long deadline = System.nanoTime() + timeout.toNanos();
        synchronized (idleMonitor) {
            while (busySlots() > 0) {
                long remaining = deadline - System.nanoTime();
                if (remaining <= 0) {
                    return false;
                }
                idleMonitor.wait(Math.max(1, remaining / 1_000_000));
            }
        }
        return true;
    }
}
