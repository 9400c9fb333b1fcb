package fr.lapetina.scheduler.disruptor;

import com.lmax.disruptor.BlockingWaitStrategy;
import com.lmax.disruptor.InsufficientCapacityException;
import com.lmax.disruptor.RingBuffer;
import com.lmax.disruptor.TimeoutException;
import com.lmax.disruptor.WaitStrategy;
import com.lmax.disruptor.YieldingWaitStrategy;
import com.lmax.disruptor.dsl.Disruptor;
import com.lmax.disruptor.dsl.ProducerType;
import fr.lapetina.scheduler.admission.AdmissionController;
import fr.lapetina.scheduler.allocation.TickAllocator;
import fr.lapetina.scheduler.disruptor.handlers.AllocationHandler;
import fr.lapetina.scheduler.disruptor.handlers.DispatchHandler;
import fr.lapetina.scheduler.disruptor.handlers.ExpiryHandler;
import fr.lapetina.scheduler.disruptor.handlers.MetricsHandler;
import fr.lapetina.scheduler.dlq.DeadLetterHandler;
import fr.lapetina.scheduler.dlq.DeadLetterQueue;
import fr.lapetina.scheduler.domain.event.SchedulerEvent;
import fr.lapetina.scheduler.domain.event.SchedulerEventFactory;
import fr.lapetina.scheduler.domain.event.SchedulerEventType;
import fr.lapetina.scheduler.domain.model.DepthSnapshot;
import fr.lapetina.scheduler.domain.model.ScheduledRequest;
import fr.lapetina.scheduler.domain.model.SchedulingTicket;
import fr.lapetina.scheduler.domain.model.TenantQuery;
import fr.lapetina.scheduler.exception.AdmissionRejectedException;
import fr.lapetina.scheduler.governor.NoisyNeighborGovernor;
import fr.lapetina.scheduler.infrastructure.config.SchedulerConfig;
import fr.lapetina.scheduler.infrastructure.metrics.MetricsRegistry;
import fr.lapetina.scheduler.queue.GlobalPriorityQueue;
import fr.lapetina.scheduler.queue.LocalClaimBuffer;
import fr.lapetina.scheduler.worker.Dispatcher;
import fr.lapetina.scheduler.worker.LocalWorkerPool;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Scheduling loop of one replica, driven by an LMAX Disruptor.
 *
 * Admission runs synchronously on the caller's thread so rejections are immediate. The ring
 * buffer carries scheduling signals only: a periodic TICK, an ARRIVAL after each admitted
 * request and a SLOT_RELEASED when a worker finishes. Every signal flows through
 * expire -> allocate -> dispatch -> metrics; the first two stages act on ticks only.
 *
 * PRODUCER TYPE CHOICE: MULTI
 *
 * Callers, the ticker and worker completions all publish concurrently.
 *
 * A full ring buffer drops the signal: the next tick dispatches whatever it would have.
 */
public final class SchedulerPipeline implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(SchedulerPipeline.class);

    private final Disruptor<SchedulerEvent> disruptor;
    private final RingBuffer<SchedulerEvent> ringBuffer;
    private final ScheduledExecutorService ticker;
    private final AtomicBoolean running = new AtomicBoolean(false);

    private final AdmissionController admissionController;
    private final Dispatcher dispatcher;
    private final NoisyNeighborGovernor governor;
    private final LocalWorkerPool workerPool;
    private final GlobalPriorityQueue queue;
    private final LocalClaimBuffer localBuffer;
    private final DeadLetterQueue deadLetterQueue;
    private final Clock clock;
    private final Duration tickInterval;
    private final Duration shutdownGrace;

    private SchedulerPipeline(Builder builder) {
        this.admissionController = builder.admissionController;
        this.dispatcher = builder.dispatcher;
        this.governor = builder.governor;
        this.workerPool = builder.workerPool;
        this.queue = builder.queue;
        this.localBuffer = builder.localBuffer;
        this.deadLetterQueue = builder.deadLetterQueue;
        this.clock = builder.clock;
        this.tickInterval = builder.tickInterval;
        this.shutdownGrace = builder.shutdownGrace;

        this.disruptor = new Disruptor<>(
                new SchedulerEventFactory(),
                builder.ringBufferSize,
                new DisruptorThreadFactory("scheduler-handler"),
                ProducerType.MULTI,
                createWaitStrategy(builder.waitStrategy)
        );

        // Order: Expiry -> Allocation -> Dispatch -> Metrics
        disruptor
                .handleEventsWith(new ExpiryHandler(builder.deadLetterHandler))
                .then(new AllocationHandler(builder.tickAllocator))
                .then(new DispatchHandler(builder.dispatcher, builder.tickAllocator))
                .then(new MetricsHandler(builder.metricsRegistry));

        disruptor.setDefaultExceptionHandler(new DisruptorExceptionHandler());

        this.ringBuffer = disruptor.getRingBuffer();

        this.ticker = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "scheduler-ticker");
            t.setDaemon(true);
            return t;
        });

        workerPool.addListener(requestId -> publish(SchedulerEventType.SLOT_RELEASED, requestId));

        log.info("SchedulerPipeline created: ringBufferSize={}, waitStrategy={}, tickInterval={}",
                builder.ringBufferSize, builder.waitStrategy, tickInterval);
    }

    /**
     * Starts the Disruptor, the tick timer and the noisy-neighbor governor.
     */
    public void start() {
        if (running.compareAndSet(false, true)) {
            disruptor.start();
            ticker.scheduleAtFixedRate(
                    this::tick,
                    tickInterval.toMillis(),
                    tickInterval.toMillis(),
                    TimeUnit.MILLISECONDS
            );
            governor.start();
            log.info("SchedulerPipeline started");
        }
    }

    private void tick() {
        try {
            publish(SchedulerEventType.TICK, null);
        } catch (Exception e) {
            log.error("Failed to publish tick", e);
        }
    }

    /**
     * Admits a query and signals the scheduling loop.
     *
     * @return a ticket whose future completes with the request's outcome
     * @throws AdmissionRejectedException if the query is rejected
     * @throws IllegalStateException      if the pipeline is not running
     */
    public SchedulingTicket submit(TenantQuery query) {
        if (!running.get()) {
            throw new IllegalStateException("Pipeline not running");
        }

        ScheduledRequest request = admissionController.admit(query);
        publish(SchedulerEventType.ARRIVAL, request.requestId());

        log.debug("Request submitted: requestId={}, tenantId={}, tier={}",
                request.requestId(), request.tenantId(), request.tier());

        return SchedulingTicket.of(request);
    }

    /**
     * Cancels a request that has not been dispatched yet.
     *
     * @return true if the request will not be dispatched
     */
    public boolean cancel(String requestId) {
        return admissionController.cancel(requestId);
    }

    private void publish(SchedulerEventType type, String requestId) {
        if (!running.get()) {
            return;
        }
        long sequence;
        try {
            sequence = ringBuffer.tryNext();
        } catch (InsufficientCapacityException e) {
            log.debug("Ring buffer full, dropping signal: type={}, requestId={}", type, requestId);
            return;
        }

        try {
            ringBuffer.get(sequence).initialize(type, clock.instant(), requestId);
        } finally {
            ringBuffer.publish(sequence);
        }
    }

    /**
     * True when every worker slot is busy and the local buffer is full.
     */
    public boolean isOverloaded() {
        return workerPool.isOverloaded() && localBuffer.remainingCapacity() == 0;
    }

    public boolean isRunning() {
        return running.get();
    }

    public DepthSnapshot depthSnapshot() {
        return new DepthSnapshot(queue.depths(), localBuffer.size(), deadLetterQueue.size());
    }

    /**
     * Returns current ring buffer remaining capacity.
     */
    public long getRemainingCapacity() {
        return ringBuffer.remainingCapacity();
    }

    /**
     * Graceful shutdown: stops claiming work, waits up to the grace period for in-flight
     * requests, returns locally claimed requests to the global queue, then resolves the
     * requests this replica admitted and never dispatched as CANCELLED.
     */
    @Override
    public void close() {
        if (!running.compareAndSet(true, false)) {
            return;
        }
        log.info("Shutting down SchedulerPipeline...");

        ticker.shutdown();
        try {
            ticker.awaitTermination(5, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }

        try {
            disruptor.shutdown(30, TimeUnit.SECONDS);
        } catch (TimeoutException e) {
            log.warn("SchedulerPipeline shutdown timed out, halting...");
            disruptor.halt();
        }

        try {
            governor.close();
        } catch (Exception e) {
            log.warn("Error closing governor", e);
        }

        try {
            if (!workerPool.awaitIdle(shutdownGrace)) {
                log.warn("Shutdown grace expired with requests in flight: inFlight={}",
                        workerPool.busySlots());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }

        int released = dispatcher.releaseClaims();
        int withdrawn = admissionController.withdrawPending("Replica shut down before dispatch");
        log.info("SchedulerPipeline shut down: releasedClaims={}, withdrawn={}", released, withdrawn);
    }

    private WaitStrategy createWaitStrategy(String name) {
        return switch (name.toLowerCase()) {
            case "blocking" -> new BlockingWaitStrategy();
            case "yielding" -> new YieldingWaitStrategy();
            case "busy-spin" -> new com.lmax.disruptor.BusySpinWaitStrategy();
            case "sleeping" -> new com.lmax.disruptor.SleepingWaitStrategy();
            default -> {
                log.warn("Unknown wait strategy '{}', using BlockingWaitStrategy", name);
                yield new BlockingWaitStrategy();
            }
        };
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Thread factory for Disruptor consumer threads.
     */
    private static class DisruptorThreadFactory implements ThreadFactory {
        private final String namePrefix;
        private final AtomicInteger counter = new AtomicInteger(0);

        DisruptorThreadFactory(String namePrefix) {
            this.namePrefix = namePrefix;
        }

        @Override
        public Thread newThread(Runnable r) {
            Thread t = new Thread(r, namePrefix + "-" + counter.getAndIncrement());
            t.setDaemon(false);
            return t;
        }
    }

    /**
     * Exception handler for Disruptor. A failing stage must not stop the loop: the
     * next tick retries whatever was left undone.
     */
    private static class DisruptorExceptionHandler
            implements com.lmax.disruptor.ExceptionHandler<SchedulerEvent> {

        private static final Logger log = LoggerFactory.getLogger(DisruptorExceptionHandler.class);

        @Override
        public void handleEventException(Throwable ex, long sequence, SchedulerEvent event) {
            log.error("Exception in event handler: sequence={}, event={}", sequence, event, ex);
        }

        @Override
        public void handleOnStartException(Throwable ex) {
            log.error("Exception during Disruptor start", ex);
        }

        @Override
        public void handleOnShutdownException(Throwable ex) {
            log.error("Exception during Disruptor shutdown", ex);
        }
    }

    /**
     * Builder for SchedulerPipeline.
     */
    public static final class Builder {
        private int ringBufferSize = 1024;
        private String waitStrategy = "blocking";
        private Duration tickInterval = Duration.ofMillis(100);
        private Duration shutdownGrace = Duration.ofMinutes(2);
        private Clock clock = Clock.systemUTC();
        private AdmissionController admissionController;
        private DeadLetterHandler deadLetterHandler;
        private TickAllocator tickAllocator;
        private Dispatcher dispatcher;
        private NoisyNeighborGovernor governor;
        private LocalWorkerPool workerPool;
        private GlobalPriorityQueue queue;
        private LocalClaimBuffer localBuffer;
        private DeadLetterQueue deadLetterQueue;
        private MetricsRegistry metricsRegistry;

        public Builder ringBufferSize(int size) {
            // Must be power of 2
            if (Integer.bitCount(size) != 1) {
                throw new IllegalArgumentException("Ring buffer size must be power of 2");
            }
            this.ringBufferSize = size;
            return this;
        }

        public Builder waitStrategy(String strategy) {
            this.waitStrategy = strategy;
            return this;
        }

        public Builder tickInterval(Duration interval) {
            this.tickInterval = interval;
            return this;
        }

        public Builder shutdownGrace(Duration grace) {
            this.shutdownGrace = grace;
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = clock;
            return this;
        }

        public Builder admissionController(AdmissionController controller) {
            this.admissionController = controller;
            return this;
        }

        public Builder deadLetterHandler(DeadLetterHandler handler) {
            this.deadLetterHandler = handler;
            return this;
        }

        public Builder tickAllocator(TickAllocator allocator) {
            this.tickAllocator = allocator;
            return this;
        }

        public Builder dispatcher(Dispatcher dispatcher) {
            this.dispatcher = dispatcher;
            return this;
        }

        public Builder governor(NoisyNeighborGovernor governor) {
            this.governor = governor;
            return this;
        }

        public Builder workerPool(LocalWorkerPool pool) {
            this.workerPool = pool;
            return this;
        }

        public Builder queue(GlobalPriorityQueue queue) {
            this.queue = queue;
            return this;
        }

        public Builder localBuffer(LocalClaimBuffer buffer) {
            this.localBuffer = buffer;
            return this;
        }

        public Builder deadLetterQueue(DeadLetterQueue dlq) {
            this.deadLetterQueue = dlq;
            return this;
        }

        public Builder metricsRegistry(MetricsRegistry registry) {
            this.metricsRegistry = registry;
            return this;
        }

        public Builder fromConfig(SchedulerConfig config) {
            ringBufferSize(config.getScheduling().getRingBufferSize());
            this.waitStrategy = config.getScheduling().getWaitStrategy();
            this.tickInterval = Duration.ofMillis(config.getScheduling().getTickIntervalMs());
            this.shutdownGrace = Duration.ofMillis(config.getWorkers().getShutdownGraceMs());
            return this;
        }

        public SchedulerPipeline build() {
            if (admissionController == null) {
                throw new IllegalStateException("AdmissionController is required");
            }
            if (deadLetterHandler == null) {
                throw new IllegalStateException("DeadLetterHandler is required");
            }
            if (tickAllocator == null) {
                throw new IllegalStateException("TickAllocator is required");
            }
            if (dispatcher == null) {
                throw new IllegalStateException("Dispatcher is required");
            }
            if (governor == null) {
                throw new IllegalStateException("NoisyNeighborGovernor is required");
            }
            if (workerPool == null) {
                throw new IllegalStateException("LocalWorkerPool is required");
            }
            if (queue == null || localBuffer == null || deadLetterQueue == null) {
                throw new IllegalStateException("Queue, local buffer and dead-letter queue are required");
            }
            if (metricsRegistry == null) {
                throw new IllegalStateException("MetricsRegistry is required");
            }
            return new SchedulerPipeline(this);
        }
    }
}
