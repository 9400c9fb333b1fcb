package fr.lapetina.scheduler;

import fr.lapetina.scheduler.admission.AdmissionController;
import fr.lapetina.scheduler.allocation.FairShareAllocator;
import fr.lapetina.scheduler.allocation.TickAllocator;
import fr.lapetina.scheduler.disruptor.SchedulerPipeline;
import fr.lapetina.scheduler.dlq.DeadLetterHandler;
import fr.lapetina.scheduler.domain.model.TenantTier;
import fr.lapetina.scheduler.domain.model.TierPolicies;
import fr.lapetina.scheduler.governor.NoisyNeighborGovernor;
import fr.lapetina.scheduler.infrastructure.config.ConfigLoader;
import fr.lapetina.scheduler.infrastructure.config.ReloadResult;
import fr.lapetina.scheduler.infrastructure.config.SchedulerConfig;
import fr.lapetina.scheduler.infrastructure.config.SchedulingSettings;
import fr.lapetina.scheduler.infrastructure.metrics.MetricsRegistry;
import fr.lapetina.scheduler.limiter.TokenBucketLimiter;
import fr.lapetina.scheduler.queue.GlobalPriorityQueue;
import fr.lapetina.scheduler.queue.LocalClaimBuffer;
import fr.lapetina.scheduler.worker.Dispatcher;
import fr.lapetina.scheduler.worker.HttpRagPipeline;
import fr.lapetina.scheduler.worker.LocalWorkerPool;
import fr.lapetina.scheduler.worker.RagPipeline;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Factory for creating a fully-wired scheduler replica from configuration.
 * This is the primary entry point for obtaining a configured SchedulerPipeline.
 *
 * <p>Usage:
 * <pre>{@code
 * try (SchedulerFactory factory = SchedulerFactory.create("config.yaml").start()) {
 *     SchedulingTicket ticket = factory.getPipeline().submit(query);
 *     SchedulingOutcome outcome = ticket.outcome().join();
 * }
 * }</pre>
 *
 * <p>Tier policies, redistribution policy, governor settings, queue size and maximum queue
 * wait follow configuration reloads. Pool size, buffer size, tick interval and ring size are
 * read once at startup.
 */
public class SchedulerFactory implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(SchedulerFactory.class);

    private static final Duration CONFIG_POLL_INTERVAL = Duration.ofSeconds(1);

    private final SchedulerConfig config;
    private final ConfigLoader configLoader;
    private final String replicaId;
    private final Clock clock;
    private final SharedState sharedState;

    private final AtomicReference<SchedulingSettings> settings;

    private final MetricsRegistry metricsRegistry;
    private final TokenBucketLimiter limiter;
    private final GlobalPriorityQueue queue;
    private final LocalClaimBuffer localBuffer;
    private final TickAllocator tickAllocator;
    private final NoisyNeighborGovernor governor;
    private final DeadLetterHandler deadLetterHandler;
    private final LocalWorkerPool workerPool;
    private final Dispatcher dispatcher;
    private final AdmissionController admissionController;
    private final SchedulerPipeline pipeline;

    protected SchedulerFactory(
            SchedulerConfig config,
            ConfigLoader configLoader,
            RagPipeline ragPipelineOverride,
            Clock clock,
            SharedState sharedState
    ) {
        SchedulingSettings initial = config.validate();
        this.config = config;
        this.configLoader = configLoader;
        this.clock = clock;
        this.sharedState = sharedState;
        this.replicaId = config.resolveReplicaId();

        log.info("Initializing SchedulerFactory: replicaId={}", replicaId);

        this.settings = new AtomicReference<>(initial);

        this.metricsRegistry = new MetricsRegistry(config.getMetrics().getPrefix());

        this.limiter = new TokenBucketLimiter(sharedState.tokenBuckets(), this::getPolicies, clock);
        this.queue = new GlobalPriorityQueue(sharedState.queueStore(), () -> settings.get().maxQueueSize());
        this.localBuffer = new LocalClaimBuffer(config.getWorkers().getLocalBufferSize());

        int creditsPerTick = config.effectiveCreditsPerTick();
        this.tickAllocator = new TickAllocator(
                queue,
                localBuffer,
                sharedState.ledger(),
                new FairShareAllocator(initial.tierPolicies(), initial.redistribution()),
                () -> creditsPerTick,
                clock.instant()
        );

        this.governor = new NoisyNeighborGovernor(
                sharedState.ledger(),
                limiter,
                this::getPolicies,
                () -> settings.get().governor(),
                clock,
                Duration.ofMillis(config.getGovernor().getScanIntervalMs())
        );

        this.deadLetterHandler = new DeadLetterHandler(
                queue, localBuffer, sharedState.deadLetterQueue(), metricsRegistry);

        // Allow override for testing
        RagPipeline ragPipeline = ragPipelineOverride != null ? ragPipelineOverride : createRagPipeline();
        this.workerPool = new LocalWorkerPool(config.getWorkers().getPoolSize(), ragPipeline, metricsRegistry, clock);

        this.dispatcher = new Dispatcher(
                queue, localBuffer, workerPool, governor, deadLetterHandler, sharedState.ledger(), metricsRegistry);

        this.admissionController = new AdmissionController(
                limiter, queue, () -> settings.get().maxQueueWait(), metricsRegistry, clock);

        this.pipeline = SchedulerPipeline.builder()
                .fromConfig(config)
                .clock(clock)
                .admissionController(admissionController)
                .deadLetterHandler(deadLetterHandler)
                .tickAllocator(tickAllocator)
                .dispatcher(dispatcher)
                .governor(governor)
                .workerPool(workerPool)
                .queue(queue)
                .localBuffer(localBuffer)
                .deadLetterQueue(sharedState.deadLetterQueue())
                .metricsRegistry(metricsRegistry)
                .build();

        if (configLoader != null) {
            configLoader.addListener(this::applySettings);
        }

        registerGauges();

        log.info("SchedulerFactory initialized: replicaId={}, workers={}, creditsPerTick={}, policies={}",
                replicaId, workerPool.size(), creditsPerTick, initial.tierPolicies());
    }

    /**
     * Creates a factory from the specified configuration file, with process-local shared state.
     */
    public static SchedulerFactory create(String configPath) {
        ConfigLoader loader = new ConfigLoader(configPath);
        SchedulerConfig config = loader.load();
        return new SchedulerFactory(
                config,
                loader,
                null,
                Clock.systemUTC(),
                SharedState.inMemory(config.getScheduling().getDlqRetention())
        );
    }

    /**
     * Creates a factory from the default configuration (config.yaml).
     */
    public static SchedulerFactory create() {
        return create("config.yaml");
    }

    /**
     * Creates a replica joining the cluster formed by {@code sharedState}.
     */
    public static SchedulerFactory create(SchedulerConfig config, RagPipeline ragPipeline, SharedState sharedState) {
        return new SchedulerFactory(config, null, ragPipeline, Clock.systemUTC(), sharedState);
    }

    /**
     * Starts the scheduling loop and configuration watching.
     */
    public SchedulerFactory start() {
        pipeline.start();
        if (configLoader != null) {
            configLoader.startWatching(CONFIG_POLL_INTERVAL);
        }
        log.info("Scheduler started: replicaId={}", replicaId);
        return this;
    }

    public SchedulerPipeline getPipeline() {
        return pipeline;
    }

    public String getReplicaId() {
        return replicaId;
    }

    public SchedulerConfig getConfig() {
        return config;
    }

    public ConfigLoader getConfigLoader() {
        return configLoader;
    }

    public SharedState getSharedState() {
        return sharedState;
    }

    public TierPolicies getPolicies() {
        return settings.get().tierPolicies();
    }

    public SchedulingSettings getSettings() {
        return settings.get();
    }

    /**
     * Re-reads the configuration file. Changed scheduling settings reach this replica
     * through {@link #applySettings} before the method returns.
     *
     * @throws IllegalStateException if the replica was not configured from a file
     */
    public ReloadResult reloadConfiguration() {
        if (configLoader == null) {
            throw new IllegalStateException("Replica was not configured from a file");
        }
        return configLoader.reload();
    }

    public MetricsRegistry getMetricsRegistry() {
        return metricsRegistry;
    }

    public TokenBucketLimiter getLimiter() {
        return limiter;
    }

    public GlobalPriorityQueue getQueue() {
        return queue;
    }

    public LocalClaimBuffer getLocalBuffer() {
        return localBuffer;
    }

    public TickAllocator getTickAllocator() {
        return tickAllocator;
    }

    public NoisyNeighborGovernor getGovernor() {
        return governor;
    }

    public DeadLetterHandler getDeadLetterHandler() {
        return deadLetterHandler;
    }

    public LocalWorkerPool getWorkerPool() {
        return workerPool;
    }

    public Dispatcher getDispatcher() {
        return dispatcher;
    }

    public AdmissionController getAdmissionController() {
        return admissionController;
    }

    public Clock getClock() {
        return clock;
    }

    private RagPipeline createRagPipeline() {
        return new HttpRagPipeline(
                URI.create(config.getPipeline().getUrl()),
                Duration.ofMillis(config.getPipeline().getConnectTimeoutMs()),
                Duration.ofMillis(config.getPipeline().getRequestTimeoutMs())
        );
    }

    private void registerGauges() {
        for (TenantTier tier : TenantTier.values()) {
            metricsRegistry.registerQueueDepth(tier, () -> queue.depth(tier));
        }
        metricsRegistry.registerLocalBufferDepth(localBuffer::size);
        metricsRegistry.registerWorkersBusy(workerPool::busySlots);
        metricsRegistry.registerThrottledTenants(governor::throttledCount);
    }

    private void applySettings(SchedulingSettings previous, SchedulingSettings updated) {
        settings.set(updated);
        if (!updated.tierPolicies().equals(previous.tierPolicies())
                || updated.redistribution() != previous.redistribution()) {
            tickAllocator.updateAllocator(new FairShareAllocator(updated.tierPolicies(), updated.redistribution()));
        }
        log.info("Scheduling settings applied: replicaId={}, changed={}", replicaId, updated.changesFrom(previous));
    }

    @Override
    public void close() {
        log.info("Shutting down SchedulerFactory: replicaId={}", replicaId);

        try {
            pipeline.close();
        } catch (Exception e) {
            log.warn("Error closing pipeline", e);
        }

        try {
            governor.close();
        } catch (Exception e) {
            log.warn("Error closing governor", e);
        }

        try {
            metricsRegistry.close();
        } catch (Exception e) {
            log.warn("Error closing metrics registry", e);
        }

        if (configLoader != null) {
            try {
                configLoader.close();
            } catch (Exception e) {
                log.warn("Error closing config loader", e);
            }
        }

        log.info("SchedulerFactory shut down");
    }
}
