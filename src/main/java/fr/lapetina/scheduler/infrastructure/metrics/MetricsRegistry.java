package fr.lapetina.scheduler.infrastructure.metrics;

import fr.lapetina.scheduler.domain.model.ErrorType;
import fr.lapetina.scheduler.domain.model.FairShareAllocation;
import fr.lapetina.scheduler.domain.model.RequestStatus;
import fr.lapetina.scheduler.domain.model.TenantTier;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.binder.jvm.JvmGcMetrics;
import io.micrometer.core.instrument.binder.jvm.JvmMemoryMetrics;
import io.micrometer.core.instrument.binder.jvm.JvmThreadMetrics;
import io.micrometer.core.instrument.binder.system.ProcessorMetrics;
import io.micrometer.prometheus.PrometheusConfig;
import io.micrometer.prometheus.PrometheusMeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Supplier;

/**
 * Centralized scheduler metrics using Micrometer.
 *
 * Provides:
 * - Queue depth per tier, local buffer depth and busy worker gauges
 * - Queue wait and dispatch latency timers per tier
 * - Rejection counters by reason and terminal outcome counters
 * - Credit granted / consumed counters and utilization per tier
 * - JVM and system metrics, Prometheus exposition
 */
public final class MetricsRegistry implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(MetricsRegistry.class);

    private final PrometheusMeterRegistry registry;
    private final String prefix;

    // Cache for dynamic meters
    private final ConcurrentHashMap<String, Timer> waitTimers = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, Timer> latencyTimers = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, Counter> rejectionCounters = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, Counter> outcomeCounters = new ConcurrentHashMap<>();
    private final Map<TenantTier, Counter> creditsGranted = new EnumMap<>(TenantTier.class);
    private final Map<TenantTier, Counter> creditsConsumed = new EnumMap<>(TenantTier.class);

    // Utilization of the last closed tick, in thousandths
    private final Map<TenantTier, AtomicLong> creditUtilization = new EnumMap<>(TenantTier.class);

    public MetricsRegistry(String prefix) {
        this.prefix = prefix;
        this.registry = new PrometheusMeterRegistry(PrometheusConfig.DEFAULT);

        new JvmMemoryMetrics().bindTo(registry);
        new JvmGcMetrics().bindTo(registry);
        new JvmThreadMetrics().bindTo(registry);
        new ProcessorMetrics().bindTo(registry);

        for (TenantTier tier : TenantTier.values()) {
            creditsGranted.put(tier, Counter.builder(prefix + "_credits_granted_total")
                    .description("Dispatch credits granted by the fair-share allocator")
                    .tag("tier", tier.tag())
                    .register(registry));
            creditsConsumed.put(tier, Counter.builder(prefix + "_credits_consumed_total")
                    .description("Dispatch credits consumed by claims")
                    .tag("tier", tier.tag())
                    .register(registry));
            AtomicLong utilization = new AtomicLong(0);
            creditUtilization.put(tier, utilization);
            Gauge.builder(prefix + "_credit_utilization", utilization, u -> u.get() / 1000.0)
                    .description("Consumed / granted credits of the last closed tick")
                    .tag("tier", tier.tag())
                    .register(registry);
        }

        log.info("MetricsRegistry initialized with prefix: {}", prefix);
    }

    public MetricsRegistry() {
        this("tenant_scheduler");
    }

    public void registerQueueDepth(TenantTier tier, Supplier<Number> depth) {
        Gauge.builder(prefix + "_queue_depth", depth)
                .description("Pending requests in the global queue")
                .tag("tier", tier.tag())
                .register(registry);
    }

    public void registerLocalBufferDepth(Supplier<Number> depth) {
        Gauge.builder(prefix + "_local_buffer_depth", depth)
                .description("Claimed requests waiting for a worker slot on this replica")
                .register(registry);
    }

    public void registerWorkersBusy(Supplier<Number> busy) {
        Gauge.builder(prefix + "_workers_busy", busy)
                .description("Occupied worker slots")
                .register(registry);
    }

    public void registerThrottledTenants(Supplier<Number> throttled) {
        Gauge.builder(prefix + "_throttled_tenants", throttled)
                .description("Tenants currently throttled by the noisy-neighbor governor")
                .register(registry);
    }

    /**
     * Records the time a request spent queued before dispatch or timeout.
     */
    public void recordQueueWait(TenantTier tier, Duration wait) {
        waitTimers.computeIfAbsent(tier.tag(), k ->
                Timer.builder(prefix + "_queue_wait")
                        .description("Time from arrival to dispatch")
                        .tag("tier", tier.tag())
                        .publishPercentileHistogram()
                        .publishPercentiles(0.5, 0.9, 0.95, 0.99)
                        .register(registry)
        ).record(wait);
    }

    /**
     * Records the pipeline call latency of a dispatched request.
     */
    public void recordDispatchLatency(TenantTier tier, RequestStatus outcome, Duration latency) {
        String outcomeTag = outcome.name().toLowerCase(Locale.ROOT);
        String key = tier.tag() + ":" + outcomeTag;
        latencyTimers.computeIfAbsent(key, k ->
                Timer.builder(prefix + "_dispatch_latency")
                        .description("RAG pipeline call latency")
                        .tag("tier", tier.tag())
                        .tag("outcome", outcomeTag)
                        .publishPercentileHistogram()
                        .register(registry)
        ).record(latency);
    }

    public void incrementRejection(ErrorType reason) {
        String tag = rejectionTag(reason);
        rejectionCounters.computeIfAbsent(tag, k ->
                Counter.builder(prefix + "_rejections_total")
                        .description("Requests refused or expired, by reason")
                        .tag("reason", tag)
                        .register(registry)
        ).increment();
    }

    public void incrementOutcome(TenantTier tier, RequestStatus status) {
        String outcomeTag = status.name().toLowerCase(Locale.ROOT);
        String key = tier.tag() + ":" + outcomeTag;
        outcomeCounters.computeIfAbsent(key, k ->
                Counter.builder(prefix + "_outcomes_total")
                        .description("Terminal request outcomes")
                        .tag("tier", tier.tag())
                        .tag("outcome", outcomeTag)
                        .register(registry)
        ).increment();
    }

    /**
     * Records the credits of a closed tick.
     */
    public void recordTick(List<FairShareAllocation> allocations) {
        for (FairShareAllocation allocation : allocations) {
            creditsGranted.get(allocation.tier()).increment(allocation.creditsGranted());
            creditsConsumed.get(allocation.tier()).increment(allocation.creditsConsumed());
            creditUtilization.get(allocation.tier()).set(Math.round(allocation.utilization() * 1000));
        }
    }

    static String rejectionTag(ErrorType reason) {
        return switch (reason) {
            case QUEUE_TIMEOUT -> "timed_out";
            default -> reason.tag();
        };
    }

    /**
     * Returns the Prometheus scrape output.
     */
    public String scrape() {
        return registry.scrape();
    }

    /**
     * Returns the underlying Micrometer registry.
     */
    public MeterRegistry getRegistry() {
        return registry;
    }

    @Override
    public void close() {
        registry.close();
    }
}
