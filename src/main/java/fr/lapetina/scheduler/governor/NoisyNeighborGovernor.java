package fr.lapetina.scheduler.governor;

import fr.lapetina.scheduler.domain.model.TenantTier;
import fr.lapetina.scheduler.domain.model.TierPolicies;
import fr.lapetina.scheduler.limiter.TokenBucketLimiter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Supplier;

/**
 * Background feedback loop enforcing the per-tenant hard cap.
 *
 * Each scan compares every active tenant's dispatches over the sliding window with the
 * cluster capacity granted over the same window. A tenant above its tier's hard cap for the
 * sustained period is throttled: its token refill rate is reduced and the dispatcher limits
 * how many of its requests may be claimed per tick. Throttled requests stay queued.
 */
public final class NoisyNeighborGovernor implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(NoisyNeighborGovernor.class);

    private final ConsumptionLedger ledger;
    private final TokenBucketLimiter limiter;
    private final Supplier<TierPolicies> policies;
    private final Supplier<GovernorSettings> settings;
    private final Clock clock;
    private final Duration scanInterval;
    private final ScheduledExecutorService scheduler;
    private final AtomicBoolean running = new AtomicBoolean(false);

    private final ConcurrentHashMap<String, TenantGovernorState> states = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, TenantTier> tiers = new ConcurrentHashMap<>();

    public NoisyNeighborGovernor(
            ConsumptionLedger ledger,
            TokenBucketLimiter limiter,
            Supplier<TierPolicies> policies,
            Supplier<GovernorSettings> settings,
            Clock clock,
            Duration scanInterval
    ) {
        this.ledger = ledger;
        this.limiter = limiter;
        this.policies = policies;
        this.settings = settings;
        this.clock = clock;
        this.scanInterval = scanInterval;
        this.scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "noisy-neighbor-governor");
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * Starts the periodic scan.
     */
    public void start() {
        if (running.compareAndSet(false, true)) {
            scheduler.scheduleWithFixedDelay(
                    this::scanSafely,
                    scanInterval.toMillis(),
                    scanInterval.toMillis(),
                    TimeUnit.MILLISECONDS
            );
            log.info("Noisy-neighbor governor started: scanInterval={}", scanInterval);
        }
    }

    private void scanSafely() {
        try {
            scan(clock.instant());
        } catch (Exception e) {
            log.error("Noisy-neighbor scan failed", e);
        }
    }

    /**
     * Runs one control-loop iteration at {@code now}.
     */
    public void scan(Instant now) {
        GovernorSettings current = settings.get();
        TierPolicies tierPolicies = policies.get();
        Instant since = now.minus(current.window());
        long capacity = ledger.capacity(since);

        Map<String, TenantTier> active = ledger.tenantsSince(since);
        tiers.putAll(active);
        Set<String> tenants = new HashSet<>(active.keySet());
        tenants.addAll(states.keySet());

        for (String tenantId : tenants) {
            TenantTier tier = tiers.get(tenantId);
            if (tier == null) {
                continue;
            }
            long dispatched = active.containsKey(tenantId) ? ledger.dispatches(tenantId, since) : 0;
            double ratio = capacity > 0 ? (double) dispatched / capacity : 0.0;
            double cap = tierPolicies.get(tier).hardCapPercent() / 100.0;

            TenantGovernorState previous = states.getOrDefault(tenantId, TenantGovernorState.initial(now));
            TenantGovernorState next = previous.observe(
                    ratio, cap, now, current.sustainedPeriod(), current.cooldownPeriod());

            if (next.state() != previous.state()) {
                onTransition(tenantId, tier, previous, next, current);
            }

            if (next.state() == GovernorState.NORMAL && next.overCapSince() == null && dispatched == 0) {
                states.remove(tenantId);
                tiers.remove(tenantId);
            } else {
                states.put(tenantId, next);
            }
        }

        ledger.prune(since.minusSeconds(1));
        log.debug("Noisy-neighbor scan: at={}, windowCapacity={}, tenants={}, throttled={}",
                now, capacity, tenants.size(), throttledCount());
    }

    private void onTransition(
            String tenantId,
            TenantTier tier,
            TenantGovernorState previous,
            TenantGovernorState next,
            GovernorSettings current
    ) {
        if (next.isThrottled()) {
            limiter.applyThrottle(tenantId, current.throttleRateFactor());
            log.warn("Tenant throttled: tenantId={}, tier={}, ratio={}, hardCapPercent={}",
                    tenantId, tier, String.format("%.3f", next.ratio()),
                    policies.get().get(tier).hardCapPercent());
        } else {
            limiter.clearThrottle(tenantId);
            log.info("Tenant released: tenantId={}, tier={}, ratio={}, throttledFor={}",
                    tenantId, tier, String.format("%.3f", next.ratio()),
                    Duration.between(previous.changedAt(), next.changedAt()));
        }
    }

    public boolean isThrottled(String tenantId) {
        TenantGovernorState state = states.get(tenantId);
        return state != null && state.isThrottled();
    }

    /**
     * Noisy-neighbor score: the tenant's share of window capacity at the last scan.
     */
    public double score(String tenantId) {
        TenantGovernorState state = states.get(tenantId);
        return state != null ? state.ratio() : 0.0;
    }

    public GovernorState state(String tenantId) {
        TenantGovernorState state = states.get(tenantId);
        return state != null ? state.state() : GovernorState.NORMAL;
    }

    /**
     * Most requests of a throttled tenant that may be claimed in one tick of the given capacity.
     */
    public int perTickDequeueLimit(TenantTier tier, int capacity) {
        int hardCap = policies.get().get(tier).hardCapPercent();
        return Math.max(1, (int) ((long) hardCap * capacity / 100));
    }

    /**
     * Throttled tenants with their last consumption ratio.
     */
    public Map<String, Double> throttledTenants() {
        Map<String, Double> throttled = new HashMap<>();
        states.forEach((tenantId, state) -> {
            if (state.isThrottled()) {
                throttled.put(tenantId, state.ratio());
            }
        });
        return throttled;
    }

    public int throttledCount() {
        int count = 0;
        for (TenantGovernorState state : states.values()) {
            if (state.isThrottled()) {
                count++;
            }
        }
        return count;
    }

    @Override
    public void close() {
        if (running.compareAndSet(true, false)) {
            scheduler.shutdown();
            try {
                if (!scheduler.awaitTermination(5, TimeUnit.SECONDS)) {
                    scheduler.shutdownNow();
                }
            } catch (InterruptedException e) {
                scheduler.shutdownNow();
                Thread.currentThread().interrupt();
            }
            log.info("Noisy-neighbor governor stopped");
        } else {
            scheduler.shutdownNow();
        }
    }
}
