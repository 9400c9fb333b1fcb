package fr.lapetina.scheduler.support;

import fr.lapetina.scheduler.SchedulerFactory;
import fr.lapetina.scheduler.SharedState;
import fr.lapetina.scheduler.allocation.RedistributionPolicy;
import fr.lapetina.scheduler.domain.model.ScheduledRequest;
import fr.lapetina.scheduler.domain.model.TenantQuery;
import fr.lapetina.scheduler.domain.model.TenantTier;
import fr.lapetina.scheduler.infrastructure.config.ConfigLoader;
import fr.lapetina.scheduler.infrastructure.config.SchedulerConfig;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Scheduler factory wired to a {@link StubRagPipeline}.
 *
 * Integration tests start it like a real replica. Simulation tests never start it and
 * drive the scheduling loop one tick at a time through {@link #tick(Instant)}.
 */
public final class TestSchedulerFactory extends SchedulerFactory {

    private final StubRagPipeline rag;

    private TestSchedulerFactory(
            SchedulerConfig config,
            ConfigLoader loader,
            StubRagPipeline rag,
            Clock clock,
            SharedState sharedState
    ) {
        super(config, loader, rag, clock, sharedState);
        this.rag = rag;
    }

    /**
     * Replica configured from test-config.yaml, real clock.
     */
    public static TestSchedulerFactory create() {
        ConfigLoader loader = new ConfigLoader("test-config.yaml");
        SchedulerConfig config = loader.load();
        return new TestSchedulerFactory(config, loader, new StubRagPipeline(), Clock.systemUTC(),
                SharedState.inMemory(config.getScheduling().getDlqRetention()));
    }

    /**
     * Replica backed by a configuration file, so reloads reach it through the loader.
     */
    public static TestSchedulerFactory fromFile(Path file, Clock clock) {
        ConfigLoader loader = new ConfigLoader(file.toString());
        SchedulerConfig config = loader.load();
        return new TestSchedulerFactory(config, loader, new StubRagPipeline(), clock,
                SharedState.inMemory(config.getScheduling().getDlqRetention()));
    }

    public static TestSchedulerFactory create(SchedulerConfig config, Clock clock, SharedState sharedState) {
        return new TestSchedulerFactory(config, null, new StubRagPipeline(), clock, sharedState);
    }

    public static TestSchedulerFactory create(SchedulerConfig config, Clock clock) {
        return create(config, clock, SharedState.inMemory(config.getScheduling().getDlqRetention()));
    }

    /**
     * Configuration for tick simulations: token buckets that never run dry, a queue that never
     * fills, 100ms ticks, 30s deadlines, a 60s governor window with 5s sustain and 10s cooldown.
     */
    public static SchedulerConfig simulationConfig(int creditsPerTick, RedistributionPolicy redistribution) {
        SchedulerConfig config = new SchedulerConfig();
        config.getReplica().setId("sim-replica");
        config.getWorkers().setPoolSize(creditsPerTick);
        config.getWorkers().setLocalBufferSize(creditsPerTick);
        config.getScheduling().setTickIntervalMs(100);
        config.getScheduling().setMaxQueueWaitMs(30_000);
        config.getScheduling().setMaxQueueSize(1_000_000);
        config.getScheduling().setCreditsPerTick(creditsPerTick);
        config.getScheduling().setRedistribution(redistribution.name());
        config.getScheduling().setDlqRetention(10_000);
        config.getServer().setEnabled(false);
        config.getMetrics().setPrefix("sim");

        List<SchedulerConfig.TierConfig> tiers = new ArrayList<>();
        tiers.add(tier("ENTERPRISE", 50, 60));
        tiers.add(tier("PROFESSIONAL", 30, 40));
        tiers.add(tier("STARTER", 15, 25));
        tiers.add(tier("FREE", 5, 10));
        config.setTiers(tiers);
        return config;
    }

    private static SchedulerConfig.TierConfig tier(String name, int share, int cap) {
        SchedulerConfig.TierConfig tier = new SchedulerConfig.TierConfig();
        tier.setName(name);
        tier.setFairSharePercent(share);
        tier.setHardCapPercent(cap);
        tier.setSustainedRate(1_000_000);
        tier.setBurstCapacity(1_000_000);
        return tier;
    }

    public StubRagPipeline rag() {
        return rag;
    }

    /**
     * One synchronous scheduling tick: expire, allocate, dispatch, governor scan.
     *
     * @return requests dispatched during the tick
     */
    public int tick(Instant now) {
        getDeadLetterHandler().scanAndExpire(now);
        getTickAllocator().allocate(now);
        int dispatched = getDispatcher().dispatchAvailable(getTickAllocator().current(), now);
        getGovernor().scan(now);
        return dispatched;
    }

    public ScheduledRequest admit(String tenantId, TenantTier tier) {
        return getAdmissionController().admit(TenantQuery.of(tenantId, tier, Map.of("query", "q")));
    }

    /**
     * Admits requests until the tier's global depth reaches {@code depth}.
     */
    public void topUp(String tenantId, TenantTier tier, int depth) {
        while (getQueue().depth(tier) < depth) {
            admit(tenantId, tier);
        }
    }
}
