package fr.lapetina.scheduler.infrastructure.config;

import fr.lapetina.scheduler.domain.model.TenantTier;
import fr.lapetina.scheduler.domain.model.TierPolicies;
import fr.lapetina.scheduler.domain.model.TierPolicy;
import fr.lapetina.scheduler.governor.GovernorSettings;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.UUID;

/**
 * Root configuration object for a scheduler replica.
 * Designed to be populated from YAML.
 */
public class SchedulerConfig {

    private ReplicaConfig replica = new ReplicaConfig();
    private WorkersConfig workers = new WorkersConfig();
    private SchedulingConfig scheduling = new SchedulingConfig();
    private GovernorConfig governor = new GovernorConfig();
    private List<TierConfig> tiers = new ArrayList<>();
    private PipelineConfig pipeline = new PipelineConfig();
    private ServerConfig server = new ServerConfig();
    private MetricsConfig metrics = new MetricsConfig();

    // Getters and Setters
    public ReplicaConfig getReplica() { return replica; }
    public void setReplica(ReplicaConfig replica) { this.replica = replica; }

    public WorkersConfig getWorkers() { return workers; }
    public void setWorkers(WorkersConfig workers) { this.workers = workers; }

    public SchedulingConfig getScheduling() { return scheduling; }
    public void setScheduling(SchedulingConfig scheduling) { this.scheduling = scheduling; }

    public GovernorConfig getGovernor() { return governor; }
    public void setGovernor(GovernorConfig governor) { this.governor = governor; }

    public List<TierConfig> getTiers() { return tiers; }
    public void setTiers(List<TierConfig> tiers) { this.tiers = tiers; }

    public PipelineConfig getPipeline() { return pipeline; }
    public void setPipeline(PipelineConfig pipeline) { this.pipeline = pipeline; }

    public ServerConfig getServer() { return server; }
    public void setServer(ServerConfig server) { this.server = server; }

    public MetricsConfig getMetrics() { return metrics; }
    public void setMetrics(MetricsConfig metrics) { this.metrics = metrics; }

    /**
     * Builds the tier policies, falling back to the built-in defaults when no tier is configured.
     *
     * @throws IllegalArgumentException if a tier is missing, duplicated or inconsistent
     */
    public TierPolicies toTierPolicies() {
        if (tiers == null || tiers.isEmpty()) {
            return TierPolicies.defaults();
        }
        List<TierPolicy> policies = new ArrayList<>();
        for (TierConfig tier : tiers) {
            policies.add(tier.toPolicy());
        }
        return TierPolicies.of(policies);
    }

    public GovernorSettings toGovernorSettings() {
        return new GovernorSettings(
                Duration.ofSeconds(governor.getWindowSeconds()),
                Duration.ofMillis(governor.getSustainedPeriodMs()),
                Duration.ofMillis(governor.getCooldownPeriodMs()),
                governor.getThrottleRateFactor()
        );
    }

    /**
     * Returns the configured replica id, or a generated {@code replica-xxxxxxxx} one.
     */
    public String resolveReplicaId() {
        String id = replica.getId();
        if (id != null && !id.isBlank()) {
            return id;
        }
        return "replica-" + UUID.randomUUID().toString().substring(0, 8);
    }

    /**
     * Credits offered per tick, the worker pool size unless set explicitly.
     */
    public int effectiveCreditsPerTick() {
        return scheduling.getCreditsPerTick() > 0 ? scheduling.getCreditsPerTick() : workers.getPoolSize();
    }

    /**
     * Checks the startup-only sections, then resolves the reloadable ones.
     *
     * @return the scheduling settings this configuration describes
     * @throws IllegalArgumentException on the first inconsistency
     */
    public SchedulingSettings validate() {
        if (workers.getPoolSize() < 1) {
            throw new IllegalArgumentException("workers.poolSize must be >= 1");
        }
        if (workers.getLocalBufferSize() < 0) {
            throw new IllegalArgumentException("workers.localBufferSize must be >= 0");
        }
        if (scheduling.getTickIntervalMs() < 1) {
            throw new IllegalArgumentException("scheduling.tickIntervalMs must be >= 1");
        }
        if (scheduling.getCreditsPerTick() < 0) {
            throw new IllegalArgumentException("scheduling.creditsPerTick must be >= 0");
        }
        if (Integer.bitCount(scheduling.getRingBufferSize()) != 1) {
            throw new IllegalArgumentException("scheduling.ringBufferSize must be a power of 2");
        }
        if (scheduling.getDlqRetention() < 1) {
            throw new IllegalArgumentException("scheduling.dlqRetention must be >= 1");
        }
        if (governor.getScanIntervalMs() < 1) {
            throw new IllegalArgumentException("governor.scanIntervalMs must be >= 1");
        }
        return SchedulingSettings.from(this);
    }

    /**
     * Settings that differ from {@code previous} but only take effect after a restart.
     */
    public List<String> restartOnlyChangesFrom(SchedulerConfig previous) {
        List<String> changed = new ArrayList<>();
        if (workers.getPoolSize() != previous.workers.getPoolSize()) {
            changed.add("workers.poolSize");
        }
        if (workers.getLocalBufferSize() != previous.workers.getLocalBufferSize()) {
            changed.add("workers.localBufferSize");
        }
        if (scheduling.getTickIntervalMs() != previous.scheduling.getTickIntervalMs()) {
            changed.add("scheduling.tickIntervalMs");
        }
        if (scheduling.getCreditsPerTick() != previous.scheduling.getCreditsPerTick()) {
            changed.add("scheduling.creditsPerTick");
        }
        if (scheduling.getRingBufferSize() != previous.scheduling.getRingBufferSize()) {
            changed.add("scheduling.ringBufferSize");
        }
        if (!Objects.equals(pipeline.getUrl(), previous.pipeline.getUrl())) {
            changed.add("pipeline.url");
        }
        if (server.getPort() != previous.server.getPort()) {
            changed.add("server.port");
        }
        return changed;
    }

    /**
     * Replica identity.
     */
    public static class ReplicaConfig {
        private String id;

        public String getId() { return id; }
        public void setId(String id) { this.id = id; }
    }

    /**
     * Local worker pool configuration.
     */
    public static class WorkersConfig {
        private int poolSize = 10;
        private int localBufferSize = 100;
        private long shutdownGraceMs = 120_000;

        public int getPoolSize() { return poolSize; }
        public void setPoolSize(int poolSize) { this.poolSize = poolSize; }

        public int getLocalBufferSize() { return localBufferSize; }
        public void setLocalBufferSize(int localBufferSize) { this.localBufferSize = localBufferSize; }

        public long getShutdownGraceMs() { return shutdownGraceMs; }
        public void setShutdownGraceMs(long shutdownGraceMs) { this.shutdownGraceMs = shutdownGraceMs; }
    }

    /**
     * Tick, queue and ring buffer configuration.
     */
    public static class SchedulingConfig {
        private long tickIntervalMs = 100;
        private long maxQueueWaitMs = 30_000;
        private int maxQueueSize = 10_000;
        private int creditsPerTick = 0;
        private String redistribution = "CAP_BOUNDED";
        private int dlqRetention = 10_000;
        private int ringBufferSize = 1024;
        private String waitStrategy = "blocking";

        public long getTickIntervalMs() { return tickIntervalMs; }
        public void setTickIntervalMs(long tickIntervalMs) { this.tickIntervalMs = tickIntervalMs; }

        public long getMaxQueueWaitMs() { return maxQueueWaitMs; }
        public void setMaxQueueWaitMs(long maxQueueWaitMs) { this.maxQueueWaitMs = maxQueueWaitMs; }

        public int getMaxQueueSize() { return maxQueueSize; }
        public void setMaxQueueSize(int maxQueueSize) { this.maxQueueSize = maxQueueSize; }

        public int getCreditsPerTick() { return creditsPerTick; }
        public void setCreditsPerTick(int creditsPerTick) { this.creditsPerTick = creditsPerTick; }

        public String getRedistribution() { return redistribution; }
        public void setRedistribution(String redistribution) { this.redistribution = redistribution; }

        public int getDlqRetention() { return dlqRetention; }
        public void setDlqRetention(int dlqRetention) { this.dlqRetention = dlqRetention; }

        public int getRingBufferSize() { return ringBufferSize; }
        public void setRingBufferSize(int ringBufferSize) { this.ringBufferSize = ringBufferSize; }

        public String getWaitStrategy() { return waitStrategy; }
        public void setWaitStrategy(String waitStrategy) { this.waitStrategy = waitStrategy; }
    }

    /**
     * Noisy-neighbor governor configuration.
     */
    public static class GovernorConfig {
        private long scanIntervalMs = 1000;
        private long windowSeconds = 60;
        private long sustainedPeriodMs = 5000;
        private long cooldownPeriodMs = 10_000;
        private double throttleRateFactor = 0.5;

        public long getScanIntervalMs() { return scanIntervalMs; }
        public void setScanIntervalMs(long scanIntervalMs) { this.scanIntervalMs = scanIntervalMs; }

        public long getWindowSeconds() { return windowSeconds; }
        public void setWindowSeconds(long windowSeconds) { this.windowSeconds = windowSeconds; }

        public long getSustainedPeriodMs() { return sustainedPeriodMs; }
        public void setSustainedPeriodMs(long sustainedPeriodMs) { this.sustainedPeriodMs = sustainedPeriodMs; }

        public long getCooldownPeriodMs() { return cooldownPeriodMs; }
        public void setCooldownPeriodMs(long cooldownPeriodMs) { this.cooldownPeriodMs = cooldownPeriodMs; }

        public double getThrottleRateFactor() { return throttleRateFactor; }
        public void setThrottleRateFactor(double throttleRateFactor) { this.throttleRateFactor = throttleRateFactor; }
    }

    /**
     * Policy of one tenant tier.
     */
    public static class TierConfig {
        private String name;
        private int fairSharePercent;
        private int hardCapPercent;
        private double sustainedRate;
        private long burstCapacity;

        public String getName() { return name; }
        public void setName(String name) { this.name = name; }

        public int getFairSharePercent() { return fairSharePercent; }
        public void setFairSharePercent(int fairSharePercent) { this.fairSharePercent = fairSharePercent; }

        public int getHardCapPercent() { return hardCapPercent; }
        public void setHardCapPercent(int hardCapPercent) { this.hardCapPercent = hardCapPercent; }

        public double getSustainedRate() { return sustainedRate; }
        public void setSustainedRate(double sustainedRate) { this.sustainedRate = sustainedRate; }

        public long getBurstCapacity() { return burstCapacity; }
        public void setBurstCapacity(long burstCapacity) { this.burstCapacity = burstCapacity; }

        TierPolicy toPolicy() {
            return new TierPolicy(TenantTier.fromName(name), fairSharePercent, hardCapPercent,
                    sustainedRate, burstCapacity);
        }
    }

    /**
     * Downstream RAG pipeline endpoint.
     */
    public static class PipelineConfig {
        private String url = "http://localhost:8000/internal/rag/execute";
        private long connectTimeoutMs = 5000;
        private long requestTimeoutMs = 120_000;

        public String getUrl() { return url; }
        public void setUrl(String url) { this.url = url; }

        public long getConnectTimeoutMs() { return connectTimeoutMs; }
        public void setConnectTimeoutMs(long connectTimeoutMs) { this.connectTimeoutMs = connectTimeoutMs; }

        public long getRequestTimeoutMs() { return requestTimeoutMs; }
        public void setRequestTimeoutMs(long requestTimeoutMs) { this.requestTimeoutMs = requestTimeoutMs; }
    }

    /**
     * Operator HTTP server configuration.
     */
    public static class ServerConfig {
        private boolean enabled = true;
        private int port = 8081;
        private int backlog = 100;
        private int threads = 4;

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }

        public int getPort() { return port; }
        public void setPort(int port) { this.port = port; }

        public int getBacklog() { return backlog; }
        public void setBacklog(int backlog) { this.backlog = backlog; }

        public int getThreads() { return threads; }
        public void setThreads(int threads) { this.threads = threads; }
    }

    /**
     * Metrics configuration.
     */
    public static class MetricsConfig {
        private boolean enabled = true;
        private String prefix = "tenant_scheduler";

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }

        public String getPrefix() { return prefix; }
        public void setPrefix(String prefix) { this.prefix = prefix; }
    }
}
