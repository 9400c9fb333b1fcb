package fr.lapetina.scheduler.infrastructure.config;

import fr.lapetina.scheduler.allocation.RedistributionPolicy;
import fr.lapetina.scheduler.domain.model.TierPolicies;
import fr.lapetina.scheduler.governor.GovernorSettings;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * The part of the configuration a running replica picks up on reload.
 * Everything else in {@link SchedulerConfig} is read once at startup.
 */
public record SchedulingSettings(
        TierPolicies tierPolicies,
        RedistributionPolicy redistribution,
        GovernorSettings governor,
        int maxQueueSize,
        Duration maxQueueWait
) {
    public SchedulingSettings {
        Objects.requireNonNull(tierPolicies, "Tier policies are required");
        Objects.requireNonNull(redistribution, "Redistribution policy is required");
        Objects.requireNonNull(governor, "Governor settings are required");
        Objects.requireNonNull(maxQueueWait, "Maximum queue wait is required");
        if (maxQueueSize < 1) {
            throw new IllegalArgumentException("scheduling.maxQueueSize must be >= 1");
        }
        if (maxQueueWait.isZero() || maxQueueWait.isNegative()) {
            throw new IllegalArgumentException("scheduling.maxQueueWaitMs must be >= 1");
        }
        if (governor.sustainedPeriod().compareTo(governor.window()) > 0) {
            throw new IllegalArgumentException("governor.sustainedPeriodMs must not exceed the window");
        }
    }

    /**
     * Resolves the domain objects behind the scheduling sections of {@code config}.
     *
     * @throws IllegalArgumentException on the first invalid value
     */
    public static SchedulingSettings from(SchedulerConfig config) {
        SchedulerConfig.SchedulingConfig scheduling = config.getScheduling();
        return new SchedulingSettings(
                config.toTierPolicies(),
                redistributionOf(scheduling.getRedistribution()),
                config.toGovernorSettings(),
                scheduling.getMaxQueueSize(),
                Duration.ofMillis(scheduling.getMaxQueueWaitMs())
        );
    }

    private static RedistributionPolicy redistributionOf(String name) {
        try {
            return RedistributionPolicy.fromName(name);
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("scheduling.redistribution must be CAP_BOUNDED or WORK_CONSERVING, got '"
                    + name.toUpperCase(Locale.ROOT) + "'", e);
        }
    }

    /**
     * Names of the sections that differ from {@code previous}, empty when nothing changed.
     */
    public List<String> changesFrom(SchedulingSettings previous) {
        List<String> changed = new ArrayList<>();
        if (!tierPolicies.equals(previous.tierPolicies)) {
            changed.add("tiers");
        }
        if (redistribution != previous.redistribution) {
            changed.add("redistribution");
        }
        if (!governor.equals(previous.governor)) {
            changed.add("governor");
        }
        if (maxQueueSize != previous.maxQueueSize) {
            changed.add("maxQueueSize");
        }
        if (!maxQueueWait.equals(previous.maxQueueWait)) {
            changed.add("maxQueueWait");
        }
        return changed;
    }
}
