package fr.lapetina.scheduler.governor;

import java.time.Duration;
import java.util.Objects;

/**
 * Tuning of the noisy-neighbor control loop.
 *
 * @param window             sliding window over which consumption is measured
 * @param sustainedPeriod    time above the cap before a tenant is throttled
 * @param cooldownPeriod     time below the cap before a tenant is released
 * @param throttleRateFactor multiplier applied to the tenant's sustained token rate while throttled
 */
public record GovernorSettings(
        Duration window,
        Duration sustainedPeriod,
        Duration cooldownPeriod,
        double throttleRateFactor
) {
    public GovernorSettings {
        Objects.requireNonNull(window, "Window is required");
        Objects.requireNonNull(sustainedPeriod, "Sustained period is required");
        Objects.requireNonNull(cooldownPeriod, "Cooldown period is required");
        if (window.isZero() || window.isNegative()) {
            throw new IllegalArgumentException("Window must be positive");
        }
        if (!(throttleRateFactor > 0.0) || throttleRateFactor > 1.0) {
            throw new IllegalArgumentException("throttleRateFactor must be within (0, 1]");
        }
    }

    public static GovernorSettings defaults() {
        return new GovernorSettings(Duration.ofSeconds(60), Duration.ofSeconds(5), Duration.ofSeconds(10), 0.5);
    }
}
