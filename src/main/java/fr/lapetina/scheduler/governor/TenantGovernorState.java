package fr.lapetina.scheduler.governor;

import java.time.Duration;
import java.time.Instant;

/**
 * Immutable control-loop state of one tenant.
 *
 * <pre>
 * NORMAL    --(ratio &gt; cap for sustainedPeriod)--&gt;  THROTTLED
 * THROTTLED --(ratio &lt; cap for cooldownPeriod)---&gt;  NORMAL
 * </pre>
 *
 * @param overCapSince  first scan of the current over-cap streak while NORMAL, else null
 * @param underCapSince first scan of the current under-cap streak while THROTTLED, else null
 * @param ratio         consumption ratio seen at the last scan
 * @param changedAt     when the state last changed
 */
public record TenantGovernorState(
        GovernorState state,
        Instant overCapSince,
        Instant underCapSince,
        double ratio,
        Instant changedAt
) {
    public static TenantGovernorState initial(Instant now) {
        return new TenantGovernorState(GovernorState.NORMAL, null, null, 0.0, now);
    }

    public boolean isThrottled() {
        return state == GovernorState.THROTTLED;
    }

    /**
     * Applies one scan observation.
     *
     * @param ratio     tenant consumption over the window as a fraction of cluster capacity
     * @param cap       hard cap as a fraction
     * @param sustained how long the ratio must stay above the cap before throttling
     * @param cooldown  how long the ratio must stay below the cap before releasing
     */
    public TenantGovernorState observe(double ratio, double cap, Instant now, Duration sustained, Duration cooldown) {
        if (state == GovernorState.NORMAL) {
            if (ratio <= cap) {
                return new TenantGovernorState(GovernorState.NORMAL, null, null, ratio, changedAt);
            }
            Instant since = overCapSince != null ? overCapSince : now;
            if (!Duration.between(since, now).minus(sustained).isNegative()) {
                return new TenantGovernorState(GovernorState.THROTTLED, null, null, ratio, now);
            }
            return new TenantGovernorState(GovernorState.NORMAL, since, null, ratio, changedAt);
        }

        if (ratio >= cap) {
            return new TenantGovernorState(GovernorState.THROTTLED, null, null, ratio, changedAt);
        }
        Instant since = underCapSince != null ? underCapSince : now;
        if (!Duration.between(since, now).minus(cooldown).isNegative()) {
            return new TenantGovernorState(GovernorState.NORMAL, null, null, ratio, now);
        }
        return new TenantGovernorState(GovernorState.THROTTLED, null, since, ratio, changedAt);
    }
}
