package fr.lapetina.scheduler.allocation;

import java.util.Locale;

/**
 * How leftover capacity of a tick is handed to backlogged tiers.
 */
public enum RedistributionPolicy {
    /** A tier never receives more than its hard cap of the tick's capacity */
    CAP_BOUNDED,

    /** A single active tier may absorb the whole capacity; the governor caps tenants */
    WORK_CONSERVING;

    public static RedistributionPolicy fromName(String name) {
        if (name == null || name.isBlank()) {
            return CAP_BOUNDED;
        }
        return valueOf(name.trim().toUpperCase(Locale.ROOT).replace('-', '_'));
    }
}
