package fr.lapetina.scheduler.domain.model;

import java.util.Map;

/**
 * Point-in-time view of pending work: global queue per tier, this replica's
 * claim buffer, and the DLQ size.
 */
public record DepthSnapshot(Map<TenantTier, Integer> global, int local, int dlq) {
    public DepthSnapshot {
        global = Map.copyOf(global);
    }

    public int globalTotal() {
        return global.values().stream().mapToInt(Integer::intValue).sum();
    }
}
