package fr.lapetina.scheduler.domain.model;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Inbound unit of work handed over by the API layer once the tenant is authenticated.
 * Immutable and thread-safe.
 */
public record TenantQuery(
        String tenantId,
        TenantTier tier,
        Map<String, Object> payload,
        Instant arrivalTimestamp
) {
    public TenantQuery {
        Objects.requireNonNull(tier, "Tier is required");
        payload = payload != null ? Collections.unmodifiableMap(new LinkedHashMap<>(payload)) : Map.of();
    }

    /**
     * Creates a query whose arrival time is stamped by the scheduler at admission.
     */
    public static TenantQuery of(String tenantId, TenantTier tier, Map<String, Object> payload) {
        return new TenantQuery(tenantId, tier, payload, null);
    }

    public TenantQuery withArrival(Instant arrival) {
        return new TenantQuery(tenantId, tier, payload, arrival);
    }
}
