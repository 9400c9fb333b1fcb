package fr.lapetina.scheduler.domain.model;

import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicReference;

/**
 * One unit of admitted work.
 *
 * Identity, tenant, tier, arrival and deadline are fixed at admission. The status only
 * moves forward through compare-and-set transitions, so at most one owner can win any
 * given transition. The caller's future is completed exactly once.
 */
public final class ScheduledRequest {

    private final String requestId;
    private final String tenantId;
    private final TenantTier tier;
    private final Map<String, Object> payload;
    private final Instant arrivalTimestamp;
    private final Instant deadline;
    private final long sequence;

    private final AtomicReference<RequestStatus> status = new AtomicReference<>(RequestStatus.QUEUED);
    private final CompletableFuture<SchedulingOutcome> outcome = new CompletableFuture<>();
    private volatile Instant dispatchedAt;

    private ScheduledRequest(
            String requestId,
            String tenantId,
            TenantTier tier,
            Map<String, Object> payload,
            Instant arrivalTimestamp,
            Instant deadline,
            long sequence
    ) {
        this.requestId = Objects.requireNonNull(requestId, "Request ID is required");
        this.tenantId = Objects.requireNonNull(tenantId, "Tenant ID is required");
        this.tier = Objects.requireNonNull(tier, "Tier is required");
        this.payload = payload != null ? Collections.unmodifiableMap(new LinkedHashMap<>(payload)) : Map.of();
        this.arrivalTimestamp = Objects.requireNonNull(arrivalTimestamp, "Arrival timestamp is required");
        this.deadline = Objects.requireNonNull(deadline, "Deadline is required");
        this.sequence = sequence;
    }

    /**
     * Creates a queued request for an admitted query.
     *
     * @param query        the inbound query, its arrival timestamp is used when present
     * @param now          admission time, used as arrival when the query carries none
     * @param maxQueueWait how long the request may stay queued before it times out
     * @param sequence     monotonic tie-breaker for requests stamped with the same instant
     */
    public static ScheduledRequest admit(TenantQuery query, Instant now, Duration maxQueueWait, long sequence) {
        Instant arrival = query.arrivalTimestamp() != null ? query.arrivalTimestamp() : now;
        return new ScheduledRequest(
                UUID.randomUUID().toString(),
                query.tenantId(),
                query.tier(),
                query.payload(),
                arrival,
                arrival.plus(maxQueueWait),
                sequence
        );
    }

    public String requestId() {
        return requestId;
    }

    public String tenantId() {
        return tenantId;
    }

    public TenantTier tier() {
        return tier;
    }

    public Map<String, Object> payload() {
        return payload;
    }

    public Instant arrivalTimestamp() {
        return arrivalTimestamp;
    }

    public Instant deadline() {
        return deadline;
    }

    public long sequence() {
        return sequence;
    }

    public RequestStatus status() {
        return status.get();
    }

    public Instant dispatchedAt() {
        return dispatchedAt;
    }

    public PriorityKey priorityKey() {
        return new PriorityKey(tier.rank(), arrivalTimestamp, sequence);
    }

    /**
     * Moves the status from {@code expected} to {@code target}.
     *
     * @return false if another owner already moved the request
     */
    public boolean transition(RequestStatus expected, RequestStatus target) {
        return status.compareAndSet(expected, target);
    }

    /**
     * Marks the request as dispatched at the given instant.
     * Only succeeds from QUEUED.
     */
    public boolean markDispatched(Instant at) {
        if (status.compareAndSet(RequestStatus.QUEUED, RequestStatus.DISPATCHED)) {
            this.dispatchedAt = at;
            return true;
        }
        return false;
    }

    /**
     * A request is expired once its deadline lies strictly before {@code now}.
     */
    public boolean isExpired(Instant now) {
        return deadline.isBefore(now);
    }

    /**
     * Completes the caller's future.
     *
     * @return false if an outcome was already delivered
     */
    public boolean resolve(SchedulingOutcome result) {
        return outcome.complete(result);
    }

    public CompletableFuture<SchedulingOutcome> outcome() {
        return outcome;
    }

    public Duration waitedUntil(Instant at) {
        Duration waited = Duration.between(arrivalTimestamp, at);
        return waited.isNegative() ? Duration.ZERO : waited;
    }

    public RequestSnapshot snapshot() {
        return new RequestSnapshot(requestId, tenantId, tier, arrivalTimestamp, deadline, status.get(), payload);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return requestId.equals(((ScheduledRequest) o).requestId);
    }

    @Override
    public int hashCode() {
        return requestId.hashCode();
    }

    @Override
    public String toString() {
        return "ScheduledRequest{" +
                "requestId='" + requestId + '\'' +
                ", tenantId='" + tenantId + '\'' +
                ", tier=" + tier +
                ", status=" + status.get() +
                ", arrival=" + arrivalTimestamp +
                ", deadline=" + deadline +
                '}';
    }
}
