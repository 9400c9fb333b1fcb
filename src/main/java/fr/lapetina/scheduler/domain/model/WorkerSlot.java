package fr.lapetina.scheduler.domain.model;

import java.time.Instant;
import java.util.concurrent.atomic.AtomicReference;

/**
 * One of the fixed concurrent execution slots of a replica.
 * A slot is free if and only if no request owns it.
 */
public final class WorkerSlot {

    private final int slotId;
    private final AtomicReference<String> occupyingRequestId = new AtomicReference<>();
    private volatile Instant acquiredAt;

    public WorkerSlot(int slotId) {
        this.slotId = slotId;
    }

    public int slotId() {
        return slotId;
    }

    public String occupyingRequestId() {
        return occupyingRequestId.get();
    }

    public Instant acquiredAt() {
        return acquiredAt;
    }

    public boolean isFree() {
        return occupyingRequestId.get() == null;
    }

    /**
     * Attempts to take the slot for a request.
     * @return true if the slot was free and is now owned by the request
     */
    public boolean tryAcquire(String requestId, Instant now) {
        if (occupyingRequestId.compareAndSet(null, requestId)) {
            acquiredAt = now;
            return true;
        }
        return false;
    }

    /**
     * Frees the slot if it is still owned by the request.
     */
    public boolean release(String requestId) {
        if (occupyingRequestId.compareAndSet(requestId, null)) {
            acquiredAt = null;
            return true;
        }
        return false;
    }

    @Override
    public String toString() {
        return "WorkerSlot{" +
                "slotId=" + slotId +
                ", request=" + occupyingRequestId.get() +
                '}';
    }
}
