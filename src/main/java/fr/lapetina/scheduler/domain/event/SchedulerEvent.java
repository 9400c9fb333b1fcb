package fr.lapetina.scheduler.domain.event;

import fr.lapetina.scheduler.allocation.TickCredits;

import java.time.Instant;

/**
 * Event object for the LMAX Disruptor ring buffer.
 *
 * This is a mutable holder that gets reused across the ring buffer. It carries a
 * scheduling signal rather than a request: requests live in the global queue, events only
 * tell the scheduling loop that something changed.
 *
 * IMPORTANT: This class is intentionally mutable for Disruptor performance.
 * It should never be accessed outside the Disruptor pipeline handlers.
 */
public final class SchedulerEvent {

    private SchedulerEventType type;
    private Instant timestamp;
    private String requestId;

    // Filled in by handlers
    private TickCredits closedCredits;
    private int expiredCount;
    private int dispatchedCount;

    /**
     * Clears the event for reuse.
     */
    public void clear() {
        this.type = null;
        this.timestamp = null;
        this.requestId = null;
        this.closedCredits = null;
        this.expiredCount = 0;
        this.dispatchedCount = 0;
    }

    /**
     * Initializes the event with a new signal.
     *
     * @param requestId the request concerned, null for ticks
     */
    public void initialize(SchedulerEventType type, Instant timestamp, String requestId) {
        clear();
        this.type = type;
        this.timestamp = timestamp;
        this.requestId = requestId;
    }

    public boolean isTick() {
        return type == SchedulerEventType.TICK;
    }

    public SchedulerEventType getType() {
        return type;
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    public String getRequestId() {
        return requestId;
    }

    public TickCredits getClosedCredits() {
        return closedCredits;
    }

    public void setClosedCredits(TickCredits closedCredits) {
        this.closedCredits = closedCredits;
    }

    public int getExpiredCount() {
        return expiredCount;
    }

    public void setExpiredCount(int expiredCount) {
        this.expiredCount = expiredCount;
    }

    public int getDispatchedCount() {
        return dispatchedCount;
    }

    public void setDispatchedCount(int dispatchedCount) {
        this.dispatchedCount = dispatchedCount;
    }

    @Override
    public String toString() {
        return "SchedulerEvent{" +
                "type=" + type +
                ", timestamp=" + timestamp +
                ", requestId='" + requestId + '\'' +
                ", expired=" + expiredCount +
                ", dispatched=" + dispatchedCount +
                '}';
    }
}
