package fr.lapetina.scheduler.queue;

import fr.lapetina.scheduler.domain.model.ScheduledRequest;

import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;

/**
 * Bounded FIFO of requests this replica has claimed from the global queue but not yet
 * handed to a worker slot. Counted as in-flight by the allocator, exactly once.
 */
public final class LocalClaimBuffer {

    private final int capacity;
    private final ArrayDeque<ScheduledRequest> buffer;

    public LocalClaimBuffer(int capacity) {
        if (capacity < 0) {
            throw new IllegalArgumentException("Buffer capacity must be >= 0");
        }
        this.capacity = capacity;
        this.buffer = new ArrayDeque<>(Math.max(capacity, 1));
    }

    public synchronized boolean offer(ScheduledRequest request) {
        if (buffer.size() >= capacity) {
            return false;
        }
        buffer.addLast(request);
        return true;
    }

    public synchronized ScheduledRequest poll() {
        return buffer.pollFirst();
    }

    /**
     * Puts a request back at the head, keeping its claim order.
     */
    public synchronized void pushBack(ScheduledRequest request) {
        buffer.addFirst(request);
    }

    public synchronized List<ScheduledRequest> removeExpired(Instant now) {
        List<ScheduledRequest> expired = new ArrayList<>();
        Iterator<ScheduledRequest> it = buffer.iterator();
        while (it.hasNext()) {
            ScheduledRequest request = it.next();
            if (request.isExpired(now)) {
                it.remove();
                expired.add(request);
            }
        }
        return expired;
    }

    public synchronized List<ScheduledRequest> drain() {
        List<ScheduledRequest> drained = new ArrayList<>(buffer);
        buffer.clear();
        return drained;
    }

    public synchronized ScheduledRequest remove(String requestId) {
        Iterator<ScheduledRequest> it = buffer.iterator();
        while (it.hasNext()) {
            ScheduledRequest request = it.next();
            if (request.requestId().equals(requestId)) {
                it.remove();
                return request;
            }
        }
        return null;
    }

    public synchronized int size() {
        return buffer.size();
    }

    public synchronized int remainingCapacity() {
        return capacity - buffer.size();
    }

    public int capacity() {
        return capacity;
    }
}
