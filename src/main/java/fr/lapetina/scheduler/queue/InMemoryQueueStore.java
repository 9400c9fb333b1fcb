package fr.lapetina.scheduler.queue;

import fr.lapetina.scheduler.domain.model.PriorityKey;
import fr.lapetina.scheduler.domain.model.ScheduledRequest;
import fr.lapetina.scheduler.domain.model.TenantTier;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentSkipListMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Queue store built from concurrent skip lists: one per tier for priority order and one
 * for deadlines. Several replicas in one JVM can share an instance.
 *
 * The id index is written last on insert and removed first on remove, so it decides which
 * caller owns a removal.
 */
public final class InMemoryQueueStore implements QueueStore {

    private final Map<TenantTier, ConcurrentSkipListMap<PriorityKey, ScheduledRequest>> byTier =
            new EnumMap<>(TenantTier.class);
    private final Map<TenantTier, AtomicInteger> depths = new EnumMap<>(TenantTier.class);
    private final ConcurrentSkipListMap<DeadlineKey, ScheduledRequest> byDeadline = new ConcurrentSkipListMap<>();
    private final ConcurrentHashMap<String, ScheduledRequest> byId = new ConcurrentHashMap<>();
    private final AtomicInteger size = new AtomicInteger(0);
    private final AtomicLong sequence = new AtomicLong(0);

    public InMemoryQueueStore() {
        for (TenantTier tier : TenantTier.values()) {
            byTier.put(tier, new ConcurrentSkipListMap<>());
            depths.put(tier, new AtomicInteger(0));
        }
    }

    @Override
    public boolean offer(ScheduledRequest request, int maxSize) {
        while (true) {
            int current = size.get();
            if (current >= maxSize) {
                return false;
            }
            if (size.compareAndSet(current, current + 1)) {
                break;
            }
        }
        byTier.get(request.tier()).put(request.priorityKey(), request);
        byDeadline.put(DeadlineKey.of(request), request);
        depths.get(request.tier()).incrementAndGet();
        byId.put(request.requestId(), request);
        return true;
    }

    @Override
    public List<ScheduledRequest> headOfTier(TenantTier tier, int limit) {
        List<ScheduledRequest> head = new ArrayList<>(Math.min(limit, 64));
        for (ScheduledRequest request : byTier.get(tier).values()) {
            if (head.size() >= limit) {
                break;
            }
            head.add(request);
        }
        return head;
    }

    @Override
    public ScheduledRequest remove(String requestId) {
        ScheduledRequest removed = byId.remove(requestId);
        if (removed == null) {
            return null;
        }
        byTier.get(removed.tier()).remove(removed.priorityKey());
        byDeadline.remove(DeadlineKey.of(removed));
        depths.get(removed.tier()).decrementAndGet();
        size.decrementAndGet();
        return removed;
    }

    @Override
    public ScheduledRequest get(String requestId) {
        return byId.get(requestId);
    }

    @Override
    public List<ScheduledRequest> expiredBefore(Instant now, int limit) {
        List<ScheduledRequest> expired = new ArrayList<>();
        for (ScheduledRequest request : byDeadline.headMap(new DeadlineKey(now, Long.MIN_VALUE)).values()) {
            if (expired.size() >= limit) {
                break;
            }
            expired.add(request);
        }
        return expired;
    }

    @Override
    public long nextSequence() {
        return sequence.incrementAndGet();
    }

    @Override
    public int depth(TenantTier tier) {
        return depths.get(tier).get();
    }

    @Override
    public int size() {
        return size.get();
    }

    private record DeadlineKey(Instant deadline, long sequence) implements Comparable<DeadlineKey> {

        private static final Comparator<DeadlineKey> ORDER = Comparator
                .comparing(DeadlineKey::deadline)
                .thenComparingLong(DeadlineKey::sequence);

        static DeadlineKey of(ScheduledRequest request) {
            return new DeadlineKey(request.deadline(), request.sequence());
        }

        @Override
        public int compareTo(DeadlineKey other) {
            return ORDER.compare(this, other);
        }
    }
}
