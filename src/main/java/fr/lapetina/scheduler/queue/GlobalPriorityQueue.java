package fr.lapetina.scheduler.queue;

import fr.lapetina.scheduler.domain.model.ErrorType;
import fr.lapetina.scheduler.domain.model.RequestStatus;
import fr.lapetina.scheduler.domain.model.ScheduledRequest;
import fr.lapetina.scheduler.domain.model.TenantTier;
import fr.lapetina.scheduler.exception.AdmissionRejectedException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.IntSupplier;
import java.util.function.Predicate;

/**
 * Replica-side view of the shared priority queue.
 *
 * Ordering is tier rank first, then arrival timestamp, so dequeue is strict FIFO within a
 * tier. Cross-tier fairness is bounded by the credits each tier is granted, not by rank.
 */
public final class GlobalPriorityQueue {

    private static final Logger log = LoggerFactory.getLogger(GlobalPriorityQueue.class);

    private static final double CAPACITY_WARNING_THRESHOLD = 0.8;
    private static final int EXPIRY_BATCH = 1000;

    private final QueueStore store;
    private final IntSupplier maxSize;
    private volatile boolean capacityWarningLogged = false;

    public GlobalPriorityQueue(QueueStore store, IntSupplier maxSize) {
        this.store = store;
        this.maxSize = maxSize;
    }

    public long nextSequence() {
        return store.nextSequence();
    }

    /**
     * Adds an admitted request.
     *
     * @throws AdmissionRejectedException with {@link ErrorType#CAPACITY_EXHAUSTED} if the queue is full;
     *                                    the request is moved to REJECTED
     */
    public void enqueue(ScheduledRequest request) {
        int limit = maxSize.getAsInt();
        if (!store.offer(request, limit)) {
            request.transition(RequestStatus.QUEUED, RequestStatus.REJECTED);
            log.warn("Queue full: requestId={}, tenantId={}, tier={}, size={}/{}",
                    request.requestId(), request.tenantId(), request.tier(), store.size(), limit);
            throw new AdmissionRejectedException(ErrorType.CAPACITY_EXHAUSTED,
                    "Global queue at its size ceiling of " + limit);
        }
        checkCapacityThreshold(limit);
        log.debug("Request enqueued: requestId={}, tenantId={}, tier={}, deadline={}",
                request.requestId(), request.tenantId(), request.tier(), request.deadline());
    }

    /**
     * Puts back a request this replica claimed but did not dispatch. Ignores the size
     * ceiling, the request already held a place.
     */
    public void requeue(ScheduledRequest request) {
        store.offer(request, Integer.MAX_VALUE);
    }

    public List<ScheduledRequest> dequeueForTier(TenantTier tier, int maxCount) {
        return dequeueForTier(tier, maxCount, r -> true);
    }

    /**
     * Claims up to {@code maxCount} requests of the tier in priority order.
     * Requests failing {@code eligible} are skipped and stay queued in place.
     */
    public List<ScheduledRequest> dequeueForTier(TenantTier tier, int maxCount, Predicate<ScheduledRequest> eligible) {
        if (maxCount <= 0) {
            return Collections.emptyList();
        }
        List<ScheduledRequest> claimed = new ArrayList<>(maxCount);
        Set<String> seen = new HashSet<>();
        while (claimed.size() < maxCount) {
            List<ScheduledRequest> head = store.headOfTier(tier, maxCount - claimed.size() + seen.size());
            boolean sawNew = false;
            for (ScheduledRequest candidate : head) {
                if (claimed.size() >= maxCount) {
                    break;
                }
                if (!seen.add(candidate.requestId())) {
                    continue;
                }
                sawNew = true;
                if (!eligible.test(candidate)) {
                    continue;
                }
                // another replica may win the removal; the candidate is then just skipped
                ScheduledRequest removed = store.remove(candidate.requestId());
                if (removed != null) {
                    claimed.add(removed);
                }
            }
            if (!sawNew) {
                break;
            }
        }
        return claimed;
    }

    /**
     * Removes every request whose deadline lies strictly before {@code now}.
     * Served from the deadline index, not by scanning the tiers.
     */
    public List<ScheduledRequest> removeExpired(Instant now) {
        List<ScheduledRequest> removed = new ArrayList<>();
        while (true) {
            List<ScheduledRequest> expired = store.expiredBefore(now, EXPIRY_BATCH);
            int claimedInBatch = 0;
            for (ScheduledRequest candidate : expired) {
                ScheduledRequest r = store.remove(candidate.requestId());
                if (r != null) {
                    removed.add(r);
                    claimedInBatch++;
                }
            }
            if (expired.size() < EXPIRY_BATCH || claimedInBatch == 0) {
                return removed;
            }
        }
    }

    /**
     * Removes a single request, used for eager cancellation.
     * @return the request if this caller removed it
     */
    public ScheduledRequest remove(String requestId) {
        return store.remove(requestId);
    }

    public Map<TenantTier, Integer> depths() {
        Map<TenantTier, Integer> depths = new EnumMap<>(TenantTier.class);
        for (TenantTier tier : TenantTier.values()) {
            depths.put(tier, store.depth(tier));
        }
        return depths;
    }

    public int depth(TenantTier tier) {
        return store.depth(tier);
    }

    public int size() {
        return store.size();
    }

    private void checkCapacityThreshold(int limit) {
        double utilization = (double) store.size() / limit;
        if (utilization >= CAPACITY_WARNING_THRESHOLD && !capacityWarningLogged) {
            log.warn("Approaching queue capacity: size={}/{} ({}%)",
                    store.size(), limit, (int) (utilization * 100));
            capacityWarningLogged = true;
        } else if (utilization < CAPACITY_WARNING_THRESHOLD * 0.9) {
            capacityWarningLogged = false;
        }
    }

    boolean isCapacityWarningActive() {
        return capacityWarningLogged;
    }
}
