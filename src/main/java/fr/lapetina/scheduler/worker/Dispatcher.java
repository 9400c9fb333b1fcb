package fr.lapetina.scheduler.worker;

import fr.lapetina.scheduler.allocation.TickCredits;
import fr.lapetina.scheduler.dlq.DeadLetterHandler;
import fr.lapetina.scheduler.domain.model.RequestStatus;
import fr.lapetina.scheduler.domain.model.ScheduledRequest;
import fr.lapetina.scheduler.domain.model.TenantTier;
import fr.lapetina.scheduler.governor.ConsumptionLedger;
import fr.lapetina.scheduler.governor.NoisyNeighborGovernor;
import fr.lapetina.scheduler.infrastructure.metrics.MetricsRegistry;
import fr.lapetina.scheduler.queue.GlobalPriorityQueue;
import fr.lapetina.scheduler.queue.LocalClaimBuffer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.EnumSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.function.Predicate;

/**
 * Moves work from the global queue to worker slots under the current tick's credits.
 *
 * Buffered claims are served first. New claims are then taken one credit at a time, the
 * tier being chosen by {@link TickCredits#nextTier}, and go straight to a slot when one is
 * free or into the local claim buffer otherwise. Requests cancelled or expired while claimed
 * are dropped before a slot is taken.
 *
 * Not thread-safe: one dispatcher per replica, driven from a single thread.
 */
public final class Dispatcher {

    private static final Logger log = LoggerFactory.getLogger(Dispatcher.class);

    private final GlobalPriorityQueue queue;
    private final LocalClaimBuffer localBuffer;
    private final LocalWorkerPool pool;
    private final NoisyNeighborGovernor governor;
    private final DeadLetterHandler deadLetterHandler;
    private final ConsumptionLedger ledger;
    private final MetricsRegistry metrics;

    public Dispatcher(
            GlobalPriorityQueue queue,
            LocalClaimBuffer localBuffer,
            LocalWorkerPool pool,
            NoisyNeighborGovernor governor,
            DeadLetterHandler deadLetterHandler,
            ConsumptionLedger ledger,
            MetricsRegistry metrics
    ) {
        this.queue = queue;
        this.localBuffer = localBuffer;
        this.pool = pool;
        this.governor = governor;
        this.deadLetterHandler = deadLetterHandler;
        this.ledger = ledger;
        this.metrics = metrics;
    }

    private enum HandOff {
        DISPATCHED,
        NO_SLOT,
        DROPPED
    }

    /**
     * Dispatches as much eligible work as free slots and remaining credits allow.
     *
     * @return number of requests handed to a worker slot
     */
    public int dispatchAvailable(TickCredits credits, Instant now) {
        int dispatched = drainLocalBuffer(now);
        dispatched += claimAndDispatch(credits, now);
        return dispatched;
    }

    private int drainLocalBuffer(Instant now) {
        int dispatched = 0;
        while (pool.freeSlots() > 0) {
            ScheduledRequest request = localBuffer.poll();
            if (request == null) {
                break;
            }
            HandOff result = handOff(request, now);
            if (result == HandOff.DISPATCHED) {
                dispatched++;
            } else if (result == HandOff.NO_SLOT) {
                localBuffer.pushBack(request);
                break;
            }
        }
        return dispatched;
    }

    private int claimAndDispatch(TickCredits credits, Instant now) {
        int dispatched = 0;
        Set<TenantTier> exhausted = EnumSet.noneOf(TenantTier.class);
        Predicate<ScheduledRequest> eligible = request -> withinThrottleLimit(request, credits);

        while (pool.freeSlots() > 0 || localBuffer.remainingCapacity() > 0) {
            Optional<TenantTier> next = credits.nextTier(exhausted);
            if (next.isEmpty()) {
                break;
            }
            TenantTier tier = next.get();
            if (!credits.tryConsume(tier)) {
                exhausted.add(tier);
                continue;
            }

            List<ScheduledRequest> claimed = queue.dequeueForTier(tier, 1, eligible);
            if (claimed.isEmpty()) {
                credits.refund(tier);
                exhausted.add(tier);
                continue;
            }

            ScheduledRequest request = claimed.get(0);
            credits.recordTenantClaim(request.tenantId());

            if (pool.freeSlots() > 0) {
                HandOff result = handOff(request, now);
                if (result == HandOff.DISPATCHED) {
                    dispatched++;
                } else if (result == HandOff.DROPPED) {
                    credits.refund(tier);
                } else if (!localBuffer.offer(request)) {
                    queue.requeue(request);
                    credits.refund(tier);
                    break;
                }
            } else if (!localBuffer.offer(request)) {
                queue.requeue(request);
                credits.refund(tier);
                break;
            }
        }

        if (dispatched > 0 && log.isDebugEnabled()) {
            log.debug("Dispatch pass: dispatched={}, credits={}, localBuffer={}, busySlots={}/{}",
                    dispatched, credits, localBuffer.size(), pool.busySlots(), pool.size());
        }
        return dispatched;
    }

    private boolean withinThrottleLimit(ScheduledRequest request, TickCredits credits) {
        if (!governor.isThrottled(request.tenantId())) {
            return true;
        }
        int limit = governor.perTickDequeueLimit(request.tier(), credits.capacity());
        return credits.tenantClaims(request.tenantId()) < limit;
    }

    private HandOff handOff(ScheduledRequest request, Instant now) {
        if (request.status() != RequestStatus.QUEUED) {
            return HandOff.DROPPED;
        }
        if (request.isExpired(now)) {
            deadLetterHandler.expire(request, now);
            return HandOff.DROPPED;
        }
        if (!pool.dispatch(request)) {
            return request.status() == RequestStatus.QUEUED ? HandOff.NO_SLOT : HandOff.DROPPED;
        }
        ledger.recordDispatch(request.tenantId(), request.tier(), now);
        metrics.recordQueueWait(request.tier(), request.waitedUntil(now));
        return HandOff.DISPATCHED;
    }

    /**
     * Returns claimed but undispatched work to the global queue, used on shutdown so other
     * replicas can serve it.
     *
     * @return number of requests returned
     */
    public int releaseClaims() {
        int released = 0;
        for (ScheduledRequest request : localBuffer.drain()) {
            if (request.status() == RequestStatus.QUEUED) {
                queue.requeue(request);
                released++;
            }
        }
        if (released > 0) {
            log.info("Returned claimed requests to the global queue: count={}", released);
        }
        return released;
    }
}
