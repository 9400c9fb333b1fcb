package fr.lapetina.scheduler.queue;

import fr.lapetina.scheduler.domain.model.ScheduledRequest;
import fr.lapetina.scheduler.domain.model.TenantTier;

import java.time.Instant;
import java.util.List;

/**
 * Shared sorted store behind the global priority queue.
 *
 * Entries are ordered by {@code (tier rank, arrival timestamp, sequence)} and indexed by
 * deadline. Every mutation is atomic at the single-request level: {@link #remove} has
 * exactly one winner per request across all replicas.
 */
public interface QueueStore {

    /**
     * Inserts the request unless the store already holds {@code maxSize} entries.
     * @return false if the size ceiling was reached
     */
    boolean offer(ScheduledRequest request, int maxSize);

    /**
     * Returns up to {@code limit} entries of the tier in priority order, without removing them.
     */
    List<ScheduledRequest> headOfTier(TenantTier tier, int limit);

    /**
     * Removes the request.
     * @return the removed request, or null if another caller removed it first
     */
    ScheduledRequest remove(String requestId);

    ScheduledRequest get(String requestId);

    /**
     * Returns up to {@code limit} entries whose deadline lies strictly before {@code now},
     * earliest deadline first, without removing them.
     */
    List<ScheduledRequest> expiredBefore(Instant now, int limit);

    /**
     * Issues a store-wide unique, increasing sequence number used to break arrival ties.
     */
    long nextSequence();

    int depth(TenantTier tier);

    int size();
}
