package fr.lapetina.scheduler.allocation;

import fr.lapetina.scheduler.domain.model.TenantTier;
import fr.lapetina.scheduler.governor.ConsumptionLedger;
import fr.lapetina.scheduler.queue.GlobalPriorityQueue;
import fr.lapetina.scheduler.queue.LocalClaimBuffer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.IntSupplier;

/**
 * Opens a new credit tick: reads queue depths, runs the pure allocator and publishes the
 * resulting {@link TickCredits} for this replica's dispatcher.
 */
public final class TickAllocator {

    private static final Logger log = LoggerFactory.getLogger(TickAllocator.class);

    private final GlobalPriorityQueue queue;
    private final LocalClaimBuffer localBuffer;
    private final ConsumptionLedger ledger;
    private final IntSupplier capacityPerTick;
    private final AtomicReference<FairShareAllocator> allocator;
    private final AtomicReference<TickCredits> current;

    public TickAllocator(
            GlobalPriorityQueue queue,
            LocalClaimBuffer localBuffer,
            ConsumptionLedger ledger,
            FairShareAllocator allocator,
            IntSupplier capacityPerTick,
            Instant start
    ) {
        this.queue = queue;
        this.localBuffer = localBuffer;
        this.ledger = ledger;
        this.capacityPerTick = capacityPerTick;
        this.allocator = new AtomicReference<>(allocator);
        this.current = new AtomicReference<>(TickCredits.none(start));
    }

    /**
     * Replaces the tick's credits.
     *
     * @return the credits of the tick that just closed
     */
    public TickCredits allocate(Instant now) {
        int capacity = capacityPerTick.getAsInt();
        Map<TenantTier, Integer> depths = queue.depths();
        Map<TenantTier, Integer> grants = allocator.get().computeAllocation(depths, capacity);
        TickCredits next = new TickCredits(now, capacity, grants);
        TickCredits closed = current.getAndSet(next);
        ledger.recordCapacity(capacity, now);

        if (log.isDebugEnabled()) {
            log.debug("Tick allocated: at={}, capacity={}, depths={}, grants={}, localBuffer={}",
                    now, capacity, depths, grants, localBuffer.size());
        }
        return closed;
    }

    public TickCredits current() {
        return current.get();
    }

    /**
     * Swaps the allocator, used on configuration reload. Takes effect at the next tick.
     */
    public void updateAllocator(FairShareAllocator updated) {
        FairShareAllocator previous = allocator.getAndSet(updated);
        log.info("Fair-share allocator updated: policies={}, redistribution={} -> {}",
                updated.policies(), previous.redistribution(), updated.redistribution());
    }

    public FairShareAllocator allocator() {
        return allocator.get();
    }
}
