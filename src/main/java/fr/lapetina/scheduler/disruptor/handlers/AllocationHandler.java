package fr.lapetina.scheduler.disruptor.handlers;

import com.lmax.disruptor.EventHandler;
import fr.lapetina.scheduler.allocation.TickAllocator;
import fr.lapetina.scheduler.domain.event.SchedulerEvent;

/**
 * Second stage handler: opens a new credit tick. The credits of the tick that just
 * closed are attached to the event for the metrics stage.
 */
public final class AllocationHandler implements EventHandler<SchedulerEvent> {

    private final TickAllocator tickAllocator;

    public AllocationHandler(TickAllocator tickAllocator) {
        this.tickAllocator = tickAllocator;
    }

    @Override
    public void onEvent(SchedulerEvent event, long sequence, boolean endOfBatch) {
        if (event.isTick()) {
            event.setClosedCredits(tickAllocator.allocate(event.getTimestamp()));
        }
    }
}
