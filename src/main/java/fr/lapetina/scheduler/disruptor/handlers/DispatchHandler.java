package fr.lapetina.scheduler.disruptor.handlers;

import com.lmax.disruptor.EventHandler;
import fr.lapetina.scheduler.allocation.TickAllocator;
import fr.lapetina.scheduler.domain.event.SchedulerEvent;
import fr.lapetina.scheduler.worker.Dispatcher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Third stage handler: hands queued work to free worker slots using the current tick's
 * credits.
 *
 * Ticks always dispatch. Arrivals and slot releases are coalesced: a batch of them
 * triggers a single dispatch pass on its last event.
 *
 * This is the only thread that drives the {@link Dispatcher}.
 */
public final class DispatchHandler implements EventHandler<SchedulerEvent> {

    private static final Logger log = LoggerFactory.getLogger(DispatchHandler.class);

    private final Dispatcher dispatcher;
    private final TickAllocator tickAllocator;

    public DispatchHandler(Dispatcher dispatcher, TickAllocator tickAllocator) {
        this.dispatcher = dispatcher;
        this.tickAllocator = tickAllocator;
    }

    @Override
    public void onEvent(SchedulerEvent event, long sequence, boolean endOfBatch) {
        if (!event.isTick() && !endOfBatch) {
            return;
        }
        int dispatched = dispatcher.dispatchAvailable(tickAllocator.current(), event.getTimestamp());
        event.setDispatchedCount(dispatched);

        if (dispatched > 0) {
            log.debug("Dispatch pass: trigger={}, dispatched={}, sequence={}",
                    event.getType(), dispatched, sequence);
        }
    }
}
