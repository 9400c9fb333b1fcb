package fr.lapetina.scheduler.disruptor.handlers;

import com.lmax.disruptor.EventHandler;
import fr.lapetina.scheduler.dlq.DeadLetterHandler;
import fr.lapetina.scheduler.domain.event.SchedulerEvent;
import fr.lapetina.scheduler.domain.model.DlqEntry;

import java.util.List;

/**
 * First stage handler: on every tick, moves expired requests to the dead-letter queue
 * before credits are computed, so expired work is never counted as demand.
 */
public final class ExpiryHandler implements EventHandler<SchedulerEvent> {

    private final DeadLetterHandler deadLetterHandler;

    public ExpiryHandler(DeadLetterHandler deadLetterHandler) {
        this.deadLetterHandler = deadLetterHandler;
    }

    @Override
    public void onEvent(SchedulerEvent event, long sequence, boolean endOfBatch) {
        if (!event.isTick()) {
            return;
        }
        List<DlqEntry> expired = deadLetterHandler.scanAndExpire(event.getTimestamp());
        event.setExpiredCount(expired.size());
    }
}
