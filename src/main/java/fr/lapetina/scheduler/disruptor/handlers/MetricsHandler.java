package fr.lapetina.scheduler.disruptor.handlers;

import com.lmax.disruptor.EventHandler;
import fr.lapetina.scheduler.allocation.TickCredits;
import fr.lapetina.scheduler.domain.event.SchedulerEvent;
import fr.lapetina.scheduler.infrastructure.metrics.MetricsRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * Final stage handler: records per-tick credit metrics once a tick has closed.
 */
public final class MetricsHandler implements EventHandler<SchedulerEvent> {

    private static final Logger log = LoggerFactory.getLogger(MetricsHandler.class);

    private final MetricsRegistry metricsRegistry;

    public MetricsHandler(MetricsRegistry metricsRegistry) {
        this.metricsRegistry = metricsRegistry;
    }

    @Override
    public void onEvent(SchedulerEvent event, long sequence, boolean endOfBatch) {
        TickCredits closed = event.getClosedCredits();
        if (!event.isTick() || closed == null) {
            return;
        }

        MDC.put("eventType", event.getType().name());
        try {
            metricsRegistry.recordTick(closed.toAllocations());

            if (log.isDebugEnabled()) {
                log.debug("Tick closed: at={}, granted={}, consumed={}, expired={}, dispatched={}",
                        closed.tickTimestamp(), closed.totalGranted(), closed.totalConsumed(),
                        event.getExpiredCount(), event.getDispatchedCount());
            }
        } finally {
            MDC.remove("eventType");
        }
    }
}
