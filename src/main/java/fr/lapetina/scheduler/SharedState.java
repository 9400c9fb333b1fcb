package fr.lapetina.scheduler;

import fr.lapetina.scheduler.dlq.DeadLetterQueue;
import fr.lapetina.scheduler.governor.ConsumptionLedger;
import fr.lapetina.scheduler.governor.InMemoryConsumptionLedger;
import fr.lapetina.scheduler.limiter.InMemoryTokenBucketStore;
import fr.lapetina.scheduler.limiter.TokenBucketStore;
import fr.lapetina.scheduler.queue.InMemoryQueueStore;
import fr.lapetina.scheduler.queue.QueueStore;

import java.util.Objects;

/**
 * State shared by every replica of the scheduler. Replicas built from the same instance
 * behave as one cluster: one token bucket per tenant, one global queue, one consumption
 * ledger and one dead-letter queue.
 */
public record SharedState(
        TokenBucketStore tokenBuckets,
        QueueStore queueStore,
        ConsumptionLedger ledger,
        DeadLetterQueue deadLetterQueue
) {
    public SharedState {
        Objects.requireNonNull(tokenBuckets, "Token bucket store is required");
        Objects.requireNonNull(queueStore, "Queue store is required");
        Objects.requireNonNull(ledger, "Consumption ledger is required");
        Objects.requireNonNull(deadLetterQueue, "Dead-letter queue is required");
    }

    /**
     * Process-local shared state.
     */
    public static SharedState inMemory(int dlqRetention) {
        return new SharedState(
                new InMemoryTokenBucketStore(),
                new InMemoryQueueStore(),
                new InMemoryConsumptionLedger(),
                new DeadLetterQueue(dlqRetention)
        );
    }
}
