/**
 * LMAX Disruptor-based scheduling loop of a replica.
 *
 * <p>Requests are admitted synchronously and stored in the global priority queue. The ring
 * buffer only carries scheduling signals (ticks, arrivals, slot releases), each flowing
 * through the same handler chain:
 * <pre>
 * Expiry → Allocation → Dispatch → Metrics
 * </pre>
 *
 * <p>Expiry and allocation act on ticks only, so deadlines are enforced at tick granularity.
 * Dispatch runs on a single consumer thread, which is the only thread that claims work.
 *
 * @see fr.lapetina.scheduler.disruptor.SchedulerPipeline
 */
package fr.lapetina.scheduler.disruptor;
