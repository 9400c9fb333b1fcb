/**
 * Domain model of the tenant scheduler.
 *
 * <h2>Key Classes</h2>
 * <ul>
 *   <li>{@link fr.lapetina.scheduler.domain.model.TenantTier} - tier enum with an explicit rank</li>
 *   <li>{@link fr.lapetina.scheduler.domain.model.TierPolicy} - fair share, hard cap and token bucket settings of a tier</li>
 *   <li>{@link fr.lapetina.scheduler.domain.model.ScheduledRequest} - admitted unit of work with CAS status transitions</li>
 *   <li>{@link fr.lapetina.scheduler.domain.model.SchedulingOutcome} - terminal outcome delivered to the caller</li>
 *   <li>{@link fr.lapetina.scheduler.domain.model.WorkerSlot} - one of the N execution slots of a replica</li>
 * </ul>
 *
 * <h2>Thread Safety</h2>
 * <p>Records are immutable. {@code ScheduledRequest} and {@code WorkerSlot} keep their mutable
 * state in atomics so that each transition has exactly one winner.
 */
package fr.lapetina.scheduler.domain.model;
