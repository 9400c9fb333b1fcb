/**
 * Tenant-fair request scheduler.
 *
 * <p>Admits per-tenant queries through a token bucket, holds them in a global priority queue
 * shared by every replica, and dispatches them to a bounded local worker pool in proportion to
 * each tier's fair share of capacity. A noisy-neighbor governor throttles tenants that
 * consistently exceed their tier's hard cap, and requests that wait past their deadline are
 * moved to a dead-letter queue.
 *
 * <p>{@link fr.lapetina.scheduler.SchedulerFactory} wires one replica from YAML configuration.
 */
package fr.lapetina.scheduler;
