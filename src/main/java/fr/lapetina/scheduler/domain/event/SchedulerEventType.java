package fr.lapetina.scheduler.domain.event;

/**
 * What caused a scheduler event to be published.
 */
public enum SchedulerEventType {
    /** Periodic credit tick: expire, allocate, dispatch. */
    TICK,
    /** A request was admitted to the global queue. */
    ARRIVAL,
    /** A worker slot finished its request. */
    SLOT_RELEASED
}
