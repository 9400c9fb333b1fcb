package fr.lapetina.scheduler.domain.model;

/**
 * Lifecycle state of a {@link ScheduledRequest}. Transitions are one-way.
 */
public enum RequestStatus {
    /** Waiting in the global queue or in a replica's claim buffer */
    QUEUED,

    /** Owned by a worker slot, pipeline call in progress */
    DISPATCHED,

    /** Pipeline returned a result */
    COMPLETED,

    /** Pipeline returned an error */
    FAILED,

    /** Refused at enqueue time (queue at its size ceiling) */
    REJECTED,

    /** Deadline elapsed before dispatch, recorded in the DLQ */
    TIMED_OUT,

    /** Withdrawn by the caller before dispatch */
    CANCELLED;

    public boolean isTerminal() {
        return this != QUEUED && this != DISPATCHED;
    }
}
