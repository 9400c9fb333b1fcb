package fr.lapetina.scheduler.worker;

/**
 * Notified when a worker slot becomes free so buffered work can be dispatched without
 * waiting for the next tick.
 */
@FunctionalInterface
public interface SlotReleaseListener {

    void onSlotReleased(String requestId);
}
