package fr.lapetina.scheduler.governor;

/**
 * Noisy-neighbor control state of one tenant.
 */
public enum GovernorState {
    NORMAL,
    THROTTLED
}
