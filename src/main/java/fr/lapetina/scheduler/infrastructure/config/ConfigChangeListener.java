package fr.lapetina.scheduler.infrastructure.config;

/**
 * Receives the reloadable scheduling settings each time a reload changes them.
 */
@FunctionalInterface
public interface ConfigChangeListener {

    /**
     * Called after the new settings were validated and made current. Never called for a
     * rejected or unchanged reload.
     */
    void onSettingsChanged(SchedulingSettings previous, SchedulingSettings current);
}
