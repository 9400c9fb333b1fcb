package fr.lapetina.scheduler.infrastructure.config;

import java.util.List;

/**
 * What a configuration reload did to the running replica.
 *
 * @param settings the scheduling settings in effect after the attempt
 * @param changed  sections that changed, empty unless {@link Status#APPLIED}
 * @param message  rejection reason, null unless {@link Status#REJECTED}
 */
public record ReloadResult(Status status, SchedulingSettings settings, List<String> changed, String message) {

    public enum Status {
        /** New settings are live and listeners were told */
        APPLIED,

        /** The file parsed but nothing reloadable differs */
        UNCHANGED,

        /** The file failed validation, previous settings kept */
        REJECTED
    }

    public ReloadResult {
        changed = List.copyOf(changed);
    }

    static ReloadResult applied(SchedulingSettings settings, List<String> changed) {
        return new ReloadResult(Status.APPLIED, settings, changed, null);
    }

    static ReloadResult unchanged(SchedulingSettings settings) {
        return new ReloadResult(Status.UNCHANGED, settings, List.of(), null);
    }

    static ReloadResult rejected(SchedulingSettings settings, String message) {
        return new ReloadResult(Status.REJECTED, settings, List.of(), message);
    }
}
