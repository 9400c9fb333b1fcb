package fr.lapetina.scheduler.domain.model;

import java.time.Instant;
import java.util.Objects;

/**
 * A request that exceeded its deadline while queued. Append-only record.
 */
public record DlqEntry(RequestSnapshot request, String timeoutReason, Instant recordedAt) {
    public DlqEntry {
        Objects.requireNonNull(request, "Request snapshot is required");
        Objects.requireNonNull(recordedAt, "Recorded timestamp is required");
    }
}
