package fr.lapetina.scheduler.domain.model;

import java.time.Instant;
import java.util.Comparator;

/**
 * Queue sort key {@code (tier rank, arrival timestamp, sequence)} compared lexicographically.
 * The sequence breaks ties between requests stamped with the same instant.
 */
public record PriorityKey(int tierRank, Instant arrival, long sequence) implements Comparable<PriorityKey> {

    private static final Comparator<PriorityKey> ORDER = Comparator
            .comparingInt(PriorityKey::tierRank)
            .thenComparing(PriorityKey::arrival)
            .thenComparingLong(PriorityKey::sequence);

    @Override
    public int compareTo(PriorityKey other) {
        return ORDER.compare(this, other);
    }
}
