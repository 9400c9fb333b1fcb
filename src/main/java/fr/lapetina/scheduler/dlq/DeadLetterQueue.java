package fr.lapetina.scheduler.dlq;

import fr.lapetina.scheduler.domain.model.DlqEntry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Append-only record of timed-out requests kept for operator inspection.
 *
 * Retention is bounded: once {@code retention} entries are held, the oldest one ages out.
 * Entries never re-enter the live queue.
 */
public final class DeadLetterQueue {

    private static final Logger log = LoggerFactory.getLogger(DeadLetterQueue.class);

    private final int retention;
    private final ArrayDeque<DlqEntry> entries = new ArrayDeque<>();
    private final AtomicLong totalRecorded = new AtomicLong(0);

    public DeadLetterQueue(int retention) {
        if (retention < 1) {
            throw new IllegalArgumentException("Retention must be >= 1");
        }
        this.retention = retention;
    }

    public void append(DlqEntry entry) {
        synchronized (entries) {
            if (entries.size() >= retention) {
                DlqEntry evicted = entries.pollFirst();
                log.debug("DLQ retention reached, evicting: requestId={}", evicted.request().requestId());
            }
            entries.addLast(entry);
        }
        totalRecorded.incrementAndGet();
    }

    /**
     * Most recent entries first.
     */
    public List<DlqEntry> recent(int limit) {
        List<DlqEntry> result = new ArrayList<>(Math.max(0, Math.min(limit, retention)));
        synchronized (entries) {
            Iterator<DlqEntry> it = entries.descendingIterator();
            while (it.hasNext() && result.size() < limit) {
                result.add(it.next());
            }
        }
        return result;
    }

    public int size() {
        synchronized (entries) {
            return entries.size();
        }
    }

    /**
     * Number of entries ever appended, including those aged out.
     */
    public long totalRecorded() {
        return totalRecorded.get();
    }
}
