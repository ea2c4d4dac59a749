package dss.coordinator.queue;

import dss.coordinator.model.QueueEntry;

import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Order in which queued simulations are claimed.
 *
 * Key: (priority DESC, insertion order ASC). Higher priorities preempt the
 * default backlog; within one priority tier entries are served FIFO.
 *
 * The JDBC store orders with {@link #SQL_ORDER_BY}, which must stay equivalent
 * to {@link #ORDER}.
 */
public final class QueuePolicy {

    /** Claim order over queue entries. */
    public static final Comparator<QueueEntry> ORDER = Comparator
            .comparingInt(QueueEntry::priority).reversed()
            .thenComparingLong(QueueEntry::seq);

    /** SQL equivalent of {@link #ORDER} over the queue table columns. */
    public static final String SQL_ORDER_BY = "ORDER BY priority DESC, seq ASC";

    private QueuePolicy() {
    }

    /** Entries sorted in claim order. */
    public static List<QueueEntry> order(Collection<QueueEntry> entries) {
        return entries.stream().sorted(ORDER).toList();
    }

    /** The entry the next claim would take, if any. */
    public static Optional<QueueEntry> next(Collection<QueueEntry> entries) {
        return entries.stream().min(ORDER);
    }

    /**
     * Priority for a simulation requeued after a failure.
     * Saturates instead of overflowing.
     */
    public static int boost(int priority, int boost) {
        long boosted = (long) priority + boost;
        if (boosted > Integer.MAX_VALUE) {
            return Integer.MAX_VALUE;
        }
        if (boosted < Integer.MIN_VALUE) {
            return Integer.MIN_VALUE;
        }
        return (int) boosted;
    }
}
