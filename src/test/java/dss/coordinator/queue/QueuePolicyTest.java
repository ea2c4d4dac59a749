package dss.coordinator.queue;

import dss.coordinator.model.QueueEntry;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class QueuePolicyTest {

    @Test
    void ordersByPriorityThenInsertion() {
        List<QueueEntry> entries = List.of(
                new QueueEntry("a", 5, 1),
                new QueueEntry("b", 1, 2),
                new QueueEntry("c", 5, 3),
                new QueueEntry("d", 3, 4));

        List<String> order = QueuePolicy.order(entries).stream().map(QueueEntry::simulationId).toList();

        assertEquals(List.of("a", "c", "d", "b"), order);
    }

    @Test
    void nextIsHeadOfOrder() {
        List<QueueEntry> entries = List.of(
                new QueueEntry("late", 2, 10),
                new QueueEntry("early", 2, 3),
                new QueueEntry("low", -1, 1));

        assertEquals("early", QueuePolicy.next(entries).orElseThrow().simulationId());
        assertTrue(QueuePolicy.next(List.of()).isEmpty());
    }

    @Test
    void boostSaturates() {
        assertEquals(4, QueuePolicy.boost(3, 1));
        assertEquals(-2, QueuePolicy.boost(-3, 1));
        assertEquals(Integer.MAX_VALUE, QueuePolicy.boost(Integer.MAX_VALUE, 1));
        assertEquals(Integer.MAX_VALUE, QueuePolicy.boost(Integer.MAX_VALUE - 1, 5));
        assertEquals(Integer.MIN_VALUE, QueuePolicy.boost(Integer.MIN_VALUE, -1));
    }
}
