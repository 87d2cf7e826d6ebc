package org.micronav.planning.search;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.NoSuchElementException;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Search Infrastructure Tests")
class SearchInfrastructureTest {

    @Nested
    @DisplayName("1. FrontierEntry ordering")
    class FrontierEntryTests {

        @Test
        @DisplayName("Lower priority sorts first")
        void testPriorityComparison() {
            FrontierEntry a = new FrontierEntry(1, 10.0d, 3.0d, 7L);
            FrontierEntry b = new FrontierEntry(2, 20.0d, 1.0d, 0L);

            assertTrue(a.compareTo(b) < 0, "priority 10 should sort before priority 20");
            assertTrue(b.compareTo(a) > 0);
        }

        @Test
        @DisplayName("Equal priority falls back to insertion sequence")
        void testSequenceTieBreak() {
            FrontierEntry early = new FrontierEntry(9, 5.0d, 1.0d, 1L);
            FrontierEntry late = new FrontierEntry(0, 5.0d, 1.0d, 2L);

            assertTrue(early.compareTo(late) < 0, "earlier sequence wins the tie regardless of cell index");
            assertEquals(0, early.compareTo(early));
        }
    }

    @Nested
    @DisplayName("2. SearchQueue (indexed min-heap)")
    class SearchQueueTests {

        @Test
        @DisplayName("Extracts in priority order")
        void testHeapOrdering() {
            SearchQueue queue = new SearchQueue(10);
            queue.insert(1, 50.0d, 0.0d);
            queue.insert(2, 10.0d, 0.0d);
            queue.insert(3, 30.0d, 0.0d);

            assertEquals(3, queue.size());
            int[] expected = {2, 3, 1};
            for (int cell : expected) {
                assertEquals(cell, queue.extractMin().cellIndex);
            }
            assertTrue(queue.isEmpty());
        }

        @Test
        @DisplayName("Ties pop in FIFO order")
        void testFifoTies() {
            SearchQueue queue = new SearchQueue(10);
            queue.insert(7, 4.0d, 0.0d);
            queue.insert(3, 4.0d, 0.0d);
            queue.insert(5, 4.0d, 0.0d);

            assertEquals(7, extract(queue));
            assertEquals(3, extract(queue));
            assertEquals(5, extract(queue));
        }

        @Test
        @DisplayName("Decrease-key keeps one slot per cell and the best entry")
        void testDecreaseKey() {
            SearchQueue queue = new SearchQueue(10);
            assertTrue(queue.insert(5, 50.0d, 40.0d));
            assertTrue(queue.insert(5, 30.0d, 20.0d));
            assertFalse(queue.insert(5, 35.0d, 25.0d), "worse key must not replace the queued entry");

            assertEquals(1, queue.size());
            FrontierEntry e = queue.extractMin();
            assertEquals(30.0d, e.priority);
            assertEquals(20.0d, e.cost);
            assertTrue(queue.isEmpty());
            assertTrue(queue.insert(5, 90.0d, 80.0d), "an extracted cell can be queued again");
        }

        @Test
        @DisplayName("Decrease-key re-stamps the sequence")
        void testDecreaseKeyRestamps() {
            SearchQueue queue = new SearchQueue(10);
            queue.insert(1, 9.0d, 0.0d);
            queue.insert(2, 5.0d, 0.0d);
            queue.insert(1, 5.0d, 0.0d);

            assertEquals(2, extract(queue), "cell 2 was queued at key 5 before cell 1 reached it");
            assertEquals(1, extract(queue));
        }

        @Test
        @DisplayName("Random workload matches sorted order")
        void testRandomWorkload() {
            int n = 500;
            SearchQueue queue = new SearchQueue(n);
            Random random = new Random(42L);
            double[] keys = new double[n];
            for (int i = 0; i < n; i++) {
                keys[i] = random.nextInt(1000);
                queue.insert(i, keys[i], 0.0d);
            }
            assertEquals(n, queue.getPeakSize());

            double previous = Double.NEGATIVE_INFINITY;
            while (!queue.isEmpty()) {
                FrontierEntry e = queue.extractMin();
                assertTrue(e.priority >= previous);
                assertEquals(keys[e.cellIndex], e.priority);
                previous = e.priority;
            }
        }

        @Test
        @DisplayName("Contract violations fail fast")
        void testContracts() {
            assertThrows(IllegalArgumentException.class, () -> new SearchQueue(0));
            SearchQueue queue = new SearchQueue(2);
            assertThrows(IllegalArgumentException.class, () -> queue.insert(2, 1.0d, 0.0d));
            assertThrows(NoSuchElementException.class, queue::extractMin);
            assertThrows(IllegalArgumentException.class, () -> queue.insert(-1, 1.0d, 0.0d));
        }

        @Test
        @DisplayName("Peak size survives extraction")
        void testPeakSize() {
            SearchQueue queue = new SearchQueue(4);
            queue.insert(0, 1.0d, 0.0d);
            queue.insert(1, 2.0d, 0.0d);
            queue.insert(1, 0.5d, 0.0d);
            queue.extractMin();
            queue.insert(2, 3.0d, 0.0d);
            queue.extractMin();
            queue.extractMin();

            assertTrue(queue.isEmpty());
            assertEquals(2, queue.getPeakSize(), "decrease-key must not count as a new slot");
        }

        private int extract(SearchQueue queue) {
            return queue.extractMin().cellIndex;
        }
    }

    @Nested
    @DisplayName("3. PositionHistory ring buffer")
    class PositionHistoryTests {

        @Test
        @DisplayName("Counts occurrences inside the window")
        void testCount() {
            PositionHistory history = new PositionHistory(5);
            history.add(1);
            history.add(2);
            history.add(1);
            assertEquals(2, history.count(1));
            assertEquals(1, history.count(2));
            assertEquals(0, history.count(3));
            assertEquals(3, history.size());
        }

        @Test
        @DisplayName("Oldest entries are evicted once full")
        void testEviction() {
            PositionHistory history = new PositionHistory(3);
            history.add(7);
            history.add(7);
            history.add(8);
            history.add(9);
            assertEquals(1, history.count(7));
            history.add(10);
            assertEquals(0, history.count(7));
            assertEquals(3, history.size());
            assertEquals(3, history.capacity());
        }

        @Test
        @DisplayName("Capacity must be positive")
        void testCapacity() {
            assertThrows(IllegalArgumentException.class, () -> new PositionHistory(0));
        }
    }
}
