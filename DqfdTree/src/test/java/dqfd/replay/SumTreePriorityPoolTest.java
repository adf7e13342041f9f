package dqfd.replay;

import org.junit.jupiter.api.Test;

import java.util.HashSet;
import java.util.List;
import java.util.Random;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class SumTreePriorityPoolTest {

    @Test
    void testSampleDrawsDistinctItems() {
        SumTreePriorityPool<Integer> pool = SumTreePriorityPool.bounded(10, new Random(1));
        for (int i = 0; i < 10; i++) {
            pool.append(i, 1.0 + i);
        }

        PriorityPool.PoolSample<Integer> sample = pool.sample(10);

        assertEquals(10, new HashSet<>(sample.items).size());
    }

    @Test
    void testSampleMoreThanSizeUnderflows() {
        SumTreePriorityPool<Integer> pool = SumTreePriorityPool.bounded(10, new Random(1));
        pool.append(1);
        pool.append(2);

        assertThrows(UnderflowException.class, () -> pool.sample(3));
    }

    @Test
    void testEmptySampleDoesNotWaitForPriorities() {
        SumTreePriorityPool<Integer> pool = SumTreePriorityPool.bounded(4, new Random(1));
        pool.append(1);

        assertEquals(0, pool.sample(0).size());
        assertFalse(pool.isAwaitingPriority());
    }

    @Test
    void testProbabilitiesRelativeToTotalMass() {
        SumTreePriorityPool<String> pool = SumTreePriorityPool.unbounded(new Random(3));
        pool.append("a", 1.0);
        pool.append("b", 3.0);

        PriorityPool.PoolSample<String> sample = pool.sample(2);

        for (int i = 0; i < 2; i++) {
            double expected = sample.items.get(i).equals("a") ? 0.25 : 0.75;
            assertEquals(expected, sample.probabilities[i], 1e-12);
        }
        assertEquals(0.25, sample.minProbability, 1e-12);
        assertEquals(4.0, pool.totalPriority(), 1e-12);
    }

    @Test
    void testDrawFrequencyFollowsPriority() {
        SumTreePriorityPool<String> pool = SumTreePriorityPool.unbounded(new Random(11));
        pool.append("rare", 1.0);
        pool.append("common", 9.0);

        int rare = 0;
        int draws = 4000;
        for (int i = 0; i < draws; i++) {
            String drawn = pool.sample(1).items.get(0);
            if (drawn.equals("rare")) {
                rare++;
            }
            pool.setLastPriority(new double[]{drawn.equals("rare") ? 1.0 : 9.0});
        }

        assertEquals(0.1, rare / (double) draws, 0.03);
    }

    @Test
    void testBoundedPoolEvictsOldest() {
        SumTreePriorityPool<Integer> pool = SumTreePriorityPool.bounded(3, new Random(1));
        for (int i = 0; i < 5; i++) {
            pool.append(i);
        }

        assertEquals(3, pool.size());
        assertEquals(2, pool.get(0));
        assertEquals(4, pool.get(2));
        assertEquals(3.0, pool.totalPriority(), 1e-12);
    }

    @Test
    void testUnboundedPoolGrowsAndKeepsEverything() {
        SumTreePriorityPool<Integer> pool = SumTreePriorityPool.unbounded(new Random(5));
        for (int i = 0; i < 100; i++) {
            pool.append(i, 0.5);
        }

        assertEquals(100, pool.size());
        assertEquals(50.0, pool.totalPriority(), 1e-9);
        assertEquals(0, pool.get(0));
        assertEquals(100, new HashSet<>(pool.sample(100).items).size());
    }

    @Test
    void testSetLastPriorityFollowsDrawOrder() {
        SumTreePriorityPool<Integer> pool = SumTreePriorityPool.bounded(3, new Random(7));
        pool.append(0);
        pool.append(1);
        pool.append(2);

        List<Integer> drawn = pool.sample(3).items;
        pool.setLastPriority(new double[]{2.0, 4.0, 8.0});

        for (int i = 0; i < 3; i++) {
            int item = drawn.get(i);
            assertEquals(new double[]{2.0, 4.0, 8.0}[i], pool.priority(item), 1e-12);
        }
        assertEquals(14.0, pool.totalPriority(), 1e-12);
        assertEquals(2.0, pool.minPriority(), 1e-12);
        assertEquals(8.0, pool.maxPriority(), 1e-12);
    }

    @Test
    void testNewItemsEnterWithMaxPriority() {
        SumTreePriorityPool<Integer> pool = SumTreePriorityPool.bounded(4, new Random(7));
        pool.append(0);
        pool.sample(1);
        pool.setLastPriority(new double[]{6.0});

        pool.append(1);

        assertEquals(6.0, pool.priority(1), 1e-12);
    }

    @Test
    void testRejectsNonPositivePriorities() {
        SumTreePriorityPool<Integer> pool = SumTreePriorityPool.bounded(4, new Random(7));
        pool.append(0);
        pool.sample(1);

        assertThrows(IllegalArgumentException.class, () -> pool.setLastPriority(new double[]{0.0}));
        assertThrows(IllegalArgumentException.class, () -> pool.append(1, -1.0));
    }

    @Test
    void testRejectsPriorityCountMismatch() {
        SumTreePriorityPool<Integer> pool = SumTreePriorityPool.bounded(4, new Random(7));
        pool.append(0);
        pool.append(1);
        pool.sample(2);

        assertThrows(IllegalArgumentException.class, () -> pool.setLastPriority(new double[]{1.0}));
    }

    @Test
    void testSecondDrawBeforePriorityUpdateFails() {
        SumTreePriorityPool<Integer> pool = SumTreePriorityPool.bounded(4, new Random(7));
        pool.append(0);
        pool.append(1);
        pool.sample(1);

        assertThrows(IllegalStateException.class, () -> pool.sample(1));
    }

    @Test
    void testNoWaitingWhenDisabled() {
        SumTreePriorityPool<Integer> pool = new SumTreePriorityPool<>(4, false, new Random(7));
        pool.append(0);
        pool.append(1);
        pool.sample(1);

        assertEquals(1, pool.sample(1).size());
    }

    @Test
    void testPriorityOfEvictedEntryIsNotReassigned() {
        SumTreePriorityPool<String> pool = SumTreePriorityPool.bounded(2, new Random(9));
        pool.append("a");
        pool.append("b");
        List<String> drawn = pool.sample(2).items;

        pool.append("c"); // overwrites the slot of "a"
        double[] priorities = new double[2];
        priorities[drawn.indexOf("a")] = 5.0;
        priorities[drawn.indexOf("b")] = 7.0;
        pool.setLastPriority(priorities);

        assertEquals("b", pool.get(0));
        assertEquals("c", pool.get(1));
        assertEquals(7.0, pool.priority(0), 1e-12);
        assertEquals(1.0, pool.priority(1), 1e-12);
    }

    @Test
    void testSampledItemsCoverWholePoolOverManyDraws() {
        SumTreePriorityPool<Integer> pool = SumTreePriorityPool.bounded(8, new Random(21));
        for (int i = 0; i < 8; i++) {
            pool.append(i, 1.0);
        }
        Set<Integer> seen = new HashSet<>();
        for (int i = 0; i < 200; i++) {
            seen.addAll(pool.sample(2).items);
            pool.setLastPriority(new double[]{1.0, 1.0});
        }
        assertEquals(8, seen.size());
    }
}
