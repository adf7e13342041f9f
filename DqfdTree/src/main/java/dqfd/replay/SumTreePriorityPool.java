package dqfd.replay;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Random;

// Priority pool backed by a sum tree and a min tree laid out over insertion slots.
// Append, draw and priority update are O(log n).
// A bounded pool is a ring: once capacity items are stored, each append
// overwrites the oldest slot. An unbounded pool doubles its trees when full and
// never evicts.
// Not thread-safe; the owning buffer serializes access.
public class SumTreePriorityPool<T> implements PriorityPool<T> {
    private static final Logger LOGGER = LoggerFactory.getLogger(SumTreePriorityPool.class);
    private static final int INITIAL_UNBOUNDED_LEAVES = 16;

    private final int capacity; // <= 0 means unbounded
    private final boolean waitPriorityAfterSampling;
    private final Random random;

    private final List<T> items = new ArrayList<>();
    private long[] stamps;
    private double[] sums;
    private double[] mins;
    private int leafCount;

    private int head; // slot of the oldest item
    private int size;
    private long nextStamp;
    private double maxPriority;

    private int[] lastSlots = new int[0];
    private long[] lastStamps = new long[0];
    private boolean awaitingPriority;

    public SumTreePriorityPool(int capacity, boolean waitPriorityAfterSampling, Random random) {
        this.capacity = capacity;
        this.waitPriorityAfterSampling = waitPriorityAfterSampling;
        this.random = random;
        this.maxPriority = 1.0;
        allocate(capacity > 0 ? nextPowerOfTwo(capacity) : INITIAL_UNBOUNDED_LEAVES);
    }

    public static <T> SumTreePriorityPool<T> bounded(int capacity, Random random) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("Capacity must be positive, got " + capacity);
        }
        return new SumTreePriorityPool<>(capacity, true, random);
    }

    public static <T> SumTreePriorityPool<T> unbounded(Random random) {
        return new SumTreePriorityPool<>(0, true, random);
    }

    public boolean isBounded() {
        return capacity > 0;
    }

    @Override
    public void append(T item) {
        append(item, maxPriority);
    }

    @Override
    public void append(T item, double priority) {
        checkPriority(priority);
        int slot;
        if (isBounded() && size == capacity) {
            slot = head;
            head = (head + 1) % capacity;
        } else {
            if (!isBounded() && size == leafCount) {
                grow();
            }
            slot = isBounded() ? (head + size) % capacity : size;
            size++;
        }
        items.set(slot, item);
        stamps[slot] = ++nextStamp;
        setSum(slot, priority);
        setMin(slot, priority);
    }

    @Override
    public PoolSample<T> sample(int m) {
        if (m < 0) {
            throw new IllegalArgumentException("Sample size must be non-negative, got " + m);
        }
        if (m > size) {
            throw new UnderflowException(m, size);
        }
        if (waitPriorityAfterSampling && awaitingPriority) {
            throw new IllegalStateException("Priorities of the previous draw have not been set yet");
        }
        if (m == 0) {
            return new PoolSample<>(new ArrayList<>(), new double[0], 0.0);
        }

        double total = sums[1];
        double minProbability = mins[1] / total;
        int[] slots = new int[m];
        double[] priorities = new double[m];

        // Zero each drawn leaf so the next draw cannot pick it again, then restore
        for (int i = 0; i < m; i++) {
            int slot = find(random.nextDouble() * sums[1]);
            slots[i] = slot;
            priorities[i] = sums[slot + leafCount];
            setSum(slot, 0.0);
        }
        for (int i = 0; i < m; i++) {
            setSum(slots[i], priorities[i]);
        }

        List<T> sampled = new ArrayList<>(m);
        double[] probabilities = new double[m];
        long[] drawnStamps = new long[m];
        for (int i = 0; i < m; i++) {
            sampled.add(itemAt(slots[i]));
            probabilities[i] = priorities[i] / total;
            drawnStamps[i] = stamps[slots[i]];
        }
        lastSlots = slots;
        lastStamps = drawnStamps;
        awaitingPriority = true;
        return new PoolSample<>(sampled, probabilities, minProbability);
    }

    @Override
    public void setLastPriority(double[] priorities) {
        if (waitPriorityAfterSampling && !awaitingPriority) {
            throw new IllegalStateException("No draw is waiting for priorities");
        }
        if (priorities.length != lastSlots.length) {
            throw new IllegalArgumentException("Expected " + lastSlots.length
                    + " priorities for the last draw, got " + priorities.length);
        }
        for (double p : priorities) {
            checkPriority(p);
        }
        int skipped = 0;
        for (int i = 0; i < priorities.length; i++) {
            int slot = lastSlots[i];
            if (stamps[slot] != lastStamps[i]) {
                // evicted and overwritten since the draw
                skipped++;
                continue;
            }
            setSum(slot, priorities[i]);
            setMin(slot, priorities[i]);
            maxPriority = Math.max(maxPriority, priorities[i]);
        }
        if (skipped > 0) {
            LOGGER.debug("Skipped {} priority updates for entries evicted since the last draw", skipped);
        }
        lastSlots = new int[0];
        lastStamps = new long[0];
        awaitingPriority = false;
    }

    @Override
    public double totalPriority() {
        return sums[1];
    }

    @Override
    public double minPriority() {
        return size == 0 ? 0.0 : mins[1];
    }

    @Override
    public double maxPriority() {
        return maxPriority;
    }

    @Override
    public int size() {
        return size;
    }

    // Item by age, 0 being the oldest still stored.
    public T get(int index) {
        return itemAt(slotOf(index));
    }

    // Priority by age, 0 being the oldest still stored.
    public double priority(int index) {
        return sums[slotOf(index) + leafCount];
    }

    public boolean isAwaitingPriority() {
        return awaitingPriority;
    }

    private int slotOf(int index) {
        if (index < 0 || index >= size) {
            throw new IndexOutOfBoundsException("Index " + index + " out of range for size " + size);
        }
        return isBounded() ? (head + index) % capacity : index;
    }

    private T itemAt(int slot) {
        return items.get(slot);
    }

    private int find(double value) {
        double u = value;
        int node = 1;
        while (node < leafCount) {
            int left = node << 1;
            if (u < sums[left] || sums[left + 1] <= 0.0) {
                node = left;
            } else {
                u -= sums[left];
                node = left + 1;
            }
        }
        return node - leafCount;
    }

    private void setSum(int slot, double value) {
        int node = slot + leafCount;
        sums[node] = value;
        for (node >>= 1; node >= 1; node >>= 1) {
            sums[node] = sums[node << 1] + sums[(node << 1) + 1];
        }
    }

    private void setMin(int slot, double value) {
        int node = slot + leafCount;
        mins[node] = value;
        for (node >>= 1; node >= 1; node >>= 1) {
            mins[node] = Math.min(mins[node << 1], mins[(node << 1) + 1]);
        }
    }

    private void allocate(int leaves) {
        leafCount = leaves;
        // one item per leaf, null until the slot is first written
        items.addAll(Collections.nCopies(leaves - items.size(), null));
        stamps = new long[leaves];
        sums = new double[2 * leaves];
        mins = new double[2 * leaves];
        Arrays.fill(mins, Double.POSITIVE_INFINITY);
    }

    private void grow() {
        long[] oldStamps = stamps;
        double[] oldSums = sums;
        double[] oldMins = mins;
        int oldLeaves = leafCount;

        allocate(oldLeaves * 2);
        System.arraycopy(oldStamps, 0, stamps, 0, oldLeaves);
        System.arraycopy(oldSums, oldLeaves, sums, leafCount, oldLeaves);
        System.arraycopy(oldMins, oldLeaves, mins, leafCount, oldLeaves);
        for (int node = leafCount - 1; node >= 1; node--) {
            sums[node] = sums[node << 1] + sums[(node << 1) + 1];
            mins[node] = Math.min(mins[node << 1], mins[(node << 1) + 1]);
        }
        LOGGER.debug("Grew unbounded pool to {} slots", leafCount);
    }

    private static void checkPriority(double priority) {
        if (!(priority > 0.0) || Double.isInfinite(priority)) {
            throw new IllegalArgumentException("Priority must be positive and finite, got " + priority);
        }
    }

    private static int nextPowerOfTwo(int n) {
        int leaves = 1;
        while (leaves < n) {
            leaves <<= 1;
        }
        return leaves;
    }
}
