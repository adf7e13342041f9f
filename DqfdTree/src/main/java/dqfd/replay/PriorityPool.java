package dqfd.replay;

import java.util.List;

/**
 * Weighted-sampling container. Every stored item carries a strictly positive
 * priority and is drawn with probability {@code priority / totalPriority()}.
 *
 * @param <T> stored item type
 */
public interface PriorityPool<T> {

    /** Appends with the current maximum priority, so fresh items are likely to be seen soon. */
    void append(T item);

    void append(T item, double priority);

    /**
     * Draws {@code m} distinct items, each draw proportional to priority.
     *
     * @throws UnderflowException if {@code m} exceeds {@link #size()}
     */
    PoolSample<T> sample(int m);

    /**
     * Assigns priorities to the items of the most recent draw, in draw order.
     */
    void setLastPriority(double[] priorities);

    double totalPriority();

    double minPriority();

    double maxPriority();

    int size();

    /** Result of one draw. */
    final class PoolSample<T> {
        public final List<T> items;
        public final double[] probabilities;
        public final double minProbability;

        public PoolSample(List<T> items, double[] probabilities, double minProbability) {
            this.items = items;
            this.probabilities = probabilities;
            this.minProbability = minProbability;
        }

        public int size() {
            return items.size();
        }
    }
}
