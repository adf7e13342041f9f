package dqfd;

import java.util.function.IntSupplier;

/**
 * Exploration strategy: picks the action actually taken, given a way to obtain the greedy one.
 */
public interface Explorer {

    int selectAction(long step, IntSupplier greedyAction);

    default void onEpisodeEnd() {
    }
}
