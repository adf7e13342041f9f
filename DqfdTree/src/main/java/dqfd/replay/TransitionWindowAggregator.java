package dqfd.replay;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.Map;

// Sliding window of at most numSteps transitions per environment, turned into experiences.
//  - non-terminal step: a full window is emitted and keeps sliding
//  - terminal step: the window and each of its suffixes are emitted, longest first
//  - abandoned episode: a short window is emitted once, the oldest transition is
//    dropped (a full window already started with it), then the suffixes follow
public class TransitionWindowAggregator {
    private static final Logger LOGGER = LoggerFactory.getLogger(TransitionWindowAggregator.class);

    // Receives finished experiences.
    public interface ExperienceSink {
        void accept(Origin origin, Experience experience);
    }

    private final int numSteps;
    private final ExperienceSink sink;
    private final Map<Integer, Deque<Transition>> windows = new HashMap<>();

    public TransitionWindowAggregator(int numSteps, ExperienceSink sink) {
        if (numSteps < 1) {
            throw new ConfigurationException("numSteps must be at least 1, got " + numSteps);
        }
        this.numSteps = numSteps;
        this.sink = sink;
    }

    public void append(int envId, Transition transition, Origin origin) {
        Deque<Transition> window = windows.computeIfAbsent(envId, id -> new ArrayDeque<>(numSteps + 1));
        window.addLast(transition);
        if (window.size() > numSteps) {
            window.removeFirst();
        }
        if (transition.terminal) {
            drain(envId, window, origin);
        } else if (window.size() == numSteps) {
            emit(origin, window);
        }
    }

    public void stopCurrentEpisode(int envId, Origin origin) {
        Deque<Transition> window = windows.get(envId);
        if (window == null || window.isEmpty()) {
            return;
        }
        if (window.size() < numSteps) {
            emit(origin, window);
        }
        window.removeFirst();
        drain(envId, window, origin);
        LOGGER.debug("Flushed abandoned episode window of env {}", envId);
    }

    // Current window length for envId; 0 when none exists.
    public int windowLength(int envId) {
        Deque<Transition> window = windows.get(envId);
        return window == null ? 0 : window.size();
    }

    public int numSteps() {
        return numSteps;
    }

    private void drain(int envId, Deque<Transition> window, Origin origin) {
        int length = window.size();
        for (int i = 0; i < length; i++) {
            emit(origin, window);
            window.removeFirst();
        }
        if (!window.isEmpty()) {
            throw new InvariantViolationException("Window of env " + envId + " not drained at episode end");
        }
    }

    private void emit(Origin origin, Deque<Transition> window) {
        sink.accept(origin, new Experience(new ArrayList<>(window)));
    }
}
