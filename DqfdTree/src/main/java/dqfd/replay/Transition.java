package dqfd.replay;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;

// One environment step. Immutable once created.
public class Transition {
    public final double[] state;
    public final int action;
    public final double reward;
    public final double[] nextState;   // null when the step has no successor observation
    public final Integer nextAction;   // null when the follow-up action is unknown
    public final boolean terminal;
    private final Map<String, Object> extras;

    public Transition(double[] state, int action, double reward, double[] nextState, boolean terminal) {
        this(state, action, reward, nextState, null, terminal, Collections.emptyMap());
    }

    public Transition(double[] state, int action, double reward, double[] nextState,
                      Integer nextAction, boolean terminal) {
        this(state, action, reward, nextState, nextAction, terminal, Collections.emptyMap());
    }

    public Transition(double[] state, int action, double reward, double[] nextState,
                      Integer nextAction, boolean terminal, Map<String, Object> extras) {
        if (state == null) {
            throw new IllegalArgumentException("state must not be null");
        }
        // Store copies, callers tend to reuse their observation buffers
        this.state = state.clone();
        this.action = action;
        this.reward = reward;
        this.nextState = nextState == null ? null : nextState.clone();
        this.nextAction = nextAction;
        this.terminal = terminal;
        this.extras = extras == null || extras.isEmpty()
                ? Collections.emptyMap()
                : Collections.unmodifiableMap(new HashMap<>(extras));
    }

    public boolean hasNextState() {
        return nextState != null;
    }

    public boolean hasNextAction() {
        return nextAction != null;
    }

    public Map<String, Object> extras() {
        return extras;
    }

    // Typed view of an auxiliary field, null when absent. ClassCastException on a type mismatch.
    public <T> T extra(String key, Class<T> type) {
        Object value = extras.get(key);
        return value == null ? null : type.cast(value);
    }
}
