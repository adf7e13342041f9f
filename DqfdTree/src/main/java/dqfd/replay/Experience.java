package dqfd.replay;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

// A run of 1..N consecutive transitions from one episode, oldest first.
// This is the unit stored in a priority pool.
public class Experience {
    private final List<Transition> transitions;

    public Experience(List<Transition> transitions) {
        if (transitions.isEmpty()) {
            throw new IllegalArgumentException("An experience holds at least one transition");
        }
        this.transitions = Collections.unmodifiableList(new ArrayList<>(transitions));
    }

    public int length() {
        return transitions.size();
    }

    public Transition first() {
        return transitions.get(0);
    }

    public Transition last() {
        return transitions.get(transitions.size() - 1);
    }

    public Transition get(int index) {
        return transitions.get(index);
    }

    public List<Transition> transitions() {
        return transitions;
    }

    @Override
    public String toString() {
        return "Experience[length=" + transitions.size() + "]";
    }
}
