package dqfd;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Arrays;
import java.util.Random;

// Small synthetic task. Features: 0 complexity, 1 urgency, 2 interaction flag, 3+ noise.
// Answering an urgent state with action 0 pays off and ends the episode; running out
// of steps truncates it without a terminal state.
public class StructuredTreeEnv {
    private static final Logger LOGGER = LoggerFactory.getLogger(StructuredTreeEnv.class);

    private static final double URGENT = 0.7;
    private static final double INTERACTIVE = 0.5;

    private final int stateSize;
    private final int actionSize;
    private final int maxSteps;
    private final Random random;
    private double[] state;
    private int stepsTaken;

    public StructuredTreeEnv(int stateSize, int actionSize, int maxSteps, long seed) {
        if (stateSize < 3 || actionSize < 3) {
            throw new IllegalArgumentException("Need at least 3 features and 3 actions, got "
                    + stateSize + " and " + actionSize);
        }
        this.stateSize = stateSize;
        this.actionSize = actionSize;
        this.maxSteps = maxSteps;
        this.random = new Random(seed);
        this.state = new double[stateSize];
        LOGGER.debug("Initialized StructuredTreeEnv (state size {}, action size {}, max steps {})",
                stateSize, actionSize, maxSteps);
    }

    public StructuredTreeEnv(Config config) {
        this(config.stateSize, config.actionSize, config.maxStepsPerEpisode, config.randomSeed + 4);
    }

    public double[] reset() {
        for (int i = 0; i < stateSize; i++) {
            state[i] = random.nextDouble();
        }
        state[1] = random.nextDouble() * 0.5; // start calm
        state[2] = 0.0;
        stepsTaken = 0;
        return Arrays.copyOf(state, stateSize);
    }

    public StepResult step(int action) {
        if (action < 0 || action >= actionSize) {
            throw new IllegalArgumentException("Invalid action " + action + " for action size " + actionSize);
        }
        stepsTaken++;
        double reward = rewardFor(state, action);

        double[] next = new double[stateSize];
        next[0] = state[0] * 0.9 + random.nextDouble() * 0.1;
        next[1] = random.nextDouble();
        next[2] = random.nextDouble() > 0.8 ? 1.0 : 0.0;
        for (int i = 3; i < stateSize; i++) {
            next[i] = random.nextDouble() * 0.1;
        }
        if (action == 0) {
            next[1] *= 0.5;
        } else if (action == 1) {
            next[2] = 0.0;
        }
        next[0] *= 0.95 + action * 0.01;
        for (int i = 0; i < stateSize; i++) {
            state[i] = Math.max(0.0, Math.min(1.0, next[i]));
        }

        boolean done = reward > URGENT;
        boolean truncated = !done && stepsTaken >= maxSteps;
        return new StepResult(Arrays.copyOf(state, stateSize), reward, done, truncated);
    }

    // What a competent operator does: handle urgency first, then pending interaction.
    public int expertAction(double[] observation) {
        if (observation[1] > URGENT) {
            return 0;
        }
        return 1;
    }

    private double rewardFor(double[] s, int action) {
        double reward = -0.05; // Base cost per step
        if (s[1] > URGENT && action == 0) {
            reward += 0.8;
        } else if (s[2] > INTERACTIVE && action == 1) {
            reward += 0.6;
        } else if (action == 2) {
            reward -= 0.1;
        } else {
            reward += random.nextDouble() * 0.1;
        }
        return reward;
    }

    public static class StepResult {
        public final double[] nextState;
        public final double reward;
        public final boolean done;       // terminal state reached
        public final boolean truncated;  // step limit hit, episode cut short

        public StepResult(double[] nextState, double reward, boolean done, boolean truncated) {
            this.nextState = nextState;
            this.reward = reward;
            this.done = done;
            this.truncated = truncated;
        }
    }
}
