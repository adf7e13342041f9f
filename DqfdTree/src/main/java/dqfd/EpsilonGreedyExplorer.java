package dqfd;

import java.util.Random;
import java.util.function.IntSupplier;

// Epsilon-greedy with multiplicative decay once per episode
public class EpsilonGreedyExplorer implements Explorer {
    private final int actionSize;
    private final double epsilonEnd;
    private final double epsilonDecay;
    private final Random random;
    private double epsilon;

    public EpsilonGreedyExplorer(int actionSize, double epsilonStart, double epsilonEnd,
                                 double epsilonDecay, Random random) {
        this.actionSize = actionSize;
        this.epsilon = epsilonStart;
        this.epsilonEnd = epsilonEnd;
        this.epsilonDecay = epsilonDecay;
        this.random = random;
    }

    public EpsilonGreedyExplorer(Config config) {
        this(config.actionSize, config.epsilonStart, config.epsilonEnd, config.epsilonDecay,
                new Random(config.randomSeed + 3));
    }

    @Override
    public int selectAction(long step, IntSupplier greedyAction) {
        if (random.nextDouble() < epsilon) {
            // Exploration
            return random.nextInt(actionSize);
        }
        return greedyAction.getAsInt();
    }

    @Override
    public void onEpisodeEnd() {
        this.epsilon = Math.max(epsilonEnd, epsilonDecay * this.epsilon);
    }

    public double getEpsilon() {
        return epsilon;
    }
}
