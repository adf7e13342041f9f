package dqfd;

import dqfd.replay.ConfigurationException;
import dqfd.replay.PriorityWeighting.WeightNormalization;

public class Config {
    public enum TargetUpdateMethod { HARD, SOFT }

    public enum BatchAccumulator { MEAN, SUM }

    // Environment/Network parameters
    public final int stateSize;
    public final int actionSize;
    public final int hiddenDim;

    // Replay Buffer parameters
    public final int bufferSize;            // agent pool capacity, demonstrations excluded
    public final int numSteps;              // n of the n-step windows
    public final int batchSize;
    public final int replayStartSize;
    public final boolean waitPriorityAfterSampling;

    // Prioritization
    public final double alpha;
    public final double beta0;
    public final double betaSteps;
    public final double priorityEps;
    public final Double errorMin;           // null disables the clip
    public final Double errorMax;
    public final WeightNormalization weightNormalization;

    // Training parameters
    public final double gamma;              // Discount factor
    public final double lr;                 // Learning rate
    public final int updateEvery;           // Steps between learning updates
    public final int nTimesUpdate;
    public final int targetUpdateInterval;
    public final TargetUpdateMethod targetUpdateMethod;
    public final double tau;                // Soft update factor
    public final boolean clipDelta;
    public final BatchAccumulator batchAccumulator;

    // DQfD loss
    public final int nPretrainSteps;
    public final double demoSupervisedMargin;
    public final double bonusPriorityAgent;
    public final double bonusPriorityDemo;
    public final double lossCoeffNStep;
    public final double lossCoeffSupervised;
    public final double lossCoeffL2;

    // Statistics
    public final double averageQDecay;
    public final double averageLossDecay;

    // Epsilon-greedy parameters
    public final double epsilonStart;
    public final double epsilonEnd;
    public final double epsilonDecay;

    // Training loop parameters
    public final int numEpisodes;
    public final int maxStepsPerEpisode;
    public final int numDemoEpisodes;

    public final long randomSeed;

    private Config(Builder b) {
        this.stateSize = b.stateSize;
        this.actionSize = b.actionSize;
        this.hiddenDim = b.hiddenDim;
        this.bufferSize = b.bufferSize;
        this.numSteps = b.numSteps;
        this.batchSize = b.batchSize;
        this.replayStartSize = b.replayStartSize;
        this.waitPriorityAfterSampling = b.waitPriorityAfterSampling;
        this.alpha = b.alpha;
        this.beta0 = b.beta0;
        this.betaSteps = b.betaSteps;
        this.priorityEps = b.priorityEps;
        this.errorMin = b.errorMin;
        this.errorMax = b.errorMax;
        this.weightNormalization = b.weightNormalization;
        this.gamma = b.gamma;
        this.lr = b.lr;
        this.updateEvery = b.updateEvery;
        this.nTimesUpdate = b.nTimesUpdate;
        this.targetUpdateInterval = b.targetUpdateInterval;
        this.targetUpdateMethod = b.targetUpdateMethod;
        this.tau = b.tau;
        this.clipDelta = b.clipDelta;
        this.batchAccumulator = b.batchAccumulator;
        this.nPretrainSteps = b.nPretrainSteps;
        this.demoSupervisedMargin = b.demoSupervisedMargin;
        this.bonusPriorityAgent = b.bonusPriorityAgent;
        this.bonusPriorityDemo = b.bonusPriorityDemo;
        this.lossCoeffNStep = b.lossCoeffNStep;
        this.lossCoeffSupervised = b.lossCoeffSupervised;
        this.lossCoeffL2 = b.lossCoeffL2;
        this.averageQDecay = b.averageQDecay;
        this.averageLossDecay = b.averageLossDecay;
        this.epsilonStart = b.epsilonStart;
        this.epsilonEnd = b.epsilonEnd;
        this.epsilonDecay = b.epsilonDecay;
        this.numEpisodes = b.numEpisodes;
        this.maxStepsPerEpisode = b.maxStepsPerEpisode;
        this.numDemoEpisodes = b.numDemoEpisodes;
        this.randomSeed = b.randomSeed;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static Config defaults() {
        return builder().build();
    }

    public static class Builder {
        private int stateSize = 4;
        private int actionSize = 3;
        private int hiddenDim = 128;

        private int bufferSize = 50000;
        private int numSteps = 10;
        private int batchSize = 32;
        private int replayStartSize = 1000;
        private boolean waitPriorityAfterSampling = true;

        private double alpha = 0.6;
        private double beta0 = 0.4;
        private double betaSteps = 2e5;
        private double priorityEps = 0.01;
        private Double errorMin = 0.0;
        private Double errorMax = 1.0;
        private WeightNormalization weightNormalization = WeightNormalization.GLOBAL_MIN;

        private double gamma = 0.99;
        private double lr = 1e-4;
        private int updateEvery = 1;
        private int nTimesUpdate = 1;
        private int targetUpdateInterval = 1000;
        private TargetUpdateMethod targetUpdateMethod = TargetUpdateMethod.HARD;
        private double tau = 1e-2;
        private boolean clipDelta = true;
        private BatchAccumulator batchAccumulator = BatchAccumulator.MEAN;

        private int nPretrainSteps = 1000;
        private double demoSupervisedMargin = 0.8;
        private double bonusPriorityAgent = 0.001;
        private double bonusPriorityDemo = 1.0;
        private double lossCoeffNStep = 1.0;
        private double lossCoeffSupervised = 1.0;
        private double lossCoeffL2 = 1e-5;

        private double averageQDecay = 0.999;
        private double averageLossDecay = 0.99;

        private double epsilonStart = 1.0;
        private double epsilonEnd = 0.01;
        private double epsilonDecay = 0.996;

        private int numEpisodes = 50;
        private int maxStepsPerEpisode = 50;
        private int numDemoEpisodes = 20;

        private long randomSeed = 42L;

        public Builder stateSize(int v) { this.stateSize = v; return this; }
        public Builder actionSize(int v) { this.actionSize = v; return this; }
        public Builder hiddenDim(int v) { this.hiddenDim = v; return this; }
        public Builder bufferSize(int v) { this.bufferSize = v; return this; }
        public Builder numSteps(int v) { this.numSteps = v; return this; }
        public Builder batchSize(int v) { this.batchSize = v; return this; }
        public Builder replayStartSize(int v) { this.replayStartSize = v; return this; }
        public Builder waitPriorityAfterSampling(boolean v) { this.waitPriorityAfterSampling = v; return this; }
        public Builder alpha(double v) { this.alpha = v; return this; }
        public Builder beta0(double v) { this.beta0 = v; return this; }
        public Builder betaSteps(double v) { this.betaSteps = v; return this; }
        public Builder priorityEps(double v) { this.priorityEps = v; return this; }
        public Builder errorMin(Double v) { this.errorMin = v; return this; }
        public Builder errorMax(Double v) { this.errorMax = v; return this; }
        public Builder weightNormalization(WeightNormalization v) { this.weightNormalization = v; return this; }
        public Builder gamma(double v) { this.gamma = v; return this; }
        public Builder lr(double v) { this.lr = v; return this; }
        public Builder updateEvery(int v) { this.updateEvery = v; return this; }
        public Builder nTimesUpdate(int v) { this.nTimesUpdate = v; return this; }
        public Builder targetUpdateInterval(int v) { this.targetUpdateInterval = v; return this; }
        public Builder targetUpdateMethod(TargetUpdateMethod v) { this.targetUpdateMethod = v; return this; }
        public Builder tau(double v) { this.tau = v; return this; }
        public Builder clipDelta(boolean v) { this.clipDelta = v; return this; }
        public Builder batchAccumulator(BatchAccumulator v) { this.batchAccumulator = v; return this; }
        public Builder nPretrainSteps(int v) { this.nPretrainSteps = v; return this; }
        public Builder demoSupervisedMargin(double v) { this.demoSupervisedMargin = v; return this; }
        public Builder bonusPriorityAgent(double v) { this.bonusPriorityAgent = v; return this; }
        public Builder bonusPriorityDemo(double v) { this.bonusPriorityDemo = v; return this; }
        public Builder lossCoeffNStep(double v) { this.lossCoeffNStep = v; return this; }
        public Builder lossCoeffSupervised(double v) { this.lossCoeffSupervised = v; return this; }
        public Builder lossCoeffL2(double v) { this.lossCoeffL2 = v; return this; }
        public Builder averageQDecay(double v) { this.averageQDecay = v; return this; }
        public Builder averageLossDecay(double v) { this.averageLossDecay = v; return this; }
        public Builder epsilonStart(double v) { this.epsilonStart = v; return this; }
        public Builder epsilonEnd(double v) { this.epsilonEnd = v; return this; }
        public Builder epsilonDecay(double v) { this.epsilonDecay = v; return this; }
        public Builder numEpisodes(int v) { this.numEpisodes = v; return this; }
        public Builder maxStepsPerEpisode(int v) { this.maxStepsPerEpisode = v; return this; }
        public Builder numDemoEpisodes(int v) { this.numDemoEpisodes = v; return this; }
        public Builder randomSeed(long v) { this.randomSeed = v; return this; }

        public Config build() {
            requirePositive("stateSize", stateSize);
            requirePositive("actionSize", actionSize);
            requirePositive("hiddenDim", hiddenDim);
            requirePositive("bufferSize", bufferSize);
            requirePositive("numSteps", numSteps);
            requirePositive("batchSize", batchSize);
            requirePositive("updateEvery", updateEvery);
            requirePositive("nTimesUpdate", nTimesUpdate);
            requirePositive("targetUpdateInterval", targetUpdateInterval);
            if (batchSize > replayStartSize) {
                throw new ConfigurationException("batchSize (" + batchSize
                        + ") must not exceed replayStartSize (" + replayStartSize + ")");
            }
            if (!(gamma > 0.0 && gamma <= 1.0)) {
                throw new ConfigurationException("gamma must be in (0, 1], got " + gamma);
            }
            if (!(priorityEps > 0.0)) {
                throw new ConfigurationException("priorityEps must be positive, got " + priorityEps);
            }
            if (errorMin != null && errorMax != null && errorMin > errorMax) {
                throw new ConfigurationException("errorMin " + errorMin + " exceeds errorMax " + errorMax);
            }
            return new Config(this);
        }

        private static void requirePositive(String name, int value) {
            if (value <= 0) {
                throw new ConfigurationException(name + " must be positive, got " + value);
            }
        }
    }
}
