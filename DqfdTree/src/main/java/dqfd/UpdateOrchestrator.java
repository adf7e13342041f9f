package dqfd;

import dqfd.replay.DualReplayBuffer;
import dqfd.replay.SampledExperience;
import dqfd.replay.UpdateScheduler;
import org.nd4j.linalg.api.buffer.DataType;
import org.nd4j.linalg.api.ndarray.INDArray;
import org.nd4j.linalg.factory.Nd4j;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

// One DQfD update: 1-step and n-step double DQN losses plus the large-margin
// supervised loss on demonstrations, a single optimizer step, and the 1-step
// errors fed back to the replay buffer as priorities.
// The combined loss is differentiated analytically with respect to Q(s, .) and
// handed to the estimator, which back-propagates it through its parameters.
public class UpdateOrchestrator implements UpdateScheduler.UpdateFunction {
    private static final Logger LOGGER = LoggerFactory.getLogger(UpdateOrchestrator.class);

    private final QFunction qFunction;
    private final DualReplayBuffer replayBuffer;
    private final BatchAssembler assembler;
    private final boolean clipDelta;
    private final Config.BatchAccumulator batchAccumulator;
    private final double demoSupervisedMargin;
    private final double bonusPriorityAgent;
    private final double bonusPriorityDemo;
    private final double lossCoeffNStep;
    private final double lossCoeffSupervised;
    private final double averageLossDecay;

    private double averageLoss;
    private LossBreakdown lastLoss;
    private long updates;

    public UpdateOrchestrator(Config config, QFunction qFunction, DualReplayBuffer replayBuffer,
                              StatePreprocessor phi) {
        this.qFunction = qFunction;
        this.replayBuffer = replayBuffer;
        this.assembler = new BatchAssembler(config.gamma, phi);
        this.clipDelta = config.clipDelta;
        this.batchAccumulator = config.batchAccumulator;
        this.demoSupervisedMargin = config.demoSupervisedMargin;
        this.bonusPriorityAgent = config.bonusPriorityAgent;
        this.bonusPriorityDemo = config.bonusPriorityDemo;
        this.lossCoeffNStep = config.lossCoeffNStep;
        this.lossCoeffSupervised = config.lossCoeffSupervised;
        this.averageLossDecay = config.averageLossDecay;
    }

    @Override
    public void update(List<SampledExperience> agent, List<SampledExperience> demo) {
        int numAgent = agent.size();
        List<SampledExperience> experiences = new ArrayList<>(agent.size() + demo.size());
        experiences.addAll(agent);
        experiences.addAll(demo);
        ExperienceBatch batch = assembler.assembleSampled(experiences);
        int batchSize = batch.size();

        // Q(s, .) is computed once and shared by the TD and supervised terms
        INDArray qOut = qFunction.qValues(batch.state);
        double[] targetNStep = doubleDqnTargets(batch.rewardNStep, batch.nextStateNStep,
                batch.isStateTerminal, batch.discount);
        double[] target1Step = doubleDqnTargets(batch.reward1Step, batch.nextState1Step,
                batch.terminal1Step, batch.discount1Step);

        INDArray lossGradient = Nd4j.zeros(DataType.DOUBLE, batchSize, qFunction.actionSize());
        double tdDenominator = batchAccumulator == Config.BatchAccumulator.MEAN ? batchSize : 1.0;
        double loss1Step = 0.0;
        double lossNStep = 0.0;
        double[] errors = new double[batchSize];
        for (int i = 0; i < batchSize; i++) {
            int action = batch.action[i];
            double weight = batch.weights.getDouble(i, 0);
            double y = qOut.getDouble(i, action);
            double delta1 = y - target1Step[i];
            double deltaN = y - targetNStep[i];
            loss1Step += weight * valueLoss(delta1);
            lossNStep += weight * valueLoss(deltaN);
            errors[i] = Math.abs(delta1);
            double grad = weight * (valueLossGradient(delta1) + lossCoeffNStep * valueLossGradient(deltaN));
            lossGradient.putScalar(i, action, grad / tdDenominator);
        }
        loss1Step /= tdDenominator;
        lossNStep /= tdDenominator;

        // Bonus keeps both pools away from vanishing priorities
        double[] errorsAgent = new double[numAgent];
        double[] errorsDemo = new double[batchSize - numAgent];
        for (int i = 0; i < batchSize; i++) {
            if (i < numAgent) {
                errorsAgent[i] = errors[i] + bonusPriorityAgent;
            } else {
                errorsDemo[i - numAgent] = errors[i] + bonusPriorityDemo;
            }
        }
        replayBuffer.updateErrors(errorsAgent, errorsDemo);

        double lossSupervised = supervisedLoss(qOut, batch.action, numAgent, lossGradient);

        double lossCombined = loss1Step + lossCoeffNStep * lossNStep + lossCoeffSupervised * lossSupervised;
        qFunction.fitGradient(batch.state, lossGradient);

        averageLoss = decayedAverage(averageLoss, lossCombined, averageLossDecay);
        lastLoss = new LossBreakdown(lossCombined, loss1Step, lossNStep, lossSupervised);
        updates++;
        LOGGER.debug("Update {}: {} agent / {} demo samples, {}", updates, numAgent, batchSize - numAgent, lastLoss);
    }

    // Large-margin classification loss over the demonstration rows (index >= numAgent):
    // max_a [Q(s, a) + l(a_E, a)] - Q(s, a_E), with l = margin except 0 at the expert action.
    // Adds its gradient into lossGradient.
    double supervisedLoss(INDArray qOut, int[] actions, int numAgent, INDArray lossGradient) {
        int numDemo = actions.length - numAgent;
        if (numDemo == 0) {
            return 0.0;
        }
        double denominator = batchAccumulator == Config.BatchAccumulator.MEAN ? numDemo : 1.0;
        double scale = lossCoeffSupervised / denominator;
        int actionSize = qFunction.actionSize();
        double loss = 0.0;
        for (int i = numAgent; i < actions.length; i++) {
            int expert = actions[i];
            int best = expert;
            double bestValue = Double.NEGATIVE_INFINITY;
            for (int a = 0; a < actionSize; a++) {
                double value = qOut.getDouble(i, a) + (a == expert ? 0.0 : demoSupervisedMargin);
                if (value > bestValue) {
                    bestValue = value;
                    best = a;
                }
            }
            loss += bestValue - qOut.getDouble(i, expert);
            lossGradient.putScalar(i, best, lossGradient.getDouble(i, best) + scale);
            lossGradient.putScalar(i, expert, lossGradient.getDouble(i, expert) - scale);
        }
        return loss / denominator;
    }

    // Greedy next action from the online estimator, its value from the target estimator.
    double[] doubleDqnTargets(INDArray rewards, INDArray nextStates, INDArray terminals, INDArray discounts) {
        INDArray nextQOnline = qFunction.qValues(nextStates);
        INDArray greedy = Nd4j.argMax(nextQOnline, 1);
        INDArray nextQTarget = qFunction.targetQValues(nextStates);
        int n = (int) rewards.size(0);
        double[] targets = new double[n];
        for (int i = 0; i < n; i++) {
            double nextValue = nextQTarget.getDouble(i, greedy.getInt(i));
            targets[i] = rewards.getDouble(i, 0)
                    + discounts.getDouble(i, 0) * (1.0 - terminals.getDouble(i, 0)) * nextValue;
        }
        return targets;
    }

    private double valueLoss(double delta) {
        double abs = Math.abs(delta);
        if (clipDelta && abs > 1.0) {
            return abs - 0.5;
        }
        return 0.5 * delta * delta;
    }

    private double valueLossGradient(double delta) {
        if (clipDelta) {
            return Math.max(-1.0, Math.min(1.0, delta));
        }
        return delta;
    }

    static double decayedAverage(double previous, double value, double decay) {
        return decay * previous + (1.0 - decay) * value;
    }

    public double averageLoss() {
        return averageLoss;
    }

    // Loss terms of the most recent update, or null before the first one.
    public LossBreakdown lastLoss() {
        return lastLoss;
    }

    public long updates() {
        return updates;
    }

    public static final class LossBreakdown {
        public final double total;
        public final double oneStep;
        public final double nStep;
        public final double supervised;

        LossBreakdown(double total, double oneStep, double nStep, double supervised) {
            this.total = total;
            this.oneStep = oneStep;
            this.nStep = nStep;
            this.supervised = supervised;
        }

        @Override
        public String toString() {
            return String.format("loss=%.5f (1-step %.5f, n-step %.5f, supervised %.5f)",
                    total, oneStep, nStep, supervised);
        }
    }
}
