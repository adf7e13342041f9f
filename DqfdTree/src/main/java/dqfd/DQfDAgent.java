package dqfd;

import dqfd.replay.DualReplayBuffer;
import dqfd.replay.Origin;
import dqfd.replay.PriorityWeighting;
import dqfd.replay.Transition;
import dqfd.replay.UpdateScheduler;
import org.nd4j.linalg.api.ndarray.INDArray;
import org.nd4j.linalg.factory.Nd4j;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.Map;

// Deep Q-learning from Demonstrations (Hester et al., https://arxiv.org/abs/1704.03732).
// Pretrains on the demonstration pool only, then keeps learning from a mix of its
// own prioritized experience and the persistent demonstrations.
public class DQfDAgent {
    private static final Logger LOGGER = LoggerFactory.getLogger(DQfDAgent.class);

    private final Config config;
    private final QFunction qFunction;
    private final DualReplayBuffer replayBuffer;
    private final Explorer explorer;
    private final StatePreprocessor phi;
    private final UpdateOrchestrator orchestrator;
    private final UpdateScheduler replayUpdater;

    private long t;
    private double averageQ;
    private double[] lastState;
    private int lastAction;
    private double[][] batchLastObs;
    private int[] batchLastAction;

    public DQfDAgent(Config config, QFunction qFunction, DualReplayBuffer replayBuffer,
                     Explorer explorer, StatePreprocessor phi) {
        this.config = config;
        this.qFunction = qFunction;
        this.replayBuffer = replayBuffer;
        this.explorer = explorer;
        this.phi = phi;
        this.orchestrator = new UpdateOrchestrator(config, qFunction, replayBuffer, phi);
        this.replayUpdater = new UpdateScheduler(replayBuffer, orchestrator, config.batchSize,
                config.nTimesUpdate, config.replayStartSize, config.updateEvery);

        LOGGER.info("Initialized DQfDAgent: {} actions, {}-step returns, minibatch {}",
                qFunction.actionSize(), config.numSteps, config.batchSize);
    }

    public static DualReplayBuffer newReplayBuffer(Config config) {
        PriorityWeighting weighting = new PriorityWeighting(config.alpha, config.beta0, config.betaSteps,
                config.priorityEps, config.errorMin, config.errorMax, config.weightNormalization);
        return new DualReplayBuffer(config.bufferSize, config.numSteps, weighting,
                config.waitPriorityAfterSampling, config.randomSeed + 5);
    }

    // Agent with a DL4J estimator and epsilon-greedy exploration.
    public static DQfDAgent create(Config config, DualReplayBuffer replayBuffer) {
        return new DQfDAgent(config, new DenseQFunction(config), replayBuffer,
                new EpsilonGreedyExplorer(config),
                StatePreprocessor.identity());
    }

    // Supervised phase, run once before any interaction
    public void pretrain() {
        int steps = config.nPretrainSteps;
        int reportEvery = Math.max(1, steps / 10);
        for (int tpre = 0; tpre < steps; tpre++) {
            replayUpdater.updateFromDemonstrations();
            if (tpre % config.targetUpdateInterval == 0) {
                syncTargetNetwork();
            }
            if ((tpre + 1) % reportEvery == 0) {
                LOGGER.info("Pretrain step {}/{} average loss {}", tpre + 1, steps,
                        String.format("%.5f", orchestrator.averageLoss()));
            }
        }
    }

    // Greedy action, no exploration, no learning.
    public int act(double[] obs) {
        INDArray actionValues = evaluate(new double[][]{obs});
        return Nd4j.argMax(actionValues, 1).getInt(0);
    }

    public int actAndTrain(double[] obs, double reward) {
        INDArray actionValues = evaluate(new double[][]{obs});
        double q = actionValues.maxNumber().doubleValue();
        int greedyAction = Nd4j.argMax(actionValues, 1).getInt(0);

        // Update stats
        averageQ = UpdateOrchestrator.decayedAverage(averageQ, q, config.averageQDecay);
        LOGGER.debug("t:{} q:{}", t, q);

        int action = explorer.selectAction(t, () -> greedyAction);
        t++;

        if (t % config.targetUpdateInterval == 0) {
            syncTargetNetwork();
        }

        if (lastState != null) {
            replayBuffer.append(new Transition(lastState, lastAction, reward, obs, action, false),
                    0, Origin.AGENT);
        }
        lastState = obs.clone();
        lastAction = action;

        replayUpdater.updateIfNecessary(t);
        LOGGER.debug("t:{} r:{} a:{}", t, reward, action);
        return action;
    }

    // Ends the episode of environment 0. done is false when the episode was cut short.
    public void stopEpisodeAndTrain(double[] obs, double reward, boolean done) {
        if (lastState == null) {
            throw new IllegalStateException("stopEpisodeAndTrain called before any action in this episode");
        }
        replayBuffer.append(new Transition(lastState, lastAction, reward, obs, lastAction, done),
                0, Origin.AGENT);
        stopEpisode();
    }

    public void stopEpisode() {
        lastState = null;
        replayBuffer.stopCurrentEpisode(0, Origin.AGENT);
        explorer.onEpisodeEnd();
    }

    // Acts in several environments at once; environment id = batch index.
    public int[] batchActAndTrain(double[][] batchObs) {
        INDArray actionValues = evaluate(batchObs);
        INDArray greedy = Nd4j.argMax(actionValues, 1);
        double meanMaxQ = actionValues.max(1).meanNumber().doubleValue();

        int[] actions = new int[batchObs.length];
        for (int i = 0; i < batchObs.length; i++) {
            int greedyAction = greedy.getInt(i);
            actions[i] = explorer.selectAction(t, () -> greedyAction);
        }
        batchLastObs = new double[batchObs.length][];
        for (int i = 0; i < batchObs.length; i++) {
            batchLastObs[i] = batchObs[i].clone();
        }
        batchLastAction = actions.clone();

        averageQ = UpdateOrchestrator.decayedAverage(averageQ, meanMaxQ, config.averageQDecay);
        return actions;
    }

    public void batchObserveAndTrain(double[][] batchObs, double[] batchReward,
                                     boolean[] batchDone, boolean[] batchReset) {
        for (int i = 0; i < batchObs.length; i++) {
            t++;
            if (t % config.targetUpdateInterval == 0) {
                syncTargetNetwork();
            }
            if (batchLastObs != null && batchLastObs[i] != null) {
                replayBuffer.append(new Transition(batchLastObs[i], batchLastAction[i], batchReward[i],
                        batchObs[i], null, batchDone[i]), i, Origin.AGENT);
                if (batchReset[i] || batchDone[i]) {
                    batchLastObs[i] = null;
                    replayBuffer.stopCurrentEpisode(i, Origin.AGENT);
                }
            }
            replayUpdater.updateIfNecessary(t);
        }
    }

    public Map<String, Double> statistics() {
        Map<String, Double> stats = new LinkedHashMap<>();
        stats.put("average_q", averageQ);
        stats.put("average_loss", orchestrator.averageLoss());
        return stats;
    }

    public long getStep() {
        return t;
    }

    public UpdateOrchestrator getOrchestrator() {
        return orchestrator;
    }

    private void syncTargetNetwork() {
        if (config.targetUpdateMethod == Config.TargetUpdateMethod.SOFT) {
            qFunction.softUpdateTarget(config.tau);
        } else {
            qFunction.syncTarget();
        }
    }

    private INDArray evaluate(double[][] observations) {
        double[][] features = new double[observations.length][];
        for (int i = 0; i < observations.length; i++) {
            features[i] = phi.apply(observations[i]);
        }
        return qFunction.qValues(Nd4j.create(features));
    }
}
