package dqfd;

import dqfd.replay.DualReplayBuffer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Deque;
import java.util.LinkedList;

public class Main {
    private static final Logger LOGGER = LoggerFactory.getLogger(Main.class);

    public static void main(String[] args) {
        LOGGER.info("Starting DQfD training (Java / DL4J)");

        Config config = Config.builder()
                .hiddenDim(64)
                .bufferSize(20000)
                .numSteps(5)
                .batchSize(32)
                .replayStartSize(200)
                .nPretrainSteps(500)
                .targetUpdateInterval(250)
                .lr(1e-3)
                .numEpisodes(50)
                .maxStepsPerEpisode(50)
                .numDemoEpisodes(30)
                .build();

        StructuredTreeEnv env = new StructuredTreeEnv(config);
        DualReplayBuffer replayBuffer = DQfDAgent.newReplayBuffer(config);

        // --- Demonstrations ---
        new DemonstrationRecorder(env, replayBuffer).record(config.numDemoEpisodes);

        DQfDAgent agent = DQfDAgent.create(config, replayBuffer);

        // --- Pretraining on demonstrations only ---
        long startTime = System.currentTimeMillis();
        agent.pretrain();
        LOGGER.info("Pretraining done in {} s", String.format("%.2f", (System.currentTimeMillis() - startTime) / 1000.0));

        // --- Training Loop ---
        Deque<Double> scoresWindow = new LinkedList<>();
        final int scoreWindowSize = 10;

        for (int iEpisode = 1; iEpisode <= config.numEpisodes; iEpisode++) {
            double[] state = env.reset();
            double reward = 0.0;
            double episodeReward = 0.0;

            while (true) {
                int action = agent.actAndTrain(state, reward);
                StructuredTreeEnv.StepResult result = env.step(action);
                state = result.nextState;
                reward = result.reward;
                episodeReward += result.reward;
                if (result.done || result.truncated) {
                    agent.stopEpisodeAndTrain(state, reward, result.done);
                    break;
                }
            }

            if (scoresWindow.size() >= scoreWindowSize) {
                scoresWindow.removeFirst();
            }
            scoresWindow.addLast(episodeReward);
            double avgScore = scoresWindow.stream().mapToDouble(Double::doubleValue).average().orElse(0.0);

            LOGGER.info(String.format("Episode %d\tTotal Reward: %.2f\tAverage Reward (last %d): %.2f\tStats: %s",
                    iEpisode, episodeReward, scoresWindow.size(), avgScore, agent.statistics()));
        }

        LOGGER.info("Training finished in {} s, replay holds {} agent and {} demo experiences",
                String.format("%.2f", (System.currentTimeMillis() - startTime) / 1000.0),
                replayBuffer.agentSize(), replayBuffer.demoSize());
    }
}
