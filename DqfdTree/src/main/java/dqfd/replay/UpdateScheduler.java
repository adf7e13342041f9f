package dqfd.replay;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

// Decides when a training update fires and feeds it freshly drawn experiences.
public class UpdateScheduler {
    private static final Logger LOGGER = LoggerFactory.getLogger(UpdateScheduler.class);

    // Consumes one draw, agent-origin and demo-origin lists kept apart.
    public interface UpdateFunction {
        void update(List<SampledExperience> agent, List<SampledExperience> demo);
    }

    private final DualReplayBuffer replayBuffer;
    private final UpdateFunction updateFunction;
    private final int batchSize;
    private final int nTimesUpdate;
    private final int replayStartSize;
    private final int updateInterval;

    public UpdateScheduler(DualReplayBuffer replayBuffer, UpdateFunction updateFunction, int batchSize,
                           int nTimesUpdate, int replayStartSize, int updateInterval) {
        if (batchSize > replayStartSize) {
            throw new ConfigurationException("Minibatch size " + batchSize
                    + " exceeds the replay start size " + replayStartSize);
        }
        if (updateInterval <= 0) {
            throw new ConfigurationException("Update interval must be positive, got " + updateInterval);
        }
        this.replayBuffer = replayBuffer;
        this.updateFunction = updateFunction;
        this.batchSize = batchSize;
        this.nTimesUpdate = nTimesUpdate;
        this.replayStartSize = replayStartSize;
        this.updateInterval = updateInterval;
    }

    // Called on every environment step, true when updates ran
    public boolean updateIfNecessary(long iteration) {
        int buffered = replayBuffer.size();
        if (buffered < replayStartSize) {
            LOGGER.debug("Skipping update at step {}: {} buffered, {} needed", iteration, buffered, replayStartSize);
            return false;
        }
        if (iteration % updateInterval != 0) {
            return false;
        }
        for (int i = 0; i < nTimesUpdate; i++) {
            DualReplayBuffer.DualSample sample = replayBuffer.sample(batchSize);
            updateFunction.update(sample.agent, sample.demo);
        }
        return true;
    }

    // One pretraining update; every sample comes from the demonstration pool.
    public void updateFromDemonstrations() {
        DualReplayBuffer.DualSample sample = replayBuffer.sample(batchSize, true);
        updateFunction.update(sample.agent, sample.demo);
    }
}
