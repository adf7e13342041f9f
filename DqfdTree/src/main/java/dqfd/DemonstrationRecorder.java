package dqfd;

import dqfd.replay.DualReplayBuffer;
import dqfd.replay.Origin;
import dqfd.replay.Transition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

// Plays the environment's scripted expert and stores every step as a demonstration.
public class DemonstrationRecorder {
    private static final Logger LOGGER = LoggerFactory.getLogger(DemonstrationRecorder.class);

    private final StructuredTreeEnv env;
    private final DualReplayBuffer replayBuffer;

    public DemonstrationRecorder(StructuredTreeEnv env, DualReplayBuffer replayBuffer) {
        this.env = env;
        this.replayBuffer = replayBuffer;
    }

    // Returns the number of transitions recorded
    public int record(int episodes) {
        int transitions = 0;
        for (int episode = 0; episode < episodes; episode++) {
            double[] state = env.reset();
            int action = env.expertAction(state);
            while (true) {
                StructuredTreeEnv.StepResult result = env.step(action);
                int nextAction = env.expertAction(result.nextState);
                replayBuffer.append(new Transition(state, action, result.reward, result.nextState,
                        nextAction, result.done), 0, Origin.DEMO);
                transitions++;
                if (result.done || result.truncated) {
                    break;
                }
                state = result.nextState;
                action = nextAction;
            }
            replayBuffer.stopCurrentEpisode(0, Origin.DEMO);
        }
        LOGGER.info("Recorded {} demonstration transitions over {} episodes ({} demo experiences)",
                transitions, episodes, replayBuffer.demoSize());
        return transitions;
    }
}
