package dqfd;

import org.nd4j.linalg.api.ndarray.INDArray;

// Fixed-shape tensors built from a list of variable-length experiences.
// Row i of every array belongs to sample i. Per-sample scalars are column vectors.
public class ExperienceBatch {
    public final INDArray state;            // [B, features] first-transition states
    public final int[] action;              // first-transition actions
    public final INDArray rewardNStep;      // discounted reward over the whole window
    public final INDArray nextStateNStep;   // last transition's next state
    public final INDArray reward1Step;
    public final INDArray nextState1Step;
    public final INDArray isStateTerminal;  // 1 if any transition of the window is terminal
    public final INDArray discount;         // gamma^windowLength
    public final INDArray terminal1Step;    // first transition's terminal flag
    public final INDArray discount1Step;    // gamma
    public final int[] nextAction;          // null unless every window ends with a known next action
    public final INDArray weights;          // importance weights, 1 when none were attached

    ExperienceBatch(INDArray state, int[] action, INDArray rewardNStep, INDArray nextStateNStep,
                    INDArray reward1Step, INDArray nextState1Step, INDArray isStateTerminal,
                    INDArray discount, INDArray terminal1Step, INDArray discount1Step,
                    int[] nextAction, INDArray weights) {
        this.state = state;
        this.action = action;
        this.rewardNStep = rewardNStep;
        this.nextStateNStep = nextStateNStep;
        this.reward1Step = reward1Step;
        this.nextState1Step = nextState1Step;
        this.isStateTerminal = isStateTerminal;
        this.discount = discount;
        this.terminal1Step = terminal1Step;
        this.discount1Step = discount1Step;
        this.nextAction = nextAction;
        this.weights = weights;
    }

    public int size() {
        return action.length;
    }

    public boolean hasNextAction() {
        return nextAction != null;
    }
}
