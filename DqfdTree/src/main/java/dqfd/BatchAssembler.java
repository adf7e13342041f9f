package dqfd;

import dqfd.replay.Experience;
import dqfd.replay.SampledExperience;
import dqfd.replay.Transition;
import org.nd4j.linalg.api.ndarray.INDArray;
import org.nd4j.linalg.factory.Nd4j;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

// Vectorizes experiences holding 1..n consecutive transitions each, keeping both
// the n-step view (whole window) and the 1-step view (first transition).
public class BatchAssembler {
    private final double gamma;
    private final StatePreprocessor phi;

    public BatchAssembler(double gamma, StatePreprocessor phi) {
        this.gamma = gamma;
        this.phi = phi;
    }

    public ExperienceBatch assembleSampled(List<SampledExperience> sampled) {
        List<Experience> experiences = new ArrayList<>(sampled.size());
        double[] weights = new double[sampled.size()];
        for (int i = 0; i < sampled.size(); i++) {
            experiences.add(sampled.get(i).experience);
            weights[i] = sampled.get(i).weight;
        }
        return assemble(experiences, weights);
    }

    public ExperienceBatch assemble(List<Experience> experiences) {
        double[] weights = new double[experiences.size()];
        Arrays.fill(weights, 1.0);
        return assemble(experiences, weights);
    }

    public ExperienceBatch assemble(List<Experience> experiences, double[] weights) {
        int n = experiences.size();
        if (n == 0) {
            throw new IllegalArgumentException("Cannot assemble an empty batch");
        }
        if (weights.length != n) {
            throw new IllegalArgumentException("Expected " + n + " weights, got " + weights.length);
        }

        double[][] states = new double[n][];
        int[] actions = new int[n];
        double[] rewardsNStep = new double[n];
        double[][] nextStatesNStep = new double[n][];
        double[] rewards1Step = new double[n];
        double[][] nextStates1Step = new double[n][];
        double[] terminals = new double[n];
        double[] discounts = new double[n];
        double[] terminals1Step = new double[n];
        double[] discounts1Step = new double[n];
        int[] nextActions = new int[n];
        boolean allNextActions = true;

        for (int i = 0; i < n; i++) {
            Experience exp = experiences.get(i);
            Transition first = exp.first();
            Transition last = exp.last();

            states[i] = phi.apply(first.state);
            actions[i] = first.action;

            double discounted = 0.0;
            double factor = 1.0;
            boolean anyTerminal = false;
            for (Transition t : exp.transitions()) {
                discounted += factor * t.reward;
                factor *= gamma;
                anyTerminal |= t.terminal;
            }
            rewardsNStep[i] = discounted;
            nextStatesNStep[i] = nextStateOf(last);
            terminals[i] = anyTerminal ? 1.0 : 0.0;
            discounts[i] = Math.pow(gamma, exp.length());

            rewards1Step[i] = first.reward;
            nextStates1Step[i] = nextStateOf(first);
            terminals1Step[i] = first.terminal ? 1.0 : 0.0;
            discounts1Step[i] = gamma;

            if (last.hasNextAction()) {
                nextActions[i] = last.nextAction;
            } else {
                allNextActions = false;
            }
        }

        return new ExperienceBatch(
                Nd4j.create(states),
                actions,
                column(rewardsNStep),
                Nd4j.create(nextStatesNStep),
                column(rewards1Step),
                Nd4j.create(nextStates1Step),
                column(terminals),
                column(discounts),
                column(terminals1Step),
                column(discounts1Step),
                allNextActions ? nextActions : null,
                column(weights.clone()));
    }

    private double[] nextStateOf(Transition transition) {
        if (transition.hasNextState()) {
            return phi.apply(transition.nextState);
        }
        // No successor observation; the bootstrap term is masked by the terminal flag
        return new double[phi.apply(transition.state).length];
    }

    private static INDArray column(double[] values) {
        return Nd4j.create(values, new int[]{values.length, 1});
    }
}
