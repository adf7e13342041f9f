package dqfd.replay;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;

// Two independently prioritized pools: bounded agent pool, unbounded demo pool.
// Transitions reach them through per-environment n-step windows.
public class DualReplayBuffer {
    private static final Logger LOGGER = LoggerFactory.getLogger(DualReplayBuffer.class);

    private final SumTreePriorityPool<Experience> agentPool;
    private final SumTreePriorityPool<Experience> demoPool;
    private final TransitionWindowAggregator aggregator;
    private final PriorityWeighting weighting;
    private final Random random;

    public DualReplayBuffer(int agentCapacity, int numSteps, PriorityWeighting weighting,
                            boolean waitPriorityAfterSampling, long seed) {
        if (agentCapacity <= 0) {
            throw new ConfigurationException("Agent capacity must be positive, got " + agentCapacity);
        }
        this.random = new Random(seed);
        this.agentPool = new SumTreePriorityPool<>(agentCapacity, waitPriorityAfterSampling, new Random(seed + 1));
        this.demoPool = new SumTreePriorityPool<>(0, waitPriorityAfterSampling, new Random(seed + 2));
        this.weighting = weighting;
        this.aggregator = new TransitionWindowAggregator(numSteps, this::store);
        LOGGER.debug("Initialized DualReplayBuffer (agent capacity {}, {}-step windows)", agentCapacity, numSteps);
    }

    public synchronized void append(Transition transition, int envId, Origin origin) {
        aggregator.append(envId, transition, origin);
    }

    public void append(Transition transition) {
        append(transition, 0, Origin.AGENT);
    }

    // Flushes the window of an episode that ended without a terminal transition.
    public synchronized void stopCurrentEpisode(int envId, Origin origin) {
        aggregator.stopCurrentEpisode(envId, origin);
    }

    // Stores an already-windowed demonstration, e.g. from a fixed dataset.
    public synchronized void addDemonstration(Experience experience) {
        if (experience.length() > aggregator.numSteps()) {
            throw new IllegalArgumentException("Experience of length " + experience.length()
                    + " exceeds the window size " + aggregator.numSteps());
        }
        demoPool.append(experience);
    }

    public DualSample sample(int n) {
        return sample(n, false);
    }

    // Draws n experiences. Unless demoOnly, the agent share is
    // Binomial(n, p) with p the agent pool's fraction of the total priority mass,
    // capped at the agent pool size; the rest comes from the demo pool.
    public synchronized DualSample sample(int n, boolean demoOnly) {
        if (demoOnly) {
            return new DualSample(Collections.emptyList(), sampleFrom(Origin.DEMO, n));
        }
        double massAgent = agentPool.totalPriority();
        double massDemo = demoPool.totalPriority();
        double pAgent = massAgent + massDemo > 0.0 ? massAgent / (massAgent + massDemo) : 0.0;

        int nAgent = 0;
        for (int i = 0; i < n; i++) {
            if (random.nextDouble() < pAgent) {
                nAgent++;
            }
        }
        // Not enough agent experience yet, take more demonstrations
        nAgent = Math.min(nAgent, agentPool.size());
        int nDemo = n - nAgent;
        if (nDemo > demoPool.size()) {
            throw new UnderflowException(nDemo, demoPool.size());
        }

        List<SampledExperience> agent = sampleFrom(Origin.AGENT, nAgent);
        List<SampledExperience> demo = sampleFrom(Origin.DEMO, nDemo);
        return new DualSample(agent, demo);
    }

    // Feeds fresh errors back as priorities. Each array must follow the order of
    // the most recent draw from its pool; an empty array leaves that pool alone.
    public synchronized void updateErrors(double[] agentErrors, double[] demoErrors) {
        if (demoErrors.length > 0) {
            demoPool.setLastPriority(weighting.priorityFromErrors(demoErrors));
        }
        if (agentErrors.length > 0) {
            agentPool.setLastPriority(weighting.priorityFromErrors(agentErrors));
        }
    }

    public synchronized int size() {
        return agentPool.size() + demoPool.size();
    }

    public synchronized int agentSize() {
        return agentPool.size();
    }

    public synchronized int demoSize() {
        return demoPool.size();
    }

    // Stored experiences of one pool, oldest first, copied under the buffer's lock
    public synchronized List<Experience> snapshot(Origin origin) {
        SumTreePriorityPool<Experience> pool = pool(origin);
        List<Experience> experiences = new ArrayList<>(pool.size());
        for (int i = 0; i < pool.size(); i++) {
            experiences.add(pool.get(i));
        }
        return Collections.unmodifiableList(experiences);
    }

    SumTreePriorityPool<Experience> pool(Origin origin) {
        return origin == Origin.AGENT ? agentPool : demoPool;
    }

    public synchronized int windowLength(int envId) {
        return aggregator.windowLength(envId);
    }

    private void store(Origin origin, Experience experience) {
        switch (origin) {
            case AGENT:
                agentPool.append(experience);
                break;
            case DEMO:
                demoPool.append(experience);
                break;
            default:
                throw new IllegalArgumentException("Unknown origin " + origin);
        }
    }

    private List<SampledExperience> sampleFrom(Origin origin, int m) {
        SumTreePriorityPool<Experience> pool = pool(origin);
        if (m == 0) {
            return new ArrayList<>();
        }
        PriorityPool.PoolSample<Experience> drawn = pool.sample(m);
        double[] weights = weighting.weightsFromProbabilities(drawn.probabilities, drawn.minProbability, pool.size());
        List<SampledExperience> sampled = new ArrayList<>(m);
        for (int i = 0; i < m; i++) {
            sampled.add(new SampledExperience(drawn.items.get(i), weights[i]));
        }
        return sampled;
    }

    // A draw split by origin; the two lists are never merged here.
    public static class DualSample {
        public final List<SampledExperience> agent;
        public final List<SampledExperience> demo;

        public DualSample(List<SampledExperience> agent, List<SampledExperience> demo) {
            this.agent = agent;
            this.demo = demo;
        }

        public int size() {
            return agent.size() + demo.size();
        }
    }
}
