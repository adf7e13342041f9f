package dqfd.replay;

import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class DualReplayBufferTest {

    private static DualReplayBuffer newBuffer(int capacity, int numSteps) {
        PriorityWeighting weighting = new PriorityWeighting(0.6, 0.4, 2e5, 0.01, 0.0, 1.0,
                PriorityWeighting.WeightNormalization.GLOBAL_MIN);
        return new DualReplayBuffer(capacity, numSteps, weighting, true, 7);
    }

    private static Transition transition(double reward, boolean terminal) {
        return new Transition(new double[]{reward, 0.0}, 0, reward, new double[]{reward + 1, 0.0}, terminal);
    }

    private static void preloadDemos(DualReplayBuffer buffer, int count) {
        for (int i = 0; i < count; i++) {
            buffer.addDemonstration(new Experience(Collections.singletonList(transition(-i, true))));
        }
    }

    private static double[] filled(int length, double value) {
        double[] values = new double[length];
        Arrays.fill(values, value);
        return values;
    }

    @Test
    void testAgentExperiencesAppearAsWindowsFill() {
        DualReplayBuffer buffer = newBuffer(100, 3);
        preloadDemos(buffer, 10);

        buffer.append(transition(1, false));
        buffer.append(transition(2, false));
        assertEquals(10, buffer.size());
        assertEquals(0, buffer.agentSize());

        buffer.append(transition(3, false));
        assertEquals(1, buffer.agentSize());
        assertEquals(3, buffer.pool(Origin.AGENT).get(0).length());

        buffer.append(transition(4, true));
        assertEquals(4, buffer.agentSize());
        assertEquals(14, buffer.size());
        assertEquals(0, buffer.windowLength(0));
        assertEquals(10, buffer.demoSize());
    }

    @Test
    void testTerminalOnThirdStepFlushesThreeSuffixes() {
        DualReplayBuffer buffer = newBuffer(100, 3);

        buffer.append(transition(1, false));
        buffer.append(transition(2, false));
        buffer.append(transition(3, true));

        assertEquals(3, buffer.agentSize());
        SumTreePriorityPool<Experience> pool = buffer.pool(Origin.AGENT);
        assertEquals(3, pool.get(0).length());
        assertEquals(2, pool.get(1).length());
        assertEquals(1, pool.get(2).length());
    }

    @Test
    void testDemoTransitionsGoToDemoPool() {
        DualReplayBuffer buffer = newBuffer(100, 2);

        buffer.append(transition(1, false), 0, Origin.DEMO);
        buffer.append(transition(2, false), 0, Origin.DEMO);
        buffer.stopCurrentEpisode(0, Origin.DEMO);

        assertEquals(2, buffer.demoSize());
        assertEquals(0, buffer.agentSize());
    }

    @Test
    void testAgentPoolEvictsAtCapacity() {
        DualReplayBuffer buffer = newBuffer(2, 1);

        for (int i = 0; i < 5; i++) {
            buffer.append(transition(i, false));
        }

        assertEquals(2, buffer.agentSize());
        assertEquals(3.0, buffer.pool(Origin.AGENT).get(0).first().reward);
    }

    @Test
    void testDemoPoolIsNeverEvicted() {
        DualReplayBuffer buffer = newBuffer(2, 1);
        preloadDemos(buffer, 50);

        assertEquals(50, buffer.demoSize());
    }

    @Test
    void testRejectsDemonstrationLongerThanWindow() {
        DualReplayBuffer buffer = newBuffer(10, 1);
        Experience tooLong = new Experience(Arrays.asList(transition(1, false), transition(2, true)));

        assertThrows(IllegalArgumentException.class, () -> buffer.addDemonstration(tooLong));
    }

    @Test
    void testDemoOnlyDrawTakesEveryDemonstration() {
        DualReplayBuffer buffer = newBuffer(100, 3);
        preloadDemos(buffer, 4);
        buffer.append(transition(1, true));

        DualReplayBuffer.DualSample sample = buffer.sample(4, true);

        assertTrue(sample.agent.isEmpty());
        Set<Experience> distinct = new HashSet<>();
        sample.demo.forEach(s -> distinct.add(s.experience));
        assertEquals(4, distinct.size());

        buffer.updateErrors(new double[0], filled(4, 0.5));
        assertThrows(UnderflowException.class, () -> buffer.sample(5, true));
    }

    @Test
    void testDrawShortOfDemonstrationsUnderflows() {
        DualReplayBuffer buffer = newBuffer(100, 1);
        preloadDemos(buffer, 2);

        assertThrows(UnderflowException.class, () -> buffer.sample(3));
        assertEquals(2, buffer.sample(2).demo.size());
    }

    @Test
    void testDrawSplitsBetweenPools() {
        DualReplayBuffer buffer = newBuffer(100, 1);
        preloadDemos(buffer, 20);
        for (int i = 0; i < 5; i++) {
            buffer.append(transition(i, false));
        }

        int agentDrawn = 0;
        for (int round = 0; round < 50; round++) {
            DualReplayBuffer.DualSample sample = buffer.sample(8);
            assertEquals(8, sample.size());
            assertTrue(sample.agent.size() <= buffer.agentSize());
            agentDrawn += sample.agent.size();
            sample.agent.forEach(s -> assertTrue(s.weight > 0.0 && s.weight <= 1.0 + 1e-12));
            buffer.updateErrors(filled(sample.agent.size(), 0.2), filled(sample.demo.size(), 0.2));
        }
        assertTrue(agentDrawn > 0);
    }

    @Test
    void testAgentOnlyBufferDrawsAgentExperiences() {
        DualReplayBuffer buffer = newBuffer(100, 1);
        for (int i = 0; i < 4; i++) {
            buffer.append(transition(i, false));
        }

        DualReplayBuffer.DualSample sample = buffer.sample(3);

        assertEquals(3, sample.agent.size());
        assertTrue(sample.demo.isEmpty());
    }

    @Test
    void testEqualPrioritiesGiveUnitWeights() {
        DualReplayBuffer buffer = newBuffer(100, 1);
        preloadDemos(buffer, 5);

        DualReplayBuffer.DualSample sample = buffer.sample(3, true);

        sample.demo.forEach(s -> assertEquals(1.0, s.weight, 1e-12));
    }

    @Test
    void testZeroErrorsStillLeavePositivePriorities() {
        DualReplayBuffer buffer = newBuffer(100, 1);
        preloadDemos(buffer, 3);
        for (int i = 0; i < 3; i++) {
            buffer.append(transition(i, false));
        }

        DualReplayBuffer.DualSample first = buffer.sample(3, true);
        buffer.updateErrors(new double[0], filled(first.demo.size(), 0.0));
        assertEquals(Math.pow(0.01, 0.6), buffer.pool(Origin.DEMO).minPriority(), 1e-12);

        DualReplayBuffer.DualSample second = buffer.sample(3);
        // bonuses as the learner adds them on top of a zero error
        buffer.updateErrors(filled(second.agent.size(), 0.001), filled(second.demo.size(), 1.0));

        assertTrue(buffer.pool(Origin.AGENT).minPriority() > 0.0);
        assertTrue(buffer.pool(Origin.DEMO).minPriority() > 0.0);
    }

    @Test
    void testSnapshotIsReadOnlyCopyOldestFirst() {
        DualReplayBuffer buffer = newBuffer(2, 1);
        for (int i = 0; i < 3; i++) {
            buffer.append(transition(i, false));
        }

        List<Experience> agent = buffer.snapshot(Origin.AGENT);
        buffer.append(transition(3, false));

        assertEquals(2, agent.size());
        assertEquals(1.0, agent.get(0).first().reward);
        assertEquals(2.0, agent.get(1).first().reward);
        assertThrows(UnsupportedOperationException.class, () -> agent.remove(0));
        assertEquals(3.0, buffer.snapshot(Origin.AGENT).get(1).first().reward);
        assertTrue(buffer.snapshot(Origin.DEMO).isEmpty());
    }

    @Test
    void testEmptyErrorArraysAreNoop() {
        DualReplayBuffer buffer = newBuffer(100, 1);
        preloadDemos(buffer, 2);

        buffer.updateErrors(new double[0], new double[0]);

        assertEquals(2.0, buffer.pool(Origin.DEMO).totalPriority(), 1e-12);
    }
}
