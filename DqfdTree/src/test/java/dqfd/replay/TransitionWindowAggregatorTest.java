package dqfd.replay;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class TransitionWindowAggregatorTest {

    private final List<Origin> origins = new ArrayList<>();
    private final List<Experience> emitted = new ArrayList<>();

    private TransitionWindowAggregator aggregator(int numSteps) {
        return new TransitionWindowAggregator(numSteps, (origin, experience) -> {
            origins.add(origin);
            emitted.add(experience);
        });
    }

    // Reward doubles as the step number so windows can be checked for order
    private static Transition step(int number, boolean terminal) {
        return new Transition(new double[]{number}, 0, number, new double[]{number + 1}, terminal);
    }

    private void runEpisode(TransitionWindowAggregator aggregator, int length, boolean terminate) {
        for (int i = 1; i <= length; i++) {
            aggregator.append(0, step(i, terminate && i == length), Origin.AGENT);
        }
    }

    private int[] lengths() {
        return emitted.stream().mapToInt(Experience::length).toArray();
    }

    private int[] firstSteps() {
        return emitted.stream().mapToInt(e -> (int) e.first().reward).toArray();
    }

    @Test
    void testShortTerminatedEpisodeEmitsAllSuffixes() {
        TransitionWindowAggregator aggregator = aggregator(3);

        runEpisode(aggregator, 2, true);

        assertArrayEquals(new int[]{2, 1}, lengths());
        assertArrayEquals(new int[]{1, 2}, firstSteps());
        assertEquals(0, aggregator.windowLength(0));
    }

    @Test
    void testEpisodeOfWindowLengthEmitsOnlyOnTermination() {
        TransitionWindowAggregator aggregator = aggregator(3);

        runEpisode(aggregator, 3, true);

        assertArrayEquals(new int[]{3, 2, 1}, lengths());
    }

    @Test
    void testLongEpisodeSlidesThenFlushes() {
        TransitionWindowAggregator aggregator = aggregator(3);

        runEpisode(aggregator, 5, false);
        assertArrayEquals(new int[]{3, 3, 3}, lengths());
        assertArrayEquals(new int[]{1, 2, 3}, firstSteps());
        assertEquals(3, aggregator.windowLength(0));

        aggregator.append(0, step(6, true), Origin.AGENT);

        assertArrayEquals(new int[]{3, 3, 3, 3, 2, 1}, lengths());
        assertArrayEquals(new int[]{1, 2, 3, 4, 5, 6}, firstSteps());
        assertEquals(0, aggregator.windowLength(0));
    }

    @Test
    void testWindowsHoldConsecutiveTransitionsOldestFirst() {
        TransitionWindowAggregator aggregator = aggregator(3);

        runEpisode(aggregator, 4, true);

        for (Experience experience : emitted) {
            double expected = experience.first().reward;
            for (Transition transition : experience.transitions()) {
                assertEquals(expected++, transition.reward);
            }
        }
    }

    @Test
    void testTerminatedEpisodesEmitOneExperiencePerTransition() {
        for (int n = 1; n <= 4; n++) {
            for (int length = 1; length <= 9; length++) {
                emitted.clear();
                TransitionWindowAggregator aggregator = aggregator(n);

                runEpisode(aggregator, length, true);

                assertEquals(length, emitted.size(), "n=" + n + " length=" + length);
                int fullLength = Math.min(n, length);
                long full = emitted.stream().filter(e -> e.length() == fullLength).count();
                assertEquals(Math.max(1, length - n + 1), full, "n=" + n + " length=" + length);
                int[] expectedFirst = new int[length];
                for (int i = 0; i < length; i++) {
                    expectedFirst[i] = i + 1;
                }
                assertArrayEquals(expectedFirst, firstSteps());
            }
        }
    }

    @Test
    void testAbandonedShortEpisodeEmitsWindowOnceThenSuffixes() {
        TransitionWindowAggregator aggregator = aggregator(3);
        runEpisode(aggregator, 2, false);
        assertEquals(0, emitted.size());

        aggregator.stopCurrentEpisode(0, Origin.AGENT);

        assertArrayEquals(new int[]{2, 1}, lengths());
        assertArrayEquals(new int[]{1, 2}, firstSteps());
        assertEquals(0, aggregator.windowLength(0));
    }

    @Test
    void testAbandonedFullWindowSkipsAlreadyEmittedWindow() {
        TransitionWindowAggregator aggregator = aggregator(3);
        runEpisode(aggregator, 3, false);
        assertArrayEquals(new int[]{3}, lengths());

        aggregator.stopCurrentEpisode(0, Origin.AGENT);

        assertArrayEquals(new int[]{3, 2, 1}, lengths());
        assertArrayEquals(new int[]{1, 2, 3}, firstSteps());
    }

    @Test
    void testAbandonedEpisodesEmitOneExperiencePerTransition() {
        for (int n = 1; n <= 4; n++) {
            for (int length = 1; length <= 9; length++) {
                emitted.clear();
                TransitionWindowAggregator aggregator = aggregator(n);

                runEpisode(aggregator, length, false);
                aggregator.stopCurrentEpisode(0, Origin.AGENT);

                assertEquals(length, emitted.size(), "n=" + n + " length=" + length);
                int[] sortedFirst = firstSteps();
                Arrays.sort(sortedFirst);
                for (int i = 0; i < length; i++) {
                    assertEquals(i + 1, sortedFirst[i]);
                }
            }
        }
    }

    @Test
    void testStopWithoutWindowIsNoop() {
        TransitionWindowAggregator aggregator = aggregator(3);

        aggregator.stopCurrentEpisode(4, Origin.DEMO);
        runEpisode(aggregator, 2, true);
        aggregator.stopCurrentEpisode(0, Origin.AGENT);

        assertEquals(2, emitted.size());
    }

    @Test
    void testEnvironmentsKeepSeparateWindows() {
        TransitionWindowAggregator aggregator = aggregator(2);

        aggregator.append(0, step(1, false), Origin.AGENT);
        aggregator.append(1, step(100, false), Origin.AGENT);
        assertEquals(0, emitted.size());

        aggregator.append(0, step(2, false), Origin.AGENT);
        assertEquals(1, emitted.size());
        assertEquals(1.0, emitted.get(0).first().reward);
        assertEquals(2.0, emitted.get(0).last().reward);
        assertEquals(1, aggregator.windowLength(1));
    }

    @Test
    void testOriginIsForwarded() {
        TransitionWindowAggregator aggregator = aggregator(1);

        aggregator.append(0, step(1, false), Origin.DEMO);
        aggregator.append(1, step(1, false), Origin.AGENT);

        assertEquals(Arrays.asList(Origin.DEMO, Origin.AGENT), origins);
    }

    @Test
    void testRejectsZeroWindow() {
        assertThrows(ConfigurationException.class, () -> aggregator(0));
    }
}
