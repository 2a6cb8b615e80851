/**
 * Copyright (C) 2016, BMW AG
 * Author: Stefan Holder (stefan.holder@bmw.de)
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *    http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package com.bmw.viterbi;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Random;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import org.junit.Test;

public class ViterbiAlgorithmTest {

    private static final double DELTA = 1e-9;

    private static HiddenMarkovModel coinModel() {
        return HiddenMarkovModel.fromProbabilities(
                new double[] {0.5, 0.5},
                new double[][] {{0.75, 0.25}, {0.25, 0.75}},
                new double[][] {{0.5, 0.5}, {0.25, 0.75}});
    }

    /**
     * State 0: coding region, state 1: non-coding region.
     * Labels 0 to 3: nucleotides A, C, G, T.
     */
    private static HiddenMarkovModel dnaModel() {
        return HiddenMarkovModel.fromProbabilities(
                new double[] {0.5, 0.5},
                new double[][] {{0.98, 0.02}, {0.02, 0.98}},
                new double[][] {{0.18, 0.32, 0.32, 0.18}, {0.25, 0.25, 0.25, 0.25}});
    }

    @Test
    public void testCoins() {
        final ViterbiAlgorithm.Result result =
                new ViterbiAlgorithm().compute(coinModel(), new int[] {0, 0, 1, 1, 1});
        assertEquals(Arrays.asList(0, 0, 1, 1, 1), result.mostLikelySequence);
        assertEquals(7.9052624949519075, result.pathCost, DELTA);
        assertEquals(Math.pow(2.0, -7.9052624949519075), result.pathProbability(), DELTA);
        assertNull(result.messageHistory);
    }

    @Test
    public void testBackPointers() {
        final ViterbiAlgorithm.Result result = coinModel().decode(0, 0, 1, 1, 1);
        assertEquals(5, result.numberOfTimeSteps());
        final int[][] expected = {{0, 1}, {0, 0}, {0, 1}, {0, 1}, {0, 1}};
        for (int t = 0; t < expected.length; t++) {
            for (int state = 0; state < 2; state++) {
                assertEquals(expected[t][state], result.backPointer(t, state));
            }
        }
    }

    @Test
    public void testMessageHistory() {
        final ViterbiAlgorithm.Result result = coinModel().decode(
                new ViterbiAlgorithmParams().setKeepMessageHistory(true), 0, 0, 1, 1, 1);
        final List<Vector> history = result.messageHistory;
        assertEquals(6, history.size());
        assertEquals(1.0, history.get(0).get(0), DELTA);
        assertEquals(1.0, history.get(0).get(1), DELTA);
        assertEquals(2.415037499278844, history.get(1).get(0), DELTA);
        assertEquals(3.415037499278844, history.get(1).get(1), DELTA);
        assertEquals(8.07518749639422, history.get(5).get(0), DELTA);
        assertEquals(7.9052624949519075, history.get(5).get(1), DELTA);
        assertTrue(result.messageHistoryString().startsWith("Message history"));
    }

    @Test
    public void testSingleObservation() {
        final ViterbiAlgorithm.Result result = coinModel().decode(1);
        assertEquals(Arrays.asList(1), result.mostLikelySequence);
        assertEquals(1.8300749985576878, result.pathCost, DELTA);
    }

    @Test
    public void testRainAndUmbrella() {
        // State 0: rain, state 1: sun. Label 0: umbrella, label 1: no umbrella.
        final HiddenMarkovModel hmm = HiddenMarkovModel.fromProbabilities(
                new double[] {0.5, 0.5},
                new double[][] {{0.7, 0.3}, {0.3, 0.7}},
                new double[][] {{0.9, 0.1}, {0.2, 0.8}});
        final ViterbiAlgorithm.Result result = hmm.decode(0, 0, 1, 0, 0);
        assertEquals(Arrays.asList(0, 0, 1, 0, 0), result.mostLikelySequence);
        assertEquals(6.947591175489248, result.pathCost, DELTA);
    }

    @Test
    public void testDnaShortSequenceIsNonCoding() {
        // ATGCGA
        final List<Integer> states = dnaModel().mapEstimate(0, 3, 2, 1, 2, 0);
        assertEquals(Arrays.asList(1, 1, 1, 1, 1, 1), states);
    }

    @Test
    public void testDnaGcRichSequenceIsCoding() {
        final ViterbiAlgorithm.Result result = dnaModel().decode(
                1, 2, 2, 1, 2, 1, 1, 2, 0, 3, 0, 3, 3, 0, 0, 3, 1, 2, 2, 1);
        for (int state : result.mostLikelySequence) {
            assertEquals(0, state);
        }
        assertEquals(20, result.mostLikelySequence.size());
        assertEquals(41.10065069714633, result.pathCost, DELTA);
    }

    @Test
    public void testImpossibleEmission() {
        // State 1 never emits label 0.
        final HiddenMarkovModel hmm = HiddenMarkovModel.fromProbabilities(
                new double[] {0.5, 0.5},
                new double[][] {{0.6, 0.4}, {0.3, 0.7}},
                new double[][] {{0.5, 0.5}, {0.0, 1.0}});
        final ViterbiAlgorithm.Result result = hmm.decode(0, 1, 1, 0);
        assertEquals(Arrays.asList(0, 1, 1, 0), result.mostLikelySequence);
        assertEquals(7.310432456049534, result.pathCost, DELTA);
    }

    @Test
    public void testLongSequenceDoesNotUnderflow() {
        final int[] observations = new int[6000];
        Arrays.fill(observations, 3000, observations.length, 1);

        final ViterbiAlgorithm.Result result = coinModel().decode(observations);
        assertEquals(observations.length, result.mostLikelySequence.size());
        for (int t = 0; t < observations.length; t++) {
            assertEquals("time step " + t, t < 3000 ? 0 : 1,
                    (int) result.mostLikelySequence.get(t));
        }
        assertFalse(Double.isInfinite(result.pathCost));
        assertEquals(6737.922456009252, result.pathCost, 1e-6);
    }

    @Test
    public void testPathLengthAndStateRange() {
        final HiddenMarkovModel hmm = HiddenMarkovModel.fromProbabilities(
                new double[] {0.2, 0.3, 0.5},
                new double[][] {{0.6, 0.3, 0.1}, {0.1, 0.8, 0.1}, {0.3, 0.3, 0.4}},
                new double[][] {{0.7, 0.2, 0.1}, {0.1, 0.1, 0.8}, {0.3, 0.4, 0.3}});
        final Random random = new Random(42);
        for (int run = 0; run < 50; run++) {
            final int[] observations = new int[1 + random.nextInt(40)];
            for (int t = 0; t < observations.length; t++) {
                observations[t] = random.nextInt(hmm.labelCount());
            }
            final List<Integer> states = hmm.mapEstimate(observations);
            assertEquals(observations.length, states.size());
            for (int state : states) {
                assertTrue(state >= 0 && state < hmm.stateCount());
            }
            assertEquals(states, hmm.mapEstimate(observations));
        }
    }

    @Test
    public void testConcurrentDecodingOnSharedModel() throws Exception {
        final HiddenMarkovModel hmm = dnaModel();
        final Random random = new Random(7);
        final List<int[]> sequences = new ArrayList<>();
        final List<List<Integer>> expected = new ArrayList<>();
        for (int i = 0; i < 32; i++) {
            final int[] observations = new int[200 + random.nextInt(200)];
            for (int t = 0; t < observations.length; t++) {
                observations[t] = random.nextInt(hmm.labelCount());
            }
            sequences.add(observations);
            expected.add(hmm.mapEstimate(observations));
        }

        final ExecutorService executor = Executors.newFixedThreadPool(4);
        try {
            final List<Future<List<Integer>>> futures = new ArrayList<>();
            for (final int[] observations : sequences) {
                futures.add(executor.submit(new Callable<List<Integer>>() {
                    @Override
                    public List<Integer> call() {
                        return hmm.mapEstimate(observations);
                    }
                }));
            }
            for (int i = 0; i < futures.size(); i++) {
                assertEquals(expected.get(i), futures.get(i).get());
            }
        } finally {
            executor.shutdownNow();
        }
    }

    @Test(expected = UnsupportedOperationException.class)
    public void testResultIsReadOnly() {
        coinModel().decode(0, 1).mostLikelySequence.set(0, 1);
    }

    @Test(expected = InvalidObservationException.class)
    public void testEmptyObservations() {
        new ViterbiAlgorithm().compute(coinModel(), new int[0]);
    }

}
