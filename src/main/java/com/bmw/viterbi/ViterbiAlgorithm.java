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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Implementation of the Viterbi algorithm for a stationary discrete HMM.
 * Works with -log2 probabilities (costs) to prevent arithmetic underflows for long observation
 * sequences: multiplying probabilities becomes adding costs and the most likely path becomes the
 * path with minimum cost.
 * The plain Viterbi algorithm is described e.g. in
 * Rabiner, Juang, An introduction to Hidden Markov Models, IEEE ASSP Mag., pp 4-16, June 1986.
 *
 * <p>Instances do not hold any state between calls of
 * {@link #compute(HiddenMarkovModel, int[])} and may be shared between threads.
 */
public class ViterbiAlgorithm {

    private static final Logger logger = LoggerFactory.getLogger(ViterbiAlgorithm.class);

    /**
     * Contains the most likely sequence and additional results of the Viterbi algorithm.
     */
    public static class Result {

        public final List<Integer> mostLikelySequence;

        /**
         * Cost (-log2 probability) of the most likely sequence, i.e. the minimum entry of the
         * cost vector after the last time step.
         */
        public final double pathCost;

        /**
         * Sequence of cost vectors. Is null if message history is not kept
         * (see {@link ViterbiAlgorithmParams#setKeepMessageHistory(boolean)}).
         *
         * messageHistory.get(0) contains the initial state costs and messageHistory.get(t + 1)
         * the cost vector after processing the observation of time step t. Entry j is the cost
         * of the cheapest path that emitted o_1, ..., o_t and then moved to state j.
         */
        public final List<Vector> messageHistory;

        /**
         * backPointerSequence.get(t)[j] contains the state at time step t of the cheapest path
         * that moves to state j after emitting the observation of time step t.
         */
        private final List<int[]> backPointerSequence;

        Result(List<Integer> mostLikelySequence, double pathCost, List<int[]> backPointerSequence,
                List<Vector> messageHistory) {
            this.mostLikelySequence = Collections.unmodifiableList(mostLikelySequence);
            this.pathCost = pathCost;
            this.backPointerSequence = backPointerSequence;
            this.messageHistory = messageHistory == null ? null
                    : Collections.unmodifiableList(messageHistory);
        }

        /**
         * Probability of the most likely sequence, i.e. 2^-pathCost.
         */
        public double pathProbability() {
            return Math.pow(2.0, -pathCost);
        }

        /**
         * See {@link #backPointerSequence}.
         *
         * @throws IndexOutOfBoundsException if timeStep or state is out of range
         */
        public int backPointer(int timeStep, int state) {
            return backPointerSequence.get(timeStep)[state];
        }

        public int numberOfTimeSteps() {
            return backPointerSequence.size();
        }

        public String messageHistoryString() {
            if (messageHistory == null) {
                return "Message history was not kept.";
            }
            StringBuilder sb = new StringBuilder();
            sb.append("Message history with -log2 probabilities\n\n");
            int i = 0;
            for (Vector message : messageHistory) {
                sb.append("Time step " + i + "\n");
                i++;
                for (int state = 0; state < message.length(); state++) {
                    sb.append(state + ": " + message.get(state) + "\n");
                }
                sb.append("\n");
            }
            return sb.toString();
        }
    }

    private final ViterbiAlgorithmParams params;

    public ViterbiAlgorithm() {
        this(new ViterbiAlgorithmParams());
    }

    public ViterbiAlgorithm(ViterbiAlgorithmParams params) {
        if (params == null) {
            throw new NullPointerException("params must not be null.");
        }
        this.params = params;
    }

    /**
     * @see HiddenMarkovModel#mapEstimate(int...)
     *
     * @throws InvalidObservationException if observations is empty or contains a label that is
     * not in [0, model.labelCount())
     */
    public Result compute(HiddenMarkovModel model, int[] observations) {
        if (model == null || observations == null) {
            throw new NullPointerException("model and observations must not be null.");
        }
        validateObservations(model, observations);

        final List<int[]> backPointerSequence = new ArrayList<>(observations.length);
        List<Vector> messageHistory = null;
        if (params.isKeepMessageHistory()) {
            messageHistory = new ArrayList<>(observations.length + 1);
        }

        // Forward pass
        Vector cost = model.initCosts();
        if (messageHistory != null) {
            messageHistory.add(cost);
        }
        for (int t = 0; t < observations.length; t++) {
            final Matrix scored = forwardStep(model, cost, observations[t]);
            cost = scored.minByColumn();
            backPointerSequence.add(scored.argminByColumn());
            if (messageHistory != null) {
                messageHistory.add(cost);
            }
            if (logger.isTraceEnabled()) {
                logger.trace("Time step {}, label {}: costs {}", t, observations[t], cost);
            }
        }

        // Retrieve most likely state sequence
        final int lastState = cost.argmin();
        final double pathCost = cost.get(lastState);
        final List<Integer> mostLikelySequence =
                retrieveMostLikelySequence(backPointerSequence, lastState);
        logger.debug("Decoded {} observations with {} states, path cost {}.",
                observations.length, model.stateCount(), pathCost);

        return new Result(mostLikelySequence, pathCost, backPointerSequence, messageHistory);
    }

    /**
     * Returns the matrix whose entry (i, j) is the cost of being in state i, emitting the given
     * label from state i and then moving to state j.
     */
    private Matrix forwardStep(HiddenMarkovModel model, Vector cost, int label) {
        final Vector combined = cost.add(model.emissionCosts().column(label));
        return model.transitionCosts().addToRows(combined);
    }

    private void validateObservations(HiddenMarkovModel model, int[] observations) {
        if (observations.length == 0) {
            logger.debug("Rejected empty observation sequence.");
            throw new InvalidObservationException(ErrorKind.EMPTY_OBSERVATIONS, -1,
                    "Observation sequence must not be empty.");
        }
        for (int t = 0; t < observations.length; t++) {
            final int label = observations[t];
            if (label < 0 || label >= model.labelCount()) {
                logger.debug("Rejected label {} at time step {}.", label, t);
                throw new InvalidObservationException(ErrorKind.LABEL_OUT_OF_RANGE, t,
                        "Label " + label + " at time step " + t + " is not in [0, "
                        + model.labelCount() + ").");
            }
        }
    }

    /**
     * Follows the back pointers from the specified state after the last time step to the first
     * time step.
     */
    private List<Integer> retrieveMostLikelySequence(List<int[]> backPointerSequence,
            int lastState) {
        final List<Integer> mostLikelySequence = new ArrayList<>(backPointerSequence.size());
        // Retrieve most likely state sequence in reverse order
        int state = lastState;
        for (int t = backPointerSequence.size() - 1; t >= 0; t--) {
            state = backPointerSequence.get(t)[state];
            mostLikelySequence.add(state);
        }

        Collections.reverse(mostLikelySequence);
        return mostLikelySequence;
    }

}
