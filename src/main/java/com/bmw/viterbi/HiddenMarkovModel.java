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

import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Immutable first order HMM with a fixed number of hidden states and a fixed number of
 * observable labels. States and labels are identified by zero-based indices.
 *
 * <p>All parameters are stored as costs, i.e. a probability p is stored as -log2(p). The
 * parameters do not need to be normalized: rows are not required to sum to 1. A probability of
 * zero results in an infinite cost.
 */
public final class HiddenMarkovModel {

    private static final Logger logger = LoggerFactory.getLogger(HiddenMarkovModel.class);

    private final int stateCount;
    private final int labelCount;
    private final Vector initCosts;
    private final Matrix transitionCosts;
    private final Matrix emissionCosts;

    /**
     * Creates a model from probabilities (or non-negative potentials).
     *
     * @param initials initial probability of each state
     * @param transitions transitions.get(i, j) is the probability of moving from state i to
     * state j
     * @param emissions emissions.get(i, l) is the probability of observing label l in state i
     *
     * @throws ModelConstructionException if there are less than two states or less than two
     * labels, if any value is negative, NaN or infinite or if the matrix shapes do not match the
     * number of states
     */
    public HiddenMarkovModel(Vector initials, Matrix transitions, Matrix emissions) {
        if (initials == null || transitions == null || emissions == null) {
            throw new NullPointerException(
                    "initials, transitions and emissions must not be null.");
        }

        final int numberStates = initials.length();
        if (numberStates < 2) {
            throw new ModelConstructionException(ErrorKind.TOO_FEW_STATES,
                    "Model must have at least 2 states but has " + numberStates + ".");
        }
        // Infinite values must be rejected, -Infinity costs turn into NaN in the recurrence.
        checkPositive(initials.isPositiveAndFinite(), "Initial");
        checkPositive(transitions.isPositiveAndFinite(), "Transition");
        checkPositive(emissions.isPositiveAndFinite(), "Emission");

        final int numberLabels = emissions.cols();
        if (numberLabels < 2) {
            throw new ModelConstructionException(ErrorKind.TOO_FEW_OUTCOMES,
                    "Model must have at least 2 labels but has " + numberLabels + ".");
        }
        if (transitions.rows() != numberStates || transitions.cols() != numberStates) {
            throw new ModelConstructionException(ErrorKind.SHAPE_MISMATCH,
                    "Transition matrix must be " + numberStates + "x" + numberStates + " but is "
                    + transitions.rows() + "x" + transitions.cols() + ".");
        }
        if (emissions.rows() != numberStates) {
            throw new ModelConstructionException(ErrorKind.SHAPE_MISMATCH,
                    "Emission matrix must have " + numberStates + " rows but has "
                    + emissions.rows() + ".");
        }

        this.stateCount = numberStates;
        this.labelCount = numberLabels;
        this.initCosts = initials.minusLog();
        this.transitionCosts = transitions.minusLog();
        this.emissionCosts = emissions.minusLog();
        logger.debug("Created HMM with {} states and {} labels.", stateCount, labelCount);
    }

    /**
     * Convenience factory for plain arrays.
     *
     * @throws DimensionException if transitions or emissions are empty or ragged
     * @throws ModelConstructionException see
     * {@link #HiddenMarkovModel(Vector, Matrix, Matrix)}
     */
    public static HiddenMarkovModel fromProbabilities(double[] initials, double[][] transitions,
            double[][] emissions) {
        return new HiddenMarkovModel(new Vector(initials), new Matrix(transitions),
                new Matrix(emissions));
    }

    private static void checkPositive(boolean isPositive, String what) {
        if (!isPositive) {
            throw new ModelConstructionException(ErrorKind.NEGATIVE_VALUE,
                    what + " probabilities must be non-negative and finite.");
        }
    }

    /**
     * Computes the most likely sequence of states for the given labels.
     *
     * Formally, this is argmax p(s_1, ..., s_T | o_1, ..., o_T) with respect to s_1, ..., s_T,
     * where s_t is the state at time step t, o_t is the label observed at time step t and T is
     * the number of time steps.
     *
     * @return one state per observation
     *
     * @throws InvalidObservationException if observations is empty or contains a label that is
     * not in [0, labelCount())
     */
    public List<Integer> mapEstimate(int... observations) {
        return decode(observations).mostLikelySequence;
    }

    /**
     * See {@link #mapEstimate(int...)}.
     */
    public List<Integer> mapEstimate(List<Integer> observations) {
        return mapEstimate(toArray(observations));
    }

    /**
     * Like {@link #mapEstimate(int...)} but also returns the cost of the most likely sequence
     * and the back pointers.
     */
    public ViterbiAlgorithm.Result decode(int... observations) {
        return decode(new ViterbiAlgorithmParams(), observations);
    }

    public ViterbiAlgorithm.Result decode(ViterbiAlgorithmParams params, int... observations) {
        return new ViterbiAlgorithm(params).compute(this, observations);
    }

    private static int[] toArray(List<Integer> observations) {
        if (observations == null) {
            throw new NullPointerException("observations must not be null.");
        }
        final int[] result = new int[observations.size()];
        int i = 0;
        for (Integer label : observations) {
            if (label == null) {
                throw new NullPointerException("observations must not contain null.");
            }
            result[i++] = label;
        }
        return result;
    }

    public int stateCount() {
        return stateCount;
    }

    public int labelCount() {
        return labelCount;
    }

    /**
     * -log2 of the initial state probabilities.
     */
    public Vector initCosts() {
        return initCosts;
    }

    /**
     * -log2 of the transition probabilities, rows are source states and columns are target
     * states.
     */
    public Matrix transitionCosts() {
        return transitionCosts;
    }

    /**
     * -log2 of the emission probabilities, rows are states and columns are labels.
     */
    public Matrix emissionCosts() {
        return emissionCosts;
    }

}
