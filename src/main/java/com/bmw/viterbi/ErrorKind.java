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

/**
 * Reason why a container, a model or a decoding request was rejected.
 */
public enum ErrorKind {

    /** Matrix data is empty or not rectangular. */
    DIMENSION,

    /** The model has less than two hidden states. */
    TOO_FEW_STATES,

    /** A probability or potential is negative (or NaN). */
    NEGATIVE_VALUE,

    /** The emission matrix has less than two columns. */
    TOO_FEW_OUTCOMES,

    /** Transition or emission matrix does not match the number of states. */
    SHAPE_MISMATCH,

    /** Nothing to decode. */
    EMPTY_OBSERVATIONS,

    /** An observed label is not a column of the emission matrix. */
    LABEL_OUT_OF_RANGE

}
