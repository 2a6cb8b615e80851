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
 * Thrown if an observation sequence cannot be decoded, either because it is empty or because
 * it contains a label that the model does not know.
 */
public class InvalidObservationException extends HmmException {

    private static final long serialVersionUID = 1L;

    /**
     * Zero-based time step of the offending label or -1 if the sequence is empty.
     */
    private final int timeStep;

    public InvalidObservationException(ErrorKind kind, int timeStep, String message) {
        super(kind, message);
        this.timeStep = timeStep;
    }

    public int timeStep() {
        return timeStep;
    }

}
