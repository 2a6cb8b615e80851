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
 * Parameters for {@link ViterbiAlgorithm}.
 */
public class ViterbiAlgorithmParams {

    private boolean keepMessageHistory = false;

    /**
     * Whether to store the cost vector of every time step
     * (costs of intermediate most likely paths) for debugging.
     */
    public ViterbiAlgorithmParams setKeepMessageHistory(boolean value) {
        this.keepMessageHistory = value;
        return this;
    }

    public boolean isKeepMessageHistory() {
        return keepMessageHistory;
    }

}
