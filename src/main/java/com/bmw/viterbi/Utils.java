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
 * Implementation utilities.
 */
class Utils {

    private static final double LN_2 = Math.log(2.0);

    /**
     * Converts a probability or potential into a cost. Zero is mapped to positive infinity.
     * Must only be called for values that have been checked with
     * {@link #isNonNegativeAndFinite(double)}.
     */
    static double minusLog2(double probability) {
        assert isNonNegativeAndFinite(probability);
        // 0.0 - x instead of -x to map p = 1 to 0.0 rather than -0.0.
        return 0.0 - Math.log(probability) / LN_2;
    }

    /**
     * Returns false for negative values and NaN.
     */
    static boolean isNonNegative(double value) {
        return value >= 0.0;
    }

    /**
     * Returns whether the value can be converted into a cost that is not -Infinity.
     */
    static boolean isNonNegativeAndFinite(double value) {
        return isNonNegative(value) && value != Double.POSITIVE_INFINITY;
    }

    /**
     * Returns the first index holding the minimum of the given values.
     */
    static int argmin(double[] values) {
        if (values.length == 0) {
            throw new IllegalStateException("argmin of an empty vector is undefined.");
        }

        int minIndex = 0;
        double minValue = values[0];
        for (int i = 1; i < values.length; i++) {
            // Strictly less, so that ties resolve to the first occurrence.
            if (values[i] < minValue) {
                minValue = values[i];
                minIndex = i;
            }
        }
        return minIndex;
    }

}
