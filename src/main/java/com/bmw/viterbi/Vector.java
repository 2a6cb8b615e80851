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

import java.util.Arrays;

/**
 * Immutable sequence of real numbers with fixed length.
 */
public final class Vector {

    private final double[] data;

    /**
     * Creates a vector holding a copy of the given values.
     */
    public Vector(double... values) {
        this(checkNotNull(values), true);
    }

    public int length() {
        return data.length;
    }

    /**
     * @throws IndexOutOfBoundsException if i is not in [0, length())
     */
    public double get(int i) {
        if (i < 0 || i >= data.length) {
            throw new IndexOutOfBoundsException("Index " + i
                    + " out of range for vector of length " + data.length + ".");
        }
        return data[i];
    }

    /**
     * Returns the elementwise sum. If the vectors differ in length, the result has the length of
     * the shorter one.
     */
    public Vector add(Vector other) {
        final int n = Math.min(data.length, other.data.length);
        final double[] result = new double[n];
        for (int i = 0; i < n; i++) {
            result[i] = data[i] + other.data[i];
        }
        return wrap(result);
    }

    /**
     * Returns whether all entries are &gt;= 0.
     */
    public boolean isPositive() {
        for (double value : data) {
            if (!Utils.isNonNegative(value)) {
                return false;
            }
        }
        return true;
    }

    /**
     * Returns whether all entries are &gt;= 0 and finite.
     */
    boolean isPositiveAndFinite() {
        for (double value : data) {
            if (!Utils.isNonNegativeAndFinite(value)) {
                return false;
            }
        }
        return true;
    }

    /**
     * Returns the index of the minimum entry. If the minimum occurs several times, the first
     * index is returned.
     *
     * @throws IllegalStateException if the vector is empty
     */
    public int argmin() {
        return Utils.argmin(data);
    }

    /**
     * Applies -log2 to each entry. Only for vectors that passed {@link #isPositive()}.
     */
    Vector minusLog() {
        final double[] result = new double[data.length];
        for (int i = 0; i < data.length; i++) {
            result[i] = Utils.minusLog2(data[i]);
        }
        return wrap(result);
    }

    public double[] toArray() {
        return data.clone();
    }

    /**
     * Creates a vector without copying the given array, which must not be modified afterwards.
     */
    static Vector wrap(double[] values) {
        return new Vector(values, false);
    }

    private Vector(double[] values, boolean copy) {
        this.data = copy ? values.clone() : values;
    }

    private static double[] checkNotNull(double[] values) {
        if (values == null) {
            throw new NullPointerException("values must not be null.");
        }
        return values;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (!(obj instanceof Vector)) {
            return false;
        }
        return Arrays.equals(data, ((Vector) obj).data);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(data);
    }

    @Override
    public String toString() {
        return "Vector" + Arrays.toString(data);
    }

}
