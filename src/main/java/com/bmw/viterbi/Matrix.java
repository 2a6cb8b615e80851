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
 * Immutable rectangular table of real numbers with at least one row and one column.
 */
public final class Matrix {

    private final int rows;
    private final int cols;
    private final double[][] data;

    /**
     * Creates a matrix holding a copy of the given rows.
     *
     * @throws DimensionException if there are no rows, the rows are empty or not all rows have
     * the same length
     */
    public Matrix(double[]... rows) {
        if (rows == null) {
            throw new NullPointerException("rows must not be null.");
        }
        if (rows.length == 0) {
            throw new DimensionException("Matrix must have at least one row.");
        }
        for (int i = 0; i < rows.length; i++) {
            if (rows[i] == null) {
                throw new DimensionException("Row " + i + " must not be null.");
            }
        }
        if (rows[0].length == 0) {
            throw new DimensionException("Matrix must have at least one column.");
        }

        this.rows = rows.length;
        this.cols = rows[0].length;
        this.data = new double[this.rows][];
        for (int i = 0; i < this.rows; i++) {
            if (rows[i].length != cols) {
                throw new DimensionException("Row " + i + " has " + rows[i].length
                        + " entries, expected " + cols + ".");
            }
            data[i] = rows[i].clone();
        }
    }

    /**
     * Takes ownership of the given rectangular data without copying or validating it.
     */
    private Matrix(int rows, int cols, double[][] data) {
        this.rows = rows;
        this.cols = cols;
        this.data = data;
    }

    public int rows() {
        return rows;
    }

    public int cols() {
        return cols;
    }

    /**
     * @throws IndexOutOfBoundsException if row or col is out of range
     */
    public double get(int row, int col) {
        checkIndex(row, rows, "Row");
        checkIndex(col, cols, "Column");
        return data[row][col];
    }

    /**
     * Returns whether all entries are &gt;= 0.
     */
    public boolean isPositive() {
        for (double[] row : data) {
            for (double value : row) {
                if (!Utils.isNonNegative(value)) {
                    return false;
                }
            }
        }
        return true;
    }

    /**
     * Returns whether all entries are &gt;= 0 and finite.
     */
    boolean isPositiveAndFinite() {
        for (double[] row : data) {
            for (double value : row) {
                if (!Utils.isNonNegativeAndFinite(value)) {
                    return false;
                }
            }
        }
        return true;
    }

    /**
     * Applies -log2 to each entry. Only for matrices that passed {@link #isPositive()}.
     */
    Matrix minusLog() {
        final double[][] result = new double[rows][cols];
        for (int i = 0; i < rows; i++) {
            for (int j = 0; j < cols; j++) {
                result[i][j] = Utils.minusLog2(data[i][j]);
            }
        }
        return new Matrix(rows, cols, result);
    }

    /**
     * Returns a copy of the specified column in row order.
     *
     * @throws IndexOutOfBoundsException if index is not in [0, cols())
     */
    public Vector column(int index) {
        checkIndex(index, cols, "Column");
        final double[] result = new double[rows];
        for (int i = 0; i < rows; i++) {
            result[i] = data[i][index];
        }
        return Vector.wrap(result);
    }

    /**
     * Adds v[i] to every entry of row i. Rows without a corresponding vector entry are left
     * unchanged and surplus vector entries are ignored.
     */
    public Matrix addToRows(Vector v) {
        final int n = Math.min(rows, v.length());
        final double[][] result = new double[rows][];
        for (int i = 0; i < rows; i++) {
            result[i] = data[i].clone();
        }
        for (int i = 0; i < n; i++) {
            final double summand = v.get(i);
            for (int j = 0; j < cols; j++) {
                result[i][j] += summand;
            }
        }
        return new Matrix(rows, cols, result);
    }

    /**
     * Returns the minimum of each column.
     */
    public Vector minByColumn() {
        final double[] result = data[0].clone();
        for (int i = 1; i < rows; i++) {
            for (int j = 0; j < cols; j++) {
                if (data[i][j] < result[j]) {
                    result[j] = data[i][j];
                }
            }
        }
        return Vector.wrap(result);
    }

    /**
     * Returns for each column the row index of its minimum. Ties are resolved to the lowest row
     * index.
     */
    public int[] argminByColumn() {
        final double[] minValues = data[0].clone();
        final int[] result = new int[cols];
        for (int i = 1; i < rows; i++) {
            for (int j = 0; j < cols; j++) {
                if (data[i][j] < minValues[j]) {
                    minValues[j] = data[i][j];
                    result[j] = i;
                }
            }
        }
        return result;
    }

    private static void checkIndex(int index, int size, String what) {
        if (index < 0 || index >= size) {
            throw new IndexOutOfBoundsException(what + " index " + index + " out of range [0, "
                    + size + ").");
        }
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (!(obj instanceof Matrix)) {
            return false;
        }
        return Arrays.deepEquals(data, ((Matrix) obj).data);
    }

    @Override
    public int hashCode() {
        return Arrays.deepHashCode(data);
    }

    @Override
    public String toString() {
        return "Matrix" + Arrays.deepToString(data);
    }

}
