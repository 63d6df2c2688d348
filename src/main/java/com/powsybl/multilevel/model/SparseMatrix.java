/**
 * Copyright (c) 2024, Artelys (http://www.artelys.com/)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.multilevel.model;

import com.powsybl.math.matrix.DenseMatrix;
import com.powsybl.math.matrix.Matrix;

import java.util.Arrays;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;
import java.util.function.IntUnaryOperator;

/**
 * Immutable sparse matrix over a powsybl-math {@link com.powsybl.math.matrix.SparseMatrix} in compressed sparse
 * column layout. The underlying matrix is never modified once built: every transformation returns a new matrix,
 * so a matrix can safely be shared between several levels or several copies of a problem.
 * Explicit zeros are never stored.
 */
public final class SparseMatrix {

    private final com.powsybl.math.matrix.SparseMatrix matrix;
    private final int nonZeroCount;

    private SparseMatrix(com.powsybl.math.matrix.SparseMatrix matrix, int nonZeroCount) {
        this.matrix = matrix;
        this.nonZeroCount = nonZeroCount;
    }

    public static SparseMatrix empty(int rowCount, int columnCount) {
        return builder(rowCount, columnCount).build();
    }

    public static Builder builder(int rowCount, int columnCount) {
        return new Builder(rowCount, columnCount);
    }

    /**
     * Creates a sparse matrix from a row-major dense array. All rows must have the same length.
     */
    public static SparseMatrix fromDense(double[][] dense) {
        Objects.requireNonNull(dense);
        int columnCount = dense.length == 0 ? 0 : dense[0].length;
        Builder builder = builder(dense.length, columnCount);
        for (int i = 0; i < dense.length; i++) {
            if (dense[i].length != columnCount) {
                throw new IllegalArgumentException("Row " + i + " has " + dense[i].length + " columns, expected " + columnCount);
            }
            for (int j = 0; j < columnCount; j++) {
                builder.add(i, j, dense[i][j]);
            }
        }
        return builder.build();
    }

    public int getRowCount() {
        return matrix.getRowCount();
    }

    public int getColumnCount() {
        return matrix.getColumnCount();
    }

    public int getNonZeroCount() {
        return nonZeroCount;
    }

    public double get(int row, int column) {
        checkIndex(row, column, getRowCount(), getColumnCount());
        int[] columnStart = matrix.getColumnStart();
        int position = Arrays.binarySearch(matrix.getRowIndices(), columnStart[column], columnStart[column + 1], row);
        return position >= 0 ? matrix.getValues()[position] : 0;
    }

    public void iterateNonZeroValue(Matrix.ElementHandler handler) {
        Objects.requireNonNull(handler);
        matrix.iterateNonZeroValue(handler);
    }

    public void iterateNonZeroValueOfColumn(int column, Matrix.ElementHandler handler) {
        Objects.requireNonNull(handler);
        if (column < 0 || column >= getColumnCount()) {
            throw new IndexOutOfBoundsException("Column " + column + " out of bounds [0, " + getColumnCount() + ")");
        }
        matrix.iterateNonZeroValueOfColumn(column, handler);
    }

    public SparseMatrix negate() {
        double[] values = matrix.getValues();
        double[] negated = new double[nonZeroCount];
        for (int k = 0; k < nonZeroCount; k++) {
            negated[k] = -values[k];
        }
        return new SparseMatrix(new com.powsybl.math.matrix.SparseMatrix(getRowCount(), getColumnCount(),
                matrix.getColumnStart().clone(), Arrays.copyOf(matrix.getRowIndices(), nonZeroCount), negated), nonZeroCount);
    }

    /**
     * Changes the shape of the matrix. Growing only adds empty rows or columns, shrinking is only allowed
     * when no non-zero element is lost.
     */
    public SparseMatrix resize(int newRowCount, int newColumnCount) {
        if (newRowCount == getRowCount() && newColumnCount == getColumnCount()) {
            return this;
        }
        Builder builder = builder(newRowCount, newColumnCount);
        iterateNonZeroValue((row, column, value) -> {
            if (row >= newRowCount || column >= newColumnCount) {
                throw new IllegalArgumentException("Cannot resize matrix to " + newRowCount + "x" + newColumnCount
                        + ": non-zero element at (" + row + ", " + column + ") would be dropped");
            }
            builder.add(row, column, value);
        });
        return builder.build();
    }

    public SparseMatrix remapColumns(IntUnaryOperator columnMapping, int newColumnCount) {
        Objects.requireNonNull(columnMapping);
        Builder builder = builder(getRowCount(), newColumnCount);
        iterateNonZeroValue((row, column, value) -> builder.add(row, columnMapping.applyAsInt(column), value));
        return builder.build();
    }

    public SparseMatrix remapRows(IntUnaryOperator rowMapping, int newRowCount) {
        Objects.requireNonNull(rowMapping);
        Builder builder = builder(newRowCount, getColumnCount());
        iterateNonZeroValue((row, column, value) -> builder.add(rowMapping.applyAsInt(row), column, value));
        return builder.build();
    }

    /**
     * Returns the matrix {@code [A; -A]}: the rows of this matrix followed by their negation.
     */
    public SparseMatrix stackNegated() {
        int rowCount = getRowCount();
        Builder builder = builder(2 * rowCount, getColumnCount());
        iterateNonZeroValue((row, column, value) -> {
            builder.add(row, column, value);
            builder.add(rowCount + row, column, -value);
        });
        return builder.build();
    }

    /**
     * Returns a builder initialized with the elements of this matrix and the given, possibly larger, shape.
     */
    public Builder toBuilder(int newRowCount, int newColumnCount) {
        Builder builder = builder(newRowCount, newColumnCount);
        iterateNonZeroValue(builder::add);
        return builder;
    }

    /**
     * Returns a copy of the underlying powsybl-math matrix, in compressed sparse column layout.
     */
    public com.powsybl.math.matrix.SparseMatrix toPowsyblMatrix() {
        return new com.powsybl.math.matrix.SparseMatrix(getRowCount(), getColumnCount(), matrix.getColumnStart().clone(),
                Arrays.copyOf(matrix.getRowIndices(), nonZeroCount), Arrays.copyOf(matrix.getValues(), nonZeroCount));
    }

    public double[][] toDense() {
        double[][] dense = new double[getRowCount()][getColumnCount()];
        if (nonZeroCount == 0) {
            return dense;
        }
        DenseMatrix denseMatrix = matrix.toDense();
        for (int i = 0; i < dense.length; i++) {
            for (int j = 0; j < dense[i].length; j++) {
                dense[i][j] = denseMatrix.get(i, j);
            }
        }
        return dense;
    }

    private static void checkIndex(int row, int column, int rowCount, int columnCount) {
        if (row < 0 || row >= rowCount || column < 0 || column >= columnCount) {
            throw new IndexOutOfBoundsException("Element (" + row + ", " + column + ") out of bounds of a "
                    + rowCount + "x" + columnCount + " matrix");
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof SparseMatrix other)) {
            return false;
        }
        return getRowCount() == other.getRowCount()
                && getColumnCount() == other.getColumnCount()
                && nonZeroCount == other.nonZeroCount
                && Arrays.equals(matrix.getColumnStart(), 0, getColumnCount() + 1, other.matrix.getColumnStart(), 0, getColumnCount() + 1)
                && Arrays.equals(matrix.getRowIndices(), 0, nonZeroCount, other.matrix.getRowIndices(), 0, nonZeroCount)
                && Arrays.equals(matrix.getValues(), 0, nonZeroCount, other.matrix.getValues(), 0, nonZeroCount);
    }

    @Override
    public int hashCode() {
        return Objects.hash(getRowCount(), getColumnCount(),
                Arrays.hashCode(Arrays.copyOf(matrix.getRowIndices(), nonZeroCount)),
                Arrays.hashCode(Arrays.copyOf(matrix.getValues(), nonZeroCount)));
    }

    @Override
    public String toString() {
        return "SparseMatrix(rowCount=" + getRowCount() + ", columnCount=" + getColumnCount() + ", nonZeroCount=" + nonZeroCount + ')';
    }

    /**
     * Accumulates matrix elements by coordinate. Adding twice to the same coordinate sums the values.
     */
    public static final class Builder {

        private final int rowCount;
        private final int columnCount;

        // key is column in the high bits and row in the low bits, so that iteration is column major
        private final Map<Long, Double> elements = new TreeMap<>();

        private Builder(int rowCount, int columnCount) {
            if (rowCount < 0 || columnCount < 0) {
                throw new IllegalArgumentException("Invalid matrix shape " + rowCount + "x" + columnCount);
            }
            this.rowCount = rowCount;
            this.columnCount = columnCount;
        }

        private static long key(int row, int column) {
            return ((long) column << 32) | row;
        }

        public int getRowCount() {
            return rowCount;
        }

        public int getColumnCount() {
            return columnCount;
        }

        public Builder add(int row, int column, double value) {
            checkIndex(row, column, rowCount, columnCount);
            elements.merge(key(row, column), value, Double::sum);
            return this;
        }

        public Builder set(int row, int column, double value) {
            checkIndex(row, column, rowCount, columnCount);
            elements.put(key(row, column), value);
            return this;
        }

        public SparseMatrix build() {
            int nonZeroCount = (int) elements.values().stream().filter(v -> v != 0).count();
            int[] columnStart = new int[columnCount + 1];
            int[] rowIndices = new int[nonZeroCount];
            double[] values = new double[nonZeroCount];
            int k = 0;
            for (Map.Entry<Long, Double> e : elements.entrySet()) {
                if (e.getValue() == 0) {
                    continue;
                }
                int column = (int) (e.getKey() >>> 32);
                rowIndices[k] = (int) (e.getKey() & 0xFFFFFFFFL);
                values[k] = e.getValue();
                columnStart[column + 1]++;
                k++;
            }
            for (int j = 0; j < columnCount; j++) {
                columnStart[j + 1] += columnStart[j];
            }
            return new SparseMatrix(new com.powsybl.math.matrix.SparseMatrix(rowCount, columnCount, columnStart, rowIndices, values), nonZeroCount);
        }
    }
}
