/**
 * Copyright (c) 2024, Artelys (http://www.artelys.com/)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.multilevel.standardform;

import com.powsybl.multilevel.model.SparseMatrix;
import org.apache.commons.lang3.ArrayUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Applies the variable changes of a level to a constraint matrix referencing the variables of this level, and
 * to the right hand side of these constraints.
 * <p>
 * The rewritten matrix is always a new matrix, built column by column from the input one. When rows are added,
 * each range variable gets a row {@code x' <= ub - lb} (inequality form) or {@code x' + s = ub - lb} (equality
 * form). Rows must only be added once per variable, i.e. when rewriting the constraints of the level owning the
 * variables.
 */
public final class ConstraintRewriter {

    private static final Logger LOGGER = LoggerFactory.getLogger(ConstraintRewriter.class);

    public record ConstraintTerms(SparseMatrix matrix, double[] rhs) {
    }

    private ConstraintRewriter() {
    }

    /**
     * Rewrites {@code A x (<= or =) b}.
     *
     * @param changes changes of the level owning the variables
     * @param a constraint matrix, columns already remapped to the level numbering after normalization, or null
     * @param b right hand side of the constraints of the referencing level
     * @param addRows true to add the rows bounding range variables
     * @return new matrix (null if a is null and no row has been added) and new right hand side
     */
    public static ConstraintTerms rewrite(VariableChanges changes, SparseMatrix a, double[] b, boolean addRows) {
        Objects.requireNonNull(changes);
        Objects.requireNonNull(b);
        if (a != null && a.getColumnCount() != changes.getVariableCount()) {
            throw new IllegalArgumentException("Constraint matrix with " + a.getColumnCount() + " columns, expected "
                    + changes.getVariableCount());
        }
        if (a != null && a.getRowCount() > b.length) {
            throw new IllegalArgumentException("Constraint matrix with " + a.getRowCount() + " rows, only " + b.length + " right hand side values");
        }

        int addedRowCount = 0;
        if (addRows) {
            addedRowCount = (int) changes.getChanges().stream().filter(VariableChange.Range.class::isInstance).count();
        }
        if (a == null && addedRowCount == 0) {
            return new ConstraintTerms(null, b.clone());
        }

        int rowCount = b.length;
        SparseMatrix.Builder builder = SparseMatrix.builder(rowCount + addedRowCount, changes.getVariableCount());
        double[] rhs = b.clone();

        if (a != null) {
            a.iterateNonZeroValue((row, column, value) -> {
                VariableChange change = changes.getChange(column);
                if (change == null) {
                    builder.add(row, column, value);
                } else {
                    change.accept(new ElementUpdate(builder, rhs, row, value));
                }
            });
        }

        if (addedRowCount > 0) {
            int row = rowCount;
            double[] newRhs = new double[addedRowCount];
            for (VariableChange change : changes) {
                if (change instanceof VariableChange.Range range) {
                    builder.set(row, range.index(), 1);
                    if (range.hasSlack()) {
                        builder.set(row, range.slackIndex(), 1);
                    }
                    newRhs[row - rowCount] = range.upperBound() - range.lowerBound();
                    LOGGER.trace("Added bound row {} for variable {}", row, range.index());
                    row++;
                }
            }
            return new ConstraintTerms(builder.build(), ArrayUtils.addAll(rhs, newRhs));
        }
        return new ConstraintTerms(builder.build(), rhs);
    }

    /**
     * Rewrites one non-zero element {@code A[row, v]} of a changed variable v.
     */
    private static final class ElementUpdate implements VariableChange.Visitor<Void> {

        private final SparseMatrix.Builder builder;
        private final double[] rhs;
        private final int row;
        private final double value;

        private ElementUpdate(SparseMatrix.Builder builder, double[] rhs, int row, double value) {
            this.builder = builder;
            this.rhs = rhs;
            this.row = row;
            this.value = value;
        }

        @Override
        public Void visitLowerBound(VariableChange.LowerBound change) {
            builder.add(row, change.index(), value);
            rhs[row] -= value * change.lowerBound();
            return null;
        }

        @Override
        public Void visitUpperBound(VariableChange.UpperBound change) {
            builder.add(row, change.index(), -value);
            rhs[row] -= value * change.upperBound();
            return null;
        }

        @Override
        public Void visitRange(VariableChange.Range change) {
            builder.add(row, change.index(), value);
            rhs[row] -= value * change.lowerBound();
            return null;
        }

        @Override
        public Void visitUnbounded(VariableChange.Unbounded change) {
            builder.add(row, change.index(), value);
            builder.add(row, change.newIndex(), -value);
            return null;
        }
    }
}
