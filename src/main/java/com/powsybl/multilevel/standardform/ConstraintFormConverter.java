/**
 * Copyright (c) 2024, Artelys (http://www.artelys.com/)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.multilevel.standardform;

import com.google.common.primitives.Doubles;
import com.powsybl.multilevel.model.ColumnRemapping;
import com.powsybl.multilevel.model.Level;
import com.powsybl.multilevel.model.MultilevelProblem;
import com.powsybl.multilevel.model.SparseMatrix;
import com.powsybl.multilevel.model.VariableBlock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Converts the constraints of every level of a problem to a single form.
 * <ul>
 *     <li>To inequalities: each equality row {@code a x = b} is kept as {@code a x <= b} and duplicated as
 *     {@code -a x <= -b}, negated rows being appended after the original ones.</li>
 *     <li>To equalities: each inequality row {@code a x <= b} gets its own nonnegative slack variable,
 *     {@code a x + s = b}. Slack variables are continuous variables appended to the level owning the
 *     constraints and only appear in the constraint matrix of this level against itself.</li>
 * </ul>
 */
public final class ConstraintFormConverter {

    private static final Logger LOGGER = LoggerFactory.getLogger(ConstraintFormConverter.class);

    private ConstraintFormConverter() {
    }

    /**
     * @return for each level that received slack variables, the remapping of its variables
     */
    public static Map<Integer, ColumnRemapping> convert(MultilevelProblem problem, boolean inequalities) {
        Objects.requireNonNull(problem);
        Map<Integer, ColumnRemapping> remappings = new HashMap<>();
        for (Level level : problem.levels()) {
            if (inequalities && !level.isInequalities()) {
                duplicateRows(level);
            } else if (!inequalities && level.isInequalities() && level.getConstraintCount() > 0) {
                remappings.put(level.getId(), addSlackVariables(problem, level));
            }
        }
        for (Level level : problem.levels()) {
            level.setInequalities(inequalities);
        }
        return remappings;
    }

    private static void duplicateRows(Level level) {
        double[] b = level.getRhs();
        double[] negatedB = new double[b.length];
        for (int i = 0; i < b.length; i++) {
            negatedB[i] = -b[i];
        }
        level.setRhs(Doubles.concat(b, negatedB));
        for (Map.Entry<Integer, SparseMatrix> e : List.copyOf(level.getConstraintMatrices().entrySet())) {
            level.setConstraintMatrix(e.getKey(), e.getValue().stackNegated());
        }
        LOGGER.debug("Level {}: {} equality constraints converted to {} inequality constraints", level.getId(), b.length, 2 * b.length);
    }

    private static ColumnRemapping addSlackVariables(MultilevelProblem problem, Level level) {
        VariableBlock x = level.getVariables();
        int rowCount = level.getConstraintCount();
        int firstSlack = x.getNxR();
        ColumnRemapping remapping = new ColumnRemapping(x.getNxR(), x.getNxZ(), x.getNxB(), x.getNxR() + rowCount, x.getNxZ());
        problem.remapVariables(level.getId(), remapping, 0, Double.POSITIVE_INFINITY);

        SparseMatrix a = level.getConstraintMatrix(level.getId());
        SparseMatrix.Builder builder = a != null
                ? a.toBuilder(rowCount, remapping.newSize())
                : SparseMatrix.builder(rowCount, remapping.newSize());
        for (int i = 0; i < rowCount; i++) {
            builder.set(i, firstSlack + i, 1);
        }
        level.setConstraintMatrix(level.getId(), builder.build());
        LOGGER.debug("Level {}: {} slack variables added to convert inequality constraints to equality constraints", level.getId(), rowCount);
        return remapping;
    }
}
