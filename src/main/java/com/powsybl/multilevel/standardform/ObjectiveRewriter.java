/**
 * Copyright (c) 2024, Artelys (http://www.artelys.com/)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.multilevel.standardform;

import java.util.Objects;

/**
 * Applies the variable changes of a level to an objective vector referencing the variables of this level.
 *
 * @see ConstraintRewriter
 */
public final class ObjectiveRewriter {

    public record ObjectiveTerms(double[] coefficients, double constant) {
    }

    private ObjectiveRewriter() {
    }

    /**
     * Rewrites {@code c . x + d}.
     *
     * @param changes changes of the level owning the variables
     * @param c objective coefficients, already remapped to the level numbering after normalization, or null
     * @param d objective constant
     * @return new coefficients (a fresh array, null if c is null) and new constant
     */
    public static ObjectiveTerms rewrite(VariableChanges changes, double[] c, double d) {
        Objects.requireNonNull(changes);
        if (c == null) {
            return new ObjectiveTerms(null, d);
        }
        if (c.length != changes.getVariableCount()) {
            throw new IllegalArgumentException("Objective vector of length " + c.length + ", expected " + changes.getVariableCount());
        }
        double[] coefficients = c.clone();
        CoefficientUpdate update = new CoefficientUpdate(coefficients);
        double constant = d;
        for (VariableChange change : changes) {
            constant += change.accept(update);
        }
        return new ObjectiveTerms(coefficients, constant);
    }

    /**
     * Updates the coefficients in place and returns the contribution to the objective constant.
     */
    private static final class CoefficientUpdate implements VariableChange.Visitor<Double> {

        private final double[] coefficients;

        private CoefficientUpdate(double[] coefficients) {
            this.coefficients = coefficients;
        }

        @Override
        public Double visitLowerBound(VariableChange.LowerBound change) {
            // c x = c (x' + lb)
            return coefficients[change.index()] * change.lowerBound();
        }

        @Override
        public Double visitUpperBound(VariableChange.UpperBound change) {
            // c x = c (ub - x')
            double coefficient = coefficients[change.index()];
            coefficients[change.index()] = -coefficient;
            return coefficient * change.upperBound();
        }

        @Override
        public Double visitRange(VariableChange.Range change) {
            if (change.hasSlack()) {
                coefficients[change.slackIndex()] = 0;
            }
            return coefficients[change.index()] * change.lowerBound();
        }

        @Override
        public Double visitUnbounded(VariableChange.Unbounded change) {
            // c x = c x+ - c x-
            coefficients[change.newIndex()] = -coefficients[change.index()];
            return 0.0;
        }
    }
}
