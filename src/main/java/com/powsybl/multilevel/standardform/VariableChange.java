/**
 * Copyright (c) 2024, Artelys (http://www.artelys.com/)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.multilevel.standardform;

/**
 * Substitution applied to one continuous or integer variable to make it nonnegative.
 * Indices are expressed in the numbering of the level after normalization, i.e. integer variables are already
 * shifted by the number of continuous variables added to the level.
 * <p>
 * The four cases are closed: every consumer handles all of them through a {@link Visitor}.
 */
public sealed interface VariableChange
        permits VariableChange.LowerBound, VariableChange.UpperBound, VariableChange.Range, VariableChange.Unbounded {

    int NO_INDEX = -1;

    /**
     * True for a continuous variable, false for a general integer one.
     */
    boolean real();

    /**
     * Index of the variable whose coefficients are rewritten.
     */
    int index();

    /**
     * Index of the variable introduced by this change, or {@link #NO_INDEX}.
     */
    int newIndex();

    default boolean introducesVariable() {
        return newIndex() != NO_INDEX;
    }

    <R> R accept(Visitor<R> visitor);

    interface Visitor<R> {

        R visitLowerBound(LowerBound change);

        R visitUpperBound(UpperBound change);

        R visitRange(Range change);

        R visitUnbounded(Unbounded change);
    }

    /**
     * {@code lb <= x}, lb finite: {@code x = x' + lb}.
     */
    record LowerBound(boolean real, int index, double lowerBound) implements VariableChange {

        @Override
        public int newIndex() {
            return NO_INDEX;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitLowerBound(this);
        }
    }

    /**
     * {@code x <= ub}, ub finite: {@code x = ub - x'}.
     */
    record UpperBound(boolean real, int index, double upperBound) implements VariableChange {

        @Override
        public int newIndex() {
            return NO_INDEX;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitUpperBound(this);
        }
    }

    /**
     * {@code lb <= x <= ub}, both finite: {@code x = x' + lb} with the extra constraint {@code x' <= ub - lb}, or
     * {@code x' + s = ub - lb} when a slack variable s is introduced at {@code slackIndex}.
     */
    record Range(boolean real, int index, double lowerBound, double upperBound, int slackIndex) implements VariableChange {

        public boolean hasSlack() {
            return slackIndex != NO_INDEX;
        }

        @Override
        public int newIndex() {
            return slackIndex;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitRange(this);
        }
    }

    /**
     * Free variable: {@code x = x+ - x-}, x+ keeps the index of x and x- is introduced at {@code newIndex}.
     */
    record Unbounded(boolean real, int index, int newIndex) implements VariableChange {

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitUnbounded(this);
        }
    }
}
