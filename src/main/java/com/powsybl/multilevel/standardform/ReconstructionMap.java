/**
 * Copyright (c) 2024, Artelys (http://www.artelys.com/)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.multilevel.standardform;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.powsybl.commons.PowsyblException;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeMap;

/**
 * Maps solutions of a standard form problem back to the variables of the original problem, and original points
 * forward to the standard form.
 * <p>
 * For each level and each original variable i:
 * <pre>
 *   original[i] = sum of coefficient * standard[index] over the multipliers of i, + offset of i
 * </pre>
 * Multipliers are indexed by the variable numbering of the original problem and point at the variable numbering
 * of the standard form problem.
 */
public final class ReconstructionMap {

    public record Multiplier(int index, double coefficient) {
    }

    /**
     * Recipe to recover one original variable.
     *
     * @param multipliers linear combination of standard form variables
     * @param offset bound shift to add back
     * @param change the change applied to the variable, null if it was already nonnegative
     */
    public record VariableReconstruction(List<Multiplier> multipliers, double offset, VariableChange change) {

        public VariableReconstruction {
            multipliers = ImmutableList.copyOf(multipliers);
        }
    }

    record LevelReconstruction(List<VariableReconstruction> variables, int standardVariableCount) {

        LevelReconstruction {
            variables = ImmutableList.copyOf(variables);
        }
    }

    private final Map<Integer, LevelReconstruction> levels;

    ReconstructionMap(Map<Integer, LevelReconstruction> levels) {
        this.levels = ImmutableMap.copyOf(levels);
    }

    public Set<Integer> getLevelIds() {
        return levels.keySet();
    }

    private LevelReconstruction getLevel(int levelId) {
        LevelReconstruction level = levels.get(levelId);
        if (level == null) {
            throw new PowsyblException("Level " + levelId + " not found in reconstruction map");
        }
        return level;
    }

    public int getOriginalVariableCount(int levelId) {
        return getLevel(levelId).variables().size();
    }

    public int getStandardVariableCount(int levelId) {
        return getLevel(levelId).standardVariableCount();
    }

    public VariableReconstruction getVariable(int levelId, int originalIndex) {
        List<VariableReconstruction> variables = getLevel(levelId).variables();
        if (originalIndex < 0 || originalIndex >= variables.size()) {
            throw new IndexOutOfBoundsException("Level " + levelId + " has no original variable " + originalIndex);
        }
        return variables.get(originalIndex);
    }

    public List<Multiplier> getMultipliers(int levelId, int originalIndex) {
        return getVariable(levelId, originalIndex).multipliers();
    }

    public double getOffset(int levelId, int originalIndex) {
        return getVariable(levelId, originalIndex).offset();
    }

    /**
     * Computes the original variable values of a level from the values of its standard form variables.
     */
    public double[] toOriginal(int levelId, double[] standardValues) {
        Objects.requireNonNull(standardValues);
        LevelReconstruction level = getLevel(levelId);
        if (standardValues.length != level.standardVariableCount()) {
            throw new IllegalArgumentException("Level " + levelId + ": expected " + level.standardVariableCount()
                    + " standard form values, got " + standardValues.length);
        }
        double[] original = new double[level.variables().size()];
        for (int i = 0; i < original.length; i++) {
            VariableReconstruction variable = level.variables().get(i);
            double value = variable.offset();
            for (Multiplier multiplier : variable.multipliers()) {
                value += multiplier.coefficient() * standardValues[multiplier.index()];
            }
            original[i] = value;
        }
        return original;
    }

    /**
     * Computes the original variable values of every level given in the map.
     */
    public Map<Integer, double[]> toOriginal(Map<Integer, double[]> standardValues) {
        Objects.requireNonNull(standardValues);
        Map<Integer, double[]> original = new TreeMap<>();
        standardValues.forEach((levelId, values) -> original.put(levelId, toOriginal(levelId, values)));
        return original;
    }

    /**
     * Substitutes original variable values of a level into the standard form variables. Variables without
     * original counterpart, such as slack variables of converted inequality constraints, are left to zero.
     */
    public double[] toStandardForm(int levelId, double[] originalValues) {
        Objects.requireNonNull(originalValues);
        LevelReconstruction level = getLevel(levelId);
        if (originalValues.length != level.variables().size()) {
            throw new IllegalArgumentException("Level " + levelId + ": expected " + level.variables().size()
                    + " original values, got " + originalValues.length);
        }
        double[] standard = new double[level.standardVariableCount()];
        for (int i = 0; i < originalValues.length; i++) {
            VariableReconstruction variable = level.variables().get(i);
            double x = originalValues[i];
            int k = variable.multipliers().get(0).index();
            if (variable.change() == null) {
                standard[k] = x;
            } else {
                variable.change().accept(new ForwardSubstitution(standard, k, x));
            }
        }
        return standard;
    }

    private static final class ForwardSubstitution implements VariableChange.Visitor<Void> {

        private final double[] standard;
        private final int index;
        private final double x;

        private ForwardSubstitution(double[] standard, int index, double x) {
            this.standard = standard;
            this.index = index;
            this.x = x;
        }

        @Override
        public Void visitLowerBound(VariableChange.LowerBound change) {
            standard[index] = x - change.lowerBound();
            return null;
        }

        @Override
        public Void visitUpperBound(VariableChange.UpperBound change) {
            standard[index] = change.upperBound() - x;
            return null;
        }

        @Override
        public Void visitRange(VariableChange.Range change) {
            standard[index] = x - change.lowerBound();
            if (change.hasSlack()) {
                standard[change.slackIndex()] = change.upperBound() - x;
            }
            return null;
        }

        @Override
        public Void visitUnbounded(VariableChange.Unbounded change) {
            standard[index] = Math.max(x, 0);
            standard[change.newIndex()] = Math.max(-x, 0);
            return null;
        }
    }
}
