/**
 * Copyright (c) 2024, Artelys (http://www.artelys.com/)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.multilevel.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * One decision level of a multilevel problem: its variables, objective, constraints and nested lower levels.
 * <p>
 * The objective and the constraints of a level may reference the variables of any level of the problem, so
 * objective vectors and constraint matrices are stored per referenced level id:
 * <pre>
 *   objective:   sum over levels L of c[L] . x_L + d  (+ sum over pairs (L, K) of x_L' P[L, K] x_K)
 *   constraints: sum over levels L of A[L] x_L  (&lt;= or =)  b
 * </pre>
 * Vectors and matrices are copied when set and when read, so that two levels or two problems never share
 * mutable state.
 */
public class Level {

    private final int id;
    private final VariableBlock variables;
    private boolean minimize = true;
    private boolean inequalities = true;
    private final Map<Integer, double[]> objectives = new TreeMap<>();
    private double objectiveConstant = 0;
    private final Map<Integer, SparseMatrix> constraintMatrices = new TreeMap<>();
    private double[] rhs = new double[0];
    private final Map<LevelPair, SparseMatrix> quadraticTerms = new TreeMap<>(
            Comparator.comparingInt(LevelPair::rowLevelId).thenComparingInt(LevelPair::columnLevelId));
    private final List<Level> lowerLevels = new ArrayList<>();

    Level(int id, VariableBlock variables) {
        this.id = id;
        this.variables = Objects.requireNonNull(variables);
    }

    Level copy() {
        Level copy = new Level(id, variables.copy());
        copy.minimize = minimize;
        copy.inequalities = inequalities;
        objectives.forEach((levelId, c) -> copy.objectives.put(levelId, c.clone()));
        copy.objectiveConstant = objectiveConstant;
        copy.constraintMatrices.putAll(constraintMatrices); // immutable matrices
        copy.rhs = rhs.clone();
        copy.quadraticTerms.putAll(quadraticTerms);
        for (Level lowerLevel : lowerLevels) {
            copy.lowerLevels.add(lowerLevel.copy());
        }
        return copy;
    }

    public int getId() {
        return id;
    }

    public VariableBlock getVariables() {
        return variables;
    }

    public boolean isMinimize() {
        return minimize;
    }

    public Level setMinimize(boolean minimize) {
        this.minimize = minimize;
        return this;
    }

    public boolean isInequalities() {
        return inequalities;
    }

    public Level setInequalities(boolean inequalities) {
        this.inequalities = inequalities;
        return this;
    }

    /**
     * Returns the objective coefficients of the variables of the given level, or null if this objective does
     * not reference them.
     */
    public double[] getObjective(int levelId) {
        double[] c = objectives.get(levelId);
        return c != null ? c.clone() : null;
    }

    public Level setObjective(int levelId, double... coefficients) {
        if (coefficients == null) {
            objectives.remove(levelId);
        } else {
            objectives.put(levelId, coefficients.clone());
        }
        return this;
    }

    public Map<Integer, double[]> getObjectives() {
        Map<Integer, double[]> copy = new TreeMap<>();
        objectives.forEach((levelId, c) -> copy.put(levelId, c.clone()));
        return copy;
    }

    public double getObjectiveConstant() {
        return objectiveConstant;
    }

    public Level setObjectiveConstant(double objectiveConstant) {
        this.objectiveConstant = objectiveConstant;
        return this;
    }

    /**
     * Returns the constraint matrix of the variables of the given level, or null if the constraints of this level
     * do not reference them.
     */
    public SparseMatrix getConstraintMatrix(int levelId) {
        return constraintMatrices.get(levelId);
    }

    public Level setConstraintMatrix(int levelId, SparseMatrix matrix) {
        if (matrix == null) {
            constraintMatrices.remove(levelId);
        } else {
            constraintMatrices.put(levelId, matrix);
        }
        return this;
    }

    public Level setConstraintMatrix(int levelId, double[][] dense) {
        return setConstraintMatrix(levelId, SparseMatrix.fromDense(dense));
    }

    public Map<Integer, SparseMatrix> getConstraintMatrices() {
        return Collections.unmodifiableMap(constraintMatrices);
    }

    public double[] getRhs() {
        return rhs.clone();
    }

    public Level setRhs(double... rhs) {
        this.rhs = Objects.requireNonNull(rhs).clone();
        return this;
    }

    public int getConstraintCount() {
        return rhs.length;
    }

    public SparseMatrix getQuadraticTerm(int rowLevelId, int columnLevelId) {
        return quadraticTerms.get(new LevelPair(rowLevelId, columnLevelId));
    }

    public Level setQuadraticTerm(int rowLevelId, int columnLevelId, SparseMatrix matrix) {
        LevelPair pair = new LevelPair(rowLevelId, columnLevelId);
        if (matrix == null) {
            quadraticTerms.remove(pair);
        } else {
            quadraticTerms.put(pair, matrix);
        }
        return this;
    }

    public Map<LevelPair, SparseMatrix> getQuadraticTerms() {
        return Collections.unmodifiableMap(quadraticTerms);
    }

    public boolean hasQuadraticTerms() {
        return quadraticTerms.values().stream().anyMatch(p -> p.getNonZeroCount() > 0);
    }

    public List<Level> getLowerLevels() {
        return Collections.unmodifiableList(lowerLevels);
    }

    void addLowerLevel(Level level) {
        lowerLevels.add(level);
    }

    public boolean isLeaf() {
        return lowerLevels.isEmpty();
    }

    @Override
    public String toString() {
        return "Level(id=" + id + ", " + variables + ", minimize=" + minimize + ", inequalities=" + inequalities
                + ", constraints=" + rhs.length + ", lowerLevels=" + lowerLevels.size() + ')';
    }
}
