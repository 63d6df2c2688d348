/**
 * Copyright (c) 2024, Artelys (http://www.artelys.com/)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.multilevel.model;

import com.powsybl.commons.PowsyblException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * A multilevel optimization problem: a tree of {@link Level}, rooted at the upper level.
 * Levels are identified by a small integer allocated by the problem, which stays stable across copies.
 */
public class MultilevelProblem {

    private final ProblemKind kind;
    private Level root;
    private int nextLevelId = 0;

    public MultilevelProblem(ProblemKind kind) {
        this.kind = Objects.requireNonNull(kind);
    }

    public ProblemKind getKind() {
        return kind;
    }

    public Level getRoot() {
        return root;
    }

    public Level addUpper(int nxR, int nxZ, int nxB) {
        if (root != null) {
            throw new PowsyblException("Upper level already defined");
        }
        root = new Level(nextLevelId++, new VariableBlock(nxR, nxZ, nxB));
        return root;
    }

    public Level addUpper(int nxR) {
        return addUpper(nxR, 0, 0);
    }

    public Level addLower(Level parent, int nxR, int nxZ, int nxB) {
        Objects.requireNonNull(parent);
        if (getLevel(parent.getId()) != parent) {
            throw new PowsyblException("Level " + parent.getId() + " does not belong to this problem");
        }
        Level level = new Level(nextLevelId++, new VariableBlock(nxR, nxZ, nxB));
        parent.addLowerLevel(level);
        return level;
    }

    public Level addLower(Level parent, int nxR) {
        return addLower(parent, nxR, 0, 0);
    }

    /**
     * Returns all the levels of the problem, parents before their descendants (depth-first pre-order).
     */
    public List<Level> levels() {
        if (root == null) {
            return Collections.emptyList();
        }
        List<Level> levels = new ArrayList<>();
        collect(root, levels);
        return levels;
    }

    private static void collect(Level level, List<Level> levels) {
        levels.add(level);
        for (Level lowerLevel : level.getLowerLevels()) {
            collect(lowerLevel, levels);
        }
    }

    public Level getLevel(int id) {
        return levels().stream()
                .filter(l -> l.getId() == id)
                .findFirst()
                .orElseThrow(() -> new PowsyblException("Level " + id + " not found"));
    }

    /**
     * Deep copy of the problem. Level ids are preserved.
     */
    public MultilevelProblem copy() {
        MultilevelProblem copy = new MultilevelProblem(kind);
        copy.root = root != null ? root.copy() : null;
        copy.nextLevelId = nextLevelId;
        return copy;
    }

    public int getVariableCount() {
        return levels().stream().mapToInt(l -> l.getVariables().size()).sum();
    }

    public int getConstraintCount() {
        return levels().stream().mapToInt(Level::getConstraintCount).sum();
    }

    /**
     * Grows the variable block of a level and re-indexes every objective vector, constraint matrix and quadratic
     * term matrix of the problem that references the variables of this level.
     *
     * @param levelId the level owning the variables
     * @param remapping how the variable block grows
     * @param newLowerBound lower bound of the new variables
     * @param newUpperBound upper bound of the new variables
     */
    public void remapVariables(int levelId, ColumnRemapping remapping, double newLowerBound, double newUpperBound) {
        Objects.requireNonNull(remapping);
        Level owner = getLevel(levelId);
        owner.getVariables().resize(remapping, newLowerBound, newUpperBound);
        if (remapping.isIdentity()) {
            return;
        }
        for (Level level : levels()) {
            double[] c = level.getObjective(levelId);
            if (c != null) {
                level.setObjective(levelId, remapping.apply(c));
            }
            SparseMatrix a = level.getConstraintMatrix(levelId);
            if (a != null) {
                level.setConstraintMatrix(levelId, a.remapColumns(remapping::map, remapping.newSize()));
            }
            for (Map.Entry<LevelPair, SparseMatrix> e : List.copyOf(level.getQuadraticTerms().entrySet())) {
                LevelPair pair = e.getKey();
                SparseMatrix p = e.getValue();
                if (pair.rowLevelId() == levelId) {
                    p = p.remapRows(remapping::map, remapping.newSize());
                }
                if (pair.columnLevelId() == levelId) {
                    p = p.remapColumns(remapping::map, remapping.newSize());
                }
                level.setQuadraticTerm(pair.rowLevelId(), pair.columnLevelId(), p);
            }
        }
    }

    /**
     * Checks the consistency of the dimensions of every vector and matrix of the problem.
     *
     * @throws PowsyblException describing the first inconsistency found
     */
    public void check() {
        if (root == null) {
            throw new PowsyblException("Problem has no upper level");
        }
        for (Level level : levels()) {
            checkBounds(level);
            checkObjective(level);
            checkConstraints(level);
            checkQuadraticTerms(level);
        }
    }

    private void checkBounds(Level level) {
        VariableBlock x = level.getVariables();
        for (int i = 0; i < x.getBoundedCount(); i++) {
            double lb = x.getLowerBound(i);
            double ub = x.getUpperBound(i);
            if (Double.isNaN(lb) || Double.isNaN(ub)) {
                throw new PowsyblException("Level " + level.getId() + ": bound of variable " + i + " is NaN");
            }
            if (lb > ub || lb == Double.POSITIVE_INFINITY || ub == Double.NEGATIVE_INFINITY) {
                throw new PowsyblException("Level " + level.getId() + ": variable " + i + " has empty domain [" + lb + ", " + ub + "]");
            }
        }
    }

    private void checkObjective(Level level) {
        for (Map.Entry<Integer, double[]> e : level.getObjectives().entrySet()) {
            int expected = getLevel(e.getKey()).getVariables().size();
            if (e.getValue().length != expected) {
                throw new PowsyblException("Level " + level.getId() + ": objective vector of level " + e.getKey()
                        + " has length " + e.getValue().length + ", expected " + expected);
            }
        }
    }

    private void checkConstraints(Level level) {
        for (Map.Entry<Integer, SparseMatrix> e : level.getConstraintMatrices().entrySet()) {
            SparseMatrix a = e.getValue();
            int expectedColumns = getLevel(e.getKey()).getVariables().size();
            if (a.getRowCount() != level.getConstraintCount() || a.getColumnCount() != expectedColumns) {
                throw new PowsyblException("Level " + level.getId() + ": constraint matrix of level " + e.getKey()
                        + " is " + a.getRowCount() + "x" + a.getColumnCount() + ", expected "
                        + level.getConstraintCount() + "x" + expectedColumns);
            }
        }
    }

    private void checkQuadraticTerms(Level level) {
        for (Map.Entry<LevelPair, SparseMatrix> e : level.getQuadraticTerms().entrySet()) {
            SparseMatrix p = e.getValue();
            int expectedRows = getLevel(e.getKey().rowLevelId()).getVariables().size();
            int expectedColumns = getLevel(e.getKey().columnLevelId()).getVariables().size();
            if (p.getRowCount() != expectedRows || p.getColumnCount() != expectedColumns) {
                throw new PowsyblException("Level " + level.getId() + ": quadratic term " + e.getKey() + " is "
                        + p.getRowCount() + "x" + p.getColumnCount() + ", expected " + expectedRows + "x" + expectedColumns);
            }
        }
    }

    @Override
    public String toString() {
        return "MultilevelProblem(kind=" + kind + ", levels=" + levels().size() + ')';
    }
}
