/**
 * Copyright (c) 2024, Artelys (http://www.artelys.com/)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.multilevel.model;

import com.powsybl.commons.PowsyblException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class MultilevelProblemTest {

    private MultilevelProblem problem;
    private Level upper;
    private Level middle;
    private Level lower;
    private Level sibling;

    @BeforeEach
    void setUp() {
        problem = new MultilevelProblem(ProblemKind.LINEAR);
        upper = problem.addUpper(1, 1, 0);
        middle = problem.addLower(upper, 2);
        lower = problem.addLower(middle, 1);
        sibling = problem.addLower(upper, 1);
    }

    @Test
    void testTree() {
        assertSame(upper, problem.getRoot());
        assertEquals(List.of(0, 1, 2, 3), problem.levels().stream().map(Level::getId).toList());
        assertEquals(List.of(middle, sibling), upper.getLowerLevels());
        assertTrue(lower.isLeaf());
        assertFalse(middle.isLeaf());
        assertSame(lower, problem.getLevel(2));
        assertEquals(6, problem.getVariableCount());

        PowsyblException e = assertThrows(PowsyblException.class, () -> problem.getLevel(7));
        assertEquals("Level 7 not found", e.getMessage());
        PowsyblException e2 = assertThrows(PowsyblException.class, () -> problem.addUpper(1));
        assertEquals("Upper level already defined", e2.getMessage());
        Level foreign = new MultilevelProblem(ProblemKind.LINEAR).addUpper(1);
        assertThrows(PowsyblException.class, () -> problem.addLower(foreign, 1));
    }

    @Test
    void testLevelDefaults() {
        assertTrue(upper.isMinimize());
        assertTrue(upper.isInequalities());
        assertNull(upper.getObjective(middle.getId()));
        assertNull(upper.getConstraintMatrix(middle.getId()));
        assertEquals(0, upper.getConstraintCount());
        assertFalse(upper.hasQuadraticTerms());
        upper.setQuadraticTerm(0, 0, SparseMatrix.empty(2, 2));
        // an empty quadratic matrix does not make the problem quadratic
        assertFalse(upper.hasQuadraticTerms());
    }

    @Test
    void testCopy() {
        upper.setObjective(upper.getId(), 1, 2);
        middle.setConstraintMatrix(middle.getId(), new double[][] {{1, 1}});
        middle.setRhs(3);
        MultilevelProblem copy = problem.copy();

        copy.getLevel(0).setObjective(0, 5, 6);
        copy.getLevel(1).setRhs(4);
        copy.getLevel(2).getVariables().setLowerBound(0, 0);
        assertArrayEquals(new double[] {1, 2}, upper.getObjective(0));
        assertArrayEquals(new double[] {3}, middle.getRhs());
        assertEquals(Double.NEGATIVE_INFINITY, lower.getVariables().getLowerBound(0));
        assertEquals(List.of(0, 1, 2, 3), copy.levels().stream().map(Level::getId).toList());

        // ids keep increasing after a copy
        assertEquals(4, copy.addLower(copy.getLevel(3), 1).getId());
    }

    @Test
    void testRemapVariables() {
        upper.setObjective(middle.getId(), 1, 2);
        middle.setConstraintMatrix(middle.getId(), new double[][] {{1, 2}});
        middle.setRhs(0);
        lower.setQuadraticTerm(middle.getId(), lower.getId(), SparseMatrix.fromDense(new double[][] {{1}, {2}}));

        problem.remapVariables(middle.getId(), new ColumnRemapping(2, 0, 0, 3, 0), 0, Double.POSITIVE_INFINITY);

        assertEquals(3, middle.getVariables().size());
        assertEquals(0, middle.getVariables().getLowerBound(2));
        assertArrayEquals(new double[] {1, 2, 0}, upper.getObjective(middle.getId()));
        assertEquals(SparseMatrix.fromDense(new double[][] {{1, 2, 0}}), middle.getConstraintMatrix(middle.getId()));
        assertEquals(SparseMatrix.fromDense(new double[][] {{1}, {2}, {0}}), lower.getQuadraticTerm(middle.getId(), lower.getId()));
        problem.check();
    }

    @Test
    void testCheck() {
        PowsyblException e = assertThrows(PowsyblException.class, () -> new MultilevelProblem(ProblemKind.LINEAR).check());
        assertEquals("Problem has no upper level", e.getMessage());

        problem.check();

        upper.getVariables().setLowerBound(0, 2).setUpperBound(0, 1);
        e = assertThrows(PowsyblException.class, () -> problem.check());
        assertEquals("Level 0: variable 0 has empty domain [2.0, 1.0]", e.getMessage());
        upper.getVariables().setLowerBound(0, Double.NaN);
        e = assertThrows(PowsyblException.class, () -> problem.check());
        assertEquals("Level 0: bound of variable 0 is NaN", e.getMessage());
        upper.getVariables().setLowerBound(0, 0);

        middle.setObjective(upper.getId(), 1);
        e = assertThrows(PowsyblException.class, () -> problem.check());
        assertEquals("Level 1: objective vector of level 0 has length 1, expected 2", e.getMessage());
        middle.setObjective(upper.getId(), null);

        lower.setConstraintMatrix(middle.getId(), new double[][] {{1, 1}});
        e = assertThrows(PowsyblException.class, () -> problem.check());
        assertEquals("Level 2: constraint matrix of level 1 is 1x2, expected 0x2", e.getMessage());
        lower.setRhs(1);
        problem.check();

        sibling.setQuadraticTerm(sibling.getId(), upper.getId(), SparseMatrix.empty(1, 1));
        e = assertThrows(PowsyblException.class, () -> problem.check());
        assertEquals("Level 3: quadratic term LevelPair[rowLevelId=3, columnLevelId=0] is 1x1, expected 1x2", e.getMessage());
    }
}
