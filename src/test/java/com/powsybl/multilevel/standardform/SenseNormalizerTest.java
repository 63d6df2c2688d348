/**
 * Copyright (c) 2024, Artelys (http://www.artelys.com/)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.multilevel.standardform;

import com.powsybl.multilevel.model.Level;
import com.powsybl.multilevel.model.MultilevelProblem;
import com.powsybl.multilevel.model.ProblemKind;
import com.powsybl.multilevel.model.SparseMatrix;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SenseNormalizerTest {

    private static Level createMaximizingLevel(MultilevelProblem problem) {
        Level u = problem.addUpper(2);
        Level l = problem.addLower(u, 1);
        u.setMinimize(false)
                .setObjective(u.getId(), 1, -2)
                .setObjective(l.getId(), 3)
                .setObjectiveConstant(4)
                .setQuadraticTerm(u.getId(), l.getId(), SparseMatrix.fromDense(new double[][] {{1}, {0}}));
        return u;
    }

    @Test
    void testLinear() {
        Level u = createMaximizingLevel(new MultilevelProblem(ProblemKind.LINEAR));
        assertTrue(SenseNormalizer.normalize(u, true, ProblemKind.LINEAR));
        assertTrue(u.isMinimize());
        assertArrayEquals(new double[] {-1, 2}, u.getObjective(0));
        assertArrayEquals(new double[] {-3}, u.getObjective(1));
        assertEquals(-4, u.getObjectiveConstant());
        // quadratic terms are left untouched in a linear problem
        assertEquals(1, u.getQuadraticTerm(0, 1).get(0, 0));

        // already in the requested sense
        assertFalse(SenseNormalizer.normalize(u, true, ProblemKind.LINEAR));
        assertArrayEquals(new double[] {-1, 2}, u.getObjective(0));
    }

    @Test
    void testQuadratic() {
        Level u = createMaximizingLevel(new MultilevelProblem(ProblemKind.QUADRATIC));
        assertTrue(SenseNormalizer.normalize(u, true, ProblemKind.QUADRATIC));
        assertEquals(-1, u.getQuadraticTerm(0, 1).get(0, 0));

        // back to maximization
        assertTrue(SenseNormalizer.normalize(u, false, ProblemKind.QUADRATIC));
        assertFalse(u.isMinimize());
        assertArrayEquals(new double[] {1, -2}, u.getObjective(0));
        assertEquals(4, u.getObjectiveConstant());
        assertEquals(1, u.getQuadraticTerm(0, 1).get(0, 0));
    }
}
