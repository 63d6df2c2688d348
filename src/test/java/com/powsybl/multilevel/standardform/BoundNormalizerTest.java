/**
 * Copyright (c) 2024, Artelys (http://www.artelys.com/)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.multilevel.standardform;

import com.powsybl.multilevel.model.ColumnRemapping;
import com.powsybl.multilevel.model.VariableBlock;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class BoundNormalizerTest {

    private static final double INF = Double.POSITIVE_INFINITY;

    /**
     * 4 continuous variables: nonnegative, lower bounded, upper bounded, range.
     * 2 integer variables: free, range.
     * 1 binary variable.
     */
    private static VariableBlock createBlock() {
        return new VariableBlock(4, 2, 1)
                .setLowerBounds(0, 2, -INF, 1, -INF, -1)
                .setUpperBounds(INF, INF, 3, 4, INF, 1);
    }

    @Test
    void testEqualityForm() {
        VariableChanges changes = BoundNormalizer.normalize(createBlock(), false);

        // range slacks and negative parts of free variables are continuous, the integer indices are shifted by 2
        assertEquals(List.of(
                new VariableChange.LowerBound(true, 1, 2),
                new VariableChange.UpperBound(true, 2, 3),
                new VariableChange.Range(true, 3, 1, 4, 4),
                new VariableChange.Unbounded(false, 6, 8),
                new VariableChange.Range(false, 7, -1, 1, 5)),
                changes.getChanges());
        assertEquals(new ColumnRemapping(4, 2, 1, 6, 3), changes.getRemapping());
        assertEquals(6, changes.getNxR());
        assertEquals(3, changes.getNxZ());
        assertEquals(1, changes.getNxB());
        assertEquals(10, changes.getVariableCount());
        assertEquals(3, changes.getIntroducedVariableCount());
        assertNull(changes.getChange(0));
        assertEquals(new VariableChange.Unbounded(false, 6, 8), changes.getChange(6));
    }

    @Test
    void testInequalityForm() {
        VariableChanges changes = BoundNormalizer.normalize(createBlock(), true);

        // ranges are bounded by an extra inequality row, no slack variable
        assertEquals(List.of(
                new VariableChange.LowerBound(true, 1, 2),
                new VariableChange.UpperBound(true, 2, 3),
                new VariableChange.Range(true, 3, 1, 4, VariableChange.NO_INDEX),
                new VariableChange.Unbounded(false, 4, 6),
                new VariableChange.Range(false, 5, -1, 1, VariableChange.NO_INDEX)),
                changes.getChanges());
        assertEquals(new ColumnRemapping(4, 2, 1, 4, 3), changes.getRemapping());
        assertEquals(1, changes.getIntroducedVariableCount());
        assertFalse(((VariableChange.Range) changes.getChange(3)).hasSlack());
    }

    @Test
    void testFreeVariables() {
        // free continuous and integer variables, integer negative parts follow the existing integers
        VariableBlock x = new VariableBlock(1, 2, 0)
                .setLowerBounds(-INF, -INF, 1);
        VariableChanges changes = BoundNormalizer.normalize(x, true);
        assertEquals(List.of(
                new VariableChange.Unbounded(true, 0, 1),
                new VariableChange.Unbounded(false, 2, 4),
                new VariableChange.LowerBound(false, 3, 1)),
                changes.getChanges());
        assertEquals(2, changes.getNxR());
        assertEquals(3, changes.getNxZ());
    }

    @Test
    void testNoChange() {
        VariableBlock x = new VariableBlock(2, 1, 3).setLowerBounds(0, 0, 0);
        VariableChanges changes = BoundNormalizer.normalize(x, false);
        assertTrue(changes.isEmpty());
        assertTrue(changes.getRemapping().isIdentity());
        assertEquals(6, changes.getVariableCount());
        assertEquals("VariableChanges(nxR=2->2, nxZ=1->1, changes=[])", changes.toString());
    }
}
