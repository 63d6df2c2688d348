/**
 * Copyright (c) 2024, Artelys (http://www.artelys.com/)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.multilevel.model;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class VariableBlockTest {

    private static final double INF = Double.POSITIVE_INFINITY;

    @Test
    void testDefaults() {
        VariableBlock x = new VariableBlock(2, 1, 2);
        assertEquals(5, x.size());
        assertEquals(3, x.getBoundedCount());
        // variables are free by default
        assertArrayEquals(new double[] {-INF, -INF, -INF}, x.getLowerBounds());
        assertArrayEquals(new double[] {INF, INF, INF}, x.getUpperBounds());
        assertTrue(x.isReal(1));
        assertTrue(x.isInteger(2));
        assertTrue(x.isBinary(3));
        assertFalse(x.isBinary(5));
        assertEquals("VariableBlock(nxR=2, nxZ=1, nxB=2)", x.toString());
    }

    @Test
    void testBounds() {
        VariableBlock x = new VariableBlock(1, 1, 1);
        x.setLowerBound(0, -1).setUpperBound(1, 4);
        assertEquals(-1, x.getLowerBound(0));
        assertEquals(4, x.getUpperBound(1));

        // binary variables have no bounds
        IndexOutOfBoundsException e = assertThrows(IndexOutOfBoundsException.class, () -> x.setLowerBound(2, 0));
        assertEquals("Variable 2 has no bounds, bounded variables are [0, 2)", e.getMessage());
        IllegalArgumentException e2 = assertThrows(IllegalArgumentException.class, () -> x.setUpperBounds(1, 2, 3));
        assertEquals("Expected 2 bounds, got 3", e2.getMessage());
        IllegalArgumentException e3 = assertThrows(IllegalArgumentException.class, () -> new VariableBlock(0, -1, 0));
        assertEquals("Variable counts must not be negative", e3.getMessage());
    }

    @Test
    void testCopy() {
        VariableBlock x = new VariableBlock(1, 0, 0).setLowerBounds(3);
        VariableBlock copy = x.copy();
        copy.setLowerBound(0, 5);
        assertEquals(3, x.getLowerBound(0));
        assertEquals(5, copy.getLowerBound(0));
    }

    @Test
    void testResize() {
        VariableBlock x = new VariableBlock(1, 1, 1)
                .setLowerBounds(-1, -2)
                .setUpperBounds(1, 2);
        x.resize(new ColumnRemapping(1, 1, 1, 3, 2), 0, INF);
        assertEquals(3, x.getNxR());
        assertEquals(2, x.getNxZ());
        assertEquals(1, x.getNxB());
        assertArrayEquals(new double[] {-1, 0, 0, -2, 0}, x.getLowerBounds());
        assertArrayEquals(new double[] {1, INF, INF, 2, INF}, x.getUpperBounds());

        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
                () -> x.resize(new ColumnRemapping(1, 1, 1, 2, 1), 0, INF));
        assertEquals("Remapping ColumnRemapping[oldNxR=1, oldNxZ=1, nxB=1, newNxR=2, newNxZ=1] does not apply to a block of (3, 2, 1) variables",
                e.getMessage());
    }

    @Test
    void testRelaxBinaries() {
        VariableBlock x = new VariableBlock(1, 1, 2).setLowerBounds(-1, 3);
        x.relaxBinaries();
        assertEquals(3, x.getNxZ());
        assertEquals(0, x.getNxB());
        assertEquals(4, x.size());
        assertArrayEquals(new double[] {-1, 3, 0, 0}, x.getLowerBounds());
        assertArrayEquals(new double[] {INF, INF, 1, 1}, x.getUpperBounds());
    }

    @Test
    void testSetNonNegative() {
        VariableBlock x = new VariableBlock(2, 0, 0).setLowerBounds(-3, 1).setUpperBounds(5, INF);
        x.setNonNegative();
        assertArrayEquals(new double[] {0, 0}, x.getLowerBounds());
        assertArrayEquals(new double[] {INF, INF}, x.getUpperBounds());
    }
}
