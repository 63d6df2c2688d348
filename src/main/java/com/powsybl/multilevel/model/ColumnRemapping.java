/**
 * Copyright (c) 2024, Artelys (http://www.artelys.com/)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.multilevel.model;

/**
 * Describes how the variable block of a level grows when new continuous or integer variables are appended.
 * Variables are laid out as [continuous | integer | binary]: continuous variables keep their index, integer
 * variables are shifted by the number of added continuous variables, binary variables by the number of added
 * continuous and integer variables. New columns are the gaps left by these shifts.
 *
 * @param oldNxR number of continuous variables before the change
 * @param oldNxZ number of integer variables before the change
 * @param nxB number of binary variables, unchanged
 * @param newNxR number of continuous variables after the change
 * @param newNxZ number of integer variables after the change
 */
public record ColumnRemapping(int oldNxR, int oldNxZ, int nxB, int newNxR, int newNxZ) {

    public ColumnRemapping {
        if (oldNxR < 0 || oldNxZ < 0 || nxB < 0) {
            throw new IllegalArgumentException("Variable counts must not be negative");
        }
        if (newNxR < oldNxR || newNxZ < oldNxZ) {
            throw new IllegalArgumentException("A variable block can only grow: (" + oldNxR + ", " + oldNxZ
                    + ") -> (" + newNxR + ", " + newNxZ + ")");
        }
    }

    public static ColumnRemapping identity(VariableBlock block) {
        return new ColumnRemapping(block.getNxR(), block.getNxZ(), block.getNxB(), block.getNxR(), block.getNxZ());
    }

    public int oldSize() {
        return oldNxR + oldNxZ + nxB;
    }

    public int newSize() {
        return newNxR + newNxZ + nxB;
    }

    public boolean isIdentity() {
        return oldNxR == newNxR && oldNxZ == newNxZ;
    }

    public int map(int oldIndex) {
        if (oldIndex < 0 || oldIndex >= oldSize()) {
            throw new IndexOutOfBoundsException("Variable index " + oldIndex + " out of bounds [0, " + oldSize() + ")");
        }
        if (oldIndex < oldNxR) {
            return oldIndex;
        }
        if (oldIndex < oldNxR + oldNxZ) {
            return oldIndex + newNxR - oldNxR;
        }
        return oldIndex + newNxR - oldNxR + newNxZ - oldNxZ;
    }

    /**
     * Returns a new vector of the new size where each old value is moved to its new position, new positions
     * being filled with zero.
     */
    public double[] apply(double[] vector) {
        if (vector.length != oldSize()) {
            throw new IllegalArgumentException("Vector of length " + vector.length + " cannot be remapped, expected " + oldSize());
        }
        double[] remapped = new double[newSize()];
        for (int i = 0; i < vector.length; i++) {
            remapped[map(i)] = vector[i];
        }
        return remapped;
    }
}
