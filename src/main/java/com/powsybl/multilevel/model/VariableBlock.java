/**
 * Copyright (c) 2024, Artelys (http://www.artelys.com/)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.multilevel.model;

import java.util.Arrays;
import java.util.Objects;

/**
 * Variables of a level: {@code nxR} continuous variables, then {@code nxZ} general integer variables, then
 * {@code nxB} binary variables.
 * Lower and upper bounds are only stored for continuous and integer variables, binary variables being
 * implicitly bounded in [0, 1]. A newly declared variable is free: its bounds are -infinity and +infinity.
 */
public class VariableBlock {

    private int nxR;
    private int nxZ;
    private int nxB;
    private double[] lowerBounds;
    private double[] upperBounds;

    public VariableBlock(int nxR, int nxZ, int nxB) {
        if (nxR < 0 || nxZ < 0 || nxB < 0) {
            throw new IllegalArgumentException("Variable counts must not be negative");
        }
        this.nxR = nxR;
        this.nxZ = nxZ;
        this.nxB = nxB;
        this.lowerBounds = new double[nxR + nxZ];
        this.upperBounds = new double[nxR + nxZ];
        Arrays.fill(lowerBounds, Double.NEGATIVE_INFINITY);
        Arrays.fill(upperBounds, Double.POSITIVE_INFINITY);
    }

    private VariableBlock(VariableBlock other) {
        this.nxR = other.nxR;
        this.nxZ = other.nxZ;
        this.nxB = other.nxB;
        this.lowerBounds = other.lowerBounds.clone();
        this.upperBounds = other.upperBounds.clone();
    }

    public VariableBlock copy() {
        return new VariableBlock(this);
    }

    public int getNxR() {
        return nxR;
    }

    public int getNxZ() {
        return nxZ;
    }

    public int getNxB() {
        return nxB;
    }

    /**
     * Number of variables carrying explicit bounds (continuous and integer ones).
     */
    public int getBoundedCount() {
        return nxR + nxZ;
    }

    public int size() {
        return nxR + nxZ + nxB;
    }

    public boolean isReal(int index) {
        return index >= 0 && index < nxR;
    }

    public boolean isInteger(int index) {
        return index >= nxR && index < nxR + nxZ;
    }

    public boolean isBinary(int index) {
        return index >= nxR + nxZ && index < size();
    }

    public double getLowerBound(int index) {
        return lowerBounds[checkBoundedIndex(index)];
    }

    public double getUpperBound(int index) {
        return upperBounds[checkBoundedIndex(index)];
    }

    public VariableBlock setLowerBound(int index, double lowerBound) {
        lowerBounds[checkBoundedIndex(index)] = lowerBound;
        return this;
    }

    public VariableBlock setUpperBound(int index, double upperBound) {
        upperBounds[checkBoundedIndex(index)] = upperBound;
        return this;
    }

    public double[] getLowerBounds() {
        return lowerBounds.clone();
    }

    public double[] getUpperBounds() {
        return upperBounds.clone();
    }

    public VariableBlock setLowerBounds(double... lowerBounds) {
        this.lowerBounds = checkBoundsLength(lowerBounds).clone();
        return this;
    }

    public VariableBlock setUpperBounds(double... upperBounds) {
        this.upperBounds = checkBoundsLength(upperBounds).clone();
        return this;
    }

    /**
     * Makes every continuous and integer variable nonnegative with no upper bound.
     */
    public void setNonNegative() {
        Arrays.fill(lowerBounds, 0);
        Arrays.fill(upperBounds, Double.POSITIVE_INFINITY);
    }

    /**
     * Grows the block according to the given remapping. Existing bounds move with their variable, new variables
     * get the given bounds.
     */
    public void resize(ColumnRemapping remapping, double newLowerBound, double newUpperBound) {
        Objects.requireNonNull(remapping);
        if (remapping.oldNxR() != nxR || remapping.oldNxZ() != nxZ || remapping.nxB() != nxB) {
            throw new IllegalArgumentException("Remapping " + remapping + " does not apply to a block of ("
                    + nxR + ", " + nxZ + ", " + nxB + ") variables");
        }
        int newBoundedCount = remapping.newNxR() + remapping.newNxZ();
        double[] newLowerBounds = new double[newBoundedCount];
        double[] newUpperBounds = new double[newBoundedCount];
        Arrays.fill(newLowerBounds, newLowerBound);
        Arrays.fill(newUpperBounds, newUpperBound);
        for (int i = 0; i < getBoundedCount(); i++) {
            newLowerBounds[remapping.map(i)] = lowerBounds[i];
            newUpperBounds[remapping.map(i)] = upperBounds[i];
        }
        nxR = remapping.newNxR();
        nxZ = remapping.newNxZ();
        lowerBounds = newLowerBounds;
        upperBounds = newUpperBounds;
    }

    /**
     * Turns every binary variable into a general integer variable bounded in [0, 1]. Variable positions do not
     * change since binary variables directly follow integer ones.
     */
    public void relaxBinaries() {
        if (nxB == 0) {
            return;
        }
        int boundedCount = getBoundedCount();
        lowerBounds = Arrays.copyOf(lowerBounds, boundedCount + nxB);
        upperBounds = Arrays.copyOf(upperBounds, boundedCount + nxB);
        Arrays.fill(upperBounds, boundedCount, boundedCount + nxB, 1);
        nxZ += nxB;
        nxB = 0;
    }

    private int checkBoundedIndex(int index) {
        if (index < 0 || index >= getBoundedCount()) {
            throw new IndexOutOfBoundsException("Variable " + index + " has no bounds, bounded variables are [0, " + getBoundedCount() + ")");
        }
        return index;
    }

    private double[] checkBoundsLength(double[] bounds) {
        Objects.requireNonNull(bounds);
        if (bounds.length != getBoundedCount()) {
            throw new IllegalArgumentException("Expected " + getBoundedCount() + " bounds, got " + bounds.length);
        }
        return bounds;
    }

    @Override
    public String toString() {
        return "VariableBlock(nxR=" + nxR + ", nxZ=" + nxZ + ", nxB=" + nxB + ')';
    }
}
