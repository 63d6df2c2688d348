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
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Decides, for each continuous and integer variable of a level, the substitution that makes it nonnegative.
 * <p>
 * New continuous variables (negative parts of free continuous variables, range slacks) are appended after the
 * existing continuous ones, new integer variables (negative parts of free integer variables) after the existing
 * integer ones. Since continuous variables come first, every integer index is shifted by the number of added
 * continuous variables, which is why the final number of continuous variables is computed before any index is
 * assigned.
 */
public final class BoundNormalizer {

    private static final Logger LOGGER = LoggerFactory.getLogger(BoundNormalizer.class);

    private enum BoundType {
        NONNEGATIVE,
        LOWER,
        UPPER,
        RANGE,
        FREE
    }

    private BoundNormalizer() {
    }

    private static BoundType getBoundType(double lb, double ub) {
        if (ub == Double.POSITIVE_INFINITY) {
            if (lb == 0) {
                return BoundType.NONNEGATIVE;
            }
            return lb == Double.NEGATIVE_INFINITY ? BoundType.FREE : BoundType.LOWER;
        }
        return lb == Double.NEGATIVE_INFINITY ? BoundType.UPPER : BoundType.RANGE;
    }

    /**
     * Computes the changes of a level.
     *
     * @param variables the variable block of the level
     * @param inequalities true if the level constraints are inequalities: ranges then need no slack variable
     * @return the changes, with the variable counts after normalization
     */
    public static VariableChanges normalize(VariableBlock variables, boolean inequalities) {
        int oldNxR = variables.getNxR();
        int oldNxZ = variables.getNxZ();

        // first pass: count new variables, the integer offset depends on the final number of continuous variables
        int addedReals = 0;
        int addedIntegers = 0;
        for (int i = 0; i < variables.getBoundedCount(); i++) {
            BoundType type = getBoundType(variables.getLowerBound(i), variables.getUpperBound(i));
            if (type == BoundType.FREE) {
                if (variables.isReal(i)) {
                    addedReals++;
                } else {
                    addedIntegers++;
                }
            } else if (type == BoundType.RANGE && !inequalities) {
                addedReals++;
            }
        }
        int nxR = oldNxR + addedReals;
        int nxZ = oldNxZ + addedIntegers;

        // second pass: build changes with final indices
        List<VariableChange> changes = new ArrayList<>();
        int nextReal = oldNxR;
        int nextInteger = nxR + oldNxZ;
        for (int i = 0; i < variables.getBoundedCount(); i++) {
            double lb = variables.getLowerBound(i);
            double ub = variables.getUpperBound(i);
            boolean real = variables.isReal(i);
            int v = real ? i : i + nxR - oldNxR;
            switch (getBoundType(lb, ub)) {
                case NONNEGATIVE:
                    break;
                case LOWER:
                    changes.add(new VariableChange.LowerBound(real, v, lb));
                    break;
                case UPPER:
                    changes.add(new VariableChange.UpperBound(real, v, ub));
                    break;
                case RANGE:
                    int slack = inequalities ? VariableChange.NO_INDEX : nextReal++;
                    changes.add(new VariableChange.Range(real, v, lb, ub, slack));
                    break;
                case FREE:
                    changes.add(new VariableChange.Unbounded(real, v, real ? nextReal++ : nextInteger++));
                    break;
            }
        }

        long introduced = changes.stream().filter(VariableChange::introducesVariable).count();
        if (nextReal != nxR || nextInteger != nxR + nxZ || nxR + nxZ != oldNxR + oldNxZ + introduced) {
            throw new InternalConsistencyException("Inconsistent variable counts after bound normalization: nxR="
                    + oldNxR + "->" + nxR + ", nxZ=" + oldNxZ + "->" + nxZ + ", " + introduced + " introduced variables");
        }

        LOGGER.trace("{} variable changes, nxR {} -> {}, nxZ {} -> {}", changes.size(), oldNxR, nxR, oldNxZ, nxZ);

        return new VariableChanges(changes, new ColumnRemapping(oldNxR, oldNxZ, variables.getNxB(), nxR, nxZ));
    }
}
