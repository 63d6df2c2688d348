/**
 * Copyright (c) 2024, Artelys (http://www.artelys.com/)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.multilevel.standardform;

import com.powsybl.multilevel.model.Level;
import com.powsybl.multilevel.model.LevelPair;
import com.powsybl.multilevel.model.ProblemKind;
import com.powsybl.multilevel.model.SparseMatrix;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Negates the objective of a level whose optimization sense differs from the target one.
 */
public final class SenseNormalizer {

    private static final Logger LOGGER = LoggerFactory.getLogger(SenseNormalizer.class);

    private SenseNormalizer() {
    }

    /**
     * @return true if the objective of the level has been negated
     */
    public static boolean normalize(Level level, boolean minimize, ProblemKind kind) {
        Objects.requireNonNull(level);
        Objects.requireNonNull(kind);
        if (level.isMinimize() == minimize) {
            return false;
        }
        level.setMinimize(minimize);
        level.setObjectiveConstant(-level.getObjectiveConstant());
        for (Map.Entry<Integer, double[]> e : level.getObjectives().entrySet()) {
            double[] c = e.getValue();
            for (int i = 0; i < c.length; i++) {
                c[i] = -c[i];
            }
            level.setObjective(e.getKey(), c);
        }
        if (kind == ProblemKind.QUADRATIC) {
            for (Map.Entry<LevelPair, SparseMatrix> e : List.copyOf(level.getQuadraticTerms().entrySet())) {
                level.setQuadraticTerm(e.getKey().rowLevelId(), e.getKey().columnLevelId(), e.getValue().negate());
            }
        }
        LOGGER.debug("Objective of level {} negated to {}", level.getId(), minimize ? "minimize" : "maximize");
        return true;
    }
}
