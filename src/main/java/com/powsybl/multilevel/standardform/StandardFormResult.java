/**
 * Copyright (c) 2024, Artelys (http://www.artelys.com/)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.multilevel.standardform;

import com.google.common.collect.ImmutableMap;
import com.powsybl.multilevel.model.MultilevelProblem;

import java.util.Map;
import java.util.Objects;

/**
 * Outcome of a standard form conversion.
 *
 * @param problem the standard form problem, a new object independent of the converted one
 * @param reconstructionMap maps standard form solutions back to the original variables
 * @param variableChanges bound normalization changes of each level, by level id
 */
public record StandardFormResult(MultilevelProblem problem, ReconstructionMap reconstructionMap,
                                 Map<Integer, VariableChanges> variableChanges) {

    public StandardFormResult {
        Objects.requireNonNull(problem);
        Objects.requireNonNull(reconstructionMap);
        variableChanges = ImmutableMap.copyOf(variableChanges);
    }

    public VariableChanges getVariableChanges(int levelId) {
        return variableChanges.get(levelId);
    }
}
