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

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;
import java.util.function.IntUnaryOperator;

/**
 * Builds the {@link ReconstructionMap} of a conversion from the variable changes of each level.
 */
public final class ReconstructionMapBuilder {

    private ReconstructionMapBuilder() {
    }

    /**
     * @param original the problem before conversion
     * @param standard the problem after conversion
     * @param changes variable changes of each level
     * @param indexMappings for each level, mapping from original variable indices to standard form indices; levels
     *                      not in the map kept the original index of every variable
     */
    public static ReconstructionMap build(MultilevelProblem original, MultilevelProblem standard,
                                          Map<Integer, VariableChanges> changes, Map<Integer, IntUnaryOperator> indexMappings) {
        Objects.requireNonNull(original);
        Objects.requireNonNull(standard);
        Objects.requireNonNull(changes);
        Objects.requireNonNull(indexMappings);
        Map<Integer, ReconstructionMap.LevelReconstruction> levels = new TreeMap<>();
        for (Level level : original.levels()) {
            IntUnaryOperator indexMapping = indexMappings.getOrDefault(level.getId(), IntUnaryOperator.identity());
            VariableChanges levelChanges = changes.get(level.getId());
            List<ReconstructionMap.VariableReconstruction> variables = new ArrayList<>();
            for (int i = 0; i < level.getVariables().size(); i++) {
                int k = indexMapping.applyAsInt(i);
                VariableChange change = levelChanges != null ? levelChanges.getChange(k) : null;
                variables.add(change == null
                        ? new ReconstructionMap.VariableReconstruction(List.of(new ReconstructionMap.Multiplier(k, 1)), 0, null)
                        : change.accept(new VariableReconstructionBuilder()));
            }
            int standardVariableCount = standard.getLevel(level.getId()).getVariables().size();
            levels.put(level.getId(), new ReconstructionMap.LevelReconstruction(variables, standardVariableCount));
        }
        return new ReconstructionMap(levels);
    }

    private static final class VariableReconstructionBuilder implements VariableChange.Visitor<ReconstructionMap.VariableReconstruction> {

        @Override
        public ReconstructionMap.VariableReconstruction visitLowerBound(VariableChange.LowerBound change) {
            return new ReconstructionMap.VariableReconstruction(List.of(new ReconstructionMap.Multiplier(change.index(), 1)),
                    change.lowerBound(), change);
        }

        @Override
        public ReconstructionMap.VariableReconstruction visitUpperBound(VariableChange.UpperBound change) {
            return new ReconstructionMap.VariableReconstruction(List.of(new ReconstructionMap.Multiplier(change.index(), -1)),
                    change.upperBound(), change);
        }

        @Override
        public ReconstructionMap.VariableReconstruction visitRange(VariableChange.Range change) {
            return new ReconstructionMap.VariableReconstruction(List.of(new ReconstructionMap.Multiplier(change.index(), 1)),
                    change.lowerBound(), change);
        }

        @Override
        public ReconstructionMap.VariableReconstruction visitUnbounded(VariableChange.Unbounded change) {
            return new ReconstructionMap.VariableReconstruction(List.of(new ReconstructionMap.Multiplier(change.index(), 1),
                    new ReconstructionMap.Multiplier(change.newIndex(), -1)), 0, change);
        }
    }
}
