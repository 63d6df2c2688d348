/**
 * Copyright (c) 2024, Artelys (http://www.artelys.com/)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.multilevel.standardform;

import com.powsybl.multilevel.model.ColumnRemapping;
import com.powsybl.multilevel.model.Level;
import com.powsybl.multilevel.model.LevelPair;
import com.powsybl.multilevel.model.MultilevelProblem;
import com.powsybl.multilevel.model.ProblemKind;
import com.powsybl.multilevel.model.SparseMatrix;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.function.IntUnaryOperator;

/**
 * Rewrites a multilevel linear or quadratic problem into standard form:
 * <ol>
 *     <li>every level minimizes its objective,</li>
 *     <li>the constraints of every level are all equalities, or all inequalities,</li>
 *     <li>every continuous and integer variable is nonnegative with no upper bound.</li>
 * </ol>
 * The conversion works on a copy of the problem, the input problem is never modified. Steps are always run in
 * the same order: sense normalization, constraint form conversion, optional binary relaxation, bound
 * normalization of every level (all change lists are computed first, then propagated to every objective and
 * constraint matrix referencing the variables), matrix resizing and reconstruction map building.
 */
public class StandardFormConverter {

    private static final Logger LOGGER = LoggerFactory.getLogger(StandardFormConverter.class);

    private final StandardFormParameters parameters;

    public StandardFormConverter() {
        this(new StandardFormParameters());
    }

    public StandardFormConverter(StandardFormParameters parameters) {
        this.parameters = Objects.requireNonNull(parameters);
    }

    public StandardFormParameters getParameters() {
        return parameters;
    }

    public static StandardFormResult convertToStandardForm(MultilevelProblem problem, boolean inequalities) {
        return new StandardFormConverter(new StandardFormParameters().setInequalities(inequalities)).convert(problem);
    }

    public static StandardFormResult convertToStandardForm(MultilevelProblem problem) {
        return convertToStandardForm(problem, StandardFormParameters.DEFAULT_INEQUALITIES);
    }

    public StandardFormResult convert(MultilevelProblem problem) {
        Objects.requireNonNull(problem);
        checkKind(problem);
        if (parameters.isCheckProblem()) {
            problem.check();
        }
        boolean inequalities = parameters.isInequalities();

        LOGGER.info("Converting {} to standard form with {} constraints ({} variables, {} constraints)",
                problem, inequalities ? "inequality" : "equality", problem.getVariableCount(), problem.getConstraintCount());

        MultilevelProblem standard = problem.copy();

        for (Level level : standard.levels()) {
            SenseNormalizer.normalize(level, true, standard.getKind());
        }

        Map<Integer, ColumnRemapping> slackRemappings = ConstraintFormConverter.convert(standard, inequalities);

        if (parameters.isConvertBinariesToIntegers()) {
            for (Level level : standard.levels()) {
                level.getVariables().relaxBinaries();
            }
        }

        // phase 1: change lists only depend on the bounds of their own level
        Map<Integer, VariableChanges> changes = new LinkedHashMap<>();
        for (Level level : standard.levels()) {
            VariableChanges levelChanges = BoundNormalizer.normalize(level.getVariables(), inequalities);
            LOGGER.debug("Level {}: {}", level.getId(), levelChanges);
            changes.put(level.getId(), levelChanges);
        }
        checkQuadraticTerms(standard, changes);

        // phase 2: propagate each change list to every level referencing the variables
        for (Level level : standard.levels()) {
            propagate(standard, level, changes.get(level.getId()));
        }

        resizeConstraintMatrices(standard);

        Map<Integer, IntUnaryOperator> indexMappings = new HashMap<>();
        for (Level level : standard.levels()) {
            ColumnRemapping slackRemapping = slackRemappings.get(level.getId());
            ColumnRemapping boundRemapping = changes.get(level.getId()).getRemapping();
            indexMappings.put(level.getId(), slackRemapping != null
                    ? i -> boundRemapping.map(slackRemapping.map(i))
                    : boundRemapping::map);
        }
        ReconstructionMap reconstructionMap = ReconstructionMapBuilder.build(problem, standard, changes, indexMappings);

        LOGGER.info("Standard form built: {} variables, {} constraints", standard.getVariableCount(), standard.getConstraintCount());

        return new StandardFormResult(standard, reconstructionMap, changes);
    }

    private static void checkKind(MultilevelProblem problem) {
        if (problem.getKind() == ProblemKind.LINEAR) {
            for (Level level : problem.levels()) {
                if (level.hasQuadraticTerms()) {
                    throw new TypeKindException("Expected linear or quadratic multilevel problem: linear problem has quadratic terms in level "
                            + level.getId());
                }
            }
        }
    }

    private static void checkQuadraticTerms(MultilevelProblem problem, Map<Integer, VariableChanges> changes) {
        if (problem.getKind() != ProblemKind.QUADRATIC) {
            return;
        }
        for (Level level : problem.levels()) {
            for (Map.Entry<LevelPair, SparseMatrix> e : level.getQuadraticTerms().entrySet()) {
                LevelPair pair = e.getKey();
                if (e.getValue().getNonZeroCount() > 0
                        && (!changes.get(pair.rowLevelId()).isEmpty() || !changes.get(pair.columnLevelId()).isEmpty())) {
                    throw new UnsupportedStructureException("Quadratic term " + pair + " of level " + level.getId()
                            + " references variables whose bounds have to be normalized, which is not supported");
                }
            }
        }
    }

    private static void propagate(MultilevelProblem problem, Level owner, VariableChanges changes) {
        int ownerId = owner.getId();
        problem.remapVariables(ownerId, changes.getRemapping(), 0, Double.POSITIVE_INFINITY);
        owner.getVariables().setNonNegative();
        if (changes.isEmpty()) {
            return;
        }
        for (Level level : problem.levels()) {
            ObjectiveRewriter.ObjectiveTerms objective = ObjectiveRewriter.rewrite(changes, level.getObjective(ownerId),
                    level.getObjectiveConstant());
            level.setObjective(ownerId, objective.coefficients());
            level.setObjectiveConstant(objective.constant());

            ConstraintRewriter.ConstraintTerms constraints = ConstraintRewriter.rewrite(changes, level.getConstraintMatrix(ownerId),
                    level.getRhs(), level == owner);
            level.setConstraintMatrix(ownerId, constraints.matrix());
            level.setRhs(constraints.rhs());
        }
    }

    private static void resizeConstraintMatrices(MultilevelProblem problem) {
        for (Level level : problem.levels()) {
            for (Map.Entry<Integer, SparseMatrix> e : Map.copyOf(level.getConstraintMatrices()).entrySet()) {
                int columnCount = problem.getLevel(e.getKey()).getVariables().size();
                level.setConstraintMatrix(e.getKey(), e.getValue().resize(level.getConstraintCount(), columnCount));
            }
        }
    }
}
