/**
 * Copyright (c) 2024, Artelys (http://www.artelys.com/)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.multilevel.standardform;

import com.powsybl.commons.config.PlatformConfig;

import java.util.Objects;

/**
 * Parameters of the standard form conversion.
 */
public class StandardFormParameters {

    public static final String MODULE_NAME = "standard-form-default-parameters";

    public static final boolean DEFAULT_INEQUALITIES = false; // Target constraint form: equalities with slack variables
    public static final boolean DEFAULT_CONVERT_BINARIES_TO_INTEGERS = false;
    public static final boolean DEFAULT_CHECK_PROBLEM = true; // Check vector and matrix dimensions before converting

    public static final String INEQUALITIES_PARAM_NAME = "inequalities";
    public static final String CONVERT_BINARIES_TO_INTEGERS_PARAM_NAME = "convertBinariesToIntegers";
    public static final String CHECK_PROBLEM_PARAM_NAME = "checkProblem";

    private boolean inequalities = DEFAULT_INEQUALITIES;

    private boolean convertBinariesToIntegers = DEFAULT_CONVERT_BINARIES_TO_INTEGERS;

    private boolean checkProblem = DEFAULT_CHECK_PROBLEM;

    public static StandardFormParameters load() {
        return load(PlatformConfig.defaultConfig());
    }

    public static StandardFormParameters load(PlatformConfig platformConfig) {
        Objects.requireNonNull(platformConfig);
        StandardFormParameters parameters = new StandardFormParameters();
        platformConfig.getOptionalModuleConfig(MODULE_NAME).ifPresent(config -> parameters
                .setInequalities(config.getBooleanProperty(INEQUALITIES_PARAM_NAME, DEFAULT_INEQUALITIES))
                .setConvertBinariesToIntegers(config.getBooleanProperty(CONVERT_BINARIES_TO_INTEGERS_PARAM_NAME, DEFAULT_CONVERT_BINARIES_TO_INTEGERS))
                .setCheckProblem(config.getBooleanProperty(CHECK_PROBLEM_PARAM_NAME, DEFAULT_CHECK_PROBLEM)));
        return parameters;
    }

    public boolean isInequalities() {
        return inequalities;
    }

    public StandardFormParameters setInequalities(boolean inequalities) {
        this.inequalities = inequalities;
        return this;
    }

    public boolean isConvertBinariesToIntegers() {
        return convertBinariesToIntegers;
    }

    public StandardFormParameters setConvertBinariesToIntegers(boolean convertBinariesToIntegers) {
        this.convertBinariesToIntegers = convertBinariesToIntegers;
        return this;
    }

    public boolean isCheckProblem() {
        return checkProblem;
    }

    public StandardFormParameters setCheckProblem(boolean checkProblem) {
        this.checkProblem = checkProblem;
        return this;
    }

    @Override
    public String toString() {
        return "StandardFormParameters(" +
                "inequalities=" + inequalities +
                ", convertBinariesToIntegers=" + convertBinariesToIntegers +
                ", checkProblem=" + checkProblem +
                ')';
    }
}
