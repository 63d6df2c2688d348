/**
 * Copyright (c) 2024, Artelys (http://www.artelys.com/)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.multilevel.standardform;

import com.powsybl.commons.PowsyblException;

/**
 * Thrown when a problem has a structure the standard form conversion cannot rewrite without losing terms,
 * such as quadratic terms over variables whose bounds have to be normalized.
 */
public class UnsupportedStructureException extends PowsyblException {

    public UnsupportedStructureException(String msg) {
        super(msg);
    }
}
