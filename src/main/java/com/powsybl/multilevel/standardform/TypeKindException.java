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
 * Thrown when a problem is neither a well-formed linear nor a well-formed quadratic multilevel problem.
 */
public class TypeKindException extends PowsyblException {

    public TypeKindException(String msg) {
        super(msg);
    }
}
