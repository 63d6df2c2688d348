/**
 * Copyright (c) 2024, Artelys (http://www.artelys.com/)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.multilevel.model;

/**
 * Key of a quadratic term matrix: rows index the variables of the first level, columns those of the second one.
 */
public record LevelPair(int rowLevelId, int columnLevelId) {

    public boolean references(int levelId) {
        return rowLevelId == levelId || columnLevelId == levelId;
    }
}
