/**
 * Copyright (c) 2024, Artelys (http://www.artelys.com/)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.multilevel.standardform;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.powsybl.multilevel.model.ColumnRemapping;

import java.util.Iterator;
import java.util.List;
import java.util.function.Function;

/**
 * Immutable list of the {@link VariableChange} of one level, with the variable counts before and after
 * normalization. Variables already nonnegative with no upper bound have no change.
 */
public final class VariableChanges implements Iterable<VariableChange> {

    private final List<VariableChange> changes;
    private final ImmutableMap<Integer, VariableChange> changesByIndex;
    private final ColumnRemapping remapping;

    VariableChanges(List<VariableChange> changes, ColumnRemapping remapping) {
        this.changes = ImmutableList.copyOf(changes);
        this.changesByIndex = this.changes.stream().collect(ImmutableMap.toImmutableMap(VariableChange::index, Function.identity()));
        this.remapping = remapping;
    }

    public List<VariableChange> getChanges() {
        return changes;
    }

    /**
     * Returns the change of the variable at the given index (in the numbering after normalization), or null.
     */
    public VariableChange getChange(int index) {
        return changesByIndex.get(index);
    }

    public int size() {
        return changes.size();
    }

    public boolean isEmpty() {
        return changes.isEmpty();
    }

    public int getIntroducedVariableCount() {
        return (int) changes.stream().filter(VariableChange::introducesVariable).count();
    }

    /**
     * Mapping from the variable indices before normalization to the indices after normalization.
     */
    public ColumnRemapping getRemapping() {
        return remapping;
    }

    public int getOldNxR() {
        return remapping.oldNxR();
    }

    public int getOldNxZ() {
        return remapping.oldNxZ();
    }

    public int getNxR() {
        return remapping.newNxR();
    }

    public int getNxZ() {
        return remapping.newNxZ();
    }

    public int getNxB() {
        return remapping.nxB();
    }

    /**
     * Total number of variables of the level after normalization, binary variables included.
     */
    public int getVariableCount() {
        return remapping.newSize();
    }

    @Override
    public Iterator<VariableChange> iterator() {
        return changes.iterator();
    }

    @Override
    public String toString() {
        return "VariableChanges(nxR=" + getOldNxR() + "->" + getNxR() + ", nxZ=" + getOldNxZ() + "->" + getNxZ()
                + ", changes=" + changes + ')';
    }
}
