/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.circuitflow.graph;

import com.powsybl.circuitflow.network.CircuitBranch;
import com.powsybl.circuitflow.network.CircuitNode;

import java.util.List;
import java.util.Objects;
import java.util.function.ToDoubleFunction;

/**
 * Cycle obtained by closing a spanning tree path with a chord, i.e. a branch which is not part of the tree.
 * <p>
 * The walk starts at the "from" node of the chord, follows the tree path to its "to" node and goes back to the start
 * through the chord. Each traversed branch is given with its orientation: +1 when the walk follows the branch
 * direction, -1 otherwise.
 */
public class FundamentalCycle {

    public record OrientedBranch(CircuitBranch branch, int orientation) {

        public OrientedBranch {
            Objects.requireNonNull(branch);
            if (orientation != 1 && orientation != -1) {
                throw new IllegalArgumentException("Orientation must be 1 or -1: " + orientation);
            }
        }
    }

    private final List<CircuitNode> nodes;

    private final CircuitBranch chord;

    private final List<OrientedBranch> branches;

    public FundamentalCycle(List<CircuitNode> nodes, CircuitBranch chord, List<OrientedBranch> branches) {
        this.nodes = List.copyOf(nodes);
        this.chord = Objects.requireNonNull(chord);
        this.branches = List.copyOf(branches);
        if (this.nodes.isEmpty() || this.branches.size() != this.nodes.size()) {
            throw new IllegalArgumentException("A cycle walk must have as many branches as nodes");
        }
    }

    /**
     * Nodes of the walk, starting with the "from" node of the chord. The closing node is not repeated.
     */
    public List<CircuitNode> getNodes() {
        return nodes;
    }

    public CircuitBranch getChord() {
        return chord;
    }

    /**
     * Branches of the walk in traversal order, the chord being the last one.
     */
    public List<OrientedBranch> getBranches() {
        return branches;
    }

    public int size() {
        return branches.size();
    }

    /**
     * @return +1 or -1 if the branch is traversed forward or backward by the walk, 0 if it is not part of the cycle
     */
    public int getOrientation(CircuitBranch branch) {
        for (OrientedBranch orientedBranch : branches) {
            if (orientedBranch.branch() == branch) {
                return orientedBranch.orientation();
            }
        }
        return 0;
    }

    /**
     * Signed sum of the voltage drops V(from) - V(to) along the walk. Zero for any solution satisfying Kirchhoff's
     * voltage law.
     */
    public double getVoltageDropSum(ToDoubleFunction<CircuitNode> voltage) {
        double sum = 0;
        for (OrientedBranch orientedBranch : branches) {
            CircuitBranch branch = orientedBranch.branch();
            sum += orientedBranch.orientation() * (voltage.applyAsDouble(branch.getFrom()) - voltage.applyAsDouble(branch.getTo()));
        }
        return sum;
    }

    @Override
    public String toString() {
        return "FundamentalCycle(chord=" + chord.getId() + ", nodes=" + nodes + ")";
    }
}
