/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.circuitflow.mna;

import com.powsybl.circuitflow.network.CircuitBranch;
import com.powsybl.circuitflow.network.CircuitNode;
import com.powsybl.math.matrix.DenseMatrix;

import java.util.*;

/**
 * Modified nodal analysis system of a circuit:
 * <pre>
 * | G   B | | V |   | I |
 * |       |.|   | = |   |
 * | B^T 0 | | J |   | E |
 * </pre>
 * where the first N unknowns are the voltages of the non reference nodes and the last M unknowns are the currents
 * flowing through the voltage sources, from their "from" node to their "to" node.
 * <p>
 * Rows are addressed through node and branch handles. The reference node and the isolated nodes have no row.
 */
public class MnaSystem {

    public static final int NO_ROW = -1;

    private final CircuitNode referenceNode;

    private final List<CircuitNode> unknownNodes;

    private final List<CircuitBranch> voltageSources;

    private final int[] nodeRows;

    private final int[] voltageSourceRows;

    private final DenseMatrix matrix;

    private final double[] rhs;

    private final Set<CircuitNode> isolatedNodes;

    private final Set<CircuitBranch> skippedBranches;

    private final List<InvalidComponentWarning> warnings;

    MnaSystem(CircuitNode referenceNode, List<CircuitNode> unknownNodes, List<CircuitBranch> voltageSources,
              int[] nodeRows, int[] voltageSourceRows, DenseMatrix matrix, double[] rhs,
              Set<CircuitNode> isolatedNodes, Set<CircuitBranch> skippedBranches, List<InvalidComponentWarning> warnings) {
        this.referenceNode = Objects.requireNonNull(referenceNode);
        this.unknownNodes = List.copyOf(unknownNodes);
        this.voltageSources = List.copyOf(voltageSources);
        this.nodeRows = Objects.requireNonNull(nodeRows);
        this.voltageSourceRows = Objects.requireNonNull(voltageSourceRows);
        this.matrix = matrix;
        this.rhs = Objects.requireNonNull(rhs);
        this.isolatedNodes = Collections.unmodifiableSet(isolatedNodes);
        this.skippedBranches = Collections.unmodifiableSet(skippedBranches);
        this.warnings = List.copyOf(warnings);
    }

    public CircuitNode getReferenceNode() {
        return referenceNode;
    }

    /**
     * Nodes whose voltage is an unknown, in row order.
     */
    public List<CircuitNode> getUnknownNodes() {
        return unknownNodes;
    }

    /**
     * Active voltage sources, in row order.
     */
    public List<CircuitBranch> getVoltageSources() {
        return voltageSources;
    }

    public int getNodeCount() {
        return unknownNodes.size();
    }

    public int getVoltageSourceCount() {
        return voltageSources.size();
    }

    public int getSize() {
        return unknownNodes.size() + voltageSources.size();
    }

    public boolean isEmpty() {
        return getSize() == 0;
    }

    public int getNodeRow(CircuitNode node) {
        return nodeRows[node.getNum()];
    }

    public int getVoltageSourceRow(CircuitBranch branch) {
        return voltageSourceRows[branch.getNum()];
    }

    /**
     * @return the system matrix, or null when the system has no unknown
     */
    public DenseMatrix getMatrix() {
        return matrix;
    }

    public double[] getRhs() {
        return rhs.clone();
    }

    public Set<CircuitNode> getIsolatedNodes() {
        return isolatedNodes;
    }

    public boolean isSkipped(CircuitBranch branch) {
        return skippedBranches.contains(branch);
    }

    public List<InvalidComponentWarning> getWarnings() {
        return warnings;
    }
}
