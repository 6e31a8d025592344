/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.circuitflow.mna;

import com.powsybl.circuitflow.network.BranchType;
import com.powsybl.circuitflow.network.CircuitBranch;
import com.powsybl.circuitflow.network.CircuitNetwork;
import com.powsybl.circuitflow.network.CircuitNode;
import com.powsybl.circuitflow.util.Reports;
import com.powsybl.commons.report.ReportNode;
import com.powsybl.math.matrix.DenseMatrix;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * Builds the {@link MnaSystem} of a circuit using the usual nodal stamps:
 * <ul>
 *     <li>a resistor of conductance g = 1/R adds g to the diagonal terms of its nodes and -g to the cross terms,</li>
 *     <li>a current source I flowing from "from" to "to" injects -I at "from" and +I at "to",</li>
 *     <li>a voltage source E adds an extra unknown (its current) and the equation V(from) - V(to) = E.</li>
 * </ul>
 * Terms related to the reference node are dropped.
 * <p>
 * Branches with a value that cannot be stamped (a resistance which is not strictly positive, or any non finite
 * value) are skipped with an {@link InvalidComponentWarning}. Nodes left without any active branch to another node
 * are fixed at 0 V and do not get an unknown.
 */
public final class MnaSystemBuilder {

    private static final Logger LOGGER = LoggerFactory.getLogger(MnaSystemBuilder.class);

    private MnaSystemBuilder() {
    }

    public static MnaSystem build(CircuitNetwork network, CircuitNode referenceNode) {
        return build(network, referenceNode, ReportNode.NO_OP);
    }

    public static MnaSystem build(CircuitNetwork network, CircuitNode referenceNode, ReportNode reportNode) {
        Objects.requireNonNull(network);
        Objects.requireNonNull(referenceNode);
        Objects.requireNonNull(reportNode);
        if (referenceNode.getNetwork() != network) {
            throw new IllegalArgumentException("Reference node " + referenceNode.getId() + " does not belong to network " + network.getId());
        }

        List<CircuitNode> nodes = network.getNodes();
        List<CircuitBranch> branches = network.getBranches();

        // value checks
        List<InvalidComponentWarning> warnings = new ArrayList<>();
        Set<CircuitBranch> skippedBranches = new HashSet<>();
        for (CircuitBranch branch : branches) {
            String reason = checkValue(branch);
            if (reason != null) {
                InvalidComponentWarning warning = new InvalidComponentWarning(branch.getId(), branch.getType(), branch.getValue(), reason);
                warnings.add(warning);
                skippedBranches.add(branch);
                LOGGER.warn("{}", warning.getMessage());
                Reports.reportInvalidComponent(reportNode, branch.getId(), branch.getType().name(), branch.getValue(), reason);
            }
        }

        // isolated nodes
        boolean[] connected = new boolean[nodes.size()];
        for (CircuitBranch branch : branches) {
            if (!skippedBranches.contains(branch) && !branch.isSelfLoop()) {
                connected[branch.getFrom().getNum()] = true;
                connected[branch.getTo().getNum()] = true;
            }
        }
        Set<CircuitNode> isolatedNodes = new LinkedHashSet<>();
        for (CircuitNode node : nodes) {
            if (node != referenceNode && !connected[node.getNum()]) {
                isolatedNodes.add(node);
                LOGGER.warn("Node '{}' has no active branch and is fixed at 0 V", node.getId());
                Reports.reportIsolatedNode(reportNode, node.getId());
            }
        }

        // unknown indexing: node voltages first, then voltage source currents
        int[] nodeRows = new int[nodes.size()];
        Arrays.fill(nodeRows, MnaSystem.NO_ROW);
        List<CircuitNode> unknownNodes = new ArrayList<>();
        for (CircuitNode node : nodes) {
            if (node != referenceNode && !isolatedNodes.contains(node)) {
                nodeRows[node.getNum()] = unknownNodes.size();
                unknownNodes.add(node);
            }
        }
        int[] voltageSourceRows = new int[branches.size()];
        Arrays.fill(voltageSourceRows, MnaSystem.NO_ROW);
        List<CircuitBranch> voltageSources = new ArrayList<>();
        for (CircuitBranch branch : branches) {
            if (branch.getType() == BranchType.VOLTAGE_SOURCE && !skippedBranches.contains(branch)) {
                voltageSourceRows[branch.getNum()] = unknownNodes.size() + voltageSources.size();
                voltageSources.add(branch);
            }
        }

        int size = unknownNodes.size() + voltageSources.size();
        double[] rhs = new double[size];
        if (size == 0) {
            LOGGER.debug("No unknown in network '{}'", network.getId());
            return new MnaSystem(referenceNode, unknownNodes, voltageSources, nodeRows, voltageSourceRows, null, rhs,
                    isolatedNodes, skippedBranches, warnings);
        }

        DenseMatrix matrix = new DenseMatrix(size, size);
        for (CircuitBranch branch : branches) {
            if (skippedBranches.contains(branch)) {
                continue;
            }
            int a = nodeRows[branch.getFrom().getNum()];
            int b = nodeRows[branch.getTo().getNum()];
            switch (branch.getType()) {
                case RESISTOR -> stampConductance(matrix, a, b, 1 / branch.getValue());
                case CURRENT_SOURCE -> stampCurrentSource(rhs, a, b, branch.getValue());
                case VOLTAGE_SOURCE -> stampVoltageSource(matrix, rhs, a, b, voltageSourceRows[branch.getNum()], branch.getValue());
                default -> throw new IllegalStateException("Unknown branch type: " + branch.getType());
            }
        }

        LOGGER.debug("MNA system of network '{}' built: {} node unknowns, {} voltage source unknowns",
                network.getId(), unknownNodes.size(), voltageSources.size());

        return new MnaSystem(referenceNode, unknownNodes, voltageSources, nodeRows, voltageSourceRows, matrix, rhs,
                isolatedNodes, skippedBranches, warnings);
    }

    private static String checkValue(CircuitBranch branch) {
        double value = branch.getValue();
        if (!Double.isFinite(value)) {
            return "value is not finite";
        }
        if (branch.getType() == BranchType.RESISTOR && value <= 0) {
            return "resistance must be strictly positive";
        }
        return null;
    }

    private static void stampConductance(DenseMatrix matrix, int a, int b, double g) {
        if (a != MnaSystem.NO_ROW) {
            matrix.add(a, a, g);
        }
        if (b != MnaSystem.NO_ROW) {
            matrix.add(b, b, g);
        }
        if (a != MnaSystem.NO_ROW && b != MnaSystem.NO_ROW) {
            matrix.add(a, b, -g);
            matrix.add(b, a, -g);
        }
    }

    private static void stampCurrentSource(double[] rhs, int a, int b, double current) {
        if (a != MnaSystem.NO_ROW) {
            rhs[a] -= current;
        }
        if (b != MnaSystem.NO_ROW) {
            rhs[b] += current;
        }
    }

    private static void stampVoltageSource(DenseMatrix matrix, double[] rhs, int a, int b, int k, double voltage) {
        if (a != MnaSystem.NO_ROW) {
            matrix.add(a, k, 1);
            matrix.add(k, a, 1);
        }
        if (b != MnaSystem.NO_ROW) {
            matrix.add(b, k, -1);
            matrix.add(k, b, -1);
        }
        rhs[k] = voltage;
    }
}
