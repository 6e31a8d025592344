/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.circuitflow.mesh;

import com.powsybl.circuitflow.graph.FundamentalCycle;
import com.powsybl.circuitflow.graph.FundamentalCycles;
import com.powsybl.circuitflow.network.BranchType;
import com.powsybl.circuitflow.network.CircuitBranch;
import com.powsybl.circuitflow.network.CircuitNetwork;
import com.powsybl.circuitflow.solver.LinearSolver;
import com.powsybl.math.matrix.DenseMatrix;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;

/**
 * Expresses solved branch currents as a superposition of cycle currents. With C the branch x cycle incidence matrix
 * (+1 / -1 when the cycle walks the branch forward / backward, 0 otherwise), the mesh currents m are the least
 * squares solution of C.m = i, obtained from the normal equations (C^T.C).m = C^T.i.
 * <p>
 * The fit is exact for circuits made of resistors and voltage sources. Circuits with current sources are refused.
 */
public class MeshCurrentDecomposer {

    private static final Logger LOGGER = LoggerFactory.getLogger(MeshCurrentDecomposer.class);

    private final LinearSolver solver;

    public MeshCurrentDecomposer(LinearSolver solver) {
        this.solver = Objects.requireNonNull(solver);
    }

    public static void checkTopology(CircuitNetwork network, FundamentalCycles cycles) {
        Objects.requireNonNull(network);
        Objects.requireNonNull(cycles);
        if (network.hasBranchOfType(BranchType.CURRENT_SOURCE)) {
            throw new UnsupportedTopologyException("Mesh currents are not defined for a circuit with current sources");
        }
        if (cycles.isEmpty()) {
            throw new UnsupportedTopologyException("Circuit has no cycle, mesh currents are not defined");
        }
    }

    public static DenseMatrix createIncidenceMatrix(List<CircuitBranch> branches, List<FundamentalCycle> cycles) {
        DenseMatrix c = new DenseMatrix(branches.size(), cycles.size());
        for (int k = 0; k < cycles.size(); k++) {
            for (FundamentalCycle.OrientedBranch orientedBranch : cycles.get(k).getBranches()) {
                c.set(orientedBranch.branch().getNum(), k, orientedBranch.orientation());
            }
        }
        return c;
    }

    /**
     * @param branchCurrents solved branch currents, indexed by branch handle
     */
    public MeshCurrents decompose(CircuitNetwork network, FundamentalCycles cycles, double[] branchCurrents) {
        checkTopology(network, cycles);
        Objects.requireNonNull(branchCurrents);
        List<CircuitBranch> branches = network.getBranches();
        if (branchCurrents.length != branches.size()) {
            throw new IllegalArgumentException("Expected " + branches.size() + " branch currents, got " + branchCurrents.length);
        }

        List<FundamentalCycle> cycleList = cycles.cycles();
        DenseMatrix c = createIncidenceMatrix(branches, cycleList);
        int cycleCount = cycleList.size();

        // normal equations
        DenseMatrix ctc = new DenseMatrix(cycleCount, cycleCount);
        double[] cti = new double[cycleCount];
        for (int p = 0; p < cycleCount; p++) {
            for (int q = p; q < cycleCount; q++) {
                double s = 0;
                for (int i = 0; i < branches.size(); i++) {
                    s += c.get(i, p) * c.get(i, q);
                }
                ctc.set(p, q, s);
                ctc.set(q, p, s);
            }
            double s = 0;
            for (int i = 0; i < branches.size(); i++) {
                s += c.get(i, p) * branchCurrents[i];
            }
            cti[p] = s;
        }

        double[] m = solver.solve(ctc, cti);

        LOGGER.debug("{} mesh currents fitted on {} branch currents", cycleCount, branches.size());

        return new MeshCurrents(cycleList, c, m);
    }
}
