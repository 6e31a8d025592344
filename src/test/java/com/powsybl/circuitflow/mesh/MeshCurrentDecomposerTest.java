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
import com.powsybl.circuitflow.graph.FundamentalCyclesFinder;
import com.powsybl.circuitflow.network.CircuitBranch;
import com.powsybl.circuitflow.network.CircuitNetwork;
import com.powsybl.circuitflow.network.SampleCircuits;
import com.powsybl.circuitflow.solver.GaussianEliminationSolver;
import com.powsybl.math.matrix.DenseMatrix;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class MeshCurrentDecomposerTest {

    private static final double EPS = 1e-10;

    private MeshCurrentDecomposer decomposer;

    @BeforeEach
    void setUp() {
        decomposer = new MeshCurrentDecomposer(new GaussianEliminationSolver());
    }

    @Test
    void testIncidenceMatrix() {
        CircuitNetwork network = SampleCircuits.createTwoMeshes();
        List<FundamentalCycle> cycles = FundamentalCyclesFinder.find(network).cycles();
        DenseMatrix c = MeshCurrentDecomposer.createIncidenceMatrix(network.getBranches(), cycles);
        assertEquals(network.getBranches().size(), c.getRowCount());
        assertEquals(cycles.size(), c.getColumnCount());
        for (CircuitBranch branch : network.getBranches()) {
            for (int k = 0; k < cycles.size(); k++) {
                assertEquals(cycles.get(k).getOrientation(branch), c.get(branch.getNum(), k));
            }
        }
    }

    @Test
    void testDecomposeSingleLoop() {
        CircuitNetwork network = SampleCircuits.createTwoResistorsAndVoltageSource();
        FundamentalCycles cycles = FundamentalCyclesFinder.find(network);
        // R1, R2, V1: a 1/30 A loop current
        double i = 1.0 / 30;
        double[] branchCurrents = {i, -i, -i};
        MeshCurrents meshCurrents = decomposer.decompose(network, cycles, branchCurrents);
        assertEquals(1, meshCurrents.getCurrents().size());
        assertEquals(i, Math.abs(meshCurrents.getCurrent(0)), EPS);
        assertArrayEquals(branchCurrents, meshCurrents.reconstructBranchCurrents(), EPS);
    }

    @Test
    void testDecomposeCirculation() {
        CircuitNetwork network = SampleCircuits.createTwoMeshes();
        FundamentalCycles cycles = FundamentalCyclesFinder.find(network);
        // any current distribution satisfying Kirchhoff's current law is a combination of cycle currents
        List<FundamentalCycle> cycleList = cycles.cycles();
        double[] expected = new double[network.getBranches().size()];
        double[] m = {0.7, -0.2};
        for (int k = 0; k < cycleList.size(); k++) {
            for (FundamentalCycle.OrientedBranch ob : cycleList.get(k).getBranches()) {
                expected[ob.branch().getNum()] += ob.orientation() * m[k];
            }
        }
        MeshCurrents meshCurrents = decomposer.decompose(network, cycles, expected);
        assertEquals(0.7, meshCurrents.getCurrent(0), EPS);
        assertEquals(-0.2, meshCurrents.getCurrent(1), EPS);
        assertArrayEquals(expected, meshCurrents.reconstructBranchCurrents(), EPS);
        assertSame(cycleList.get(0), meshCurrents.getCycles().get(0));
    }

    @Test
    void testCurrentSourceRefused() {
        CircuitNetwork network = SampleCircuits.createTwoResistorsAndVoltageSource();
        network.addCurrentSource("I1", "2", "0", 0.1);
        FundamentalCycles cycles = FundamentalCyclesFinder.find(network);
        double[] branchCurrents = new double[4];
        UnsupportedTopologyException e = assertThrows(UnsupportedTopologyException.class,
            () -> decomposer.decompose(network, cycles, branchCurrents));
        assertEquals("Mesh currents are not defined for a circuit with current sources", e.getMessage());
    }

    @Test
    void testNoCycleRefused() {
        CircuitNetwork network = new CircuitNetwork("tree");
        network.addNode("0");
        network.addNode("1");
        network.addResistor("R1", "1", "0", 10);
        FundamentalCycles cycles = FundamentalCyclesFinder.find(network);
        double[] branchCurrents = new double[1];
        UnsupportedTopologyException e = assertThrows(UnsupportedTopologyException.class,
            () -> decomposer.decompose(network, cycles, branchCurrents));
        assertEquals("Circuit has no cycle, mesh currents are not defined", e.getMessage());
    }

    @Test
    void testBranchCurrentCountMismatch() {
        CircuitNetwork network = SampleCircuits.createTwoResistorsAndVoltageSource();
        FundamentalCycles cycles = FundamentalCyclesFinder.find(network);
        double[] branchCurrents = new double[2];
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
            () -> decomposer.decompose(network, cycles, branchCurrents));
        assertEquals("Expected 3 branch currents, got 2", e.getMessage());
    }
}
