/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.circuitflow.mesh;

import com.powsybl.circuitflow.graph.FundamentalCycle;
import com.powsybl.math.matrix.DenseMatrix;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * Mesh currents of a circuit, one per fundamental cycle, with the branch to cycle incidence matrix they have been
 * fitted with.
 */
public class MeshCurrents {

    private final List<FundamentalCycle> cycles;

    private final DenseMatrix incidenceMatrix;

    private final double[] currents;

    MeshCurrents(List<FundamentalCycle> cycles, DenseMatrix incidenceMatrix, double[] currents) {
        this.cycles = List.copyOf(cycles);
        this.incidenceMatrix = Objects.requireNonNull(incidenceMatrix);
        this.currents = Objects.requireNonNull(currents);
    }

    public List<FundamentalCycle> getCycles() {
        return cycles;
    }

    /**
     * Branch x cycle matrix, in branch handle order and cycle order.
     */
    public DenseMatrix getIncidenceMatrix() {
        return incidenceMatrix;
    }

    public double getCurrent(int cycleIndex) {
        return currents[cycleIndex];
    }

    public List<Double> getCurrents() {
        return Arrays.stream(currents).boxed().toList();
    }

    /**
     * Superposition of the mesh currents on each branch, i = C.m, in branch handle order.
     */
    public double[] reconstructBranchCurrents() {
        int branchCount = incidenceMatrix.getRowCount();
        double[] branchCurrents = new double[branchCount];
        for (int i = 0; i < branchCount; i++) {
            double sum = 0;
            for (int k = 0; k < currents.length; k++) {
                sum += incidenceMatrix.get(i, k) * currents[k];
            }
            branchCurrents[i] = sum;
        }
        return branchCurrents;
    }
}
