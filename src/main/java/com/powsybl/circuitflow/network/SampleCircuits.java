/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.circuitflow.network;

/**
 * Small circuits used as defaults and in examples.
 */
public final class SampleCircuits {

    private SampleCircuits() {
    }

    /**
     * <pre>
     *   1 --[V1 10 V]-- 2
     *   |               |
     *  [R1 100]       [R2 200]
     *   |               |
     *   0 ------------- 0
     * </pre>
     */
    public static CircuitNetwork createTwoResistorsAndVoltageSource() {
        CircuitNetwork network = new CircuitNetwork("two-resistors-and-voltage-source");
        network.addNode("0");
        network.addNode("1");
        network.addNode("2");
        network.addBranch("R1", "R1", "1", "0", BranchType.RESISTOR, 100);
        network.addBranch("R2", "R2", "2", "0", BranchType.RESISTOR, 200);
        network.addBranch("V1", "V1", "1", "2", BranchType.VOLTAGE_SOURCE, 10);
        return network;
    }

    /**
     * Classical two mesh circuit: a 10 V source feeding R1 in series with R2 // (R3 + R4), ground at node "0".
     */
    public static CircuitNetwork createTwoMeshes() {
        CircuitNetwork network = new CircuitNetwork("two-meshes");
        network.addNode("0");
        network.addNode("1");
        network.addNode("2");
        network.addNode("3");
        network.addVoltageSource("V1", "1", "0", 10);
        network.addResistor("R1", "1", "2", 10);
        network.addResistor("R2", "2", "0", 20);
        network.addResistor("R3", "2", "3", 30);
        network.addResistor("R4", "3", "0", 40);
        return network;
    }
}
