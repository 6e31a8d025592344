/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.circuitflow;

import com.powsybl.circuitflow.graph.FundamentalCycle;
import com.powsybl.circuitflow.mesh.MeshCurrents;
import com.powsybl.circuitflow.mesh.UnsupportedTopologyException;
import com.powsybl.circuitflow.network.BranchType;
import com.powsybl.circuitflow.network.CircuitBranch;
import com.powsybl.circuitflow.network.CircuitNetwork;
import com.powsybl.circuitflow.network.CircuitNode;
import com.powsybl.circuitflow.network.SampleCircuits;
import com.powsybl.circuitflow.solver.SingularMatrixException;
import com.powsybl.circuitflow.util.Reports;
import com.powsybl.commons.PowsyblException;
import com.powsybl.commons.report.ReportNode;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import java.io.StringWriter;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class CircuitFlowEngineTest {

    private static final double EPS = 1e-9;

    private static CircuitFlowResult run(CircuitNetwork network, AnalysisMethod analysisMethod) {
        return new CircuitFlowEngine(new CircuitFlowParameters().setAnalysisMethod(analysisMethod)).run(network);
    }

    /**
     * Sum of the currents leaving each node, sources included, must be zero except at the reference node.
     */
    private static void assertKirchhoffCurrentLaw(CircuitNetwork network, CircuitFlowResult result) {
        for (CircuitNode node : network.getNodes()) {
            if (node.getId().equals(result.getReferenceNodeId().orElseThrow())) {
                continue;
            }
            double sum = 0;
            for (CircuitBranch branch : node.getBranches()) {
                if (branch.isSelfLoop()) {
                    continue;
                }
                double i = result.getBranchCurrent(branch.getId());
                sum += branch.getFrom() == node ? i : -i;
            }
            assertEquals(0, sum, EPS, "KCL at node " + node.getId());
        }
    }

    private static void assertKirchhoffVoltageLaw(CircuitFlowResult result) {
        for (FundamentalCycle cycle : result.getCycles()) {
            assertEquals(0, cycle.getVoltageDropSum(result::getNodeVoltage), EPS, "KVL on " + cycle);
        }
    }

    @Test
    void testSeriesLoop() {
        CircuitNetwork network = SampleCircuits.createTwoResistorsAndVoltageSource();
        CircuitFlowResult result = run(network, AnalysisMethod.NODAL);

        // series current 10 V / 300 ohm
        double i = 10.0 / 300;
        assertEquals("0", result.getReferenceNodeId().orElseThrow());
        assertEquals(0, result.getNodeVoltage("0"));
        assertEquals(100 * i, result.getNodeVoltage("1"), 1e-6);
        assertEquals(-200 * i, result.getNodeVoltage("2"), 1e-6);
        assertEquals(10, result.getNodeVoltage("1") - result.getNodeVoltage("2"), 1e-6);
        assertEquals(i, result.getBranchCurrent("R1"), 1e-6);
        assertEquals(-i, result.getBranchCurrent("R2"), 1e-6);
        assertEquals(-i, result.getBranchCurrent("V1"), 1e-6);
        assertEquals(Map.of("V1", result.getBranchCurrent("V1")), result.getVoltageSourceCurrents());
        assertTrue(result.getWarnings().isEmpty());
        assertTrue(result.getMeshCurrents().isEmpty());
        assertKirchhoffCurrentLaw(network, result);
    }

    @Test
    void testResistorAcrossVoltageSource() {
        CircuitNetwork network = new CircuitNetwork("single-resistor");
        network.addNode("0");
        network.addNode("1");
        network.addVoltageSource("V1", "1", "0", 12);
        network.addResistor("R1", "1", "0", 4);
        CircuitFlowResult result = run(network, AnalysisMethod.NODAL);
        assertEquals(12, result.getNodeVoltage("1"), EPS);
        assertEquals(3, result.getBranchCurrent("R1"), EPS);
        assertEquals(-3, result.getBranchCurrent("V1"), EPS);
    }

    @Test
    void testShortedVoltageSources() {
        CircuitNetwork network = new CircuitNetwork("shorted-sources");
        network.addNode("0");
        network.addNode("1");
        network.addVoltageSource("V1", "1", "0", 10);
        network.addVoltageSource("V2", "1", "0", 5);
        network.addResistor("R1", "1", "0", 100);
        CircuitFlowEngine engine = new CircuitFlowEngine();
        ReportNode reportNode = Reports.createRootReportNode(network.getId());
        assertThrows(SingularMatrixException.class, () -> engine.run(network, reportNode));
        ReportNode runReportNode = reportNode.getChildren().get(0);
        assertTrue(runReportNode.getChildren().stream().anyMatch(r -> r.getMessageKey().equals("cf.singularSystem")));
    }

    @Test
    void testFloatingSubcircuit() {
        CircuitNetwork network = SampleCircuits.createTwoResistorsAndVoltageSource();
        network.addNode("a");
        network.addNode("b");
        network.addResistor("Rab", "a", "b", 10);
        CircuitFlowEngine engine = new CircuitFlowEngine();
        assertThrows(SingularMatrixException.class, () -> engine.run(network));
    }

    @Test
    void testIsolatedNode() {
        CircuitNetwork network = SampleCircuits.createTwoResistorsAndVoltageSource();
        network.addNode();
        CircuitFlowResult result = assertDoesNotThrow(() -> run(network, AnalysisMethod.NODAL));
        assertEquals(0, result.getNodeVoltage("3"));
        assertEquals(4, result.getNodeVoltages().size());
        assertEquals(10.0 / 3, result.getNodeVoltage("1"), 1e-6);
    }

    @Test
    void testCurrentSource() {
        CircuitNetwork network = new CircuitNetwork("current-source");
        network.addNode("0");
        network.addNode("1");
        network.addNode("2");
        network.addCurrentSource("I1", "0", "1", 2);
        network.addResistor("R1", "1", "2", 5);
        network.addResistor("R2", "2", "0", 15);
        CircuitFlowResult result = run(network, AnalysisMethod.NODAL);
        assertEquals(40, result.getNodeVoltage("1"), EPS);
        assertEquals(30, result.getNodeVoltage("2"), EPS);
        assertEquals(2, result.getBranchCurrent("I1"), EPS);
        assertEquals(2, result.getBranchCurrent("R1"), EPS);
        assertTrue(result.getVoltageSourceCurrents().isEmpty());
        assertKirchhoffCurrentLaw(network, result);
    }

    @Test
    void testTwoMeshes() {
        CircuitNetwork network = SampleCircuits.createTwoMeshes();
        CircuitFlowResult result = run(network, AnalysisMethod.MESH);

        // R1 in series with R2 // (R3 + R4)
        assertEquals(10, result.getNodeVoltage("1"), EPS);
        assertEquals(140.0 / 23, result.getNodeVoltage("2"), EPS);
        assertEquals(80.0 / 23, result.getNodeVoltage("3"), EPS);
        assertEquals(9.0 / 23, result.getBranchCurrent("R1"), EPS);
        assertEquals(7.0 / 23, result.getBranchCurrent("R2"), EPS);
        assertEquals(2.0 / 23, result.getBranchCurrent("R3"), EPS);
        assertEquals(2.0 / 23, result.getBranchCurrent("R4"), EPS);
        assertEquals(-9.0 / 23, result.getBranchCurrent("V1"), EPS);

        MeshCurrents meshCurrents = result.getMeshCurrents().orElseThrow();
        assertEquals(2, meshCurrents.getCurrents().size());
        assertEquals(result.getCycles(), meshCurrents.getCycles());
        assertKirchhoffCurrentLaw(network, result);
        assertKirchhoffVoltageLaw(result);
    }

    @Test
    void testMeshAndNodalAgree() {
        CircuitNetwork network = SampleCircuits.createTwoMeshes();
        network.addNode("4");
        network.addResistor("R5", "3", "4", 25);
        network.addResistor("R6", "4", "1", 35);
        network.addVoltageSource("V2", "4", "2", 3);
        network.addResistor("R7", "2", "0", 50);

        CircuitFlowResult nodal = run(network, AnalysisMethod.NODAL);
        CircuitFlowResult mesh = run(network, AnalysisMethod.MESH);
        assertEquals(nodal.getNodeVoltages().keySet(), mesh.getNodeVoltages().keySet());
        for (String nodeId : nodal.getNodeVoltages().keySet()) {
            assertEquals(nodal.getNodeVoltage(nodeId), mesh.getNodeVoltage(nodeId), EPS);
        }

        MeshCurrents meshCurrents = mesh.getMeshCurrents().orElseThrow();
        assertEquals(network.getBranches().size() - network.getNodes().size() + 1, meshCurrents.getCurrents().size());
        double[] reconstructed = meshCurrents.reconstructBranchCurrents();
        for (CircuitBranch branch : network.getBranches()) {
            assertEquals(nodal.getBranchCurrent(branch.getId()), reconstructed[branch.getNum()], 1e-6, "branch " + branch.getId());
        }
        assertKirchhoffCurrentLaw(network, mesh);
        assertKirchhoffVoltageLaw(mesh);
    }

    @Test
    void testReferenceInvariance() {
        CircuitNetwork network = SampleCircuits.createTwoMeshes();
        CircuitFlowResult groundResult = new CircuitFlowEngine().run(network);
        CircuitFlowResult otherResult = new CircuitFlowEngine(new CircuitFlowParameters().setReferenceNodeIds(List.of("3")))
                .run(network);
        assertEquals("3", otherResult.getReferenceNodeId().orElseThrow());
        assertEquals(0, otherResult.getNodeVoltage("3"));
        assertTrue(network.getNode("3").isReference());

        for (CircuitBranch branch : network.getBranches()) {
            String from = branch.getFrom().getId();
            String to = branch.getTo().getId();
            assertEquals(groundResult.getNodeVoltage(from) - groundResult.getNodeVoltage(to),
                         otherResult.getNodeVoltage(from) - otherResult.getNodeVoltage(to), 1e-6);
            assertEquals(groundResult.getBranchCurrent(branch.getId()), otherResult.getBranchCurrent(branch.getId()), 1e-6);
        }
    }

    @Test
    void testFirstNodeIsReferenceWithoutGround() {
        CircuitNetwork network = new CircuitNetwork("no-ground");
        network.addNode("a");
        network.addNode("b");
        network.addVoltageSource("V1", "b", "a", 6);
        network.addResistor("R1", "b", "a", 3);
        CircuitFlowResult result = new CircuitFlowEngine().run(network);
        assertEquals("a", result.getReferenceNodeId().orElseThrow());
        assertEquals(6, result.getNodeVoltage("b"), EPS);
        assertEquals(2, result.getBranchCurrent("R1"), EPS);
    }

    @Test
    void testMeshFallbackWithCurrentSource() {
        CircuitNetwork network = SampleCircuits.createTwoResistorsAndVoltageSource();
        network.addCurrentSource("I1", "0", "2", 0.01);
        ReportNode reportNode = Reports.createRootReportNode(network.getId());
        CircuitFlowResult result = new CircuitFlowEngine(new CircuitFlowParameters().setAnalysisMethod(AnalysisMethod.MESH))
                .run(network, reportNode);

        assertTrue(result.getMeshCurrents().isEmpty());
        assertTrue(result.getCycles().isEmpty());
        UnsupportedTopologyException failure = result.getMeshDecompositionFailure().orElseThrow();
        assertEquals("Mesh currents are not defined for a circuit with current sources", failure.getMessage());
        assertEquals(4, result.getBranchCurrents().size());
        assertKirchhoffCurrentLaw(network, result);
        ReportNode runReportNode = reportNode.getChildren().get(0);
        assertTrue(runReportNode.getChildren().stream().anyMatch(r -> r.getMessageKey().equals("cf.meshDecompositionFallback")));
    }

    @Test
    void testMeshWithoutFallback() {
        CircuitNetwork network = new CircuitNetwork("tree");
        network.addNode("0");
        network.addNode("1");
        network.addResistor("R1", "1", "0", 10);
        CircuitFlowEngine engine = new CircuitFlowEngine(new CircuitFlowParameters()
                .setAnalysisMethod(AnalysisMethod.MESH)
                .setMeshFallbackToNodal(false));
        UnsupportedTopologyException e = assertThrows(UnsupportedTopologyException.class, () -> engine.run(network));
        assertEquals("Circuit has no cycle, mesh currents are not defined", e.getMessage());
    }

    @Test
    void testInvalidComponentIsOpenCircuit() {
        CircuitNetwork network = SampleCircuits.createTwoResistorsAndVoltageSource();
        network.addResistor("R3", "1", "2", 0);
        CircuitFlowResult result = run(network, AnalysisMethod.NODAL);
        assertEquals(1, result.getWarnings().size());
        assertEquals("R3", result.getWarnings().get(0).branchId());
        assertEquals(0, result.getBranchCurrent("R3"));
        assertEquals(10.0 / 3, result.getNodeVoltage("1"), 1e-6);

        // fixing the value makes the branch active again
        network.updateBranchValue("R3", 50);
        result = run(network, AnalysisMethod.NODAL);
        assertTrue(result.getWarnings().isEmpty());
        assertEquals(0.2, result.getBranchCurrent("R3"), 1e-6);
    }

    @ParameterizedTest
    @EnumSource(AnalysisMethod.class)
    void testRepeatedRunsAreIdentical(AnalysisMethod analysisMethod) {
        CircuitNetwork network = SampleCircuits.createTwoMeshes();
        CircuitFlowEngine engine = new CircuitFlowEngine(new CircuitFlowParameters().setAnalysisMethod(analysisMethod));
        CircuitFlowResult result1 = engine.run(network);
        CircuitFlowResult result2 = engine.run(network);
        assertEquals(result1.getNodeVoltages(), result2.getNodeVoltages());
        assertEquals(result1.getBranchCurrents(), result2.getBranchCurrents());
        assertEquals(analysisMethod, result2.getAnalysisMethod());
    }

    @Test
    void testEmptyNetwork() {
        CircuitNetwork network = new CircuitNetwork("empty");
        ReportNode reportNode = Reports.createRootReportNode(network.getId());
        CircuitFlowResult result = new CircuitFlowEngine().run(network, reportNode);
        assertTrue(result.getReferenceNodeId().isEmpty());
        assertTrue(result.getNodeVoltages().isEmpty());
        assertTrue(result.getBranchCurrents().isEmpty());
        ReportNode runReportNode = reportNode.getChildren().get(0);
        assertEquals("cf.emptyCircuit", runReportNode.getChildren().get(1).getMessageKey());
    }

    @Test
    void testSingleNode() {
        CircuitNetwork network = new CircuitNetwork("single-node");
        network.addNode("GND");
        CircuitFlowResult result = new CircuitFlowEngine().run(network);
        assertEquals(Map.of("GND", 0.0), result.getNodeVoltages());
    }

    @Test
    void testReport() {
        CircuitNetwork network = SampleCircuits.createTwoResistorsAndVoltageSource();
        ReportNode reportNode = Reports.createRootReportNode(network.getId());
        new CircuitFlowEngine().run(network, reportNode);
        assertEquals(1, reportNode.getChildren().size());
        ReportNode runReportNode = reportNode.getChildren().get(0);
        assertEquals("cf.circuitFlowRun", runReportNode.getMessageKey());
        assertEquals(List.of("cf.circuitSize", "cf.referenceNode", "cf.systemSolved"),
                runReportNode.getChildren().stream().map(ReportNode::getMessageKey).toList());
        assertEquals("Circuit has 3 nodes and 3 branches", runReportNode.getChildren().get(0).getMessage());
    }

    @Test
    void testResultAccessors() {
        CircuitNetwork network = SampleCircuits.createTwoMeshes();
        CircuitFlowResult result = run(network, AnalysisMethod.MESH);
        PowsyblException e = assertThrows(PowsyblException.class, () -> result.getNodeVoltage("x"));
        assertEquals("Node 'x' not found in result of network 'two-meshes'", e.getMessage());
        e = assertThrows(PowsyblException.class, () -> result.getBranchCurrent("x"));
        assertEquals("Branch 'x' not found in result of network 'two-meshes'", e.getMessage());
        assertEquals("CircuitFlowResult(networkId=two-meshes, analysisMethod=MESH, referenceNodeId=0, nodeCount=4, branchCount=5, meshCount=2, warningCount=0)",
                result.toString());

        StringWriter writer = new StringWriter();
        result.writeJson(writer);
        String json = writer.toString();
        assertTrue(json.contains("\"referenceNodeId\" : \"0\""));
        assertTrue(json.contains("\"meshCurrents\""));
        assertTrue(json.contains("\"chord\""));
    }

    @Test
    void testUpdateTopologyBetweenRuns() {
        CircuitNetwork network = SampleCircuits.createTwoResistorsAndVoltageSource();
        network.updateBranch("R2", "2", "0", BranchType.CURRENT_SOURCE, 0.05);
        CircuitFlowResult result = run(network, AnalysisMethod.NODAL);
        assertEquals(0.05, result.getBranchCurrent("R2"), EPS);
        // the current source imposes the loop current, flowing back from ground to node 1 through R1
        assertEquals(-0.05, result.getBranchCurrent("R1"), EPS);
        assertEquals(0.05, result.getBranchCurrent("V1"), EPS);
        assertEquals(-5, result.getNodeVoltage("1"), EPS);
        assertEquals(-15, result.getNodeVoltage("2"), EPS);
        assertKirchhoffCurrentLaw(network, result);
    }
}
