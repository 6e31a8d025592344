/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.circuitflow;

import com.google.common.base.Stopwatch;
import com.powsybl.circuitflow.graph.FundamentalCycles;
import com.powsybl.circuitflow.graph.FundamentalCyclesFinder;
import com.powsybl.circuitflow.mesh.MeshCurrentDecomposer;
import com.powsybl.circuitflow.mesh.MeshCurrents;
import com.powsybl.circuitflow.mesh.UnsupportedTopologyException;
import com.powsybl.circuitflow.mna.MnaSystem;
import com.powsybl.circuitflow.mna.MnaSystemBuilder;
import com.powsybl.circuitflow.network.CircuitBranch;
import com.powsybl.circuitflow.network.CircuitNetwork;
import com.powsybl.circuitflow.network.CircuitNode;
import com.powsybl.circuitflow.network.SelectedReferenceNode;
import com.powsybl.circuitflow.solver.LinearSolver;
import com.powsybl.circuitflow.solver.SingularMatrixException;
import com.powsybl.circuitflow.util.DebugUtil;
import com.powsybl.circuitflow.util.Markers;
import com.powsybl.circuitflow.util.Reports;
import com.powsybl.commons.report.ReportNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.time.ZonedDateTime;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.TimeUnit;

/**
 * Static solve of a linear DC circuit.
 * <p>
 * A run is a pure function of the network state: it selects the reference node, builds and solves the modified
 * nodal analysis system, derives the branch currents and, with the {@link AnalysisMethod#MESH} method, fits one mesh
 * current per fundamental cycle. Fresh matrices are allocated on each run, so runs can be repeated safely. The
 * network must not be modified during a run.
 * <p>
 * A circuit without unique solution makes the run fail with a {@link SingularMatrixException}; no partial result is
 * ever returned.
 */
public class CircuitFlowEngine {

    private static final Logger LOGGER = LoggerFactory.getLogger(CircuitFlowEngine.class);

    private final CircuitFlowParameters parameters;

    public CircuitFlowEngine(CircuitFlowParameters parameters) {
        this.parameters = Objects.requireNonNull(parameters);
    }

    public CircuitFlowEngine() {
        this(new CircuitFlowParameters());
    }

    public CircuitFlowParameters getParameters() {
        return parameters;
    }

    public CircuitFlowResult run(CircuitNetwork network) {
        return run(network, ReportNode.NO_OP);
    }

    public CircuitFlowResult run(CircuitNetwork network, ReportNode reportNode) {
        Objects.requireNonNull(network);
        Objects.requireNonNull(reportNode);
        Stopwatch stopwatch = Stopwatch.createStarted();

        AnalysisMethod analysisMethod = parameters.getAnalysisMethod();
        ReportNode runReportNode = Reports.createCircuitFlowReporter(reportNode, network.getId(), analysisMethod.name());
        Reports.reportCircuitSize(runReportNode, network.getNodes().size(), network.getBranches().size());

        if (network.getNodes().isEmpty()) {
            LOGGER.warn("Network '{}' has no node, nothing to solve", network.getId());
            Reports.reportEmptyCircuit(runReportNode);
            return CircuitFlowResult.createEmptyResult(network.getId(), analysisMethod);
        }

        SelectedReferenceNode selectedReferenceNode = network.selectReferenceNode(parameters.createReferenceNodeSelector());
        CircuitNode referenceNode = selectedReferenceNode.node();
        LOGGER.info("Network '{}': reference node is '{}' (method={})", network.getId(), referenceNode.getId(), selectedReferenceNode.selectionMethod());
        Reports.reportReferenceNode(runReportNode, referenceNode.getId(), selectedReferenceNode.selectionMethod());

        MnaSystem system = MnaSystemBuilder.build(network, referenceNode, runReportNode);
        LinearSolver solver = parameters.createLinearSolver();
        double[] x = solve(network, system, solver, runReportNode);

        // node voltages, reference and isolated nodes being at 0 V
        Map<String, Double> nodeVoltages = new LinkedHashMap<>();
        double[] v = new double[network.getNodes().size()];
        for (CircuitNode node : network.getNodes()) {
            int row = system.getNodeRow(node);
            v[node.getNum()] = row != MnaSystem.NO_ROW ? x[row] : 0;
            nodeVoltages.put(node.getId(), v[node.getNum()]);
        }

        List<CircuitBranch> branches = network.getBranches();
        double[] i = computeBranchCurrents(branches, system, v, x);
        Map<String, Double> branchCurrents = new LinkedHashMap<>();
        Map<String, Double> voltageSourceCurrents = new LinkedHashMap<>();
        for (CircuitBranch branch : branches) {
            branchCurrents.put(branch.getId(), i[branch.getNum()]);
            if (system.getVoltageSourceRow(branch) != MnaSystem.NO_ROW) {
                voltageSourceCurrents.put(branch.getId(), i[branch.getNum()]);
            }
        }

        MeshCurrents meshCurrents = null;
        UnsupportedTopologyException meshDecompositionFailure = null;
        if (analysisMethod == AnalysisMethod.MESH) {
            try {
                meshCurrents = decompose(network, solver, i, runReportNode);
            } catch (UnsupportedTopologyException e) {
                if (!parameters.isMeshFallbackToNodal()) {
                    throw e;
                }
                LOGGER.warn("Network '{}': {}, only nodal results are available", network.getId(), e.getMessage());
                Reports.reportMeshDecompositionFallback(runReportNode, e.getMessage());
                meshDecompositionFailure = e;
            }
        }

        CircuitFlowResult result = new CircuitFlowResult(network.getId(), analysisMethod, referenceNode.getId(),
                nodeVoltages, branchCurrents, voltageSourceCurrents, system.getWarnings(), meshCurrents, meshDecompositionFailure);

        if (parameters.getDebugDir() != null) {
            writeDebugFiles(network, result, parameters.getDebugDir());
        }

        stopwatch.stop();
        LOGGER.debug(Markers.PERFORMANCE_MARKER, "Circuit flow on network '{}' ran in {} ms", network.getId(), stopwatch.elapsed(TimeUnit.MILLISECONDS));
        LOGGER.info("Circuit flow on network '{}' complete (method={}, unknowns={}, warnings={})",
                network.getId(), analysisMethod, system.getSize(), system.getWarnings().size());

        return result;
    }

    private static double[] solve(CircuitNetwork network, MnaSystem system, LinearSolver solver, ReportNode reportNode) {
        if (system.isEmpty()) {
            return new double[0];
        }
        try {
            double[] x = solver.solve(system.getMatrix(), system.getRhs());
            Reports.reportSystemSolved(reportNode, system.getSize());
            return x;
        } catch (SingularMatrixException e) {
            LOGGER.error("Circuit of network '{}' has no unique solution: {}", network.getId(), e.getMessage());
            Reports.reportSingularSystem(reportNode, e.getMessage());
            throw e;
        }
    }

    /**
     * Branch currents indexed by branch handle: (V(from) - V(to)) / R for a resistor, the source value for a
     * current source, the matching unknown for a voltage source, 0 for a skipped branch.
     */
    private static double[] computeBranchCurrents(List<CircuitBranch> branches, MnaSystem system, double[] v, double[] x) {
        double[] i = new double[branches.size()];
        for (CircuitBranch branch : branches) {
            if (system.isSkipped(branch)) {
                continue;
            }
            i[branch.getNum()] = switch (branch.getType()) {
                case RESISTOR -> (v[branch.getFrom().getNum()] - v[branch.getTo().getNum()]) / branch.getValue();
                case CURRENT_SOURCE -> branch.getValue();
                case VOLTAGE_SOURCE -> x[system.getVoltageSourceRow(branch)];
            };
        }
        return i;
    }

    private static MeshCurrents decompose(CircuitNetwork network, LinearSolver solver, double[] branchCurrents, ReportNode reportNode) {
        FundamentalCycles cycles = FundamentalCyclesFinder.find(network);
        if (!cycles.isConnected()) {
            LOGGER.warn("Network '{}' is split into {} connected components", network.getId(), cycles.componentCount());
            Reports.reportDisconnectedCircuit(reportNode, cycles.componentCount());
        }
        MeshCurrents meshCurrents = new MeshCurrentDecomposer(solver).decompose(network, cycles, branchCurrents);
        Reports.reportMeshCurrents(reportNode, cycles.cycles().size());
        return meshCurrents;
    }

    private static void writeDebugFiles(CircuitNetwork network, CircuitFlowResult result, String debugDirStr) {
        Path debugDir = DebugUtil.getDebugDir(debugDirStr);
        String dateStr = ZonedDateTime.now().format(DebugUtil.DATE_TIME_FORMAT);
        network.writeJson(debugDir.resolve("circuit-" + network.getId() + "-" + dateStr + ".json"));
        result.writeJson(debugDir.resolve("circuit-result-" + network.getId() + "-" + dateStr + ".json"));
    }
}
