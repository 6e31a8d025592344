/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.circuitflow;

import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonGenerator;
import com.powsybl.circuitflow.graph.FundamentalCycle;
import com.powsybl.circuitflow.mesh.MeshCurrents;
import com.powsybl.circuitflow.mesh.UnsupportedTopologyException;
import com.powsybl.circuitflow.mna.InvalidComponentWarning;
import com.powsybl.circuitflow.network.CircuitNode;
import com.powsybl.commons.PowsyblException;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.*;

/**
 * Outcome of a successful circuit flow run. Voltages are in volts, the reference node being at 0 V. Currents are in
 * amperes, positive when flowing from the "from" node to the "to" node of their branch.
 */
public class CircuitFlowResult {

    private final String networkId;

    private final AnalysisMethod analysisMethod;

    private final String referenceNodeId;

    private final Map<String, Double> nodeVoltages;

    private final Map<String, Double> branchCurrents;

    private final Map<String, Double> voltageSourceCurrents;

    private final List<InvalidComponentWarning> warnings;

    private final MeshCurrents meshCurrents;

    private final UnsupportedTopologyException meshDecompositionFailure;

    CircuitFlowResult(String networkId, AnalysisMethod analysisMethod, String referenceNodeId,
                      Map<String, Double> nodeVoltages, Map<String, Double> branchCurrents, Map<String, Double> voltageSourceCurrents,
                      List<InvalidComponentWarning> warnings, MeshCurrents meshCurrents, UnsupportedTopologyException meshDecompositionFailure) {
        this.networkId = Objects.requireNonNull(networkId);
        this.analysisMethod = Objects.requireNonNull(analysisMethod);
        this.referenceNodeId = referenceNodeId;
        this.nodeVoltages = Collections.unmodifiableMap(new LinkedHashMap<>(nodeVoltages));
        this.branchCurrents = Collections.unmodifiableMap(new LinkedHashMap<>(branchCurrents));
        this.voltageSourceCurrents = Collections.unmodifiableMap(new LinkedHashMap<>(voltageSourceCurrents));
        this.warnings = List.copyOf(warnings);
        this.meshCurrents = meshCurrents;
        this.meshDecompositionFailure = meshDecompositionFailure;
    }

    static CircuitFlowResult createEmptyResult(String networkId, AnalysisMethod analysisMethod) {
        return new CircuitFlowResult(networkId, analysisMethod, null, Collections.emptyMap(), Collections.emptyMap(),
                Collections.emptyMap(), Collections.emptyList(), null, null);
    }

    public String getNetworkId() {
        return networkId;
    }

    public AnalysisMethod getAnalysisMethod() {
        return analysisMethod;
    }

    /**
     * @return the reference node id, empty only for a network without any node
     */
    public Optional<String> getReferenceNodeId() {
        return Optional.ofNullable(referenceNodeId);
    }

    public Map<String, Double> getNodeVoltages() {
        return nodeVoltages;
    }

    public Map<String, Double> getBranchCurrents() {
        return branchCurrents;
    }

    /**
     * Currents of the voltage sources included in the equations, by branch id. They are also part of
     * {@link #getBranchCurrents()}.
     */
    public Map<String, Double> getVoltageSourceCurrents() {
        return voltageSourceCurrents;
    }

    public double getNodeVoltage(String nodeId) {
        Double v = nodeVoltages.get(nodeId);
        if (v == null) {
            throw new PowsyblException("Node '" + nodeId + "' not found in result of network '" + networkId + "'");
        }
        return v;
    }

    public double getNodeVoltage(CircuitNode node) {
        return getNodeVoltage(node.getId());
    }

    public double getBranchCurrent(String branchId) {
        Double i = branchCurrents.get(branchId);
        if (i == null) {
            throw new PowsyblException("Branch '" + branchId + "' not found in result of network '" + networkId + "'");
        }
        return i;
    }

    public List<InvalidComponentWarning> getWarnings() {
        return warnings;
    }

    public Optional<MeshCurrents> getMeshCurrents() {
        return Optional.ofNullable(meshCurrents);
    }

    /**
     * @return the fundamental cycles the mesh currents are aligned with, empty when no mesh decomposition succeeded
     */
    public List<FundamentalCycle> getCycles() {
        return meshCurrents != null ? meshCurrents.getCycles() : Collections.emptyList();
    }

    /**
     * @return why mesh currents could not be computed, when the mesh method fell back to nodal results
     */
    public Optional<UnsupportedTopologyException> getMeshDecompositionFailure() {
        return Optional.ofNullable(meshDecompositionFailure);
    }

    public void writeJson(Path file) {
        try (Writer writer = Files.newBufferedWriter(file, StandardCharsets.UTF_8)) {
            writeJson(writer);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    private static void writeValues(String fieldName, Map<String, Double> values, JsonGenerator jsonGenerator) throws IOException {
        jsonGenerator.writeFieldName(fieldName);
        jsonGenerator.writeStartObject();
        for (Map.Entry<String, Double> e : values.entrySet()) {
            jsonGenerator.writeNumberField(e.getKey(), e.getValue());
        }
        jsonGenerator.writeEndObject();
    }

    public void writeJson(Writer writer) {
        Objects.requireNonNull(writer);
        try (JsonGenerator jsonGenerator = new JsonFactory()
                .createGenerator(writer)
                .useDefaultPrettyPrinter()) {
            jsonGenerator.writeStartObject();
            jsonGenerator.writeStringField("networkId", networkId);
            jsonGenerator.writeStringField("analysisMethod", analysisMethod.name());
            if (referenceNodeId != null) {
                jsonGenerator.writeStringField("referenceNodeId", referenceNodeId);
            }
            writeValues("nodeVoltages", nodeVoltages, jsonGenerator);
            writeValues("branchCurrents", branchCurrents, jsonGenerator);

            if (meshCurrents != null) {
                jsonGenerator.writeFieldName("meshCurrents");
                jsonGenerator.writeStartArray();
                List<FundamentalCycle> cycles = meshCurrents.getCycles();
                for (int k = 0; k < cycles.size(); k++) {
                    jsonGenerator.writeStartObject();
                    jsonGenerator.writeStringField("chord", cycles.get(k).getChord().getId());
                    jsonGenerator.writeFieldName("nodes");
                    jsonGenerator.writeStartArray();
                    for (CircuitNode node : cycles.get(k).getNodes()) {
                        jsonGenerator.writeString(node.getId());
                    }
                    jsonGenerator.writeEndArray();
                    jsonGenerator.writeNumberField("current", meshCurrents.getCurrent(k));
                    jsonGenerator.writeEndObject();
                }
                jsonGenerator.writeEndArray();
            }
            if (meshDecompositionFailure != null) {
                jsonGenerator.writeStringField("meshDecompositionFailure", meshDecompositionFailure.getMessage());
            }

            if (!warnings.isEmpty()) {
                jsonGenerator.writeFieldName("warnings");
                jsonGenerator.writeStartArray();
                for (InvalidComponentWarning warning : warnings) {
                    jsonGenerator.writeString(warning.getMessage());
                }
                jsonGenerator.writeEndArray();
            }
            jsonGenerator.writeEndObject();
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    @Override
    public String toString() {
        return "CircuitFlowResult(networkId=" + networkId
                + ", analysisMethod=" + analysisMethod
                + ", referenceNodeId=" + referenceNodeId
                + ", nodeCount=" + nodeVoltages.size()
                + ", branchCount=" + branchCurrents.size()
                + ", meshCount=" + (meshCurrents != null ? meshCurrents.getCycles().size() : 0)
                + ", warningCount=" + warnings.size()
                + ")";
    }
}
