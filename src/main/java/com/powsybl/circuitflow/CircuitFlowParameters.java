/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.circuitflow;

import com.powsybl.circuitflow.network.ReferenceNodeSelector;
import com.powsybl.circuitflow.solver.GaussianEliminationSolver;
import com.powsybl.circuitflow.solver.LinearSolver;
import com.powsybl.commons.config.PlatformConfig;

import java.util.*;

/**
 * Parameters of a circuit flow run. Defaults can be overridden in the {@value #MODULE_NAME} module of the platform
 * configuration:
 * <pre>
 * circuit-flow-default-parameters:
 *     analysisMethod: MESH
 *     referenceNodeIds: GND,0
 *     pivotEpsilon: 1e-12
 *     meshFallbackToNodal: true
 *     debugDir: /tmp/circuit-flow
 * </pre>
 */
public class CircuitFlowParameters {

    public static final String MODULE_NAME = "circuit-flow-default-parameters";

    public static final String ANALYSIS_METHOD_PARAM_NAME = "analysisMethod";

    public static final String REFERENCE_NODE_IDS_PARAM_NAME = "referenceNodeIds";

    public static final String PIVOT_EPSILON_PARAM_NAME = "pivotEpsilon";

    public static final String MESH_FALLBACK_TO_NODAL_PARAM_NAME = "meshFallbackToNodal";

    public static final String DEBUG_DIR_PARAM_NAME = "debugDir";

    public static final AnalysisMethod ANALYSIS_METHOD_DEFAULT_VALUE = AnalysisMethod.NODAL;

    public static final double PIVOT_EPSILON_DEFAULT_VALUE = GaussianEliminationSolver.DEFAULT_PIVOT_EPSILON;

    public static final boolean MESH_FALLBACK_TO_NODAL_DEFAULT_VALUE = true;

    public static final List<String> SPECIFIC_PARAMETERS_NAMES = List.of(ANALYSIS_METHOD_PARAM_NAME,
                                                                         REFERENCE_NODE_IDS_PARAM_NAME,
                                                                         PIVOT_EPSILON_PARAM_NAME,
                                                                         MESH_FALLBACK_TO_NODAL_PARAM_NAME,
                                                                         DEBUG_DIR_PARAM_NAME);

    private AnalysisMethod analysisMethod = ANALYSIS_METHOD_DEFAULT_VALUE;

    private List<String> referenceNodeIds = Collections.emptyList();

    private double pivotEpsilon = PIVOT_EPSILON_DEFAULT_VALUE;

    private boolean meshFallbackToNodal = MESH_FALLBACK_TO_NODAL_DEFAULT_VALUE;

    private String debugDir;

    public AnalysisMethod getAnalysisMethod() {
        return analysisMethod;
    }

    public CircuitFlowParameters setAnalysisMethod(AnalysisMethod analysisMethod) {
        this.analysisMethod = Objects.requireNonNull(analysisMethod);
        return this;
    }

    public List<String> getReferenceNodeIds() {
        return referenceNodeIds;
    }

    /**
     * Ids of the nodes to try, in order, as reference. When empty or when none of them exists, the reference is the
     * ground node ("0" or "GND") or else the first node.
     */
    public CircuitFlowParameters setReferenceNodeIds(List<String> referenceNodeIds) {
        this.referenceNodeIds = List.copyOf(referenceNodeIds);
        return this;
    }

    public double getPivotEpsilon() {
        return pivotEpsilon;
    }

    public CircuitFlowParameters setPivotEpsilon(double pivotEpsilon) {
        if (!(pivotEpsilon >= 0) || Double.isInfinite(pivotEpsilon)) {
            throw new IllegalArgumentException("Invalid pivot epsilon: " + pivotEpsilon);
        }
        this.pivotEpsilon = pivotEpsilon;
        return this;
    }

    public boolean isMeshFallbackToNodal() {
        return meshFallbackToNodal;
    }

    /**
     * When true, a circuit on which mesh currents cannot be defined still gets its nodal results. When false, the run
     * fails with the mesh decomposition error.
     */
    public CircuitFlowParameters setMeshFallbackToNodal(boolean meshFallbackToNodal) {
        this.meshFallbackToNodal = meshFallbackToNodal;
        return this;
    }

    public String getDebugDir() {
        return debugDir;
    }

    public CircuitFlowParameters setDebugDir(String debugDir) {
        this.debugDir = debugDir;
        return this;
    }

    public ReferenceNodeSelector createReferenceNodeSelector() {
        return ReferenceNodeSelector.fromIds(referenceNodeIds);
    }

    public LinearSolver createLinearSolver() {
        return new GaussianEliminationSolver(pivotEpsilon);
    }

    public static CircuitFlowParameters load() {
        return load(PlatformConfig.defaultConfig());
    }

    public static CircuitFlowParameters load(PlatformConfig platformConfig) {
        Objects.requireNonNull(platformConfig);
        CircuitFlowParameters parameters = new CircuitFlowParameters();
        platformConfig.getOptionalModuleConfig(MODULE_NAME)
            .ifPresent(config -> parameters
                .setAnalysisMethod(config.getEnumProperty(ANALYSIS_METHOD_PARAM_NAME, AnalysisMethod.class, ANALYSIS_METHOD_DEFAULT_VALUE))
                .setReferenceNodeIds(config.getStringListProperty(REFERENCE_NODE_IDS_PARAM_NAME, Collections.emptyList()))
                .setPivotEpsilon(config.getDoubleProperty(PIVOT_EPSILON_PARAM_NAME, PIVOT_EPSILON_DEFAULT_VALUE))
                .setMeshFallbackToNodal(config.getBooleanProperty(MESH_FALLBACK_TO_NODAL_PARAM_NAME, MESH_FALLBACK_TO_NODAL_DEFAULT_VALUE))
                .setDebugDir(config.getOptionalStringProperty(DEBUG_DIR_PARAM_NAME).orElse(null)));
        return parameters;
    }

    public static CircuitFlowParameters load(Map<String, String> properties) {
        return new CircuitFlowParameters().update(properties);
    }

    private static List<String> parseStringListProp(String prop) {
        if (prop.trim().isEmpty()) {
            return Collections.emptyList();
        }
        return Arrays.stream(prop.split("[:,]")).map(String::trim).toList();
    }

    public CircuitFlowParameters update(Map<String, String> properties) {
        Objects.requireNonNull(properties);
        Optional.ofNullable(properties.get(ANALYSIS_METHOD_PARAM_NAME))
                .ifPresent(prop -> this.setAnalysisMethod(AnalysisMethod.valueOf(prop)));
        Optional.ofNullable(properties.get(REFERENCE_NODE_IDS_PARAM_NAME))
                .ifPresent(prop -> this.setReferenceNodeIds(parseStringListProp(prop)));
        Optional.ofNullable(properties.get(PIVOT_EPSILON_PARAM_NAME))
                .ifPresent(prop -> this.setPivotEpsilon(Double.parseDouble(prop)));
        Optional.ofNullable(properties.get(MESH_FALLBACK_TO_NODAL_PARAM_NAME))
                .ifPresent(prop -> this.setMeshFallbackToNodal(Boolean.parseBoolean(prop)));
        Optional.ofNullable(properties.get(DEBUG_DIR_PARAM_NAME))
                .ifPresent(this::setDebugDir);
        return this;
    }

    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put(ANALYSIS_METHOD_PARAM_NAME, analysisMethod);
        map.put(REFERENCE_NODE_IDS_PARAM_NAME, referenceNodeIds);
        map.put(PIVOT_EPSILON_PARAM_NAME, pivotEpsilon);
        map.put(MESH_FALLBACK_TO_NODAL_PARAM_NAME, meshFallbackToNodal);
        map.put(DEBUG_DIR_PARAM_NAME, debugDir);
        return map;
    }

    @Override
    public String toString() {
        return "CircuitFlowParameters(" + toMap() + ")";
    }
}
