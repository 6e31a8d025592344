/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.circuitflow.util;

import com.powsybl.circuitflow.util.report.PowsyblCircuitFlowReportResourceBundle;
import com.powsybl.commons.report.ReportNode;
import com.powsybl.commons.report.TypedValue;

/**
 * Functional report entries of a circuit flow run.
 */
public final class Reports {

    private static final String NETWORK_ID = "networkId";
    private static final String NODE_ID = "nodeId";
    private static final String BRANCH_ID = "branchId";

    private Reports() {
    }

    public static ReportNode createRootReportNode(String networkId) {
        return ReportNode.newRootReportNode()
                .withResourceBundles(PowsyblCircuitFlowReportResourceBundle.BASE_NAME)
                .withMessageTemplate("cf.circuitFlow")
                .withUntypedValue(NETWORK_ID, networkId)
                .build();
    }

    public static ReportNode createCircuitFlowReporter(ReportNode reportNode, String networkId, String analysisMethod) {
        return reportNode.newReportNode()
                .withMessageTemplate("cf.circuitFlowRun")
                .withUntypedValue(NETWORK_ID, networkId)
                .withUntypedValue("analysisMethod", analysisMethod)
                .add();
    }

    public static void reportCircuitSize(ReportNode reportNode, int nodeCount, int branchCount) {
        reportNode.newReportNode()
                .withMessageTemplate("cf.circuitSize")
                .withUntypedValue("nodeCount", nodeCount)
                .withUntypedValue("branchCount", branchCount)
                .withSeverity(TypedValue.INFO_SEVERITY)
                .add();
    }

    public static void reportEmptyCircuit(ReportNode reportNode) {
        reportNode.newReportNode()
                .withMessageTemplate("cf.emptyCircuit")
                .withSeverity(TypedValue.WARN_SEVERITY)
                .add();
    }

    public static void reportReferenceNode(ReportNode reportNode, String nodeId, String selectionMethod) {
        reportNode.newReportNode()
                .withMessageTemplate("cf.referenceNode")
                .withUntypedValue(NODE_ID, nodeId)
                .withUntypedValue("selectionMethod", selectionMethod)
                .withSeverity(TypedValue.INFO_SEVERITY)
                .add();
    }

    public static void reportInvalidComponent(ReportNode reportNode, String branchId, String branchType, double value, String reason) {
        reportNode.newReportNode()
                .withMessageTemplate("cf.invalidComponent")
                .withUntypedValue(BRANCH_ID, branchId)
                .withUntypedValue("branchType", branchType)
                .withUntypedValue("value", value)
                .withUntypedValue("reason", reason)
                .withSeverity(TypedValue.WARN_SEVERITY)
                .add();
    }

    public static void reportIsolatedNode(ReportNode reportNode, String nodeId) {
        reportNode.newReportNode()
                .withMessageTemplate("cf.isolatedNode")
                .withUntypedValue(NODE_ID, nodeId)
                .withSeverity(TypedValue.WARN_SEVERITY)
                .add();
    }

    public static void reportSingularSystem(ReportNode reportNode, String message) {
        reportNode.newReportNode()
                .withMessageTemplate("cf.singularSystem")
                .withUntypedValue("message", message)
                .withSeverity(TypedValue.ERROR_SEVERITY)
                .add();
    }

    public static void reportSystemSolved(ReportNode reportNode, int unknownCount) {
        reportNode.newReportNode()
                .withMessageTemplate("cf.systemSolved")
                .withUntypedValue("unknownCount", unknownCount)
                .withSeverity(TypedValue.INFO_SEVERITY)
                .add();
    }

    public static void reportDisconnectedCircuit(ReportNode reportNode, int componentCount) {
        reportNode.newReportNode()
                .withMessageTemplate("cf.disconnectedCircuit")
                .withUntypedValue("componentCount", componentCount)
                .withSeverity(TypedValue.WARN_SEVERITY)
                .add();
    }

    public static void reportMeshCurrents(ReportNode reportNode, int cycleCount) {
        reportNode.newReportNode()
                .withMessageTemplate("cf.meshCurrents")
                .withUntypedValue("cycleCount", cycleCount)
                .withSeverity(TypedValue.INFO_SEVERITY)
                .add();
    }

    public static void reportMeshDecompositionFallback(ReportNode reportNode, String message) {
        reportNode.newReportNode()
                .withMessageTemplate("cf.meshDecompositionFallback")
                .withUntypedValue("message", message)
                .withSeverity(TypedValue.WARN_SEVERITY)
                .add();
    }
}
