/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.circuitflow.network;

import java.util.List;
import java.util.Set;

/**
 * Selects the first node named like a ground ("0" or "GND", case insensitive). If the circuit has no such node,
 * the first node in insertion order is taken.
 */
public class GroundReferenceNodeSelector implements ReferenceNodeSelector {

    public static final Set<String> GROUND_NAMES = Set.of("0", "GND");

    private static final String GROUND_METHOD = "Ground name";

    private static final String FIRST_METHOD = "First node";

    public static boolean isGroundName(String nodeId) {
        return GROUND_NAMES.stream().anyMatch(name -> name.equalsIgnoreCase(nodeId));
    }

    @Override
    public SelectedReferenceNode select(List<CircuitNode> nodes) {
        if (nodes.isEmpty()) {
            throw new IllegalArgumentException("Empty node list");
        }
        return nodes.stream()
                .filter(node -> isGroundName(node.getId()))
                .findFirst()
                .map(node -> new SelectedReferenceNode(node, GROUND_METHOD))
                .orElseGet(() -> new SelectedReferenceNode(nodes.get(0), FIRST_METHOD));
    }
}
