/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.circuitflow.network;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Selects the first node of a configured id list which exists in the circuit, and falls back to a second level
 * selector when none of them does.
 */
public class NameReferenceNodeSelector implements ReferenceNodeSelector {

    private static final String SELECTION_METHOD = "Parameter node";

    private final List<String> nodeIds;

    private final ReferenceNodeSelector secondLevelSelector;

    public NameReferenceNodeSelector(List<String> nodeIds, ReferenceNodeSelector secondLevelSelector) {
        if (nodeIds.isEmpty()) {
            throw new IllegalArgumentException("Empty node ID list");
        }
        this.nodeIds = List.copyOf(nodeIds);
        this.secondLevelSelector = Objects.requireNonNull(secondLevelSelector);
    }

    public NameReferenceNodeSelector(List<String> nodeIds) {
        this(nodeIds, new GroundReferenceNodeSelector());
    }

    public NameReferenceNodeSelector(String... nodeIds) {
        this(List.of(nodeIds));
    }

    @Override
    public SelectedReferenceNode select(List<CircuitNode> nodes) {
        Map<String, CircuitNode> nodesById = nodes.stream().collect(Collectors.toMap(CircuitNode::getId, Function.identity()));
        return nodeIds.stream()
                .map(nodesById::get)
                .filter(Objects::nonNull)
                .findFirst()
                .map(node -> new SelectedReferenceNode(node, SELECTION_METHOD))
                .orElseGet(() -> {
                    SelectedReferenceNode fallback = secondLevelSelector.select(nodes);
                    return new SelectedReferenceNode(fallback.node(), SELECTION_METHOD + " not found + " + fallback.selectionMethod());
                });
    }
}
