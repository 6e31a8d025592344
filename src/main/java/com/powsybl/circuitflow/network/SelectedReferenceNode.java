/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.circuitflow.network;

import java.util.Objects;

/**
 * @param node the reference node
 * @param selectionMethod human readable description of how the node has been chosen
 */
public record SelectedReferenceNode(CircuitNode node, String selectionMethod) {

    public SelectedReferenceNode {
        Objects.requireNonNull(node);
        Objects.requireNonNull(selectionMethod);
    }
}
