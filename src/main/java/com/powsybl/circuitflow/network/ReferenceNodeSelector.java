/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.circuitflow.network;

import java.util.List;
import java.util.Objects;

/**
 * Chooses the node taken as the 0 V reference of a circuit.
 */
public interface ReferenceNodeSelector {

    /**
     * @param nodes the non empty node list of the network, in insertion order
     */
    SelectedReferenceNode select(List<CircuitNode> nodes);

    static ReferenceNodeSelector fromIds(List<String> referenceNodeIds) {
        Objects.requireNonNull(referenceNodeIds);
        return referenceNodeIds.isEmpty() ? new GroundReferenceNodeSelector() : new NameReferenceNodeSelector(referenceNodeIds);
    }
}
