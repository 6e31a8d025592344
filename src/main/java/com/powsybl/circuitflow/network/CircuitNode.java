/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.circuitflow.network;

import java.util.List;

public class CircuitNode extends AbstractCircuitElement {

    private boolean reference = false;

    CircuitNode(CircuitNetwork network, String id) {
        super(network, id);
    }

    public boolean isReference() {
        return reference;
    }

    void setReference(boolean reference) {
        this.reference = reference;
    }

    /**
     * Branches connected to this node on any side, in network order. A self loop is listed once.
     */
    public List<CircuitBranch> getBranches() {
        return network.getBranches().stream()
                .filter(b -> b.getFrom() == this || b.getTo() == this)
                .toList();
    }
}
