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
 * Common part of nodes and branches: an external string id and an integer handle which is the element index in
 * the flat lists of its {@link CircuitNetwork}.
 */
public abstract class AbstractCircuitElement {

    protected final CircuitNetwork network;

    protected final String id;

    protected int num = -1;

    protected AbstractCircuitElement(CircuitNetwork network, String id) {
        this.network = Objects.requireNonNull(network);
        this.id = Objects.requireNonNull(id);
    }

    public String getId() {
        return id;
    }

    public int getNum() {
        return num;
    }

    void setNum(int num) {
        this.num = num;
    }

    public CircuitNetwork getNetwork() {
        return network;
    }

    @Override
    public String toString() {
        return id;
    }
}
