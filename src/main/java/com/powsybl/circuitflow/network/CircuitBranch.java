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
 * A two terminal element oriented from {@link #getFrom()} to {@link #getTo()}. The orientation defines the sign of
 * the branch current and, for a voltage source, the polarity: V(from) - V(to) = value.
 */
public class CircuitBranch extends AbstractCircuitElement {

    private String name;

    private CircuitNode from;

    private CircuitNode to;

    private BranchType type;

    private double value;

    CircuitBranch(CircuitNetwork network, String id, String name, CircuitNode from, CircuitNode to, BranchType type, double value) {
        super(network, id);
        this.name = name != null ? name : id;
        this.from = Objects.requireNonNull(from);
        this.to = Objects.requireNonNull(to);
        this.type = Objects.requireNonNull(type);
        this.value = value;
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name != null ? name : id;
    }

    public CircuitNode getFrom() {
        return from;
    }

    public CircuitNode getTo() {
        return to;
    }

    void connect(CircuitNode from, CircuitNode to) {
        this.from = Objects.requireNonNull(from);
        this.to = Objects.requireNonNull(to);
    }

    public BranchType getType() {
        return type;
    }

    void setType(BranchType type) {
        this.type = Objects.requireNonNull(type);
    }

    public double getValue() {
        return value;
    }

    void setValue(double value) {
        this.value = value;
    }

    public boolean isSelfLoop() {
        return from == to;
    }

    public boolean isConnectedTo(CircuitNode node) {
        return from == node || to == node;
    }

    public CircuitNode getOppositeNode(CircuitNode node) {
        if (node == from) {
            return to;
        } else if (node == to) {
            return from;
        }
        throw new IllegalArgumentException("Node " + node.getId() + " is not connected to branch " + id);
    }
}
