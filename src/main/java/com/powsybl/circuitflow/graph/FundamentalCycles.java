/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.circuitflow.graph;

import java.util.List;

/**
 * Fundamental cycle basis of a circuit graph.
 *
 * @param cycles one cycle per chord, in branch order
 * @param componentCount number of connected components of the graph, isolated nodes included
 */
public record FundamentalCycles(List<FundamentalCycle> cycles, int componentCount) {

    public FundamentalCycles {
        cycles = List.copyOf(cycles);
    }

    public boolean isConnected() {
        return componentCount <= 1;
    }

    public boolean isEmpty() {
        return cycles.isEmpty();
    }
}
