/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.circuitflow.mesh;

import com.powsybl.commons.PowsyblException;

/**
 * Thrown when mesh currents cannot be defined for a circuit: it contains independent current sources, or it has no
 * cycle at all.
 */
public class UnsupportedTopologyException extends PowsyblException {

    public UnsupportedTopologyException(String msg) {
        super(msg);
    }
}
