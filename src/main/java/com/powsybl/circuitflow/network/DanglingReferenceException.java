/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.circuitflow.network;

import com.powsybl.commons.PowsyblException;

/**
 * Thrown when a mutation refers to a node or a branch which does not exist in the network.
 */
public class DanglingReferenceException extends PowsyblException {

    private final String elementId;

    public DanglingReferenceException(String elementKind, String elementId) {
        super(elementKind + " '" + elementId + "' not found");
        this.elementId = elementId;
    }

    public String getElementId() {
        return elementId;
    }
}
