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
 * Thrown when a node or a branch is added with an id already used by an element of the same kind.
 */
public class DuplicateIdException extends PowsyblException {

    private final String elementId;

    public DuplicateIdException(String elementKind, String elementId) {
        super(elementKind + " '" + elementId + "' already exists");
        this.elementId = elementId;
    }

    public String getElementId() {
        return elementId;
    }
}
