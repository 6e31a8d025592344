/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.circuitflow.solver;

import com.powsybl.math.matrix.MatrixException;

/**
 * Thrown when a linear system has no unique solution: a pivot vanished during elimination or a non finite value
 * appeared. For a circuit this means a floating subcircuit, voltage sources in a loop or current sources in a cut set.
 */
public class SingularMatrixException extends MatrixException {

    private final int column;

    public SingularMatrixException(String msg, int column) {
        super(msg);
        this.column = column;
    }

    /**
     * @return the elimination column at which the failure has been detected
     */
    public int getColumn() {
        return column;
    }
}
