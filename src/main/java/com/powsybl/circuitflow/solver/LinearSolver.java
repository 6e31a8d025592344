/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.circuitflow.solver;

import com.powsybl.math.matrix.DenseMatrix;

/**
 * Solver of square linear systems A.x = b.
 * <p>
 * Implementations either return the complete solution or throw a {@link SingularMatrixException}: a partially
 * computed vector is never returned. The given matrix and right hand side are left untouched.
 */
public interface LinearSolver {

    double[] solve(DenseMatrix a, double[] b);
}
