/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.circuitflow.solver;

import com.powsybl.math.matrix.DenseMatrix;
import com.powsybl.math.matrix.MatrixException;

import java.util.Objects;

/**
 * Dense Gaussian elimination with partial pivoting.
 */
public class GaussianEliminationSolver implements LinearSolver {

    public static final double DEFAULT_PIVOT_EPSILON = 1e-12;

    private final double pivotEpsilon;

    public GaussianEliminationSolver() {
        this(DEFAULT_PIVOT_EPSILON);
    }

    /**
     * @param pivotEpsilon absolute magnitude under which a pivot is considered as zero
     */
    public GaussianEliminationSolver(double pivotEpsilon) {
        if (!(pivotEpsilon >= 0) || Double.isInfinite(pivotEpsilon)) {
            throw new IllegalArgumentException("Invalid pivot epsilon: " + pivotEpsilon);
        }
        this.pivotEpsilon = pivotEpsilon;
    }

    public double getPivotEpsilon() {
        return pivotEpsilon;
    }

    @Override
    public double[] solve(DenseMatrix a, double[] b) {
        Objects.requireNonNull(a);
        Objects.requireNonNull(b);
        int n = a.getRowCount();
        if (a.getColumnCount() != n) {
            throw new MatrixException("Matrix is not square: " + n + "x" + a.getColumnCount());
        }
        if (b.length != n) {
            throw new MatrixException("Right hand side size " + b.length + " does not match matrix size " + n);
        }

        // augmented copy, last column is the right hand side
        double[][] m = new double[n][n + 1];
        for (int i = 0; i < n; i++) {
            for (int j = 0; j < n; j++) {
                m[i][j] = a.get(i, j);
            }
            m[i][n] = b[i];
        }

        for (int k = 0; k < n; k++) {
            int pivotRow = k;
            double pivotAbs = Math.abs(m[k][k]);
            for (int r = k + 1; r < n; r++) {
                double abs = Math.abs(m[r][k]);
                if (abs > pivotAbs) {
                    pivotAbs = abs;
                    pivotRow = r;
                }
            }
            // NaN pivots fail this test too
            if (!(pivotAbs >= pivotEpsilon) || Double.isInfinite(pivotAbs)) {
                throw new SingularMatrixException("Singular matrix: no valid pivot in column " + k + " (|pivot|=" + pivotAbs + ")", k);
            }
            if (pivotRow != k) {
                double[] tmp = m[k];
                m[k] = m[pivotRow];
                m[pivotRow] = tmp;
            }

            for (int i = k + 1; i < n; i++) {
                double f = m[i][k] / m[k][k];
                m[i][k] = 0;
                if (f != 0) {
                    for (int j = k + 1; j <= n; j++) {
                        m[i][j] -= f * m[k][j];
                    }
                }
            }
        }

        double[] x = new double[n];
        for (int i = n - 1; i >= 0; i--) {
            double s = m[i][n];
            for (int j = i + 1; j < n; j++) {
                s -= m[i][j] * x[j];
            }
            x[i] = s / m[i][i];
            if (!Double.isFinite(x[i])) {
                throw new SingularMatrixException("Non finite value found during back substitution at row " + i, i);
            }
        }
        return x;
    }
}
