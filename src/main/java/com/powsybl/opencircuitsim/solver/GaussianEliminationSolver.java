/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.opencircuitsim.solver;

import com.powsybl.math.matrix.DenseMatrix;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Dense Gaussian elimination without row pivoting, followed by back substitution.
 *
 * <p>A pivot whose magnitude is below epsilon is skipped during elimination, and the corresponding unknown is set to
 * zero during back substitution. A singular system therefore never fails: it gives a partial solution together with
 * the list of degraded rows.</p>
 *
 * @author Open Circuit Sim developers
 */
public class GaussianEliminationSolver {

    private final double pivotEpsilon;

    public GaussianEliminationSolver(double pivotEpsilon) {
        this.pivotEpsilon = pivotEpsilon;
    }

    public double getPivotEpsilon() {
        return pivotEpsilon;
    }

    /**
     * Solve {@code a x = b}. Both {@code a} and {@code b} are overwritten.
     */
    public LinearSolution solve(DenseMatrix a, double[] b) {
        Objects.requireNonNull(a);
        Objects.requireNonNull(b);
        int size = b.length;
        if (a.getRowCount() != size || a.getColumnCount() != size) {
            throw new IllegalArgumentException("Matrix " + a.getRowCount() + "x" + a.getColumnCount()
                    + " does not match right hand side of size " + size);
        }

        // forward elimination
        for (int i = 0; i < size; i++) {
            double pivot = a.get(i, i);
            if (Math.abs(pivot) < pivotEpsilon) {
                continue;
            }
            for (int j = i + 1; j < size; j++) {
                double factor = a.get(j, i) / pivot;
                b[j] -= factor * b[i];
                for (int k = i; k < size; k++) {
                    a.add(j, k, -factor * a.get(i, k));
                }
            }
        }

        // back substitution
        double[] x = new double[size];
        List<Integer> degradedRows = new ArrayList<>();
        for (int i = size - 1; i >= 0; i--) {
            double sum = 0;
            for (int j = i + 1; j < size; j++) {
                sum += a.get(i, j) * x[j];
            }
            double diagonal = a.get(i, i);
            if (Math.abs(diagonal) > pivotEpsilon) {
                x[i] = (b[i] - sum) / diagonal;
            } else {
                degradedRows.add(0, i);
            }
        }

        return new LinearSolution(x, degradedRows);
    }
}
