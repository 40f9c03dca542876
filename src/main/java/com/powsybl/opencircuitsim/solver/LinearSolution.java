/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.opencircuitsim.solver;

import java.util.List;
import java.util.Objects;

/**
 * @param x the solution vector
 * @param degradedRows rows left with a zero pivot, whose unknown has been set to zero, in increasing order
 *
 * @author Open Circuit Sim developers
 */
public record LinearSolution(double[] x, List<Integer> degradedRows) {

    public LinearSolution {
        Objects.requireNonNull(x);
        degradedRows = List.copyOf(degradedRows);
    }

    public boolean isDegraded() {
        return !degradedRows.isEmpty();
    }
}
