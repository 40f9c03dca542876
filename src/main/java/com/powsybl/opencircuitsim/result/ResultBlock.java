/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.opencircuitsim.result;

import java.util.List;
import java.util.Objects;

/**
 * A tagged block of a result file:
 * <pre>
 * &lt;dep n1 sweep&gt;
 * 5.000000e+00
 * &lt;/dep&gt;
 * </pre>
 *
 * @param kind independent (swept) or dependent variable
 * @param name the variable name, a node name for a dependent block
 * @param typeTag third word of the opening tag: the point count of an independent block, the swept variable name of
 *                a dependent one
 * @param values the values
 *
 * @author Open Circuit Sim developers
 */
public record ResultBlock(ResultBlockKind kind, String name, String typeTag, List<Double> values) {

    public ResultBlock {
        Objects.requireNonNull(kind);
        Objects.requireNonNull(name);
        Objects.requireNonNull(typeTag);
        values = List.copyOf(values);
    }
}
