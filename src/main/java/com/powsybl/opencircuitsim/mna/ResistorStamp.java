/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.opencircuitsim.mna;

import com.powsybl.commons.PowsyblException;
import com.powsybl.opencircuitsim.netlist.ComponentInstance;

/**
 * Linear resistor between two nodes: {@code R:R1 n1 n2 R="1000"}.
 *
 * @author Open Circuit Sim developers
 */
public class ResistorStamp implements Stamp {

    public static final String TYPE = "R";

    public static final String RESISTANCE = "R";

    public static final String RESISTANCE_DEFAULT_VALUE = "1000";

    @Override
    public String getComponentType() {
        return TYPE;
    }

    @Override
    public void apply(ComponentInstance component, int[] nodeNums, MnaSystem system) {
        double r = component.getDoubleParameter(RESISTANCE, RESISTANCE_DEFAULT_VALUE);
        if (r == 0) {
            throw new PowsyblException("Zero resistance for component '" + component.getId() + "'");
        }
        double g = 1 / r;
        int n1 = nodeNums[0];
        int n2 = nodeNums[1];
        if (n1 >= 0) {
            system.addToMatrix(n1, n1, g);
        }
        if (n2 >= 0) {
            system.addToMatrix(n2, n2, g);
        }
        if (n1 >= 0 && n2 >= 0) {
            system.addToMatrix(n1, n2, -g);
            system.addToMatrix(n2, n1, -g);
        }
    }
}
