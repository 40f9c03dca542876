/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.opencircuitsim.mna;

import com.powsybl.opencircuitsim.netlist.ComponentInstance;

/**
 * Ideal DC voltage source: {@code Vdc:V1 plus minus U="5"}.
 *
 * <p>The source current is an additional unknown. Its row holds the constraint {@code v(plus) - v(minus) = U} and
 * its column injects the current into both terminals.</p>
 *
 * @author Open Circuit Sim developers
 */
public class VoltageSourceStamp implements Stamp {

    public static final String TYPE = "Vdc";

    public static final String VOLTAGE = "U";

    public static final String VOLTAGE_DEFAULT_VALUE = "1";

    @Override
    public String getComponentType() {
        return TYPE;
    }

    @Override
    public boolean hasBranchCurrent() {
        return true;
    }

    @Override
    public void apply(ComponentInstance component, int[] nodeNums, MnaSystem system) {
        double u = component.getDoubleParameter(VOLTAGE, VOLTAGE_DEFAULT_VALUE);
        int branchRow = system.getBranchRow(component);
        int plus = nodeNums[0];
        int minus = nodeNums[1];
        if (plus >= 0) {
            system.addToMatrix(plus, branchRow, 1);
            system.addToMatrix(branchRow, plus, 1);
        }
        if (minus >= 0) {
            system.addToMatrix(minus, branchRow, -1);
            system.addToMatrix(branchRow, minus, -1);
        }
        system.addToRhs(branchRow, u);
    }
}
