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
 * Contribution of one component type to the modified nodal analysis system.
 *
 * <p>Implementations are stateless. Additional component types can be plugged in by declaring an implementation as
 * a {@link java.util.ServiceLoader} service, see {@link StampRegistry#load()}.</p>
 *
 * @author Open Circuit Sim developers
 */
public interface Stamp {

    /**
     * Get the type tag of the components this stamp applies to, {@code R} for {@code R:R1 n1 n2}.
     */
    String getComponentType();

    /**
     * Get the number of terminals the stamp reads. Additional node tokens of a component are ignored.
     */
    default int getTerminalCount() {
        return 2;
    }

    /**
     * Tell if the component owns a branch current unknown, with its own row and column in the system.
     */
    default boolean hasBranchCurrent() {
        return false;
    }

    /**
     * Add the component contribution to the system.
     *
     * @param component the component
     * @param nodeNums number of each terminal, {@link com.powsybl.opencircuitsim.network.NodeIndex#REFERENCE} for
     *                 the reference node
     * @param system the system being assembled
     */
    void apply(ComponentInstance component, int[] nodeNums, MnaSystem system);
}
